package absint.type;

import java.util.Objects;

/**
 * The type of lists with a given element type.
 */
public final class ListType implements ValueType {
	private final ValueType element;

	public ListType(ValueType element) {
		this.element = Objects.requireNonNull(element);
	}

	@Override
	public String getName() {
		return "List[" + this.element.getName() + "]";
	}

	@Override
	public boolean isSequence() {
		return true;
	}

	@Override
	public ValueType getElementType() {
		return this.element;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof ListType)) {
			return false;
		}

		var other = (ListType) obj;
		return this.element.equals(other.element);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ListType.class, this.element);
	}

	@Override
	public String toString() {
		return getName();
	}
}
