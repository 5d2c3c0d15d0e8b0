package absint.type;

import java.util.Objects;

/**
 * The type of sets with a given element type.
 */
public final class SetType implements ValueType {
	private final ValueType element;

	public SetType(ValueType element) {
		this.element = Objects.requireNonNull(element);
	}

	@Override
	public String getName() {
		return "Set[" + this.element.getName() + "]";
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
		} else if (!(obj instanceof SetType)) {
			return false;
		}

		var other = (SetType) obj;
		return this.element.equals(other.element);
	}

	@Override
	public int hashCode() {
		return Objects.hash(SetType.class, this.element);
	}

	@Override
	public String toString() {
		return getName();
	}
}
