package absint.type;

import java.util.Objects;

/**
 * The type of dictionaries with given key and value types.
 */
public final class DictType implements ValueType {
	private final ValueType key;
	private final ValueType value;

	public DictType(ValueType key, ValueType value) {
		this.key = Objects.requireNonNull(key);
		this.value = Objects.requireNonNull(value);
	}

	@Override
	public String getName() {
		return "Dict[" + this.key.getName() + ", " + this.value.getName() + "]";
	}

	@Override
	public boolean isMapping() {
		return true;
	}

	/**
	 * @return The key type (iterating over a dictionary yields its keys).
	 */
	@Override
	public ValueType getElementType() {
		return this.key;
	}

	@Override
	public ValueType getValueType() {
		return this.value;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof DictType)) {
			return false;
		}

		var other = (DictType) obj;
		return this.key.equals(other.key)
			&& this.value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.key, this.value);
	}

	@Override
	public String toString() {
		return getName();
	}
}
