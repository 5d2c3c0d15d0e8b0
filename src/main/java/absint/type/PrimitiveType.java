package absint.type;

/**
 * Scalar and string types.
 */
public enum PrimitiveType implements ValueType {
	BOOL("bool"),
	INT("int"),
	FLOAT("float"),
	STRING("str");

	private final String name;

	PrimitiveType(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	public boolean isNumeric() {
		return this != STRING;
	}

	@Override
	public boolean isSequence() {
		return this == STRING;
	}

	@Override
	public ValueType getElementType() {
		return this == STRING ? STRING : null;
	}

	@Override
	public String toString() {
		return this.name;
	}
}
