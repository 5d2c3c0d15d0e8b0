package absint.type;

/**
 * The static type of a program variable or expression.
 */
public interface ValueType {
	/**
	 * @return The name of this type, as written in source.
	 */
	String getName();

	/**
	 * @return Whether values of this type are numbers (booleans included).
	 */
	default boolean isNumeric() {
		return false;
	}

	/**
	 * @return Whether this is a string, list or set type.
	 */
	default boolean isSequence() {
		return false;
	}

	/**
	 * @return Whether this is a dictionary type.
	 */
	default boolean isMapping() {
		return false;
	}

	/**
	 * @return Whether this is a string, list, set or dictionary type.
	 */
	default boolean isContainer() {
		return isSequence() || isMapping();
	}

	/**
	 * @return The type of the elements of a sequence (or keys of a mapping),
	 *         or null if this is not a container type.
	 */
	default ValueType getElementType() {
		return null;
	}

	/**
	 * @return The type of the values of a mapping, or null if this is not a
	 *         mapping.
	 */
	default ValueType getValueType() {
		return null;
	}
}
