package absint.expr;

import absint.type.ValueType;

/**
 * A store identifier derived from a container variable: its length, its
 * keys, or its values.
 */
public abstract class DerivedIdentifier extends VariableIdentifier {
	private final VariableIdentifier container;

	DerivedIdentifier(ValueType type, String prefix, VariableIdentifier container) {
		super(type, prefix + "(" + container.getName() + ")");
		this.container = container;
	}

	/**
	 * @return The container variable this identifier is derived from.
	 */
	public VariableIdentifier getContainer() {
		return this.container;
	}
}
