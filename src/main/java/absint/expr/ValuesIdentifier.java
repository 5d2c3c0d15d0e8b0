package absint.expr;

import absint.type.ValueType;

/**
 * The values of a dictionary variable, or the elements of a sequence.
 */
public final class ValuesIdentifier extends DerivedIdentifier {
	public ValuesIdentifier(VariableIdentifier container) {
		super(valueType(container.getType()), "values", container);
	}

	private static ValueType valueType(ValueType type) {
		if (type.isMapping()) {
			return type.getValueType();
		} else {
			return type.getElementType();
		}
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitValuesIdentifier(this, arg);
	}
}
