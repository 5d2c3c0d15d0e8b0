package absint.expr;

import absint.type.PrimitiveType;

/**
 * The length of a container variable.
 */
public final class LengthIdentifier extends DerivedIdentifier {
	public LengthIdentifier(VariableIdentifier container) {
		super(PrimitiveType.INT, "len", container);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitLengthIdentifier(this, arg);
	}
}
