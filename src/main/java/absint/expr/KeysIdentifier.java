package absint.expr;

/**
 * The keys of a dictionary variable (or the elements of a sequence).
 */
public final class KeysIdentifier extends DerivedIdentifier {
	public KeysIdentifier(VariableIdentifier container) {
		super(container.getType().getElementType(), "keys", container);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitKeysIdentifier(this, arg);
	}
}
