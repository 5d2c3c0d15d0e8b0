package absint.stmt;

import absint.expr.VariableIdentifier;

import java.util.Objects;

/**
 * Access to a variable.
 */
public final class VariableAccess extends Statement {
	private final VariableIdentifier variable;

	public VariableAccess(ProgramPoint pp, VariableIdentifier variable) {
		super(pp);
		this.variable = Objects.requireNonNull(variable);
	}

	public VariableIdentifier getVariable() {
		return this.variable;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitVariableAccess(this, arg);
	}

	@Override
	public String toString() {
		return this.variable.toString();
	}
}
