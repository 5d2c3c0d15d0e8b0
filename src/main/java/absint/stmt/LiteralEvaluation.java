package absint.stmt;

import absint.expr.Literal;

import java.util.Objects;

/**
 * Evaluation of a literal.
 */
public final class LiteralEvaluation extends Statement {
	private final Literal literal;

	public LiteralEvaluation(ProgramPoint pp, Literal literal) {
		super(pp);
		this.literal = Objects.requireNonNull(literal);
	}

	public Literal getLiteral() {
		return this.literal;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitLiteralEvaluation(this, arg);
	}

	@Override
	public String toString() {
		return this.literal.toString();
	}
}
