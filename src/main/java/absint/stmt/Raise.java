package absint.stmt;

/**
 * Raising an error.
 */
public final class Raise extends Statement {
	public Raise(ProgramPoint pp) {
		super(pp);
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitRaise(this, arg);
	}

	@Override
	public String toString() {
		return "raise";
	}
}
