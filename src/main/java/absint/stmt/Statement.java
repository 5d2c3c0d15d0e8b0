package absint.stmt;

import java.util.Objects;

/**
 * A statement in a basic block, or the condition of a CFG edge.
 */
public abstract class Statement {
	private final ProgramPoint pp;

	protected Statement(ProgramPoint pp) {
		this.pp = Objects.requireNonNull(pp);
	}

	/**
	 * @return The program point of this statement.
	 */
	public ProgramPoint getProgramPoint() {
		return this.pp;
	}

	/**
	 * Dispatch to the visitor method for this statement's kind.
	 */
	public abstract <R, A> R accept(StatementVisitor<R, A> visitor, A arg);
}
