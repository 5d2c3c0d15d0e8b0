package absint.stmt;

import java.util.Objects;

/**
 * An assignment {@code left = right}.
 */
public final class Assignment extends Statement {
	private final Statement left;
	private final Statement right;

	public Assignment(ProgramPoint pp, Statement left, Statement right) {
		super(pp);
		this.left = Objects.requireNonNull(left);
		this.right = Objects.requireNonNull(right);
	}

	public Statement getLeft() {
		return this.left;
	}

	public Statement getRight() {
		return this.right;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitAssignment(this, arg);
	}

	@Override
	public String toString() {
		return this.left + " = " + this.right;
	}
}
