package absint;

import absint.stmt.Statement;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A node of a control flow graph, identified by an integer id.
 */
public abstract class Node {
	private final int id;
	private final ImmutableList<Statement> stmts;

	Node(int id, List<? extends Statement> stmts) {
		this.id = id;
		this.stmts = ImmutableList.copyOf(stmts);
	}

	public int getId() {
		return this.id;
	}

	/**
	 * @return The statements of this node, in execution order.
	 */
	public ImmutableList<Statement> getStatements() {
		return this.stmts;
	}

	/**
	 * @return Whether this is a loop head.
	 */
	public boolean isLoop() {
		return false;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Node)) {
			return false;
		}

		var other = (Node) obj;
		return this.id == other.id;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(this.id);
	}

	@Override
	public String toString() {
		return String.valueOf(this.id);
	}
}
