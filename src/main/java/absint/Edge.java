package absint;

import absint.stmt.Statement;

import java.util.Objects;
import java.util.Optional;

/**
 * A control flow edge, optionally guarded by a condition.
 */
public final class Edge {
	/**
	 * The role of an edge with respect to branches and loops.
	 */
	public enum Kind {
		IF_OUT,
		LOOP_OUT,
		DEFAULT,
		LOOP_IN,
		IF_IN
	}

	private final Node source;
	private final Node target;
	private final Kind kind;
	private final Statement condition;

	private Edge(Node source, Node target, Kind kind, Statement condition) {
		this.source = Objects.requireNonNull(source);
		this.target = Objects.requireNonNull(target);
		this.kind = Objects.requireNonNull(kind);
		this.condition = condition;
	}

	/**
	 * @return An edge that is always taken.
	 */
	public static Edge unconditional(Node source, Node target, Kind kind) {
		return new Edge(source, target, kind, null);
	}

	/**
	 * @return An edge taken when the condition holds.
	 */
	public static Edge conditional(Node source, Node target, Statement condition, Kind kind) {
		return new Edge(source, target, kind, Objects.requireNonNull(condition));
	}

	public Node getSource() {
		return this.source;
	}

	public Node getTarget() {
		return this.target;
	}

	public Kind getKind() {
		return this.kind;
	}

	/**
	 * @return The guard of a conditional edge.
	 */
	public Optional<Statement> getCondition() {
		return Optional.ofNullable(this.condition);
	}

	public boolean isConditional() {
		return this.condition != null;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Edge)) {
			return false;
		}

		var other = (Edge) obj;
		return this.source.equals(other.source)
			&& this.target.equals(other.target)
			&& this.kind == other.kind
			&& Objects.equals(this.condition, other.condition);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.source, this.target, this.kind);
	}

	@Override
	public String toString() {
		var str = new StringBuilder()
			.append(this.source)
			.append(" -");
		if (this.kind != Kind.DEFAULT) {
			str.append(this.kind);
		}
		getCondition().ifPresent(c -> str.append("[").append(c).append("]"));
		return str.append("-> ")
			.append(this.target)
			.toString();
	}
}
