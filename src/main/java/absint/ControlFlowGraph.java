package absint;

import absint.expr.VariableIdentifier;
import absint.stmt.Assignment;
import absint.stmt.Call;
import absint.stmt.DictDisplayAccess;
import absint.stmt.ListDisplayAccess;
import absint.stmt.LiteralEvaluation;
import absint.stmt.Raise;
import absint.stmt.SetDisplayAccess;
import absint.stmt.SlicingAccess;
import absint.stmt.Statement;
import absint.stmt.StatementVisitor;
import absint.stmt.SubscriptionAccess;
import absint.stmt.VariableAccess;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableTable;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collects the variables accessed by statements.
 */
class VariableCollector implements StatementVisitor<Void, Set<VariableIdentifier>> {
	static final VariableCollector INSTANCE = new VariableCollector();

	private void visitAll(Collection<? extends Statement> stmts, Set<VariableIdentifier> vars) {
		for (var stmt : stmts) {
			stmt.accept(this, vars);
		}
	}

	@Override
	public Void visitLiteralEvaluation(LiteralEvaluation stmt, Set<VariableIdentifier> vars) {
		return null;
	}

	@Override
	public Void visitVariableAccess(VariableAccess stmt, Set<VariableIdentifier> vars) {
		vars.add(stmt.getVariable());
		return null;
	}

	@Override
	public Void visitListDisplayAccess(ListDisplayAccess stmt, Set<VariableIdentifier> vars) {
		visitAll(stmt.getItems(), vars);
		return null;
	}

	@Override
	public Void visitSetDisplayAccess(SetDisplayAccess stmt, Set<VariableIdentifier> vars) {
		visitAll(stmt.getItems(), vars);
		return null;
	}

	@Override
	public Void visitDictDisplayAccess(DictDisplayAccess stmt, Set<VariableIdentifier> vars) {
		visitAll(stmt.getKeys(), vars);
		visitAll(stmt.getValues(), vars);
		return null;
	}

	@Override
	public Void visitSubscriptionAccess(SubscriptionAccess stmt, Set<VariableIdentifier> vars) {
		stmt.getTarget().accept(this, vars);
		stmt.getKey().accept(this, vars);
		return null;
	}

	@Override
	public Void visitSlicingAccess(SlicingAccess stmt, Set<VariableIdentifier> vars) {
		stmt.getTarget().accept(this, vars);
		stmt.getLower().accept(this, vars);
		stmt.getUpper().ifPresent(s -> s.accept(this, vars));
		stmt.getStride().ifPresent(s -> s.accept(this, vars));
		return null;
	}

	@Override
	public Void visitAssignment(Assignment stmt, Set<VariableIdentifier> vars) {
		stmt.getLeft().accept(this, vars);
		stmt.getRight().accept(this, vars);
		return null;
	}

	@Override
	public Void visitCall(Call stmt, Set<VariableIdentifier> vars) {
		visitAll(stmt.getArguments(), vars);
		return null;
	}

	@Override
	public Void visitRaise(Raise stmt, Set<VariableIdentifier> vars) {
		return null;
	}
}

/**
 * An immutable control flow graph.
 *
 * Nodes are stored by id; edges are stored in a table keyed by their
 * (source, target) pair.
 */
public final class ControlFlowGraph {
	private final ImmutableSortedMap<Integer, Node> nodes;
	private final ImmutableTable<Node, Node, Edge> edges;
	private final Node entry;
	private final Node exit;

	private ControlFlowGraph(ImmutableSortedMap<Integer, Node> nodes, ImmutableTable<Node, Node, Edge> edges, Node entry, Node exit) {
		this.nodes = nodes;
		this.edges = edges;
		this.entry = entry;
		this.exit = exit;
	}

	/**
	 * @return A builder for a new graph.
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return The unique entry node.
	 */
	public Node getEntry() {
		return this.entry;
	}

	/**
	 * @return The unique exit node.
	 */
	public Node getExit() {
		return this.exit;
	}

	/**
	 * @return All nodes, ordered by id.
	 */
	public Collection<Node> getNodes() {
		return this.nodes.values();
	}

	/**
	 * @return The node with the given id.
	 */
	public Node getNode(int id) {
		var node = this.nodes.get(id);
		Preconditions.checkArgument(node != null, "No node with id %s", id);
		return node;
	}

	/**
	 * @return All edges.
	 */
	public Collection<Edge> getEdges() {
		return this.edges.values();
	}

	/**
	 * @return The edge between two nodes, if any.
	 */
	public Optional<Edge> getEdge(Node source, Node target) {
		return Optional.ofNullable(this.edges.get(source, target));
	}

	/**
	 * @return The edges leading into a node.
	 */
	public Collection<Edge> inEdges(Node node) {
		return this.edges.column(node).values();
	}

	/**
	 * @return The edges leaving a node.
	 */
	public Collection<Edge> outEdges(Node node) {
		return this.edges.row(node).values();
	}

	/**
	 * @return The sources of the edges leading into a node.
	 */
	public Set<Node> predecessors(Node node) {
		return this.edges.column(node).keySet();
	}

	/**
	 * @return The targets of the edges leaving a node.
	 */
	public Set<Node> successors(Node node) {
		return this.edges.row(node).keySet();
	}

	/**
	 * @return Every variable accessed by a statement or condition of this graph.
	 */
	public Set<VariableIdentifier> variables() {
		var vars = new LinkedHashSet<VariableIdentifier>();
		for (var node : getNodes()) {
			for (var stmt : node.getStatements()) {
				stmt.accept(VariableCollector.INSTANCE, vars);
			}
		}
		for (var edge : getEdges()) {
			edge.getCondition()
				.ifPresent(c -> c.accept(VariableCollector.INSTANCE, vars));
		}
		return vars;
	}

	@Override
	public String toString() {
		var str = new StringBuilder();
		for (var node : getNodes()) {
			str.append(node)
				.append(node.isLoop() ? " (loop)" : "")
				.append(": ")
				.append(node.getStatements())
				.append("\n");
		}
		for (var edge : getEdges()) {
			str.append(edge).append("\n");
		}
		return str.toString();
	}

	/**
	 * Builds a {@link ControlFlowGraph}.
	 */
	public static final class Builder {
		private final TreeMap<Integer, Node> nodes = new TreeMap<>();
		private final ImmutableTable.Builder<Node, Node, Edge> edges = ImmutableTable.builder();
		private Node entry;
		private Node exit;

		private Builder() {
		}

		/**
		 * Add a node to the graph.
		 */
		public Builder addNode(Node node) {
			var old = this.nodes.putIfAbsent(node.getId(), node);
			Preconditions.checkArgument(old == null || old == node, "Duplicate node id %s", node.getId());
			return this;
		}

		/**
		 * Add an edge (and its endpoints) to the graph.
		 */
		public Builder addEdge(Edge edge) {
			addNode(edge.getSource());
			addNode(edge.getTarget());
			this.edges.put(edge.getSource(), edge.getTarget(), edge);
			return this;
		}

		/**
		 * Set the entry node.
		 */
		public Builder entry(Node node) {
			addNode(node);
			this.entry = node;
			return this;
		}

		/**
		 * Set the exit node.
		 */
		public Builder exit(Node node) {
			addNode(node);
			this.exit = node;
			return this;
		}

		public ControlFlowGraph build() {
			Preconditions.checkState(this.entry != null, "Missing entry node");
			Preconditions.checkState(this.exit != null, "Missing exit node");
			return new ControlFlowGraph(ImmutableSortedMap.copyOf(this.nodes), this.edges.build(), this.entry, this.exit);
		}
	}
}
