package absint.dataflow;

import absint.ControlFlowGraph;
import absint.Node;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The result of an analysis: for every reached node, the states before and
 * after each of its statements.
 *
 * A basic node with n statements has n + 1 states; a loop head has one.
 */
public final class AnalysisResult<T extends State<T>> {
	private final ControlFlowGraph cfg;
	private final Map<Node, ImmutableList<T>> result = new HashMap<>();

	public AnalysisResult(ControlFlowGraph cfg) {
		this.cfg = cfg;
	}

	/**
	 * @return The analyzed graph.
	 */
	public ControlFlowGraph getCfg() {
		return this.cfg;
	}

	/**
	 * @return Whether the analysis reached a node.
	 */
	public boolean contains(Node node) {
		return this.result.containsKey(node);
	}

	/**
	 * @return The states of a reached node.
	 */
	public ImmutableList<T> getNodeResult(Node node) {
		var states = this.result.get(node);
		Preconditions.checkArgument(states != null, "No result for node %s", node);
		return states;
	}

	/**
	 * Set the states of a node.
	 */
	public void setNodeResult(Node node, List<T> states) {
		Preconditions.checkArgument(states.size() == node.getStatements().size() + 1,
			"Node %s needs %s states", node, node.getStatements().size() + 1);
		this.result.put(node, ImmutableList.copyOf(states));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AnalysisResult)) {
			return false;
		}

		var other = (AnalysisResult<?>) obj;
		return this.result.equals(other.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.result);
	}

	@Override
	public String toString() {
		var str = new StringBuilder();
		for (var node : this.cfg.getNodes()) {
			var states = this.result.get(node);
			if (states == null) {
				continue;
			}

			str.append("Node ").append(node).append(":\n");
			var stmts = node.getStatements();
			for (int i = 0; i < states.size(); ++i) {
				str.append("\t").append(states.get(i)).append("\n");
				if (i < stmts.size()) {
					str.append("\t").append(stmts.get(i)).append("\n");
				}
			}
		}
		return str.toString();
	}
}
