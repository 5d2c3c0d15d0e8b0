package absint.dataflow;

import absint.Node;

/**
 * Thrown when a node does not stabilize within the iteration limit.
 */
public class NonConvergenceException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final transient Node node;
	private final int limit;

	public NonConvergenceException(Node node, int limit) {
		super(String.format("Node %s did not stabilize within %d iterations", node, limit));
		this.node = node;
		this.limit = limit;
	}

	/**
	 * @return The node that kept changing.
	 */
	public Node getNode() {
		return this.node;
	}

	/**
	 * @return The iteration limit that was exceeded.
	 */
	public int getLimit() {
		return this.limit;
	}
}
