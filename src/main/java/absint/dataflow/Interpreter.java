package absint.dataflow;

import absint.AbsintConfig;
import absint.ControlFlowGraph;
import absint.Edge;
import absint.Node;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A work-list fixpoint interpreter over a control flow graph.
 *
 * An interpreter may be tethered to a precursory interpreter.  Its results
 * are computed first, and the state it has just before each statement (in
 * its own direction) is bound to the dependent state with
 * {@link State#before}.
 */
public abstract class Interpreter<T extends State<T>> {
	private final ControlFlowGraph cfg;
	private final Semantics semantics;
	private final int widening;
	private final int maxIterations;
	private final Interpreter<?> precursory;

	/**
	 * @param cfg
	 *         The graph to analyze.
	 * @param semantics
	 *         The semantics of its statements.
	 * @param widening
	 *         The number of loop head iterations before widening.
	 * @param maxIterations
	 *         The maximum number of times a node may change, or 0 for no limit.
	 * @param precursory
	 *         The precursory interpreter, or null.
	 */
	protected Interpreter(ControlFlowGraph cfg, Semantics semantics, int widening, int maxIterations, Interpreter<?> precursory) {
		Preconditions.checkArgument(widening >= 0, "Negative widening threshold %s", widening);
		Preconditions.checkArgument(maxIterations >= 0, "Negative iteration limit %s", maxIterations);
		this.cfg = cfg;
		this.semantics = semantics;
		this.widening = widening;
		this.maxIterations = maxIterations;
		this.precursory = precursory;
	}

	/**
	 * Create an interpreter with the configured defaults.
	 */
	protected Interpreter(ControlFlowGraph cfg, Semantics semantics) {
		this(cfg, semantics, AbsintConfig.WIDENING, AbsintConfig.MAX_ITERATIONS, null);
	}

	public ControlFlowGraph getCfg() {
		return this.cfg;
	}

	public Semantics getSemantics() {
		return this.semantics;
	}

	/**
	 * @return The number of loop head iterations before widening.
	 */
	public int getWidening() {
		return this.widening;
	}

	/**
	 * @return The iteration limit per node (0 for none).
	 */
	public int getMaxIterations() {
		return this.maxIterations;
	}

	/**
	 * @return The precursory interpreter, or null.
	 */
	public Interpreter<?> getPrecursory() {
		return this.precursory;
	}

	/**
	 * @return Whether this interpreter follows the control flow forwards.
	 */
	public abstract boolean isForward();

	/**
	 * Run the analysis.
	 *
	 * @param initial
	 *         The state at the entry node (forward) or exit node (backward).
	 *         If there is a precursory interpreter, its own initial state is
	 *         {@code initial.getPrecursory()}.
	 * @return The fixpoint.
	 * @throws NonConvergenceException
	 *         If a node changes more often than the iteration limit allows.
	 */
	public abstract AnalysisResult<T> analyze(T initial);

	/**
	 * Run the precursory analysis, if any.
	 *
	 * @return Its result, or null.
	 */
	protected AnalysisResult<?> analyzePrecursory(T initial) {
		if (this.precursory == null) {
			return null;
		}
		return runPrecursory(this.precursory, initial.getPrecursory());
	}

	@SuppressWarnings("unchecked")
	private static <P extends State<P>> AnalysisResult<P> runPrecursory(Interpreter<P> interpreter, State<?> initial) {
		Preconditions.checkArgument(initial != null, "Missing initial state for the precursory analysis");
		return interpreter.analyze((P) initial);
	}

	/**
	 * @return The precursory state for each statement of a node, in
	 *         statement order.
	 */
	protected List<State<?>> precursoryStates(AnalysisResult<?> pre, Node node) {
		var n = node.getStatements().size();
		if (pre == null || !pre.contains(node)) {
			return Collections.<State<?>>nCopies(n, null);
		}

		var states = pre.getNodeResult(node);
		if (this.precursory.isForward()) {
			// The state before each statement
			return new ArrayList<>(states.subList(0, n));
		} else {
			// The state after each statement, where a backward analysis starts
			return new ArrayList<>(states.subList(1, n + 1));
		}
	}

	/**
	 * @return The precursory state for the condition of an edge.
	 */
	protected State<?> precursoryState(AnalysisResult<?> pre, Edge edge) {
		if (pre == null) {
			return null;
		}

		if (this.precursory.isForward()) {
			var source = edge.getSource();
			if (pre.contains(source)) {
				var states = pre.getNodeResult(source);
				return states.get(states.size() - 1);
			}
		} else {
			var target = edge.getTarget();
			if (pre.contains(target)) {
				return pre.getNodeResult(target).get(0);
			}
		}
		return null;
	}

	/**
	 * Evaluate the condition of an edge and assume it holds.
	 */
	protected T filter(T state, Edge edge, State<?> precursory) {
		var condition = edge.getCondition()
			.orElseThrow(() -> new IllegalStateException("Edge " + edge + " has no condition"));
		state.before(condition.getProgramPoint(), precursory);
		return this.semantics.semantics(condition, state)
			.filter(!isForward());
	}

	/**
	 * Check whether a node may be recomputed once more.
	 */
	protected void checkIterations(Node node, long iteration) {
		if (this.maxIterations > 0 && iteration >= this.maxIterations) {
			throw new NonConvergenceException(node, this.maxIterations);
		}
	}

	/**
	 * @return Whether a node branches (true) or loops (false) on its
	 *         conditional out-edges.
	 */
	protected boolean isBranch(Node source) {
		boolean branch = false;
		boolean loop = false;
		for (var edge : this.cfg.outEdges(source)) {
			branch |= edge.getKind() == Edge.Kind.IF_IN;
			loop |= edge.getKind() == Edge.Kind.LOOP_IN;
		}
		Preconditions.checkState(branch != loop, "Node %s must either branch or loop", source);
		return branch;
	}
}
