package absint.dataflow;

import absint.ControlFlowGraph;
import absint.Edge;
import absint.Node;
import absint.util.Counter;
import absint.util.Log;
import absint.util.WorkList;

import java.util.ArrayDeque;
import java.util.ArrayList;

/**
 * Backward control flow graph interpreter.
 *
 * The analysis starts at the exit node and runs against the edges; the
 * statements of a node are executed last to first.
 */
public class BackwardInterpreter<T extends State<T>> extends Interpreter<T> {
	public BackwardInterpreter(ControlFlowGraph cfg, Semantics semantics, int widening, int maxIterations, Interpreter<?> precursory) {
		super(cfg, semantics, widening, maxIterations, precursory);
	}

	public BackwardInterpreter(ControlFlowGraph cfg, Semantics semantics, int widening, Interpreter<?> precursory) {
		this(cfg, semantics, widening, 0, precursory);
	}

	public BackwardInterpreter(ControlFlowGraph cfg, Semantics semantics, int widening) {
		this(cfg, semantics, widening, 0, null);
	}

	@Override
	public boolean isForward() {
		return false;
	}

	@Override
	public AnalysisResult<T> analyze(T initial) {
		var pre = analyzePrecursory(initial);

		var cfg = getCfg();
		var result = new AnalysisResult<T>(cfg);
		var iterations = new Counter<Node>();

		var workList = new WorkList<Node>();
		workList.addLast(cfg.getExit());

		Log.debug("Backward analysis of %d nodes", cfg.getNodes().size());

		while (!workList.isEmpty()) {
			var current = workList.removeFirst();
			var iteration = iterations.get(current);
			Log.trace("Visiting node %s (iteration %d)", current, iteration);

			T previous = null;
			if (result.contains(current)) {
				var states = result.getNodeResult(current);
				previous = states.get(states.size() - 1).copy();
			}

			// Compute the exit state from the outgoing edges
			var exit = initial.copy();
			if (!current.equals(cfg.getExit())) {
				exit.bottom();
				for (var edge : cfg.outEdges(current)) {
					exit.join(transfer(result, pre, edge, initial));
				}

				if (current.isLoop() && getWidening() < iteration) {
					Log.debug("Widening at node %s", current);
					exit = previous.copy().widening(exit);
				}
			}

			if (previous != null && exit.lessEqual(previous)) {
				continue;
			}

			checkIterations(current, iteration);

			var stmts = current.getStatements();
			var precursory = precursoryStates(pre, current);
			var states = new ArrayDeque<T>(stmts.size() + 1);
			states.addFirst(exit);
			var predecessor = exit;
			for (int i = stmts.size() - 1; i >= 0; --i) {
				var stmt = stmts.get(i);
				predecessor = predecessor.copy().before(stmt.getProgramPoint(), precursory.get(i));
				predecessor = getSemantics().semantics(stmt, predecessor);
				states.addFirst(predecessor);
			}
			result.setNodeResult(current, new ArrayList<>(states));

			for (var node : cfg.predecessors(current)) {
				workList.addLast(node);
			}
			iterations.increment(current);
		}

		Log.debug("Backward analysis stabilized after %d iterations", iterations.max());
		return result;
	}

	/**
	 * @return The entry state of an edge's target, carried back along the
	 *         edge.
	 */
	private T transfer(AnalysisResult<T> result, AnalysisResult<?> pre, Edge edge, T initial) {
		T state;
		var target = edge.getTarget();
		if (result.contains(target)) {
			state = result.getNodeResult(target).get(0).copy();
		} else {
			return initial.copy().bottom();
		}

		switch (edge.getKind()) {
		case DEFAULT:
			if (edge.isConditional()) {
				var branch = isBranch(edge.getSource());
				if (branch) {
					state.enterIf();
				} else {
					state.enterLoop();
				}
				filter(state, edge, precursoryState(pre, edge));
				if (branch) {
					state.exitIf();
				} else {
					state.exitLoop();
				}
			}
			break;
		case IF_IN:
			filter(state, edge, precursoryState(pre, edge));
			state.exitIf();
			break;
		case LOOP_IN:
			filter(state, edge, precursoryState(pre, edge));
			state.exitLoop();
			break;
		case IF_OUT:
			state.enterIf();
			break;
		case LOOP_OUT:
			state.enterLoop();
			break;
		}
		return state;
	}
}
