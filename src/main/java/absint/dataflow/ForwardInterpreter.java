package absint.dataflow;

import absint.ControlFlowGraph;
import absint.Edge;
import absint.Node;
import absint.util.Counter;
import absint.util.Log;
import absint.util.WorkList;

import java.util.ArrayList;

/**
 * Forward control flow graph interpreter.
 */
public class ForwardInterpreter<T extends State<T>> extends Interpreter<T> {
	public ForwardInterpreter(ControlFlowGraph cfg, Semantics semantics, int widening, int maxIterations, Interpreter<?> precursory) {
		super(cfg, semantics, widening, maxIterations, precursory);
	}

	public ForwardInterpreter(ControlFlowGraph cfg, Semantics semantics, int widening) {
		this(cfg, semantics, widening, 0, null);
	}

	public ForwardInterpreter(ControlFlowGraph cfg, Semantics semantics) {
		super(cfg, semantics);
	}

	@Override
	public boolean isForward() {
		return true;
	}

	@Override
	public AnalysisResult<T> analyze(T initial) {
		var pre = analyzePrecursory(initial);

		var cfg = getCfg();
		var result = new AnalysisResult<T>(cfg);
		var iterations = new Counter<Node>();

		var workList = new WorkList<Node>();
		workList.addLast(cfg.getEntry());

		Log.debug("Forward analysis of %d nodes", cfg.getNodes().size());

		while (!workList.isEmpty()) {
			var current = workList.removeFirst();
			var iteration = iterations.get(current);
			Log.trace("Visiting node %s (iteration %d)", current, iteration);

			T previous = null;
			if (result.contains(current)) {
				previous = result.getNodeResult(current).get(0).copy();
			}

			// Compute the entry state from the incoming edges
			var entry = initial.copy();
			if (!current.equals(cfg.getEntry())) {
				entry.bottom();
				for (var edge : cfg.inEdges(current)) {
					entry.join(transfer(result, pre, edge, initial));
				}

				if (current.isLoop() && getWidening() < iteration) {
					Log.debug("Widening at node %s", current);
					entry = previous.copy().widening(entry);
				}
			}

			if (previous != null && entry.lessEqual(previous)) {
				continue;
			}

			checkIterations(current, iteration);

			var stmts = current.getStatements();
			var precursory = precursoryStates(pre, current);
			var states = new ArrayList<T>(stmts.size() + 1);
			states.add(entry);
			var successor = entry;
			for (int i = 0; i < stmts.size(); ++i) {
				var stmt = stmts.get(i);
				successor = successor.copy().before(stmt.getProgramPoint(), precursory.get(i));
				successor = getSemantics().semantics(stmt, successor);
				states.add(successor);
			}
			result.setNodeResult(current, states);

			for (var node : cfg.successors(current)) {
				workList.addLast(node);
			}
			iterations.increment(current);
		}

		Log.debug("Forward analysis stabilized after %d iterations", iterations.max());
		return result;
	}

	/**
	 * @return The exit state of an edge's source, carried along the edge.
	 */
	private T transfer(AnalysisResult<T> result, AnalysisResult<?> pre, Edge edge, T initial) {
		T state;
		var source = edge.getSource();
		if (result.contains(source)) {
			var states = result.getNodeResult(source);
			state = states.get(states.size() - 1).copy();
		} else {
			return initial.copy().bottom();
		}

		switch (edge.getKind()) {
		case DEFAULT:
			if (edge.isConditional()) {
				// The "else" side of a branch or loop
				var branch = isBranch(source);
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
			state.enterIf();
			filter(state, edge, precursoryState(pre, edge));
			break;
		case LOOP_IN:
			state.enterLoop();
			filter(state, edge, precursoryState(pre, edge));
			break;
		case IF_OUT:
			state.exitIf();
			break;
		case LOOP_OUT:
			state.exitLoop();
			break;
		}
		return state;
	}
}
