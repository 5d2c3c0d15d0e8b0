package absint.dataflow;

import static absint.Programs.access;
import static absint.Programs.assign;
import static absint.Programs.call;
import static absint.Programs.intVar;
import static absint.Programs.literal;
import static absint.Programs.pp;
import static absint.Programs.whileLoop;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import absint.Basic;
import absint.ControlFlowGraph;
import absint.Edge;
import absint.expr.VariableIdentifier;
import absint.stmt.Raise;
import absint.stmt.Statement;
import absint.type.PrimitiveType;

import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ForwardInterpreterTest {
	private static final VariableIdentifier X = intVar("x");

	/** x = 0; while x < 10: x = x + 1 */
	private static ControlFlowGraph counter() {
		return whileLoop(X, 10,
			List.<Statement>of(assign(X, literal(0))),
			List.<Statement>of(assign(X, call("add", PrimitiveType.INT, access(X), literal(1)))));
	}

	private static AnalysisResult<IntervalState> analyze(ControlFlowGraph cfg, int widening) {
		var interpreter = new ForwardInterpreter<IntervalState>(cfg, new ForwardSemantics(), widening);
		return interpreter.analyze(new IntervalState(cfg.variables()));
	}

	@Test
	public void straightLine() {
		var y = intVar("y");
		var node = new Basic(1,
			assign(X, literal(3)),
			assign(y, call("mult", PrimitiveType.INT, access(X), literal(2))),
			assign(X, call("sub", PrimitiveType.INT, access(y), access(X))));
		var cfg = ControlFlowGraph.builder()
			.entry(node)
			.exit(node)
			.build();

		var states = analyze(cfg, 3).getNodeResult(node);
		assertThat(states).hasSize(4);
		assertThat(states.get(0).get(X)).isEqualTo(new IntervalLattice());
		assertThat(states.get(1).get(X)).isEqualTo(IntervalLattice.constant(3));
		assertThat(states.get(2).get(y)).isEqualTo(IntervalLattice.constant(6));
		assertThat(states.get(3).get(X)).isEqualTo(IntervalLattice.constant(3));
	}

	@Test
	public void branchesAreJoined() {
		var entry = new Basic(1, assign(X, call("input", PrimitiveType.INT)));
		var then = new Basic(2, assign(X, literal(1)));
		var otherwise = new Basic(3, assign(X, literal(5)));
		var exit = new Basic(4);
		var cfg = ControlFlowGraph.builder()
			.entry(entry)
			.exit(exit)
			.addEdge(Edge.conditional(entry, then, call("gt", PrimitiveType.BOOL, access(X), literal(0)), Edge.Kind.IF_IN))
			.addEdge(Edge.conditional(entry, otherwise, call("lte", PrimitiveType.BOOL, access(X), literal(0)), Edge.Kind.DEFAULT))
			.addEdge(Edge.unconditional(then, exit, Edge.Kind.IF_OUT))
			.addEdge(Edge.unconditional(otherwise, exit, Edge.Kind.DEFAULT))
			.build();

		var result = analyze(cfg, 3);
		assertThat(result.getNodeResult(exit).get(0).get(X)).isEqualTo(IntervalLattice.of(1, 5));
	}

	@Test
	public void infeasibleBranchIsBottom() {
		var entry = new Basic(1, assign(X, literal(0)));
		var then = new Basic(2, assign(X, literal(1)));
		var exit = new Basic(3);
		var cfg = ControlFlowGraph.builder()
			.entry(entry)
			.exit(exit)
			.addEdge(Edge.conditional(entry, then, call("gt", PrimitiveType.BOOL, access(X), literal(0)), Edge.Kind.IF_IN))
			.addEdge(Edge.conditional(entry, exit, call("lte", PrimitiveType.BOOL, access(X), literal(0)), Edge.Kind.DEFAULT))
			.addEdge(Edge.unconditional(then, exit, Edge.Kind.IF_OUT))
			.build();

		var result = analyze(cfg, 3);
		assertThat(result.getNodeResult(then).get(0).isBottom()).isTrue();
		assertThat(result.getNodeResult(exit).get(0).get(X)).isEqualTo(IntervalLattice.constant(0));
	}

	@Test
	public void loopIsWidened() {
		var cfg = counter();
		var result = analyze(cfg, 1);

		var head = cfg.getNode(2);
		assertThat(result.getNodeResult(head)).hasSize(1);
		assertThat(result.getNodeResult(head).get(0).get(X)).isEqualTo(IntervalLattice.atLeast(0));
		assertThat(result.getNodeResult(cfg.getExit()).get(0).get(X)).isEqualTo(IntervalLattice.atLeast(10));
	}

	@Test
	public void widerThresholdSameFixpoint() {
		var cfg = counter();
		var early = analyze(cfg, 1);
		var late = analyze(cfg, 5);
		assertThat(late.getNodeResult(cfg.getExit()).get(0).get(X))
			.isEqualTo(early.getNodeResult(cfg.getExit()).get(0).get(X));
	}

	@Test
	public void analysisIsDeterministic() {
		var cfg = counter();
		assertThat(analyze(cfg, 2)).isEqualTo(analyze(cfg, 2));
	}

	@Test
	public void iterationLimit() {
		var cfg = counter();
		var interpreter = new ForwardInterpreter<IntervalState>(cfg, new ForwardSemantics(), 100, 2, null);
		var e = assertThrows(NonConvergenceException.class, () -> interpreter.analyze(new IntervalState(cfg.variables())));
		assertThat(e.getNode()).isEqualTo(cfg.getNode(2));
		assertThat(e.getLimit()).isEqualTo(2);
	}

	@Test
	public void raiseMakesPathInfeasible() {
		var node = new Basic(1, assign(X, literal(1)), new Raise(pp()));
		var cfg = ControlFlowGraph.builder()
			.entry(node)
			.exit(node)
			.build();

		var states = analyze(cfg, 3).getNodeResult(node);
		assertThat(states.get(1).isBottom()).isFalse();
		assertThat(states.get(2).isBottom()).isTrue();
	}
}
