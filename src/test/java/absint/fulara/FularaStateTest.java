package absint.fulara;

import static absint.Programs.access;
import static absint.Programs.assign;
import static absint.Programs.call;
import static absint.Programs.compare;
import static absint.Programs.intVar;
import static absint.Programs.literal;
import static absint.Programs.pp;
import static absint.Programs.whileLoop;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import absint.Basic;
import absint.ControlFlowGraph;
import absint.Edge;
import absint.Loop;
import absint.dataflow.ForwardInterpreter;
import absint.dataflow.ForwardSemantics;
import absint.dataflow.IntervalLattice;
import absint.expr.BinaryComparisonOperation;
import absint.expr.DictDisplay;
import absint.expr.Expression;
import absint.expr.Input;
import absint.expr.KeysIdentifier;
import absint.expr.Literal;
import absint.expr.Subscription;
import absint.expr.ValuesIdentifier;
import absint.expr.VariableIdentifier;
import absint.stmt.DictDisplayAccess;
import absint.stmt.Statement;
import absint.stmt.SubscriptionAccess;
import absint.type.DictType;
import absint.type.ListType;
import absint.type.PrimitiveType;

import java.util.List;
import java.util.Set;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FularaStateTest {
	private static final DictType INTS = new DictType(PrimitiveType.INT, PrimitiveType.INT);
	private static final DictType NAMES = new DictType(PrimitiveType.STRING, PrimitiveType.INT);
	private static final VariableIdentifier D = new VariableIdentifier(INTS, "d");
	private static final VariableIdentifier E = new VariableIdentifier(INTS, "e");
	private static final VariableIdentifier N = new VariableIdentifier(NAMES, "n");
	private static final VariableIdentifier X = new VariableIdentifier(PrimitiveType.INT, "x");
	private static final VariableIdentifier Y = new VariableIdentifier(PrimitiveType.INT, "y");
	private static final Literal A = new Literal(PrimitiveType.STRING, "a");

	private static FularaState state() {
		return new FularaState(List.of(D, E, N, X, Y));
	}

	private static Expression at(VariableIdentifier dict, Expression key) {
		return new Subscription(PrimitiveType.INT, dict, key);
	}

	private static FularaState assignTo(FularaState state, Expression left, Expression right) {
		return state.assign(Set.of(left), Set.of(right));
	}

	private static FularaState assume(FularaState state, Expression left, BinaryComparisonOperation.Operator op, Expression right) {
		return state.assume(Set.of(new BinaryComparisonOperation(PrimitiveType.BOOL, left, op, right)), false);
	}

	private static DictDisplay empty() {
		return new DictDisplay(INTS, List.of(), List.of());
	}

	/** d = {3: 2, 4: 1} */
	private static FularaState withCounts() {
		var display = new DictDisplay(INTS, List.of(Literal.of(3), Literal.of(4)), List.of(Literal.of(2), Literal.of(1)));
		return assignTo(state(), D, display);
	}

	/** d = {}; d[1] = 7 */
	private static FularaState withSevenAtOne() {
		var state = assignTo(state(), D, empty());
		return assignTo(state, at(D, Literal.of(1)), Literal.of(7));
	}

	@Test
	public void initialState() {
		var state = state();
		assertThat(state.getDictionary(D).isTop()).isTrue();
		assertThat(state.getDictionary(E).isTop()).isTrue();
		assertThat(state.isBottom()).isFalse();
		assertThrows(IllegalArgumentException.class, () -> state.getDictionary(N));
		assertThrows(IllegalArgumentException.class, () -> state.getDictionary(X));
	}

	@Test
	public void emptyDisplay() {
		var state = assignTo(state(), D, empty());
		assertThat(state.getDictionary(D).isEmptyDict()).isTrue();
		assertThat(state.getScalarState().get(new ValuesIdentifier(D)).isTop()).isTrue();
		assertThat(state.isBottom()).isFalse();
	}

	@Test
	public void display() {
		var display = new DictDisplay(INTS, List.of(Literal.of(1), Literal.of(2)), List.of(Literal.of(10), Literal.of(20)));
		var state = assignTo(state(), D, display);
		var dict = state.getDictionary(D);
		assertThat(dict.toString()).isEqualTo("{([1, 1], [10, 10]), ([2, 2], [20, 20])}");
		assertThat(state.getScalarState().get(new KeysIdentifier(D))).isEqualTo(IntervalLattice.of(1, 2));
	}

	@Test
	public void strongUpdate() {
		var state = withSevenAtOne();
		assignTo(state, at(D, Literal.of(1)), Literal.of(5));
		var dict = state.getDictionary(D);
		assertThat(dict.getSegments()).hasSize(1);
		assertThat(dict.getValuesJoined().getInterval()).isEqualTo(IntervalLattice.constant(5));
		assertThat(dict.getKeysJoined().getInterval()).isEqualTo(IntervalLattice.constant(1));
	}

	@Test
	public void weakUpdate() {
		var state = withSevenAtOne();
		assignTo(state, X, new Input(PrimitiveType.INT));
		assume(state, X, BinaryComparisonOperation.Operator.GT_E, Literal.of(0));
		assume(state, X, BinaryComparisonOperation.Operator.LT_E, Literal.of(2));
		assignTo(state, at(D, X), Literal.of(9));

		var dict = state.getDictionary(D);
		assertThat(dict.getSegments()).hasSize(3);
		assertThat(dict.getKeysJoined().getInterval()).isEqualTo(IntervalLattice.of(0, 2));
		assertThat(dict.getValuesJoined().getInterval()).isEqualTo(IntervalLattice.of(7, 9));
		assertThat(dict.toString()).isEqualTo("{([0, 0], [9, 9]), ([1, 1], [7, 9]), ([2, 2], [9, 9])}");
	}

	@Test
	public void read() {
		var state = withSevenAtOne();
		assignTo(state, at(D, Literal.of(2)), Literal.of(3));
		assignTo(state, Y, at(D, Literal.of(1)));
		assertThat(state.getScalarState().get(Y)).isEqualTo(IntervalLattice.constant(7));

		assignTo(state, X, new Input(PrimitiveType.INT));
		assume(state, X, BinaryComparisonOperation.Operator.GT_E, Literal.of(1));
		assume(state, X, BinaryComparisonOperation.Operator.LT_E, Literal.of(2));
		assignTo(state, Y, at(D, X));
		assertThat(state.getScalarState().get(Y)).isEqualTo(IntervalLattice.of(3, 7));
		assertThat(state.getScalarState().getStore().getVariables()).hasSize(
			state().getScalarState().getStore().getVariables().size());
	}

	@Test
	public void readOfAbsentKeyIsBottom() {
		var state = withSevenAtOne();
		assignTo(state, Y, at(D, Literal.of(5)));
		assertThat(state.isBottom()).isTrue();
	}

	@Test
	public void conditionOnRead() {
		var state = withSevenAtOne();
		assume(state, at(D, Literal.of(1)), BinaryComparisonOperation.Operator.GT, Literal.of(7));
		assertThat(state.isBottom()).isTrue();

		state = withSevenAtOne();
		assume(state, at(D, Literal.of(1)), BinaryComparisonOperation.Operator.EQ, Literal.of(7));
		assertThat(state.isBottom()).isFalse();
	}

	@Test
	public void copyBetweenDictionaries() {
		var state = withSevenAtOne();
		assignTo(state, E, D);
		assertThat(state.getDictionary(E)).isEqualTo(state.getDictionary(D));

		assignTo(state, at(E, Literal.of(1)), Literal.of(0));
		assertThat(state.getDictionary(D).getValuesJoined().getInterval()).isEqualTo(IntervalLattice.constant(7));
		assertThat(state.getDictionary(E).getValuesJoined().getInterval()).isEqualTo(IntervalLattice.constant(0));
	}

	@Test
	public void inputIsTop() {
		var state = withSevenAtOne();
		assignTo(state, D, new Input(INTS));
		assertThat(state.getDictionary(D).isTop()).isTrue();
	}

	@Test
	public void unsupportedAssignment() {
		var state = state();
		assertThrows(UnsupportedOperationException.class, () -> assignTo(state, D, Literal.of(1)));
	}

	@Test
	public void scalarAssignmentReachesSegments() {
		var state = assignTo(state(), X, Literal.of(0));
		assignTo(state, D, empty());
		assignTo(state, at(D, X), Literal.of(1));
		assignTo(state, X, Literal.of(4));

		var segment = state.getDictionary(D).getSegments().get(0);
		assertThat(segment.getKey().getState().get(X)).isEqualTo(IntervalLattice.constant(4));
		assertThat(segment.getKey().getInterval()).isEqualTo(IntervalLattice.constant(0));

		assignTo(state, X, at(D, Literal.of(0)));
		segment = state.getDictionary(D).getSegments().get(0);
		assertThat(segment.getKey().getState().get(X).isTop()).isTrue();
	}

	@Test
	public void otherDictionariesAreSummarized() {
		var state = state();
		assignTo(state, at(N, A), Literal.of(3));
		assertThat(state.getScalarState().get(new ValuesIdentifier(N)).isTop()).isTrue();
		assignTo(state, N, new DictDisplay(NAMES, List.of(A), List.of(Literal.of(3))));
		assertThat(state.getScalarState().get(new ValuesIdentifier(N))).isEqualTo(IntervalLattice.constant(3));
	}

	@Test
	public void noBackwardAnalysis() {
		var state = state();
		assertThrows(UnsupportedOperationException.class, () -> state.substitute(Set.of(X), Set.of(Literal.of(1))));
	}

	@Test
	public void lattice() {
		var a = withSevenAtOne();
		var b = assignTo(withSevenAtOne(), at(D, Literal.of(2)), Literal.of(8));
		assertThat(a.lessEqual(b)).isTrue();
		assertThat(b.lessEqual(a)).isFalse();

		var join = a.copy().join(b);
		assertThat(a.lessEqual(join)).isTrue();
		assertThat(b.lessEqual(join)).isTrue();
		assertThat(join.getDictionary(D).getSegments()).hasSize(2);

		var meet = a.copy().meet(b);
		assertThat(meet.getDictionary(D).toString()).isEqualTo("{([1, 1], [7, 7])}");

		assertThat(a.copy().bottom().isBottom()).isTrue();
		assertThat(a.copy().bottom().lessEqual(a)).isTrue();
	}

	/**
	 * <pre>
	 *     d = {}
	 *     x = input()
	 *     if x > 0:
	 *         d[1] = 1
	 *     else:
	 *         d[2] = 2
	 * </pre>
	 */
	@Test
	public void forwardAnalysis() {
		var x = intVar("x");
		var d = new VariableIdentifier(INTS, "d");
		var entry = new Basic(1,
			assign(d, new DictDisplayAccess(pp(), INTS, List.<Statement>of(), List.<Statement>of())),
			assign(x, call("input", PrimitiveType.INT)));
		var then = new Basic(2, assign(new SubscriptionAccess(pp(), PrimitiveType.INT, access(d), literal(1)), literal(1)));
		var otherwise = new Basic(3, assign(new SubscriptionAccess(pp(), PrimitiveType.INT, access(d), literal(2)), literal(2)));
		var exit = new Basic(4);
		var cfg = ControlFlowGraph.builder()
			.entry(entry)
			.exit(exit)
			.addEdge(Edge.conditional(entry, then, compare("gt", access(x), literal(0)), Edge.Kind.IF_IN))
			.addEdge(Edge.conditional(entry, otherwise, compare("lte", access(x), literal(0)), Edge.Kind.DEFAULT))
			.addEdge(Edge.unconditional(then, exit, Edge.Kind.IF_OUT))
			.addEdge(Edge.unconditional(otherwise, exit, Edge.Kind.DEFAULT))
			.build();

		var interpreter = new ForwardInterpreter<FularaState>(cfg, new ForwardSemantics(), 3);
		var result = interpreter.analyze(new FularaState(cfg.variables()));

		var dict = result.getNodeResult(exit).get(0).getDictionary(d);
		assertThat(dict.getSegments()).hasSize(2);
		assertThat(dict.getKeysJoined().getInterval()).isEqualTo(IntervalLattice.of(1, 2));
		assertThat(dict.getValuesJoined().getInterval()).isEqualTo(IntervalLattice.of(1, 2));
		assertThat(result.getNodeResult(entry).get(1).getDictionary(d).isEmptyDict()).isTrue();
	}

	@Test
	public void membership() {
		var keys = assume(withCounts(), X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		assertThat(keys.getScalarState().get(X)).isEqualTo(IntervalLattice.of(3, 4));
		var values = assume(withCounts(), X, BinaryComparisonOperation.Operator.IN, new ValuesIdentifier(D));
		assertThat(values.getScalarState().get(X)).isEqualTo(IntervalLattice.of(1, 2));
		var dict = assume(withCounts(), X, BinaryComparisonOperation.Operator.IN, D);
		assertThat(dict.getScalarState().get(X)).isEqualTo(IntervalLattice.of(3, 4));
	}

	@Test
	public void membershipUsesSegments() {
		// The key summary of d is unbounded after the update, its segments are not
		var state = assume(withSevenAtOne(), X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		assertThat(state.getScalarState().get(new KeysIdentifier(D)).isTop()).isTrue();
		assertThat(state.getScalarState().get(X)).isEqualTo(IntervalLattice.constant(1));

		state = assume(withSevenAtOne(), Y, BinaryComparisonOperation.Operator.IN, new ValuesIdentifier(D));
		assertThat(state.getScalarState().get(Y)).isEqualTo(IntervalLattice.constant(7));

		state = assume(assignTo(state(), D, empty()), X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		assertThat(state.isBottom()).isTrue();

		state = assignTo(withSevenAtOne(), X, Literal.of(2));
		assume(state, X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		assertThat(state.isBottom()).isTrue();
	}

	@Test
	public void negativeMembershipKeepsTheState() {
		var state = assignTo(withSevenAtOne(), X, Literal.of(2));
		assume(state, X, BinaryComparisonOperation.Operator.NOT_IN, new KeysIdentifier(D));
		assertThat(state).isEqualTo(assignTo(withSevenAtOne(), X, Literal.of(2)));
	}

	@Test
	public void membershipInLoopRebindsElement() {
		var state = assignTo(state(), X, Literal.of(5));
		assignTo(state, D, empty());
		assignTo(state, at(D, X), Literal.of(1));
		assignTo(state, X, Literal.of(0));

		state.enterLoop();
		assume(state, X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		assertThat(state.getScalarState().get(X)).isEqualTo(IntervalLattice.constant(5));
		var segment = state.getDictionary(D).getSegments().get(0);
		assertThat(segment.getKey().getState().get(X).isTop()).isTrue();
		state.exitLoop();

		// Outside of a loop header the test only refines
		state = assignTo(state(), X, Literal.of(5));
		assignTo(state, D, empty());
		assignTo(state, at(D, X), Literal.of(1));
		assume(state, X, BinaryComparisonOperation.Operator.IN, new KeysIdentifier(D));
		segment = state.getDictionary(D).getSegments().get(0);
		assertThat(segment.getKey().getState().get(X)).isEqualTo(IntervalLattice.constant(5));
	}

	/**
	 * <pre>
	 *     d = {}
	 *     i = 0
	 *     while i < 10:
	 *         d[i] = i
	 *         i = i + 1
	 * </pre>
	 */
	@Test
	public void loopConvergesUnderWidening() {
		var i = intVar("i");
		var d = new VariableIdentifier(INTS, "d");
		var cfg = whileLoop(i, 10,
			List.of(
				assign(d, new DictDisplayAccess(pp(), INTS, List.<Statement>of(), List.<Statement>of())),
				assign(i, literal(0))),
			List.of(
				assign(new SubscriptionAccess(pp(), PrimitiveType.INT, access(d), access(i)), access(i)),
				assign(i, call("add", PrimitiveType.INT, access(i), literal(1)))));

		var interpreter = new ForwardInterpreter<FularaState>(cfg, new ForwardSemantics(), 1, 20, null);
		var result = interpreter.analyze(new FularaState(cfg.variables()));

		var exit = result.getNodeResult(cfg.getExit()).get(0);
		assertThat(exit.getScalarState().get(i)).isEqualTo(IntervalLattice.atLeast(10));
		assertThat(exit.getDictionary(d).getValuesJoined().getInterval()).isEqualTo(IntervalLattice.atLeast(0));
	}

	/**
	 * <pre>
	 *     d = {3: 2, 4: 1}
	 *     x = 0
	 *     for k in d.keys():
	 *         x = d[k]
	 * </pre>
	 */
	@Test
	public void loopOverKeys() {
		var k = intVar("k");
		var x = intVar("x");
		var d = new VariableIdentifier(INTS, "d");
		var keys = new ListType(PrimitiveType.INT);
		var entry = new Basic(1,
			assign(d, new DictDisplayAccess(pp(), INTS, List.of(literal(3), literal(4)), List.of(literal(2), literal(1)))),
			assign(x, literal(0)));
		var head = new Loop(2);
		var body = new Basic(3, assign(x, new SubscriptionAccess(pp(), PrimitiveType.INT, access(d), access(k))));
		var exit = new Basic(4);
		var cfg = ControlFlowGraph.builder()
			.entry(entry)
			.exit(exit)
			.addEdge(Edge.unconditional(entry, head, Edge.Kind.DEFAULT))
			.addEdge(Edge.conditional(head, body, compare("in", access(k), call("keys", keys, access(d))), Edge.Kind.LOOP_IN))
			.addEdge(Edge.unconditional(body, head, Edge.Kind.LOOP_OUT))
			.addEdge(Edge.conditional(head, exit, compare("notin", access(k), call("keys", keys, access(d))), Edge.Kind.DEFAULT))
			.build();

		var interpreter = new ForwardInterpreter<FularaState>(cfg, new ForwardSemantics(), 3, 20, null);
		var result = interpreter.analyze(new FularaState(cfg.variables()));

		var states = result.getNodeResult(body);
		assertThat(states.get(0).getScalarState().get(k)).isEqualTo(IntervalLattice.of(3, 4));
		assertThat(states.get(1).getScalarState().get(x)).isEqualTo(IntervalLattice.of(1, 2));
		assertThat(result.getNodeResult(exit).get(0).getScalarState().get(x)).isEqualTo(IntervalLattice.of(0, 2));
	}
}
