package absint;

import absint.expr.Literal;
import absint.expr.VariableIdentifier;
import absint.stmt.Assignment;
import absint.stmt.Call;
import absint.stmt.LiteralEvaluation;
import absint.stmt.ProgramPoint;
import absint.stmt.Statement;
import absint.stmt.VariableAccess;
import absint.type.PrimitiveType;
import absint.type.ValueType;

import java.util.List;

/**
 * Statement builders for tests.
 */
public final class Programs {
	private static int line = 0;

	private Programs() {
	}

	public static ProgramPoint pp() {
		return new ProgramPoint(++line, 0);
	}

	public static VariableIdentifier intVar(String name) {
		return new VariableIdentifier(PrimitiveType.INT, name);
	}

	public static VariableAccess access(VariableIdentifier variable) {
		return new VariableAccess(pp(), variable);
	}

	public static LiteralEvaluation literal(long value) {
		return new LiteralEvaluation(pp(), Literal.of(value));
	}

	public static Call call(String name, ValueType type, Statement... args) {
		return new Call(pp(), name, List.of(args), type);
	}

	public static Assignment assign(Statement left, Statement right) {
		return new Assignment(pp(), left, right);
	}

	public static Assignment assign(VariableIdentifier left, Statement right) {
		return assign(access(left), right);
	}

	/**
	 * @return {@code left op right} for a comparison operator.
	 */
	public static Call compare(String op, Statement left, Statement right) {
		return call(op, PrimitiveType.BOOL, left, right);
	}

	/**
	 * Build
	 *
	 * <pre>
	 *     [init]
	 *     while var < bound:
	 *         [body]
	 *     [exit]
	 * </pre>
	 *
	 * with node ids 1 (init), 2 (loop head), 3 (body) and 4 (exit).
	 */
	public static ControlFlowGraph whileLoop(VariableIdentifier var, long bound, List<Statement> init, List<Statement> body) {
		var entry = new Basic(1, init);
		var head = new Loop(2);
		var loop = new Basic(3, body);
		var exit = new Basic(4);
		return ControlFlowGraph.builder()
			.entry(entry)
			.exit(exit)
			.addEdge(Edge.unconditional(entry, head, Edge.Kind.DEFAULT))
			.addEdge(Edge.conditional(head, loop, compare("lt", access(var), literal(bound)), Edge.Kind.LOOP_IN))
			.addEdge(Edge.unconditional(loop, head, Edge.Kind.LOOP_OUT))
			.addEdge(Edge.conditional(head, exit, compare("gte", access(var), literal(bound)), Edge.Kind.DEFAULT))
			.build();
	}
}
