package absint.dataflow;

import absint.expr.BinaryArithmeticOperation;
import absint.expr.BinaryBooleanOperation;
import absint.expr.BinaryComparisonOperation;
import absint.expr.DictDisplay;
import absint.expr.Expression;
import absint.expr.Input;
import absint.expr.KeysIdentifier;
import absint.expr.LengthIdentifier;
import absint.expr.ListDisplay;
import absint.expr.Literal;
import absint.expr.Range;
import absint.expr.SetDisplay;
import absint.expr.Slicing;
import absint.expr.Subscription;
import absint.expr.UnaryArithmeticOperation;
import absint.expr.UnaryBooleanOperation;
import absint.expr.ValuesIdentifier;
import absint.expr.VariableIdentifier;
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
import absint.type.PrimitiveType;
import absint.type.ValueType;

import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The semantics of statements, shared by both analysis directions.
 *
 * Evaluating an access leaves the denoted expressions in the state's result;
 * calls to operators and builtins combine the results of their arguments.
 * Subclasses decide what an {@link absint.stmt.Assignment} does.
 */
public abstract class Semantics implements StatementVisitor<Void, State<?>> {
	/**
	 * Execute a statement.
	 *
	 * @return The (updated) state.
	 */
	public <T extends State<T>> T semantics(Statement stmt, T state) {
		stmt.accept(this, state);
		return state;
	}

	/**
	 * @return The expressions a statement evaluates to.
	 */
	protected Set<Expression> evaluate(Statement stmt, State<?> state) {
		stmt.accept(this, state);
		return new LinkedHashSet<>(state.getResult());
	}

	private List<Set<Expression>> evaluateAll(List<Statement> stmts, State<?> state) {
		var results = new ArrayList<Set<Expression>>(stmts.size());
		for (var stmt : stmts) {
			results.add(evaluate(stmt, state));
		}
		return results;
	}

	@Override
	public Void visitLiteralEvaluation(LiteralEvaluation stmt, State<?> state) {
		state.setResult(Set.of(stmt.getLiteral()));
		return null;
	}

	@Override
	public Void visitVariableAccess(VariableAccess stmt, State<?> state) {
		state.setResult(Set.of(stmt.getVariable()));
		return null;
	}

	@Override
	public Void visitListDisplayAccess(ListDisplayAccess stmt, State<?> state) {
		var result = new LinkedHashSet<Expression>();
		for (var items : Sets.cartesianProduct(evaluateAll(stmt.getItems(), state))) {
			result.add(new ListDisplay(stmt.getType(), items));
		}
		state.setResult(result);
		return null;
	}

	@Override
	public Void visitSetDisplayAccess(SetDisplayAccess stmt, State<?> state) {
		var result = new LinkedHashSet<Expression>();
		for (var items : Sets.cartesianProduct(evaluateAll(stmt.getItems(), state))) {
			result.add(new SetDisplay(stmt.getType(), items));
		}
		state.setResult(result);
		return null;
	}

	@Override
	public Void visitDictDisplayAccess(DictDisplayAccess stmt, State<?> state) {
		var keys = evaluateAll(stmt.getKeys(), state);
		var values = evaluateAll(stmt.getValues(), state);

		var n = keys.size();
		var all = new ArrayList<Set<Expression>>(keys);
		all.addAll(values);

		var result = new LinkedHashSet<Expression>();
		for (var items : Sets.cartesianProduct(all)) {
			result.add(new DictDisplay(stmt.getType(), items.subList(0, n), items.subList(n, 2 * n)));
		}
		state.setResult(result);
		return null;
	}

	@Override
	public Void visitSubscriptionAccess(SubscriptionAccess stmt, State<?> state) {
		var targets = evaluate(stmt.getTarget(), state);
		var keys = evaluate(stmt.getKey(), state);

		var result = new LinkedHashSet<Expression>();
		for (var target : targets) {
			for (var key : keys) {
				result.add(new Subscription(stmt.getType(), target, key));
			}
		}
		state.setResult(result);
		return null;
	}

	/**
	 * @return The results of an optional statement, or a single null.
	 */
	private List<Expression> evaluateOptional(Statement stmt, State<?> state) {
		if (stmt == null) {
			return Arrays.asList((Expression) null);
		} else {
			return new ArrayList<>(evaluate(stmt, state));
		}
	}

	@Override
	public Void visitSlicingAccess(SlicingAccess stmt, State<?> state) {
		var targets = evaluate(stmt.getTarget(), state);
		var lowers = evaluate(stmt.getLower(), state);
		var uppers = evaluateOptional(stmt.getUpper().orElse(null), state);
		var strides = evaluateOptional(stmt.getStride().orElse(null), state);

		var result = new LinkedHashSet<Expression>();
		for (var target : targets) {
			for (var lower : lowers) {
				for (var upper : uppers) {
					for (var stride : strides) {
						result.add(new Slicing(stmt.getType(), target, lower, upper, stride));
					}
				}
			}
		}
		state.setResult(result);
		return null;
	}

	@Override
	public Void visitRaise(Raise stmt, State<?> state) {
		state.raiseError();
		return null;
	}

	@Override
	public Void visitCall(Call stmt, State<?> state) {
		switch (stmt.getName()) {
		case "add":
			return binary(stmt, state, BinaryArithmeticOperation.Operator.ADD);
		case "sub":
			return binary(stmt, state, BinaryArithmeticOperation.Operator.SUB);
		case "mult":
			return binary(stmt, state, BinaryArithmeticOperation.Operator.MULT);
		case "div":
			return binary(stmt, state, BinaryArithmeticOperation.Operator.DIV);
		case "mod":
			return binary(stmt, state, BinaryArithmeticOperation.Operator.MOD);
		case "eq":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.EQ);
		case "noteq":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.NOT_EQ);
		case "lt":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.LT);
		case "lte":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.LT_E);
		case "gt":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.GT);
		case "gte":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.GT_E);
		case "is":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.IS);
		case "isnot":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.IS_NOT);
		case "in":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.IN);
		case "notin":
			return comparison(stmt, state, BinaryComparisonOperation.Operator.NOT_IN);
		case "and":
			return logical(stmt, state, BinaryBooleanOperation.Operator.AND);
		case "or":
			return logical(stmt, state, BinaryBooleanOperation.Operator.OR);
		case "not":
			return unary(stmt, state, e -> new UnaryBooleanOperation(stmt.getType(), UnaryBooleanOperation.Operator.NEG, e));
		case "uadd":
			return unary(stmt, state, e -> new UnaryArithmeticOperation(stmt.getType(), UnaryArithmeticOperation.Operator.ADD, e));
		case "usub":
			return unary(stmt, state, e -> new UnaryArithmeticOperation(stmt.getType(), UnaryArithmeticOperation.Operator.SUB, e));
		case "input":
			state.setResult(Set.of(new Input(stmt.getType())));
			return null;
		case "print":
			return print(stmt, state);
		case "len":
			return len(stmt, state);
		case "range":
			return range(stmt, state);
		case "int":
			return cast(stmt, state, PrimitiveType.INT);
		case "bool":
			return cast(stmt, state, PrimitiveType.BOOL);
		case "float":
			return cast(stmt, state, PrimitiveType.FLOAT);
		case "list":
			return empty(stmt, state, t -> new ListDisplay(t, List.of()));
		case "set":
			return empty(stmt, state, t -> new SetDisplay(t, List.of()));
		case "dict":
			return empty(stmt, state, t -> new DictDisplay(t, List.of(), List.of()));
		case "keys":
			state.setResult(Set.of(new KeysIdentifier(target(stmt))));
			return null;
		case "values":
			state.setResult(Set.of(new ValuesIdentifier(target(stmt))));
			return null;
		default:
			return userDefinedCall(stmt, state);
		}
	}

	/**
	 * Semantics of a call to anything but an operator or builtin.
	 */
	protected Void userDefinedCall(Call stmt, State<?> state) {
		throw new UnsupportedOperationException("Semantics for call to " + stmt.getName() + " is not supported");
	}

	private static void checkArity(Call stmt, int min, int max) {
		var n = stmt.getArguments().size();
		if (n < min || n > max) {
			throw new IllegalArgumentException("Call to " + stmt.getName() + " with unexpected number of arguments: " + n);
		}
	}

	private Void unary(Call stmt, State<?> state, Function<Expression, Expression> operation) {
		checkArity(stmt, 1, 1);
		var result = new LinkedHashSet<Expression>();
		for (var expr : evaluate(stmt.getArguments().get(0), state)) {
			result.add(operation.apply(expr));
		}
		state.setResult(result);
		return null;
	}

	/**
	 * Fold the (two or more) arguments of a call with a binary operation.
	 */
	private Void fold(Call stmt, State<?> state, BiFunction<Expression, Expression, Expression> operation) {
		checkArity(stmt, 2, Integer.MAX_VALUE);
		var result = new LinkedHashSet<Expression>();
		for (var args : Sets.cartesianProduct(evaluateAll(stmt.getArguments(), state))) {
			var expr = args.get(0);
			for (var arg : args.subList(1, args.size())) {
				expr = operation.apply(expr, arg);
			}
			result.add(expr);
		}
		state.setResult(result);
		return null;
	}

	private Void binary(Call stmt, State<?> state, BinaryArithmeticOperation.Operator op) {
		return fold(stmt, state, (l, r) -> new BinaryArithmeticOperation(stmt.getType(), l, op, r));
	}

	private Void comparison(Call stmt, State<?> state, BinaryComparisonOperation.Operator op) {
		return fold(stmt, state, (l, r) -> new BinaryComparisonOperation(stmt.getType(), l, op, r));
	}

	private Void logical(Call stmt, State<?> state, BinaryBooleanOperation.Operator op) {
		return fold(stmt, state, (l, r) -> new BinaryBooleanOperation(stmt.getType(), l, op, r));
	}

	private Void print(Call stmt, State<?> state) {
		checkArity(stmt, 1, 1);
		state.output(evaluate(stmt.getArguments().get(0), state));
		return null;
	}

	/**
	 * @return The variable a builtin like {@code len()} is applied to.
	 */
	private static VariableIdentifier target(Call stmt) {
		checkArity(stmt, 1, 1);
		var arg = stmt.getArguments().get(0);
		if (arg instanceof VariableAccess) {
			return ((VariableAccess) arg).getVariable();
		} else {
			throw new UnsupportedOperationException("Semantics for " + stmt.getName() + " of " + arg + " is not supported");
		}
	}

	private Void len(Call stmt, State<?> state) {
		state.setResult(Set.of(new LengthIdentifier(target(stmt))));
		return null;
	}

	private Void range(Call stmt, State<?> state) {
		var args = stmt.getArguments();
		Set<Expression> starts = Set.of(Literal.of(0));
		Set<Expression> stops;
		Set<Expression> steps = Set.of(Literal.of(1));
		switch (args.size()) {
		case 1:
			stops = evaluate(args.get(0), state);
			break;
		case 2:
			starts = evaluate(args.get(0), state);
			stops = evaluate(args.get(1), state);
			break;
		case 3:
			starts = evaluate(args.get(0), state);
			stops = evaluate(args.get(1), state);
			steps = evaluate(args.get(2), state);
			break;
		default:
			throw new IllegalArgumentException("Call to range with unexpected number of arguments: " + args.size());
		}

		var result = new LinkedHashSet<Expression>();
		for (var start : starts) {
			for (var stop : stops) {
				for (var step : steps) {
					result.add(new Range(stmt.getType(), start, stop, step));
				}
			}
		}
		state.setResult(result);
		return null;
	}

	private Void cast(Call stmt, State<?> state, ValueType type) {
		checkArity(stmt, 1, 1);
		var result = new LinkedHashSet<Expression>();
		for (var expr : evaluate(stmt.getArguments().get(0), state)) {
			if (expr.getType().equals(type)) {
				result.add(expr);
			} else if (expr instanceof Input) {
				result.add(new Input(type));
			} else if (expr instanceof Literal l && type.isNumeric() && !l.isNumber()) {
				// A string we cannot read may hold any number
				result.add(new Input(type));
			} else if (expr instanceof Literal l) {
				result.add(new Literal(type, l.getValue()));
			} else if (expr.getClass() == VariableIdentifier.class) {
				result.add(new VariableIdentifier(type, ((VariableIdentifier) expr).getName()));
			} else if (expr instanceof Subscription s) {
				result.add(new Subscription(type, s.getTarget(), s.getKey()));
			} else {
				throw new UnsupportedOperationException("Argument " + expr + " of " + stmt.getName() + " is not supported");
			}
		}
		state.setResult(result);
		return null;
	}

	private Void empty(Call stmt, State<?> state, Function<ValueType, Expression> display) {
		if (!stmt.getArguments().isEmpty()) {
			throw new UnsupportedOperationException("Semantics for " + stmt + " is not supported");
		}
		state.setResult(Set.of(display.apply(stmt.getType())));
		return null;
	}
}
