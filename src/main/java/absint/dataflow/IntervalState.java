package absint.dataflow;

import absint.expr.AttributeReference;
import absint.expr.BinaryArithmeticOperation;
import absint.expr.BinaryBooleanOperation;
import absint.expr.BinaryComparisonOperation;
import absint.expr.DerivedIdentifier;
import absint.expr.DictDisplay;
import absint.expr.Expression;
import absint.expr.ExpressionVisitor;
import absint.expr.Expressions;
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
import absint.type.PrimitiveType;
import absint.type.ValueType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interval analysis state.
 *
 * Numeric variables map to intervals.  Containers are summarized: each one
 * tracks its length, the join of its elements (or values), and for
 * dictionaries the join of its keys.
 */
public final class IntervalState extends State<IntervalState> implements Environment {
	private final Store<IntervalLattice> store;
	private Deque<Scope> scopes = new ArrayDeque<>();

	public IntervalState(Collection<? extends VariableIdentifier> variables) {
		this.store = new Store<>(List.of(), IntervalState::lattice);
		for (var variable : variables) {
			addVariable(variable);
		}
	}

	private IntervalState(IntervalState other) {
		super(other);
		this.store = other.store.copy();
		this.scopes = new ArrayDeque<>(other.scopes);
	}

	/**
	 * Intervals abstract booleans and numbers.
	 */
	private static IntervalLattice lattice(ValueType type) {
		if (type.isNumeric()) {
			return new IntervalLattice();
		} else {
			return null;
		}
	}

	/**
	 * @return The store identifiers that represent a variable.
	 */
	static List<VariableIdentifier> tracked(VariableIdentifier variable) {
		var ids = new ArrayList<VariableIdentifier>();
		var type = variable.getType();
		if (type.isNumeric()) {
			ids.add(variable);
		} else if (type.isContainer()) {
			ids.add(new LengthIdentifier(variable));
			if (type.getElementType().isNumeric() && type.isMapping()) {
				ids.add(new KeysIdentifier(variable));
			}
			var values = new ValuesIdentifier(variable);
			if (values.getType().isNumeric()) {
				ids.add(values);
			}
		}
		return ids;
	}

	/**
	 * @return The store backing this state.
	 */
	public Store<IntervalLattice> getStore() {
		return this.store;
	}

	/**
	 * @return The interval of a tracked identifier.
	 */
	public IntervalLattice get(VariableIdentifier variable) {
		return this.store.get(variable);
	}

	private IntervalLattice unknown(VariableIdentifier id) {
		if (id instanceof LengthIdentifier) {
			return IntervalLattice.atLeast(0);
		} else {
			return new IntervalLattice();
		}
	}

	@Override
	public void addVariable(VariableIdentifier variable) {
		for (var id : tracked(variable)) {
			this.store.addVariable(id);
			this.store.put(id, unknown(id));
		}
	}

	@Override
	public void removeVariable(VariableIdentifier variable) {
		for (var id : tracked(variable)) {
			this.store.removeVariable(id);
		}
	}

	@Override
	public void forgetVariable(VariableIdentifier variable) {
		for (var id : tracked(variable)) {
			this.store.put(id, unknown(id));
		}
	}

	@Override
	public IntervalState bottom() {
		this.store.bottom();
		return this;
	}

	@Override
	public IntervalState top() {
		this.store.top();
		return this;
	}

	@Override
	public boolean isBottom() {
		return this.store.isBottom();
	}

	@Override
	public boolean isTop() {
		return this.store.isTop();
	}

	@Override
	public IntervalState copy() {
		return new IntervalState(this);
	}

	@Override
	public IntervalState replace(IntervalState other) {
		this.store.replace(other.store);
		if (other != this) {
			this.scopes = new ArrayDeque<>(other.scopes);
		}
		return this;
	}

	@Override
	public IntervalState enterIf() {
		this.scopes.push(Scope.BRANCH);
		return this;
	}

	@Override
	public IntervalState exitIf() {
		this.scopes.poll();
		return this;
	}

	@Override
	public IntervalState enterLoop() {
		this.scopes.push(Scope.LOOP);
		return this;
	}

	@Override
	public IntervalState exitLoop() {
		this.scopes.poll();
		return this;
	}

	/**
	 * @return Whether the innermost enclosing block is a loop.
	 */
	public boolean isInLoop() {
		return this.scopes.peek() == Scope.LOOP;
	}

	@Override
	public boolean properLessEqual(IntervalState other) {
		return this.store.lessEqual(other.store);
	}

	@Override
	public IntervalState properJoin(IntervalState other) {
		this.store.join(other.store);
		return this;
	}

	@Override
	public IntervalState properMeet(IntervalState other) {
		this.store.meet(other.store);
		return this;
	}

	@Override
	public IntervalState properWidening(IntervalState other) {
		this.store.widening(other.store);
		return this;
	}

	/**
	 * @return The interval of a numeric expression in this state.
	 */
	public IntervalLattice evaluate(Expression expr) {
		return evaluate(expr, new HashMap<>());
	}

	private IntervalLattice evaluate(Expression expr, Map<Expression, IntervalLattice> evaluation) {
		return expr.accept(new Evaluation(), evaluation);
	}

	@Override
	protected IntervalState assignOne(Expression left, Expression right) {
		if (isBottom()) {
			return this;
		}

		if (left instanceof VariableIdentifier v) {
			if (v.getType().isNumeric()) {
				this.store.put(v, evaluate(right));
			} else if (v.getType().isContainer()) {
				assignSummary(v, summarize(right));
			}
		} else if (left instanceof Subscription s && s.getTarget() instanceof VariableIdentifier target) {
			// Weak update of the summaries
			var values = new ValuesIdentifier(target);
			if (this.store.contains(values)) {
				this.store.get(values).join(evaluate(right));
			}
			if (target.getType().isMapping()) {
				var keys = new KeysIdentifier(target);
				if (this.store.contains(keys)) {
					this.store.get(keys).join(evaluate(s.getKey()));
				}
				// The key may or may not be new
				var length = this.store.get(new LengthIdentifier(target));
				length.join(length.copy().add(IntervalLattice.constant(1)));
			}
		} else if (left instanceof Slicing s && s.getTarget() instanceof VariableIdentifier target) {
			var summary = summarize(right);
			var values = new ValuesIdentifier(target);
			if (this.store.contains(values)) {
				this.store.get(values).join(summary.values);
			}
			this.store.put(new LengthIdentifier(target), IntervalLattice.atLeast(0));
		} else {
			throw new UnsupportedOperationException("Assignment to " + left + " is not supported");
		}
		return this;
	}

	private void assignSummary(VariableIdentifier variable, Summary summary) {
		this.store.put(new LengthIdentifier(variable), summary.length);
		var keys = new KeysIdentifier(variable);
		if (this.store.contains(keys)) {
			this.store.put(keys, summary.keys);
		}
		var values = new ValuesIdentifier(variable);
		if (this.store.contains(values)) {
			this.store.put(values, summary.values);
		}
	}

	@Override
	protected IntervalState assumeOne(Expression condition, boolean backward) {
		if (isBottom()) {
			return this;
		}
		return assumeNormalized(Expressions.normalize(condition), backward);
	}

	private IntervalState assumeNormalized(Expression condition, boolean backward) {
		if (condition instanceof BinaryBooleanOperation b) {
			if (b.getOperator() == BinaryBooleanOperation.Operator.AND) {
				assumeNormalized(b.getLeft(), backward);
				return assumeNormalized(b.getRight(), backward);
			} else {
				var left = copy().assumeNormalized(b.getLeft(), backward);
				var right = copy().assumeNormalized(b.getRight(), backward);
				return replace(left.join(right));
			}
		} else if (condition instanceof BinaryComparisonOperation c) {
			return assumeComparison(c, backward);
		} else if (condition instanceof UnaryBooleanOperation u) {
			return assumeValue(u.getExpression(), new IntervalLattice().makeFalse());
		} else {
			return assumeValue(condition, new IntervalLattice().makeTrue());
		}
	}

	/**
	 * Assume that an expression evaluates into the given interval.
	 */
	private IntervalState assumeValue(Expression expr, IntervalLattice value) {
		if (!expr.getType().isNumeric()) {
			return this;
		}

		var evaluation = new HashMap<Expression, IntervalLattice>();
		var refined = evaluate(expr, evaluation).meet(value);
		if (refined.isBottom()) {
			return bottom();
		}
		expr.accept(new Refinement(evaluation), refined);
		return this;
	}

	private static boolean isIntegral(ValueType type) {
		return type == PrimitiveType.INT || type == PrimitiveType.BOOL;
	}

	private IntervalState assumeComparison(BinaryComparisonOperation condition, boolean backward) {
		var left = condition.getLeft();
		var right = condition.getRight();
		switch (condition.getOperator()) {
		case IN:
			return assumeMember(left, right, backward);
		case NOT_IN:
		case IS:
		case IS_NOT:
			// No interval information: the state is kept as is
			return this;
		default:
			break;
		}
		if (!left.getType().isNumeric() || !right.getType().isNumeric()) {
			return this;
		}

		// Normalize `l op r` to a constraint on `l - r`
		var integral = isIntegral(left.getType()) && isIntegral(right.getType());
		var type = integral ? PrimitiveType.INT : PrimitiveType.FLOAT;
		var diff = new BinaryArithmeticOperation(type, left, BinaryArithmeticOperation.Operator.SUB, right);
		double strict = integral ? 1 : 0;

		switch (condition.getOperator()) {
		case EQ:
			return assumeValue(diff, IntervalLattice.constant(0));
		case LT:
			return assumeValue(diff, IntervalLattice.atMost(-strict));
		case LT_E:
			return assumeValue(diff, IntervalLattice.atMost(0));
		case GT:
			return assumeValue(diff, IntervalLattice.atLeast(strict));
		case GT_E:
			return assumeValue(diff, IntervalLattice.atLeast(0));
		case NOT_EQ:
			if (evaluate(diff).equals(IntervalLattice.constant(0))) {
				return bottom();
			}
			return this;
		default:
			throw new UnsupportedOperationException("Condition " + condition + " is not supported");
		}
	}

	/**
	 * Assume {@code element in container}.  The header of a loop iterating
	 * over the container binds the element to any of its members; elsewhere
	 * the test refines the element.
	 */
	private IntervalState assumeMember(Expression element, Expression container, boolean backward) {
		if (!element.getType().isNumeric()) {
			return this;
		}

		var summary = summarize(container);
		var members = container.getType().isMapping() ? summary.keys : summary.values;
		if (!backward && isInLoop() && element instanceof VariableIdentifier v && this.store.contains(v)) {
			if (members.isBottom()) {
				return bottom();
			}
			this.store.put(v, members);
			return this;
		}
		return assumeValue(element, members);
	}

	@Override
	protected IntervalState substituteOne(Expression left, Expression right) {
		if (isBottom()) {
			return this;
		}

		if (left instanceof VariableIdentifier v) {
			if (!v.getType().isNumeric()) {
				forgetVariable(v);
				return this;
			}

			// Record the current value, then forget it
			var value = this.store.get(v).copy();
			forgetVariable(v);

			var evaluation = new HashMap<Expression, IntervalLattice>();
			var result = evaluate(right, evaluation);
			if (isBottom()) {
				return this;
			}
			var feasible = result.copy().meet(value);
			if (!result.isBottom() && feasible.isBottom()) {
				return bottom();
			}
			right.accept(new Refinement(evaluation), feasible);
			return this;
		} else if (left instanceof Subscription || left instanceof Slicing) {
			// Summaries keep their previous value
			return this;
		} else {
			throw new UnsupportedOperationException("Substitution of " + left + " is not supported");
		}
	}

	@Override
	protected IntervalState outputOne(Expression output) {
		return this;
	}

	/**
	 * The abstraction of a container value.
	 */
	private static final class Summary {
		final IntervalLattice length;
		final IntervalLattice keys;
		final IntervalLattice values;

		Summary(IntervalLattice length, IntervalLattice keys, IntervalLattice values) {
			this.length = length;
			this.keys = keys;
			this.values = values;
		}

		static Summary unknown() {
			return new Summary(IntervalLattice.atLeast(0), new IntervalLattice(), new IntervalLattice());
		}
	}

	/**
	 * Join the values of some expressions.  No elements at all gives top:
	 * a summary never becomes bottom on a feasible path.
	 */
	private IntervalLattice joinAll(List<Expression> exprs) {
		if (exprs.isEmpty()) {
			return new IntervalLattice();
		}

		var value = new IntervalLattice().bottom();
		for (var expr : exprs) {
			value.join(evaluate(expr));
		}
		return value;
	}

	private IntervalLattice lookup(VariableIdentifier id) {
		if (this.store.contains(id)) {
			return this.store.get(id).copy();
		} else {
			return new IntervalLattice();
		}
	}

	/**
	 * @return The summary of a container-typed expression.
	 */
	private Summary summarize(Expression expr) {
		if (expr instanceof KeysIdentifier k) {
			var container = k.getContainer();
			return new Summary(lookup(new LengthIdentifier(container)), new IntervalLattice(), lookup(k));
		} else if (expr instanceof ValuesIdentifier v) {
			var container = v.getContainer();
			return new Summary(lookup(new LengthIdentifier(container)), new IntervalLattice(), lookup(v));
		} else if (expr instanceof VariableIdentifier v) {
			return new Summary(lookup(new LengthIdentifier(v)), lookup(new KeysIdentifier(v)), lookup(new ValuesIdentifier(v)));
		} else if (expr instanceof ListDisplay l) {
			var n = l.getItems().size();
			return new Summary(IntervalLattice.constant(n), new IntervalLattice(), joinAll(l.getItems()));
		} else if (expr instanceof SetDisplay s) {
			var n = s.getItems().size();
			return new Summary(IntervalLattice.of(Math.min(n, 1), n), new IntervalLattice(), joinAll(s.getItems()));
		} else if (expr instanceof DictDisplay d) {
			var n = d.getKeys().size();
			return new Summary(IntervalLattice.of(Math.min(n, 1), n), joinAll(d.getKeys()), joinAll(d.getValues()));
		} else if (expr instanceof Range r) {
			return new Summary(IntervalLattice.atLeast(0), new IntervalLattice(), rangeValues(r));
		} else if (expr instanceof Slicing s) {
			var target = summarize(s.getTarget());
			var length = IntervalLattice.of(0, target.length.getUpper());
			return new Summary(length, target.keys, target.values);
		} else if (expr instanceof BinaryArithmeticOperation b && b.getOperator() == BinaryArithmeticOperation.Operator.ADD) {
			// Concatenation
			var left = summarize(b.getLeft());
			var right = summarize(b.getRight());
			return new Summary(left.length.add(right.length), left.keys.join(right.keys), left.values.join(right.values));
		} else if (expr instanceof Literal l) {
			var n = l.getValue().length();
			return new Summary(IntervalLattice.constant(n), new IntervalLattice(), new IntervalLattice());
		} else if (expr instanceof Input || expr instanceof Subscription || expr instanceof AttributeReference) {
			return Summary.unknown();
		} else {
			throw new UnsupportedOperationException("Container value " + expr + " is not supported");
		}
	}

	/**
	 * @return The interval containing every element of a range.
	 */
	private IntervalLattice rangeValues(Range range) {
		var start = evaluate(range.getStart());
		var stop = evaluate(range.getStop());
		var step = evaluate(range.getStep());
		if (start.isBottom() || stop.isBottom() || step.isBottom()) {
			return new IntervalLattice().bottom();
		} else if (step.getLower() > 0) {
			return IntervalLattice.of(start.getLower(), Math.max(start.getLower(), stop.getUpper() - 1));
		} else if (step.getUpper() < 0) {
			return IntervalLattice.of(Math.min(start.getUpper(), stop.getLower() + 1), start.getUpper());
		} else {
			return new IntervalLattice();
		}
	}

	/**
	 * Bottom-up evaluation, recording the value of every subexpression.
	 */
	private final class Evaluation implements ExpressionVisitor<IntervalLattice, Map<Expression, IntervalLattice>> {
		private IntervalLattice record(Expression expr, IntervalLattice value, Map<Expression, IntervalLattice> evaluation) {
			evaluation.put(expr, value.copy());
			return value;
		}

		private IntervalLattice visit(Expression expr, Map<Expression, IntervalLattice> evaluation) {
			return expr.accept(this, evaluation);
		}

		@Override
		public IntervalLattice visitLiteral(Literal expr, Map<Expression, IntervalLattice> evaluation) {
			IntervalLattice value;
			if (expr.getType().isNumeric()) {
				value = IntervalLattice.constant(expr.toDouble());
			} else {
				value = new IntervalLattice();
			}
			return record(expr, value, evaluation);
		}

		@Override
		public IntervalLattice visitVariableIdentifier(VariableIdentifier expr, Map<Expression, IntervalLattice> evaluation) {
			return record(expr, lookup(expr), evaluation);
		}

		@Override
		public IntervalLattice visitLengthIdentifier(LengthIdentifier expr, Map<Expression, IntervalLattice> evaluation) {
			return record(expr, lookup(expr), evaluation);
		}

		@Override
		public IntervalLattice visitKeysIdentifier(KeysIdentifier expr, Map<Expression, IntervalLattice> evaluation) {
			return record(expr, lookup(expr), evaluation);
		}

		@Override
		public IntervalLattice visitValuesIdentifier(ValuesIdentifier expr, Map<Expression, IntervalLattice> evaluation) {
			return record(expr, lookup(expr), evaluation);
		}

		@Override
		public IntervalLattice visitInput(Input expr, Map<Expression, IntervalLattice> evaluation) {
			var value = new IntervalLattice();
			if (expr.getType() == PrimitiveType.BOOL) {
				value.makeMaybe();
			}
			return record(expr, value, evaluation);
		}

		private IntervalLattice visitItems(Expression expr, List<Expression> items, Map<Expression, IntervalLattice> evaluation) {
			for (var item : items) {
				visit(item, evaluation);
			}
			return record(expr, new IntervalLattice(), evaluation);
		}

		@Override
		public IntervalLattice visitListDisplay(ListDisplay expr, Map<Expression, IntervalLattice> evaluation) {
			return visitItems(expr, expr.getItems(), evaluation);
		}

		@Override
		public IntervalLattice visitSetDisplay(SetDisplay expr, Map<Expression, IntervalLattice> evaluation) {
			return visitItems(expr, expr.getItems(), evaluation);
		}

		@Override
		public IntervalLattice visitDictDisplay(DictDisplay expr, Map<Expression, IntervalLattice> evaluation) {
			return visitItems(expr, expr.getChildren(), evaluation);
		}

		@Override
		public IntervalLattice visitRange(Range expr, Map<Expression, IntervalLattice> evaluation) {
			return visitItems(expr, expr.getChildren(), evaluation);
		}

		@Override
		public IntervalLattice visitAttributeReference(AttributeReference expr, Map<Expression, IntervalLattice> evaluation) {
			// Attributes are not modelled
			return record(expr, new IntervalLattice(), evaluation);
		}

		@Override
		public IntervalLattice visitSubscription(Subscription expr, Map<Expression, IntervalLattice> evaluation) {
			visit(expr.getTarget(), evaluation);
			visit(expr.getKey(), evaluation);

			IntervalLattice value;
			var target = expr.getTarget();
			if (target instanceof VariableIdentifier v && v.getType().isContainer()) {
				value = lookup(new ValuesIdentifier(v));
			} else if (target instanceof ListDisplay l) {
				value = joinAll(l.getItems());
			} else {
				// Elements of nested containers are not summarized
				value = new IntervalLattice();
			}
			return record(expr, value, evaluation);
		}

		@Override
		public IntervalLattice visitSlicing(Slicing expr, Map<Expression, IntervalLattice> evaluation) {
			return visitItems(expr, expr.getChildren(), evaluation);
		}

		@Override
		public IntervalLattice visitUnaryArithmeticOperation(UnaryArithmeticOperation expr, Map<Expression, IntervalLattice> evaluation) {
			var value = visit(expr.getExpression(), evaluation).copy();
			if (expr.getOperator() == UnaryArithmeticOperation.Operator.SUB) {
				value.neg();
			}
			return record(expr, value, evaluation);
		}

		@Override
		public IntervalLattice visitUnaryBooleanOperation(UnaryBooleanOperation expr, Map<Expression, IntervalLattice> evaluation) {
			var value = visit(expr.getExpression(), evaluation).copy();
			if (value.isTop()) {
				value.makeMaybe();
			}
			return record(expr, value.complement(), evaluation);
		}

		@Override
		public IntervalLattice visitBinaryArithmeticOperation(BinaryArithmeticOperation expr, Map<Expression, IntervalLattice> evaluation) {
			var left = visit(expr.getLeft(), evaluation).copy();
			var right = visit(expr.getRight(), evaluation);
			if (!expr.getType().isNumeric()) {
				return record(expr, new IntervalLattice(), evaluation);
			}

			switch (expr.getOperator()) {
			case ADD:
				left.add(right);
				break;
			case SUB:
				left.sub(right);
				break;
			case MULT:
				left.mult(right);
				break;
			case DIV:
				left.div(right);
				break;
			case MOD:
				left.mod(right);
				break;
			}
			return record(expr, left, evaluation);
		}

		@Override
		public IntervalLattice visitBinaryBooleanOperation(BinaryBooleanOperation expr, Map<Expression, IntervalLattice> evaluation) {
			var left = visit(expr.getLeft(), evaluation).copy();
			var right = visit(expr.getRight(), evaluation);
			if (expr.getOperator() == BinaryBooleanOperation.Operator.AND) {
				left.conjunction(right);
			} else {
				left.disjunction(right);
			}
			return record(expr, left, evaluation);
		}

		@Override
		public IntervalLattice visitBinaryComparisonOperation(BinaryComparisonOperation expr, Map<Expression, IntervalLattice> evaluation) {
			var left = visit(expr.getLeft(), evaluation);
			var right = visit(expr.getRight(), evaluation);
			var value = new IntervalLattice().makeMaybe();
			if (left.isBottom() || right.isBottom()) {
				value.bottom();
			} else if (expr.getLeft().getType().isNumeric() && expr.getRight().getType().isNumeric()) {
				compare(expr.getOperator(), left.copy().sub(right), value);
			}
			return record(expr, value, evaluation);
		}

		/**
		 * Decide a comparison from the interval of {@code left - right}.
		 */
		private void compare(BinaryComparisonOperation.Operator op, IntervalLattice diff, IntervalLattice value) {
			switch (op) {
			case EQ:
				if (diff.equals(IntervalLattice.constant(0))) {
					value.makeTrue();
				} else if (!diff.contains(0)) {
					value.makeFalse();
				}
				break;
			case NOT_EQ:
				compare(BinaryComparisonOperation.Operator.EQ, diff, value);
				value.complement();
				break;
			case LT:
				if (diff.getUpper() < 0) {
					value.makeTrue();
				} else if (diff.getLower() >= 0) {
					value.makeFalse();
				}
				break;
			case LT_E:
				if (diff.getUpper() <= 0) {
					value.makeTrue();
				} else if (diff.getLower() > 0) {
					value.makeFalse();
				}
				break;
			case GT:
				compare(BinaryComparisonOperation.Operator.LT_E, diff, value);
				value.complement();
				break;
			case GT_E:
				compare(BinaryComparisonOperation.Operator.LT, diff, value);
				value.complement();
				break;
			default:
				break;
			}
		}
	}

	/**
	 * Top-down refinement of the variables of an expression, given that the
	 * expression evaluates into an interval.
	 */
	private final class Refinement implements ExpressionVisitor<Void, IntervalLattice> {
		private final Map<Expression, IntervalLattice> evaluation;

		Refinement(Map<Expression, IntervalLattice> evaluation) {
			this.evaluation = evaluation;
		}

		private IntervalLattice evaluated(Expression expr) {
			var value = this.evaluation.get(expr);
			if (value == null) {
				value = evaluate(expr, this.evaluation);
			}
			return value.copy();
		}

		private Void refine(Expression expr, IntervalLattice value) {
			return expr.accept(this, value);
		}

		private Void refineIdentifier(VariableIdentifier id, IntervalLattice value) {
			if (store.contains(id)) {
				store.put(id, evaluated(id).meet(value));
			}
			return null;
		}

		@Override
		public Void visitLiteral(Literal expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitVariableIdentifier(VariableIdentifier expr, IntervalLattice value) {
			return refineIdentifier(expr, value);
		}

		@Override
		public Void visitLengthIdentifier(LengthIdentifier expr, IntervalLattice value) {
			return refineIdentifier(expr, value);
		}

		@Override
		public Void visitKeysIdentifier(KeysIdentifier expr, IntervalLattice value) {
			// A constraint on one key says nothing about the others
			return null;
		}

		@Override
		public Void visitValuesIdentifier(ValuesIdentifier expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitInput(Input expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitListDisplay(ListDisplay expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitSetDisplay(SetDisplay expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitDictDisplay(DictDisplay expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitRange(Range expr, IntervalLattice value) {
			throw new UnsupportedOperationException("Refinement of " + expr + " is not supported");
		}

		@Override
		public Void visitAttributeReference(AttributeReference expr, IntervalLattice value) {
			throw new UnsupportedOperationException("Refinement of " + expr + " is not supported");
		}

		@Override
		public Void visitSubscription(Subscription expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitSlicing(Slicing expr, IntervalLattice value) {
			return null;
		}

		@Override
		public Void visitUnaryArithmeticOperation(UnaryArithmeticOperation expr, IntervalLattice value) {
			var operand = expr.getExpression();
			var refined = value.copy();
			if (expr.getOperator() == UnaryArithmeticOperation.Operator.SUB) {
				refined.neg();
			}
			return refine(operand, evaluated(operand).meet(refined));
		}

		@Override
		public Void visitUnaryBooleanOperation(UnaryBooleanOperation expr, IntervalLattice value) {
			var operand = expr.getExpression();
			return refine(operand, evaluated(operand).meet(value.copy().complement()));
		}

		@Override
		public Void visitBinaryArithmeticOperation(BinaryArithmeticOperation expr, IntervalLattice value) {
			var left = expr.getLeft();
			var right = expr.getRight();
			if (!expr.getType().isNumeric()) {
				return null;
			}

			switch (expr.getOperator()) {
			case ADD: {
				// l = v - r, r = v - l
				var l = evaluated(left).meet(value.copy().sub(evaluated(right)));
				var r = evaluated(right).meet(value.copy().sub(evaluated(left)));
				refine(left, l);
				return refine(right, r);
			}
			case SUB: {
				// l = v + r, r = l - v
				var l = evaluated(left).meet(value.copy().add(evaluated(right)));
				var r = evaluated(right).meet(evaluated(left).sub(value));
				refine(left, l);
				return refine(right, r);
			}
			default:
				// Would need division, which is not modelled
				return null;
			}
		}

		@Override
		public Void visitBinaryBooleanOperation(BinaryBooleanOperation expr, IntervalLattice value) {
			var and = expr.getOperator() == BinaryBooleanOperation.Operator.AND;
			if ((and && value.isTrue()) || (!and && value.isFalse())) {
				refine(expr.getLeft(), evaluated(expr.getLeft()).meet(value));
				refine(expr.getRight(), evaluated(expr.getRight()).meet(value));
			}
			return null;
		}

		@Override
		public Void visitBinaryComparisonOperation(BinaryComparisonOperation expr, IntervalLattice value) {
			if (value.isTrue()) {
				assumeNormalized(expr, false);
			} else if (value.isFalse()) {
				assumeNormalized(Expressions.negate(expr), false);
			}
			return null;
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof IntervalState)) {
			return false;
		}

		var other = (IntervalState) obj;
		return this.store.equals(other.store);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.store);
	}

	@Override
	public String toString() {
		return this.store.toString();
	}
}
