package absint.fulara;

import absint.dataflow.IntervalLattice;
import absint.dataflow.IntervalState;
import absint.dataflow.State;
import absint.expr.BinaryBooleanOperation;
import absint.expr.BinaryComparisonOperation;
import absint.expr.DictDisplay;
import absint.expr.Expression;
import absint.expr.ExpressionRewriter;
import absint.expr.Expressions;
import absint.expr.Input;
import absint.expr.KeysIdentifier;
import absint.expr.Subscription;
import absint.expr.ValuesIdentifier;
import absint.expr.VariableIdentifier;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dictionary content analysis state.
 *
 * Scalars and container summaries are tracked by an {@link IntervalState}.
 * Each dictionary with numeric keys and values is additionally abstracted by
 * a {@link FularaLattice} of interval segments.  Only forward analyses are
 * supported.
 */
public final class FularaState extends State<FularaState> {
	private final ImmutableList<VariableIdentifier> numeric;
	private final IntervalState scalars;
	private final Map<VariableIdentifier, FularaLattice<IntervalKeyWrapper, IntervalValueWrapper>> dicts;

	public FularaState(Collection<? extends VariableIdentifier> variables) {
		var numeric = ImmutableList.<VariableIdentifier>builder();
		for (var variable : variables) {
			if (variable.getClass() == VariableIdentifier.class && variable.getType().isNumeric()) {
				numeric.add(variable);
			}
		}
		this.numeric = numeric.build();
		this.scalars = new IntervalState(variables);

		this.dicts = new LinkedHashMap<>();
		for (var variable : variables) {
			var type = variable.getType();
			if (type.isMapping() && type.getElementType().isNumeric() && type.getValueType().isNumeric()) {
				var scope = this.numeric;
				this.dicts.put(variable, new FularaLattice<>(
					() -> new IntervalKeyWrapper(scope, type.getElementType()),
					() -> new IntervalValueWrapper(scope, type.getValueType())));
			}
		}
	}

	private FularaState(FularaState other) {
		super(other);
		this.numeric = other.numeric;
		this.scalars = other.scalars.copy();
		this.dicts = new LinkedHashMap<>();
		other.dicts.forEach((k, v) -> this.dicts.put(k, v.copy()));
	}

	/**
	 * @return The state of the scalar variables and container summaries.
	 */
	public IntervalState getScalarState() {
		return this.scalars;
	}

	/**
	 * @return The segments of a dictionary variable.
	 */
	public FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> getDictionary(VariableIdentifier variable) {
		var lattice = this.dicts.get(variable);
		Preconditions.checkArgument(lattice != null, "Unknown dictionary %s", variable);
		return lattice;
	}

	@Override
	public FularaState bottom() {
		this.scalars.bottom();
		this.dicts.values().forEach(FularaLattice::bottom);
		return this;
	}

	@Override
	public FularaState top() {
		this.scalars.top();
		this.dicts.values().forEach(FularaLattice::top);
		return this;
	}

	@Override
	public boolean isBottom() {
		return this.scalars.isBottom()
			|| this.dicts.values().stream().anyMatch(FularaLattice::isBottom);
	}

	@Override
	public boolean isTop() {
		return this.scalars.isTop()
			&& this.dicts.values().stream().allMatch(FularaLattice::isTop);
	}

	@Override
	public FularaState copy() {
		return new FularaState(this);
	}

	@Override
	public FularaState replace(FularaState other) {
		if (other != this) {
			this.scalars.replace(other.scalars);
			this.dicts.forEach((k, v) -> v.replace(other.dicts.get(k)));
		}
		return this;
	}

	@Override
	public boolean properLessEqual(FularaState other) {
		if (!this.scalars.lessEqual(other.scalars)) {
			return false;
		}
		for (var entry : this.dicts.entrySet()) {
			if (!entry.getValue().lessEqual(other.dicts.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public FularaState properJoin(FularaState other) {
		this.scalars.join(other.scalars);
		this.dicts.forEach((k, v) -> v.join(other.dicts.get(k)));
		return this;
	}

	@Override
	public FularaState properMeet(FularaState other) {
		this.scalars.meet(other.scalars);
		this.dicts.forEach((k, v) -> v.meet(other.dicts.get(k)));
		return this;
	}

	/**
	 * The dictionaries are only widened once the scalars are stable, since
	 * their segments refer to the scalars.
	 */
	@Override
	public FularaState properWidening(FularaState other) {
		var old = this.scalars.copy();
		this.scalars.widening(other.scalars);
		if (this.scalars.equals(old)) {
			this.dicts.forEach((k, v) -> v.widening(other.dicts.get(k)));
		} else {
			this.dicts.forEach((k, v) -> v.join(other.dicts.get(k)));
		}
		return this;
	}

	@Override
	protected FularaState assignOne(Expression left, Expression right) {
		if (isBottom()) {
			return this;
		}

		var temps = new ArrayList<VariableIdentifier>();
		if (left instanceof VariableIdentifier d && this.dicts.containsKey(d)) {
			assignDictionary(d, right, temps);
		} else if (left instanceof Subscription s && s.getTarget() instanceof VariableIdentifier d && this.dicts.containsKey(d)) {
			var key = rewrite(s.getKey(), temps);
			var value = rewrite(right, temps);
			var k = key(d, key);
			var v = value(d, value);
			this.scalars.assign(Set.of(new Subscription(s.getType(), d, key)), Set.of(value));

			var lattice = this.dicts.get(d);
			if (k.isSingleton()) {
				lattice.partitionAdd(k, v);
			} else {
				lattice.partitionUpdate(List.of(new Segment<>(k, v)));
			}
		} else {
			var lhs = left instanceof VariableIdentifier ? left : rewrite(left, temps);
			var rhs = rewrite(right, temps);
			this.scalars.assign(Set.of(lhs), Set.of(rhs));
			if (this.numeric.contains(left)) {
				assignSegments((VariableIdentifier) left, rhs);
			}
		}
		removeTemporaries(temps);
		return this;
	}

	private void assignDictionary(VariableIdentifier d, Expression right, List<VariableIdentifier> temps) {
		var lattice = this.dicts.get(d);
		if (right instanceof VariableIdentifier source && this.dicts.containsKey(source)) {
			lattice.replace(this.dicts.get(source));
			this.scalars.assign(Set.of(d), Set.of(right));
		} else if (right instanceof DictDisplay display) {
			var keys = new ArrayList<Expression>();
			var values = new ArrayList<Expression>();
			for (int i = 0; i < display.getKeys().size(); ++i) {
				keys.add(rewrite(display.getKeys().get(i), temps));
				values.add(rewrite(display.getValues().get(i), temps));
			}

			lattice.emptyDict();
			for (int i = 0; i < keys.size(); ++i) {
				var k = key(d, keys.get(i));
				var v = value(d, values.get(i));
				if (k.isSingleton()) {
					lattice.partitionAdd(k, v);
				} else {
					lattice.partitionUpdate(List.of(new Segment<>(k, v)));
				}
			}
			this.scalars.assign(Set.of(d), Set.of(new DictDisplay(display.getType(), keys, values)));
		} else if (right instanceof Input) {
			lattice.top();
			this.scalars.assign(Set.of(d), Set.of(right));
		} else {
			throw new UnsupportedOperationException("Assignment of " + right + " to dictionary " + d + " is not supported");
		}
	}

	/**
	 * Carry a scalar assignment into every segment, or forget the variable
	 * there if the right-hand side is not over scalars alone.
	 */
	private void assignSegments(VariableIdentifier variable, Expression right) {
		var scalar = this.numeric.containsAll(Expressions.ids(right));
		for (var lattice : this.dicts.values()) {
			if (scalar) {
				for (var segment : lattice.getSegments()) {
					segment.getKey().getState().assign(Set.of(variable), Set.of(right));
					segment.getValue().getState().assign(Set.of(variable), Set.of(right));
				}
				lattice.normalize();
			} else {
				lattice.forgetVariable(variable);
			}
		}
	}

	@Override
	protected FularaState assumeOne(Expression condition, boolean backward) {
		if (isBottom()) {
			return this;
		}

		var temps = new ArrayList<VariableIdentifier>();
		var rewritten = rewrite(condition, temps);
		this.scalars.assume(Set.of(rewritten), backward);
		assumeMembers(Expressions.normalize(rewritten), backward);
		removeTemporaries(temps);
		if (this.scalars.isBottom()) {
			bottom();
		}
		return this;
	}

	/**
	 * Refine the elements of {@code element in d} conjuncts by the keys or
	 * values of the segments of {@code d}.
	 */
	private void assumeMembers(Expression condition, boolean backward) {
		if (this.scalars.isBottom()) {
			return;
		}

		if (condition instanceof BinaryBooleanOperation b && b.getOperator() == BinaryBooleanOperation.Operator.AND) {
			assumeMembers(b.getLeft(), backward);
			assumeMembers(b.getRight(), backward);
		} else if (condition instanceof BinaryComparisonOperation c
			&& c.getOperator() == BinaryComparisonOperation.Operator.IN
			&& c.getLeft() instanceof VariableIdentifier element
			&& this.scalars.getStore().contains(element)) {
			var members = members(c.getRight());
			if (members.isEmpty()) {
				return;
			}

			var store = this.scalars.getStore();
			store.put(element, store.get(element).copy().meet(members.get()));
			if (!backward && this.scalars.isInLoop() && this.numeric.contains(element)) {
				// The loop rebinds the element
				for (var lattice : this.dicts.values()) {
					lattice.forgetVariable(element);
				}
			}
		}
	}

	/**
	 * @return The join of the keys or values of a dictionary, if the
	 *         container is one we have segments for.
	 */
	private Optional<IntervalLattice> members(Expression container) {
		if (container instanceof KeysIdentifier k && this.dicts.containsKey(k.getContainer())) {
			return Optional.of(this.dicts.get(k.getContainer()).getKeysJoined().getInterval());
		} else if (container instanceof ValuesIdentifier v && this.dicts.containsKey(v.getContainer())) {
			return Optional.of(this.dicts.get(v.getContainer()).getValuesJoined().getInterval());
		} else if (container.getClass() == VariableIdentifier.class && this.dicts.containsKey(container)) {
			return Optional.of(this.dicts.get(container).getKeysJoined().getInterval());
		} else {
			return Optional.empty();
		}
	}

	@Override
	public FularaState enterIf() {
		this.scalars.enterIf();
		return this;
	}

	@Override
	public FularaState exitIf() {
		this.scalars.exitIf();
		return this;
	}

	@Override
	public FularaState enterLoop() {
		this.scalars.enterLoop();
		return this;
	}

	@Override
	public FularaState exitLoop() {
		this.scalars.exitLoop();
		return this;
	}

	@Override
	protected FularaState substituteOne(Expression left, Expression right) {
		throw new UnsupportedOperationException("Dictionary contents cannot be analyzed backwards");
	}

	@Override
	protected FularaState outputOne(Expression output) {
		return this;
	}

	/**
	 * Bind the scalars to their current values in a wrapped state.
	 */
	private void bind(IntervalState state) {
		for (var variable : this.numeric) {
			state.getStore().put(variable, this.scalars.get(variable).copy());
		}
	}

	private IntervalKeyWrapper key(VariableIdentifier d, Expression key) {
		var k = new IntervalKeyWrapper(this.numeric, d.getType().getElementType());
		bind(k.getState());
		return k.setInterval(this.scalars.evaluate(key));
	}

	private IntervalValueWrapper value(VariableIdentifier d, Expression value) {
		var v = new IntervalValueWrapper(this.numeric, d.getType().getValueType());
		bind(v.getState());
		return v.setInterval(this.scalars.evaluate(value));
	}

	/**
	 * @return The join of the values of every segment a key may fall into.
	 */
	private IntervalLattice read(VariableIdentifier d, Expression key) {
		var k = key(d, key);
		var result = new IntervalLattice().bottom();
		for (var segment : this.dicts.get(d).getSegments()) {
			if (segment.overlaps(k)) {
				result.join(segment.getValue().getInterval());
			}
		}
		return result;
	}

	private Expression rewrite(Expression expr, List<VariableIdentifier> temps) {
		return new DictionaryReads().rewrite(expr, temps);
	}

	/**
	 * Remove the temporaries, keeping the state bottom if a read was empty.
	 */
	private void removeTemporaries(List<VariableIdentifier> temps) {
		var empty = this.scalars.isBottom();
		for (var temp : temps) {
			this.scalars.removeVariable(temp);
		}
		if (empty) {
			bottom();
		}
	}

	/**
	 * Replaces dictionary reads with temporary scalar variables holding the
	 * values read.
	 */
	private final class DictionaryReads extends ExpressionRewriter<List<VariableIdentifier>> {
		@Override
		public Expression visitSubscription(Subscription expr, List<VariableIdentifier> temps) {
			if (expr.getTarget() instanceof VariableIdentifier d && dicts.containsKey(d)) {
				var key = rewrite(expr.getKey(), temps);
				var value = read(d, key);
				var temp = new VariableIdentifier(expr.getType(), temps.size() + "v");
				scalars.addVariable(temp);
				scalars.getStore().put(temp, value);
				temps.add(temp);
				return temp;
			}
			return super.visitSubscription(expr, temps);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof FularaState)) {
			return false;
		}

		var other = (FularaState) obj;
		return this.scalars.equals(other.scalars)
			&& this.dicts.equals(other.dicts);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.scalars, this.dicts);
	}

	@Override
	public String toString() {
		if (this.dicts.isEmpty()) {
			return this.scalars.toString();
		}
		return this.scalars + ", " + Joiner.on(", ").withKeyValueSeparator(" -> ").join(this.dicts);
	}
}
