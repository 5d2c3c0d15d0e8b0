package absint.fulara;

import absint.dataflow.IntervalLattice;
import absint.dataflow.IntervalState;
import absint.expr.VariableIdentifier;
import absint.type.PrimitiveType;
import absint.type.ValueType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Interval abstraction of dictionary keys.
 */
public final class IntervalKeyWrapper extends IntervalWrapper<IntervalKeyWrapper> implements KeyWrapper<IntervalKeyWrapper> {
	/** The name of the variable standing for a key. */
	public static final String KEY_NAME = "0v_k";

	/**
	 * Create the top key.
	 *
	 * @param scalars
	 *         The numeric scalar variables in scope.
	 * @param type
	 *         The (numeric) key type.
	 */
	public IntervalKeyWrapper(Collection<? extends VariableIdentifier> scalars, ValueType type) {
		super(scalars, new VariableIdentifier(type, KEY_NAME));
	}

	private IntervalKeyWrapper(VariableIdentifier variable, IntervalState state) {
		super(variable, state);
	}

	@Override
	protected IntervalKeyWrapper wrap(IntervalState state) {
		return new IntervalKeyWrapper(getVariable(), state);
	}

	private boolean isIntegral() {
		var type = getVariable().getType();
		return type == PrimitiveType.INT || type == PrimitiveType.BOOL;
	}

	/**
	 * Keys are split at the integers just outside the excluded interval, so
	 * only integral keys can be split.
	 */
	@Override
	public Optional<List<IntervalKeyWrapper>> decomp(IntervalKeyWrapper exclude) {
		if (!isIntegral()) {
			return Optional.empty();
		}

		var pieces = new ArrayList<IntervalKeyWrapper>(2);
		var key = getInterval();
		var ex = exclude.getInterval();
		if (key.isBottom() || ex.isTop()) {
			return Optional.of(pieces);
		} else if (ex.isBottom()) {
			pieces.add(copy());
			return Optional.of(pieces);
		}

		var left = IntervalLattice.of(key.getLower(), Math.min(key.getUpper(), ex.getLower() - 1));
		var right = IntervalLattice.of(Math.max(key.getLower(), ex.getUpper() + 1), key.getUpper());
		for (var piece : List.of(left, right)) {
			if (!piece.isBottom()) {
				pieces.add(copy().setInterval(piece));
			}
		}
		return Optional.of(pieces);
	}

	@Override
	public boolean isSingleton() {
		var key = getInterval();
		return !key.isBottom() && key.isSingleton();
	}

	@Override
	public boolean keyIsBottom() {
		return getInterval().isBottom();
	}

	@Override
	public int compareTo(IntervalKeyWrapper other) {
		var key = getInterval();
		var otherKey = other.getInterval();
		int ret = Double.compare(key.getLower(), otherKey.getLower());
		if (ret == 0) {
			ret = Double.compare(key.getUpper(), otherKey.getUpper());
		}
		return ret;
	}
}
