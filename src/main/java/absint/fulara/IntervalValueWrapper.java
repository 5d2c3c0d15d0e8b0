package absint.fulara;

import absint.dataflow.IntervalState;
import absint.expr.VariableIdentifier;
import absint.type.ValueType;

import java.util.Collection;

/**
 * Interval abstraction of dictionary values.
 */
public final class IntervalValueWrapper extends IntervalWrapper<IntervalValueWrapper> implements ValueWrapper<IntervalValueWrapper> {
	/** The name of the variable standing for a value. */
	public static final String VALUE_NAME = "0v_v";

	/**
	 * Create the top value.
	 *
	 * @param scalars
	 *         The numeric scalar variables in scope.
	 * @param type
	 *         The (numeric) value type.
	 */
	public IntervalValueWrapper(Collection<? extends VariableIdentifier> scalars, ValueType type) {
		super(scalars, new VariableIdentifier(type, VALUE_NAME));
	}

	private IntervalValueWrapper(VariableIdentifier variable, IntervalState state) {
		super(variable, state);
	}

	@Override
	protected IntervalValueWrapper wrap(IntervalState state) {
		return new IntervalValueWrapper(getVariable(), state);
	}

	@Override
	public boolean valueIsBottom() {
		return getInterval().isBottom();
	}
}
