package absint.fulara;

import absint.dataflow.Environment;
import absint.dataflow.IntervalLattice;
import absint.dataflow.IntervalState;
import absint.dataflow.Lattice;
import absint.expr.VariableIdentifier;

import com.google.common.base.Preconditions;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * An interval state over the scalar variables plus one reserved variable
 * that stands for a dictionary key or value.
 */
abstract class IntervalWrapper<W extends IntervalWrapper<W>> implements Lattice<W>, Environment {
	private final VariableIdentifier variable;
	private final IntervalState state;

	protected IntervalWrapper(Collection<? extends VariableIdentifier> scalars, VariableIdentifier variable) {
		Preconditions.checkArgument(variable.getType().isNumeric(), "Expected a numeric type for %s", variable);
		this.variable = variable;
		var variables = new LinkedHashSet<VariableIdentifier>(scalars);
		variables.add(variable);
		this.state = new IntervalState(variables);
	}

	protected IntervalWrapper(VariableIdentifier variable, IntervalState state) {
		this.variable = variable;
		this.state = state;
	}

	/**
	 * @return A wrapper of the same kind around the given state.
	 */
	protected abstract W wrap(IntervalState state);

	@SuppressWarnings("unchecked")
	private W self() {
		return (W) this;
	}

	/**
	 * @return The reserved variable.
	 */
	public VariableIdentifier getVariable() {
		return this.variable;
	}

	/**
	 * @return The wrapped state.  Updates to it update this wrapper.
	 */
	public IntervalState getState() {
		return this.state;
	}

	/**
	 * @return The interval of the reserved variable.
	 */
	public IntervalLattice getInterval() {
		return this.state.get(this.variable);
	}

	/**
	 * Set the interval of the reserved variable.
	 */
	public W setInterval(IntervalLattice interval) {
		this.state.getStore().put(this.variable, interval.copy());
		return self();
	}

	@Override
	public void addVariable(VariableIdentifier variable) {
		Preconditions.checkArgument(!variable.equals(this.variable), "%s is reserved", variable);
		this.state.addVariable(variable);
	}

	@Override
	public void removeVariable(VariableIdentifier variable) {
		Preconditions.checkArgument(!variable.equals(this.variable), "%s is reserved", variable);
		this.state.removeVariable(variable);
	}

	/**
	 * Variables this wrapper does not track are ignored.
	 */
	@Override
	public void forgetVariable(VariableIdentifier variable) {
		if (this.state.getStore().contains(variable)) {
			this.state.forgetVariable(variable);
		}
	}

	@Override
	public W bottom() {
		this.state.bottom();
		return self();
	}

	@Override
	public W top() {
		this.state.top();
		return self();
	}

	@Override
	public boolean isBottom() {
		return this.state.isBottom();
	}

	@Override
	public boolean isTop() {
		return this.state.isTop();
	}

	@Override
	public W copy() {
		return wrap(this.state.copy());
	}

	@Override
	public W replace(W other) {
		this.state.replace(other.getState());
		return self();
	}

	@Override
	public boolean properLessEqual(W other) {
		return this.state.lessEqual(other.getState());
	}

	@Override
	public W properJoin(W other) {
		this.state.join(other.getState());
		return self();
	}

	@Override
	public W properMeet(W other) {
		this.state.meet(other.getState());
		return self();
	}

	@Override
	public W properWidening(W other) {
		this.state.widening(other.getState());
		return self();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj == null || obj.getClass() != getClass()) {
			return false;
		}

		var other = (IntervalWrapper<?>) obj;
		return this.variable.equals(other.variable)
			&& this.state.equals(other.state);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), this.variable, this.state);
	}

	@Override
	public String toString() {
		return getInterval().toString();
	}
}
