package absint.dataflow;

import absint.expr.Expression;
import absint.stmt.ProgramPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An analysis state: a lattice element with statement transformers.
 *
 * Evaluating a statement leaves the expressions it denotes in
 * {@link #getResult()}; the transformers consume them.
 */
public abstract class State<T extends State<T>> implements Lattice<T> {
	private Set<Expression> result = new LinkedHashSet<>();
	private ProgramPoint pp;
	private State<?> precursory;

	protected State() {
	}

	/**
	 * Copy the evaluation context (result, program point and precursory
	 * state) of another state.
	 */
	protected State(State<?> other) {
		this.result = new LinkedHashSet<>(other.result);
		this.pp = other.pp;
		this.precursory = other.precursory;
	}

	@SuppressWarnings("unchecked")
	protected final T self() {
		return (T) this;
	}

	/**
	 * @return The expressions computed by the last evaluation.
	 */
	public Set<Expression> getResult() {
		return Collections.unmodifiableSet(this.result);
	}

	public T setResult(Set<? extends Expression> result) {
		this.result = new LinkedHashSet<>(result);
		return self();
	}

	/**
	 * @return The program point of the statement being processed.
	 */
	public ProgramPoint getProgramPoint() {
		return this.pp;
	}

	/**
	 * @return The state a precursory analysis computed for the current
	 *         statement, or (for an initial state) the initial state of the
	 *         precursory analysis.  Null if there is none.
	 */
	public State<?> getPrecursory() {
		return this.precursory;
	}

	public T setPrecursory(State<?> precursory) {
		this.precursory = precursory;
		return self();
	}

	/**
	 * Assignment of a single right-hand side to a single left-hand side.
	 */
	protected abstract T assignOne(Expression left, Expression right);

	/**
	 * Restriction to the states satisfying a single condition.
	 */
	protected abstract T assumeOne(Expression condition, boolean backward);

	/**
	 * Backward assignment of a single right-hand side.
	 */
	protected abstract T substituteOne(Expression left, Expression right);

	/**
	 * Observation of a single expression.
	 */
	protected abstract T outputOne(Expression output);

	/**
	 * Assign every right-hand side to every left-hand side, joining the
	 * outcomes.
	 */
	public T assign(Set<Expression> left, Set<Expression> right) {
		var states = new ArrayList<T>();
		for (var lhs : left) {
			for (var rhs : right) {
				states.add(copy().assignOne(lhs, rhs));
			}
		}
		bigJoin(states);
		this.result.clear();
		return self();
	}

	/**
	 * Assume that at least one of the conditions holds.
	 */
	public T assume(Set<Expression> conditions, boolean backward) {
		var states = new ArrayList<T>();
		for (var condition : conditions) {
			states.add(copy().assumeOne(condition, backward));
		}
		bigJoin(states);
		this.result.clear();
		return self();
	}

	/**
	 * Substitute every right-hand side for every left-hand side, joining the
	 * outcomes.
	 */
	public T substitute(Set<Expression> left, Set<Expression> right) {
		var states = new ArrayList<T>();
		for (var lhs : left) {
			for (var rhs : right) {
				states.add(copy().substituteOne(lhs, rhs));
			}
		}
		bigJoin(states);
		this.result.clear();
		return self();
	}

	/**
	 * Record that the expressions are observed (e.g. printed).
	 */
	public T output(Set<Expression> output) {
		var states = new ArrayList<T>();
		for (var expr : output) {
			states.add(copy().outputOne(expr));
		}
		bigJoin(states);
		this.result.clear();
		return self();
	}

	/**
	 * Assume the current result, then clear it.
	 */
	public T filter(boolean backward) {
		assume(new LinkedHashSet<>(this.result), backward);
		this.result.clear();
		return self();
	}

	/**
	 * Bind the program point and precursory state before a statement.
	 */
	public T before(ProgramPoint pp, State<?> precursory) {
		this.pp = pp;
		this.precursory = precursory;
		return self();
	}

	/**
	 * An error was raised: this path is infeasible.
	 */
	public T raiseError() {
		return bottom();
	}

	/**
	 * Called when entering a branch.  Does nothing for flat domains.
	 */
	public T enterIf() {
		return self();
	}

	/**
	 * Called when leaving a branch.  Does nothing for flat domains.
	 */
	public T exitIf() {
		return self();
	}

	/**
	 * Called when entering a loop body.  Does nothing for flat domains.
	 */
	public T enterLoop() {
		return self();
	}

	/**
	 * Called when leaving a loop.  Does nothing for flat domains.
	 */
	public T exitLoop() {
		return self();
	}
}
