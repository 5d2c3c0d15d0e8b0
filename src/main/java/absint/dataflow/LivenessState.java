package absint.dataflow;

import absint.expr.DerivedIdentifier;
import absint.expr.Expression;
import absint.expr.Expressions;
import absint.expr.Literal;
import absint.expr.Slicing;
import absint.expr.Subscription;
import absint.expr.VariableIdentifier;

import java.util.Collection;
import java.util.Objects;

/**
 * Strongly live variable analysis state.
 *
 * A variable is strongly live if it is used in an assignment to another
 * strongly live variable, or in a statement other than an assignment.
 * Containers are summarized: an update to one element keeps the container
 * live.  This is a backward analysis only.
 */
public final class LivenessState extends State<LivenessState> {
	private final Store<LivenessLattice> store;

	public LivenessState(Collection<? extends VariableIdentifier> variables) {
		this.store = new Store<>(variables, type -> new LivenessLattice());
	}

	private LivenessState(LivenessState other) {
		super(other);
		this.store = other.store.copy();
	}

	/**
	 * @return The liveness of a variable.
	 */
	public LivenessLattice get(VariableIdentifier variable) {
		return this.store.get(variable);
	}

	/**
	 * @return Whether a variable is strongly live.
	 */
	public boolean isLive(VariableIdentifier variable) {
		return this.store.get(variable).isTop();
	}

	/**
	 * Derived identifiers ({@code len(xs)}, ...) are uses of their container.
	 */
	private static VariableIdentifier base(VariableIdentifier id) {
		while (id instanceof DerivedIdentifier) {
			id = ((DerivedIdentifier) id).getContainer();
		}
		return id;
	}

	private void makeLive(Expression expr) {
		for (var id : Expressions.ids(expr)) {
			this.store.get(base(id)).top();
		}
	}

	@Override
	public LivenessState bottom() {
		this.store.bottom();
		return this;
	}

	@Override
	public LivenessState top() {
		this.store.top();
		return this;
	}

	/**
	 * The state is bottom if every variable is dead.
	 */
	@Override
	public boolean isBottom() {
		return this.store.getVariables()
			.stream()
			.allMatch(v -> this.store.get(v).isBottom());
	}

	@Override
	public boolean isTop() {
		return this.store.isTop();
	}

	@Override
	public LivenessState copy() {
		return new LivenessState(this);
	}

	@Override
	public LivenessState replace(LivenessState other) {
		this.store.replace(other.store);
		return this;
	}

	@Override
	public boolean properLessEqual(LivenessState other) {
		return this.store.properLessEqual(other.store);
	}

	@Override
	public LivenessState properJoin(LivenessState other) {
		this.store.properJoin(other.store);
		return this;
	}

	@Override
	public LivenessState properMeet(LivenessState other) {
		this.store.properMeet(other.store);
		return this;
	}

	@Override
	public LivenessState properWidening(LivenessState other) {
		this.store.properJoin(other.store);
		return this;
	}

	@Override
	protected LivenessState assignOne(Expression left, Expression right) {
		throw new UnsupportedOperationException("Unexpected assignment in a backward analysis");
	}

	@Override
	protected LivenessState assumeOne(Expression condition, boolean backward) {
		makeLive(condition);
		return this;
	}

	@Override
	protected LivenessState substituteOne(Expression left, Expression right) {
		if (left instanceof VariableIdentifier v) {
			var element = this.store.get(base(v));
			if (element.isTop()) {
				element.bottom();
				makeLive(right);
			}
		} else if (left instanceof Subscription s && s.getTarget() instanceof VariableIdentifier target) {
			if (isLive(target)) {
				// Weak update: the rest of the container stays live
				makeLive(right);
				var key = s.getKey();
				if (!(key instanceof Literal)) {
					makeLive(key);
				}
			}
		} else if (left instanceof Slicing s && s.getTarget() instanceof VariableIdentifier target) {
			if (isLive(target)) {
				makeLive(right);
				for (var child : s.getChildren()) {
					makeLive(child);
				}
			}
		} else {
			throw new UnsupportedOperationException("Substitution of " + left + " is not supported");
		}
		return this;
	}

	@Override
	protected LivenessState outputOne(Expression output) {
		makeLive(output);
		return this;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof LivenessState)) {
			return false;
		}

		var other = (LivenessState) obj;
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
