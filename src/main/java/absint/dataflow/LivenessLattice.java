package absint.dataflow;

import java.util.Objects;

/**
 * The two-element liveness lattice, {@code Dead ⊑ Live}.
 */
public final class LivenessLattice implements Lattice<LivenessLattice> {
	/**
	 * Liveness status of a variable.
	 */
	public enum Status {
		DEAD,
		LIVE,
	}

	private Status status;

	/**
	 * Create a dead element.
	 */
	public LivenessLattice() {
		this(Status.DEAD);
	}

	public LivenessLattice(Status status) {
		this.status = Objects.requireNonNull(status);
	}

	public Status getStatus() {
		return this.status;
	}

	@Override
	public LivenessLattice bottom() {
		this.status = Status.DEAD;
		return this;
	}

	@Override
	public LivenessLattice top() {
		this.status = Status.LIVE;
		return this;
	}

	@Override
	public boolean isBottom() {
		return this.status == Status.DEAD;
	}

	@Override
	public boolean isTop() {
		return this.status == Status.LIVE;
	}

	@Override
	public LivenessLattice copy() {
		return new LivenessLattice(this.status);
	}

	@Override
	public LivenessLattice replace(LivenessLattice other) {
		this.status = other.status;
		return this;
	}

	// Every element is bottom or top, so the generic wrappers decide
	// everything and these are never reached

	@Override
	public boolean properLessEqual(LivenessLattice other) {
		return this.status.compareTo(other.status) <= 0;
	}

	@Override
	public LivenessLattice properJoin(LivenessLattice other) {
		if (other.status.compareTo(this.status) > 0) {
			this.status = other.status;
		}
		return this;
	}

	@Override
	public LivenessLattice properMeet(LivenessLattice other) {
		if (other.status.compareTo(this.status) < 0) {
			this.status = other.status;
		}
		return this;
	}

	@Override
	public LivenessLattice properWidening(LivenessLattice other) {
		return properJoin(other);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof LivenessLattice)) {
			return false;
		}

		var other = (LivenessLattice) obj;
		return this.status == other.status;
	}

	@Override
	public int hashCode() {
		return this.status.hashCode();
	}

	@Override
	public String toString() {
		return isTop() ? "Live" : "Dead";
	}
}
