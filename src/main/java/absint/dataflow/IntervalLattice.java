package absint.dataflow;

import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;

/**
 * The interval lattice over the extended reals.
 */
public final class IntervalLattice implements Arithmetic<IntervalLattice>, BooleanLattice<IntervalLattice> {
	private static final double INF = Double.POSITIVE_INFINITY;

	// Represents the set of numbers
	//
	//     {x | lower <= x <= upper}
	//
	// with lower, upper ∈ ℝ ∪ {-∞, +∞}.  Every empty interval is encoded as
	// the canonical bottom element lower == +∞, upper == -∞.
	private double lower;
	private double upper;

	/**
	 * Create the top element [-∞, +∞].
	 */
	public IntervalLattice() {
		this(-INF, INF);
	}

	/**
	 * Create [lower, upper], or bottom if that interval is empty.
	 */
	public IntervalLattice(double lower, double upper) {
		set(lower, upper);
	}

	/**
	 * @return The interval [lower, upper].
	 */
	public static IntervalLattice of(double lower, double upper) {
		return new IntervalLattice(lower, upper);
	}

	/**
	 * @return The interval [value, value].
	 */
	public static IntervalLattice constant(double value) {
		return new IntervalLattice(value, value);
	}

	/**
	 * @return The interval [lower, +∞].
	 */
	public static IntervalLattice atLeast(double lower) {
		return new IntervalLattice(lower, INF);
	}

	/**
	 * @return The interval [-∞, upper].
	 */
	public static IntervalLattice atMost(double upper) {
		return new IntervalLattice(-INF, upper);
	}

	private IntervalLattice set(double lower, double upper) {
		if (lower <= upper && lower != INF && upper != -INF) {
			// Adding 0.0 turns -0.0 into 0.0
			this.lower = lower + 0.0;
			this.upper = upper + 0.0;
		} else {
			this.lower = INF;
			this.upper = -INF;
		}
		return this;
	}

	public double getLower() {
		return this.lower;
	}

	public double getUpper() {
		return this.upper;
	}

	/**
	 * @return Whether this interval contains the given number.
	 */
	public boolean contains(double value) {
		return this.lower <= value && value <= this.upper;
	}

	/**
	 * @return Whether this interval holds exactly one number.
	 */
	public boolean isSingleton() {
		return this.lower == this.upper;
	}

	@Override
	public IntervalLattice bottom() {
		return set(INF, -INF);
	}

	@Override
	public IntervalLattice top() {
		return set(-INF, INF);
	}

	@Override
	public boolean isBottom() {
		return this.lower > this.upper;
	}

	@Override
	public boolean isTop() {
		return this.lower == -INF && this.upper == INF;
	}

	@Override
	public IntervalLattice copy() {
		return new IntervalLattice(this.lower, this.upper);
	}

	@Override
	public IntervalLattice replace(IntervalLattice other) {
		this.lower = other.lower;
		this.upper = other.upper;
		return this;
	}

	@Override
	public boolean properLessEqual(IntervalLattice other) {
		return other.lower <= this.lower && this.upper <= other.upper;
	}

	@Override
	public IntervalLattice properJoin(IntervalLattice other) {
		return set(Math.min(this.lower, other.lower), Math.max(this.upper, other.upper));
	}

	@Override
	public IntervalLattice properMeet(IntervalLattice other) {
		return set(Math.max(this.lower, other.lower), Math.min(this.upper, other.upper));
	}

	@Override
	public IntervalLattice properWidening(IntervalLattice other) {
		var lower = other.lower < this.lower ? -INF : this.lower;
		var upper = this.upper < other.upper ? INF : this.upper;
		return set(lower, upper);
	}

	@Override
	public IntervalLattice properNeg() {
		return set(-this.upper, -this.lower);
	}

	@Override
	public IntervalLattice properAdd(IntervalLattice other) {
		return set(this.lower + other.lower, this.upper + other.upper);
	}

	@Override
	public IntervalLattice properSub(IntervalLattice other) {
		return set(this.lower - other.upper, this.upper - other.lower);
	}

	/** Multiplication where 0 * ∞ == 0. */
	private static double times(double a, double b) {
		if (a == 0 || b == 0) {
			return 0;
		} else {
			return a * b;
		}
	}

	@Override
	public IntervalLattice properMult(IntervalLattice other) {
		double a = times(this.lower, other.lower);
		double b = times(this.lower, other.upper);
		double c = times(this.upper, other.lower);
		double d = times(this.upper, other.upper);
		return set(Math.min(Math.min(a, b), Math.min(c, d)), Math.max(Math.max(a, b), Math.max(c, d)));
	}

	/**
	 * Division is not modelled; the result is top.
	 */
	@Override
	public IntervalLattice properDiv(IntervalLattice other) {
		return top();
	}

	/**
	 * Modulo is not modelled; the result is top.
	 */
	@Override
	public IntervalLattice properMod(IntervalLattice other) {
		return top();
	}

	@Override
	public IntervalLattice makeFalse() {
		return set(0, 0);
	}

	@Override
	public IntervalLattice makeTrue() {
		return set(1, 1);
	}

	@Override
	public IntervalLattice makeMaybe() {
		return set(0, 1);
	}

	@Override
	public boolean isFalse() {
		return this.lower == 0 && this.upper == 0;
	}

	@Override
	public boolean isTrue() {
		return this.lower == 1 && this.upper == 1;
	}

	@Override
	public boolean isMaybe() {
		return this.lower == 0 && this.upper == 1;
	}

	@Override
	public IntervalLattice complement() {
		if (isBottom()) {
			return this;
		}
		return set(1 - this.upper, 1 - this.lower);
	}

	@Override
	public IntervalLattice conjunction(IntervalLattice other) {
		if (isBottom() || other.isBottom()) {
			return bottom();
		}
		return set(Math.min(this.lower, other.lower), Math.min(this.upper, other.upper));
	}

	@Override
	public IntervalLattice disjunction(IntervalLattice other) {
		if (isBottom() || other.isBottom()) {
			return bottom();
		}
		return set(Math.max(this.lower, other.lower), Math.max(this.upper, other.upper));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof IntervalLattice)) {
			return false;
		}

		var other = (IntervalLattice) obj;
		return this.lower == other.lower
			&& this.upper == other.upper;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(this.lower) + Double.hashCode(this.upper);
	}

	private static String format(double bound) {
		if (bound == INF) {
			return "inf";
		} else if (bound == -INF) {
			return "-inf";
		} else if (bound == Math.rint(bound)) {
			return Long.toString((long) bound);
		} else {
			return Double.toString(bound);
		}
	}

	@Override
	public String toString() {
		if (isBottom()) {
			return "⊥";
		} else {
			return "[" + format(this.lower) + ", " + format(this.upper) + "]";
		}
	}

	private static final boolean CHECK = IntervalLattice.class.desiredAssertionStatus();
	private static final long CHECK_MIN = -4;
	private static final long CHECK_MAX = 4;

	/**
	 * Check that an interval operator contains the concrete result for every
	 * pair of numbers drawn from small intervals.
	 */
	private static void checkBinary(DoubleBinaryOperator f, BinaryOperator<IntervalLattice> g) {
		for (long a = CHECK_MIN; a <= CHECK_MAX; ++a) {
			for (long b = a; b <= CHECK_MAX; ++b) {
				for (long c = CHECK_MIN; c <= CHECK_MAX; ++c) {
					for (long d = c; d <= CHECK_MAX; ++d) {
						var result = g.apply(of(a, b), of(c, d));
						for (long x = a; x <= b; ++x) {
							for (long y = c; y <= d; ++y) {
								assert result.contains(f.applyAsDouble(x, y));
							}
						}
					}
				}
			}
		}
	}

	static {
		if (CHECK) {
			checkBinary((x, y) -> x + y, (l, r) -> l.copy().add(r));
			checkBinary((x, y) -> x - y, (l, r) -> l.copy().sub(r));
			checkBinary((x, y) -> x * y, (l, r) -> l.copy().mult(r));

			assert of(2, 4).mult(of(1, 3)).equals(of(2, 12));
			assert of(0, 0).mult(new IntervalLattice()).equals(constant(0));
			assert constant(0).neg().equals(constant(0));
		}
	}
}
