package absint.dataflow;

/**
 * A lattice with arithmetic operators.  Bottom operands propagate.
 */
public interface Arithmetic<T extends Arithmetic<T>> extends Lattice<T> {
	T properNeg();

	T properAdd(T other);

	T properSub(T other);

	T properMult(T other);

	T properDiv(T other);

	T properMod(T other);

	@SuppressWarnings("unchecked")
	private T self() {
		return (T) this;
	}

	/** this = -this */
	default T neg() {
		return isBottom() ? self() : properNeg();
	}

	/** this = this + other */
	default T add(T other) {
		if (isBottom()) {
			return self();
		} else if (other.isBottom()) {
			return replace(other);
		} else {
			return properAdd(other);
		}
	}

	/** this = this - other */
	default T sub(T other) {
		if (isBottom()) {
			return self();
		} else if (other.isBottom()) {
			return replace(other);
		} else {
			return properSub(other);
		}
	}

	/** this = this * other */
	default T mult(T other) {
		if (isBottom()) {
			return self();
		} else if (other.isBottom()) {
			return replace(other);
		} else {
			return properMult(other);
		}
	}

	/** this = this / other */
	default T div(T other) {
		if (isBottom()) {
			return self();
		} else if (other.isBottom()) {
			return replace(other);
		} else {
			return properDiv(other);
		}
	}

	/** this = this % other */
	default T mod(T other) {
		if (isBottom()) {
			return self();
		} else if (other.isBottom()) {
			return replace(other);
		} else {
			return properMod(other);
		}
	}
}
