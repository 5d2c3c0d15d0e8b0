package absint.dataflow;

import java.util.Collection;

/**
 * A mutable lattice element.
 *
 * The lattice operations update the receiver in place and return it.  The
 * generic wrappers {@link #lessEqual}, {@link #join}, {@link #meet} and
 * {@link #widening} handle bottom and top operands themselves, so the
 * {@code proper*} hooks only ever see two elements that are neither.
 */
public interface Lattice<T extends Lattice<T>> {
	/**
	 * Make this the bottom element.
	 */
	T bottom();

	/**
	 * Make this the top element.
	 */
	T top();

	/**
	 * @return Whether this is the bottom element.
	 */
	boolean isBottom();

	/**
	 * @return Whether this is the top element.
	 */
	boolean isTop();

	/**
	 * @return An independent deep copy of this element.
	 */
	T copy();

	/**
	 * Overwrite this element with (a copy of) another one.
	 */
	T replace(T other);

	/**
	 * {@link #lessEqual} for proper elements.
	 */
	boolean properLessEqual(T other);

	/**
	 * {@link #join} for proper elements.
	 */
	T properJoin(T other);

	/**
	 * {@link #meet} for proper elements.
	 */
	T properMeet(T other);

	/**
	 * {@link #widening} for proper elements.
	 */
	T properWidening(T other);

	@SuppressWarnings("unchecked")
	private T self() {
		return (T) this;
	}

	/**
	 * @return Whether this element is less than or equal to another one.
	 */
	default boolean lessEqual(T other) {
		if (isBottom() || other.isTop()) {
			return true;
		} else if (other.isBottom() || isTop()) {
			return false;
		} else {
			return properLessEqual(other);
		}
	}

	/**
	 * Compute the least upper bound of this and another element.
	 */
	default T join(T other) {
		if (isBottom() || other.isTop()) {
			return replace(other);
		} else if (other.isBottom() || isTop()) {
			return self();
		} else {
			return properJoin(other);
		}
	}

	/**
	 * Compute the greatest lower bound of this and another element.
	 */
	default T meet(T other) {
		if (isTop() || other.isBottom()) {
			return replace(other);
		} else if (other.isTop() || isBottom()) {
			return self();
		} else {
			return properMeet(other);
		}
	}

	/**
	 * Over-approximate the join of this and another element, such that
	 * increasing chains of widenings stabilize.
	 */
	default T widening(T other) {
		if (isBottom() || other.isTop()) {
			return replace(other);
		} else if (other.isBottom() || isTop()) {
			return self();
		} else {
			return properWidening(other);
		}
	}

	/**
	 * Make this the join of all the given elements.
	 */
	default T bigJoin(Collection<? extends T> elements) {
		bottom();
		for (var element : elements) {
			join(element);
		}
		return self();
	}

	/**
	 * Make this the meet of all the given elements.
	 */
	default T bigMeet(Collection<? extends T> elements) {
		top();
		for (var element : elements) {
			meet(element);
		}
		return self();
	}
}
