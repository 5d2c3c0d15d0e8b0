package absint.dataflow;

/**
 * A lattice that can represent truth values.
 */
public interface BooleanLattice<T extends BooleanLattice<T>> extends Lattice<T> {
	/** Make this the abstraction of false. */
	T makeFalse();

	/** Make this the abstraction of true. */
	T makeTrue();

	/** Make this the abstraction of "either". */
	T makeMaybe();

	boolean isFalse();

	boolean isTrue();

	boolean isMaybe();

	/** this = not this */
	T complement();

	/** this = this and other */
	T conjunction(T other);

	/** this = this or other */
	T disjunction(T other);
}
