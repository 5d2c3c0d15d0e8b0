package absint.fulara;

import absint.dataflow.Environment;
import absint.dataflow.Lattice;

/**
 * An abstraction of a set of dictionary values, usable as the value of a
 * {@link FularaLattice} segment.
 */
public interface ValueWrapper<V extends ValueWrapper<V>> extends Lattice<V>, Environment {
	/**
	 * @return Whether this value stands for no concrete value.
	 */
	boolean valueIsBottom();
}
