package absint.fulara;

import absint.dataflow.Environment;
import absint.dataflow.Lattice;

import java.util.List;
import java.util.Optional;

/**
 * An abstraction of a set of dictionary keys, usable as the key of a
 * {@link FularaLattice} segment.
 *
 * Keys are ordered for printing; the order has no semantic meaning.
 */
public interface KeyWrapper<K extends KeyWrapper<K>> extends Lattice<K>, Environment, Comparable<K> {
	/**
	 * Split this key around another one.
	 *
	 * @return Keys covering every concrete key of this one that is not a
	 *         concrete key of {@code exclude} (none of them bottom), or
	 *         empty if the domain cannot compute such a split.
	 */
	Optional<List<K>> decomp(K exclude);

	/**
	 * @return Whether this key stands for exactly one concrete key.
	 */
	boolean isSingleton();

	/**
	 * @return Whether this key stands for no concrete key.  Unlike
	 *         {@link #isBottom()}, this ignores the rest of the state.
	 */
	boolean keyIsBottom();
}
