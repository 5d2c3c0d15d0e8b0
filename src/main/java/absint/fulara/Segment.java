package absint.fulara;

import java.util.Objects;

/**
 * An abstract segment: a set of keys, all mapped to values from a set.
 */
public final class Segment<K extends KeyWrapper<K>, V extends ValueWrapper<V>> {
	private final K key;
	private final V value;

	public Segment(K key, V value) {
		this.key = Objects.requireNonNull(key);
		this.value = Objects.requireNonNull(value);
	}

	public K getKey() {
		return this.key;
	}

	public V getValue() {
		return this.value;
	}

	/**
	 * @return Whether the keys of this segment intersect another key.
	 */
	public boolean overlaps(K other) {
		return !this.key.copy().meet(other).keyIsBottom();
	}

	/**
	 * @return Whether either component is bottom.
	 */
	public boolean isEmpty() {
		return this.key.isBottom() || this.value.isBottom();
	}

	/**
	 * @return A deep copy of this segment.
	 */
	public Segment<K, V> copy() {
		return new Segment<>(this.key.copy(), this.value.copy());
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Segment)) {
			return false;
		}

		var other = (Segment<?, ?>) obj;
		return this.key.equals(other.key)
			&& this.value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.key, this.value);
	}

	@Override
	public String toString() {
		return "(" + this.key + ", " + this.value + ")";
	}
}
