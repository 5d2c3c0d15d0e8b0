package absint.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Counter/multiset with long counts.
 */
public final class Counter<T> {
	private final Map<T, Long> map = new HashMap<>();

	/**
	 * @return The count for a key.
	 */
	public long get(T key) {
		return this.map.getOrDefault(key, 0L);
	}

	/**
	 * Add to the count for a key.
	 */
	public void add(T key, long count) {
		this.map.merge(key, count, Long::sum);
	}

	/**
	 * Increment the count for a key.
	 */
	public void increment(T key) {
		add(key, 1);
	}

	/**
	 * @return The largest count of any key.
	 */
	public long max() {
		return this.map.values()
			.stream()
			.mapToLong(Long::longValue)
			.max()
			.orElse(0);
	}

	@Override
	public String toString() {
		return this.map.toString();
	}
}
