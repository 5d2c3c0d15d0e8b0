package absint.util;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * A FIFO queue for work-list algorithms that holds each item at most once.
 */
public final class WorkList<T> {
	private final ArrayDeque<T> deque = new ArrayDeque<>();
	private final Set<T> set = new HashSet<>();

	/**
	 * @return Whether any items are in the list.
	 */
	public boolean isEmpty() {
		return this.deque.isEmpty();
	}

	/**
	 * @return The number of pending items.
	 */
	public int size() {
		return this.deque.size();
	}

	/**
	 * @return Whether this list already contains the item.
	 */
	public boolean contains(T item) {
		return this.set.contains(item);
	}

	/**
	 * Add an item to the back of the queue.
	 *
	 * @return Whether a new item was added.
	 */
	public boolean addLast(T item) {
		if (this.set.add(item)) {
			this.deque.addLast(item);
			return true;
		} else {
			return false;
		}
	}

	/**
	 * Pop an element from the front of the queue.
	 */
	public T removeFirst() {
		var ret = this.deque.removeFirst();
		this.set.remove(ret);
		return ret;
	}
}
