package absint.fulara;

import absint.dataflow.Lattice;
import absint.expr.VariableIdentifier;
import absint.util.Log;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The Fulara lattice: a dictionary abstracted by a set of segments.
 *
 * Each segment {@code (k, v)} says that the dictionary may map the keys in
 * {@code k} to values in {@code v}.  Segments never overlap (the meet of any
 * two keys is empty) and have no empty component.  The top element is the
 * single segment {@code (⊤, ⊤)}; the empty set of segments is the empty
 * dictionary, which is distinct from bottom (an unreachable state).
 */
public final class FularaLattice<K extends KeyWrapper<K>, V extends ValueWrapper<V>> implements Lattice<FularaLattice<K, V>> {
	private final Supplier<K> keys;
	private final Supplier<V> values;
	private List<Segment<K, V>> segments;
	private boolean bottom;

	/**
	 * Create the top element.
	 *
	 * @param keys
	 *         Creates a fresh top key.
	 * @param values
	 *         Creates a fresh top value.
	 */
	public FularaLattice(Supplier<K> keys, Supplier<V> values) {
		this.keys = keys;
		this.values = values;
		this.segments = new ArrayList<>();
		top();
	}

	private FularaLattice(FularaLattice<K, V> other) {
		this.keys = other.keys;
		this.values = other.values;
		this.segments = copyAll(other.segments);
		this.bottom = other.bottom;
	}

	private static <K extends KeyWrapper<K>, V extends ValueWrapper<V>> List<Segment<K, V>> copyAll(Collection<Segment<K, V>> segments) {
		var ret = new ArrayList<Segment<K, V>>(segments.size());
		for (var segment : segments) {
			ret.add(segment.copy());
		}
		return ret;
	}

	/**
	 * @return The segments of this element.  Their components may be updated
	 *         in place, followed by {@link #normalize()}.
	 */
	public List<Segment<K, V>> getSegments() {
		return Collections.unmodifiableList(this.segments);
	}

	/**
	 * Make this the empty dictionary.
	 */
	public FularaLattice<K, V> emptyDict() {
		this.segments.clear();
		this.bottom = false;
		return this;
	}

	/**
	 * @return Whether this is the empty dictionary.
	 */
	public boolean isEmptyDict() {
		return !this.bottom && this.segments.isEmpty();
	}

	@Override
	public FularaLattice<K, V> bottom() {
		this.segments.clear();
		this.bottom = true;
		return this;
	}

	@Override
	public FularaLattice<K, V> top() {
		this.segments.clear();
		this.segments.add(new Segment<>(this.keys.get().top(), this.values.get().top()));
		this.bottom = false;
		return this;
	}

	@Override
	public boolean isBottom() {
		return this.bottom;
	}

	@Override
	public boolean isTop() {
		if (this.bottom || this.segments.size() != 1) {
			return false;
		}
		var segment = this.segments.get(0);
		return segment.getKey().isTop() && segment.getValue().isTop();
	}

	@Override
	public FularaLattice<K, V> copy() {
		return new FularaLattice<>(this);
	}

	@Override
	public FularaLattice<K, V> replace(FularaLattice<K, V> other) {
		if (other != this) {
			this.segments = copyAll(other.segments);
			this.bottom = other.bottom;
		}
		return this;
	}

	/**
	 * Every segment must be contained in the (unique) segment of the other
	 * element it overlaps.
	 */
	@Override
	public boolean properLessEqual(FularaLattice<K, V> other) {
		if (ImmutableSet.copyOf(this.segments).equals(ImmutableSet.copyOf(other.segments))) {
			return true;
		}

		for (var s : this.segments) {
			Segment<K, V> container = null;
			for (var o : other.segments) {
				if (o.overlaps(s.getKey())) {
					container = o;
					break;
				}
			}

			if (container == null
				|| !s.getKey().lessEqual(container.getKey())
				|| !s.getValue().lessEqual(container.getValue())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public FularaLattice<K, V> properJoin(FularaLattice<K, V> other) {
		if (this.segments.size() > other.segments.size()) {
			this.segments = dNorm(other.segments, this.segments);
		} else {
			this.segments = dNorm(this.segments, copyAll(other.segments));
		}
		check();
		return this;
	}

	/**
	 * Pointwise meet of the overlapping segments.
	 */
	@Override
	public FularaLattice<K, V> properMeet(FularaLattice<K, V> other) {
		var result = new ArrayList<Segment<K, V>>();
		for (var s : this.segments) {
			for (var o : other.segments) {
				if (s.equals(o)) {
					result.add(s.copy());
					continue;
				}

				var key = s.getKey().copy().meet(o.getKey());
				if (key.keyIsBottom() || key.isBottom()) {
					continue;
				}
				var value = s.getValue().copy().meet(o.getValue());
				if (!value.isBottom()) {
					result.add(new Segment<>(key, value));
				}
			}
		}
		this.segments = result;
		check();
		return this;
	}

	/**
	 * Overlapping segments are widened pointwise.  If the other element has a
	 * segment that overlaps none of ours, the keys are widened to top at once.
	 */
	@Override
	public FularaLattice<K, V> properWidening(FularaLattice<K, V> other) {
		var result = new ArrayList<>(this.segments);
		boolean added = false;
		for (var o : other.segments) {
			boolean overlaps = false;
			for (var s : this.segments) {
				if (s.overlaps(o.getKey())) {
					overlaps = true;
					result.removeIf(r -> r == s);
					var key = s.getKey().copy().widening(o.getKey());
					var value = s.getValue().copy().widening(o.getValue());
					result.add(new Segment<>(key, value));
				}
			}
			if (!overlaps) {
				result.add(o.copy());
				added = true;
			}
		}

		if (added) {
			var value = this.values.get().bottom();
			for (var segment : result) {
				value.join(segment.getValue());
			}
			this.segments = new ArrayList<>();
			this.segments.add(new Segment<>(this.keys.get().top(), value));
		} else {
			this.segments = dNorm(result, List.of());
		}
		check();
		return this;
	}

	/**
	 * Disjoint normalization: add segments to a set of disjoint segments,
	 * joining every pair that overlaps.
	 *
	 * @param added
	 *         The segments to add (copied).
	 * @param disjoint
	 *         Pairwise disjoint segments (reused).
	 * @return Pairwise disjoint segments covering both inputs.
	 */
	static <K extends KeyWrapper<K>, V extends ValueWrapper<V>> List<Segment<K, V>> dNorm(Collection<Segment<K, V>> added, Collection<Segment<K, V>> disjoint) {
		var result = new ArrayList<>(disjoint);
		for (var s : added) {
			var key = s.getKey().copy();
			var value = s.getValue().copy();

			// Joining may make the key overlap segments it has already passed
			boolean changed = true;
			while (changed) {
				changed = false;
				for (var it = result.iterator(); it.hasNext(); ) {
					var r = it.next();
					if (r.overlaps(key)) {
						key.join(r.getKey());
						value.join(r.getValue());
						it.remove();
						changed = true;
					}
				}
			}
			result.add(new Segment<>(key, value));
		}
		return result;
	}

	/**
	 * Restore disjointness after the segments were updated in place.
	 */
	public FularaLattice<K, V> normalize() {
		if (!this.bottom) {
			this.segments = dNorm(new ArrayList<>(this.segments), List.of());
		}
		check();
		return this;
	}

	/**
	 * Weak update: add a segment, joining it with every segment it overlaps.
	 * Empty segments are ignored.
	 */
	public FularaLattice<K, V> normalizedAdd(K key, V value) {
		if (!this.bottom && !key.isBottom() && !value.isBottom()) {
			this.segments = dNorm(List.of(new Segment<>(key, value)), this.segments);
		}
		check();
		return this;
	}

	/**
	 * Strong update: add a segment, removing its keys from every segment it
	 * overlaps.  Falls back to {@link #normalizedAdd} when an overlapping key
	 * cannot be split.
	 */
	public FularaLattice<K, V> partitionAdd(K key, V value) {
		if (this.bottom) {
			return this;
		}

		var kept = new ArrayList<Segment<K, V>>();
		var pieces = new ArrayList<Segment<K, V>>();
		for (var s : this.segments) {
			if (!s.overlaps(key)) {
				kept.add(s);
				continue;
			}

			var remainder = s.getKey().decomp(key);
			if (remainder.isEmpty()) {
				Log.debug("Cannot split %s around %s, updating weakly", s.getKey(), key);
				return normalizedAdd(key, value);
			}
			for (var k : remainder.get()) {
				pieces.add(new Segment<>(k, s.getValue().copy()));
			}
		}

		kept.addAll(pieces);
		if (!key.isBottom() && !value.isBottom()) {
			kept.add(new Segment<>(key.copy(), value.copy()));
		}
		this.segments = kept;
		check();
		return this;
	}

	/**
	 * Weak update that keeps the partition precise: the keys shared with an
	 * existing segment map to the join of both values, the keys of the
	 * existing segment outside the update keep their old values, and new
	 * keys map to the new values.  Falls back to {@link #normalizedAdd} when
	 * a key cannot be split.
	 */
	public FularaLattice<K, V> partitionUpdate(Collection<Segment<K, V>> updates) {
		if (this.bottom) {
			return this;
		}

		var saved = copyAll(this.segments);
		var pending = new ArrayDeque<Segment<K, V>>();
		for (var update : updates) {
			if (!update.isEmpty()) {
				pending.addLast(update.copy());
			}
		}

		while (!pending.isEmpty()) {
			var n = pending.removeFirst();

			Segment<K, V> s = null;
			for (var segment : this.segments) {
				if (segment.overlaps(n.getKey())) {
					s = segment;
					break;
				}
			}

			if (s == null) {
				this.segments.add(n);
				continue;
			} else if (s.getKey().equals(n.getKey())) {
				s.getValue().join(n.getValue());
				continue;
			}

			var sRemainder = s.getKey().decomp(n.getKey());
			var nRemainder = n.getKey().decomp(s.getKey());
			var shared = s.getKey().copy().meet(n.getKey());
			if (sRemainder.isEmpty() || nRemainder.isEmpty() || shared.isBottom()) {
				Log.debug("Cannot split %s around %s, updating weakly", s.getKey(), n.getKey());
				this.segments = saved;
				for (var update : updates) {
					normalizedAdd(update.getKey(), update.getValue());
				}
				return this;
			}

			var old = s;
			this.segments.removeIf(segment -> segment == old);
			for (var k : sRemainder.get()) {
				this.segments.add(new Segment<>(k, old.getValue().copy()));
			}
			this.segments.add(new Segment<>(shared, old.getValue().copy().join(n.getValue())));
			for (var k : nRemainder.get()) {
				pending.addLast(new Segment<>(k, n.getValue().copy()));
			}
		}

		check();
		return this;
	}

	/**
	 * @return The join of all keys.
	 */
	public K getKeysJoined() {
		var result = this.keys.get().bottom();
		for (var segment : this.segments) {
			result.join(segment.getKey());
		}
		return result;
	}

	/**
	 * @return The join of all values.
	 */
	public V getValuesJoined() {
		var result = this.values.get().bottom();
		for (var segment : this.segments) {
			result.join(segment.getValue());
		}
		return result;
	}

	/**
	 * Forget a scalar variable in every segment.
	 */
	public FularaLattice<K, V> forgetVariable(VariableIdentifier variable) {
		for (var segment : this.segments) {
			segment.getKey().forgetVariable(variable);
			segment.getValue().forgetVariable(variable);
		}
		return normalize();
	}

	private static final boolean CHECK = FularaLattice.class.desiredAssertionStatus();

	private void check() {
		if (CHECK) {
			for (int i = 0; i < this.segments.size(); ++i) {
				var s = this.segments.get(i);
				assert !s.getKey().keyIsBottom() && !s.getValue().valueIsBottom() : "Empty segment " + s;
				for (int j = i + 1; j < this.segments.size(); ++j) {
					assert !s.overlaps(this.segments.get(j).getKey()) : "Overlapping segments in " + this;
				}
			}
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof FularaLattice)) {
			return false;
		}

		var other = (FularaLattice<?, ?>) obj;
		return this.bottom == other.bottom
			&& ImmutableSet.copyOf(this.segments).equals(ImmutableSet.copyOf(other.segments));
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.bottom, ImmutableSet.copyOf(this.segments));
	}

	@Override
	public String toString() {
		if (this.bottom) {
			return "⊥";
		}

		var sorted = new ArrayList<>(this.segments);
		sorted.sort((a, b) -> a.getKey().compareTo(b.getKey()));
		return "{" + Joiner.on(", ").join(sorted) + "}";
	}
}
