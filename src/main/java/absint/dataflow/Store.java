package absint.dataflow;

import absint.expr.LengthIdentifier;
import absint.expr.VariableIdentifier;
import absint.type.ValueType;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * A map lattice from variables to abstract values, ordered pointwise.
 */
public final class Store<L extends Lattice<L>> implements Lattice<Store<L>> {
	private final Function<? super ValueType, ? extends L> lattices;
	private final Map<VariableIdentifier, L> map;

	/**
	 * @param variables
	 *         The variables to track.
	 * @param lattices
	 *         Creates the initial element for a variable of the given type,
	 *         or returns null if the type is not supported.
	 */
	public Store(Collection<? extends VariableIdentifier> variables, Function<? super ValueType, ? extends L> lattices) {
		this.lattices = lattices;
		this.map = new LinkedHashMap<>();
		for (var variable : variables) {
			addVariable(variable);
		}
	}

	private Store(Function<? super ValueType, ? extends L> lattices, Map<VariableIdentifier, L> map) {
		this.lattices = lattices;
		this.map = map;
	}

	/**
	 * @return A fresh element for the given type.
	 * @throws IllegalArgumentException
	 *         If the type has no lattice.
	 */
	public L create(ValueType type) {
		L lattice = this.lattices.apply(type);
		if (lattice == null) {
			throw new IllegalArgumentException("Missing lattice for variable type " + type);
		}
		return lattice;
	}

	/**
	 * @return The tracked variables.
	 */
	public Set<VariableIdentifier> getVariables() {
		return Collections.unmodifiableSet(this.map.keySet());
	}

	/**
	 * @return Whether the given variable is tracked.
	 */
	public boolean contains(VariableIdentifier variable) {
		return this.map.containsKey(variable);
	}

	/**
	 * @return The (mutable) value of a tracked variable.
	 */
	public L get(VariableIdentifier variable) {
		var value = this.map.get(variable);
		Preconditions.checkArgument(value != null, "Unknown variable %s", variable);
		return value;
	}

	/**
	 * Set the value of a tracked variable.
	 *
	 * @return Whether the store changed.
	 */
	public boolean put(VariableIdentifier variable, L value) {
		Preconditions.checkArgument(this.map.containsKey(variable), "Unknown variable %s", variable);
		L old = this.map.put(variable, value);
		return !value.equals(old);
	}

	/**
	 * Start tracking a variable.
	 */
	public void addVariable(VariableIdentifier variable) {
		this.map.put(variable, create(variable.getType()));
	}

	/**
	 * Stop tracking a variable.
	 */
	public void removeVariable(VariableIdentifier variable) {
		this.map.remove(variable);
	}

	@Override
	public Store<L> bottom() {
		this.map.values().forEach(Lattice::bottom);
		return this;
	}

	@Override
	public Store<L> top() {
		this.map.values().forEach(Lattice::top);
		return this;
	}

	/**
	 * A store is bottom if any variable (lengths excepted) maps to bottom.
	 */
	@Override
	public boolean isBottom() {
		for (var entry : this.map.entrySet()) {
			if (!(entry.getKey() instanceof LengthIdentifier) && entry.getValue().isBottom()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * A store is top if every variable maps to top.
	 */
	@Override
	public boolean isTop() {
		return this.map.values()
			.stream()
			.allMatch(Lattice::isTop);
	}

	@Override
	public Store<L> copy() {
		var map = new LinkedHashMap<VariableIdentifier, L>();
		this.map.forEach((k, v) -> map.put(k, v.copy()));
		return new Store<>(this.lattices, map);
	}

	@Override
	public Store<L> replace(Store<L> other) {
		if (other != this) {
			this.map.clear();
			other.map.forEach((k, v) -> this.map.put(k, v.copy()));
		}
		return this;
	}

	@Override
	public boolean properLessEqual(Store<L> other) {
		for (var entry : this.map.entrySet()) {
			if (!entry.getValue().lessEqual(other.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Store<L> properJoin(Store<L> other) {
		this.map.forEach((k, v) -> v.join(other.get(k)));
		return this;
	}

	@Override
	public Store<L> properMeet(Store<L> other) {
		this.map.forEach((k, v) -> v.meet(other.get(k)));
		return this;
	}

	@Override
	public Store<L> properWidening(Store<L> other) {
		this.map.forEach((k, v) -> v.widening(other.get(k)));
		return this;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Store)) {
			return false;
		}

		var other = (Store<?>) obj;
		return this.map.equals(other.map);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.map);
	}

	@Override
	public String toString() {
		return Joiner.on(", ")
			.withKeyValueSeparator(" -> ")
			.join(this.map);
	}
}
