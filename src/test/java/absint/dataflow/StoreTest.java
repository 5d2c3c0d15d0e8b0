package absint.dataflow;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import absint.expr.LengthIdentifier;
import absint.expr.VariableIdentifier;
import absint.type.ListType;
import absint.type.PrimitiveType;

import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StoreTest {
	private static final VariableIdentifier X = new VariableIdentifier(PrimitiveType.INT, "x");
	private static final VariableIdentifier Y = new VariableIdentifier(PrimitiveType.INT, "y");
	private static final VariableIdentifier S = new VariableIdentifier(PrimitiveType.STRING, "s");

	private static Store<IntervalLattice> store() {
		return new Store<>(List.of(X, Y), type -> type.isNumeric() ? new IntervalLattice() : null);
	}

	@Test
	public void missingLattice() {
		var e = assertThrows(IllegalArgumentException.class, () -> new Store<IntervalLattice>(List.of(S), type -> type.isNumeric() ? new IntervalLattice() : null));
		assertThat(e).hasMessageThat().contains("Missing lattice");
	}

	@Test
	public void bottomIfAnyEntryIsBottom() {
		var store = store();
		assertThat(store.isTop()).isTrue();
		store.get(X).bottom();
		assertThat(store.isBottom()).isTrue();
		assertThat(store.isTop()).isFalse();
	}

	@Test
	public void bottomLengthIsNotBottom() {
		var xs = new VariableIdentifier(new ListType(PrimitiveType.INT), "xs");
		var length = new LengthIdentifier(xs);
		var store = new Store<IntervalLattice>(List.of(length), type -> new IntervalLattice());
		store.get(length).bottom();
		assertThat(store.isBottom()).isFalse();
	}

	@Test
	public void pointwiseOrder() {
		var a = store();
		a.put(X, IntervalLattice.constant(0));
		a.put(Y, IntervalLattice.constant(1));
		var b = store();
		b.put(X, IntervalLattice.of(0, 5));
		b.put(Y, IntervalLattice.constant(3));

		assertThat(a.lessEqual(b)).isFalse();
		var join = a.copy().join(b);
		assertThat(join.get(X)).isEqualTo(IntervalLattice.of(0, 5));
		assertThat(join.get(Y)).isEqualTo(IntervalLattice.of(1, 3));
		assertThat(a.lessEqual(join)).isTrue();
		assertThat(b.lessEqual(join)).isTrue();

		var meet = a.copy().meet(b);
		assertThat(meet.get(X)).isEqualTo(IntervalLattice.constant(0));
		assertThat(meet.isBottom()).isTrue();
	}

	@Test
	public void copyIsDeep() {
		var a = store();
		a.put(X, IntervalLattice.constant(0));
		var b = a.copy();
		b.get(X).join(IntervalLattice.constant(2));
		assertThat(a.get(X)).isEqualTo(IntervalLattice.constant(0));
		assertThat(b).isNotEqualTo(a);
	}

	@Test
	public void variables() {
		var store = store();
		assertThat(store.getVariables()).containsExactly(X, Y).inOrder();
		assertThat(store.put(X, IntervalLattice.constant(1))).isTrue();
		assertThat(store.put(X, IntervalLattice.constant(1))).isFalse();
		store.removeVariable(X);
		assertThat(store.contains(X)).isFalse();
		assertThrows(IllegalArgumentException.class, () -> store.get(X));
		assertThrows(IllegalArgumentException.class, () -> store.put(X, new IntervalLattice()));
	}
}
