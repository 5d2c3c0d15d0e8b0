package absint.fulara;

import static com.google.common.truth.Truth.assertThat;

import absint.dataflow.IntervalLattice;
import absint.expr.VariableIdentifier;
import absint.type.PrimitiveType;
import absint.type.ValueType;

import java.util.List;
import java.util.function.Supplier;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FularaLatticeTest {
	private static IntervalKeyWrapper key(ValueType type, double lower, double upper) {
		return new IntervalKeyWrapper(List.of(), type).setInterval(IntervalLattice.of(lower, upper));
	}

	private static IntervalKeyWrapper key(double lower, double upper) {
		return key(PrimitiveType.INT, lower, upper);
	}

	private static IntervalValueWrapper value(double lower, double upper) {
		return new IntervalValueWrapper(List.of(), PrimitiveType.INT).setInterval(IntervalLattice.of(lower, upper));
	}

	private static FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> top(ValueType keyType) {
		return new FularaLattice<>(
			() -> new IntervalKeyWrapper(List.of(), keyType),
			() -> new IntervalValueWrapper(List.of(), PrimitiveType.INT));
	}

	private static FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> top() {
		return top(PrimitiveType.INT);
	}

	private static FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> empty() {
		return top().emptyDict();
	}

	private static FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> update(
		FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> dict, double lower, double upper, double v) {
		return dict.partitionUpdate(List.of(new Segment<>(key(lower, upper), value(v, v))));
	}

	private static void assertDisjoint(FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> dict) {
		var segments = dict.getSegments();
		for (int i = 0; i < segments.size(); ++i) {
			for (int j = i + 1; j < segments.size(); ++j) {
				assertThat(segments.get(i).overlaps(segments.get(j).getKey())).isFalse();
			}
		}
	}

	/**
	 * Bottom, top, and a few proper elements, each built afresh.
	 */
	private static List<Supplier<FularaLattice<IntervalKeyWrapper, IntervalValueWrapper>>> samples() {
		return List.of(
			() -> top().bottom(),
			FularaLatticeTest::empty,
			() -> empty().partitionAdd(key(1, 1), value(7, 7)),
			() -> empty().partitionAdd(key(1, 1), value(7, 7)).partitionAdd(key(2, 2), value(8, 8)),
			() -> empty().partitionAdd(key(0, 5), value(0, 3)),
			FularaLatticeTest::top);
	}

	@Test
	public void latticeLaws() {
		for (var x : samples()) {
			assertThat(x.get().join(x.get())).isEqualTo(x.get());
			assertThat(x.get().meet(x.get())).isEqualTo(x.get());
			assertThat(x.get().lessEqual(x.get())).isTrue();

			for (var y : samples()) {
				assertThat(x.get().meet(y.get())).isEqualTo(y.get().meet(x.get()));

				var join = x.get().join(y.get());
				var widened = x.get().widening(y.get());
				assertThat(x.get().lessEqual(join)).isTrue();
				assertThat(y.get().lessEqual(join)).isTrue();
				assertThat(join.lessEqual(widened)).isTrue();

				// Widening is stable once the iterates stop growing
				if (y.get().lessEqual(x.get())) {
					assertThat(widened).isEqualTo(x.get());
				}
			}
		}
	}

	@Test
	public void updatesKeepSegmentsDisjoint() {
		var dict = empty();
		update(dict, 0, 5, 1);
		assertDisjoint(dict);
		update(dict, 3, 8, 2);
		assertDisjoint(dict);
		assertThat(dict.toString()).isEqualTo("{([0, 2], [1, 1]), ([3, 5], [1, 2]), ([6, 8], [2, 2])}");
		update(dict, -2, 1, 3);
		assertDisjoint(dict);
		update(dict, 4, 4, 4);
		assertDisjoint(dict);
		update(dict, 0, 10, 5);
		assertDisjoint(dict);

		assertThat(dict.toString()).isEqualTo("{([-2, -1], [3, 3]), ([0, 1], [1, 5]), ([2, 2], [1, 5]), ([3, 3], [1, 5]), "
			+ "([4, 4], [1, 5]), ([5, 5], [1, 5]), ([6, 8], [2, 5]), ([9, 10], [5, 5])}");
		assertThat(dict.getKeysJoined().getInterval()).isEqualTo(IntervalLattice.of(-2, 10));
	}

	@Test
	public void topBottomAndEmpty() {
		assertThat(top().isTop()).isTrue();
		assertThat(top().getSegments()).hasSize(1);

		var empty = empty();
		assertThat(empty.isEmptyDict()).isTrue();
		assertThat(empty.isBottom()).isFalse();
		assertThat(empty.isTop()).isFalse();
		assertThat(empty.toString()).isEqualTo("{}");

		var bottom = top().bottom();
		assertThat(bottom.isBottom()).isTrue();
		assertThat(bottom.isEmptyDict()).isFalse();
		assertThat(bottom).isNotEqualTo(empty);
		assertThat(bottom.toString()).isEqualTo("⊥");
	}

	@Test
	public void strongUpdates() {
		var dict = empty()
			.partitionAdd(key(3, 3), value(2, 2))
			.partitionAdd(key(4, 4), value(1, 1));

		assertThat(dict.getSegments()).hasSize(2);
		assertThat(dict.getKeysJoined().getInterval()).isEqualTo(IntervalLattice.of(3, 4));
		assertThat(dict.getValuesJoined().getInterval()).isEqualTo(IntervalLattice.of(1, 2));
		assertThat(dict.toString()).isEqualTo("{([3, 3], [2, 2]), ([4, 4], [1, 1])}");

		dict.partitionAdd(key(3, 3), value(7, 7));
		assertThat(dict.toString()).isEqualTo("{([3, 3], [7, 7]), ([4, 4], [1, 1])}");
	}

	@Test
	public void strongUpdateSplitsSegments() {
		var dict = top().partitionAdd(key(5, 5), value(7, 7));
		assertThat(dict.toString()).isEqualTo("{([-inf, 4], [-inf, inf]), ([5, 5], [7, 7]), ([6, inf], [-inf, inf])}");
	}

	@Test
	public void weakUpdate() {
		var dict = empty().partitionAdd(key(0, 10), value(1, 1));
		dict.partitionUpdate(List.of(new Segment<>(key(5, 15), value(2, 2))));
		assertThat(dict.toString()).isEqualTo("{([0, 4], [1, 1]), ([5, 10], [1, 2]), ([11, 15], [2, 2])}");
	}

	@Test
	public void normalizedAddJoinsOverlaps() {
		var dict = empty()
			.partitionAdd(key(0, 1), value(0, 0))
			.partitionAdd(key(3, 4), value(5, 5))
			.normalizedAdd(key(1, 3), value(9, 9));
		assertThat(dict.toString()).isEqualTo("{([0, 4], [0, 9])}");
	}

	@Test
	public void emptySegmentsAreIgnored() {
		var dict = empty()
			.normalizedAdd(key(1, 1), value(1, 1).bottom())
			.partitionAdd(key(2, 2), value(1, 1).bottom());
		assertThat(dict.isEmptyDict()).isTrue();
	}

	@Test
	public void unsplittableKeysUpdateWeakly() {
		var dict = top(PrimitiveType.FLOAT).partitionAdd(key(PrimitiveType.FLOAT, 5, 5), value(7, 7));
		assertThat(dict.getSegments()).hasSize(1);
		assertThat(dict.isTop()).isTrue();
	}

	@Test
	public void order() {
		var small = empty().partitionAdd(key(0, 0), value(1, 1));
		var large = empty().partitionAdd(key(0, 2), value(0, 5));
		var other = empty().partitionAdd(key(7, 7), value(1, 1));

		assertThat(empty().lessEqual(small)).isTrue();
		assertThat(small.lessEqual(large)).isTrue();
		assertThat(large.lessEqual(small)).isFalse();
		assertThat(small.lessEqual(other)).isFalse();
		assertThat(small.lessEqual(top())).isTrue();
		assertThat(top().bottom().lessEqual(empty())).isTrue();
	}

	@Test
	public void join() {
		var a = empty().partitionAdd(key(0, 0), value(1, 1));
		var b = empty()
			.partitionAdd(key(0, 2), value(5, 5))
			.partitionAdd(key(9, 9), value(0, 0));

		var join = a.copy().join(b);
		assertThat(join.toString()).isEqualTo("{([0, 2], [1, 5]), ([9, 9], [0, 0])}");
		assertThat(a.lessEqual(join)).isTrue();
		assertThat(b.lessEqual(join)).isTrue();
		assertThat(join).isEqualTo(b.copy().join(a));
	}

	@Test
	public void meet() {
		var a = empty().partitionAdd(key(0, 5), value(1, 3));
		var b = empty().partitionAdd(key(3, 9), value(2, 8));
		assertThat(a.copy().meet(b).toString()).isEqualTo("{([3, 5], [2, 3])}");

		var disjoint = empty().partitionAdd(key(7, 7), value(1, 1));
		var meet = a.copy().meet(disjoint);
		assertThat(meet.isEmptyDict()).isTrue();
		assertThat(meet.isBottom()).isFalse();
	}

	@Test
	public void wideningOfOverlappingSegments() {
		var a = empty().partitionAdd(key(0, 1), value(0, 0));
		var b = empty().partitionAdd(key(0, 2), value(0, 1));
		var widened = a.copy().widening(b);
		assertThat(widened.toString()).isEqualTo("{([0, inf], [0, inf])}");
		assertThat(b.lessEqual(widened)).isTrue();
	}

	@Test
	public void extremeWidening() {
		var a = empty().partitionAdd(key(0, 0), value(1, 1));
		var b = a.copy().partitionAdd(key(1, 1), value(2, 2));
		var widened = a.copy().widening(b);

		assertThat(widened.getSegments()).hasSize(1);
		var segment = widened.getSegments().get(0);
		assertThat(segment.getKey().isTop()).isTrue();
		assertThat(segment.getValue().getInterval()).isEqualTo(IntervalLattice.of(1, 2));
		assertThat(b.lessEqual(widened)).isTrue();
	}

	@Test
	public void copyIsDeep() {
		var a = empty().partitionAdd(key(0, 0), value(1, 1));
		var b = a.copy();
		b.getSegments().get(0).getValue().setInterval(IntervalLattice.constant(9));
		assertThat(a.getValuesJoined().getInterval()).isEqualTo(IntervalLattice.constant(1));
	}

	@Test
	public void forgetVariable() {
		var i = new VariableIdentifier(PrimitiveType.INT, "i");
		var k = new IntervalKeyWrapper(List.of(i), PrimitiveType.INT).setInterval(IntervalLattice.constant(0));
		k.getState().getStore().put(i, IntervalLattice.constant(3));
		var v = new IntervalValueWrapper(List.of(i), PrimitiveType.INT).setInterval(IntervalLattice.constant(1));
		FularaLattice<IntervalKeyWrapper, IntervalValueWrapper> dict = new FularaLattice<>(
			() -> new IntervalKeyWrapper(List.of(i), PrimitiveType.INT),
			() -> new IntervalValueWrapper(List.of(i), PrimitiveType.INT));
		dict.emptyDict().partitionAdd(k, v);

		dict.forgetVariable(i);
		var segment = dict.getSegments().get(0);
		assertThat(segment.getKey().getState().get(i).isTop()).isTrue();
		assertThat(segment.getKey().getInterval()).isEqualTo(IntervalLattice.constant(0));
	}
}
