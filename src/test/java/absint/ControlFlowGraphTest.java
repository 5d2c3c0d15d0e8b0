package absint;

import static absint.Programs.access;
import static absint.Programs.assign;
import static absint.Programs.intVar;
import static absint.Programs.literal;
import static absint.Programs.pp;
import static absint.Programs.whileLoop;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import absint.expr.VariableIdentifier;
import absint.stmt.Statement;
import absint.stmt.SubscriptionAccess;
import absint.type.DictType;
import absint.type.PrimitiveType;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ControlFlowGraphTest {
	private static final VariableIdentifier X = intVar("x");

	private static ControlFlowGraph loop() {
		return whileLoop(X, 3,
			List.<Statement>of(assign(X, literal(0))),
			List.<Statement>of(assign(X, literal(1))));
	}

	@Test
	public void structure() {
		var cfg = loop();
		var head = cfg.getNode(2);
		var body = cfg.getNode(3);

		assertThat(cfg.getEntry().getId()).isEqualTo(1);
		assertThat(cfg.getExit().getId()).isEqualTo(4);
		assertThat(cfg.getNodes()).hasSize(4);
		assertThat(cfg.getEdges()).hasSize(4);
		assertThat(head.isLoop()).isTrue();
		assertThat(body.isLoop()).isFalse();

		assertThat(cfg.predecessors(head)).containsExactly(cfg.getNode(1), body);
		assertThat(cfg.successors(head)).containsExactly(body, cfg.getNode(4));
		assertThat(cfg.inEdges(head)).hasSize(2);
		assertThat(cfg.outEdges(body)).hasSize(1);

		var back = cfg.getEdge(body, head).get();
		assertThat(back.getKind()).isEqualTo(Edge.Kind.LOOP_OUT);
		assertThat(back.isConditional()).isFalse();
		var in = cfg.getEdge(head, body).get();
		assertThat(in.getKind()).isEqualTo(Edge.Kind.LOOP_IN);
		assertThat(in.isConditional()).isTrue();
		assertThat(cfg.getEdge(body, cfg.getNode(4)).isPresent()).isFalse();
	}

	@Test
	public void nodesAreOrderedById() {
		var cfg = loop();
		var ids = new ArrayList<Integer>();
		for (var node : cfg.getNodes()) {
			ids.add(node.getId());
		}
		assertThat(ids).containsExactly(1, 2, 3, 4).inOrder();
	}

	@Test
	public void variables() {
		var y = intVar("y");
		var d = new VariableIdentifier(new DictType(PrimitiveType.INT, PrimitiveType.INT), "d");
		var node = new Basic(1,
			assign(y, access(X)),
			assign(new SubscriptionAccess(pp(), PrimitiveType.INT, access(d), literal(0)), literal(1)));
		var cfg = ControlFlowGraph.builder()
			.entry(node)
			.exit(node)
			.build();
		assertThat(cfg.variables()).containsExactly(y, X, d);

		assertThat(loop().variables()).containsExactly(X);
	}

	@Test
	public void invalidGraphs() {
		assertThrows(IllegalStateException.class, () -> ControlFlowGraph.builder().entry(new Basic(1)).build());
		assertThrows(IllegalStateException.class, () -> ControlFlowGraph.builder().exit(new Basic(1)).build());
		assertThrows(IllegalArgumentException.class, () -> ControlFlowGraph.builder()
			.entry(new Basic(1))
			.exit(new Basic(1)));
		assertThrows(IllegalArgumentException.class, () -> loop().getNode(7));
	}
}
