package absint.expr;

import static com.google.common.truth.Truth.assertThat;

import absint.type.ListType;
import absint.type.PrimitiveType;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionsTest {
	private static final VariableIdentifier X = new VariableIdentifier(PrimitiveType.INT, "x");
	private static final VariableIdentifier Y = new VariableIdentifier(PrimitiveType.INT, "y");
	private static final VariableIdentifier B = new VariableIdentifier(PrimitiveType.BOOL, "b");

	private static Expression compare(Expression left, BinaryComparisonOperation.Operator op, Expression right) {
		return new BinaryComparisonOperation(PrimitiveType.BOOL, left, op, right);
	}

	private static Expression not(Expression expr) {
		return new UnaryBooleanOperation(PrimitiveType.BOOL, UnaryBooleanOperation.Operator.NEG, expr);
	}

	private static Expression and(Expression left, Expression right) {
		return new BinaryBooleanOperation(PrimitiveType.BOOL, left, BinaryBooleanOperation.Operator.AND, right);
	}

	private static Expression or(Expression left, Expression right) {
		return new BinaryBooleanOperation(PrimitiveType.BOOL, left, BinaryBooleanOperation.Operator.OR, right);
	}

	@Test
	public void ids() {
		var xs = new VariableIdentifier(new ListType(PrimitiveType.INT), "xs");
		var expr = new BinaryArithmeticOperation(PrimitiveType.INT,
			new Subscription(PrimitiveType.INT, xs, X),
			BinaryArithmeticOperation.Operator.ADD,
			new LengthIdentifier(xs));
		assertThat(Expressions.ids(expr)).containsExactly(xs, X, new LengthIdentifier(xs)).inOrder();
		assertThat(Expressions.ids(Literal.of(1))).isEmpty();
	}

	@Test
	public void negatedComparisons() {
		assertThat(Expressions.negate(compare(X, BinaryComparisonOperation.Operator.LT, Y)))
			.isEqualTo(compare(X, BinaryComparisonOperation.Operator.GT_E, Y));
		assertThat(Expressions.normalize(not(compare(X, BinaryComparisonOperation.Operator.EQ, Y))))
			.isEqualTo(compare(X, BinaryComparisonOperation.Operator.NOT_EQ, Y));
		assertThat(Expressions.normalize(not(not(B)))).isEqualTo(B);
	}

	@Test
	public void deMorgan() {
		var lt = compare(X, BinaryComparisonOperation.Operator.LT, Y);
		var gt = compare(X, BinaryComparisonOperation.Operator.GT, Y);
		assertThat(Expressions.normalize(not(and(lt, B))))
			.isEqualTo(or(compare(X, BinaryComparisonOperation.Operator.GT_E, Y), not(B)));
		assertThat(Expressions.negate(or(lt, gt)))
			.isEqualTo(and(compare(X, BinaryComparisonOperation.Operator.GT_E, Y), compare(X, BinaryComparisonOperation.Operator.LT_E, Y)));
	}

	@Test
	public void literals() {
		assertThat(Expressions.negate(Literal.of(true))).isEqualTo(Literal.of(false));
		assertThat(Expressions.normalize(Literal.of(true))).isEqualTo(Literal.of(true));
	}
}
