package absint.expr;

import absint.type.PrimitiveType;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utilities for expressions.
 */
public final class Expressions {
	private Expressions() {
	}

	/**
	 * @return Every identifier occurring in an expression.
	 */
	public static Set<VariableIdentifier> ids(Expression expr) {
		var ids = new LinkedHashSet<VariableIdentifier>();
		collectIds(expr, ids);
		return ids;
	}

	private static void collectIds(Expression expr, Set<VariableIdentifier> ids) {
		if (expr instanceof VariableIdentifier v) {
			ids.add(v);
		} else {
			for (var child : expr.getChildren()) {
				collectIds(child, ids);
			}
		}
	}

	/**
	 * Push every boolean negation in a condition down to its atoms, flipping
	 * comparison operators and swapping conjunctions with disjunctions.
	 */
	public static Expression normalize(Expression condition) {
		return normalize(condition, false);
	}

	/**
	 * @return The negation-free normal form of {@code not condition}.
	 */
	public static Expression negate(Expression condition) {
		return normalize(condition, true);
	}

	private static Expression normalize(Expression expr, boolean negate) {
		if (expr instanceof UnaryBooleanOperation u) {
			return normalize(u.getExpression(), !negate);
		} else if (expr instanceof BinaryBooleanOperation b) {
			var op = negate ? b.getOperator().dual() : b.getOperator();
			var left = normalize(b.getLeft(), negate);
			var right = normalize(b.getRight(), negate);
			return new BinaryBooleanOperation(b.getType(), left, op, right);
		} else if (!negate) {
			return expr;
		} else if (expr instanceof BinaryComparisonOperation c) {
			return new BinaryComparisonOperation(c.getType(), c.getLeft(), c.getOperator().negate(), c.getRight());
		} else if (expr instanceof Literal l && l.getType() == PrimitiveType.BOOL) {
			return Literal.of(l.toDouble() == 0);
		} else {
			return new UnaryBooleanOperation(PrimitiveType.BOOL, UnaryBooleanOperation.Operator.NEG, expr);
		}
	}
}
