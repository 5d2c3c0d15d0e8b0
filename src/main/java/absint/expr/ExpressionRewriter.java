package absint.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A visitor that rebuilds an expression bottom-up.  Subclasses override the
 * shapes they want to replace; everything else is copied with rewritten
 * children.
 */
public abstract class ExpressionRewriter<A> implements ExpressionVisitor<Expression, A> {
	/**
	 * Rewrite an expression.
	 */
	public Expression rewrite(Expression expr, A arg) {
		return expr.accept(this, arg);
	}

	private List<Expression> rewriteAll(List<Expression> exprs, A arg) {
		var ret = new ArrayList<Expression>(exprs.size());
		for (var expr : exprs) {
			ret.add(rewrite(expr, arg));
		}
		return ret;
	}

	private Expression rewriteOrNull(Expression expr, A arg) {
		return expr == null ? null : rewrite(expr, arg);
	}

	@Override
	public Expression visitLiteral(Literal expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitVariableIdentifier(VariableIdentifier expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitLengthIdentifier(LengthIdentifier expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitKeysIdentifier(KeysIdentifier expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitValuesIdentifier(ValuesIdentifier expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitInput(Input expr, A arg) {
		return expr;
	}

	@Override
	public Expression visitListDisplay(ListDisplay expr, A arg) {
		return new ListDisplay(expr.getType(), rewriteAll(expr.getItems(), arg));
	}

	@Override
	public Expression visitSetDisplay(SetDisplay expr, A arg) {
		return new SetDisplay(expr.getType(), rewriteAll(expr.getItems(), arg));
	}

	@Override
	public Expression visitDictDisplay(DictDisplay expr, A arg) {
		return new DictDisplay(expr.getType(), rewriteAll(expr.getKeys(), arg), rewriteAll(expr.getValues(), arg));
	}

	@Override
	public Expression visitRange(Range expr, A arg) {
		return new Range(expr.getType(), rewrite(expr.getStart(), arg), rewrite(expr.getStop(), arg), rewrite(expr.getStep(), arg));
	}

	@Override
	public Expression visitAttributeReference(AttributeReference expr, A arg) {
		return new AttributeReference(expr.getType(), rewrite(expr.getTarget(), arg), expr.getAttribute());
	}

	@Override
	public Expression visitSubscription(Subscription expr, A arg) {
		return new Subscription(expr.getType(), rewrite(expr.getTarget(), arg), rewrite(expr.getKey(), arg));
	}

	@Override
	public Expression visitSlicing(Slicing expr, A arg) {
		var upper = rewriteOrNull(expr.getUpper().orElse(null), arg);
		var stride = rewriteOrNull(expr.getStride().orElse(null), arg);
		return new Slicing(expr.getType(), rewrite(expr.getTarget(), arg), rewrite(expr.getLower(), arg), upper, stride);
	}

	@Override
	public Expression visitUnaryArithmeticOperation(UnaryArithmeticOperation expr, A arg) {
		return new UnaryArithmeticOperation(expr.getType(), expr.getOperator(), rewrite(expr.getExpression(), arg));
	}

	@Override
	public Expression visitUnaryBooleanOperation(UnaryBooleanOperation expr, A arg) {
		return new UnaryBooleanOperation(expr.getType(), expr.getOperator(), rewrite(expr.getExpression(), arg));
	}

	@Override
	public Expression visitBinaryArithmeticOperation(BinaryArithmeticOperation expr, A arg) {
		return new BinaryArithmeticOperation(expr.getType(), rewrite(expr.getLeft(), arg), expr.getOperator(), rewrite(expr.getRight(), arg));
	}

	@Override
	public Expression visitBinaryBooleanOperation(BinaryBooleanOperation expr, A arg) {
		return new BinaryBooleanOperation(expr.getType(), rewrite(expr.getLeft(), arg), expr.getOperator(), rewrite(expr.getRight(), arg));
	}

	@Override
	public Expression visitBinaryComparisonOperation(BinaryComparisonOperation expr, A arg) {
		return new BinaryComparisonOperation(expr.getType(), rewrite(expr.getLeft(), arg), expr.getOperator(), rewrite(expr.getRight(), arg));
	}
}
