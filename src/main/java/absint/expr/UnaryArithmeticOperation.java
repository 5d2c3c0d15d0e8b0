package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * Unary plus or minus.
 */
public final class UnaryArithmeticOperation extends Expression {
	public enum Operator {
		ADD("+"),
		SUB("-");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return this.symbol;
		}
	}

	private final Operator operator;
	private final Expression expression;

	public UnaryArithmeticOperation(ValueType type, Operator operator, Expression expression) {
		super(type);
		this.operator = Objects.requireNonNull(operator);
		this.expression = Objects.requireNonNull(expression);
	}

	public Operator getOperator() {
		return this.operator;
	}

	public Expression getExpression() {
		return this.expression;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of(this.expression);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitUnaryArithmeticOperation(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof UnaryArithmeticOperation)) {
			return false;
		}

		var other = (UnaryArithmeticOperation) obj;
		return getType().equals(other.getType())
			&& this.operator == other.operator
			&& this.expression.equals(other.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.operator, this.expression);
	}

	@Override
	public String toString() {
		return this.operator + "" + this.expression;
	}
}
