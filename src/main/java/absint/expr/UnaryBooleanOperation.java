package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * Boolean negation.
 */
public final class UnaryBooleanOperation extends Expression {
	public enum Operator {
		NEG;

		@Override
		public String toString() {
			return "not";
		}
	}

	private final Operator operator;
	private final Expression expression;

	public UnaryBooleanOperation(ValueType type, Operator operator, Expression expression) {
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
		return visitor.visitUnaryBooleanOperation(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof UnaryBooleanOperation)) {
			return false;
		}

		var other = (UnaryBooleanOperation) obj;
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
		return this.operator + " " + this.expression;
	}
}
