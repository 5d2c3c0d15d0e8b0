package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A binary arithmetic operation, e.g. {@code a + b}.
 */
public final class BinaryArithmeticOperation extends Expression {
	public enum Operator {
		ADD("+"),
		SUB("-"),
		MULT("*"),
		DIV("/"),
		MOD("%");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return this.symbol;
		}
	}

	private final Expression left;
	private final Operator operator;
	private final Expression right;

	public BinaryArithmeticOperation(ValueType type, Expression left, Operator operator, Expression right) {
		super(type);
		this.left = Objects.requireNonNull(left);
		this.operator = Objects.requireNonNull(operator);
		this.right = Objects.requireNonNull(right);
	}

	public Expression getLeft() {
		return this.left;
	}

	public Operator getOperator() {
		return this.operator;
	}

	public Expression getRight() {
		return this.right;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of(this.left, this.right);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitBinaryArithmeticOperation(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof BinaryArithmeticOperation)) {
			return false;
		}

		var other = (BinaryArithmeticOperation) obj;
		return getType().equals(other.getType())
			&& this.left.equals(other.left)
			&& this.operator == other.operator
			&& this.right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.left, this.operator, this.right);
	}

	@Override
	public String toString() {
		return this.left + " " + this.operator + " " + this.right;
	}
}
