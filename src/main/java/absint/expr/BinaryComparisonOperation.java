package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A comparison, e.g. {@code a < b}.
 */
public final class BinaryComparisonOperation extends Expression {
	public enum Operator {
		EQ("=="),
		NOT_EQ("!="),
		LT("<"),
		LT_E("<="),
		GT(">"),
		GT_E(">="),
		IS("is"),
		IS_NOT("is not"),
		IN("in"),
		NOT_IN("not in");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		/**
		 * @return The operator testing the opposite condition.
		 */
		public Operator negate() {
			switch (this) {
			case EQ:
				return NOT_EQ;
			case NOT_EQ:
				return EQ;
			case LT:
				return GT_E;
			case LT_E:
				return GT;
			case GT:
				return LT_E;
			case GT_E:
				return LT;
			case IS:
				return IS_NOT;
			case IS_NOT:
				return IS;
			case IN:
				return NOT_IN;
			default:
				return IN;
			}
		}

		@Override
		public String toString() {
			return this.symbol;
		}
	}

	private final Expression left;
	private final Operator operator;
	private final Expression right;

	public BinaryComparisonOperation(ValueType type, Expression left, Operator operator, Expression right) {
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
		return visitor.visitBinaryComparisonOperation(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof BinaryComparisonOperation)) {
			return false;
		}

		var other = (BinaryComparisonOperation) obj;
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
