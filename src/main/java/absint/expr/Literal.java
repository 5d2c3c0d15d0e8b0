package absint.expr;

import absint.type.PrimitiveType;
import absint.type.ValueType;

import com.google.common.primitives.Doubles;

import java.util.List;
import java.util.Objects;

/**
 * A literal constant, kept in its source spelling.
 */
public final class Literal extends Expression {
	private final String value;

	public Literal(ValueType type, String value) {
		super(type);
		this.value = Objects.requireNonNull(value);
	}

	/**
	 * @return An integer literal.
	 */
	public static Literal of(long value) {
		return new Literal(PrimitiveType.INT, Long.toString(value));
	}

	/**
	 * @return A boolean literal.
	 */
	public static Literal of(boolean value) {
		return new Literal(PrimitiveType.BOOL, value ? "True" : "False");
	}

	public String getValue() {
		return this.value;
	}

	/**
	 * @return Whether {@link #toDouble()} can read this literal.
	 */
	public boolean isNumber() {
		switch (this.value) {
		case "True":
		case "False":
			return true;
		default:
			return Doubles.tryParse(this.value) != null;
		}
	}

	/**
	 * @return The numeric value of a number or boolean literal.
	 */
	public double toDouble() {
		switch (this.value) {
		case "True":
			return 1;
		case "False":
			return 0;
		default:
			return Double.parseDouble(this.value);
		}
	}

	@Override
	public List<Expression> getChildren() {
		return List.of();
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitLiteral(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Literal)) {
			return false;
		}

		var other = (Literal) obj;
		return getType().equals(other.getType())
			&& this.value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.value);
	}

	@Override
	public String toString() {
		if (getType() == PrimitiveType.STRING) {
			return "\"" + this.value + "\"";
		} else {
			return this.value;
		}
	}
}
