package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A value read from the outside world.
 */
public final class Input extends Expression {
	public Input(ValueType type) {
		super(type);
	}

	@Override
	public List<Expression> getChildren() {
		return List.of();
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitInput(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Input)) {
			return false;
		}

		return getType().equals(((Input) obj).getType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(Input.class, getType());
	}

	@Override
	public String toString() {
		return "input()";
	}
}
