package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A program variable.
 */
public class VariableIdentifier extends Expression {
	private final String name;

	public VariableIdentifier(ValueType type, String name) {
		super(type);
		this.name = Objects.requireNonNull(name);
	}

	public String getName() {
		return this.name;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of();
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitVariableIdentifier(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj == null || obj.getClass() != getClass()) {
			return false;
		}

		var other = (VariableIdentifier) obj;
		return this.name.equals(other.name)
			&& getType().equals(other.getType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), this.name, getType());
	}

	@Override
	public String toString() {
		return this.name;
	}
}
