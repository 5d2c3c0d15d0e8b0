package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A side-effect free expression over program variables.
 *
 * The set of subclasses is closed: every domain handles each shape through
 * an {@link ExpressionVisitor}.
 */
public abstract class Expression {
	private final ValueType type;

	protected Expression(ValueType type) {
		this.type = Objects.requireNonNull(type);
	}

	/**
	 * @return The static type of this expression.
	 */
	public ValueType getType() {
		return this.type;
	}

	/**
	 * @return The direct subexpressions of this expression.
	 */
	public abstract List<Expression> getChildren();

	/**
	 * Dispatch to the visitor method for this expression's shape.
	 */
	public abstract <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public abstract int hashCode();
}
