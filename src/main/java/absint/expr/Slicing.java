package absint.expr;

import absint.type.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A slicing, e.g. {@code xs[lower:upper:stride]}.
 */
public final class Slicing extends Expression {
	private final Expression target;
	private final Expression lower;
	private final Expression upper;
	private final Expression stride;

	/**
	 * @param upper
	 *         The upper bound, or null if omitted.
	 * @param stride
	 *         The stride, or null if omitted.
	 */
	public Slicing(ValueType type, Expression target, Expression lower, Expression upper, Expression stride) {
		super(type);
		this.target = Objects.requireNonNull(target);
		this.lower = Objects.requireNonNull(lower);
		this.upper = upper;
		this.stride = stride;
	}

	public Expression getTarget() {
		return this.target;
	}

	public Expression getLower() {
		return this.lower;
	}

	public Optional<Expression> getUpper() {
		return Optional.ofNullable(this.upper);
	}

	public Optional<Expression> getStride() {
		return Optional.ofNullable(this.stride);
	}

	@Override
	public List<Expression> getChildren() {
		var children = new ArrayList<Expression>();
		children.add(this.target);
		children.add(this.lower);
		getUpper().ifPresent(children::add);
		getStride().ifPresent(children::add);
		return children;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitSlicing(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Slicing)) {
			return false;
		}

		var other = (Slicing) obj;
		return getType().equals(other.getType())
			&& this.target.equals(other.target)
			&& this.lower.equals(other.lower)
			&& Objects.equals(this.upper, other.upper)
			&& Objects.equals(this.stride, other.stride);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.target, this.lower, this.upper, this.stride);
	}

	@Override
	public String toString() {
		var str = new StringBuilder()
			.append(this.target)
			.append("[")
			.append(this.lower)
			.append(":");
		getUpper().ifPresent(str::append);
		getStride().ifPresent(s -> str.append(":").append(s));
		return str.append("]").toString();
	}
}
