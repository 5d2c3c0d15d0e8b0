package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A subscription, e.g. {@code d[k]}.
 */
public final class Subscription extends Expression {
	private final Expression target;
	private final Expression key;

	public Subscription(ValueType type, Expression target, Expression key) {
		super(type);
		this.target = Objects.requireNonNull(target);
		this.key = Objects.requireNonNull(key);
	}

	public Expression getTarget() {
		return this.target;
	}

	public Expression getKey() {
		return this.key;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of(this.target, this.key);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitSubscription(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Subscription)) {
			return false;
		}

		var other = (Subscription) obj;
		return getType().equals(other.getType())
			&& this.target.equals(other.target)
			&& this.key.equals(other.key);
	}

	@Override
	public int hashCode() {
		return Objects.hash(Subscription.class, getType(), this.target, this.key);
	}

	@Override
	public String toString() {
		return this.target + "[" + this.key + "]";
	}
}
