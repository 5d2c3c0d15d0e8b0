package absint.stmt;

import absint.type.ValueType;

import java.util.Objects;

/**
 * Access to a subscription, e.g. {@code d[k]}.
 */
public final class SubscriptionAccess extends Statement {
	private final ValueType type;
	private final Statement target;
	private final Statement key;

	public SubscriptionAccess(ProgramPoint pp, ValueType type, Statement target, Statement key) {
		super(pp);
		this.type = Objects.requireNonNull(type);
		this.target = Objects.requireNonNull(target);
		this.key = Objects.requireNonNull(key);
	}

	/**
	 * @return The type of the accessed element.
	 */
	public ValueType getType() {
		return this.type;
	}

	public Statement getTarget() {
		return this.target;
	}

	public Statement getKey() {
		return this.key;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitSubscriptionAccess(this, arg);
	}

	@Override
	public String toString() {
		return this.target + "[" + this.key + "]";
	}
}
