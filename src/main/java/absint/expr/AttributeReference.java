package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * An attribute reference, e.g. {@code x.real}.
 */
public final class AttributeReference extends Expression {
	private final Expression target;
	private final String attribute;

	public AttributeReference(ValueType type, Expression target, String attribute) {
		super(type);
		this.target = Objects.requireNonNull(target);
		this.attribute = Objects.requireNonNull(attribute);
	}

	public Expression getTarget() {
		return this.target;
	}

	public String getAttribute() {
		return this.attribute;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of(this.target);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitAttributeReference(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AttributeReference)) {
			return false;
		}

		var other = (AttributeReference) obj;
		return getType().equals(other.getType())
			&& this.target.equals(other.target)
			&& this.attribute.equals(other.attribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.target, this.attribute);
	}

	@Override
	public String toString() {
		return this.target + "." + this.attribute;
	}
}
