package absint.expr;

import absint.type.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * A call to {@code range(start, stop, step)}.
 */
public final class Range extends Expression {
	private final Expression start;
	private final Expression stop;
	private final Expression step;

	public Range(ValueType type, Expression start, Expression stop, Expression step) {
		super(type);
		this.start = Objects.requireNonNull(start);
		this.stop = Objects.requireNonNull(stop);
		this.step = Objects.requireNonNull(step);
	}

	public Expression getStart() {
		return this.start;
	}

	public Expression getStop() {
		return this.stop;
	}

	public Expression getStep() {
		return this.step;
	}

	@Override
	public List<Expression> getChildren() {
		return List.of(this.start, this.stop, this.step);
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitRange(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Range)) {
			return false;
		}

		var other = (Range) obj;
		return getType().equals(other.getType())
			&& this.start.equals(other.start)
			&& this.stop.equals(other.stop)
			&& this.step.equals(other.step);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.start, this.stop, this.step);
	}

	@Override
	public String toString() {
		return String.format("range(%s, %s, %s)", this.start, this.stop, this.step);
	}
}
