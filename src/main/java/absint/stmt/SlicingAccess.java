package absint.stmt;

import absint.type.ValueType;

import java.util.Objects;
import java.util.Optional;

/**
 * Access to a slicing, e.g. {@code xs[a:b:c]}.
 */
public final class SlicingAccess extends Statement {
	private final ValueType type;
	private final Statement target;
	private final Statement lower;
	private final Statement upper;
	private final Statement stride;

	public SlicingAccess(ProgramPoint pp, ValueType type, Statement target, Statement lower, Statement upper, Statement stride) {
		super(pp);
		this.type = Objects.requireNonNull(type);
		this.target = Objects.requireNonNull(target);
		this.lower = Objects.requireNonNull(lower);
		this.upper = upper;
		this.stride = stride;
	}

	public ValueType getType() {
		return this.type;
	}

	public Statement getTarget() {
		return this.target;
	}

	public Statement getLower() {
		return this.lower;
	}

	public Optional<Statement> getUpper() {
		return Optional.ofNullable(this.upper);
	}

	public Optional<Statement> getStride() {
		return Optional.ofNullable(this.stride);
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitSlicingAccess(this, arg);
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
