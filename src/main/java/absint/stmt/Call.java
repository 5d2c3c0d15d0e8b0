package absint.stmt;

import absint.type.ValueType;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A call to a function, method or operator.
 *
 * Operators are calls too: {@code x + 1} is {@code add(x, 1)}.
 */
public final class Call extends Statement {
	private final String name;
	private final ImmutableList<Statement> arguments;
	private final ValueType type;

	public Call(ProgramPoint pp, String name, List<? extends Statement> arguments, ValueType type) {
		super(pp);
		this.name = Objects.requireNonNull(name);
		this.arguments = ImmutableList.copyOf(arguments);
		this.type = Objects.requireNonNull(type);
	}

	public String getName() {
		return this.name;
	}

	public ImmutableList<Statement> getArguments() {
		return this.arguments;
	}

	/**
	 * @return The type of the call's result.
	 */
	public ValueType getType() {
		return this.type;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitCall(this, arg);
	}

	@Override
	public String toString() {
		return this.name + "(" + Joiner.on(", ").join(this.arguments) + ")";
	}
}
