package absint.stmt;

import absint.type.ValueType;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Construction of a set from item statements.
 */
public final class SetDisplayAccess extends Statement {
	private final ValueType type;
	private final ImmutableList<Statement> items;

	public SetDisplayAccess(ProgramPoint pp, ValueType type, List<? extends Statement> items) {
		super(pp);
		this.type = type;
		this.items = ImmutableList.copyOf(items);
	}

	public ValueType getType() {
		return this.type;
	}

	public ImmutableList<Statement> getItems() {
		return this.items;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitSetDisplayAccess(this, arg);
	}

	@Override
	public String toString() {
		return "{" + Joiner.on(", ").join(this.items) + "}";
	}
}
