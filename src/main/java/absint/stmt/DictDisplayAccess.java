package absint.stmt;

import absint.type.ValueType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Construction of a dictionary from key and value statements.
 */
public final class DictDisplayAccess extends Statement {
	private final ValueType type;
	private final ImmutableList<Statement> keys;
	private final ImmutableList<Statement> values;

	public DictDisplayAccess(ProgramPoint pp, ValueType type, List<? extends Statement> keys, List<? extends Statement> values) {
		super(pp);
		Preconditions.checkArgument(keys.size() == values.size(), "Mismatched keys and values");
		this.type = type;
		this.keys = ImmutableList.copyOf(keys);
		this.values = ImmutableList.copyOf(values);
	}

	public ValueType getType() {
		return this.type;
	}

	public ImmutableList<Statement> getKeys() {
		return this.keys;
	}

	public ImmutableList<Statement> getValues() {
		return this.values;
	}

	@Override
	public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
		return visitor.visitDictDisplayAccess(this, arg);
	}

	@Override
	public String toString() {
		var str = new StringBuilder("{");
		for (int i = 0; i < this.keys.size(); ++i) {
			if (i > 0) {
				str.append(", ");
			}
			str.append(this.keys.get(i))
				.append(": ")
				.append(this.values.get(i));
		}
		return str.append("}").toString();
	}
}
