package absint.expr;

import absint.type.ValueType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A dictionary display, e.g. {@code {k1: v1, k2: v2}}.
 */
public final class DictDisplay extends Expression {
	private final ImmutableList<Expression> keys;
	private final ImmutableList<Expression> values;

	public DictDisplay(ValueType type, List<? extends Expression> keys, List<? extends Expression> values) {
		super(type);
		Preconditions.checkArgument(keys.size() == values.size(), "Mismatched keys and values");
		this.keys = ImmutableList.copyOf(keys);
		this.values = ImmutableList.copyOf(values);
	}

	public ImmutableList<Expression> getKeys() {
		return this.keys;
	}

	public ImmutableList<Expression> getValues() {
		return this.values;
	}

	@Override
	public List<Expression> getChildren() {
		return ImmutableList.<Expression>builder()
			.addAll(this.keys)
			.addAll(this.values)
			.build();
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitDictDisplay(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof DictDisplay)) {
			return false;
		}

		var other = (DictDisplay) obj;
		return getType().equals(other.getType())
			&& this.keys.equals(other.keys)
			&& this.values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), this.keys, this.values);
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
