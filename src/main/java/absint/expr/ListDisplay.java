package absint.expr;

import absint.type.ValueType;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A list display, e.g. {@code [a, b, c]}.
 */
public final class ListDisplay extends Expression {
	private final ImmutableList<Expression> items;

	public ListDisplay(ValueType type, List<? extends Expression> items) {
		super(type);
		this.items = ImmutableList.copyOf(items);
	}

	public ImmutableList<Expression> getItems() {
		return this.items;
	}

	@Override
	public List<Expression> getChildren() {
		return this.items;
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
		return visitor.visitListDisplay(this, arg);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof ListDisplay)) {
			return false;
		}

		var other = (ListDisplay) obj;
		return getType().equals(other.getType())
			&& this.items.equals(other.items);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ListDisplay.class, getType(), this.items);
	}

	@Override
	public String toString() {
		return "[" + Joiner.on(", ").join(this.items) + "]";
	}
}
