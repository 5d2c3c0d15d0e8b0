package absint.stmt;

import java.util.Objects;

/**
 * A source location.
 */
public final class ProgramPoint {
	private final int line;
	private final int column;

	public ProgramPoint(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return this.line;
	}

	public int getColumn() {
		return this.column;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof ProgramPoint)) {
			return false;
		}

		var other = (ProgramPoint) obj;
		return this.line == other.line
			&& this.column == other.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.line, this.column);
	}

	@Override
	public String toString() {
		return String.format("@%d:%d", this.line, this.column);
	}
}
