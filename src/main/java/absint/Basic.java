package absint;

import absint.stmt.Statement;

import java.util.List;

/**
 * A basic block: a straight-line list of statements.
 */
public final class Basic extends Node {
	public Basic(int id, List<? extends Statement> stmts) {
		super(id, stmts);
	}

	public Basic(int id, Statement... stmts) {
		this(id, List.of(stmts));
	}
}
