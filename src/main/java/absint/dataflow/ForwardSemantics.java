package absint.dataflow;

import absint.stmt.Assignment;

/**
 * Forward semantics: an assignment updates the state with its right-hand
 * side.
 */
public class ForwardSemantics extends Semantics {
	@Override
	public Void visitAssignment(Assignment stmt, State<?> state) {
		var rhs = evaluate(stmt.getRight(), state);
		var lhs = evaluate(stmt.getLeft(), state);
		state.assign(lhs, rhs);
		return null;
	}
}
