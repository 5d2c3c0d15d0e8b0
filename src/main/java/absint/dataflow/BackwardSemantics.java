package absint.dataflow;

import absint.stmt.Assignment;

/**
 * Backward semantics: an assignment substitutes its right-hand side for its
 * left-hand side.
 */
public class BackwardSemantics extends Semantics {
	@Override
	public Void visitAssignment(Assignment stmt, State<?> state) {
		var lhs = evaluate(stmt.getLeft(), state);
		var rhs = evaluate(stmt.getRight(), state);
		state.substitute(lhs, rhs);
		return null;
	}
}
