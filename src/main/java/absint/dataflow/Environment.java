package absint.dataflow;

import absint.expr.VariableIdentifier;

/**
 * A state whose set of tracked variables can change.
 */
public interface Environment {
	/**
	 * Start tracking a variable, with an unknown value.
	 */
	void addVariable(VariableIdentifier variable);

	/**
	 * Stop tracking a variable.
	 */
	void removeVariable(VariableIdentifier variable);

	/**
	 * Forget everything known about a variable.
	 */
	void forgetVariable(VariableIdentifier variable);
}
