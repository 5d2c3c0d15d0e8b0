package absint.dataflow;

/**
 * The kind of block an analysis state is currently inside.
 */
public enum Scope {
	BRANCH,
	LOOP
}
