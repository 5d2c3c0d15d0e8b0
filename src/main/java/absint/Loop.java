package absint;

import java.util.List;

/**
 * A loop head.  It has no statements; widening happens here.
 */
public final class Loop extends Node {
	public Loop(int id) {
		super(id, List.of());
	}

	@Override
	public boolean isLoop() {
		return true;
	}
}
