package io.vena.arbor;

import lombok.Value;

/**
 * What one {@link ElementIdRegistry#reconcile} call did.
 * Counts exclude the root, which is reported by {@link #rootReused}.
 */
@Value
public class ReconciliationStats {
	int total;
	int exactMatched;
	int fuzzyMatched;
	int freshlyAllocated;
	boolean rootReused;
	int registrySize;

	public int matched() {
		return exactMatched + fuzzyMatched;
	}
}
