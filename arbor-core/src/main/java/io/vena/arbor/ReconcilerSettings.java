package io.vena.arbor;

import java.util.function.Supplier;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Tuning for {@link ElementIdRegistry}.
 * The defaults are what arbor has always used; changing them changes which
 * edits preserve identities, so persisted state written under one set of
 * weights may reconcile differently under another.
 */
@Value
@Builder
public class ReconcilerSettings {
	@Default FuzzyWeights weights = FuzzyWeights.builder().build();

	/**
	 * A fuzzy candidate needs at least this score to be accepted.
	 */
	@Default int fuzzyThreshold = 55;

	/**
	 * When true, an exact key match is not taken if both sides are named, the names differ,
	 * and an unclaimed sibling in the same field was recorded under the node's name
	 * at a sibling index the new tree no longer has.
	 * The node then goes through fuzzy matching instead.
	 * This keeps a node that slid into a deleted sibling's position from inheriting that sibling's identity,
	 * while names edited in place still keep their positional identities.
	 */
	@Default boolean namesContestExactMatches = true;

	/**
	 * Mints identities for nodes that match nothing.
	 */
	@Default Supplier<ElementId> idGenerator = ElementId::random;

	public static ReconcilerSettings defaults() {
		return builder().build();
	}

	/**
	 * Points awarded by {@link FuzzyMatcher#score} per matching attribute.
	 * A type mismatch always scores zero.
	 */
	@Value
	@Builder
	public static class FuzzyWeights {
		@Default int type = 40;
		@Default int parent = 25;
		@Default int containingField = 15;
		@Default int name = 10;
		@Default int siblingIndex = 10;

		public int maximum() {
			return type + parent + containingField + name + siblingIndex;
		}
	}

	public void validate() {
		if (weights.type() < 0 || weights.parent() < 0 || weights.containingField() < 0 || weights.name() < 0 || weights.siblingIndex() < 0) {
			throw new IllegalArgumentException("Fuzzy weights can't be negative: " + weights);
		}
		if (fuzzyThreshold <= 0) {
			// Zero would let any same-typed candidate match, however unrelated
			throw new IllegalArgumentException("Fuzzy threshold must be positive: " + fuzzyThreshold);
		}
		if (idGenerator == null) {
			throw new IllegalArgumentException("idGenerator is required");
		}
	}

}
