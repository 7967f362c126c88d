package io.vena.arbor;

import io.vena.arbor.ReconcilerSettings.FuzzyWeights;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * Scores how plausibly a freshly computed fingerprint describes the same
 * element as a stored one, for nodes whose exact key found nothing.
 *
 * <p>
 * Matching is greedy: each node takes the best candidate still available when
 * its turn comes, in traversal order. This is not an optimal assignment.
 *
 * <p>
 * Equal scores are broken, in order, by:
 * <ol><li>
 *     a candidate with the same name over one without;
 * </li><li>
 *     the candidate whose recorded source offset is closest, when both offsets are known;
 * </li><li>
 *     the candidate recorded earliest. Stored fingerprints are kept in document order,
 *     so that's the one that appeared first in the previous version of the document.
 * </li></ol>
 */
@RequiredArgsConstructor
public final class FuzzyMatcher {
	@NonNull private final ReconcilerSettings settings;

	public int score(StructuralFingerprint candidate, StructuralFingerprint stored) {
		if (!candidate.nodeType().equals(stored.nodeType())) {
			return 0;
		}
		FuzzyWeights w = settings.weights();
		int score = w.type();
		if (candidate.parentId().equals(stored.parentId())) {
			score += w.parent();
		}
		if (candidate.containingField().equals(stored.containingField())) {
			score += w.containingField();
		}
		if (sameName(candidate, stored)) {
			score += w.name();
		}
		if (candidate.siblingIndex() == stored.siblingIndex()) {
			score += w.siblingIndex();
		}
		return score;
	}

	static boolean sameName(StructuralFingerprint a, StructuralFingerprint b) {
		return a.hasName() && b.hasName() && Objects.equals(a.name(), b.name());
	}

	private static long offsetDistance(StructuralFingerprint a, StructuralFingerprint b) {
		if (a.sourceOffset() == null || b.sourceOffset() == null) {
			return Long.MAX_VALUE;
		} else {
			return Math.abs((long) a.sourceOffset() - b.sourceOffset());
		}
	}

	public boolean isAcceptable(int score) {
		return score >= settings.fuzzyThreshold();
	}

	/**
	 * @param stored every stored fingerprint, in the order they were recorded
	 * @param claimed identities that are already taken and must not be offered
	 */
	public CandidatePool newPool(Map<ElementId, StructuralFingerprint> stored, Set<ElementId> claimed) {
		CandidatePool pool = new CandidatePool();
		stored.forEach((id, fp) -> {
			if (!claimed.contains(id)) {
				pool.add(id, fp);
			}
		});
		return pool;
	}

	/**
	 * The stored fingerprints still available during one reconciliation,
	 * grouped by type so a candidate is only compared against fingerprints it could match.
	 */
	public final class CandidatePool {
		private final Map<String, Map<ElementId, StructuralFingerprint>> byType = new HashMap<>();
		private final Map<ElementId, String> typeById = new HashMap<>();

		private CandidatePool() { }

		void add(ElementId id, StructuralFingerprint fp) {
			byType.computeIfAbsent(fp.nodeType(), __ -> new LinkedHashMap<>()).put(id, fp);
			typeById.put(id, fp.nodeType());
		}

		/**
		 * Finds the best-scoring acceptable candidate for <code>fingerprint</code>
		 * and takes it out of the pool.
		 *
		 * @return the claimed identity, or null if nothing scored high enough
		 */
		public @Nullable ElementId claimBestMatch(StructuralFingerprint fingerprint) {
			Map<ElementId, StructuralFingerprint> sameType = byType.get(fingerprint.nodeType());
			if (sameType == null) {
				return null;
			}
			ElementId bestId = null;
			int bestScore = 0;
			boolean bestNamed = false;
			long bestDistance = Long.MAX_VALUE;
			for (Entry<ElementId, StructuralFingerprint> entry: sameType.entrySet()) {
				StructuralFingerprint stored = entry.getValue();
				int score = score(fingerprint, stored);
				if (!isAcceptable(score) || score < bestScore) {
					continue;
				}
				boolean named = sameName(fingerprint, stored);
				long distance = offsetDistance(fingerprint, stored);
				if (score > bestScore
					|| (named && !bestNamed)
					|| (named == bestNamed && distance < bestDistance)
				) {
					bestId = entry.getKey();
					bestScore = score;
					bestNamed = named;
					bestDistance = distance;
				}
			}
			if (bestId != null) {
				remove(bestId);
			}
			return bestId;
		}

		/**
		 * Withdraws an identity that got claimed some other way.
		 */
		public void remove(ElementId id) {
			String type = typeById.remove(id);
			if (type != null) {
				Map<ElementId, StructuralFingerprint> sameType = byType.get(type);
				sameType.remove(id);
				if (sameType.isEmpty()) {
					byType.remove(type);
				}
			}
		}

		public boolean contains(ElementId id) {
			return typeById.containsKey(id);
		}

		public int size() {
			return typeById.size();
		}
	}
}
