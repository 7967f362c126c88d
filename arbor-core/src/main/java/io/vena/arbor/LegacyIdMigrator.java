package io.vena.arbor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upgrades externally stored state keyed by an older, unstable identification scheme
 * (typically paths computed from the tree) to {@link ElementId} keys.
 * This is a one-time operation per document, done right after its first reconciliation.
 */
@RequiredArgsConstructor
public final class LegacyIdMigrator<N> {
	@NonNull private final ElementIdRegistry<N> registry;

	/**
	 * Walks the tree under <code>root</code>, which must be the tree most recently reconciled by the registry,
	 * and pairs each node's legacy id with its current identity.
	 * Nodes without an identity are left out.
	 *
	 * @param legacyIdFunction computes a node's id under the old scheme
	 * @return legacy id to identity, in document order
	 */
	public Map<String, ElementId> buildLegacyIdMapping(N root, Function<? super N, String> legacyIdFunction) {
		Map<String, ElementId> result = new LinkedHashMap<>();
		registry.shape().walk(root, node -> {
			ElementId id = registry.getIdentity(node);
			if (id != null) {
				String legacyId = legacyIdFunction.apply(node);
				ElementId previous = result.put(legacyId, id);
				if (previous != null) {
					LOGGER.warn("Legacy id \"{}\" is shared by {} and {}; keeping {}", legacyId, previous, id, id);
				}
			}
		});
		return result;
	}

	/**
	 * Re-keys <code>legacyKeyed</code> using a mapping from {@link #buildLegacyIdMapping}.
	 * Entries whose legacy key has no mapping belonged to elements that no longer exist, and are dropped.
	 */
	public static <V> Map<ElementId, V> rekey(Map<String, V> legacyKeyed, Map<String, ElementId> legacyIdMapping) {
		Map<ElementId, V> result = new LinkedHashMap<>();
		int dropped = 0;
		for (Map.Entry<String, V> entry: legacyKeyed.entrySet()) {
			ElementId id = legacyIdMapping.get(entry.getKey());
			if (id == null) {
				dropped++;
			} else {
				result.put(id, entry.getValue());
			}
		}
		LOGGER.debug("Re-keyed {} entries; dropped {} with no current element", result.size(), dropped);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LegacyIdMigrator.class);
}
