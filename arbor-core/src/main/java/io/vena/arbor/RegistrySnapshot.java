package io.vena.arbor;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.pcollections.OrderedPMap;

/**
 * The durable part of an {@link ElementIdRegistry}, detached from it:
 * what gets written out when a document is closed and read back when it's reopened.
 *
 * <p>
 * Entries are kept in the order they were recorded, which is document order
 * for state produced by a reconciliation. That order decides fuzzy-match ties,
 * so encoders should preserve it.
 *
 * @see ElementIdRegistry#exportState()
 * @see ElementIdRegistry#loadState(RegistrySnapshot)
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RegistrySnapshot {
	/**
	 * {@link StructuralFingerprint#key() Fingerprint key} to identity.
	 */
	private final OrderedPMap<String, ElementId> idMap;

	/**
	 * Identity to the last fingerprint recorded for it.
	 */
	private final OrderedPMap<ElementId, StructuralFingerprint> fingerprints;

	private static final RegistrySnapshot EMPTY = new RegistrySnapshot(OrderedPMap.empty(), OrderedPMap.empty());

	public static RegistrySnapshot empty() {
		return EMPTY;
	}

	/**
	 * Copies the given maps, keeping their iteration order.
	 * Entries with a null key or value are dropped;
	 * other validation is left to {@link ElementIdRegistry#loadState}.
	 */
	public static RegistrySnapshot of(Map<String, ElementId> idMap, Map<ElementId, StructuralFingerprint> fingerprints) {
		return new RegistrySnapshot(withoutNulls(idMap), withoutNulls(fingerprints));
	}

	private static <K, V> OrderedPMap<K, V> withoutNulls(Map<K, V> map) {
		LinkedHashMap<K, V> result = new LinkedHashMap<>();
		map.forEach((k, v) -> {
			if (k != null && v != null) {
				result.put(k, v);
			}
		});
		return OrderedPMap.from(result);
	}

	public RegistrySnapshot withFingerprint(ElementId id, StructuralFingerprint fingerprint) {
		return new RegistrySnapshot(idMap.plus(fingerprint.key(), id), fingerprints.plus(id, fingerprint));
	}

	public boolean isEmpty() {
		return idMap.isEmpty() && fingerprints.isEmpty();
	}

	@Override
	public String toString() {
		return "RegistrySnapshot(" + fingerprints.size() + " fingerprints, " + idMap.size() + " keys)";
	}
}
