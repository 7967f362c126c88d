package io.vena.arbor;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableMap;

/**
 * Remembers which identity was last seen at each {@link StructuralFingerprint#key() fingerprint key}.
 * Iteration order is insertion order.
 */
final class ExactMatchIndex {
	private final Map<String, ElementId> idsByKey = new LinkedHashMap<>();

	public @Nullable ElementId get(StructuralFingerprint fingerprint) {
		return idsByKey.get(fingerprint.key());
	}

	/**
	 * @return the identity previously stored under the same key, if any
	 */
	public @Nullable ElementId put(StructuralFingerprint fingerprint, ElementId id) {
		return idsByKey.put(fingerprint.key(), id);
	}

	public void put(String key, ElementId id) {
		idsByKey.put(key, id);
	}

	public void clear() {
		idsByKey.clear();
	}

	public int size() {
		return idsByKey.size();
	}

	public Map<String, ElementId> asMap() {
		return unmodifiableMap(idsByKey);
	}

	@Override
	public String toString() {
		return "ExactMatchIndex" + idsByKey;
	}
}
