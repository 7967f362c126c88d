package io.vena.arbor;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import static java.util.UUID.randomUUID;

/**
 * An opaque identity for one logical element of a document.
 * Unlike the tree nodes it gets attached to, an <code>ElementId</code>
 * survives reparses, and is what external state (diagram layout, selection, undo)
 * should be keyed by.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class ElementId {
	@NonNull final String value;

	/**
	 * The {@link StructuralFingerprint#parentId() parent} of the root node.
	 */
	public static final ElementId ROOT_PARENT = new ElementId("root");

	/**
	 * Stands in for a parent whose identity could not be resolved.
	 * Never matches a stored fingerprint exactly.
	 */
	public static final ElementId UNKNOWN_PARENT = new ElementId("unknown");

	public static ElementId from(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("ElementId can't be empty");
		} else if (value.indexOf('/') >= 0) {
			// The slash is the separator in fingerprint keys
			throw new IllegalArgumentException("ElementId can't contain a slash: \"" + value + "\"");
		}
		return new ElementId(value);
	}

	public static ElementId random() {
		return new ElementId(randomUUID().toString());
	}

	public boolean isSentinel() {
		return this.equals(ROOT_PARENT) || this.equals(UNKNOWN_PARENT);
	}

	@Override public String toString() { return value; }
}
