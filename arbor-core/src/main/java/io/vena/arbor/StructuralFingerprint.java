package io.vena.arbor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

import static io.vena.arbor.ElementId.ROOT_PARENT;

/**
 * Describes where a node sits in its tree:
 * its type, the field of its parent that holds it,
 * its position among same-typed siblings in that field,
 * and the identity of that parent.
 *
 * <p>
 * {@link #name} and {@link #sourceOffset} are hints only.
 * They are carried along for fuzzy matching and diagnostics,
 * but they never participate in {@link #key()}.
 *
 * <p>
 * Note that {@link #equals} is ordinary value equality over every field;
 * for the exact-match notion of "same position", use {@link #hasSameKeyAs}.
 */
@Value
@With
public class StructuralFingerprint {
	String nodeType;
	String containingField;
	int siblingIndex;
	ElementId parentId;
	@Nullable String name;
	@Nullable Integer sourceOffset;

	@Builder(toBuilder = true)
	public StructuralFingerprint(@NonNull String nodeType, @NonNull String containingField, int siblingIndex, @NonNull ElementId parentId, @Nullable String name, @Nullable Integer sourceOffset) {
		if (nodeType.isEmpty()) {
			throw new IllegalArgumentException("Node type can't be empty");
		}
		if (siblingIndex < 0) {
			throw new IllegalArgumentException("Negative sibling index " + siblingIndex + " for " + nodeType);
		}
		this.nodeType = nodeType;
		this.containingField = containingField;
		this.siblingIndex = siblingIndex;
		this.parentId = parentId;
		this.name = name;
		this.sourceOffset = sourceOffset;
	}

	public static StructuralFingerprint forRoot(String nodeType, @Nullable String name, @Nullable Integer sourceOffset) {
		return new StructuralFingerprint(nodeType, "", 0, ROOT_PARENT, name, sourceOffset);
	}

	/**
	 * @return <code>"{parentId}/{containingField}/{siblingIndex}/{nodeType}"</code>
	 */
	public String key() {
		return parentId + "/" + containingField + "/" + siblingIndex + "/" + nodeType;
	}

	public boolean hasSameKeyAs(StructuralFingerprint other) {
		return siblingIndex == other.siblingIndex
			&& nodeType.equals(other.nodeType)
			&& containingField.equals(other.containingField)
			&& parentId.equals(other.parentId);
	}

	public boolean isRoot() {
		return ROOT_PARENT.equals(parentId) && containingField.isEmpty();
	}

	public boolean hasName() {
		return name != null;
	}
}
