package io.vena.arbor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

import static io.vena.arbor.ElementId.UNKNOWN_PARENT;
import static java.util.Arrays.asList;

/**
 * Computes {@link StructuralFingerprint}s from a tree's current shape.
 * A node's fingerprint depends on the resolved identity of its parent,
 * so callers must work top-down.
 *
 * <p>
 * Sibling indexes count only earlier siblings with the same type in the same field,
 * and are recomputed from scratch every time.
 * Inserting or removing an earlier same-typed sibling shifts them;
 * that's what fuzzy matching is for.
 */
@RequiredArgsConstructor
public final class FingerprintExtractor<N> {
	@NonNull private final TreeShape<N> shape;

	@Value
	public static class ChildFingerprint<N> {
		N node;
		StructuralFingerprint fingerprint;
	}

	public StructuralFingerprint rootFingerprint(N root) {
		return StructuralFingerprint.forRoot(shape.nodeType(root), shape.name(root), shape.sourceOffset(root));
	}

	/**
	 * Fingerprints every child of <code>parent</code> in one pass over its children.
	 *
	 * @param parentId the identity already resolved for <code>parent</code>
	 * @return one entry per child, in document order
	 */
	public List<ChildFingerprint<N>> childFingerprints(N parent, ElementId parentId) {
		List<N> children = shape.children(parent);
		List<ChildFingerprint<N>> result = new ArrayList<>(children.size());
		Map<List<String>, Integer> counters = new HashMap<>();
		for (N child: children) {
			String field = shape.containingField(child);
			String type = shape.nodeType(child);
			int siblingIndex = counters.merge(asList(field, type), 1, Integer::sum) - 1;
			result.add(new ChildFingerprint<>(child, fingerprint(child, type, field, siblingIndex, parentId)));
		}
		return result;
	}

	/**
	 * Fingerprints a single node, scanning its siblings to find its index.
	 * Prefer {@link #childFingerprints} when fingerprinting a whole tree.
	 *
	 * @param parentIds resolves the parent's identity; may return null,
	 *   in which case the fingerprint gets {@link ElementId#UNKNOWN_PARENT}.
	 */
	public StructuralFingerprint fingerprint(N node, Function<? super N, ElementId> parentIds) {
		N parent = shape.parent(node);
		if (parent == null) {
			return rootFingerprint(node);
		}
		ElementId parentId = parentIds.apply(parent);
		if (parentId == null) {
			parentId = UNKNOWN_PARENT;
		}
		String field = shape.containingField(node);
		String type = shape.nodeType(node);
		int siblingIndex = 0;
		for (N sibling: shape.children(parent)) {
			if (sibling == node) {
				break;
			} else if (type.equals(shape.nodeType(sibling)) && field.equals(shape.containingField(sibling))) {
				siblingIndex++;
			}
		}
		return fingerprint(node, type, field, siblingIndex, parentId);
	}

	/**
	 * The fingerprint a node of the given type will have once it has been appended
	 * after the existing contents of <code>field</code> and the document has been reparsed.
	 */
	public StructuralFingerprint fingerprintForNewChild(N parent, ElementId parentId, String field, String nodeType, @Nullable String name) {
		int siblingIndex = 0;
		for (N sibling: shape.children(parent)) {
			if (nodeType.equals(shape.nodeType(sibling)) && field.equals(shape.containingField(sibling))) {
				siblingIndex++;
			}
		}
		return new StructuralFingerprint(nodeType, field, siblingIndex, parentId, name, null);
	}

	private StructuralFingerprint fingerprint(N node, String type, String field, int siblingIndex, ElementId parentId) {
		return new StructuralFingerprint(type, field, siblingIndex, parentId, shape.name(node), shape.sourceOffset(node));
	}
}
