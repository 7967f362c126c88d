package io.vena.arbor;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A tree node that can describe its own position.
 * Implement this on your AST classes to avoid writing a separate {@link TreeShape}.
 *
 * @see TreeShape#shapedNodes()
 */
public interface ShapedNode<N extends ShapedNode<N>> {
	String nodeType();
	@Nullable N parent();
	String containingField();
	List<N> children();

	default @Nullable String name() { return null; }
	default @Nullable Integer sourceOffset() { return null; }
}
