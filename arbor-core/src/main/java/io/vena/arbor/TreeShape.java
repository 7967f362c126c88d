package io.vena.arbor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * Tells arbor what it needs to know about a parser's tree nodes,
 * so that no parser-specific types leak into the registry.
 *
 * <p>
 * Implementations must be cheap and side-effect free:
 * every method is called at least once per node on every reconciliation.
 *
 * @param <N> The parser's node type
 */
public interface TreeShape<N> {
	/**
	 * A tag naming the grammar rule or class of the node, like <code>"Entity"</code>.
	 */
	String nodeType(N node);

	/**
	 * @return the node containing this one, or null for the root.
	 */
	@Nullable N parent(N node);

	/**
	 * @return the name of the parent's property that holds this node,
	 * like <code>"entities"</code>, or the empty string for the root.
	 */
	String containingField(N node);

	/**
	 * @return the directly contained nodes, in document order.
	 */
	List<N> children(N node);

	/**
	 * A human-readable label, if the node has one.
	 * Used only as a hint for fuzzy matching.
	 */
	default @Nullable String name(N node) {
		return null;
	}

	/**
	 * The node's position in the source text, if known.
	 */
	default @Nullable Integer sourceOffset(N node) {
		return null;
	}

	/**
	 * Visits <code>root</code> and all its descendants in pre-order,
	 * so every node is visited after its parent.
	 */
	default void walk(N root, Consumer<? super N> action) {
		Deque<N> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			N node = stack.pop();
			action.accept(node);
			List<N> children = children(node);
			for (ListIterator<N> iter = children.listIterator(children.size()); iter.hasPrevious(); ) {
				stack.push(iter.previous());
			}
		}
	}

	/**
	 * For trees whose nodes describe themselves by implementing {@link ShapedNode}.
	 */
	static <NN extends ShapedNode<NN>> TreeShape<NN> shapedNodes() {
		return new TreeShape<>() {
			@Override public String nodeType(NN node) { return node.nodeType(); }
			@Override public @Nullable NN parent(NN node) { return node.parent(); }
			@Override public String containingField(NN node) { return node.containingField(); }
			@Override public List<NN> children(NN node) { return node.children(); }
			@Override public @Nullable String name(NN node) { return node.name(); }
			@Override public @Nullable Integer sourceOffset(NN node) { return node.sourceOffset(); }
		};
	}
}
