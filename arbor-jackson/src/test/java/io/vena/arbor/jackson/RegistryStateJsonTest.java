package io.vena.arbor.jackson;

import io.vena.arbor.ElementId;
import io.vena.arbor.ElementIdRegistry;
import io.vena.arbor.RegistrySnapshot;
import io.vena.arbor.ShapedNode;
import io.vena.arbor.exceptions.DeserializationException;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.util.Collections.unmodifiableList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegistryStateJsonTest {
	final RegistryStateJson json = new RegistryStateJson();

	static final class Node implements ShapedNode<Node> {
		final String type;
		final @Nullable String name;
		@Nullable Node parent;
		String field = "";
		final List<Node> children = new ArrayList<>();

		Node(String type, @Nullable String name) {
			this.type = type;
			this.name = name;
		}

		Node add(String field, Node child) {
			child.parent = this;
			child.field = field;
			children.add(child);
			return this;
		}

		@Override public String nodeType() { return type; }
		@Override public @Nullable Node parent() { return parent; }
		@Override public String containingField() { return field; }
		@Override public List<Node> children() { return unmodifiableList(children); }
		@Override public @Nullable String name() { return name; }
	}

	static Node diagram() {
		return new Node("StateMachine", "traffic")
			.add("states", new Node("State", "red").add("transitions", new Node("Transition", null)))
			.add("states", new Node("State", "green"))
			.add("states", new Node("State", "yellow"));
	}

	static List<Node> preOrder(Node root) {
		List<Node> result = new ArrayList<>();
		result.add(root);
		for (Node child: root.children) {
			result.addAll(preOrder(child));
		}
		return result;
	}

	@Test
	void persistedState_reproducesIdentitiesAfterReopen() {
		ElementIdRegistry<Node> before = ElementIdRegistry.forShapedNodes();
		Node original = diagram();
		before.reconcile(original);
		String persisted = json.write(before.exportState());

		ElementIdRegistry<Node> after = ElementIdRegistry.forShapedNodes();
		after.loadState(json.read(persisted));
		Node reparsed = diagram();
		after.reconcile(reparsed);

		List<Node> originalNodes = preOrder(original);
		List<Node> reparsedNodes = preOrder(reparsed);
		for (int i = 0; i < originalNodes.size(); i++) {
			ElementId expected = before.getIdentity(originalNodes.get(i));
			assertEquals(expected, after.getIdentity(reparsedNodes.get(i)), "Node " + i);
		}
		assertEquals(before.exportState(), after.exportState());
	}

	@Test
	void emptySnapshot() {
		assertEquals("{\"idMap\":{},\"fingerprints\":{}}", json.write(RegistrySnapshot.empty()));
		assertEquals(RegistrySnapshot.empty(), json.read("{}"));
	}

	@Test
	void indented() {
		String text = RegistryStateJson.indented().write(RegistrySnapshot.empty());
		assertThat(text, containsString("\n"));
		assertEquals(RegistrySnapshot.empty(), json.read(text));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"null",
		"[]",
		"42",
		"{\"idMap\":",
		"not json"
	})
	void unreadableState_throws(String text) {
		assertThrows(DeserializationException.class, () -> json.read(text));
	}
}
