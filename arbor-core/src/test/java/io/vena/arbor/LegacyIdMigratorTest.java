package io.vena.arbor;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.arbor.SampleNode.node;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegacyIdMigratorTest {
	ElementIdRegistry<SampleNode> registry;
	SampleNode root;

	@BeforeEach
	void reconcileDocument() {
		registry = ElementIdRegistry.forShapedNodes();
		root = node("Model", "m").with("entities",
			node("Entity", "Customer").with("attributes", node("Attribute", "id")),
			node("Entity", "Order"));
		registry.reconcile(root);
	}

	/**
	 * The kind of path-based id older layout files were keyed by.
	 */
	static String pathOf(SampleNode node) {
		SampleNode parent = node.parent();
		if (parent == null) {
			return "";
		}
		int index = parent.children().indexOf(node);
		return pathOf(parent) + "/" + node.containingField() + "@" + index;
	}

	@Test
	void mapping_coversWholeTreeInDocumentOrder() {
		Map<String, ElementId> mapping = registry.buildLegacyIdMapping(root, LegacyIdMigratorTest::pathOf);
		assertEquals(asList("", "/entities@0", "/entities@0/attributes@0", "/entities@1"), asList(mapping.keySet().toArray(new String[0])));
		assertEquals(registry.getIdentity(root), mapping.get(""));
		assertEquals(registry.getIdentity(root.child(0).child(0)), mapping.get("/entities@0/attributes@0"));
		assertEquals(registry.getIdentity(root.child(1)), mapping.get("/entities@1"));
	}

	@Test
	void duplicateLegacyIds_lastOneWins() {
		Map<String, ElementId> mapping = registry.buildLegacyIdMapping(root, SampleNode::nodeType);
		assertEquals(registry.getIdentity(root.child(1)), mapping.get("Entity"));
		assertEquals(3, mapping.size());
	}

	@Test
	void nodesOutsideCurrentGeneration_areLeftOut() {
		SampleNode stranger = node("Model", "other").with("entities", node("Entity", "X"));
		assertTrue(registry.buildLegacyIdMapping(stranger, LegacyIdMigratorTest::pathOf).isEmpty());
	}

	@Test
	void rekey_dropsVanishedElements() {
		Map<String, ElementId> mapping = registry.buildLegacyIdMapping(root, LegacyIdMigratorTest::pathOf);
		Map<String, String> layout = new LinkedHashMap<>();
		layout.put("/entities@1", "x=10,y=20");
		layout.put("/entities@0", "x=30,y=40");
		layout.put("/entities@7", "x=0,y=0");

		Map<ElementId, String> rekeyed = LegacyIdMigrator.rekey(layout, mapping);

		Map<ElementId, String> expected = new LinkedHashMap<>();
		expected.put(registry.getIdentity(root.child(1)), "x=10,y=20");
		expected.put(registry.getIdentity(root.child(0)), "x=30,y=40");
		assertEquals(expected, rekeyed);
		assertEquals(asList(expected.keySet().toArray()), asList(rekeyed.keySet().toArray()));
	}
}
