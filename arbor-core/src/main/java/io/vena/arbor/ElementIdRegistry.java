package io.vena.arbor;

import io.vena.arbor.FingerprintExtractor.ChildFingerprint;
import io.vena.arbor.FuzzyMatcher.CandidatePool;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Assigns stable {@link ElementId}s to the nodes of a tree that gets rebuilt from
 * scratch on every reparse.
 *
 * <p>
 * Each call to {@link #reconcile} matches the new tree against the fingerprints
 * recorded by the previous call, in three phases:
 * <ol><li>
 *     Exact: a node whose {@link StructuralFingerprint#key() key} was recorded
 *     gets the identity recorded for it.
 * </li><li>
 *     Fuzzy: remaining nodes take the best-scoring leftover identity of the same type
 *     (see {@link FuzzyMatcher}).
 * </li><li>
 *     Fresh: anything still unmatched gets a new identity.
 * </li></ol>
 * The recorded fingerprints are then replaced by those of the new tree,
 * so identities of nodes that disappeared are forgotten.
 *
 * <p>
 * Identities are only attached to nodes for one <em>generation</em>:
 * {@link #getIdentity} and {@link #getAstNode} answer for the tree most recently
 * passed to {@link #reconcile}, and nodes of older trees are not retained.
 *
 * <p>
 * Create one registry per open document, and don't share it:
 * it has no internal synchronization, and reconciliations of the same
 * document must not overlap.
 *
 * @param <N> The parser's node type
 * @see DocumentRegistries
 */
public class ElementIdRegistry<N> {
	@Getter(AccessLevel.PACKAGE) private final TreeShape<N> shape;
	@Getter private final ReconcilerSettings settings;
	private final FingerprintExtractor<N> extractor;
	private final FuzzyMatcher fuzzyMatcher;

	// Durable state
	private final Map<ElementId, StructuralFingerprint> storedFingerprints = new LinkedHashMap<>();
	private final ExactMatchIndex exactIndex = new ExactMatchIndex();

	// Current generation
	private Generation<N> generation = new Generation<>();

	public ElementIdRegistry(TreeShape<N> shape) {
		this(shape, ReconcilerSettings.defaults());
	}

	public ElementIdRegistry(@NonNull TreeShape<N> shape, @NonNull ReconcilerSettings settings) {
		settings.validate();
		this.shape = shape;
		this.settings = settings;
		this.extractor = new FingerprintExtractor<>(shape);
		this.fuzzyMatcher = new FuzzyMatcher(settings);
	}

	public static <NN extends ShapedNode<NN>> ElementIdRegistry<NN> forShapedNodes() {
		return new ElementIdRegistry<NN>(TreeShape.<NN>shapedNodes());
	}

	/**
	 * @return the identity assigned to <code>node</code> by the most recent
	 * {@link #reconcile}, or null if the node isn't part of that tree.
	 */
	public @Nullable ElementId getIdentity(N node) {
		return generation.idsByNode.get(node);
	}

	/**
	 * @return the node of the most recently reconciled tree that holds <code>id</code>,
	 * or null if there's no such node.
	 */
	public @Nullable N getAstNode(ElementId id) {
		return generation.nodesById.get(id);
	}

	/**
	 * @return the identities of the current generation, in document order
	 */
	public Set<ElementId> currentIdentities() {
		return unmodifiableMap(generation.nodesById).keySet();
	}

	public @Nullable StructuralFingerprint storedFingerprint(ElementId id) {
		return storedFingerprints.get(id);
	}

	public FingerprintExtractor<N> extractor() {
		return extractor;
	}

	/**
	 * Assigns an identity to every node of the freshly parsed tree under <code>root</code>
	 * and starts a new generation.
	 * Structural differences from the previous tree never cause an exception;
	 * at worst, a node gets a fresh identity.
	 */
	public ReconciliationStats reconcile(@NonNull N root) {
		Generation<N> next = new Generation<>();
		Set<ElementId> claimed = new HashSet<>();

		StructuralFingerprint rootFingerprint = extractor.rootFingerprint(root);
		ElementId rootId = storedRootId();
		boolean rootReused = (rootId != null);
		if (rootId == null) {
			rootId = mintFresh(claimed);
		}
		claimed.add(rootId);

		NamedSiblings namedSiblings = settings.namesContestExactMatches()? new NamedSiblings(storedFingerprints) : null;
		List<Slot<N>> slots = new ArrayList<>();
		List<Slot<N>> deferred = new ArrayList<>();
		int exactMatched = 0;
		int fuzzyMatched = 0;
		int freshlyAllocated = 0;

		// Phase 1: exact matches, top-down.
		// A slot has no fingerprint yet if its parent is still unresolved.
		Deque<Slot<N>> stack = new ArrayDeque<>();
		pushAll(stack, fingerprintedSlots(root, rootId));
		while (!stack.isEmpty()) {
			Slot<N> slot = stack.pop();
			slots.add(slot);
			if (slot.fingerprint != null) {
				ElementId hit = exactIndex.get(slot.fingerprint);
				if (hit != null && !claimed.contains(hit) && !isContested(slot.node, slot.fingerprint, hit, claimed, namedSiblings)) {
					claimed.add(hit);
					slot.id = hit;
					exactMatched++;
				}
			}
			if (slot.id == null) {
				deferred.add(slot);
				slot.children = unfingerprintedSlots(slot.node);
				pushAll(stack, slot.children);
			} else {
				pushAll(stack, fingerprintedSlots(slot.node, slot.id));
			}
		}

		// Phases 2 and 3, in traversal order, so each parent is resolved before its children.
		// Fresh identities never enter the pool, so allocating them as we go
		// gives the same result as allocating them after all fuzzy matching.
		CandidatePool pool = fuzzyMatcher.newPool(storedFingerprints, claimed);
		for (Slot<N> slot: deferred) {
			StructuralFingerprint fingerprint = requireNonNull(slot.fingerprint);
			if (slot.fingerprintedLate) {
				ElementId hit = exactIndex.get(fingerprint);
				if (hit != null && !claimed.contains(hit) && !isContested(slot.node, fingerprint, hit, claimed, namedSiblings)) {
					claimed.add(hit);
					pool.remove(hit);
					slot.id = hit;
					exactMatched++;
				}
			}
			if (slot.id == null) {
				ElementId match = pool.claimBestMatch(fingerprint);
				if (match != null) {
					claimed.add(match);
					slot.id = match;
					fuzzyMatched++;
				}
			}
			if (slot.id == null) {
				slot.id = mintFresh(claimed);
				freshlyAllocated++;
			}
			fingerprintChildren(slot);
		}

		// Rebuild durable state from this tree alone; anything not in it is forgotten
		storedFingerprints.clear();
		exactIndex.clear();
		record(rootId, rootFingerprint);
		next.assign(root, rootId);
		for (Slot<N> slot: slots) {
			record(slot.id, slot.fingerprint);
			next.assign(slot.node, slot.id);
		}
		generation = next;

		ReconciliationStats stats = new ReconciliationStats(slots.size(), exactMatched, fuzzyMatched, freshlyAllocated, rootReused, storedFingerprints.size());
		LOGGER.debug("Reconciled {} nodes: {} exact, {} fuzzy, {} fresh; root {}; registry size {}",
			stats.total(), stats.exactMatched(), stats.fuzzyMatched(), stats.freshlyAllocated(),
			rootReused? "reused" : "allocated", stats.registrySize());
		return stats;
	}

	/**
	 * Records <code>fingerprint</code> as belonging to <code>id</code> ahead of time,
	 * so that the next {@link #reconcile} gives <code>id</code> to the node that appears there.
	 * Replaces any identity already recorded under the same {@link StructuralFingerprint#key() key}.
	 *
	 * <p>
	 * Meant for operations that create an element: they can pick its identity
	 * before the document has even been reparsed, and use it right away,
	 * for instance to place the new diagram node where the user dropped it.
	 */
	public void registerNewIdentity(@NonNull ElementId id, @NonNull StructuralFingerprint fingerprint) {
		if (id.isSentinel()) {
			throw new IllegalArgumentException("Reserved ElementId can't be registered: " + id);
		}
		ElementId displaced = exactIndex.put(fingerprint, id);
		storedFingerprints.put(id, fingerprint);
		if (displaced != null && !displaced.equals(id)) {
			LOGGER.debug("Pre-registered {} at {}, displacing {}", id, fingerprint.key(), displaced);
		}
	}

	/**
	 * Mints and {@link #registerNewIdentity registers} an identity for a node about to be
	 * appended to <code>field</code> of <code>parent</code>.
	 *
	 * @param parent a node of the current generation
	 * @return the identity the new node will have after the next {@link #reconcile}
	 */
	public ElementId preRegisterChild(N parent, String field, String nodeType, @Nullable String name) {
		ElementId parentId = getIdentity(parent);
		if (parentId == null) {
			throw new IllegalArgumentException("Parent node is not part of the current generation");
		}
		StructuralFingerprint fingerprint = extractor.fingerprintForNewChild(parent, parentId, field, nodeType, name);
		ElementId id = mintFresh(new HashSet<>(generation.nodesById.keySet()));
		registerNewIdentity(id, fingerprint);
		return id;
	}

	public RegistrySnapshot exportState() {
		return RegistrySnapshot.of(exactIndex.asMap(), storedFingerprints);
	}

	/**
	 * Replaces the durable state with <code>snapshot</code>, skipping entries that can't be used,
	 * like a fingerprint recorded under a reserved identity.
	 * Keys whose identity ends up without a fingerprint are skipped too.
	 * Also ends the current generation: no nodes have identities until the next {@link #reconcile}.
	 *
	 * <p>
	 * Call this when a document is opened, before its first reconciliation.
	 */
	public void loadState(@NonNull RegistrySnapshot snapshot) {
		clear();
		int skipped = 0;
		for (Entry<ElementId, StructuralFingerprint> entry: snapshot.fingerprints().entrySet()) {
			ElementId id = entry.getKey();
			StructuralFingerprint fingerprint = entry.getValue();
			if (id.isSentinel() || id.equals(fingerprint.parentId())) {
				LOGGER.warn("Skipping unusable fingerprint for {}: {}", id, fingerprint);
				skipped++;
			} else {
				storedFingerprints.put(id, fingerprint);
			}
		}
		for (Entry<String, ElementId> entry: snapshot.idMap().entrySet()) {
			String key = entry.getKey();
			ElementId id = entry.getValue();
			if (key.isBlank() || id.isSentinel() || !storedFingerprints.containsKey(id)) {
				LOGGER.warn("Skipping unusable key entry \"{}\" -> {}", key, id);
				skipped++;
			} else {
				exactIndex.put(key, id);
			}
		}
		LOGGER.debug("Loaded {} fingerprints and {} keys; skipped {}", storedFingerprints.size(), exactIndex.size(), skipped);
	}

	/**
	 * @see LegacyIdMigrator#buildLegacyIdMapping
	 */
	public Map<String, ElementId> buildLegacyIdMapping(N root, Function<? super N, String> legacyIdFunction) {
		return new LegacyIdMigrator<>(this).buildLegacyIdMapping(root, legacyIdFunction);
	}

	/**
	 * Forgets everything: durable state and the current generation.
	 */
	public void clear() {
		storedFingerprints.clear();
		exactIndex.clear();
		generation = new Generation<>();
	}

	public int registrySize() {
		return storedFingerprints.size();
	}

	private @Nullable ElementId storedRootId() {
		for (Entry<ElementId, StructuralFingerprint> entry: storedFingerprints.entrySet()) {
			if (entry.getValue().isRoot()) {
				return entry.getKey();
			}
		}
		return null;
	}

	/**
	 * An exact hit is contested when the node's name disagrees with the one recorded for the hit,
	 * and an unclaimed sibling was recorded under the node's name at a position that no longer exists.
	 * That's a sibling that slid into a deleted one's slot. A rival whose old slot is still occupied
	 * means the names were merely edited in place, and the positional match stands.
	 */
	private boolean isContested(N node, StructuralFingerprint candidate, ElementId hit, Set<ElementId> claimed, @Nullable NamedSiblings namedSiblings) {
		if (namedSiblings == null || !candidate.hasName()) {
			return false;
		}
		StructuralFingerprint stored = storedFingerprints.get(hit);
		if (stored == null || !stored.hasName() || FuzzyMatcher.sameName(candidate, stored)) {
			return false;
		}
		int occupiedSlots = -1;
		for (ElementId rival: namedSiblings.idsNamedLike(candidate)) {
			if (rival.equals(hit) || claimed.contains(rival)) {
				continue;
			}
			if (occupiedSlots < 0) {
				occupiedSlots = sameKindSiblingCount(node, candidate);
			}
			if (storedFingerprints.get(rival).siblingIndex() >= occupiedSlots) {
				LOGGER.trace("Exact match of {} to {} is contested by {}", candidate.key(), hit, rival);
				return true;
			}
		}
		return false;
	}

	/**
	 * @return how many children of <code>node</code>'s parent share its type and containing field,
	 * <code>node</code> included
	 */
	private int sameKindSiblingCount(N node, StructuralFingerprint fingerprint) {
		N parent = shape.parent(node);
		if (parent == null) {
			return 1;
		}
		int result = 0;
		for (N sibling: shape.children(parent)) {
			if (fingerprint.nodeType().equals(shape.nodeType(sibling)) && fingerprint.containingField().equals(shape.containingField(sibling))) {
				result++;
			}
		}
		return result;
	}

	private void record(ElementId id, StructuralFingerprint fingerprint) {
		storedFingerprints.put(id, fingerprint);
		exactIndex.put(fingerprint, id);
	}

	/**
	 * @param inUse identities that must not be returned; the result is added to it
	 */
	private ElementId mintFresh(Set<ElementId> inUse) {
		for (int attempt = 1; attempt <= MAX_MINT_ATTEMPTS; attempt++) {
			ElementId candidate = requireNonNull(settings.idGenerator().get(), "idGenerator returned null");
			if (!candidate.isSentinel() && !storedFingerprints.containsKey(candidate) && inUse.add(candidate)) {
				return candidate;
			}
		}
		throw new IllegalStateException("idGenerator produced no unused ElementId in " + MAX_MINT_ATTEMPTS + " attempts");
	}

	private List<Slot<N>> fingerprintedSlots(N parent, ElementId parentId) {
		List<ChildFingerprint<N>> children = extractor.childFingerprints(parent, parentId);
		List<Slot<N>> result = new ArrayList<>(children.size());
		for (ChildFingerprint<N> child: children) {
			result.add(new Slot<>(child.node(), child.fingerprint(), false));
		}
		return result;
	}

	private List<Slot<N>> unfingerprintedSlots(N parent) {
		List<N> children = shape.children(parent);
		List<Slot<N>> result = new ArrayList<>(children.size());
		for (N child: children) {
			result.add(new Slot<>(child, null, true));
		}
		return result;
	}

	/**
	 * Once a deferred slot is resolved, its children's fingerprints can be computed.
	 */
	private void fingerprintChildren(Slot<N> slot) {
		if (slot.children.isEmpty()) {
			return;
		}
		List<ChildFingerprint<N>> fingerprints = extractor.childFingerprints(slot.node, slot.id);
		for (int i = 0; i < fingerprints.size(); i++) {
			slot.children.get(i).fingerprint = fingerprints.get(i).fingerprint();
		}
	}

	private static <T> void pushAll(Deque<T> stack, List<T> items) {
		// Reverse order so the first item is popped first
		for (int i = items.size() - 1; i >= 0; i--) {
			stack.push(items.get(i));
		}
	}

	/**
	 * Stored identities that carry a name, by parent, field, type and name.
	 */
	private static final class NamedSiblings {
		final Map<List<Object>, List<ElementId>> idsBySlot = new HashMap<>();

		NamedSiblings(Map<ElementId, StructuralFingerprint> stored) {
			stored.forEach((id, fp) -> {
				if (fp.hasName()) {
					idsBySlot.computeIfAbsent(slotOf(fp), __ -> new ArrayList<>()).add(id);
				}
			});
		}

		List<ElementId> idsNamedLike(StructuralFingerprint fp) {
			return idsBySlot.getOrDefault(slotOf(fp), emptyList());
		}

		private static List<Object> slotOf(StructuralFingerprint fp) {
			return asList(fp.parentId(), fp.containingField(), fp.nodeType(), fp.name());
		}
	}

	/**
	 * One non-root node's progress through a reconciliation.
	 */
	private static final class Slot<N> {
		final N node;
		@Nullable StructuralFingerprint fingerprint;
		final boolean fingerprintedLate;
		@Nullable ElementId id;
		List<Slot<N>> children = emptyList();

		Slot(N node, @Nullable StructuralFingerprint fingerprint, boolean fingerprintedLate) {
			this.node = node;
			this.fingerprint = fingerprint;
			this.fingerprintedLate = fingerprintedLate;
		}
	}

	/**
	 * The node-to-identity associations of one reconciled tree.
	 * Nodes are compared by identity, since parsers may give them structural equality.
	 */
	private static final class Generation<N> {
		final Map<N, ElementId> idsByNode = new IdentityHashMap<>();
		final Map<ElementId, N> nodesById = new LinkedHashMap<>();

		void assign(N node, ElementId id) {
			idsByNode.put(node, id);
			nodesById.put(id, node);
		}
	}

	private static final int MAX_MINT_ATTEMPTS = 100;
	private static final Logger LOGGER = LoggerFactory.getLogger(ElementIdRegistry.class);
}
