package io.vena.arbor;

import io.vena.arbor.exceptions.DocumentAlreadyOpenException;
import io.vena.arbor.exceptions.DocumentNotOpenException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableSet;

/**
 * One {@link ElementIdRegistry} per open document, keyed by document URI.
 *
 * <p>
 * A registry is created when its document is {@link #open opened},
 * reconciled by that document's edit pipeline on every reparse,
 * and {@link #close closed} with the document, which yields the state to persist.
 * This object may be used from any thread, but each registry it hands out
 * belongs to one document's pipeline and must not be reconciled concurrently.
 */
@RequiredArgsConstructor
public final class DocumentRegistries<N> {
	@NonNull private final TreeShape<N> shape;
	@Getter @NonNull private final ReconcilerSettings settings;
	private final ConcurrentHashMap<String, ElementIdRegistry<N>> registriesByUri = new ConcurrentHashMap<>();

	public DocumentRegistries(TreeShape<N> shape) {
		this(shape, ReconcilerSettings.defaults());
	}

	public ElementIdRegistry<N> open(String uri) {
		return open(uri, RegistrySnapshot.empty());
	}

	/**
	 * @param persistedState what {@link #close} returned last time this document was closed
	 * @throws DocumentAlreadyOpenException if <code>uri</code> is already open
	 */
	public ElementIdRegistry<N> open(@NonNull String uri, @NonNull RegistrySnapshot persistedState) {
		ElementIdRegistry<N> registry = new ElementIdRegistry<>(shape, settings);
		if (!persistedState.isEmpty()) {
			registry.loadState(persistedState);
		}
		ElementIdRegistry<N> existing = registriesByUri.putIfAbsent(uri, registry);
		if (existing != null) {
			throw new DocumentAlreadyOpenException("Document is already open: " + uri);
		}
		LOGGER.debug("Opened {} with {} stored fingerprints", uri, registry.registrySize());
		return registry;
	}

	/**
	 * @throws DocumentNotOpenException if <code>uri</code> isn't open
	 */
	public ElementIdRegistry<N> registryFor(String uri) {
		ElementIdRegistry<N> result = registriesByUri.get(uri);
		if (result == null) {
			throw new DocumentNotOpenException("Document is not open: " + uri);
		}
		return result;
	}

	public boolean isOpen(String uri) {
		return registriesByUri.containsKey(uri);
	}

	public Set<String> openDocuments() {
		return unmodifiableSet(registriesByUri.keySet());
	}

	/**
	 * Forgets the document's registry.
	 *
	 * @return the registry's final state, for the caller to persist
	 * @throws DocumentNotOpenException if <code>uri</code> isn't open
	 */
	public RegistrySnapshot close(String uri) {
		ElementIdRegistry<N> registry = registriesByUri.remove(uri);
		if (registry == null) {
			throw new DocumentNotOpenException("Document is not open: " + uri);
		}
		RegistrySnapshot result = registry.exportState();
		registry.clear();
		LOGGER.debug("Closed {}; exported {}", uri, result);
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRegistries.class);
}
