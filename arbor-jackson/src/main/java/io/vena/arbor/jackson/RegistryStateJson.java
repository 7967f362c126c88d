package io.vena.arbor.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.arbor.RegistrySnapshot;
import io.vena.arbor.exceptions.DeserializationException;
import lombok.Getter;

import static com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * Converts {@link RegistrySnapshot}s to and from JSON text,
 * for storing alongside a document's other persisted state.
 */
public final class RegistryStateJson {
	@Getter private final ObjectMapper mapper;

	public RegistryStateJson() {
		this(new ObjectMapper());
	}

	/**
	 * @param mapper will have {@link JacksonPlugin#module()} registered on it
	 */
	public RegistryStateJson(ObjectMapper mapper) {
		this.mapper = mapper.registerModule(new JacksonPlugin().module());
	}

	public static RegistryStateJson indented() {
		return new RegistryStateJson(new ObjectMapper().enable(INDENT_OUTPUT));
	}

	public String write(RegistrySnapshot snapshot) {
		try {
			return mapper.writeValueAsString(snapshot);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize " + snapshot, e);
		}
	}

	/**
	 * @throws DeserializationException if <code>json</code> isn't a JSON object.
	 * Unreadable entries within the object are skipped rather than reported.
	 */
	public RegistrySnapshot read(String json) {
		RegistrySnapshot result;
		try {
			result = mapper.readValue(json, RegistrySnapshot.class);
		} catch (JsonProcessingException e) {
			throw new DeserializationException("Unable to read registry state: " + e.getOriginalMessage(), e);
		}
		if (result == null) {
			throw new DeserializationException("Registry state is null");
		}
		return result;
	}
}
