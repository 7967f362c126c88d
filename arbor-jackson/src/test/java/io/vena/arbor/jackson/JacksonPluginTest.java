package io.vena.arbor.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.arbor.ElementId;
import io.vena.arbor.RegistrySnapshot;
import io.vena.arbor.StructuralFingerprint;
import java.util.ArrayList;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static java.util.Arrays.asList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonPluginTest {
	final ObjectMapper mapper = new ObjectMapper().registerModule(new JacksonPlugin().module());

	final ElementId rootId = ElementId.from("r");
	final ElementId childId = ElementId.from("c");
	final StructuralFingerprint rootFp = StructuralFingerprint.forRoot("Model", null, null);
	final StructuralFingerprint childFp = new StructuralFingerprint("X", "items", 0, rootId, "alpha", 3);
	final RegistrySnapshot snapshot = RegistrySnapshot.empty()
		.withFingerprint(rootId, rootFp)
		.withFingerprint(childId, childFp);

	static final String SNAPSHOT_JSON = "{"
		+ "\"idMap\":{\"root//0/Model\":\"r\",\"r/items/0/X\":\"c\"},"
		+ "\"fingerprints\":{"
		+ "\"r\":{\"astType\":\"Model\",\"containmentProperty\":\"\",\"siblingIndex\":0,\"parentUuid\":\"root\"},"
		+ "\"c\":{\"astType\":\"X\",\"containmentProperty\":\"items\",\"siblingIndex\":0,\"parentUuid\":\"r\",\"name\":\"alpha\",\"lastOffset\":3}"
		+ "}}";

	@Test
	void snapshot_wireFormat() throws JsonProcessingException {
		assertEquals(SNAPSHOT_JSON, mapper.writeValueAsString(snapshot));
	}

	@Test
	void snapshot_readBack() throws JsonProcessingException {
		RegistrySnapshot actual = mapper.readValue(SNAPSHOT_JSON, RegistrySnapshot.class);
		assertEquals(snapshot, actual);
		assertEquals(asList(rootId, childId), new ArrayList<>(actual.fingerprints().keySet()));
	}

	@Test
	void absentHints_areOmitted() throws JsonProcessingException {
		String json = mapper.writeValueAsString(rootFp);
		assertThat(json, not(containsString("name")));
		assertThat(json, not(containsString("lastOffset")));
	}

	@Test
	void elementId_isAString() throws JsonProcessingException {
		assertEquals("\"abc\"", mapper.writeValueAsString(ElementId.from("abc")));
		assertEquals(ElementId.from("abc"), mapper.readValue("\"abc\"", ElementId.class));
	}

	@ParameterizedTest
	@MethodSource("invalidElementIds")
	void elementId_invalid_throws(String json) {
		assertThrows(JsonMappingException.class, () -> mapper.readValue(json, ElementId.class));
	}

	static Stream<String> invalidElementIds() {
		return Stream.of("\"\"", "\"a/b\"", "17", "{}");
	}

	@Test
	void fingerprint_optionalFieldsDefault() throws JsonProcessingException {
		StructuralFingerprint actual = mapper.readValue("{\"astType\":\"X\",\"parentUuid\":\"p\"}", StructuralFingerprint.class);
		assertEquals(new StructuralFingerprint("X", "", 0, ElementId.from("p"), null, null), actual);
	}

	@ParameterizedTest
	@MethodSource("invalidFingerprints")
	void fingerprint_invalid_throws(String json) {
		assertThrows(JsonMappingException.class, () -> mapper.readValue(json, StructuralFingerprint.class));
	}

	static Stream<String> invalidFingerprints() {
		return Stream.of(
			"[]",
			"{\"parentUuid\":\"p\"}",
			"{\"astType\":\"\",\"parentUuid\":\"p\"}",
			"{\"astType\":\"X\"}",
			"{\"astType\":\"X\",\"parentUuid\":\"p\",\"siblingIndex\":-1}",
			"{\"astType\":\"X\",\"parentUuid\":\"p\",\"siblingIndex\":\"1\"}",
			"{\"astType\":\"X\",\"parentUuid\":\"p\",\"name\":5}"
		);
	}

	@ParameterizedTest
	@MethodSource("unusableOffsets")
	void fingerprint_unusableOffset_isDropped(String offset) throws JsonProcessingException {
		String json = "{\"astType\":\"X\",\"parentUuid\":\"p\",\"name\":\"alpha\",\"lastOffset\":" + offset + "}";
		StructuralFingerprint actual = mapper.readValue(json, StructuralFingerprint.class);
		assertEquals(new StructuralFingerprint("X", "", 0, ElementId.from("p"), "alpha", null), actual);
	}

	static Stream<String> unusableOffsets() {
		return Stream.of("1.5", "9999999999", "\"12\"", "true", "{}");
	}

	@Test
	void snapshot_unusableOffset_keepsEntry() throws JsonProcessingException {
		String json = SNAPSHOT_JSON.replace("\"lastOffset\":3", "\"lastOffset\":3.25");
		RegistrySnapshot expected = RegistrySnapshot.empty()
			.withFingerprint(rootId, rootFp)
			.withFingerprint(childId, childFp.withSourceOffset(null));
		assertEquals(expected, mapper.readValue(json, RegistrySnapshot.class));
	}

	@Test
	void module_isNamed() {
		assertEquals("arbor", new JacksonPlugin().module().getModuleName());
	}

	@Test
	void snapshot_skipsUnreadableEntries() throws JsonProcessingException {
		String json = "{"
			+ "\"idMap\":{\"root//0/Model\":\"r\",\"bad\":42,\"worse\":\"x/y\"},"
			+ "\"fingerprints\":{"
			+ "\"r\":{\"astType\":\"Model\",\"parentUuid\":\"root\"},"
			+ "\"no/slashes\":{\"astType\":\"X\",\"parentUuid\":\"r\"},"
			+ "\"orphan\":{\"astType\":\"X\"},"
			+ "\"notAnObject\":\"X\""
			+ "}}";
		RegistrySnapshot expected = RegistrySnapshot.empty().withFingerprint(rootId, rootFp);
		assertEquals(expected, mapper.readValue(json, RegistrySnapshot.class));
	}

	@Test
	void snapshot_missingOrMalformedSections_areEmpty() throws JsonProcessingException {
		assertTrue(mapper.readValue("{}", RegistrySnapshot.class).isEmpty());
		assertTrue(mapper.readValue("{\"idMap\":null,\"fingerprints\":[1,2]}", RegistrySnapshot.class).isEmpty());
	}

	@Test
	void snapshot_notAnObject_throws() {
		assertThrows(JsonMappingException.class, () -> mapper.readValue("[]", RegistrySnapshot.class));
		assertThrows(JsonMappingException.class, () -> mapper.readValue("\"state\"", RegistrySnapshot.class));
	}
}
