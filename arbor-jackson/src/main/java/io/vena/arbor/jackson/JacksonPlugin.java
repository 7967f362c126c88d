package io.vena.arbor.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.arbor.ElementId;
import io.vena.arbor.RegistrySnapshot;
import io.vena.arbor.StructuralFingerprint;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptyIterator;

/**
 * Provides JSON serialization/deserialization of registry state using Jackson.
 *
 * <p>
 * The format of a {@link RegistrySnapshot} is:
 * <pre>
 * { "idMap": { "&lt;fingerprint key&gt;": "&lt;id&gt;", ... },
 *   "fingerprints": { "&lt;id&gt;": { "astType": ..., "containmentProperty": ..., "siblingIndex": ...,
 *                                "parentUuid": ..., "name": ..., "lastOffset": ... }, ... } }
 * </pre>
 * where <code>name</code> and <code>lastOffset</code> are omitted when absent.
 * A <code>lastOffset</code> that isn't an <code>int</code> is ignored on read.
 *
 * <p>
 * Reading a snapshot is lenient: an <code>idMap</code> or <code>fingerprints</code> entry
 * that can't be decoded is logged and skipped, and a missing section counts as empty.
 * Only a snapshot that isn't a JSON object at all is an error.
 * {@link ElementId} and {@link StructuralFingerprint} on their own are read strictly.
 */
public final class JacksonPlugin {
	static final String ID_MAP = "idMap";
	static final String FINGERPRINTS = "fingerprints";
	static final String AST_TYPE = "astType";
	static final String CONTAINMENT_PROPERTY = "containmentProperty";
	static final String SIBLING_INDEX = "siblingIndex";
	static final String PARENT_UUID = "parentUuid";
	static final String NAME = "name";
	static final String LAST_OFFSET = "lastOffset";

	public Module module() {
		return new Module() {
			@Override
			public String getModuleName() {
				return "arbor";
			}

			@Override
			public Version version() {
				return Version.unknownVersion();
			}

			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new ArborSerializers());
				context.addDeserializers(new ArborDeserializers());
			}
		};
	}

	private static final class ArborSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (ElementId.class.isAssignableFrom(theClass)) {
				return elementIdSerializer();
			} else if (StructuralFingerprint.class.isAssignableFrom(theClass)) {
				return fingerprintSerializer();
			} else if (RegistrySnapshot.class.isAssignableFrom(theClass)) {
				return snapshotSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<ElementId> elementIdSerializer() {
			return new JsonSerializer<ElementId>() {
				@Override
				public void serialize(ElementId value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.toString());
				}
			};
		}

		private JsonSerializer<StructuralFingerprint> fingerprintSerializer() {
			return new JsonSerializer<StructuralFingerprint>() {
				@Override
				public void serialize(StructuralFingerprint value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					writeFingerprint(value, gen);
				}
			};
		}

		private JsonSerializer<RegistrySnapshot> snapshotSerializer() {
			return new JsonSerializer<RegistrySnapshot>() {
				@Override
				public void serialize(RegistrySnapshot value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeStartObject();
					gen.writeObjectFieldStart(ID_MAP);
					for (Entry<String, ElementId> entry: value.idMap().entrySet()) {
						gen.writeStringField(entry.getKey(), entry.getValue().toString());
					}
					gen.writeEndObject();
					gen.writeObjectFieldStart(FINGERPRINTS);
					for (Entry<ElementId, StructuralFingerprint> entry: value.fingerprints().entrySet()) {
						gen.writeFieldName(entry.getKey().toString());
						writeFingerprint(entry.getValue(), gen);
					}
					gen.writeEndObject();
					gen.writeEndObject();
				}
			};
		}

		private static void writeFingerprint(StructuralFingerprint fp, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeStringField(AST_TYPE, fp.nodeType());
			gen.writeStringField(CONTAINMENT_PROPERTY, fp.containingField());
			gen.writeNumberField(SIBLING_INDEX, fp.siblingIndex());
			gen.writeStringField(PARENT_UUID, fp.parentId().toString());
			if (fp.name() != null) {
				gen.writeStringField(NAME, fp.name());
			}
			if (fp.sourceOffset() != null) {
				gen.writeNumberField(LAST_OFFSET, fp.sourceOffset());
			}
			gen.writeEndObject();
		}
	}

	private static final class ArborDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (ElementId.class.isAssignableFrom(theClass)) {
				return elementIdDeserializer();
			} else if (StructuralFingerprint.class.isAssignableFrom(theClass)) {
				return fingerprintDeserializer();
			} else if (RegistrySnapshot.class.isAssignableFrom(theClass)) {
				return snapshotDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<ElementId> elementIdDeserializer() {
			return new JsonDeserializer<ElementId>() {
				@Override
				public ElementId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonNode node = p.readValueAsTree();
					return elementId(node, p, "ElementId");
				}
			};
		}

		private JsonDeserializer<StructuralFingerprint> fingerprintDeserializer() {
			return new JsonDeserializer<StructuralFingerprint>() {
				@Override
				public StructuralFingerprint deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonNode node = p.readValueAsTree();
					return fingerprint(node, p);
				}
			};
		}

		private JsonDeserializer<RegistrySnapshot> snapshotDeserializer() {
			return new JsonDeserializer<RegistrySnapshot>() {
				@Override
				public RegistrySnapshot deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonNode root = p.readValueAsTree();
					if (root == null || !root.isObject()) {
						throw JsonMappingException.from(p, "Registry state must be a JSON object");
					}
					Map<String, ElementId> idMap = new LinkedHashMap<>();
					for (Iterator<Entry<String, JsonNode>> iter = section(root, ID_MAP); iter.hasNext(); ) {
						Entry<String, JsonNode> entry = iter.next();
						try {
							idMap.put(entry.getKey(), elementId(entry.getValue(), p, ID_MAP + " entry"));
						} catch (JsonMappingException e) {
							LOGGER.warn("Skipping {} entry \"{}\": {}", ID_MAP, entry.getKey(), e.getOriginalMessage());
						}
					}
					Map<ElementId, StructuralFingerprint> fingerprints = new LinkedHashMap<>();
					for (Iterator<Entry<String, JsonNode>> iter = section(root, FINGERPRINTS); iter.hasNext(); ) {
						Entry<String, JsonNode> entry = iter.next();
						try {
							ElementId id = elementId(entry.getKey(), p, FINGERPRINTS + " key");
							fingerprints.put(id, fingerprint(entry.getValue(), p));
						} catch (JsonMappingException e) {
							LOGGER.warn("Skipping {} entry \"{}\": {}", FINGERPRINTS, entry.getKey(), e.getOriginalMessage());
						}
					}
					return RegistrySnapshot.of(idMap, fingerprints);
				}
			};
		}

		/**
		 * A missing or null section is empty; anything else that isn't an object is skipped entirely.
		 */
		private static Iterator<Entry<String, JsonNode>> section(JsonNode root, String name) {
			JsonNode section = root.get(name);
			if (section == null || section.isNull()) {
				return emptyFields();
			} else if (!section.isObject()) {
				LOGGER.warn("Skipping {}: expected an object, found {}", name, section.getNodeType());
				return emptyFields();
			} else {
				return section.fields();
			}
		}

		private static Iterator<Entry<String, JsonNode>> emptyFields() {
			return emptyIterator();
		}

		private static ElementId elementId(JsonNode node, JsonParser p, String what) throws JsonMappingException {
			if (node == null || !node.isTextual()) {
				throw JsonMappingException.from(p, what + " must be a string");
			}
			return elementId(node.textValue(), p, what);
		}

		private static ElementId elementId(String text, JsonParser p, String what) throws JsonMappingException {
			try {
				return ElementId.from(text);
			} catch (IllegalArgumentException e) {
				throw JsonMappingException.from(p, "Invalid " + what + ": " + e.getMessage(), e);
			}
		}

		private static StructuralFingerprint fingerprint(JsonNode node, JsonParser p) throws JsonMappingException {
			if (node == null || !node.isObject()) {
				throw JsonMappingException.from(p, "Fingerprint must be an object");
			}
			JsonNode astType = node.get(AST_TYPE);
			if (astType == null || !astType.isTextual() || astType.textValue().isEmpty()) {
				throw JsonMappingException.from(p, "Fingerprint needs a non-empty string \"" + AST_TYPE + "\"");
			}
			ElementId parentId = elementId(node.get(PARENT_UUID), p, PARENT_UUID);
			String containmentProperty = optionalText(node, CONTAINMENT_PROPERTY, p);
			Integer siblingIndex = optionalInt(node, SIBLING_INDEX, p);
			if (siblingIndex != null && siblingIndex < 0) {
				throw JsonMappingException.from(p, "Negative \"" + SIBLING_INDEX + "\": " + siblingIndex);
			}
			return StructuralFingerprint.builder()
				.nodeType(astType.textValue())
				.containingField(containmentProperty == null ? "" : containmentProperty)
				.siblingIndex(siblingIndex == null ? 0 : siblingIndex)
				.parentId(parentId)
				.name(optionalText(node, NAME, p))
				.sourceOffset(offsetHint(node))
				.build();
		}

		private static String optionalText(JsonNode node, String field, JsonParser p) throws JsonMappingException {
			JsonNode value = node.get(field);
			if (value == null || value.isNull()) {
				return null;
			} else if (value.isTextual()) {
				return value.textValue();
			} else {
				throw JsonMappingException.from(p, "\"" + field + "\" must be a string");
			}
		}

		/**
		 * The offset only breaks ties, so an unusable one is dropped rather than failing the whole fingerprint.
		 */
		private static Integer offsetHint(JsonNode node) {
			JsonNode value = node.get(LAST_OFFSET);
			if (value == null || value.isNull()) {
				return null;
			} else if (value.isInt()) {
				return value.intValue();
			} else {
				LOGGER.warn("Ignoring unusable \"{}\": {}", LAST_OFFSET, value);
				return null;
			}
		}

		private static Integer optionalInt(JsonNode node, String field, JsonParser p) throws JsonMappingException {
			JsonNode value = node.get(field);
			if (value == null || value.isNull()) {
				return null;
			} else if (value.isInt()) {
				return value.intValue();
			} else {
				throw JsonMappingException.from(p, "\"" + field + "\" must be an integer");
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonPlugin.class);
}
