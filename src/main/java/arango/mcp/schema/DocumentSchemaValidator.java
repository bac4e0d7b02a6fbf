package arango.mcp.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaId;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import arango.mcp.utils.JsonValues;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON-Schema draft-07 validation of user documents, backed by networknt json-schema-validator.
 *
 * <p>This is only used by the document-schema tools. Tool arguments are checked by
 * {@link ArgumentSchema}.</p>
 */
public class DocumentSchemaValidator {

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile JsonSchema metaSchema;

    /**
     * Check that a schema document is itself a valid draft-07 schema.
     *
     * @return problems found; empty when the schema is usable
     */
    public List<String> checkSchema(JsonObject schema) {
        JsonNode node = toNode(schema);
        try {
            Set<ValidationMessage> problems = metaSchema().validate(node);
            if (!problems.isEmpty()) {
                return problems.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
            }
            factory.getSchema(node);
            return List.of();
        } catch (JsonSchemaException e) {
            return List.of(e.getMessage());
        }
    }

    /**
     * Validate a document.
     *
     * @return <code>{"valid": true}</code> or <code>{"valid": false, "errors": [{message, path, validator}]}</code>
     */
    public JsonObject validate(JsonObject schema, Object document) {
        Set<ValidationMessage> messages;
        try {
            messages = factory.getSchema(toNode(schema)).validate(toNode(document));
        } catch (JsonSchemaException e) {
            return new JsonObject()
                .put("valid", false)
                .put("errors", new JsonArray().add(new JsonObject().put("message", e.getMessage())));
        }
        if (messages.isEmpty()) {
            return new JsonObject().put("valid", true);
        }

        List<ValidationMessage> sorted = new ArrayList<>(messages);
        sorted.sort(Comparator.comparing((ValidationMessage m) -> String.valueOf(m.getInstanceLocation()))
            .thenComparing(ValidationMessage::getMessage));

        JsonArray errors = new JsonArray();
        for (ValidationMessage message : sorted) {
            errors.add(new JsonObject()
                .put("message", message.getMessage())
                .put("path", pathOf(message.getInstanceLocation()))
                .put("validator", message.getType()));
        }
        return new JsonObject().put("valid", false).put("errors", errors);
    }

    private JsonSchema metaSchema() {
        JsonSchema schema = metaSchema;
        if (schema == null) {
            schema = factory.getSchema(SchemaLocation.of(SchemaId.V7));
            metaSchema = schema;
        }
        return schema;
    }

    private static JsonArray pathOf(JsonNodePath location) {
        JsonArray path = new JsonArray();
        if (location != null) {
            for (int i = 0; i < location.getNameCount(); i++) {
                path.add(location.getElement(i));
            }
        }
        return path;
    }

    private JsonNode toNode(Object value) {
        try {
            return mapper.readTree(JsonValues.encode(value));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
