package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.schema.DocumentSchemaValidator;
import io.vertx.core.json.JsonObject;

import java.util.List;

import static arango.mcp.handlers.HandlerArgs.requireObject;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Named JSON Schemas, stored per collection in {@value #SCHEMA_COLLECTION}.
 */
public class SchemaHandlers {

    public static final String SCHEMA_COLLECTION = "mcp_schemas";

    private final DocumentSchemaValidator validator;

    public SchemaHandlers(DocumentSchemaValidator validator) {
        this.validator = validator;
    }

    static String schemaKey(String collection, String name) {
        return collection + ":" + name;
    }

    /**
     * Upsert a draft-07 schema. The schema is checked before anything is stored.
     */
    public Object createSchema(ArangoHandle db, JsonObject args) {
        String name = requireString(args, "name");
        String collection = requireString(args, "collection");
        JsonObject schema = args.getJsonObject("schema_def");
        if (schema == null) {
            throw new IllegalArgumentException("Missing schema definition (expected 'schema' or 'schema_def')");
        }

        List<String> problems = validator.checkSchema(schema);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid JSON Schema: " + String.join("; ", problems));
        }

        if (!db.hasCollection(SCHEMA_COLLECTION)) {
            db.createCollection(SCHEMA_COLLECTION, false, null);
        }
        String key = schemaKey(collection, name);
        JsonObject document = new JsonObject()
            .put("_key", key)
            .put("collection", collection)
            .put("name", name)
            .put("schema", schema);
        if (db.getDocument(SCHEMA_COLLECTION, key) != null) {
            db.replace(SCHEMA_COLLECTION, key, document);
        } else {
            db.insert(SCHEMA_COLLECTION, document);
        }
        return new JsonObject().put("created", true).put("key", key);
    }

    /**
     * Validate against an inline schema, or the stored one named by <code>schema_name</code>.
     * Read-only.
     */
    public Object validateDocument(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonObject document = requireObject(args, "document");
        JsonObject schema = args.getJsonObject("schema_def");

        if (schema == null) {
            String schemaName = args.getString("schema_name");
            if (schemaName == null || schemaName.isEmpty()) {
                throw new IllegalArgumentException("Either 'schema' or 'schema_name' must be provided");
            }
            if (!db.hasCollection(SCHEMA_COLLECTION)) {
                throw new IllegalArgumentException("No stored schemas found (collection '" + SCHEMA_COLLECTION + "' missing)");
            }
            String key = schemaKey(collection, schemaName);
            JsonObject stored = db.getDocument(SCHEMA_COLLECTION, key);
            if (stored == null || stored.getJsonObject("schema") == null) {
                throw new IllegalArgumentException("Stored schema not found: " + key);
            }
            schema = stored.getJsonObject("schema");
        }
        return validator.validate(schema, document);
    }
}
