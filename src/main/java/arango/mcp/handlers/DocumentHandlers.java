package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import static arango.mcp.handlers.HandlerArgs.requireObject;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Core data tools: AQL execution, collection listing/creation and single-document CRUD.
 */
public final class DocumentHandlers {

    private DocumentHandlers() {
    }

    /**
     * Run an AQL query with optional bind vars and return all rows.
     */
    public static Object query(ArangoHandle db, JsonObject args) {
        JsonObject bindVars = args.getJsonObject("bind_vars", new JsonObject());
        return db.query(requireString(args, "query"), bindVars);
    }

    /** Non-system collection names. Read-only. */
    public static Object listCollections(ArangoHandle db, JsonObject args) {
        return new JsonArray(db.listCollections());
    }

    public static Object insert(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonObject document = requireObject(args, "document");
        if (!db.hasCollection(collection)) {
            return collectionNotFound(collection);
        }
        return db.insert(collection, document);
    }

    /**
     * Merge the <code>update</code> object into the document with the given key.
     */
    public static Object update(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        String key = requireString(args, "key");
        JsonObject update = requireObject(args, "update");
        if (!db.hasCollection(collection)) {
            return collectionNotFound(collection);
        }
        return db.update(collection, key, update);
    }

    public static Object remove(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        String key = requireString(args, "key");
        if (!db.hasCollection(collection)) {
            return collectionNotFound(collection);
        }
        return db.remove(collection, key);
    }

    /**
     * Create the collection if missing, otherwise reuse it, and report its properties.
     */
    public static Object createCollection(ArangoHandle db, JsonObject args) {
        String name = requireString(args, "name");
        boolean edge = "edge".equals(args.getString("type", "document"));
        Boolean waitForSync = args.getBoolean("waitForSync");

        if (!db.hasCollection(name)) {
            db.createCollection(name, edge, waitForSync);
        }
        JsonObject props = db.collectionProperties(name);
        return new JsonObject()
            .put("name", props.getString("name", name))
            .put("type", "edge".equals(props.getString("type")) ? "edge" : "document")
            .put("waitForSync", props.getValue("waitForSync"));
    }

    static JsonObject collectionNotFound(String collection) {
        return new JsonObject()
            .put("error", "Collection '" + collection + "' does not exist")
            .put("type", "CollectionNotFound");
    }
}
