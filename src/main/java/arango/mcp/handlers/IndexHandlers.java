package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.db.IndexSpec;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

import static arango.mcp.handlers.HandlerArgs.requireArray;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Index listing, creation and deletion.
 */
public final class IndexHandlers {

    private IndexHandlers() {
    }

    public static Object listIndexes(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonArray out = new JsonArray();
        for (Object raw : db.listIndexes(collection)) {
            JsonObject index = (JsonObject) raw;
            out.add(new JsonObject()
                .put("id", index.getValue("id"))
                .put("type", index.getValue("type"))
                .put("fields", index.getValue("fields", new JsonArray()))
                .put("unique", index.getValue("unique"))
                .put("sparse", index.getValue("sparse"))
                .put("name", index.getValue("name"))
                .put("selectivityEstimate", index.getValue("selectivityEstimate")));
        }
        return out;
    }

    /**
     * Create an index. <code>hash</code> and <code>skiplist</code> are legacy names and are
     * created as persistent indexes.
     */
    public static Object createIndex(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        List<String> fields = HandlerArgs.strings(requireArray(args, "fields"));
        String type = args.getString("type", "persistent");

        IndexSpec spec;
        switch (type) {
            case "persistent":
            case "hash":
            case "skiplist":
                spec = new IndexSpec(IndexSpec.Kind.PERSISTENT, fields)
                    .unique(HandlerArgs.boolValue(args, "unique", false))
                    .sparse(HandlerArgs.boolValue(args, "sparse", false))
                    .deduplicate(HandlerArgs.boolValue(args, "deduplicate", true));
                break;
            case "ttl":
                if (fields.size() != 1) {
                    throw new IllegalArgumentException("TTL index requires exactly one field in 'fields'");
                }
                Integer expire = args.getValue("ttl") != null
                    ? HandlerArgs.optionalInt(args, "ttl")
                    : HandlerArgs.optionalInt(args, "expireAfter");
                if (expire == null) {
                    throw new IllegalArgumentException("TTL index requires 'ttl' (expireAfter seconds)");
                }
                spec = new IndexSpec(IndexSpec.Kind.TTL, fields).expireAfter(expire);
                break;
            case "fulltext":
                spec = new IndexSpec(IndexSpec.Kind.FULLTEXT, fields).minLength(HandlerArgs.optionalInt(args, "minLength"));
                break;
            case "geo":
                spec = new IndexSpec(IndexSpec.Kind.GEO, fields).geoJson(args.getBoolean("geoJson"));
                break;
            default:
                throw new IllegalArgumentException("Unsupported index type: " + type);
        }
        spec.name(args.getString("name")).inBackground(args.getBoolean("inBackground"));

        JsonObject created = db.createIndex(collection, spec);
        return new JsonObject()
            .put("id", created.getValue("id"))
            .put("type", created.getValue("type"))
            .put("fields", created.getValue("fields", new JsonArray(fields)))
            .put("unique", created.getValue("unique"))
            .put("sparse", created.getValue("sparse"))
            .put("name", created.getValue("name"));
    }

    /**
     * Delete by full id (<code>coll/123</code>), bare id, or index name.
     */
    public static Object deleteIndex(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        String idOrName = requireString(args, "id_or_name");

        String indexId = idOrName;
        if (!idOrName.contains("/")) {
            indexId = resolveByName(db, collection, idOrName);
            if (indexId == null) {
                if (!idOrName.chars().allMatch(Character::isDigit)) {
                    throw new IllegalArgumentException(
                        "Index with name '" + idOrName + "' not found in collection '" + collection + "'");
                }
                indexId = idOrName;
            }
        }
        if (!indexId.contains("/")) {
            indexId = collection + "/" + indexId;
        }

        JsonObject result = db.deleteIndex(indexId);
        return new JsonObject()
            .put("deleted", true)
            .put("id", indexId)
            .put("result", result);
    }

    private static String resolveByName(ArangoHandle db, String collection, String name) {
        for (Object raw : db.listIndexes(collection)) {
            JsonObject index = (JsonObject) raw;
            if (name.equals(index.getString("name"))) {
                return index.getString("id");
            }
        }
        return null;
    }
}
