package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static arango.mcp.handlers.HandlerArgs.requireArray;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Batched insert and update.
 *
 * <p>A failing batch is recorded as <code>{batch_start, batch_size, error}</code>. With
 * <code>on_error == "stop"</code> no further batches are sent; any other value continues.</p>
 */
public final class BulkHandlers {

    private BulkHandlers() {
    }

    public static Object bulkInsert(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        List<JsonObject> documents = HandlerArgs.objects(requireArray(args, "documents"));
        int batchSize = Math.max(1, HandlerArgs.intValue(args, "batch_size", 1000));
        boolean validateRefs = HandlerArgs.boolValue(args, "validate_refs", false);
        boolean stopOnError = "stop".equals(args.getString("on_error", "stop"));

        int inserted = 0;
        int failed = 0;
        JsonArray errors = new JsonArray();
        JsonArray insertedIds = new JsonArray();

        for (int start = 0; start < documents.size(); start += batchSize) {
            List<JsonObject> batch = documents.subList(start, Math.min(start + batchSize, documents.size()));
            try {
                if (validateRefs) {
                    checkReferences(db, batch);
                }
                List<JsonObject> metas = db.insertMany(collection, batch);
                inserted += metas.size();
                for (JsonObject meta : metas) {
                    insertedIds.add(meta.getValue("_id"));
                }
            } catch (RuntimeException e) {
                failed += batch.size();
                errors.add(batchError(start, batch.size(), e));
                if (stopOnError) {
                    break;
                }
            }
        }

        return new JsonObject()
            .put("total_documents", documents.size())
            .put("inserted_count", inserted)
            .put("error_count", failed)
            .put("errors", errors)
            .put("inserted_ids", insertedIds)
            .put("success_rate", documents.isEmpty() ? 0.0 : (double) inserted / documents.size());
    }

    /**
     * Checks every top-level field named <code>*_id</code> (other than <code>_id</code>) as a
     * document reference.
     */
    private static void checkReferences(ArangoHandle db, List<JsonObject> batch) {
        for (JsonObject document : batch) {
            JsonArray fields = new JsonArray();
            for (String name : document.fieldNames()) {
                if (name.endsWith("_id") && !"_id".equals(name)) {
                    fields.add(name);
                }
            }
            if (fields.isEmpty()) {
                continue;
            }
            JsonArray invalid = ReferenceHandlers.invalidReferences(db, document, fields);
            if (!invalid.isEmpty()) {
                throw new IllegalArgumentException("Invalid references: " + invalid.encode());
            }
        }
    }

    public static Object bulkUpdate(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        List<JsonObject> updates = HandlerArgs.objects(requireArray(args, "updates"));
        int batchSize = Math.max(1, HandlerArgs.intValue(args, "batch_size", 1000));
        boolean stopOnError = "stop".equals(args.getString("on_error", "stop"));

        int updated = 0;
        int failed = 0;
        JsonArray errors = new JsonArray();

        for (int start = 0; start < updates.size(); start += batchSize) {
            List<JsonObject> batch = updates.subList(start, Math.min(start + batchSize, updates.size()));
            try {
                List<JsonObject> normalized = new ArrayList<>();
                for (JsonObject item : batch) {
                    normalized.add(normalizeUpdate(item));
                }
                updated += db.updateMany(collection, normalized).size();
            } catch (RuntimeException e) {
                failed += batch.size();
                errors.add(batchError(start, batch.size(), e));
                if (stopOnError) {
                    break;
                }
            }
        }

        return new JsonObject()
            .put("total_updates", updates.size())
            .put("updated_count", updated)
            .put("error_count", failed)
            .put("errors", errors);
    }

    /**
     * <code>{key|_key, update}</code> or <code>{key|_key, ...fields}</code> to <code>{_key, ...fields}</code>.
     */
    static JsonObject normalizeUpdate(JsonObject item) {
        Object key = item.getValue("key") != null ? item.getValue("key") : item.getValue("_key");
        if (key == null) {
            throw new IllegalArgumentException("Update item has no 'key' or '_key'");
        }
        JsonObject payload = item.getJsonObject("update");
        JsonObject out = new JsonObject().put("_key", String.valueOf(key));
        if (payload != null && !payload.isEmpty()) {
            out.mergeIn(payload);
        } else {
            for (Map.Entry<String, Object> entry : item) {
                if (!"key".equals(entry.getKey()) && !"_key".equals(entry.getKey())) {
                    out.put(entry.getKey(), entry.getValue());
                }
            }
        }
        out.put("_key", String.valueOf(key));
        return out;
    }

    private static JsonObject batchError(int start, int size, Exception e) {
        return new JsonObject()
            .put("batch_start", start)
            .put("batch_size", size)
            .put("error", String.valueOf(e.getMessage()));
    }
}
