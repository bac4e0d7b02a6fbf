package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.db.DatabaseOperationException;
import arango.mcp.services.LogUtil;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

import static arango.mcp.handlers.HandlerArgs.requireArray;
import static arango.mcp.handlers.HandlerArgs.requireObject;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Referential checks on document id fields, resolved with <code>DOCUMENT()</code>.
 */
public final class ReferenceHandlers {

    static final String COLLECTION_CHECK_AQL =
        "FOR doc IN @@collection"
            + " LET invalid_refs = ("
            + " FOR field IN @fields"
            + " LET ref = DOCUMENT(doc[field])"
            + " FILTER ref == null AND doc[field] != null"
            + " RETURN {field: field, value: doc[field]})"
            + " FILTER LENGTH(invalid_refs) > 0"
            + " RETURN {_id: doc._id, _key: doc._key, invalid_references: invalid_refs}";

    static final String DOCUMENT_CHECK_AQL =
        "LET d = @doc"
            + " LET invalid_refs = ("
            + " FOR field IN @fields"
            + " LET ref = DOCUMENT(d[field])"
            + " FILTER ref == null AND d[field] != null"
            + " RETURN {field: field, value: d[field]})"
            + " RETURN invalid_refs";

    private static final int REPORT_LIMIT = 100;

    private ReferenceHandlers() {
    }

    /**
     * Report documents whose reference fields point nowhere. With <code>fix_invalid</code>
     * those documents are removed.
     */
    public static Object validateReferences(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonArray fields = requireArray(args, "reference_fields");

        JsonArray invalid = db.query(COLLECTION_CHECK_AQL, new JsonObject()
            .put("@collection", collection)
            .put("fields", fields));

        JsonArray reported = new JsonArray();
        for (int i = 0; i < Math.min(invalid.size(), REPORT_LIMIT); i++) {
            reported.add(invalid.getValue(i));
        }
        JsonObject result = new JsonObject()
            .put("total_checked", db.count(collection))
            .put("invalid_count", invalid.size())
            .put("invalid_documents", reported)
            .put("validation_passed", invalid.isEmpty());

        if (HandlerArgs.boolValue(args, "fix_invalid", false) && !invalid.isEmpty()) {
            List<String> keys = new ArrayList<>();
            for (JsonObject doc : HandlerArgs.objects(invalid)) {
                keys.add(doc.getString("_key"));
            }
            try {
                db.removeMany(collection, keys);
                result.put("removed_count", keys.size());
            } catch (DatabaseOperationException e) {
                LogUtil.logError(null, "Removing invalid documents from " + collection + " failed", e,
                    "ReferenceHandlers", "FixInvalid", "Database", false);
                result.put("removed_count", 0);
            }
        }
        return result;
    }

    public static Object insertWithValidation(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonObject document = requireObject(args, "document");
        JsonArray fields = args.getJsonArray("reference_fields", new JsonArray());

        if (!fields.isEmpty()) {
            JsonArray invalid = invalidReferences(db, document, fields);
            if (!invalid.isEmpty()) {
                return new JsonObject()
                    .put("error", "Invalid references")
                    .put("invalid_references", invalid);
            }
        }
        return db.insert(collection, document);
    }

    /**
     * @return <code>[{field, value}]</code> for each field whose target document is missing
     */
    static JsonArray invalidReferences(ArangoHandle db, JsonObject document, JsonArray fields) {
        JsonArray rows = db.query(DOCUMENT_CHECK_AQL, new JsonObject()
            .put("doc", document)
            .put("fields", fields));
        if (rows.isEmpty() || !(rows.getValue(0) instanceof JsonArray)) {
            return new JsonArray();
        }
        return rows.getJsonArray(0);
    }
}
