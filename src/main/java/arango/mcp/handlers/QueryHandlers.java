package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.utils.JsonValues;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static arango.mcp.handlers.HandlerArgs.aqlAttributePath;
import static arango.mcp.handlers.HandlerArgs.aqlCollection;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Query planning and the filter/sort/limit query builder.
 */
public final class QueryHandlers {

    static final String INDEX_HINT = "Consider adding a persistent/hash index for filtered fields";

    private QueryHandlers() {
    }

    public static Object explain(ArangoHandle db, JsonObject args) {
        JsonObject result = explainResult(db, args);
        if (HandlerArgs.boolValue(args, "suggest_indexes", true)) {
            result.put("index_suggestions", indexSuggestions(result.getJsonArray("plans")));
        }
        return result;
    }

    /** Same as explain, without suggestions. */
    public static Object profile(ArangoHandle db, JsonObject args) {
        return explainResult(db, args);
    }

    private static JsonObject explainResult(ArangoHandle db, JsonObject args) {
        String query = requireString(args, "query");
        JsonObject bindVars = args.getJsonObject("bind_vars", new JsonObject());
        JsonObject explained = db.explain(query, bindVars, HandlerArgs.intValue(args, "max_plans", 1));
        return new JsonObject()
            .put("plans", explained.getJsonArray("plans", new JsonArray()))
            .put("warnings", explained.getJsonArray("warnings", new JsonArray()))
            .put("stats", explained.getJsonObject("stats", new JsonObject()));
    }

    /**
     * One hint per filter or full-scan node, deduplicated by node id.
     */
    static JsonArray indexSuggestions(JsonArray plans) {
        Set<Object> seen = new LinkedHashSet<>();
        JsonArray suggestions = new JsonArray();
        if (plans == null) {
            return suggestions;
        }
        for (Object plan : plans) {
            if (!(plan instanceof JsonObject)) {
                continue;
            }
            JsonArray nodes = ((JsonObject) plan).getJsonArray("nodes", new JsonArray());
            for (Object node : nodes) {
                if (!(node instanceof JsonObject)) {
                    continue;
                }
                JsonObject n = (JsonObject) node;
                String type = n.getString("type");
                if (("FilterNode".equals(type) || "EnumerateCollectionNode".equals(type)
                    || "Filter".equals(type) || "EnumerateCollection".equals(type))
                    && seen.add(n.getValue("id"))) {
                    suggestions.add(new JsonObject()
                        .put("hint", INDEX_HINT)
                        .put("nodeId", n.getValue("id")));
                }
            }
        }
        return suggestions;
    }

    public static Object queryBuilder(ArangoHandle db, JsonObject args) {
        return db.query(buildQuery(args), new JsonObject());
    }

    /**
     * Render the builder arguments as AQL. Values are embedded as JSON literals.
     */
    static String buildQuery(JsonObject args) {
        String collection = aqlCollection(requireString(args, "collection"));
        StringBuilder aql = new StringBuilder("FOR doc IN ").append(collection);

        for (JsonObject filter : HandlerArgs.objects(args.getJsonArray("filters"))) {
            String field = aqlAttributePath(filter.getString("field"));
            String op = filter.getString("op", "==");
            String value = JsonValues.encode(filter.getValue("value"));
            if ("LIKE".equals(op)) {
                aql.append(" FILTER LIKE(doc.").append(field).append(", ").append(value).append(")");
            } else {
                aql.append(" FILTER doc.").append(field).append(' ').append(op).append(' ').append(value);
            }
        }

        List<String> sorts = new ArrayList<>();
        for (JsonObject sort : HandlerArgs.objects(args.getJsonArray("sort"))) {
            sorts.add("doc." + aqlAttributePath(sort.getString("field")) + " " + sort.getString("direction", "ASC"));
        }
        if (!sorts.isEmpty()) {
            aql.append(" SORT ").append(String.join(", ", sorts));
        }

        Integer limit = HandlerArgs.optionalInt(args, "limit");
        if (limit != null) {
            aql.append(" LIMIT ").append(limit);
        }

        List<String> returnFields = HandlerArgs.strings(args.getJsonArray("return_fields"));
        if (returnFields.isEmpty()) {
            aql.append(" RETURN doc");
        } else {
            List<String> projections = new ArrayList<>();
            for (String field : returnFields) {
                aqlAttributePath(field);
                projections.add((field.contains(".") ? JsonValues.encode(field) : field) + ": doc." + field);
            }
            aql.append(" RETURN {").append(String.join(", ", projections)).append("}");
        }
        return aql.toString();
    }
}
