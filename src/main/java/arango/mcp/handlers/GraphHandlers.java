package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.db.EdgeDefinitionSpec;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static arango.mcp.handlers.HandlerArgs.aqlCollection;
import static arango.mcp.handlers.HandlerArgs.requireArray;
import static arango.mcp.handlers.HandlerArgs.requireString;

/**
 * Named graphs, edges and traversals.
 *
 * <p>Traversals run either over a named graph or over an explicit list of edge collections;
 * one of the two must be given.</p>
 */
public final class GraphHandlers {

    static final String NO_EDGE_SOURCE = "edge_collections must be provided when graph is not specified";

    private GraphHandlers() {
    }

    public static Object createGraph(ArangoHandle db, JsonObject args) {
        String name = requireString(args, "name");
        JsonArray rawDefinitions = requireArray(args, "edge_definitions");
        boolean createCollections = HandlerArgs.boolValue(args, "create_collections", true);

        List<EdgeDefinitionSpec> definitions = new ArrayList<>();
        for (JsonObject raw : HandlerArgs.objects(rawDefinitions)) {
            definitions.add(EdgeDefinitionSpec.fromJson(raw));
        }

        TreeSet<String> vertexCollections = new TreeSet<>();
        for (EdgeDefinitionSpec definition : definitions) {
            vertexCollections.addAll(definition.getFromCollections());
            vertexCollections.addAll(definition.getToCollections());
        }

        if (createCollections) {
            for (EdgeDefinitionSpec definition : definitions) {
                if (!db.hasCollection(definition.getEdgeCollection())) {
                    db.createCollection(definition.getEdgeCollection(), true, null);
                }
                List<String> vertices = new ArrayList<>(definition.getFromCollections());
                vertices.addAll(definition.getToCollections());
                for (String vertex : vertices) {
                    if (!db.hasCollection(vertex)) {
                        db.createCollection(vertex, false, null);
                    }
                }
            }
        }

        if (!db.hasGraph(name)) {
            db.createGraph(name, definitions);
        }

        return new JsonObject()
            .put("name", name)
            .put("edge_definitions", rawDefinitions)
            .put("vertex_collections", new JsonArray(new ArrayList<>(vertexCollections)));
    }

    public static Object addEdge(ArangoHandle db, JsonObject args) {
        String collection = requireString(args, "collection");
        JsonObject edge = new JsonObject()
            .put("_from", requireString(args, "from_id"))
            .put("_to", requireString(args, "to_id"))
            .mergeIn(args.getJsonObject("attributes", new JsonObject()));
        return db.insert(collection, edge);
    }

    public static Object traverse(ArangoHandle db, JsonObject args) {
        String start = requireString(args, "start_vertex");
        String direction = args.getString("direction", "OUTBOUND");
        int minDepth = HandlerArgs.intValue(args, "min_depth", 1);
        int maxDepth = HandlerArgs.intValue(args, "max_depth", 1);
        boolean returnPaths = HandlerArgs.boolValue(args, "return_paths", false);
        Integer limit = HandlerArgs.optionalInt(args, "limit");

        JsonObject bind = new JsonObject().put("start", start);
        StringBuilder aql = new StringBuilder("FOR v, e, p IN ")
            .append(minDepth).append("..").append(maxDepth).append(' ')
            .append(direction).append(" @start ")
            .append(edgeSource(args, bind));
        if (limit != null && limit > 0) {
            aql.append(" LIMIT @limit");
            bind.put("limit", limit);
        }
        aql.append(returnPaths ? " RETURN p" : " RETURN {vertex: v, edge: e}");
        return db.query(aql.toString(), bind);
    }

    public static Object shortestPath(ArangoHandle db, JsonObject args) {
        String start = requireString(args, "start_vertex");
        String end = requireString(args, "end_vertex");
        String direction = args.getString("direction", "OUTBOUND");

        JsonObject bind = new JsonObject().put("start", start).put("end", end);
        String aql = "FOR v, e IN " + direction + " SHORTEST_PATH @start TO @end "
            + edgeSource(args, bind)
            + " RETURN {vertices: v, edges: e}";

        JsonArray paths = db.query(aql, bind);
        if (paths.isEmpty()) {
            return new JsonObject().put("found", false);
        }
        JsonObject found = new JsonObject().put("found", true);
        Object first = paths.getValue(0);
        if (first instanceof JsonObject) {
            found.mergeIn((JsonObject) first);
        }
        return found;
    }

    /**
     * <code>GRAPH @graph</code> when a graph is named, otherwise the comma-joined edge collections.
     */
    private static String edgeSource(JsonObject args, JsonObject bind) {
        String graph = args.getString("graph");
        if (graph != null && !graph.isEmpty()) {
            bind.put("graph", graph);
            return "GRAPH @graph";
        }
        List<String> edgeCollections = HandlerArgs.strings(args.getJsonArray("edge_collections"));
        if (edgeCollections.isEmpty()) {
            throw new IllegalArgumentException(NO_EDGE_SOURCE);
        }
        List<String> checked = new ArrayList<>();
        for (String edgeCollection : edgeCollections) {
            checked.add(aqlCollection(edgeCollection));
        }
        return String.join(", ", checked);
    }

    public static Object listGraphs(ArangoHandle db, JsonObject args) {
        JsonArray out = new JsonArray();
        for (JsonObject graph : HandlerArgs.objects(db.listGraphs())) {
            out.add(new JsonObject()
                .put("name", graph.getString("name"))
                .put("_raw", graph));
        }
        return out;
    }

    public static Object addVertexCollection(ArangoHandle db, JsonObject args) {
        String graph = requireString(args, "graph");
        String collection = requireString(args, "collection");
        db.addVertexCollection(graph, collection);
        return new JsonObject()
            .put("graph", graph)
            .put("collection_added", collection);
    }

    public static Object addEdgeDefinition(ArangoHandle db, JsonObject args) {
        String graph = requireString(args, "graph");
        EdgeDefinitionSpec definition = new EdgeDefinitionSpec(
            requireString(args, "edge_collection"),
            HandlerArgs.strings(requireArray(args, "from_collections")),
            HandlerArgs.strings(requireArray(args, "to_collections")));
        db.addEdgeDefinition(graph, definition);
        return new JsonObject()
            .put("graph", graph)
            .put("edge_definition", definition.toJson());
    }
}
