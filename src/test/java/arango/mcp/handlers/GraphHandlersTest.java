package arango.mcp.handlers;

import arango.mcp.db.InMemoryArangoHandle;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphHandlersTest {

    private final InMemoryArangoHandle db = new InMemoryArangoHandle();

    private static JsonObject follows() {
        return new JsonObject()
            .put("edge_collection", "follows")
            .put("from_collections", new JsonArray().add("users"))
            .put("to_collections", new JsonArray().add("users").add("artists"));
    }

    @Test
    void testCreateGraphCreatesCollections() {
        JsonObject result = (JsonObject) GraphHandlers.createGraph(db, new JsonObject()
            .put("name", "social")
            .put("edge_definitions", new JsonArray().add(follows())));

        assertEquals("social", result.getString("name"));
        assertEquals(new JsonArray().add("artists").add("users"), result.getJsonArray("vertex_collections"));
        assertTrue(db.isEdge("follows"));
        assertNotNull(db.documents("users"));
        assertNotNull(db.documents("artists"));
        assertEquals("follows", db.graph("social").get(0).getEdgeCollection());
    }

    @Test
    void testCreateGraphWithoutCollections() {
        GraphHandlers.createGraph(db, new JsonObject()
            .put("name", "social")
            .put("edge_definitions", new JsonArray().add(follows()))
            .put("create_collections", false));

        assertFalse(db.calls.contains("createCollection"));
        assertNotNull(db.graph("social"));
    }

    @Test
    void testCreateExistingGraphIsReused() {
        JsonObject args = new JsonObject().put("name", "social").put("edge_definitions", new JsonArray().add(follows()));
        GraphHandlers.createGraph(db, args);
        GraphHandlers.createGraph(db, args);

        assertEquals(1, db.calls.stream().filter("createGraph"::equals).count());
    }

    @Test
    void testAddEdge() {
        db.withCollection("follows");

        JsonObject meta = (JsonObject) GraphHandlers.addEdge(db, new JsonObject()
            .put("collection", "follows")
            .put("from_id", "users/a")
            .put("to_id", "users/b")
            .put("attributes", new JsonObject().put("since", 2020)));

        JsonObject stored = db.documents("follows").get(meta.getString("_key"));
        assertEquals("users/a", stored.getString("_from"));
        assertEquals("users/b", stored.getString("_to"));
        assertEquals(2020, stored.getInteger("since"));
    }

    @Test
    void testTraverseNamedGraph() {
        GraphHandlers.traverse(db, new JsonObject()
            .put("start_vertex", "users/a")
            .put("graph", "social")
            .put("direction", "ANY")
            .put("min_depth", 1)
            .put("max_depth", 3)
            .put("limit", 5));

        InMemoryArangoHandle.QueryCall call = db.queries.get(0);
        assertEquals("FOR v, e, p IN 1..3 ANY @start GRAPH @graph LIMIT @limit RETURN {vertex: v, edge: e}", call.aql);
        assertEquals(new JsonObject().put("start", "users/a").put("graph", "social").put("limit", 5), call.bindVars);
    }

    @Test
    void testTraverseEdgeCollectionsReturningPaths() {
        GraphHandlers.traverse(db, new JsonObject()
            .put("start_vertex", "users/a")
            .put("edge_collections", new JsonArray().add("follows").add("likes"))
            .put("return_paths", true));

        assertEquals("FOR v, e, p IN 1..1 OUTBOUND @start follows, likes RETURN p", db.queries.get(0).aql);
    }

    @Test
    void testTraverseNeedsEdgeSource() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> GraphHandlers.traverse(db, new JsonObject().put("start_vertex", "users/a")));

        assertEquals(GraphHandlers.NO_EDGE_SOURCE, e.getMessage());
        assertTrue(db.queries.isEmpty());
    }

    @Test
    void testTraverseDepthBeyondIntRangeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> GraphHandlers.traverse(db, new JsonObject()
                .put("start_vertex", "users/a")
                .put("graph", "social")
                .put("max_depth", 3000000000L)));

        assertTrue(e.getMessage().contains("max_depth"), e.getMessage());
        assertTrue(db.queries.isEmpty());
    }

    @Test
    void testShortestPath() {
        JsonObject path = new JsonObject()
            .put("vertices", new JsonArray().add("users/a").add("users/b"))
            .put("edges", new JsonArray().add("follows/1"));
        db.enqueueQueryResult(new JsonArray().add(path));

        JsonObject found = (JsonObject) GraphHandlers.shortestPath(db, new JsonObject()
            .put("start_vertex", "users/a")
            .put("end_vertex", "users/b")
            .put("graph", "social"));

        assertTrue(found.getBoolean("found"));
        assertEquals(2, found.getJsonArray("vertices").size());
        assertEquals("FOR v, e IN OUTBOUND SHORTEST_PATH @start TO @end GRAPH @graph RETURN {vertices: v, edges: e}",
            db.queries.get(0).aql);

        JsonObject missing = (JsonObject) GraphHandlers.shortestPath(db, new JsonObject()
            .put("start_vertex", "users/a")
            .put("end_vertex", "users/z")
            .put("edge_collections", new JsonArray().add("follows")));
        assertEquals(new JsonObject().put("found", false), missing);
    }

    @Test
    void testListAndExtendGraphs() {
        GraphHandlers.createGraph(db, new JsonObject()
            .put("name", "social")
            .put("edge_definitions", new JsonArray().add(follows())));

        JsonObject added = (JsonObject) GraphHandlers.addVertexCollection(db, new JsonObject()
            .put("graph", "social").put("collection", "venues"));
        assertEquals("venues", added.getString("collection_added"));

        JsonObject definition = (JsonObject) GraphHandlers.addEdgeDefinition(db, new JsonObject()
            .put("graph", "social")
            .put("edge_collection", "visits")
            .put("from_collections", new JsonArray().add("users"))
            .put("to_collections", new JsonArray().add("venues")));
        assertEquals("visits", definition.getJsonObject("edge_definition").getString("edge_collection"));

        JsonArray graphs = (JsonArray) GraphHandlers.listGraphs(db, new JsonObject());
        assertEquals(1, graphs.size());
        assertEquals("social", graphs.getJsonObject(0).getString("name"));
        JsonObject raw = graphs.getJsonObject(0).getJsonObject("_raw");
        assertEquals(2, raw.getJsonArray("edgeDefinitions").size());
        assertEquals(new JsonArray().add("venues"), raw.getJsonArray("orphanCollections"));
    }
}
