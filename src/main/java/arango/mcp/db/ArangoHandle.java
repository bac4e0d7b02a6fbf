package arango.mcp.db;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * A live connection to one ArangoDB database.
 *
 * <p>Every method blocks on the network and must run off the event loop. Failures reported
 * by the server surface as {@link DatabaseOperationException}. Documents and results are
 * plain Vert.x JSON values.</p>
 */
public interface ArangoHandle extends AutoCloseable {

    /* ---------- AQL ---------- */

    /**
     * Run an AQL query and drain the cursor.
     *
     * @param bindVars bind parameters; may be empty but never null
     */
    JsonArray query(String aql, JsonObject bindVars);

    /**
     * Explain an AQL query without executing it.
     *
     * @return object with <code>plans</code>, <code>warnings</code> and <code>stats</code>
     */
    JsonObject explain(String aql, JsonObject bindVars, int maxPlans);

    /* ---------- collections ---------- */

    /** Names of all non-system collections. */
    List<String> listCollections();

    boolean hasCollection(String name);

    void createCollection(String name, boolean edge, Boolean waitForSync);

    /**
     * @return <code>{name, type: "document"|"edge", waitForSync}</code>
     */
    JsonObject collectionProperties(String name);

    long count(String collection);

    /* ---------- documents ---------- */

    /** @return document metadata <code>{_id, _key, _rev}</code> */
    JsonObject insert(String collection, JsonObject document);

    /**
     * Insert all documents in one request. Any per-document rejection fails the whole call.
     *
     * @return metadata of each inserted document, in input order
     */
    List<JsonObject> insertMany(String collection, List<JsonObject> documents);

    /** Merge-update the document with the given key. */
    JsonObject update(String collection, String key, JsonObject update);

    /**
     * Merge-update several documents, each carrying its own <code>_key</code>.
     *
     * @return metadata of each updated document
     */
    List<JsonObject> updateMany(String collection, List<JsonObject> updates);

    JsonObject remove(String collection, String key);

    List<JsonObject> removeMany(String collection, List<String> keys);

    /** @return the document, or null if it does not exist */
    JsonObject getDocument(String collection, String key);

    JsonObject replace(String collection, String key, JsonObject document);

    /* ---------- indexes ---------- */

    /** Raw index descriptions, as reported by the server. */
    JsonArray listIndexes(String collection);

    JsonObject createIndex(String collection, IndexSpec spec);

    /**
     * @param indexId fully qualified id, <code>collection/number</code>
     * @return the server's deletion result
     */
    JsonObject deleteIndex(String indexId);

    /* ---------- graphs ---------- */

    boolean hasGraph(String name);

    void createGraph(String name, List<EdgeDefinitionSpec> edgeDefinitions);

    /** Raw graph descriptions, each with at least <code>name</code>. */
    JsonArray listGraphs();

    void addVertexCollection(String graph, String collection);

    void addEdgeDefinition(String graph, EdgeDefinitionSpec edgeDefinition);

    /**
     * Release the underlying connection pool.
     */
    @Override
    void close();
}
