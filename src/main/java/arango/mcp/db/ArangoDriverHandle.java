package arango.mcp.db;

import arango.mcp.config.ConnectionConfig;
import arango.mcp.utils.JsonValues;
import com.arangodb.ArangoCollection;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.Request;
import com.arangodb.Response;
import com.arangodb.entity.CollectionEntity;
import com.arangodb.entity.CollectionPropertiesEntity;
import com.arangodb.entity.CollectionType;
import com.arangodb.entity.DocumentCreateEntity;
import com.arangodb.entity.DocumentDeleteEntity;
import com.arangodb.entity.DocumentEntity;
import com.arangodb.entity.DocumentUpdateEntity;
import com.arangodb.entity.EdgeDefinition;
import com.arangodb.entity.ErrorEntity;
import com.arangodb.entity.GraphEntity;
import com.arangodb.entity.IndexEntity;
import com.arangodb.entity.MultiDocumentEntity;
import com.arangodb.model.CollectionCreateOptions;
import com.arangodb.model.CollectionsReadOptions;
import com.arangodb.model.FulltextIndexOptions;
import com.arangodb.model.GeoIndexOptions;
import com.arangodb.model.PersistentIndexOptions;
import com.arangodb.model.TtlIndexOptions;
import com.arangodb.util.RawJson;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ArangoHandle} on top of the ArangoDB Java driver.
 *
 * <p>Documents cross the driver boundary as {@link RawJson} so that the Vert.x JSON model
 * is preserved without a second mapping layer.</p>
 */
public class ArangoDriverHandle implements ArangoHandle {

    private final ArangoDB arango;
    private final ArangoDatabase db;

    ArangoDriverHandle(ArangoDB arango, ArangoDatabase db) {
        this.arango = arango;
        this.db = db;
    }

    /**
     * Open a connection and verify it with a version round trip.
     *
     * @throws DatabaseOperationException if the server cannot be reached or rejects the credentials
     */
    public static ArangoDriverHandle connect(ConnectionConfig config) {
        ArangoDB arango = new ArangoDB.Builder()
            .host(config.getHost(), config.getPort())
            .user(config.getUsername())
            .password(config.getPassword())
            .timeout(config.getTimeoutMillis())
            .useSsl(config.isUseSsl())
            .build();
        try {
            ArangoDatabase db = arango.db(config.getDatabase());
            db.getVersion();
            return new ArangoDriverHandle(arango, db);
        } catch (ArangoDBException e) {
            arango.shutdown();
            throw translate("connect to " + config.getUrl(), e);
        } catch (RuntimeException e) {
            arango.shutdown();
            throw e;
        }
    }

    /* ---------- AQL ---------- */

    @Override
    public JsonArray query(String aql, JsonObject bindVars) {
        return call("query", () -> {
            List<RawJson> rows = db.query(aql, RawJson.class, JsonValues.toPlainMap(bindVars)).asListRemaining();
            JsonArray out = new JsonArray();
            for (RawJson row : rows) {
                out.add(row == null ? null : JsonValues.decode(row.get()));
            }
            return out;
        });
    }

    @Override
    public JsonObject explain(String aql, JsonObject bindVars, int maxPlans) {
        JsonObject body = new JsonObject()
            .put("query", aql)
            .put("bindVars", bindVars == null ? new JsonObject() : bindVars)
            .put("options", new JsonObject().put("maxNumberOfPlans", maxPlans).put("allPlans", maxPlans > 1));
        return call("explain", () -> {
            Request<RawJson> request = Request.<RawJson>builder()
                .db(db.name())
                .method(Request.Method.POST)
                .path("/_api/explain")
                .body(RawJson.of(body.encode()))
                .build();
            Response<RawJson> response = arango.execute(request, RawJson.class);
            JsonObject raw = new JsonObject(response.getBody().get());
            JsonArray plans = raw.getJsonArray("plans");
            if (plans == null) {
                // Single-plan responses carry "plan" instead of "plans"
                plans = new JsonArray();
                if (raw.getJsonObject("plan") != null) {
                    plans.add(raw.getJsonObject("plan"));
                }
            }
            return new JsonObject()
                .put("plans", plans)
                .put("warnings", raw.getJsonArray("warnings", new JsonArray()))
                .put("stats", raw.getJsonObject("stats", new JsonObject()));
        });
    }

    /* ---------- collections ---------- */

    @Override
    public List<String> listCollections() {
        return call("listCollections", () -> db.getCollections(new CollectionsReadOptions().excludeSystem(true))
            .stream()
            .filter(c -> !Boolean.TRUE.equals(c.getIsSystem()))
            .map(CollectionEntity::getName)
            .collect(Collectors.toList()));
    }

    @Override
    public boolean hasCollection(String name) {
        return call("hasCollection", () -> db.collection(name).exists());
    }

    @Override
    public void createCollection(String name, boolean edge, Boolean waitForSync) {
        CollectionCreateOptions options = new CollectionCreateOptions()
            .type(edge ? CollectionType.EDGES : CollectionType.DOCUMENT);
        if (waitForSync != null) {
            options.waitForSync(waitForSync);
        }
        call("createCollection", () -> db.createCollection(name, options));
    }

    @Override
    public JsonObject collectionProperties(String name) {
        return call("collectionProperties", () -> {
            CollectionPropertiesEntity props = db.collection(name).getProperties();
            return new JsonObject()
                .put("name", props.getName() != null ? props.getName() : name)
                .put("type", props.getType() == CollectionType.EDGES ? "edge" : "document")
                .put("waitForSync", props.getWaitForSync());
        });
    }

    @Override
    public long count(String collection) {
        return call("count", () -> db.collection(collection).count().getCount());
    }

    /* ---------- documents ---------- */

    @Override
    public JsonObject insert(String collection, JsonObject document) {
        return call("insert", () -> meta(db.collection(collection).insertDocument(RawJson.of(document.encode()))));
    }

    @Override
    public List<JsonObject> insertMany(String collection, List<JsonObject> documents) {
        return call("insertMany", () -> {
            MultiDocumentEntity<? extends DocumentCreateEntity<?>> result =
                db.collection(collection).insertDocuments(raw(documents));
            failOnErrors(result);
            return metas(result.getDocuments());
        });
    }

    @Override
    public JsonObject update(String collection, String key, JsonObject update) {
        return call("update", () -> meta(db.collection(collection).updateDocument(key, RawJson.of(update.encode()))));
    }

    @Override
    public List<JsonObject> updateMany(String collection, List<JsonObject> updates) {
        return call("updateMany", () -> {
            MultiDocumentEntity<? extends DocumentUpdateEntity<?>> result =
                db.collection(collection).updateDocuments(raw(updates));
            failOnErrors(result);
            return metas(result.getDocuments());
        });
    }

    @Override
    public JsonObject remove(String collection, String key) {
        return call("remove", () -> {
            DocumentDeleteEntity<?> deleted = db.collection(collection).deleteDocument(key);
            return meta(deleted);
        });
    }

    @Override
    public List<JsonObject> removeMany(String collection, List<String> keys) {
        return call("removeMany", () -> {
            MultiDocumentEntity<? extends DocumentDeleteEntity<?>> result =
                db.collection(collection).deleteDocuments(keys);
            failOnErrors(result);
            return metas(result.getDocuments());
        });
    }

    @Override
    public JsonObject getDocument(String collection, String key) {
        return call("getDocument", () -> {
            RawJson doc = db.collection(collection).getDocument(key, RawJson.class);
            return doc == null ? null : new JsonObject(doc.get());
        });
    }

    @Override
    public JsonObject replace(String collection, String key, JsonObject document) {
        return call("replace", () -> meta(db.collection(collection).replaceDocument(key, RawJson.of(document.encode()))));
    }

    /* ---------- indexes ---------- */

    @Override
    public JsonArray listIndexes(String collection) {
        return call("listIndexes", () -> {
            JsonArray out = new JsonArray();
            for (IndexEntity index : db.collection(collection).getIndexes()) {
                out.add(indexJson(index));
            }
            return out;
        });
    }

    @Override
    public JsonObject createIndex(String collection, IndexSpec spec) {
        ArangoCollection col = db.collection(collection);
        return call("createIndex", () -> {
            IndexEntity created;
            switch (spec.getKind()) {
                case TTL:
                    created = col.ensureTtlIndex(spec.getFields(), new TtlIndexOptions()
                        .expireAfter(spec.getExpireAfter())
                        .name(spec.getName())
                        .inBackground(spec.getInBackground()));
                    break;
                case FULLTEXT:
                    created = col.ensureFulltextIndex(spec.getFields(), new FulltextIndexOptions()
                        .minLength(spec.getMinLength())
                        .name(spec.getName())
                        .inBackground(spec.getInBackground()));
                    break;
                case GEO:
                    created = col.ensureGeoIndex(spec.getFields(), new GeoIndexOptions()
                        .geoJson(spec.getGeoJson())
                        .name(spec.getName())
                        .inBackground(spec.getInBackground()));
                    break;
                case PERSISTENT:
                default:
                    created = col.ensurePersistentIndex(spec.getFields(), new PersistentIndexOptions()
                        .unique(spec.isUnique())
                        .sparse(spec.isSparse())
                        .deduplicate(spec.isDeduplicate())
                        .name(spec.getName())
                        .inBackground(spec.getInBackground()));
                    break;
            }
            return indexJson(created);
        });
    }

    @Override
    public JsonObject deleteIndex(String indexId) {
        return call("deleteIndex", () -> new JsonObject().put("id", db.deleteIndex(indexId)));
    }

    /* ---------- graphs ---------- */

    @Override
    public boolean hasGraph(String name) {
        return call("hasGraph", () -> db.graph(name).exists());
    }

    @Override
    public void createGraph(String name, List<EdgeDefinitionSpec> edgeDefinitions) {
        List<EdgeDefinition> definitions = edgeDefinitions.stream()
            .map(ArangoDriverHandle::toDriver)
            .collect(Collectors.toList());
        call("createGraph", () -> db.createGraph(name, definitions));
    }

    @Override
    public JsonArray listGraphs() {
        return call("listGraphs", () -> {
            JsonArray out = new JsonArray();
            for (GraphEntity graph : db.getGraphs()) {
                JsonArray defs = new JsonArray();
                if (graph.getEdgeDefinitions() != null) {
                    for (EdgeDefinition def : graph.getEdgeDefinitions()) {
                        defs.add(new JsonObject()
                            .put("collection", def.getCollection())
                            .put("from", new JsonArray(new ArrayList<>(def.getFrom())))
                            .put("to", new JsonArray(new ArrayList<>(def.getTo()))));
                    }
                }
                JsonArray orphans = new JsonArray();
                if (graph.getOrphanCollections() != null) {
                    graph.getOrphanCollections().forEach(orphans::add);
                }
                out.add(new JsonObject()
                    .put("name", graph.getName())
                    .put("edgeDefinitions", defs)
                    .put("orphanCollections", orphans));
            }
            return out;
        });
    }

    @Override
    public void addVertexCollection(String graph, String collection) {
        call("addVertexCollection", () -> db.graph(graph).addVertexCollection(collection));
    }

    @Override
    public void addEdgeDefinition(String graph, EdgeDefinitionSpec edgeDefinition) {
        call("addEdgeDefinition", () -> db.graph(graph).addEdgeDefinition(toDriver(edgeDefinition)));
    }

    @Override
    public void close() {
        arango.shutdown();
    }

    /* ---------- helpers ---------- */

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (ArangoDBException e) {
            throw translate(operation, e);
        }
    }

    private static DatabaseOperationException translate(String operation, ArangoDBException e) {
        int errorNum = e.getErrorNum() != null ? e.getErrorNum() : 0;
        String message = e.getErrorMessage() != null ? e.getErrorMessage() : e.getMessage();
        return new DatabaseOperationException(operation + " failed: " + message, errorNum, e);
    }

    private static List<RawJson> raw(List<JsonObject> documents) {
        return documents.stream().map(d -> RawJson.of(d.encode())).collect(Collectors.toList());
    }

    private static void failOnErrors(MultiDocumentEntity<?> result) {
        List<ErrorEntity> errors = result.getErrors();
        if (errors != null && !errors.isEmpty()) {
            ErrorEntity first = errors.get(0);
            throw new DatabaseOperationException(
                errors.size() + " document(s) rejected: " + first.getErrorMessage(), first.getErrorNum(), null);
        }
    }

    private static List<JsonObject> metas(Iterable<? extends DocumentEntity> entities) {
        List<JsonObject> out = new ArrayList<>();
        for (DocumentEntity entity : entities) {
            out.add(meta(entity));
        }
        return out;
    }

    private static JsonObject meta(DocumentEntity entity) {
        return new JsonObject()
            .put("_id", entity.getId())
            .put("_key", entity.getKey())
            .put("_rev", entity.getRev());
    }

    private static JsonObject indexJson(IndexEntity index) {
        JsonArray fields = new JsonArray();
        if (index.getFields() != null) {
            index.getFields().forEach(fields::add);
        }
        return new JsonObject()
            .put("id", index.getId())
            .put("type", index.getType() != null ? index.getType().toString() : null)
            .put("fields", fields)
            .put("unique", index.getUnique())
            .put("sparse", index.getSparse())
            .put("name", index.getName())
            .put("selectivityEstimate", index.getSelectivityEstimate());
    }

    private static EdgeDefinition toDriver(EdgeDefinitionSpec spec) {
        return new EdgeDefinition()
            .collection(spec.getEdgeCollection())
            .from(spec.getFromCollections().toArray(new String[0]))
            .to(spec.getToCollections().toArray(new String[0]));
    }
}
