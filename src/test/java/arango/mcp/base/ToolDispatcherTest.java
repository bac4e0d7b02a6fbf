package arango.mcp.base;

import arango.mcp.config.ConnectionConfig;
import arango.mcp.db.DatabaseOperationException;
import arango.mcp.db.InMemoryArangoHandle;
import arango.mcp.schema.ArgumentSchema;
import arango.mcp.schema.FieldSpec;
import arango.mcp.services.ArangoConnectionManager;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.atomic.AtomicInteger;

@ExtendWith(VertxExtension.class)
public class ToolDispatcherTest {

    private static final ConnectionConfig CONFIG =
        new ConnectionConfig(ConnectionConfig.DEFAULT_URL, "_system", "root", "", 1000);

    private final AtomicInteger handlerCalls = new AtomicInteger();

    private ToolRegistry registry() {
        return ToolRegistry.builder()
            .register("ping", "Liveness", ArgumentSchema.empty(), (db, args) -> {
                handlerCalls.incrementAndGet();
                return new JsonObject().put("pong", true);
            })
            .register("insert_doc", "Insert", ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.object("document").required()),
                (db, args) -> {
                    handlerCalls.incrementAndGet();
                    return db.insert(args.getString("collection"), args.getJsonObject("document"));
                })
            .register("explode", "Throws what it is told to", ArgumentSchema.of(FieldSpec.string("kind")),
                (db, args) -> {
                    handlerCalls.incrementAndGet();
                    switch (args.getString("kind", "")) {
                        case "missing":
                            throw new MissingParameterException("key");
                        case "db":
                            throw new DatabaseOperationException("boom", 1203, null);
                        default:
                            throw new IllegalStateException("unexpected state");
                    }
                })
            .build();
    }

    private static ArangoConnectionManager connectedManager(Vertx vertx, InMemoryArangoHandle db) {
        return new ArangoConnectionManager(vertx, CONFIG, config -> db);
    }

    private static ArangoConnectionManager failingManager(Vertx vertx) {
        return new ArangoConnectionManager(vertx, CONFIG, config -> {
            throw new DatabaseOperationException("connection refused");
        });
    }

    @Test
    @DisplayName("Unknown tool fails without touching the connection manager")
    void testUnknownTool(Vertx vertx, VertxTestContext testContext) {
        ArangoConnectionManager manager = failingManager(vertx);
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(), manager);

        dispatcher.dispatch("no_such_tool", new JsonObject()).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                Assertions.assertFalse(result.isSuccess());
                Assertions.assertEquals(ErrorKind.UNKNOWN_TOOL, result.getKind());
                JsonObject envelope = (JsonObject) result.toJsonValue();
                Assertions.assertEquals("Unknown tool: no_such_tool", envelope.getString("error"));
                Assertions.assertEquals("UnknownTool", envelope.getString("type"));
                Assertions.assertEquals(0, manager.getConnectCalls());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Validation failure names the missing field and skips the handler")
    void testValidationError(Vertx vertx, VertxTestContext testContext) {
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(),
            connectedManager(vertx, new InMemoryArangoHandle()));

        dispatcher.dispatch("insert_doc", new JsonObject().put("document", new JsonObject().put("a", 1)))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertEquals(ErrorKind.VALIDATION_ERROR, result.getKind());
                JsonObject envelope = (JsonObject) result.toJsonValue();
                Assertions.assertEquals("ValidationError", envelope.getString("type"));
                Assertions.assertEquals("insert_doc", envelope.getString("tool"));
                JsonArray details = envelope.getJsonArray("details");
                Assertions.assertEquals(1, details.size());
                Assertions.assertEquals(new JsonArray().add("collection"), details.getJsonObject(0).getJsonArray("loc"));
                Assertions.assertEquals(0, handlerCalls.get());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Ping returns the handler payload untouched")
    void testPing(Vertx vertx, VertxTestContext testContext) {
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(),
            connectedManager(vertx, new InMemoryArangoHandle()));

        dispatcher.dispatch("ping", null).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                Assertions.assertTrue(result.isSuccess());
                Assertions.assertEquals("{\"pong\":true}", result.toJsonText());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A missing handle triggers exactly one reconnect, then stays cached")
    void testLazyReconnectOnce(Vertx vertx, VertxTestContext testContext) {
        InMemoryArangoHandle db = new InMemoryArangoHandle().withCollection("users");
        ArangoConnectionManager manager = connectedManager(vertx, db);
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(), manager);
        JsonObject args = new JsonObject().put("collection", "users").put("document", new JsonObject().put("n", 1));

        dispatcher.dispatch("insert_doc", args)
            .compose(first -> {
                testContext.verify(() -> {
                    Assertions.assertTrue(first.isSuccess());
                    Assertions.assertEquals(1, manager.getConnectCalls());
                });
                return dispatcher.dispatch("insert_doc", args);
            })
            .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
                Assertions.assertTrue(second.isSuccess());
                Assertions.assertEquals(1, manager.getConnectCalls());
                Assertions.assertEquals(2, db.documents("users").size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Failed reconnect reports DatabaseUnavailable with a hint")
    void testDatabaseUnavailable(Vertx vertx, VertxTestContext testContext) {
        ArangoConnectionManager manager = failingManager(vertx);
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(), manager);

        dispatcher.dispatch("ping", new JsonObject()).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                Assertions.assertEquals(ErrorKind.DATABASE_UNAVAILABLE, result.getKind());
                JsonObject envelope = (JsonObject) result.toJsonValue();
                Assertions.assertEquals("Database unavailable", envelope.getString("error"));
                Assertions.assertEquals(ToolDispatcher.DB_UNAVAILABLE_HINT, envelope.getString("hint"));
                Assertions.assertEquals(1, manager.getConnectCalls());
                Assertions.assertEquals(0, handlerCalls.get());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Handler exceptions map to their failure kinds and do not affect later calls")
    void testErrorIsolation(Vertx vertx, VertxTestContext testContext) {
        InMemoryArangoHandle db = new InMemoryArangoHandle();
        ArangoConnectionManager manager = connectedManager(vertx, db);
        ToolDispatcher dispatcher = new ToolDispatcher(vertx, registry(), manager);

        dispatcher.dispatch("explode", new JsonObject().put("kind", "missing"))
            .compose(missing -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(ErrorKind.MISSING_PARAMETER, missing.getKind());
                    Assertions.assertEquals("Missing required parameter: key", missing.getMessage());
                });
                return dispatcher.dispatch("explode", new JsonObject().put("kind", "db"));
            })
            .compose(dbFailure -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(ErrorKind.DATABASE_OPERATION_FAILED, dbFailure.getKind());
                    Assertions.assertEquals("Database operation failed: boom", dbFailure.getMessage());
                });
                return dispatcher.dispatch("explode", new JsonObject().put("kind", "other"));
            })
            .compose(other -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(ErrorKind.UNEXPECTED_ERROR, other.getKind());
                    JsonObject envelope = (JsonObject) other.toJsonValue();
                    Assertions.assertEquals("Operation failed: unexpected state", envelope.getString("error"));
                    Assertions.assertEquals("IllegalStateException", envelope.getString("exception"));
                });
                return dispatcher.dispatch("ping", new JsonObject());
            })
            .onComplete(testContext.succeeding(ping -> testContext.verify(() -> {
                Assertions.assertTrue(ping.isSuccess());
                // handler failures keep the cached connection
                Assertions.assertEquals(1, manager.getConnectCalls());
                Assertions.assertFalse(db.closed);
                testContext.completeNow();
            })));
    }
}
