package arango.mcp.base;

import arango.mcp.config.ConnectionConfig;
import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.db.InMemoryArangoHandle;
import arango.mcp.schema.ArgumentSchema;
import arango.mcp.schema.FieldSpec;
import arango.mcp.services.ArangoConnectionManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(VertxExtension.class)
public class McpProtocolHandlerTest {

    private static McpProtocolHandler handler(Vertx vertx, ToolListingMode mode, int baseline) {
        ToolRegistry.Builder builder = ToolRegistry.builder()
            .register("ping", "Liveness", ArgumentSchema.empty(), (db, args) -> new JsonObject().put("pong", true))
            .register("echo", "Echo", ArgumentSchema.of(FieldSpec.string("text").required()),
                (db, args) -> args.getString("text"))
            .register("tool_3", "Scale", ArgumentSchema.of(FieldSpec.number("factor").required(), FieldSpec.integer("count")),
                (db, args) -> new JsonObject()
                    .put("scaled", args.getDouble("factor") * args.getInteger("count", 1)));
        for (int i = 4; i <= 10; i++) {
            builder.register("tool_" + i, "Tool " + i, ArgumentSchema.empty(), (db, args) -> null);
        }
        ArangoConnectionManager manager = new ArangoConnectionManager(vertx,
            new ConnectionConfig(ConnectionConfig.DEFAULT_URL, "_system", "root", "", 1000),
            config -> new InMemoryArangoHandle());
        return new McpProtocolHandler(vertx, new ToolDispatcher(vertx, builder.build(), manager), mode, baseline);
    }

    private static JsonObject request(Object id, String method, JsonObject params) {
        JsonObject message = new JsonObject().put("jsonrpc", "2.0").put("method", method);
        if (id != null) {
            message.put("id", id);
        }
        if (params != null) {
            message.put("params", params);
        }
        return message;
    }

    @Test
    void testInitializeEchoesProtocolVersion(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.FULL, 7)
            .handle(request(1, "initialize", new JsonObject().put("protocolVersion", "2025-03-26")))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(1, response.getInteger("id"));
                JsonObject result = response.getJsonObject("result");
                Assertions.assertEquals("2025-03-26", result.getString("protocolVersion"));
                Assertions.assertEquals(McpProtocolHandler.SERVER_NAME,
                    result.getJsonObject("serverInfo").getString("name"));
                Assertions.assertNotNull(result.getJsonObject("capabilities").getJsonObject("tools"));
                testContext.completeNow();
            })));
    }

    @Test
    void testNotificationGetsNoResponse(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.FULL, 7)
            .handle(request(null, "notifications/initialized", null))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertNull(response);
                testContext.completeNow();
            })));
    }

    @Test
    void testBaselineToolsList(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.BASELINE, 7)
            .handle(request("a", "tools/list", null))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonArray tools = response.getJsonObject("result").getJsonArray("tools");
                Assertions.assertEquals(7, tools.size());
                Assertions.assertEquals("ping", tools.getJsonObject(0).getString("name"));
                Assertions.assertEquals("tool_7", tools.getJsonObject(6).getString("name"));
                Assertions.assertNotNull(tools.getJsonObject(1).getJsonObject("inputSchema"));
                testContext.completeNow();
            })));
    }

    @Test
    void testToolsCallWrapsPayloadAsText(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.FULL, 7)
            .handle(request(2, "tools/call", new JsonObject().put("name", "ping")))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                JsonArray content = response.getJsonObject("result").getJsonArray("content");
                Assertions.assertEquals(1, content.size());
                Assertions.assertEquals("text", content.getJsonObject(0).getString("type"));
                Assertions.assertEquals(new JsonObject().put("pong", true),
                    new JsonObject(content.getJsonObject(0).getString("text")));
                testContext.completeNow();
            })));
    }

    @Test
    void testToolFailureIsStillAResult(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.FULL, 7)
            .handle(request(3, "tools/call", new JsonObject().put("name", "echo").put("arguments", new JsonObject())))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertNull(response.getJsonObject("error"));
                String text = response.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
                JsonObject envelope = new JsonObject(text);
                Assertions.assertEquals("ValidationError", envelope.getString("type"));
                Assertions.assertEquals("echo", envelope.getString("tool"));
                testContext.completeNow();
            })));
    }

    @Test
    void testProtocolErrors(Vertx vertx, VertxTestContext testContext) {
        McpProtocolHandler handler = handler(vertx, ToolListingMode.FULL, 7);

        handler.handleText("{not json")
            .compose(parse -> {
                testContext.verify(() -> Assertions.assertEquals(-32700,
                    parse.getJsonObject("error").getInteger("code")));
                return handler.handle(request(4, "resources/list", null));
            })
            .compose(unknown -> {
                testContext.verify(() -> Assertions.assertEquals(-32601,
                    unknown.getJsonObject("error").getInteger("code")));
                return handler.handle(new JsonObject().put("id", 5).put("method", "ping"));
            })
            .compose(invalid -> {
                testContext.verify(() -> Assertions.assertEquals(-32600,
                    invalid.getJsonObject("error").getInteger("code")));
                return handler.handle(request(6, "tools/call", new JsonObject()));
            })
            .onComplete(testContext.succeeding(noName -> testContext.verify(() -> {
                Assertions.assertEquals(-32602, noName.getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    void testFractionalArgumentsFromRawText(Vertx vertx, VertxTestContext testContext) {
        String line = "{\"jsonrpc\":\"2.0\",\"id\":8,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"tool_3\",\"arguments\":{\"factor\":1.5,\"count\":4}}}";
        handler(vertx, ToolListingMode.FULL, 7)
            .handleText(line)
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertNull(response.getJsonObject("error"));
                String text = response.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
                Assertions.assertEquals(6.0, new JsonObject(text).getDouble("scaled"));
                testContext.completeNow();
            })));
    }

    @Test
    void testOversizedIntegerArgumentIsAValidationError(Vertx vertx, VertxTestContext testContext) {
        String line = "{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"tool_3\",\"arguments\":{\"factor\":2,\"count\":4294967296}}}";
        handler(vertx, ToolListingMode.FULL, 7)
            .handleText(line)
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                String text = response.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
                JsonObject envelope = new JsonObject(text);
                Assertions.assertEquals("ValidationError", envelope.getString("type"));
                JsonObject detail = envelope.getJsonArray("details").getJsonObject(0);
                Assertions.assertEquals(new JsonArray().add("count"), detail.getJsonArray("loc"));
                Assertions.assertEquals("less_than_equal", detail.getString("type"));
                testContext.completeNow();
            })));
    }

    @Test
    void testUnexpectedFailureBecomesInternalError(Vertx vertx, VertxTestContext testContext) {
        McpProtocolHandler base = handler(vertx, ToolListingMode.FULL, 7);
        McpProtocolHandler failing = new McpProtocolHandler(vertx, null, ToolListingMode.FULL, 7) {
            @Override
            public Future<JsonObject> handle(JsonObject message) {
                if ("ping".equals(message.getString("method"))) {
                    throw new NoSuchMethodError("com.fasterxml.jackson.core.JsonParser.getNumberTypeFP()");
                }
                return base.handle(message);
            }
        };

        failing.handleText("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"ping\"}")
            .compose(crashed -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(10, crashed.getInteger("id"));
                    JsonObject error = crashed.getJsonObject("error");
                    Assertions.assertEquals(-32603, error.getInteger("code"));
                    Assertions.assertTrue(error.getString("message").contains("NoSuchMethodError"));
                });
                return failing.handleText("{\"jsonrpc\":2,\"id\":11,\"method\":\"initialize\"}");
            })
            .onComplete(testContext.succeeding(badVersion -> testContext.verify(() -> {
                Assertions.assertEquals(-32600, badVersion.getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    void testPing(Vertx vertx, VertxTestContext testContext) {
        handler(vertx, ToolListingMode.FULL, 7)
            .handle(request(7, "ping", null))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(new JsonObject(), response.getJsonObject("result"));
                testContext.completeNow();
            })));
    }
}
