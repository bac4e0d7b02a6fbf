package arango.mcp.transport;

import arango.mcp.base.McpProtocolHandler;
import arango.mcp.base.ToolDispatcher;
import arango.mcp.base.ToolRegistry;
import arango.mcp.config.ConnectionConfig;
import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.db.InMemoryArangoHandle;
import arango.mcp.schema.ArgumentSchema;
import arango.mcp.schema.FieldSpec;
import arango.mcp.services.ArangoConnectionManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@ExtendWith(VertxExtension.class)
public class StdioServerTransportTest {

    private static ToolDispatcher dispatcher(Vertx vertx) {
        ToolRegistry registry = ToolRegistry.builder()
            .register("ping", "Liveness", ArgumentSchema.empty(), (db, args) -> new JsonObject().put("pong", true))
            .register("half", "Halve a number", ArgumentSchema.of(FieldSpec.number("value").required()),
                (db, args) -> new JsonObject().put("half", args.getDouble("value") / 2))
            .build();
        ArangoConnectionManager manager = new ArangoConnectionManager(vertx,
            new ConnectionConfig(ConnectionConfig.DEFAULT_URL, "_system", "root", "", 1000),
            config -> new InMemoryArangoHandle());
        return new ToolDispatcher(vertx, registry, manager);
    }

    private static List<JsonObject> responses(ByteArrayOutputStream bytes) {
        List<JsonObject> responses = new ArrayList<>();
        for (String line : bytes.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                responses.add(new JsonObject(line));
            }
        }
        return responses;
    }

    @Test
    void testAnswersEachRequestLine(Vertx vertx, VertxTestContext testContext) {
        McpProtocolHandler protocol = new McpProtocolHandler(vertx, dispatcher(vertx), ToolListingMode.FULL, 7);

        String input = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}\n"
            + "\n"
            + "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}\n"
            + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"ping\"}}\n";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        StdioServerTransport transport = new StdioServerTransport(vertx, protocol,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);

        transport.start(() -> vertx.setTimer(500, id -> testContext.verify(() -> {
            List<JsonObject> responses = responses(bytes);
            Assertions.assertEquals(2, responses.size());
            for (JsonObject response : responses) {
                Assertions.assertEquals("2.0", response.getString("jsonrpc"));
                Assertions.assertNotNull(response.getJsonObject("result"));
            }
            testContext.completeNow();
        })));
    }

    @Test
    void testKeepsReadingAfterAFailingLine(Vertx vertx, VertxTestContext testContext) {
        McpProtocolHandler protocol = new McpProtocolHandler(vertx, dispatcher(vertx), ToolListingMode.FULL, 7) {
            @Override
            public Future<JsonObject> handleText(String text) {
                if (text.contains("\"broken\"")) {
                    throw new NoSuchMethodError("com.fasterxml.jackson.core.JsonParser.getNumberTypeFP()");
                }
                return super.handleText(text);
            }
        };

        String input = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"half\",\"arguments\":{\"value\":2.5}}}\n"
            + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"broken\"}\n"
            + "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"ping\"}\n";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        StdioServerTransport transport = new StdioServerTransport(vertx, protocol,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);

        transport.start(() -> vertx.setTimer(500, id -> testContext.verify(() -> {
            List<JsonObject> responses = responses(bytes);
            Assertions.assertEquals(3, responses.size());

            JsonObject failed = responses.stream().filter(r -> r.containsKey("error")).findFirst().orElseThrow();
            Assertions.assertEquals(-32603, failed.getJsonObject("error").getInteger("code"));

            JsonObject halved = responses.stream().filter(r -> Integer.valueOf(1).equals(r.getValue("id")))
                .findFirst().orElseThrow();
            String text = halved.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
            Assertions.assertEquals(1.25, new JsonObject(text).getDouble("half"));

            JsonObject pong = responses.stream().filter(r -> Integer.valueOf(3).equals(r.getValue("id")))
                .findFirst().orElseThrow();
            Assertions.assertEquals(new JsonObject(), pong.getJsonObject("result"));
            testContext.completeNow();
        })));
    }
}
