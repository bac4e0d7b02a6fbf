package arango.mcp.base;

import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Transport-independent MCP method handling: session setup, ping, tools/list and tools/call.
 *
 * <p>Tool results are wrapped as a single text content item holding the JSON envelope, for
 * successes and failures alike.</p>
 */
public class McpProtocolHandler {

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "arango-mcp-server";
    public static final String SERVER_VERSION = "0.1.0";

    private static final String COMPONENT = "McpProtocolHandler";

    private final Vertx vertx;
    private final ToolDispatcher dispatcher;
    private final ToolListingMode listingMode;
    private final int baselineSize;

    public McpProtocolHandler(Vertx vertx, ToolDispatcher dispatcher, ToolListingMode listingMode, int baselineSize) {
        this.vertx = vertx;
        this.dispatcher = dispatcher;
        this.listingMode = listingMode;
        this.baselineSize = baselineSize;
    }

    /**
     * Handle one raw JSON-RPC message.
     *
     * @return the response, or a future of null when the message was a notification
     */
    public Future<JsonObject> handleText(String text) {
        JsonObject message;
        try {
            message = new JsonObject(text);
        } catch (DecodeException | ClassCastException e) {
            LogUtil.logDetail(vertx, "Unparseable message: " + e.getMessage(), COMPONENT, "Parse", "MCP");
            return Future.succeededFuture(
                MCPResponse.error(null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error").toJson());
        } catch (RuntimeException | LinkageError e) {
            return Future.succeededFuture(internalError(null, "Parse", e));
        }

        Object id = requestId(message);
        try {
            return handle(message).otherwise(err -> internalError(id, "Handle", err));
        } catch (RuntimeException | LinkageError e) {
            return Future.succeededFuture(internalError(id, "Handle", e));
        }
    }

    /** The request id when it is usable in a reply, otherwise null. */
    private static Object requestId(JsonObject message) {
        Object id = message.getValue("id");
        return id instanceof String || id instanceof Number ? id : null;
    }

    private JsonObject internalError(Object id, String operation, Throwable err) {
        LogUtil.logError(vertx, "Message handling failed", err, COMPONENT, operation, "MCP", true);
        return MCPResponse.error(id, MCPResponse.ErrorCodes.INTERNAL_ERROR,
            "Internal error: " + err.getClass().getSimpleName() + ": " + err.getMessage()).toJson();
    }

    public Future<JsonObject> handle(JsonObject message) {
        MCPRequest request = MCPRequest.fromJson(message);
        if (!request.isValid()) {
            return Future.succeededFuture(MCPResponse.error(request.getId(),
                MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format").toJson());
        }
        LogUtil.logDebug(vertx, "Received " + request.getMethod(), COMPONENT, "Request", "MCP");

        if (request.isNotification()) {
            // notifications/initialized and friends need no reply
            return Future.succeededFuture(null);
        }

        switch (request.getMethod()) {
            case "initialize":
                return Future.succeededFuture(MCPResponse.success(request.getId(), initializeResult(request.getParams())).toJson());
            case "ping":
                return Future.succeededFuture(MCPResponse.success(request.getId(), new JsonObject()).toJson());
            case "tools/list":
                return Future.succeededFuture(MCPResponse.success(request.getId(), listTools()).toJson());
            case "tools/call":
                return callTool(request);
            default:
                return Future.succeededFuture(MCPResponse.error(request.getId(),
                    MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + request.getMethod()).toJson());
        }
    }

    private JsonObject initializeResult(JsonObject params) {
        String requested = params.getValue("protocolVersion") instanceof String
            ? params.getString("protocolVersion") : null;
        return new JsonObject()
            .put("protocolVersion", requested != null ? requested : PROTOCOL_VERSION)
            .put("capabilities", new JsonObject()
                .put("tools", new JsonObject().put("listChanged", false)))
            .put("serverInfo", new JsonObject()
                .put("name", SERVER_NAME)
                .put("version", SERVER_VERSION));
    }

    JsonObject listTools() {
        JsonArray tools = new JsonArray();
        for (MCPTool tool : dispatcher.getRegistry().listForListing(listingMode, baselineSize)) {
            tools.add(tool.toJson());
        }
        return new JsonObject().put("tools", tools);
    }

    private Future<JsonObject> callTool(MCPRequest request) {
        JsonObject params = request.getParams();
        Object name = params.getValue("name");
        if (!(name instanceof String)) {
            return Future.succeededFuture(MCPResponse.error(request.getId(),
                MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name").toJson());
        }
        Object arguments = params.getValue("arguments");
        if (arguments != null && !(arguments instanceof JsonObject)) {
            return Future.succeededFuture(MCPResponse.error(request.getId(),
                MCPResponse.ErrorCodes.INVALID_PARAMS, "Tool arguments must be an object").toJson());
        }

        return dispatcher.dispatch((String) name, (JsonObject) arguments)
            .map(result -> MCPResponse.success(request.getId(), toContent(result)).toJson())
            .otherwise(err -> internalError(request.getId(), "Call", err));
    }

    static JsonObject toContent(DispatchResult result) {
        return new JsonObject().put("content", new JsonArray()
            .add(new JsonObject()
                .put("type", "text")
                .put("text", result.toJsonText())));
    }
}
