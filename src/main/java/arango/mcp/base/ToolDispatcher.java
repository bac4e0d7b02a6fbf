package arango.mcp.base;

import arango.mcp.db.ArangoHandle;
import arango.mcp.db.DatabaseOperationException;
import arango.mcp.schema.ValidationResult;
import arango.mcp.services.ArangoConnectionManager;
import arango.mcp.services.LogUtil;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.Optional;

/**
 * Resolves, validates and runs tool calls.
 *
 * <ol>
 *   <li>Look the tool up; an unknown name fails without touching the connection manager.</li>
 *   <li>Validate arguments; violations fail before the handler is reached.</li>
 *   <li>Use the cached handle, or make one lazy reconnect attempt.</li>
 *   <li>Run the handler on a worker thread and map its outcome.</li>
 * </ol>
 *
 * <p>The returned future always succeeds; every failure becomes a {@link DispatchResult}.</p>
 */
public class ToolDispatcher {

    static final String DB_UNAVAILABLE_HINT = "Ensure ArangoDB is reachable or check ARANGO_* environment variables.";
    private static final String COMPONENT = "ToolDispatcher";

    private final Vertx vertx;
    private final ToolRegistry registry;
    private final ArangoConnectionManager connections;

    public ToolDispatcher(Vertx vertx, ToolRegistry registry, ArangoConnectionManager connections) {
        this.vertx = vertx;
        this.registry = registry;
        this.connections = connections;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public Future<DispatchResult> dispatch(String toolName, JsonObject rawArguments) {
        Optional<MCPTool> found = registry.lookup(toolName);
        if (found.isEmpty()) {
            LogUtil.logDetail(vertx, "Unknown tool requested: " + toolName, COMPONENT, "Dispatch", "MCP");
            return Future.succeededFuture(DispatchResult.failure(toolName, ErrorKind.UNKNOWN_TOOL,
                "Unknown tool: " + toolName, null));
        }
        MCPTool tool = found.get();

        ValidationResult validation = tool.getSchema().validate(rawArguments);
        if (!validation.isValid()) {
            LogUtil.logDetail(vertx, "Validation failed for " + toolName + ": " + validation.getViolations(),
                COMPONENT, "Validate", "MCP");
            return Future.succeededFuture(DispatchResult.failure(toolName, ErrorKind.VALIDATION_ERROR,
                "Invalid arguments for tool '" + toolName + "'",
                new JsonObject().put("details", validation.violationsJson())));
        }
        JsonObject arguments = validation.getArguments();

        Future<Optional<ArangoHandle>> handleFuture = connections.current()
            .map(h -> Future.succeededFuture(Optional.of(h)))
            .orElseGet(connections::lazyReconnect);

        return handleFuture.compose(handle -> {
            if (handle.isEmpty()) {
                return Future.succeededFuture(DispatchResult.failure(toolName, ErrorKind.DATABASE_UNAVAILABLE,
                    "Database unavailable", new JsonObject().put("hint", DB_UNAVAILABLE_HINT)));
            }
            return invoke(tool, handle.get(), arguments);
        });
    }

    private Future<DispatchResult> invoke(MCPTool tool, ArangoHandle handle, JsonObject arguments) {
        String toolName = tool.getName();
        LogUtil.logDebug(vertx, "Invoking " + toolName, COMPONENT, "Invoke", "MCP");
        return vertx.<Object>executeBlocking(() -> tool.getHandler().handle(handle, arguments), false)
            .map(payload -> DispatchResult.success(toolName, payload))
            .otherwise(err -> mapFailure(toolName, err));
    }

    /**
     * Translate a handler exception into a failure result. Only the message and kind are
     * kept; stack traces stay in the log.
     */
    DispatchResult mapFailure(String toolName, Throwable err) {
        if (err instanceof MissingParameterException) {
            LogUtil.logError(vertx, "Missing required parameter in " + toolName + ": "
                + ((MissingParameterException) err).getParameter(), COMPONENT, "Invoke", "MCP", true);
            return DispatchResult.failure(toolName, ErrorKind.MISSING_PARAMETER, err.getMessage(), null);
        }
        if (err instanceof DatabaseOperationException) {
            LogUtil.logError(vertx, "ArangoDB error in " + toolName, err, COMPONENT, "Invoke", "Database", false);
            return DispatchResult.failure(toolName, ErrorKind.DATABASE_OPERATION_FAILED,
                "Database operation failed: " + err.getMessage(), null);
        }
        LogUtil.logError(vertx, "Unexpected error in " + toolName, err, COMPONENT, "Invoke", "MCP", false);
        return DispatchResult.failure(toolName, ErrorKind.UNEXPECTED_ERROR,
            "Operation failed: " + err.getMessage(),
            new JsonObject().put("exception", err.getClass().getSimpleName()));
    }
}
