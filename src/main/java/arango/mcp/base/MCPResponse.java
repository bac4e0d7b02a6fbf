package arango.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents a JSON-RPC response in MCP protocol format.
 * Can be either a success response with result or an error response.
 */
public class MCPResponse {

    private final String jsonrpc = "2.0";
    private final Object id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(Object id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(Object id, JsonObject result) {
        return new MCPResponse(id, result, null);
    }

    public static MCPResponse error(Object id, int code, String message) {
        JsonObject error = new JsonObject()
            .put("code", code)
            .put("message", message);
        return new MCPResponse(id, null, error);
    }

    public Object getId() {
        return id;
    }

    public JsonObject getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Convert to JSON for transmission
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id);

        if (isError()) {
            json.put("error", error);
        } else {
            json.put("result", result);
        }
        return json;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "MCPResponse{id='" + id + "', result=" + result + "}";
        } else {
            return "MCPResponse{id='" + id + "', error=" + error + "}";
        }
    }

    // Standard JSON-RPC error codes
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;
    }
}
