package arango.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents an incoming JSON-RPC message in MCP protocol format.
 * A message without an id is a notification and gets no response.
 */
public class MCPRequest {

    private final String jsonrpc;
    private final Object id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(String jsonrpc, Object id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    /** String or number, as sent by the client. Null for notifications. */
    public Object getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    public boolean isNotification() {
        return id == null;
    }

    /**
     * Create from incoming JSON. A non-object <code>params</code> is read as empty.
     */
    public static MCPRequest fromJson(JsonObject json) {
        Object rawParams = json.getValue("params");
        return new MCPRequest(
            json.getValue("jsonrpc") instanceof String ? json.getString("jsonrpc") : null,
            json.getValue("id"),
            json.getValue("method") instanceof String ? json.getString("method") : null,
            rawParams instanceof JsonObject ? (JsonObject) rawParams : new JsonObject()
        );
    }

    /**
     * Validate the request format
     */
    public boolean isValid() {
        return "2.0".equals(jsonrpc)
            && method != null && !method.isEmpty()
            && (id == null || id instanceof String || id instanceof Number);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
