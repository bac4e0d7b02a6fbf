package arango.mcp.base;

import arango.mcp.utils.JsonValues;
import io.vertx.core.json.JsonObject;

/**
 * Outcome of one tool call. Either way it serializes to a single JSON text; failures are
 * objects carrying an <code>error</code> field.
 */
public final class DispatchResult {

    private final String tool;
    private final Object payload;
    private final ErrorKind kind;
    private final String message;
    private final JsonObject detail;

    private DispatchResult(String tool, Object payload, ErrorKind kind, String message, JsonObject detail) {
        this.tool = tool;
        this.payload = payload;
        this.kind = kind;
        this.message = message;
        this.detail = detail;
    }

    public static DispatchResult success(String tool, Object payload) {
        return new DispatchResult(tool, payload, null, null, null);
    }

    /**
     * @param detail extra envelope fields such as <code>details</code>, <code>hint</code> or <code>exception</code>
     */
    public static DispatchResult failure(String tool, ErrorKind kind, String message, JsonObject detail) {
        return new DispatchResult(tool, null, kind, message, detail == null ? new JsonObject() : detail);
    }

    public boolean isSuccess() {
        return kind == null;
    }

    public String getTool() {
        return tool;
    }

    /** Handler value, untouched. Null on failure. */
    public Object getPayload() {
        return payload;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public JsonObject getDetail() {
        return detail;
    }

    /**
     * The response body: the payload itself, or the error envelope.
     */
    public Object toJsonValue() {
        if (isSuccess()) {
            return JsonValues.wrap(payload);
        }
        JsonObject envelope = new JsonObject()
            .put("error", message)
            .put("tool", tool)
            .put("type", kind.wireName());
        envelope.mergeIn(detail);
        return envelope;
    }

    public String toJsonText() {
        return JsonValues.encode(toJsonValue());
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "DispatchResult{tool='" + tool + "', success}"
            : "DispatchResult{tool='" + tool + "', " + kind.wireName() + ": " + message + "}";
    }
}
