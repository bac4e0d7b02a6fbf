package arango.mcp.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * One rejected argument: a violation code, the path to the offending value and a message.
 */
public class FieldViolation {

    private final String type;
    private final List<Object> loc;
    private final String msg;

    public FieldViolation(String type, List<Object> loc, String msg) {
        this.type = type;
        this.loc = List.copyOf(loc);
        this.msg = msg;
    }

    public String getType() {
        return type;
    }

    /** Field names and array indexes from the argument root down to the value. */
    public List<Object> getLoc() {
        return loc;
    }

    public String getMsg() {
        return msg;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("type", type)
            .put("loc", new JsonArray(new ArrayList<>(loc)))
            .put("msg", msg);
    }

    @Override
    public String toString() {
        return type + " at " + loc + ": " + msg;
    }
}
