package arango.mcp.handlers;

import arango.mcp.base.MissingParameterException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Typed access to validated tool arguments.
 */
public final class HandlerArgs {

    // Collection names and attribute paths that may be spliced into AQL text
    private static final Pattern AQL_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_\\-]*$");
    private static final Pattern AQL_PATH = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*$");

    private HandlerArgs() {
    }

    public static String requireString(JsonObject args, String key) {
        String value = args.getString(key);
        if (value == null) {
            throw new MissingParameterException(key);
        }
        return value;
    }

    public static JsonObject requireObject(JsonObject args, String key) {
        JsonObject value = args.getJsonObject(key);
        if (value == null) {
            throw new MissingParameterException(key);
        }
        return value;
    }

    public static JsonArray requireArray(JsonObject args, String key) {
        JsonArray value = args.getJsonArray(key);
        if (value == null) {
            throw new MissingParameterException(key);
        }
        return value;
    }

    public static int intValue(JsonObject args, String key, int defaultValue) {
        Integer value = optionalInt(args, key);
        return value == null ? defaultValue : value;
    }

    /**
     * @return the value, or null when absent
     * @throws IllegalArgumentException if the value is fractional or does not fit in an int
     */
    public static Integer optionalInt(JsonObject args, String key) {
        Number value = (Number) args.getValue(key);
        if (value == null) {
            return null;
        }
        long whole = value.longValue();
        if (whole != value.doubleValue() || whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a 32-bit integer, got " + value);
        }
        return (int) whole;
    }

    public static boolean boolValue(JsonObject args, String key, boolean defaultValue) {
        Boolean value = args.getBoolean(key);
        return value == null ? defaultValue : value;
    }

    public static List<String> strings(JsonArray array) {
        List<String> out = new ArrayList<>();
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                out.add(array.getString(i));
            }
        }
        return out;
    }

    public static List<JsonObject> objects(JsonArray array) {
        List<JsonObject> out = new ArrayList<>();
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                out.add(array.getJsonObject(i));
            }
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException if the name cannot be used verbatim as an AQL collection name
     */
    public static String aqlCollection(String name) {
        if (name == null || !AQL_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid collection name: '" + name + "'");
        }
        return name;
    }

    /**
     * @throws IllegalArgumentException if the path is not a dotted attribute path
     */
    public static String aqlAttributePath(String path) {
        if (path == null || !AQL_PATH.matcher(path).matches()) {
            throw new IllegalArgumentException("Invalid field name: '" + path + "'");
        }
        return path;
    }
}
