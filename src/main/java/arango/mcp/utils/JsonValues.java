package arango.mcp.utils;

import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Vert.x JSON containers and plain Java values.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Unwrap JsonObject/JsonArray (recursively) into Map/List so the value can be handed
     * to libraries that serialize plain Java collections.
     */
    public static Object toPlain(Object value) {
        if (value instanceof JsonObject) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : (JsonObject) value) {
                map.put(entry.getKey(), toPlain(entry.getValue()));
            }
            return map;
        }
        if (value instanceof JsonArray) {
            List<Object> list = new ArrayList<>();
            for (Object item : (JsonArray) value) {
                list.add(toPlain(item));
            }
            return list;
        }
        if (value instanceof Map || value instanceof List) {
            return toPlain(wrap(value));
        }
        return value;
    }

    public static Map<String, Object> toPlainMap(JsonObject object) {
        if (object == null) {
            return new LinkedHashMap<>();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) toPlain(object);
        return map;
    }

    /**
     * Wrap Map/List values into JsonObject/JsonArray. Other values pass through.
     */
    @SuppressWarnings("unchecked")
    public static Object wrap(Object value) {
        if (value instanceof Map) {
            return new JsonObject((Map<String, Object>) value);
        }
        if (value instanceof List) {
            return new JsonArray((List<Object>) value);
        }
        return value;
    }

    /**
     * Parse a JSON text into JsonObject, JsonArray, or a scalar.
     */
    public static Object decode(String json) {
        return wrap(Json.decodeValue(json));
    }

    /**
     * Encode any JSON-compatible value, including null and scalars.
     */
    public static String encode(Object value) {
        return Json.encode(wrap(value));
    }
}
