package arango.mcp.db;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * One edge collection of a named graph with its allowed endpoint collections.
 */
public class EdgeDefinitionSpec {

    private final String edgeCollection;
    private final List<String> fromCollections;
    private final List<String> toCollections;

    public EdgeDefinitionSpec(String edgeCollection, List<String> fromCollections, List<String> toCollections) {
        this.edgeCollection = edgeCollection;
        this.fromCollections = List.copyOf(fromCollections);
        this.toCollections = List.copyOf(toCollections);
    }

    /**
     * Read the <code>{edge_collection, from_collections, to_collections}</code> wire shape.
     */
    public static EdgeDefinitionSpec fromJson(JsonObject json) {
        return new EdgeDefinitionSpec(
            json.getString("edge_collection"),
            strings(json.getJsonArray("from_collections")),
            strings(json.getJsonArray("to_collections")));
    }

    private static List<String> strings(JsonArray array) {
        List<String> out = new ArrayList<>();
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                out.add(array.getString(i));
            }
        }
        return out;
    }

    public String getEdgeCollection() {
        return edgeCollection;
    }

    public List<String> getFromCollections() {
        return fromCollections;
    }

    public List<String> getToCollections() {
        return toCollections;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("edge_collection", edgeCollection)
            .put("from_collections", new JsonArray(new ArrayList<>(fromCollections)))
            .put("to_collections", new JsonArray(new ArrayList<>(toCollections)));
    }

    @Override
    public String toString() {
        return "EdgeDefinitionSpec{" + edgeCollection + ": " + fromCollections + " -> " + toCollections + "}";
    }
}
