package arango.mcp.base;

import arango.mcp.schema.ArgumentSchema;
import io.vertx.core.json.JsonObject;

/**
 * A registered tool: name, description, argument schema and handler.
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final ArgumentSchema schema;
    private final ToolHandler handler;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, ArgumentSchema schema, ToolHandler handler) {
        this.name = name;
        this.description = description;
        this.schema = schema;
        this.handler = handler;
        this.inputSchema = schema.toJsonSchema();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ArgumentSchema getSchema() {
        return schema;
    }

    public ToolHandler getHandler() {
        return handler;
    }

    public JsonObject getInputSchema() {
        return inputSchema.copy();
    }

    /**
     * Convert to JSON format for tools/list
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", getInputSchema());
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "', description='" + description + "'}";
    }
}
