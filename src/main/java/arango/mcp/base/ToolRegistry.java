package arango.mcp.base;

import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.schema.ArgumentSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name to tool mapping, in registration order.
 *
 * <p>Built once at startup through {@link Builder}. A duplicate name or an empty registry is a
 * startup error.</p>
 */
public final class ToolRegistry {

    private final Map<String, MCPTool> tools;

    private ToolRegistry(Map<String, MCPTool> tools) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MCPTool> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public List<MCPTool> listAll() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Tools exposed by tools/list. In {@link ToolListingMode#BASELINE} mode only the first
     * <code>baselineSize</code> registered tools are listed; dispatch still sees all of them.
     */
    public List<MCPTool> listForListing(ToolListingMode mode, int baselineSize) {
        List<MCPTool> all = listAll();
        if (mode == ToolListingMode.BASELINE && baselineSize >= 0 && baselineSize < all.size()) {
            return all.subList(0, baselineSize);
        }
        return all;
    }

    public int size() {
        return tools.size();
    }

    public static class Builder {
        private final Map<String, MCPTool> tools = new LinkedHashMap<>();

        /**
         * @throws IllegalStateException if a tool with this name is already registered
         */
        public Builder register(String name, String description, ArgumentSchema schema, ToolHandler handler) {
            return register(new MCPTool(name, description, schema, handler));
        }

        public Builder register(MCPTool tool) {
            if (tools.containsKey(tool.getName())) {
                throw new IllegalStateException("Duplicate tool registration: " + tool.getName());
            }
            tools.put(tool.getName(), tool);
            return this;
        }

        /**
         * @throws IllegalStateException if no tool was registered
         */
        public ToolRegistry build() {
            if (tools.isEmpty()) {
                throw new IllegalStateException("Tool registry is empty. No tools have been registered.");
            }
            return new ToolRegistry(tools);
        }
    }
}
