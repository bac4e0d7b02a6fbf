package arango.mcp.base;

import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.schema.ArgumentSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final ToolHandler NOOP = (db, args) -> null;

    private static ToolRegistry registryOf(int count) {
        ToolRegistry.Builder builder = ToolRegistry.builder();
        for (int i = 1; i <= count; i++) {
            builder.register("tool_" + i, "Tool " + i, ArgumentSchema.empty(), NOOP);
        }
        return builder.build();
    }

    @Test
    void testDuplicateNameIsRejected() {
        ToolRegistry.Builder builder = ToolRegistry.builder()
            .register("arango_query", "first", ArgumentSchema.empty(), NOOP);

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> builder.register("arango_query", "second", ArgumentSchema.empty(), NOOP));
        assertTrue(e.getMessage().contains("arango_query"));
    }

    @Test
    void testEmptyRegistryIsRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ToolRegistry.builder().build());
        assertEquals("Tool registry is empty. No tools have been registered.", e.getMessage());
    }

    @Test
    void testLookupAndRegistrationOrder() {
        ToolRegistry registry = registryOf(3);

        assertEquals(3, registry.size());
        assertTrue(registry.lookup("tool_2").isPresent());
        assertFalse(registry.lookup("missing").isPresent());
        assertFalse(registry.lookup(null).isPresent());
        assertEquals(List.of("tool_1", "tool_2", "tool_3"),
            registry.listAll().stream().map(MCPTool::getName).collect(Collectors.toList()));
    }

    @Test
    void testBaselineListingKeepsRegistrationPrefix() {
        ToolRegistry registry = registryOf(10);

        List<MCPTool> listed = registry.listForListing(ToolListingMode.BASELINE, 7);

        assertEquals(7, listed.size());
        assertEquals("tool_1", listed.get(0).getName());
        assertEquals("tool_7", listed.get(6).getName());
        // restricted listing does not hide tools from lookup
        assertTrue(registry.lookup("tool_10").isPresent());
    }

    @Test
    void testFullListingAndOversizedBaseline() {
        ToolRegistry registry = registryOf(5);

        assertEquals(5, registry.listForListing(ToolListingMode.FULL, 2).size());
        assertEquals(5, registry.listForListing(ToolListingMode.BASELINE, 50).size());
    }

    @Test
    void testToolJsonCarriesInputSchema() {
        MCPTool tool = registryOf(1).listAll().get(0);

        assertEquals("tool_1", tool.toJson().getString("name"));
        assertEquals("Tool 1", tool.toJson().getString("description"));
        assertEquals("object", tool.toJson().getJsonObject("inputSchema").getString("type"));
    }
}
