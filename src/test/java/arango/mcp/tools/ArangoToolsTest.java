package arango.mcp.tools;

import arango.mcp.base.MCPTool;
import arango.mcp.base.ToolRegistry;
import arango.mcp.config.ServerConfig.ToolListingMode;
import arango.mcp.schema.FieldViolation;
import arango.mcp.schema.ValidationResult;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ArangoToolsTest {

    private final ToolRegistry registry = ArangoTools.buildRegistry();

    @Test
    void testAllToolsRegistered() {
        assertEquals(28, registry.size());
        for (MCPTool tool : registry.listAll()) {
            assertTrue(tool.getName().startsWith("arango_"), tool.getName());
            assertFalse(tool.getDescription().isEmpty(), tool.getName());
        }
    }

    @Test
    void testBaselineIsTheFirstSeven() {
        List<String> baseline = registry.listForListing(ToolListingMode.BASELINE, ArangoTools.BASELINE_TOOLS)
            .stream().map(MCPTool::getName).collect(Collectors.toList());

        assertEquals(List.of(
            ArangoTools.QUERY,
            ArangoTools.LIST_COLLECTIONS,
            ArangoTools.INSERT,
            ArangoTools.UPDATE,
            ArangoTools.REMOVE,
            ArangoTools.CREATE_COLLECTION,
            ArangoTools.BACKUP), baseline);
    }

    @Test
    void testAliasesShareSchemas() {
        JsonObject traverse = registry.lookup(ArangoTools.TRAVERSE).orElseThrow().getInputSchema();
        JsonObject alias = registry.lookup(ArangoTools.GRAPH_TRAVERSAL).orElseThrow().getInputSchema();
        assertEquals(traverse, alias);

        assertEquals(registry.lookup(ArangoTools.INSERT).orElseThrow().getInputSchema(),
            registry.lookup(ArangoTools.ADD_VERTEX).orElseThrow().getInputSchema());
    }

    @Test
    void testInputSchemaDetails() {
        JsonObject insert = registry.lookup(ArangoTools.INSERT).orElseThrow().getInputSchema();
        assertEquals(new JsonArray().add("collection").add("document"), insert.getJsonArray("required"));

        JsonObject index = registry.lookup(ArangoTools.CREATE_INDEX).orElseThrow().getInputSchema();
        JsonArray types = index.getJsonObject("properties").getJsonObject("type").getJsonArray("enum");
        assertTrue(types.contains("ttl"));
        assertTrue(types.contains("skiplist"));

        JsonObject listCollections = registry.lookup(ArangoTools.LIST_COLLECTIONS).orElseThrow().getInputSchema();
        assertTrue(listCollections.getJsonObject("properties").isEmpty());
    }

    @Test
    void testBackupAcceptsCamelCaseAliases() {
        MCPTool backup = registry.lookup(ArangoTools.BACKUP).orElseThrow();

        JsonObject args = backup.getSchema().validate(new JsonObject()
            .put("outputDir", "/tmp/out")
            .put("docLimit", 5)).getArguments();

        assertEquals("/tmp/out", args.getString("output_dir"));
        assertEquals(5, args.getInteger("doc_limit"));
    }

    private FieldViolation onlyViolation(String tool, JsonObject arguments) {
        ValidationResult result = registry.lookup(tool).orElseThrow().getSchema().validate(arguments);
        assertFalse(result.isValid());
        assertEquals(1, result.getViolations().size(), result.getViolations().toString());
        return result.getViolations().get(0);
    }

    @Test
    void testOversizedIntegersAreRejectedBeforeHandlers() {
        FieldViolation batch = onlyViolation(ArangoTools.BULK_INSERT, new JsonObject()
            .put("collection", "items")
            .put("documents", new JsonArray().add(new JsonObject()))
            .put("batch_size", 4294967296L));
        assertEquals(List.of("batch_size"), batch.getLoc());
        assertEquals("less_than_equal", batch.getType());

        FieldViolation depth = onlyViolation(ArangoTools.TRAVERSE, new JsonObject()
            .put("start_vertex", "users/a")
            .put("max_depth", 3000000000L));
        assertEquals(List.of("max_depth"), depth.getLoc());

        FieldViolation limit = onlyViolation(ArangoTools.BACKUP, new JsonObject()
            .put("docLimit", new BigInteger("18446744073709551617")));
        assertEquals(List.of("doc_limit"), limit.getLoc());
        assertEquals("less_than_equal", limit.getType());
    }
}
