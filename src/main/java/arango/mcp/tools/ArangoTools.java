package arango.mcp.tools;

import arango.mcp.base.ToolRegistry;
import arango.mcp.handlers.BackupHandler;
import arango.mcp.handlers.BulkHandlers;
import arango.mcp.handlers.DocumentHandlers;
import arango.mcp.handlers.GraphHandlers;
import arango.mcp.handlers.IndexHandlers;
import arango.mcp.handlers.QueryHandlers;
import arango.mcp.handlers.ReferenceHandlers;
import arango.mcp.handlers.SchemaHandlers;
import arango.mcp.schema.ArgumentSchema;
import arango.mcp.schema.DocumentSchemaValidator;
import arango.mcp.schema.FieldSpec;
import arango.mcp.schema.FieldType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * The ArangoDB tool set. Registration order is the tools/list order; the first
 * {@link #BASELINE_TOOLS} entries form the baseline set.
 */
public final class ArangoTools {

    public static final int BASELINE_TOOLS = 7;

    public static final String QUERY = "arango_query";
    public static final String LIST_COLLECTIONS = "arango_list_collections";
    public static final String INSERT = "arango_insert";
    public static final String UPDATE = "arango_update";
    public static final String REMOVE = "arango_remove";
    public static final String CREATE_COLLECTION = "arango_create_collection";
    public static final String BACKUP = "arango_backup";
    public static final String LIST_INDEXES = "arango_list_indexes";
    public static final String CREATE_INDEX = "arango_create_index";
    public static final String DELETE_INDEX = "arango_delete_index";
    public static final String EXPLAIN_QUERY = "arango_explain_query";
    public static final String VALIDATE_REFERENCES = "arango_validate_references";
    public static final String INSERT_WITH_VALIDATION = "arango_insert_with_validation";
    public static final String BULK_INSERT = "arango_bulk_insert";
    public static final String BULK_UPDATE = "arango_bulk_update";
    public static final String CREATE_GRAPH = "arango_create_graph";
    public static final String ADD_EDGE = "arango_add_edge";
    public static final String TRAVERSE = "arango_traverse";
    public static final String SHORTEST_PATH = "arango_shortest_path";
    public static final String LIST_GRAPHS = "arango_list_graphs";
    public static final String ADD_VERTEX_COLLECTION = "arango_add_vertex_collection";
    public static final String ADD_EDGE_DEFINITION = "arango_add_edge_definition";
    public static final String GRAPH_TRAVERSAL = "arango_graph_traversal";
    public static final String ADD_VERTEX = "arango_add_vertex";
    public static final String CREATE_SCHEMA = "arango_create_schema";
    public static final String VALIDATE_DOCUMENT = "arango_validate_document";
    public static final String QUERY_BUILDER = "arango_query_builder";
    public static final String QUERY_PROFILE = "arango_query_profile";

    private static final String[] DIRECTIONS = {"OUTBOUND", "INBOUND", "ANY"};
    private static final String[] ON_ERROR = {"stop", "continue", "ignore"};

    private ArangoTools() {
    }

    public static ToolRegistry buildRegistry() {
        return buildRegistry(new BackupHandler(), new DocumentSchemaValidator());
    }

    public static ToolRegistry buildRegistry(BackupHandler backup, DocumentSchemaValidator validator) {
        SchemaHandlers schemas = new SchemaHandlers(validator);
        ArgumentSchema insertArgs = ArgumentSchema.of(
            FieldSpec.string("collection").required().description("Name of the collection to insert into"),
            FieldSpec.object("document").required().description("Document to insert"));
        ArgumentSchema traverseArgs = traverseArgs();

        return ToolRegistry.builder()
            .register(QUERY, "Execute an AQL query with optional bind vars and return rows.",
                ArgumentSchema.of(
                    FieldSpec.string("query").required().description("AQL query string"),
                    FieldSpec.object("bind_vars").description("Optional bind variables for the AQL query")),
                DocumentHandlers::query)
            .register(LIST_COLLECTIONS, "List non-system collection names.",
                ArgumentSchema.empty(), DocumentHandlers::listCollections)
            .register(INSERT, "Insert a document into a collection.", insertArgs, DocumentHandlers::insert)
            .register(UPDATE, "Update a document by key in a collection.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Name of the collection containing the document"),
                    FieldSpec.string("key").required().description("Document key to update"),
                    FieldSpec.object("update").required().description("Fields to update in the document")),
                DocumentHandlers::update)
            .register(REMOVE, "Remove a document by key in a collection.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Name of the collection containing the document"),
                    FieldSpec.string("key").required().description("Document key to remove")),
                DocumentHandlers::remove)
            .register(CREATE_COLLECTION, "Create a collection (document or edge).",
                ArgumentSchema.of(
                    FieldSpec.string("name").required().description("Name of the collection to create"),
                    FieldSpec.stringEnum("type", "document", "edge").defaultValue("document")
                        .description("Type of collection (document or edge)"),
                    FieldSpec.bool("waitForSync").description("Whether to wait for sync to disk")),
                DocumentHandlers::createCollection)
            .register(BACKUP, "Backup collections to JSON files.",
                ArgumentSchema.of(
                    FieldSpec.string("output_dir").alias("outputDir")
                        .description("Output directory path; defaults to backups/<timestamp>"),
                    FieldSpec.string("collection").description("Single collection to back up"),
                    FieldSpec.array("collections", FieldType.STRING).description("Collections to back up; all when omitted"),
                    FieldSpec.integer("doc_limit").alias("docLimit").minimum(1)
                        .description("Maximum documents per collection")),
                backup::backup)
            .register(LIST_INDEXES, "List indexes for a collection.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Collection name to list indexes for")),
                IndexHandlers::listIndexes)
            .register(CREATE_INDEX, "Create an index on a collection (persistent, hash, skiplist, ttl, fulltext, geo).",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Name of the collection to create index on"),
                    FieldSpec.stringEnum("type", "persistent", "hash", "skiplist", "ttl", "fulltext", "geo")
                        .defaultValue("persistent").description("Type of index to create"),
                    FieldSpec.array("fields", FieldType.STRING).required().description("Field paths to index"),
                    FieldSpec.bool("unique").defaultValue(false).description("Whether the index should enforce uniqueness"),
                    FieldSpec.bool("sparse").defaultValue(false).description("Whether the index should be sparse (ignore null values)"),
                    FieldSpec.bool("deduplicate").defaultValue(true).description("Whether to deduplicate index entries"),
                    FieldSpec.string("name").description("Custom name for the index"),
                    FieldSpec.bool("inBackground").alias("in_background").description("Whether to create index in background"),
                    FieldSpec.integer("ttl").description("TTL seconds (expireAfter) for TTL index"),
                    FieldSpec.integer("expireAfter").description("Alias for ttl (expireAfter)"),
                    FieldSpec.integer("minLength").description("Minimum length for fulltext index"),
                    FieldSpec.bool("geoJson").description("If true, fields are in GeoJSON format for geo index")),
                IndexHandlers::createIndex)
            .register(DELETE_INDEX, "Delete an index by id or name from a collection.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Name of the collection containing the index"),
                    FieldSpec.string("id_or_name").required().description("Index id (e.g., collection/12345) or name")),
                IndexHandlers::deleteIndex)
            .register(EXPLAIN_QUERY, "Explain an AQL query and return execution plans and optional index suggestions.",
                ArgumentSchema.of(
                    FieldSpec.string("query").required().description("AQL query to explain"),
                    FieldSpec.object("bind_vars").description("Bind variables for the query"),
                    FieldSpec.bool("suggest_indexes").defaultValue(true).description("Whether to suggest indexes"),
                    FieldSpec.integer("max_plans").defaultValue(1).minimum(1).description("Maximum number of plans to return")),
                QueryHandlers::explain)
            .register(VALIDATE_REFERENCES, "Validate that documents in a collection have valid references in specified fields.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Collection to validate"),
                    FieldSpec.array("reference_fields", FieldType.STRING).required().description("Fields holding document ids"),
                    FieldSpec.bool("fix_invalid").defaultValue(false).description("Remove documents with invalid references")),
                ReferenceHandlers::validateReferences)
            .register(INSERT_WITH_VALIDATION, "Insert a document after validating its reference fields.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.object("document").required(),
                    FieldSpec.array("reference_fields", FieldType.STRING).defaultValue(new JsonArray())),
                ReferenceHandlers::insertWithValidation)
            .register(BULK_INSERT, "Bulk insert documents with batching and basic error handling.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.array("documents", FieldType.OBJECT).required(),
                    FieldSpec.bool("validate_refs").defaultValue(false),
                    FieldSpec.integer("batch_size").defaultValue(1000).minimum(1),
                    FieldSpec.stringEnum("on_error", ON_ERROR).defaultValue("stop")),
                BulkHandlers::bulkInsert)
            .register(BULK_UPDATE, "Bulk update documents by key with batching.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.array("updates", FieldType.OBJECT).required()
                        .description("Items of {key|_key, update} or {key|_key, ...fields}"),
                    FieldSpec.integer("batch_size").defaultValue(1000).minimum(1),
                    FieldSpec.stringEnum("on_error", ON_ERROR).defaultValue("stop")),
                BulkHandlers::bulkUpdate)
            .register(CREATE_GRAPH, "Create a named graph with edge definitions (optionally creating collections).",
                ArgumentSchema.of(
                    FieldSpec.string("name").required(),
                    FieldSpec.objectArray("edge_definitions", edgeDefinitionArgs()).required(),
                    FieldSpec.bool("create_collections").defaultValue(true)),
                GraphHandlers::createGraph)
            .register(ADD_EDGE, "Add an edge document between two vertices with optional attributes.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required().description("Edge collection name"),
                    FieldSpec.string("from_id").required().description("_from document id, e.g., users/123"),
                    FieldSpec.string("to_id").required().description("_to document id, e.g., orders/456"),
                    FieldSpec.object("attributes").defaultValue(new JsonObject())),
                GraphHandlers::addEdge)
            .register(TRAVERSE, "Traverse graph from a start vertex with depth bounds (by graph or edge collections).",
                traverseArgs, GraphHandlers::traverse)
            .register(SHORTEST_PATH, "Compute the shortest path between two vertices (by graph or edge collections).",
                ArgumentSchema.of(
                    FieldSpec.string("start_vertex").required(),
                    FieldSpec.string("end_vertex").required(),
                    FieldSpec.stringEnum("direction", DIRECTIONS).defaultValue("OUTBOUND"),
                    FieldSpec.string("graph"),
                    FieldSpec.array("edge_collections", FieldType.STRING),
                    FieldSpec.bool("return_paths").defaultValue(true)),
                GraphHandlers::shortestPath)
            .register(LIST_GRAPHS, "List available graphs in the database.",
                ArgumentSchema.empty(), GraphHandlers::listGraphs)
            .register(ADD_VERTEX_COLLECTION, "Add a vertex collection to a named graph.",
                ArgumentSchema.of(
                    FieldSpec.string("graph").required(),
                    FieldSpec.string("collection").required()),
                GraphHandlers::addVertexCollection)
            .register(ADD_EDGE_DEFINITION, "Create an edge definition in a named graph.",
                ArgumentSchema.of(
                    FieldSpec.string("graph").required(),
                    FieldSpec.string("edge_collection").required(),
                    FieldSpec.array("from_collections", FieldType.STRING).required(),
                    FieldSpec.array("to_collections", FieldType.STRING).required()),
                GraphHandlers::addEdgeDefinition)
            .register(GRAPH_TRAVERSAL, "Alias for arango_traverse (graph traversal by graph or edge collections).",
                traverseArgs, GraphHandlers::traverse)
            .register(ADD_VERTEX, "Alias for arango_insert (insert a vertex document into a collection).",
                insertArgs, DocumentHandlers::insert)
            .register(CREATE_SCHEMA, "Create or update a named JSON Schema for a collection.",
                ArgumentSchema.of(
                    FieldSpec.string("name").required().description("Schema name"),
                    FieldSpec.string("collection").required().description("Collection the schema applies to"),
                    FieldSpec.object("schema_def").alias("schema").required().description("JSON Schema (draft-07) definition")),
                schemas::createSchema)
            .register(VALIDATE_DOCUMENT, "Validate a document against a stored or inline JSON Schema.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.object("document").required(),
                    FieldSpec.string("schema_name").description("Name of stored schema to use"),
                    FieldSpec.object("schema_def").alias("schema").description("Inline JSON Schema (draft-07)")),
                schemas::validateDocument)
            .register(QUERY_BUILDER, "Build and execute a simple AQL query from filters, sort, and limit.",
                ArgumentSchema.of(
                    FieldSpec.string("collection").required(),
                    FieldSpec.objectArray("filters", ArgumentSchema.of(
                        FieldSpec.string("field").required(),
                        FieldSpec.stringEnum("op", "==", "!=", "<", "<=", ">", ">=", "IN", "LIKE").required(),
                        FieldSpec.any("value").required())).defaultValue(new JsonArray()),
                    FieldSpec.objectArray("sort", ArgumentSchema.of(
                        FieldSpec.string("field").required(),
                        FieldSpec.stringEnum("direction", "ASC", "DESC").defaultValue("ASC"))).defaultValue(new JsonArray()),
                    FieldSpec.integer("limit").minimum(1),
                    FieldSpec.array("return_fields", FieldType.STRING).description("Fields to project; omit for full doc")),
                QueryHandlers::queryBuilder)
            .register(QUERY_PROFILE, "Explain a query and return plans/stats for profiling.",
                ArgumentSchema.of(
                    FieldSpec.string("query").required(),
                    FieldSpec.object("bind_vars"),
                    FieldSpec.integer("max_plans").defaultValue(1).minimum(1)),
                QueryHandlers::profile)
            .build();
    }

    private static ArgumentSchema edgeDefinitionArgs() {
        return ArgumentSchema.of(
            FieldSpec.string("edge_collection").required(),
            FieldSpec.array("from_collections", FieldType.STRING).required(),
            FieldSpec.array("to_collections", FieldType.STRING).required());
    }

    private static ArgumentSchema traverseArgs() {
        return ArgumentSchema.of(
            FieldSpec.string("start_vertex").required().description("Start vertex id, e.g., users/123"),
            FieldSpec.stringEnum("direction", DIRECTIONS).defaultValue("OUTBOUND"),
            FieldSpec.integer("min_depth").defaultValue(1).minimum(0),
            FieldSpec.integer("max_depth").defaultValue(1).minimum(1),
            FieldSpec.string("graph").description("Named graph to traverse"),
            FieldSpec.array("edge_collections", FieldType.STRING).description("Edge collections when no graph is given"),
            FieldSpec.bool("return_paths").defaultValue(false),
            FieldSpec.integer("limit").minimum(1));
    }
}
