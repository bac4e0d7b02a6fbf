package arango.mcp.handlers;

import arango.mcp.db.ArangoHandle;
import arango.mcp.services.LogUtil;
import arango.mcp.utils.JsonValues;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Dumps collections to <code>&lt;dir&gt;/&lt;collection&gt;.json</code>, one JSON array per file.
 *
 * <p>The output directory must resolve inside the working directory or the system temp
 * directory. A failing collection is recorded in the report and the next one continues.</p>
 */
public class BackupHandler {

    private static final DateTimeFormatter DIR_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String COMPONENT = "BackupHandler";

    private final Path workingDir;
    private final Path tempDir;

    public BackupHandler() {
        this(Paths.get("").toAbsolutePath(), Paths.get(System.getProperty("java.io.tmpdir")));
    }

    public BackupHandler(Path workingDir, Path tempDir) {
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.tempDir = tempDir.toAbsolutePath().normalize();
    }

    public Object backup(ArangoHandle db, JsonObject args) throws IOException {
        String requestedDir = args.getString("output_dir");
        if (requestedDir == null || requestedDir.isBlank()) {
            requestedDir = Paths.get("backups", LocalDateTime.now().format(DIR_STAMP)).toString();
        }
        Integer docLimit = HandlerArgs.optionalInt(args, "doc_limit");
        Path outputDir = validateOutputDirectory(requestedDir);
        Files.createDirectories(outputDir);

        List<String> requested = HandlerArgs.strings(args.getJsonArray("collections"));
        String single = args.getString("collection");
        if (requested.isEmpty() && single != null && !single.isEmpty()) {
            requested = List.of(single);
        }

        List<String> existing = db.listCollections();
        List<String> targets = requested.isEmpty() ? existing : requested;

        JsonArray written = new JsonArray();
        long totalDocuments = 0;
        for (String name : targets) {
            if (!existing.contains(name)) {
                LogUtil.logDetail(null, "Skipping unknown collection " + name, COMPONENT, "Backup", "Backup");
                continue;
            }
            Path file = outputDir.resolve(name + ".json");
            JsonObject entry = new JsonObject()
                .put("collection", name)
                .put("path", file.toString());
            try {
                int count = dumpCollection(db, name, docLimit, file);
                entry.put("count", count);
                totalDocuments += count;
            } catch (IOException | RuntimeException e) {
                LogUtil.logError(null, "Backup of " + name + " failed", e, COMPONENT, "Backup", "Backup", false);
                entry.put("count", 0).put("error", String.valueOf(e.getMessage()));
            }
            written.add(entry);
        }

        return new JsonObject()
            .put("output_dir", outputDir.toString())
            .put("written", written)
            .put("total_collections", written.size())
            .put("total_documents", totalDocuments);
    }

    private static int dumpCollection(ArangoHandle db, String name, Integer docLimit, Path file) throws IOException {
        JsonObject bind = new JsonObject().put("@collection", name);
        String aql = "FOR d IN @@collection RETURN d";
        if (docLimit != null) {
            aql = "FOR d IN @@collection LIMIT @limit RETURN d";
            bind.put("limit", docLimit);
        }
        JsonArray docs = db.query(aql, bind);

        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write('[');
            for (int i = 0; i < docs.size(); i++) {
                if (i > 0) {
                    out.write(',');
                }
                out.write("\n  ");
                out.write(JsonValues.encode(docs.getValue(i)));
            }
            out.write("\n]");
        }
        return docs.size();
    }

    /**
     * @return the absolute output directory
     * @throws IllegalArgumentException for traversal attempts or locations outside the allowed roots
     */
    Path validateOutputDirectory(String requested) {
        if (requested.contains("..")) {
            throw new IllegalArgumentException("Invalid output directory: Path traversal detected: '..' not allowed in path");
        }
        Path candidate = Paths.get(requested);
        Path absolute = (candidate.isAbsolute() ? candidate : workingDir.resolve(candidate)).normalize();
        if (absolute.startsWith(tempDir) || absolute.startsWith(workingDir)) {
            return absolute;
        }
        throw new IllegalArgumentException("Invalid output directory: Output directory '" + requested
            + "' is not allowed. Must be within current working directory or temp directory.");
    }
}
