package arango.mcp.transport;

import arango.mcp.base.MCPResponse;
import arango.mcp.base.McpProtocolHandler;
import arango.mcp.services.LogUtil;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Newline-delimited JSON-RPC over a pair of streams, normally stdin/stdout.
 *
 * <p>Each line is handed to the protocol handler as soon as it is read, so responses may be
 * written out of order. The output stream carries protocol messages only.</p>
 */
public class StdioServerTransport {

    private static final String COMPONENT = "StdioServerTransport";

    private final Vertx vertx;
    private final McpProtocolHandler protocol;
    private final InputStream in;
    private final PrintStream out;

    public StdioServerTransport(Vertx vertx, McpProtocolHandler protocol, InputStream in, PrintStream out) {
        this.vertx = vertx;
        this.protocol = protocol;
        this.in = in;
        this.out = out;
    }

    /**
     * Start the reader thread.
     *
     * @param onClose run once when the input reaches end of stream or fails
     */
    public Thread start(Runnable onClose) {
        Thread reader = new Thread(() -> readLoop(onClose), "mcp-stdio-reader");
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private void readLoop(Runnable onClose) {
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                LogUtil.logData(vertx, "stdin: " + line, COMPONENT, "Read", "MCP");
                handleLine(line);
            }
            LogUtil.logInfo(vertx, "Input closed", COMPONENT, "Read", "MCP", false);
        } catch (IOException e) {
            LogUtil.logError(vertx, "Reading input failed", e, COMPONENT, "Read", "MCP", true);
        } finally {
            onClose.run();
        }
    }

    /**
     * Dispatch one line. A failing line is answered with an internal error and the loop goes on.
     */
    private void handleLine(String line) {
        try {
            protocol.handleText(line).onComplete(ar -> {
                if (ar.succeeded()) {
                    write(ar.result());
                } else {
                    writeInternalError(ar.cause());
                }
            });
        } catch (RuntimeException | LinkageError e) {
            writeInternalError(e);
        }
    }

    private void writeInternalError(Throwable err) {
        LogUtil.logError(vertx, "Message handling failed", err, COMPONENT, "Read", "MCP", true);
        write(MCPResponse.error(null, MCPResponse.ErrorCodes.INTERNAL_ERROR,
            "Internal error: " + err.getClass().getSimpleName() + ": " + err.getMessage()).toJson());
    }

    void write(JsonObject response) {
        if (response == null) {
            return;
        }
        synchronized (out) {
            out.println(response.encode());
            out.flush();
        }
    }
}
