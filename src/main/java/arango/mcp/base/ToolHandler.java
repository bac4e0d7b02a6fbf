package arango.mcp.base;

import arango.mcp.db.ArangoHandle;
import io.vertx.core.json.JsonObject;

/**
 * Executes one tool against a live database handle.
 *
 * <p>Handlers run on a worker thread. The returned value must be JSON-serializable
 * (JsonObject, JsonArray, Map, List, String, Number, Boolean or null). Exceptions are mapped
 * to failure envelopes by {@link ToolDispatcher}.</p>
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(ArangoHandle db, JsonObject args) throws Exception;
}
