package arango.mcp.services;

import arango.mcp.config.ConnectionConfig;
import arango.mcp.db.ArangoHandle;

/**
 * Opens a new database handle. Called on a worker thread; may block.
 */
@FunctionalInterface
public interface ArangoConnector {

    ArangoHandle connect(ConnectionConfig config) throws Exception;
}
