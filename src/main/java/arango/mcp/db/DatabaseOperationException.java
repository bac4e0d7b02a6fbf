package arango.mcp.db;

/**
 * ArangoDB rejected or failed an operation.
 */
public class DatabaseOperationException extends RuntimeException {

    private final int errorNum;

    public DatabaseOperationException(String message, int errorNum, Throwable cause) {
        super(message, cause);
        this.errorNum = errorNum;
    }

    public DatabaseOperationException(String message) {
        this(message, 0, null);
    }

    /**
     * ArangoDB error number, or 0 when the failure did not come from the server.
     */
    public int getErrorNum() {
        return errorNum;
    }
}
