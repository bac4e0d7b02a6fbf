package arango.mcp.base;

/**
 * Failure categories reported in the <code>type</code> field of an error envelope.
 */
public enum ErrorKind {
    UNKNOWN_TOOL("UnknownTool"),
    VALIDATION_ERROR("ValidationError"),
    DATABASE_UNAVAILABLE("DatabaseUnavailable"),
    MISSING_PARAMETER("MissingParameter"),
    DATABASE_OPERATION_FAILED("DatabaseOperationFailed"),
    UNEXPECTED_ERROR("UnexpectedError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
