package arango.mcp.base;

/**
 * A handler needed an argument that validation let through as absent.
 */
public class MissingParameterException extends RuntimeException {

    private final String parameter;

    public MissingParameterException(String parameter) {
        super("Missing required parameter: " + parameter);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
