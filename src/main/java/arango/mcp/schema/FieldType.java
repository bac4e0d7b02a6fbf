package arango.mcp.schema;

/**
 * JSON types a tool argument can be declared with.
 */
public enum FieldType {
    STRING("string", "string_type", "Input should be a valid string"),
    INTEGER("integer", "int_type", "Input should be a valid integer"),
    NUMBER("number", "float_type", "Input should be a valid number"),
    BOOLEAN("boolean", "bool_type", "Input should be a valid boolean"),
    OBJECT("object", "dict_type", "Input should be a valid dictionary"),
    ARRAY("array", "list_type", "Input should be a valid list"),
    ANY(null, null, null);

    private final String jsonType;
    private final String violationType;
    private final String violationMessage;

    FieldType(String jsonType, String violationType, String violationMessage) {
        this.jsonType = jsonType;
        this.violationType = violationType;
        this.violationMessage = violationMessage;
    }

    /** JSON-Schema <code>type</code> keyword, or null for {@link #ANY}. */
    public String jsonType() {
        return jsonType;
    }

    String violationType() {
        return violationType;
    }

    String violationMessage() {
        return violationMessage;
    }
}
