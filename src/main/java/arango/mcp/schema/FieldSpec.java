package arango.mcp.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Declaration of a single tool argument.
 *
 * <pre>
 * FieldSpec.string("collection").required().description("Target collection")
 * FieldSpec.integer("doc_limit").alias("docLimit").minimum(1)
 * FieldSpec.array("fields", FieldType.STRING).required()
 * </pre>
 */
public class FieldSpec {

    private final String name;
    private final FieldType type;
    private FieldType itemType;
    private ArgumentSchema itemSchema;
    private boolean required;
    private Object defaultValue;
    private List<Object> enumValues;
    private String alias;
    private Long minimum;
    private String description;

    private FieldSpec(String name, FieldType type) {
        this.name = name;
        this.type = type;
    }

    public static FieldSpec string(String name) {
        return new FieldSpec(name, FieldType.STRING);
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, FieldType.INTEGER);
    }

    public static FieldSpec number(String name) {
        return new FieldSpec(name, FieldType.NUMBER);
    }

    public static FieldSpec bool(String name) {
        return new FieldSpec(name, FieldType.BOOLEAN);
    }

    public static FieldSpec object(String name) {
        return new FieldSpec(name, FieldType.OBJECT);
    }

    public static FieldSpec any(String name) {
        return new FieldSpec(name, FieldType.ANY);
    }

    /** Array whose items must all be of the given type. */
    public static FieldSpec array(String name, FieldType itemType) {
        FieldSpec spec = new FieldSpec(name, FieldType.ARRAY);
        spec.itemType = itemType;
        return spec;
    }

    /** Array of objects, each validated against a nested schema. */
    public static FieldSpec objectArray(String name, ArgumentSchema itemSchema) {
        FieldSpec spec = new FieldSpec(name, FieldType.ARRAY);
        spec.itemType = FieldType.OBJECT;
        spec.itemSchema = itemSchema;
        return spec;
    }

    /** String restricted to a fixed set of values. */
    public static FieldSpec stringEnum(String name, String... values) {
        FieldSpec spec = new FieldSpec(name, FieldType.STRING);
        spec.enumValues = new ArrayList<>(Arrays.asList(values));
        return spec;
    }

    public FieldSpec required() {
        this.required = true;
        return this;
    }

    public FieldSpec defaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public FieldSpec alias(String alias) {
        this.alias = alias;
        return this;
    }

    public FieldSpec minimum(long minimum) {
        this.minimum = minimum;
        return this;
    }

    public FieldSpec description(String description) {
        this.description = description;
        return this;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public FieldType getItemType() {
        return itemType;
    }

    public ArgumentSchema getItemSchema() {
        return itemSchema;
    }

    public boolean isRequired() {
        return required;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public List<Object> getEnumValues() {
        return enumValues;
    }

    public String getAlias() {
        return alias;
    }

    public Long getMinimum() {
        return minimum;
    }

    public String getDescription() {
        return description;
    }

    /**
     * JSON-Schema property definition for this field.
     */
    JsonObject toJsonSchema() {
        JsonObject property = new JsonObject();
        if (type.jsonType() != null) {
            property.put("type", type.jsonType());
        }
        if (description != null) {
            property.put("description", alias == null ? description : description + " (alias: " + alias + ")");
        } else if (alias != null) {
            property.put("description", "Alias: " + alias);
        }
        if (enumValues != null) {
            property.put("enum", new JsonArray(new ArrayList<>(enumValues)));
        }
        if (defaultValue != null) {
            property.put("default", defaultValue);
        }
        if (minimum != null) {
            property.put("minimum", minimum);
        }
        if (type == FieldType.ARRAY) {
            if (itemSchema != null) {
                property.put("items", itemSchema.toJsonSchema());
            } else if (itemType != null && itemType.jsonType() != null) {
                property.put("items", new JsonObject().put("type", itemType.jsonType()));
            }
        }
        return property;
    }
}
