package arango.mcp.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Argument contract of one tool.
 *
 * <p>Validation checks every declared field and reports all violations at once. Types are
 * strict: <code>"5"</code> is not an integer and <code>"true"</code> is not a boolean. When a
 * field is given under both its alias and its canonical name, the alias value is used.
 * Undeclared keys are dropped, and a null optional value counts as absent.</p>
 */
public class ArgumentSchema {

    private static final ArgumentSchema EMPTY = new ArgumentSchema(List.of());
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

    private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

    private ArgumentSchema(List<FieldSpec> specs) {
        for (FieldSpec spec : specs) {
            if (fields.put(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("Duplicate field in schema: " + spec.getName());
            }
        }
    }

    public static ArgumentSchema of(FieldSpec... specs) {
        return specs.length == 0 ? EMPTY : new ArgumentSchema(List.of(specs));
    }

    /** Schema of a tool that takes no arguments. */
    public static ArgumentSchema empty() {
        return EMPTY;
    }

    public List<FieldSpec> getFields() {
        return Collections.unmodifiableList(new ArrayList<>(fields.values()));
    }

    /**
     * Validate and normalize raw arguments.
     *
     * @param raw incoming arguments; null is treated as an empty object
     */
    public ValidationResult validate(JsonObject raw) {
        List<FieldViolation> violations = new ArrayList<>();
        JsonObject normalized = validateObject(raw == null ? new JsonObject() : raw, List.of(), violations);
        return violations.isEmpty() ? ValidationResult.valid(normalized) : ValidationResult.invalid(violations);
    }

    private JsonObject validateObject(JsonObject raw, List<Object> path, List<FieldViolation> violations) {
        JsonObject out = new JsonObject();
        for (FieldSpec spec : fields.values()) {
            List<Object> loc = append(path, spec.getName());

            Object value = null;
            if (spec.getAlias() != null && raw.getValue(spec.getAlias()) != null) {
                value = raw.getValue(spec.getAlias());
            } else if (raw.getValue(spec.getName()) != null) {
                value = raw.getValue(spec.getName());
            }

            if (value == null) {
                if (spec.isRequired()) {
                    violations.add(new FieldViolation("missing", loc, "Field required"));
                } else if (spec.getDefaultValue() != null) {
                    out.put(spec.getName(), copy(spec.getDefaultValue()));
                }
                continue;
            }

            Object checked = checkValue(spec, value, loc, violations);
            if (checked != null) {
                out.put(spec.getName(), checked);
            }
        }
        return out;
    }

    private Object checkValue(FieldSpec spec, Object value, List<Object> loc, List<FieldViolation> violations) {
        Object checked = checkType(spec.getType(), value, loc, violations);
        if (checked == null) {
            return null;
        }

        if (spec.getEnumValues() != null && !spec.getEnumValues().contains(checked)) {
            violations.add(new FieldViolation("enum", loc, "Input should be " + describeEnum(spec.getEnumValues())));
            return null;
        }

        if (spec.getMinimum() != null && checked instanceof Number
            && ((Number) checked).longValue() < spec.getMinimum()) {
            violations.add(new FieldViolation("greater_than_equal", loc,
                "Input should be greater than or equal to " + spec.getMinimum()));
            return null;
        }

        if (spec.getType() == FieldType.ARRAY && spec.getItemType() != null) {
            JsonArray items = (JsonArray) checked;
            JsonArray out = new JsonArray();
            int before = violations.size();
            for (int i = 0; i < items.size(); i++) {
                List<Object> itemLoc = append(loc, i);
                Object item = items.getValue(i);
                Object itemChecked = item == null
                    ? violate(spec.getItemType(), itemLoc, violations)
                    : checkType(spec.getItemType(), item, itemLoc, violations);
                if (itemChecked != null && spec.getItemSchema() != null) {
                    itemChecked = spec.getItemSchema().validateObject((JsonObject) itemChecked, itemLoc, violations);
                }
                out.add(itemChecked);
            }
            return violations.size() == before ? out : null;
        }
        return checked;
    }

    /**
     * Return the value in its canonical Java form, or record a violation and return null.
     */
    private static Object checkType(FieldType type, Object value, List<Object> loc, List<FieldViolation> violations) {
        switch (type) {
            case STRING:
                return value instanceof String ? value : violate(type, loc, violations);
            case INTEGER:
                return checkInteger(value, loc, violations);
            case NUMBER:
                return value instanceof Number ? value : violate(type, loc, violations);
            case BOOLEAN:
                return value instanceof Boolean ? value : violate(type, loc, violations);
            case OBJECT:
                if (value instanceof JsonObject) {
                    return value;
                }
                if (value instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> map = (Map<String, Object>) value;
                    return new JsonObject(map);
                }
                return violate(type, loc, violations);
            case ARRAY:
                if (value instanceof JsonArray) {
                    return value;
                }
                if (value instanceof List) {
                    @SuppressWarnings("unchecked")
                    List<Object> list = (List<Object>) value;
                    return new JsonArray(list);
                }
                return violate(type, loc, violations);
            case ANY:
            default:
                return value;
        }
    }

    /**
     * Integers, including integral floats, must fit in 32 bits and come back as {@link Integer}.
     */
    private static Object checkInteger(Object value, List<Object> loc, List<FieldViolation> violations) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        BigInteger whole;
        if (value instanceof Long) {
            whole = BigInteger.valueOf((Long) value);
        } else if (value instanceof BigInteger) {
            whole = (BigInteger) value;
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                return violate(FieldType.INTEGER, loc, violations);
            }
            whole = value instanceof BigDecimal ? ((BigDecimal) value).toBigInteger() : BigDecimal.valueOf(d).toBigInteger();
        } else {
            return violate(FieldType.INTEGER, loc, violations);
        }

        if (whole.compareTo(INT_MAX) > 0) {
            violations.add(new FieldViolation("less_than_equal", loc,
                "Input should be less than or equal to " + Integer.MAX_VALUE));
            return null;
        }
        if (whole.compareTo(INT_MIN) < 0) {
            violations.add(new FieldViolation("greater_than_equal", loc,
                "Input should be greater than or equal to " + Integer.MIN_VALUE));
            return null;
        }
        return whole.intValue();
    }

    private static Object violate(FieldType type, List<Object> loc, List<FieldViolation> violations) {
        violations.add(new FieldViolation(type.violationType(), loc, type.violationMessage()));
        return null;
    }

    private static String describeEnum(List<Object> values) {
        List<String> quoted = values.stream().map(v -> "'" + v + "'").collect(Collectors.toList());
        if (quoted.size() == 1) {
            return quoted.get(0);
        }
        return String.join(", ", quoted.subList(0, quoted.size() - 1)) + " or " + quoted.get(quoted.size() - 1);
    }

    private static List<Object> append(List<Object> path, Object segment) {
        List<Object> loc = new ArrayList<>(path);
        loc.add(segment);
        return loc;
    }

    private static Object copy(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).copy();
        }
        if (value instanceof JsonArray) {
            return ((JsonArray) value).copy();
        }
        return value;
    }

    /**
     * JSON-Schema object describing these arguments, used as a tool's <code>inputSchema</code>.
     */
    public JsonObject toJsonSchema() {
        JsonObject properties = new JsonObject();
        JsonArray required = new JsonArray();
        for (FieldSpec spec : fields.values()) {
            properties.put(spec.getName(), spec.toJsonSchema());
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        JsonObject schema = new JsonObject()
            .put("type", "object")
            .put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }
}
