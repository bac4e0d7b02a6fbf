package arango.mcp.schema;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Outcome of validating raw tool arguments: either normalized arguments or violations.
 */
public class ValidationResult {

    private final JsonObject arguments;
    private final List<FieldViolation> violations;

    private ValidationResult(JsonObject arguments, List<FieldViolation> violations) {
        this.arguments = arguments;
        this.violations = violations;
    }

    static ValidationResult valid(JsonObject arguments) {
        return new ValidationResult(arguments, List.of());
    }

    static ValidationResult invalid(List<FieldViolation> violations) {
        return new ValidationResult(null, List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Canonically named arguments with defaults applied. Null when invalid.
     */
    public JsonObject getArguments() {
        return arguments;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public JsonArray violationsJson() {
        JsonArray out = new JsonArray();
        violations.forEach(v -> out.add(v.toJson()));
        return out;
    }
}
