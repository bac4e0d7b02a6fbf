package arango.mcp.db;

import java.util.List;

/**
 * Index creation request. Only the options relevant to {@link #getKind()} are read.
 */
public class IndexSpec {

    public enum Kind {
        PERSISTENT,
        TTL,
        FULLTEXT,
        GEO
    }

    private final Kind kind;
    private final List<String> fields;
    private boolean unique;
    private boolean sparse;
    private boolean deduplicate = true;
    private String name;
    private Boolean inBackground;
    private Integer expireAfter;
    private Integer minLength;
    private Boolean geoJson;

    public IndexSpec(Kind kind, List<String> fields) {
        this.kind = kind;
        this.fields = List.copyOf(fields);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getFields() {
        return fields;
    }

    public boolean isUnique() {
        return unique;
    }

    public IndexSpec unique(boolean unique) {
        this.unique = unique;
        return this;
    }

    public boolean isSparse() {
        return sparse;
    }

    public IndexSpec sparse(boolean sparse) {
        this.sparse = sparse;
        return this;
    }

    public boolean isDeduplicate() {
        return deduplicate;
    }

    public IndexSpec deduplicate(boolean deduplicate) {
        this.deduplicate = deduplicate;
        return this;
    }

    public String getName() {
        return name;
    }

    public IndexSpec name(String name) {
        this.name = name;
        return this;
    }

    public Boolean getInBackground() {
        return inBackground;
    }

    public IndexSpec inBackground(Boolean inBackground) {
        this.inBackground = inBackground;
        return this;
    }

    /** TTL seconds; only for {@link Kind#TTL}. */
    public Integer getExpireAfter() {
        return expireAfter;
    }

    public IndexSpec expireAfter(Integer expireAfter) {
        this.expireAfter = expireAfter;
        return this;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public IndexSpec minLength(Integer minLength) {
        this.minLength = minLength;
        return this;
    }

    public Boolean getGeoJson() {
        return geoJson;
    }

    public IndexSpec geoJson(Boolean geoJson) {
        this.geoJson = geoJson;
        return this;
    }

    @Override
    public String toString() {
        return "IndexSpec{kind=" + kind + ", fields=" + fields + ", name=" + name + "}";
    }
}
