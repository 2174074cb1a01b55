package org.promoharvest.pipeline.api.records;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema-less harvested document: an insertion-ordered map of field names to JSON values.
 * <p>
 * Unknown fields are preserved as-is so they pass through to batch files and the merged log.
 * Instances are immutable; {@link #withField(String, Object)} returns a copy.
 */
public final class HarvestRecord {

    private final Map<String, Object> fields;

    private HarvestRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Creates a record from a decoded JSON object. The map is copied.
     *
     * @param fields the document fields
     * @return the record
     */
    public static HarvestRecord of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields cannot be null");
        return new HarvestRecord(new LinkedHashMap<>(fields));
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public int size() {
        return fields.size();
    }

    public HarvestRecord withField(String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new HarvestRecord(copy);
    }

    /**
     * Shorthand for {@link IdentityResolver#resolveIdentity(Map, java.util.List)} with the given resolver's fields.
     */
    public Optional<String> identity(IdentityResolver resolver) {
        return resolver.resolve(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HarvestRecord)) return false;
        return fields.equals(((HarvestRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "HarvestRecord" + fields;
    }
}
