package org.promoharvest.pipeline.api.records;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the deduplication identity of a record by trying an ordered list of candidate fields.
 * <p>
 * The first candidate whose value is a non-empty scalar wins. Strings are trimmed, integral
 * numbers are rendered without a fraction, booleans use their literal. Objects, arrays,
 * {@code null} and blank strings count as absent. A record without any match is anonymous.
 */
public final class IdentityResolver {

    /** Candidate fields used when nothing is configured. */
    public static final List<String> DEFAULT_FIELDS = List.of("product_id", "productId", "ProductID", "id");

    private final List<String> candidateFields;

    public IdentityResolver(List<String> candidateFields) {
        if (candidateFields == null || candidateFields.isEmpty()) {
            throw new IllegalArgumentException("At least one identity field must be configured");
        }
        this.candidateFields = List.copyOf(candidateFields);
    }

    public static IdentityResolver defaults() {
        return new IdentityResolver(DEFAULT_FIELDS);
    }

    public List<String> candidateFields() {
        return candidateFields;
    }

    /**
     * The field new identities are written under when a fetched record lacks one.
     */
    public String primaryField() {
        return candidateFields.get(0);
    }

    public Optional<String> resolve(HarvestRecord record) {
        return resolveIdentity(record.fields(), candidateFields);
    }

    /**
     * Resolves the identity of a raw field map.
     *
     * @param fields          the document fields
     * @param candidateFields field names to try, in order
     * @return the identity, or empty for an anonymous document
     */
    public static Optional<String> resolveIdentity(Map<String, ?> fields, List<String> candidateFields) {
        for (String field : candidateFields) {
            Optional<String> value = stringify(fields.get(field));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> stringify(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Optional.of(Long.toString((long) d));
            }
            return Optional.of(BigDecimal.valueOf(d).stripTrailingZeros().toPlainString());
        }
        if (value instanceof BigDecimal) {
            return Optional.of(((BigDecimal) value).stripTrailingZeros().toPlainString());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return Optional.of(value.toString());
        }
        return Optional.empty();
    }
}
