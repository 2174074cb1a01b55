package org.promoharvest.pipeline.api.records;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class IdentityResolverTest {

    private final IdentityResolver resolver = IdentityResolver.defaults();

    @Test
    void resolve_usesFirstCandidateWithValue() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", "fallback");
        fields.put("productId", "P-1");

        assertThat(resolver.resolve(HarvestRecord.of(fields))).contains("P-1");
    }

    @Test
    void resolve_skipsBlankNullAndStructuredValues() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("product_id", "   ");
        fields.put("productId", null);
        fields.put("ProductID", Map.of("nested", 1));
        fields.put("id", " 42 ");

        assertThat(resolver.resolve(HarvestRecord.of(fields))).contains("42");
    }

    @Test
    void resolve_rendersIntegralNumbersWithoutFraction() {
        assertThat(resolver.resolve(HarvestRecord.of(Map.of("id", 7.0)))).contains("7");
        assertThat(resolver.resolve(HarvestRecord.of(Map.of("id", new BigDecimal("12.50"))))).contains("12.5");
        assertThat(resolver.resolve(HarvestRecord.of(Map.of("id", 123456789L)))).contains("123456789");
    }

    @Test
    void resolve_anonymousRecordHasNoIdentity() {
        assertThat(resolver.resolve(HarvestRecord.of(Map.of("name", "pen")))).isEmpty();
        assertThat(resolver.resolve(HarvestRecord.of(Map.of("id", List.of("a"))))).isEmpty();
    }

    @Test
    void primaryField_isFirstCandidate() {
        assertThat(new IdentityResolver(List.of("sku", "id")).primaryField()).isEqualTo("sku");
    }

    @Test
    void constructor_rejectsEmptyCandidates() {
        assertThatThrownBy(() -> new IdentityResolver(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
