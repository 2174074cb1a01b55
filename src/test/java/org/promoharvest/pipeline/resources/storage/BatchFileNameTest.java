package org.promoharvest.pipeline.resources.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BatchFileNameTest {

    @Test
    void fileName_encodesTimestampAndPaddedSequence() {
        BatchFileName name = BatchFileName.of("batch", Instant.parse("2024-03-01T12:30:05Z"), 7);

        assertThat(name.fileName()).isEqualTo("batch_20240301T123005Z_000007.jsonl");
    }

    @Test
    void parse_acceptsOwnPrefixOnly() {
        assertThat(BatchFileName.parse(Path.of("batch_20240301T123005Z_000007.jsonl"), "batch"))
            .hasValueSatisfying(n -> assertThat(n.sequence()).isEqualTo(7));
        assertThat(BatchFileName.parse(Path.of("other_20240301T123005Z_000007.jsonl"), "batch")).isEmpty();
        assertThat(BatchFileName.parse(Path.of("batch_20240301T123005Z_000007.jsonl.abc.tmp"), "batch")).isEmpty();
        assertThat(BatchFileName.parse(Path.of("records.jsonl"), "batch")).isEmpty();
    }

    @Test
    void parse_sequenceBeyondSixDigits() {
        assertThat(BatchFileName.parse(Path.of("batch_20240301T123005Z_1000000.jsonl"), "batch"))
            .hasValueSatisfying(n -> assertThat(n.sequence()).isEqualTo(1_000_000));
    }
}
