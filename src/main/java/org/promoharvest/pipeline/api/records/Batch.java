package org.promoharvest.pipeline.api.records;

import java.time.Instant;
import java.util.List;

/**
 * An immutable, sequentially numbered group of records flushed to one batch file.
 *
 * @param sequence  monotonically increasing batch number, assigned at flush time
 * @param createdAt flush timestamp
 * @param records   the records in completion order
 */
public record Batch(long sequence, Instant createdAt, List<HarvestRecord> records) {

    public Batch {
        if (sequence < 1) {
            throw new IllegalArgumentException("Batch sequence must be >= 1: " + sequence);
        }
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
