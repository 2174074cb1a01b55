package org.promoharvest.pipeline.resources.storage;

/**
 * Counts from one {@link RecordBatcher#merge()} run.
 *
 * @param batchFiles number of batch files merged
 * @param written    records written to the record log
 * @param duplicates records dropped because their identity survived elsewhere
 * @param anonymous  records without identity (kept)
 * @param invalid    unparseable fragments skipped
 */
public record MergeReport(int batchFiles, long written, long duplicates, long anonymous, long invalid) {
}
