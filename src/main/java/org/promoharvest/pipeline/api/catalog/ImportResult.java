package org.promoharvest.pipeline.api.catalog;

/**
 * Per-record outcome of a catalog import.
 *
 * @param identity the record identity
 * @param accepted whether the catalog accepted the record
 * @param reason   rejection reason, or a short status for accepted records
 */
public record ImportResult(String identity, boolean accepted, String reason) {

    public static ImportResult accepted(String identity, String reason) {
        return new ImportResult(identity, true, reason);
    }

    public static ImportResult rejected(String identity, String reason) {
        return new ImportResult(identity, false, reason);
    }
}
