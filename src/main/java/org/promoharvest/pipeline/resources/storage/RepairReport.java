package org.promoharvest.pipeline.resources.storage;

/**
 * Result of scanning, validating or repairing a record log.
 *
 * @param totalLines         physical lines read
 * @param documents          JSON objects recovered from those lines
 * @param valid              documents passing the schema check
 * @param invalid            schema failures plus unparseable fragments
 * @param duplicates         valid documents dropped in favour of another occurrence of their identity
 * @param multiDocumentLines lines that held more than one document
 * @param survivors          documents kept
 * @param lastIdentity       identity of the last kept document, or {@code null}
 * @param repaired           whether the log was rewritten
 * @param checkpointStale    whether the stored checkpoint disagreed with the fresh scan
 */
public record RepairReport(
    long totalLines,
    long documents,
    long valid,
    long invalid,
    long duplicates,
    long multiDocumentLines,
    long survivors,
    String lastIdentity,
    boolean repaired,
    boolean checkpointStale
) {

    /**
     * @return whether the log already holds exactly one valid, unique document per line
     */
    public boolean isClean() {
        return invalid == 0 && duplicates == 0 && multiDocumentLines == 0;
    }

    public Checkpoint toCheckpoint() {
        return new Checkpoint(lastIdentity, survivors);
    }

    RepairReport withOutcome(boolean repaired, boolean checkpointStale) {
        return new RepairReport(totalLines, documents, valid, invalid, duplicates, multiDocumentLines,
            survivors, lastIdentity, repaired, checkpointStale);
    }
}
