package org.promoharvest.pipeline.api.records;

/**
 * Which occurrence survives when several documents share an identity.
 */
public enum DuplicatePolicy {
    KEEP_FIRST,
    KEEP_LAST;

    public static DuplicatePolicy fromFlag(boolean keepLast) {
        return keepLast ? KEEP_LAST : KEEP_FIRST;
    }
}
