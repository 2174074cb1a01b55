package org.promoharvest.pipeline.services;

import org.promoharvest.pipeline.api.fetch.FetchErrorKind;
import org.promoharvest.pipeline.api.records.HarvestRecord;

/**
 * Final outcome of fetching one identity, after gating and retries.
 *
 * @param identity  the requested identity
 * @param status    what happened
 * @param record    the fetched record when {@code status == RECORD}
 * @param errorKind the last failure kind when {@code status == FAILED}
 * @param message   the last failure message, if any
 * @param attempts  fetch attempts made
 */
public record FetchOutcome(String identity, Status status, HarvestRecord record,
                           FetchErrorKind errorKind, String message, int attempts) {

    public enum Status {
        /** A record was fetched. */
        RECORD,
        /** The producer had nothing for this identity. */
        EMPTY,
        /** Permanent failure or retries exhausted. */
        FAILED,
        /** Rejected by the open circuit breaker; eligible again in a later pass. */
        DEFERRED,
        /** Retries abandoned because a stop was requested. */
        ABORTED
    }

    static FetchOutcome record(String identity, HarvestRecord record, int attempts) {
        return new FetchOutcome(identity, Status.RECORD, record, null, null, attempts);
    }

    static FetchOutcome empty(String identity, int attempts) {
        return new FetchOutcome(identity, Status.EMPTY, null, null, null, attempts);
    }

    static FetchOutcome failed(String identity, FetchErrorKind kind, String message, int attempts) {
        return new FetchOutcome(identity, Status.FAILED, null, kind, message, attempts);
    }

    static FetchOutcome deferred(String identity, int attempts) {
        return new FetchOutcome(identity, Status.DEFERRED, null, null, "circuit breaker open", attempts);
    }

    static FetchOutcome aborted(String identity, int attempts) {
        return new FetchOutcome(identity, Status.ABORTED, null, null, "stop requested", attempts);
    }
}
