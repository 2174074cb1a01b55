package org.promoharvest.pipeline.api.fetch;

import org.promoharvest.pipeline.api.records.HarvestRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one fetch attempt: a record, no record, or a classified failure.
 */
public final class FetchResult {

    public enum Outcome { RECORD, EMPTY, FAILURE }

    private static final FetchResult EMPTY = new FetchResult(Outcome.EMPTY, null, null, null);

    private final Outcome outcome;
    private final HarvestRecord record;
    private final FetchErrorKind errorKind;
    private final String message;

    private FetchResult(Outcome outcome, HarvestRecord record, FetchErrorKind errorKind, String message) {
        this.outcome = outcome;
        this.record = record;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static FetchResult success(HarvestRecord record) {
        return new FetchResult(Outcome.RECORD, Objects.requireNonNull(record, "record"), null, null);
    }

    public static FetchResult empty() {
        return EMPTY;
    }

    public static FetchResult failure(FetchErrorKind kind, String message) {
        return new FetchResult(Outcome.FAILURE, null, Objects.requireNonNull(kind, "kind"), message);
    }

    public static FetchResult retryable(String message) {
        return failure(FetchErrorKind.RETRYABLE, message);
    }

    public static FetchResult rateLimited(String message) {
        return failure(FetchErrorKind.RATE_LIMITED, message);
    }

    public static FetchResult authExpired(String message) {
        return failure(FetchErrorKind.AUTH_EXPIRED, message);
    }

    public static FetchResult fatal(String message) {
        return failure(FetchErrorKind.FATAL, message);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isRecord() {
        return outcome == Outcome.RECORD;
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILURE;
    }

    public Optional<HarvestRecord> record() {
        return Optional.ofNullable(record);
    }

    /**
     * @return the failure kind, or {@code null} unless {@link #isFailure()}
     */
    public FetchErrorKind errorKind() {
        return errorKind;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case RECORD:
                return "FetchResult[RECORD]";
            case EMPTY:
                return "FetchResult[EMPTY]";
            default:
                return "FetchResult[" + errorKind + ": " + message + "]";
        }
    }
}
