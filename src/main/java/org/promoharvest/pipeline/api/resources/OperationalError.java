package org.promoharvest.pipeline.api.resources;

import java.time.Instant;

/**
 * A transient problem observed by a pipeline component.
 *
 * @param timestamp when the error occurred
 * @param errorType a category such as {@code "FETCH_FAILED"} or {@code "FLUSH_FAILED"}
 * @param message   human-readable description
 * @param details   optional context, for example the identity involved
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
