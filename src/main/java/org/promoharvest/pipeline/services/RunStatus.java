package org.promoharvest.pipeline.services;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Run status published in the progress and heartbeat files.
 */
public enum RunStatus {
    STARTING,
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    STOPPED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != STARTING && this != RUNNING;
    }

    public boolean isCompleted() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS;
    }
}
