package org.promoharvest.pipeline.resources.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Position of an interrupted ingestion run: the last identity whose fetch attempt finished.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResumePoint(
    @JsonProperty("last_attempted_identity") String lastAttemptedIdentity,
    @JsonProperty("attempted") long attempted,
    @JsonProperty("updated_at") String updatedAt
) {
}
