package org.promoharvest.pipeline.resources.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last known-good state of a record log: the identity of its last surviving record and the number of
 * surviving records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
    @JsonProperty("last_valid_identity") String lastValidIdentity,
    @JsonProperty("last_valid_line") long lastValidLine
) {
}
