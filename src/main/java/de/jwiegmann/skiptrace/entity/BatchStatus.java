package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lebenszyklus eines Uploads: MAPPING -> PROCESSING -> COMPLETED | FAILED_PARTIAL.
 */
public enum BatchStatus {
    @JsonProperty("mapping") MAPPING,
    @JsonProperty("processing") PROCESSING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed_partial") FAILED_PARTIAL
}
