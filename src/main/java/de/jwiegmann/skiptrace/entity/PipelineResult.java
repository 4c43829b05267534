package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminales Ergebnis eines Datensatzes innerhalb eines Verarbeitungslaufs.
 */
public enum PipelineResult {
    @JsonProperty("enriched_from_cache") ENRICHED_FROM_CACHE,
    @JsonProperty("enriched_fresh") ENRICHED_FRESH,
    @JsonProperty("matched_litigator") MATCHED_LITIGATOR,
    @JsonProperty("skipped_invalid") SKIPPED_INVALID,
    @JsonProperty("failed_external") FAILED_EXTERNAL;   // einziges Ergebnis, das ein Resume erneut aufgreift

    public boolean isEnriched() {
        return this == ENRICHED_FROM_CACHE || this == ENRICHED_FRESH;
    }

    public boolean isFinal() {
        return this != FAILED_EXTERNAL;
    }
}
