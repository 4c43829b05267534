package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Welcher Weg bei der Anreicherung genommen wurde. Grundlage für die Kostenabrechnung.
 */
public enum EnrichmentSource {
    @JsonProperty("cache") CACHE,
    @JsonProperty("fresh") FRESH,
    @JsonProperty("not_found") NOT_FOUND,
    @JsonProperty("no_address") NO_ADDRESS;

    public boolean hasContact() {
        return this == CACHE || this == FRESH;
    }
}
