package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RefreshPolicy {
    @JsonProperty("prefer_cache") PREFER_CACHE,   // Cache-Treffer wiederverwenden, nur bei Miss extern abfragen
    @JsonProperty("force_refresh") FORCE_REFRESH  // jede Adresse einmal pro Lauf neu abfragen
}
