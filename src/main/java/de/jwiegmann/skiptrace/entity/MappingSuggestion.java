package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Herkunft einer Spaltenzuordnung im Mapping-Vorschlag.
 */
public enum MappingSuggestion {
    @JsonProperty("exact") EXACT,         // Header entspricht dem Feldnamen
    @JsonProperty("alternate") ALTERNATE, // Header entspricht einer alternativen Schreibweise
    @JsonProperty("conflict") CONFLICT,   // Feld bereits von einer früheren Spalte belegt -> manuell klären
    @JsonProperty("none") NONE,           // kein Treffer, SKIP bis zur Bestätigung
    @JsonProperty("manual") MANUAL        // vom Benutzer bestätigt
}
