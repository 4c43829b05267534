package de.jwiegmann.skiptrace.entity;

/**
 * Stufen, die ein Datensatz durchläuft. Eine abgeschlossene Stufe wird beim Resume nicht wiederholt.
 */
public enum RecordStage {
    NORMALIZED,
    ENRICHED,
    MATCHED,
    TAGGED
}
