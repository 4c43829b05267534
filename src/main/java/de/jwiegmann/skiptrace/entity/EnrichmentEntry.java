package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cache-Eintrag, global über alle Uploads und Besitzer geteilt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentEntry {

    private String fingerprint;
    private ContactMetadata contact;
    private Instant fetchedAt;
    private String sourceBatchId;
}
