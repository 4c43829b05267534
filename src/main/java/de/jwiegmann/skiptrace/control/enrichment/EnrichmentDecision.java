package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class EnrichmentDecision {

    private final String fingerprint;
    private final EnrichmentSource source;
    private final ContactMetadata contact;
}
