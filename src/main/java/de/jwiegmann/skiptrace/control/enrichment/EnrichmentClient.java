package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.entity.PostalAddress;

/**
 * Kostenpflichtiger Skip-Trace-Anbieter. Jeder Aufruf ist ein abgerechneter Fresh Fetch.
 */
public interface EnrichmentClient {

    /**
     * @param propertyAddress normalisierte Objektadresse
     * @return Kontaktdaten oder {@link EnrichmentResponse#notFound()}
     * @throws ExternalServiceException bei Timeout, Rate-Limit oder Fehler des Anbieters
     */
    EnrichmentResponse lookup(PostalAddress propertyAddress);
}
