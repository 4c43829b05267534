package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.entity.EnrichmentEntry;

import java.util.Optional;

/**
 * Adressbezogener Cache, global über alle Uploads und Besitzer.
 * Schreibzugriffe erfolgen nur unter der Sperre des jeweiligen Fingerprints.
 */
public interface EnrichmentCache {

    Optional<EnrichmentEntry> get(String fingerprint);

    /** Überschreibt einen vorhandenen Eintrag; der letzte Fresh Fetch gilt. */
    void put(EnrichmentEntry entry);

    int size();
}
