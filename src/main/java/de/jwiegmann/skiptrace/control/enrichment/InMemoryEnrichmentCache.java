package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.entity.EnrichmentEntry;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryEnrichmentCache implements EnrichmentCache {

    // Map<fingerprint, EnrichmentEntry>
    private final Map<String, EnrichmentEntry> store = new ConcurrentHashMap<>();

    @Override
    public Optional<EnrichmentEntry> get(String fingerprint) {
        return Optional.ofNullable(store.get(fingerprint));
    }

    @Override
    public void put(EnrichmentEntry entry) {
        store.put(entry.getFingerprint(), entry);
    }

    @Override
    public int size() {
        return store.size();
    }
}
