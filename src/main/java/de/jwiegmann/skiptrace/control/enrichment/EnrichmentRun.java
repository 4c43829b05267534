package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Zustand eines Verarbeitungslaufs: pro Fingerprint höchstens ein Fresh Fetch, auch unter FORCE_REFRESH.
 */
@Getter
public class EnrichmentRun {

    private final String batchId;
    private final RefreshPolicy policy;
    private final Map<String, EnrichmentResponse> fetched = new ConcurrentHashMap<>();

    public EnrichmentRun(String batchId, RefreshPolicy policy) {
        this.batchId = batchId;
        this.policy = policy == null ? RefreshPolicy.PREFER_CACHE : policy;
    }
}
