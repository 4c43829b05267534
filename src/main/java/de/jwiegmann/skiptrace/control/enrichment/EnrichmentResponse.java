package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.entity.ContactMetadata;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnrichmentResponse {

    private static final EnrichmentResponse NOT_FOUND = new EnrichmentResponse(null);

    private final ContactMetadata contact;

    public static EnrichmentResponse found(ContactMetadata contact) {
        return new EnrichmentResponse(contact);
    }

    public static EnrichmentResponse notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return contact != null;
    }
}
