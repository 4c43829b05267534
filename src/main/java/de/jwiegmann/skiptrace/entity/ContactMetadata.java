package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ergebnis einer Skip-Trace-Abfrage für eine Adresse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactMetadata {

    @Builder.Default
    private List<String> ownerNames = new ArrayList<>();

    @Builder.Default
    private List<String> phones = new ArrayList<>();

    @Builder.Default
    private List<String> emails = new ArrayList<>();

    @Builder.Default
    private List<PostalAddress> addressHistory = new ArrayList<>();

    public boolean hasData() {
        return !ownerNames.isEmpty() || !phones.isEmpty() || !emails.isEmpty() || !addressHistory.isEmpty();
    }
}
