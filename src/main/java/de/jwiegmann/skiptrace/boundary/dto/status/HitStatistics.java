package de.jwiegmann.skiptrace.boundary.dto.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HitStatistics {
    private int totalHits;           // Datensätze mit Telefon, E-Mail oder Adresse
    private int billableHits;        // Fresh Fetch mit Daten
    private int existingMatches;     // Cache-Treffer mit Daten
    private int freshFetches;
    private int cacheReuses;
    private int totalPhones;
    private int totalEmails;
    private int totalAddresses;
}
