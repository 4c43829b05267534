package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Eine normalisierte Zeile im festen Zielschema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalRecord {

    /** 1-basiert, gezählt über die Datenzeilen ohne Header. */
    private int rowNumber;

    /** Aus der Tabelle übernommen oder aus Vor- und Nachname zusammengesetzt. */
    private String fullName;
    private String firstName;
    private String lastName;

    private PostalAddress mailingAddress;
    private PostalAddress propertyAddress;

    @Builder.Default
    private List<String> phones = new ArrayList<>();

    private String email;

    private String custom1;
    private String custom2;
    private String custom3;
}
