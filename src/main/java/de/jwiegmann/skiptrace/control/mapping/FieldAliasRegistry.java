package de.jwiegmann.skiptrace.control.mapping;

import de.jwiegmann.skiptrace.entity.CanonicalField;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Kennt pro Zielfeld den kanonischen Namen und die alternativen Schreibweisen der Spaltenüberschrift.
 * Zusätzliche Schreibweisen kommen aus {@code upload.mapping.aliases.<FIELD>} (kommasepariert).
 */
@Slf4j
@Component
public class FieldAliasRegistry {

    static final String ALIAS_PROPERTY_PREFIX = "upload.mapping.aliases.";

    private final Map<CanonicalField, Set<String>> exactNames = new EnumMap<>(CanonicalField.class);
    private final Map<CanonicalField, Set<String>> alternates = new EnumMap<>(CanonicalField.class);

    public FieldAliasRegistry(Environment environment) {
        for (CanonicalField field : CanonicalField.values()) {
            Set<String> exact = new LinkedHashSet<>();
            exact.add(normalizeHeader(field.getDisplayName()));
            exact.add(normalizeHeader(field.name()));
            exactNames.put(field, exact);

            Set<String> alt = new LinkedHashSet<>();
            field.getDefaultAliases().forEach(a -> alt.add(normalizeHeader(a)));
            String configured = environment.getProperty(ALIAS_PROPERTY_PREFIX + field.name());
            if (configured != null && !configured.isBlank()) {
                Arrays.stream(configured.split(","))
                        .map(FieldAliasRegistry::normalizeHeader)
                        .filter(a -> !a.isEmpty())
                        .forEach(alt::add);
            }
            alt.removeAll(exact);
            alternates.put(field, alt);
        }
        log.debug("Alias-Tabelle geladen: {}", alternates);
    }

    /**
     * Vergleichsform einer Überschrift: Kleinbuchstaben, nur Buchstaben und Ziffern.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    public Optional<CanonicalField> exactMatch(String header) {
        return lookup(exactNames, header);
    }

    public Optional<CanonicalField> alternateMatch(String header) {
        return lookup(alternates, header);
    }

    public boolean isKnownHeader(String header) {
        return exactMatch(header).isPresent() || alternateMatch(header).isPresent();
    }

    private static Optional<CanonicalField> lookup(Map<CanonicalField, Set<String>> table, String header) {
        String key = normalizeHeader(header);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        // EnumMap iteriert in Deklarationsreihenfolge, bei Mehrdeutigkeit gewinnt das erste Feld
        return table.entrySet().stream()
                .filter(e -> e.getValue().contains(key))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
