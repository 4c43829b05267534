package de.jwiegmann.skiptrace.control.normalize;

import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.PostalAddress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Vergleichsschlüssel für Cache und Sperrliste. Beide Seiten müssen exakt dieselbe Normalisierung verwenden.
 */
public final class Fingerprints {

    private static final Set<String> NAME_SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv", "v");

    private Fingerprints() {
    }

    /**
     * street|city|state|zip5, klein geschrieben, ohne Satzzeichen, Leerraum zusammengefasst.
     * Leer, wenn die Straße fehlt oder weder PLZ noch Stadt+Staat vorhanden sind.
     */
    public static Optional<String> address(PostalAddress address) {
        if (address == null) {
            return Optional.empty();
        }
        String street = part(address.getStreet());
        String city = part(address.getCity());
        String state = part(address.getState());
        String zip = zip5(address.getZip());
        if (street.isEmpty() || (zip.isEmpty() && (city.isEmpty() || state.isEmpty()))) {
            return Optional.empty();
        }
        return Optional.of(String.join("|", street, city, state, zip));
    }

    public static Optional<String> propertyAddress(CanonicalRecord record) {
        return address(record.getPropertyAddress());
    }

    /**
     * Nachname plus Initiale des Vornamens, z.B. "smith:j". Namenszusätze wie "Jr" oder "III" am Ende des
     * Nachnamens zählen nicht. Ohne Vornamen endet der Schlüssel auf ":". Leer ohne Nachnamen.
     */
    public static Optional<String> nameKey(String firstName, String lastName) {
        String last = letters(withoutSuffix(lastName));
        if (last.isEmpty()) {
            return Optional.empty();
        }
        String first = letters(firstName);
        return Optional.of(last + ":" + (first.isEmpty() ? "" : first.substring(0, 1)));
    }

    public static Optional<String> person(String firstName, String lastName, PostalAddress address) {
        Optional<String> name = nameKey(firstName, lastName);
        Optional<String> addr = address(address);
        if (name.isEmpty() || addr.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(name.get() + "@" + addr.get());
    }

    /**
     * Schlüssel für identische Zeilen innerhalb eines Uploads: voller Name, Objekt- und Postadresse.
     * Leer ohne verwertbare Objektadresse.
     */
    public static Optional<String> duplicateKey(CanonicalRecord record) {
        return propertyAddress(record).map(property -> String.join("#",
                letters(record.getFirstName()),
                letters(record.getLastName()),
                property,
                address(record.getMailingAddress()).orElse("")));
    }

    /**
     * Nur Ziffern, führende US-Landesvorwahl entfernt. Leer, wenn keine 10 Stellen übrig bleiben.
     */
    public static Optional<String> phone(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == 11 && digits.startsWith("1")) {
            digits = digits.substring(1);
        }
        return digits.length() == 10 ? Optional.of(digits) : Optional.empty();
    }

    public static String zip5(String zip) {
        if (zip == null) {
            return "";
        }
        String digits = zip.trim();
        int dash = digits.indexOf('-');
        if (dash > 0) {
            digits = digits.substring(0, dash);
        }
        digits = digits.replaceAll("\\D", "");
        return digits.length() > 5 ? digits.substring(0, 5) : digits;
    }

    private static String part(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static String withoutSuffix(String lastName) {
        if (lastName == null) {
            return null;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(lastName.trim().split("[\\s,]+")));
        while (tokens.size() > 1 && NAME_SUFFIXES.contains(letters(tokens.get(tokens.size() - 1)))) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join(" ", tokens);
    }

    private static String letters(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
