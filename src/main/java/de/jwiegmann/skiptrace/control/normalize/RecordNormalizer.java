package de.jwiegmann.skiptrace.control.normalize;

import de.jwiegmann.skiptrace.entity.CanonicalField;
import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.ColumnMapping;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import de.jwiegmann.skiptrace.entity.RowValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Wandelt Rohzeilen anhand des bestätigten Mappings in {@link CanonicalRecord}s um.
 *
 * <p>Die Normalisierung ist deterministisch und wird bei jedem Lauf aus den Rohzeilen neu erzeugt.
 */
@Slf4j
@Service
public class RecordNormalizer {

    private final int maxFieldLength;

    public RecordNormalizer(@Value("${upload.record.max-field-length:255}") int maxFieldLength) {
        this.maxFieldLength = maxFieldLength;
    }

    /**
     * Liefert einen lazy Stream über alle nicht-leeren Datenzeilen.
     * Zeilennummern sind 1-basiert und zählen ab der ersten Datenzeile (Header nicht mitgezählt).
     */
    public Stream<NormalizedRow> normalize(List<List<String>> rows, boolean hasHeaderRow, List<ColumnMapping> mapping) {
        int offset = hasHeaderRow ? 1 : 0;
        int dataRows = Math.max(0, rows.size() - offset);
        return IntStream.range(0, dataRows)
                .filter(i -> !isBlank(rows.get(i + offset)))
                .mapToObj(i -> normalizeRow(i + 1, rows.get(i + offset), mapping));
    }

    /**
     * Anzahl der Datenzeilen, die {@link #normalize} liefern wird.
     */
    public static int countDataRows(List<List<String>> rows, boolean hasHeaderRow) {
        return (int) rows.stream()
                .skip(hasHeaderRow ? 1 : 0)
                .filter(r -> !isBlank(r))
                .count();
    }

    public static boolean isBlank(List<String> row) {
        return row == null || row.stream().allMatch(c -> c == null || c.isBlank());
    }

    NormalizedRow normalizeRow(int rowNumber, List<String> row, List<ColumnMapping> mapping) {
        Map<CanonicalField, List<String>> values = new EnumMap<>(CanonicalField.class);
        for (ColumnMapping column : mapping) {
            if (column.isSkipped()) {
                continue;
            }
            // fehlende Zellen am Zeilenende gelten als leer
            String raw = column.getColumnIndex() < row.size() ? row.get(column.getColumnIndex()) : null;
            if (raw != null && raw.length() > maxFieldLength) {
                RowValidationError error = RowValidationError.builder()
                        .rowNumber(rowNumber)
                        .field(column.getField())
                        .columnNumber(column.getColumnIndex() + 1)
                        .code(RowValidationError.FIELD_TOO_LONG)
                        .message(String.format("row %d, column %d (%s): value has %d characters, maximum is %d",
                                rowNumber, column.getColumnIndex() + 1, column.getField().getDisplayName(),
                                raw.length(), maxFieldLength))
                        .build();
                log.debug("Zeile {} abgewiesen: {}", rowNumber, error.getMessage());
                return NormalizedRow.rejected(error);
            }
            values.computeIfAbsent(column.getField(), f -> new ArrayList<>()).add(raw);
        }
        return NormalizedRow.valid(toRecord(rowNumber, values));
    }

    private CanonicalRecord toRecord(int rowNumber, Map<CanonicalField, List<String>> values) {
        String firstName = titleCase(first(values, CanonicalField.FIRST_NAME));
        String lastName = titleCase(first(values, CanonicalField.LAST_NAME));
        String fullName = titleCase(first(values, CanonicalField.FULL_NAME));
        if (fullName != null && firstName == null && lastName == null) {
            int space = fullName.indexOf(' ');
            firstName = space < 0 ? fullName : fullName.substring(0, space);
            lastName = space < 0 ? null : fullName.substring(space + 1);
        } else if (fullName == null && (firstName != null || lastName != null)) {
            fullName = Stream.of(firstName, lastName).filter(Objects::nonNull).collect(Collectors.joining(" "));
        }

        Set<String> phones = new LinkedHashSet<>();
        values.getOrDefault(CanonicalField.PHONE, List.of()).forEach(p -> Fingerprints.phone(p).ifPresent(phones::add));

        String email = collapse(first(values, CanonicalField.EMAIL));

        return CanonicalRecord.builder()
                .rowNumber(rowNumber)
                .fullName(fullName)
                .firstName(firstName)
                .lastName(lastName)
                .mailingAddress(address(values, CanonicalField.MAILING_STREET, CanonicalField.MAILING_CITY,
                        CanonicalField.MAILING_STATE, CanonicalField.MAILING_ZIP))
                .propertyAddress(address(values, CanonicalField.PROPERTY_STREET, CanonicalField.PROPERTY_CITY,
                        CanonicalField.PROPERTY_STATE, CanonicalField.PROPERTY_ZIP))
                .phones(new ArrayList<>(phones))
                .email(email == null ? null : email.toLowerCase(Locale.ROOT))
                .custom1(trimmed(first(values, CanonicalField.CUSTOM_1)))
                .custom2(trimmed(first(values, CanonicalField.CUSTOM_2)))
                .custom3(trimmed(first(values, CanonicalField.CUSTOM_3)))
                .build();
    }

    private static PostalAddress address(Map<CanonicalField, List<String>> values, CanonicalField street,
                                         CanonicalField city, CanonicalField state, CanonicalField zip) {
        return PostalAddress.builder()
                .street(upper(first(values, street)))
                .city(upper(first(values, city)))
                .state(upper(first(values, state)))
                .zip(upper(first(values, zip)))
                .build();
    }

    private static String first(Map<CanonicalField, List<String>> values, CanonicalField field) {
        List<String> list = values.get(field);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String collapse(String value) {
        String t = trimmed(value);
        return t == null ? null : t.replaceAll("\\s+", " ");
    }

    private static String upper(String value) {
        String c = collapse(value);
        return c == null ? null : c.toUpperCase(Locale.ROOT);
    }

    static String titleCase(String value) {
        String c = collapse(value);
        if (c == null) {
            return null;
        }
        return Arrays.stream(c.split(" "))
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
