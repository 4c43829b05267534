package de.jwiegmann.skiptrace.control.mapping;

import de.jwiegmann.skiptrace.boundary.dto.mapping.ColumnAssignment;
import de.jwiegmann.skiptrace.control.exception.FieldConflictException;
import de.jwiegmann.skiptrace.control.exception.SchemaException;
import de.jwiegmann.skiptrace.control.normalize.RecordNormalizer;
import de.jwiegmann.skiptrace.entity.CanonicalField;
import de.jwiegmann.skiptrace.entity.ColumnMapping;
import de.jwiegmann.skiptrace.entity.MappingSuggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordnet die Spalten eines Uploads den Zielfeldern zu.
 *
 * <p>Jedes Feld außer {@link CanonicalField#PHONE} darf höchstens einer Spalte zugeordnet sein,
 * PHONE höchstens {@code upload.mapping.phone-slots} Spalten.
 */
@Slf4j
@Service
public class SchemaMapper {

    private final FieldAliasRegistry aliases;
    private final int phoneSlots;
    private final int sampleRows;

    public SchemaMapper(FieldAliasRegistry aliases,
                        @Value("${upload.mapping.phone-slots:7}") int phoneSlots,
                        @Value("${upload.mapping.sample-rows:3}") int sampleRows) {
        this.aliases = aliases;
        this.phoneSlots = phoneSlots;
        this.sampleRows = Math.max(1, Math.min(3, sampleRows));
    }

    /**
     * Erstellt den Mapping-Vorschlag für die Bestätigung durch den Benutzer.
     *
     * @param rows         alle Zeilen der Tabelle, ggf. inklusive Header
     * @param hasHeaderRow {@code null} = automatisch erkennen
     * @return Vorschlag mit einer Zuordnung pro Spalte
     * @throws SchemaException wenn die Tabelle leer ist oder die Beispielzeilen nicht zur Spaltenzahl passen
     */
    public MappingProposal propose(List<List<String>> rows, Boolean hasHeaderRow) {
        if (rows == null || rows.isEmpty()) {
            throw new SchemaException("upload contains no rows");
        }
        List<String> firstRow = rows.get(0);
        int columnCount = firstRow == null ? 0 : firstRow.size();
        if (columnCount == 0) {
            throw new SchemaException("first row contains no columns");
        }

        boolean header = hasHeaderRow != null ? hasHeaderRow : detectHeaderRow(firstRow);
        List<List<String>> samples = sampleRows(rows, header);
        validate(columnCount, samples, header);

        List<ColumnMapping> columns = new ArrayList<>();
        for (int i = 0; i < columnCount; i++) {
            final int col = i;
            columns.add(ColumnMapping.builder()
                    .columnIndex(i)
                    .header(header ? firstRow.get(i) : "Column " + (i + 1))
                    .sampleValues(samples.stream().map(r -> r.get(col)).collect(Collectors.toList()))
                    .build());
        }

        if (header) {
            preselect(columns, aliases::exactMatch, MappingSuggestion.EXACT);
            preselect(columns, aliases::alternateMatch, MappingSuggestion.ALTERNATE);
        }

        log.debug("Mapping-Vorschlag: {} Spalten, Header={}, zugeordnet={}",
                columnCount, header, columns.stream().filter(c -> !c.isSkipped()).count());

        return MappingProposal.builder()
                .hasHeaderRow(header)
                .columnCount(columnCount)
                .columns(columns)
                .build();
    }

    /**
     * Erste Zeile ist ein Header, wenn mindestens eine Zelle einem Feldnamen oder einer Schreibweise entspricht.
     */
    public boolean detectHeaderRow(List<String> firstRow) {
        return firstRow != null && firstRow.stream().anyMatch(aliases::isKnownHeader);
    }

    /**
     * Weist einer Spalte ein Feld zu (oder SKIP bei {@code null}).
     *
     * @throws FieldConflictException wenn das Feld bereits belegt ist bzw. alle Telefon-Slots vergeben sind
     */
    public void assign(List<ColumnMapping> columns, int columnIndex, CanonicalField field) {
        ColumnMapping target = column(columns, columnIndex);
        if (field != null) {
            List<ColumnMapping> others = columns.stream()
                    .filter(c -> c.getColumnIndex() != columnIndex && c.getField() == field)
                    .collect(Collectors.toList());
            if (field.isMultiColumn() ? others.size() >= phoneSlots : !others.isEmpty()) {
                throw new FieldConflictException(field, columnIndex, others.get(others.size() - 1).getColumnIndex());
            }
        }
        target.setField(field);
        target.setSuggestion(MappingSuggestion.MANUAL);
    }

    /**
     * Übernimmt die bestätigten Zuordnungen. Nicht genannte Spalten werden übersprungen.
     *
     * @return bestätigtes Mapping (neue Liste, der Vorschlag bleibt unverändert)
     */
    public List<ColumnMapping> confirm(List<ColumnMapping> proposal, List<ColumnAssignment> assignments) {
        List<ColumnMapping> confirmed = proposal.stream()
                .map(c -> c.toBuilder()
                        .sampleValues(new ArrayList<>(c.getSampleValues()))
                        .field(null)
                        .suggestion(MappingSuggestion.NONE)
                        .build())
                .collect(Collectors.toList());

        Set<Integer> seen = new HashSet<>();
        for (ColumnAssignment a : assignments == null ? List.<ColumnAssignment>of() : assignments) {
            if (a.getColumnIndex() < 0 || a.getColumnIndex() >= confirmed.size()) {
                throw new SchemaException("column index " + a.getColumnIndex() + " out of range (0.." + (confirmed.size() - 1) + ")");
            }
            if (!seen.add(a.getColumnIndex())) {
                throw new SchemaException("column " + a.getColumnIndex() + " assigned twice");
            }
            assign(confirmed, a.getColumnIndex(), a.getField());
        }
        return confirmed;
    }

    /**
     * Felder, die für die Spalte nicht mehr wählbar sind, weil andere Spalten sie belegen.
     * PHONE wird erst gesperrt, wenn alle Slots durch andere Spalten vergeben sind.
     */
    public Set<CanonicalField> disabledOptions(List<ColumnMapping> columns, int columnIndex) {
        Set<CanonicalField> disabled = EnumSet.noneOf(CanonicalField.class);
        long phonesElsewhere = 0;
        for (ColumnMapping c : columns) {
            if (c.getColumnIndex() == columnIndex || c.isSkipped()) {
                continue;
            }
            if (c.getField().isMultiColumn()) {
                phonesElsewhere++;
            } else {
                disabled.add(c.getField());
            }
        }
        if (phonesElsewhere >= phoneSlots) {
            disabled.add(CanonicalField.PHONE);
        }
        return disabled;
    }

    public int getPhoneSlots() {
        return phoneSlots;
    }

    private void preselect(List<ColumnMapping> columns,
                           Function<String, Optional<CanonicalField>> matcher,
                           MappingSuggestion kind) {
        for (ColumnMapping column : columns) {
            if (!column.isSkipped() || column.getSuggestion() == MappingSuggestion.CONFLICT) {
                continue;
            }
            matcher.apply(column.getHeader()).ifPresent(field -> {
                if (disabledOptions(columns, column.getColumnIndex()).contains(field)) {
                    // Feld schon vergeben: Spalte bleibt SKIP und muss manuell geklärt werden
                    column.setSuggestion(MappingSuggestion.CONFLICT);
                } else {
                    column.setField(field);
                    column.setSuggestion(kind);
                }
            });
        }
    }

    private List<List<String>> sampleRows(List<List<String>> rows, boolean header) {
        return rows.stream()
                .skip(header ? 1 : 0)
                .filter(r -> !RecordNormalizer.isBlank(r))
                .limit(sampleRows)
                .collect(Collectors.toList());
    }

    private void validate(int columnCount, List<List<String>> samples, boolean header) {
        for (int i = 0; i < samples.size(); i++) {
            int width = samples.get(i).size();
            if (width != columnCount) {
                throw new SchemaException(String.format(
                        "column count mismatch: %s has %d columns, sample row %d has %d",
                        header ? "header row" : "first row", columnCount, i + 1, width));
            }
        }
    }

    private static ColumnMapping column(List<ColumnMapping> columns, int columnIndex) {
        return columns.stream()
                .filter(c -> c.getColumnIndex() == columnIndex)
                .findFirst()
                .orElseThrow(() -> new SchemaException("column index " + columnIndex + " out of range"));
    }
}
