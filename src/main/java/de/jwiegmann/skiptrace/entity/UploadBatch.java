package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ein hochgeladenes Tabellenblatt samt Mapping und Verarbeitungszustand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadBatch {

    private String batchId;
    private String ownerId;
    private String filename;

    @Builder.Default
    private List<List<String>> rawRows = new ArrayList<>();

    private boolean hasHeaderRow;

    @Builder.Default
    private List<ColumnMapping> columnMappings = new ArrayList<>();

    @Builder.Default
    private RefreshPolicy refreshPolicy = RefreshPolicy.PREFER_CACHE;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private volatile BatchStatus status = BatchStatus.MAPPING;

    private volatile boolean cancelRequested;

    /** Anzahl nicht-leerer Datenzeilen. */
    private int totalRows;

    private String errorMessage;

    private int runCount;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
