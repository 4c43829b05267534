package de.jwiegmann.skiptrace.boundary.dto.init;

import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitRequest {
    private String ownerId;
    private String filename;
    private List<List<String>> rows;     // bereits geparste Tabelle, ggf. mit Header
    private Boolean hasHeaderRow;        // null = automatisch erkennen
    private RefreshPolicy refreshPolicy;
}
