package de.jwiegmann.skiptrace.boundary.dto.record;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordListResponse {
    private String batchId;
    private int total;
    private List<RecordResultResponse> items;
}
