package com.di.scorenova.controller.dto;

import com.di.scorenova.pipeline.InputRecord;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST request body for {@code POST /api/scoring/batches}.
 *
 * <pre>{@code
 * { "records": [ { "equipmentId": "EQ0001", "timestamp": "2024-01-01T00:00:00Z",
 *                  "temperature": 71.5, "vibration": 0.4 } ] }
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBatchRequest {

    /** Raw records; numeric entries other than equipmentId/timestamp become fields. */
    @NotEmpty
    private List<Map<String, Object>> records;

    public List<InputRecord> toInputRecords() {
        return records.stream().map(InputRecord::fromMap).collect(Collectors.toList());
    }
}
