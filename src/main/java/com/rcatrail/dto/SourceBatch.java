package com.rcatrail.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The unit of work handed over by the orchestration layer: everything already
 * fetched for one extraction window.
 *
 * Example JSON:
 * {
 *   "batchId": "etl-2026-02-11T10:15",
 *   "scenarios":    [ { "scenarioId": "...", "createdAt": "..." } ],
 *   "userActions":  [ ... ],
 *   "inputChanges": [ ... ],
 *   "runs":         [ ... ],
 *   "logs":         [ ... ]
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SourceBatch {

    @NotBlank(message = "batchId is required")
    private String batchId;

    @Builder.Default
    private List<ScenarioRecord> scenarios = new ArrayList<>();
    @Builder.Default
    private List<UserActionRecord> userActions = new ArrayList<>();
    @Builder.Default
    private List<InputChangeRow> inputChanges = new ArrayList<>();
    @Builder.Default
    private List<RunRecord> runs = new ArrayList<>();
    @Builder.Default
    private List<LogRecord> logs = new ArrayList<>();

    public int recordCount() {
        return size(scenarios) + size(userActions) + size(inputChanges) + size(runs) + size(logs);
    }

    private static int size(List<?> rows) {
        return rows == null ? 0 : rows.size();
    }
}
