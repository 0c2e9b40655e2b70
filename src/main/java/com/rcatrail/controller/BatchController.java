package com.rcatrail.controller;

import com.rcatrail.dto.SourceBatch;
import com.rcatrail.model.BatchReport;
import com.rcatrail.service.BatchProcessor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Submits a batch over HTTP instead of Kafka. The batch is processed before the
 * response is sent; the body is the batch report.
 *
 * POST /api/v1/rca/batches
 * {
 *   "batchId": "etl-2026-02-11T10:15",
 *   "runs": [ {"runId": "R1", "scenarioId": "s-1", "startedAt": "2026-02-11T10:30:00Z", "status": "running"} ]
 * }
 */
@RestController
@RequestMapping("/api/v1/rca/batches")
@RequiredArgsConstructor
public class BatchController {

    private final BatchProcessor batchProcessor;

    @PostMapping
    public ResponseEntity<BatchReport> submitBatch(@Valid @RequestBody SourceBatch batch) {
        return ResponseEntity.accepted().body(batchProcessor.process(batch));
    }
}
