package com.rcatrail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcatrail.dto.SourceBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for extraction batches on the "rcatrail.batches" topic.
 *
 * FLOW:
 *   ETL orchestrator publishes a batch → Kafka topic "rcatrail.batches"
 *                                            ↓
 *                                  BatchListener reads it
 *                                            ↓
 *                                  JSON → SourceBatch
 *                                            ↓
 *                                  BatchProcessor.process()
 *
 * Messages that are not a valid batch are forwarded to the rejected topic.
 * A batch that fails while processing is rethrown so the container's error
 * handling redelivers it; reprocessing from scratch is safe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchListener {

    private final BatchProcessor batchProcessor;
    private final ObjectMapper objectMapper;
    private final AnomalyPublisher anomalyPublisher;

    @KafkaListener(topics = "${rcatrail.topics.batches:rcatrail.batches}", groupId = "rcatrail-batch-processor")
    public void onBatch(String message) {
        SourceBatch batch;
        try {
            batch = objectMapper.readValue(message, SourceBatch.class);
        } catch (JsonProcessingException e) {
            log.error("Unparseable batch message: {}", e.getOriginalMessage());
            anomalyPublisher.publishRejected(message, e.getOriginalMessage());
            return;
        }
        if (batch.getBatchId() == null || batch.getBatchId().isBlank()) {
            log.error("Batch message without batchId rejected");
            anomalyPublisher.publishRejected(message, "batchId is required");
            return;
        }
        batchProcessor.process(batch);
    }
}
