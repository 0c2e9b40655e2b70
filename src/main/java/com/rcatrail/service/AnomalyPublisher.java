package com.rcatrail.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcatrail.config.RcaTrailProperties;
import com.rcatrail.model.AnomalyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes what a batch could not use.
 *
 *   anomaly reports     → rcatrail.anomalies (keyed by batch id)
 *   unparseable batches → rcatrail.batches.rejected
 *
 * Publishing is best effort: a failure is logged and never fails the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnomalyPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final RcaTrailProperties properties;

    public void publishAnomalies(String batchId, AnomalyReport report) {
        if (report == null || report.isEmpty()) {
            return;
        }
        try {
            Map<String, Object> message = new HashMap<>();
            message.put("batchId", batchId);
            message.put("report", report);
            message.put("timestamp", System.currentTimeMillis());

            kafkaTemplate.send(properties.getTopics().getAnomalies(), batchId,
                    objectMapper.writeValueAsString(message));
            log.info("Anomaly report published: batchId={}, anomalies={}", batchId, report.getTotalCount());
        } catch (Exception e) {
            log.error("Failed to publish anomaly report for batch {}: {}", batchId, e.getMessage(), e);
        }
    }

    public void publishRejected(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> message = new HashMap<>();
            message.put("rawMessage", rawMessage);
            message.put("error", errorMessage);
            message.put("timestamp", System.currentTimeMillis());

            kafkaTemplate.send(properties.getTopics().getRejected(), objectMapper.writeValueAsString(message));
            log.info("Rejected batch message forwarded: error={}", errorMessage);
        } catch (Exception e) {
            log.error("Failed to forward rejected batch message: {}", e.getMessage(), e);
        }
    }
}
