package com.rcatrail.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One normalized event as stored in the reporting schema.
 *
 * recordKey is the digest of the event's full content; its unique index makes a
 * re-loaded batch a no-op instead of a duplicate, while distinct records that share
 * scenario, type, timestamp and correlation id are all stored.
 *
 * Example row:
 *   scenario_id     = "7d0c..."
 *   event_type      = "run_failed"
 *   event_timestamp = 2026-02-11T10:32:00Z
 *   run_id          = "R1"
 *   payload         = {"run_status":"timeout","duration_seconds":120}
 */
@Entity
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_events_scenario_ts", columnList = "scenario_id, event_timestamp"),
    @Index(name = "idx_audit_events_actor_ts", columnList = "actor, event_timestamp"),
    @Index(name = "idx_audit_events_node_ts", columnList = "scenario_id, node_id, event_timestamp")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AuditEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "record_key", nullable = false, unique = true, length = 32)
    private String recordKey;

    @Column(name = "scenario_id", nullable = false)
    private String scenarioId;

    @Column(name = "event_type", nullable = false, length = 32)
    private String eventType;

    @Column(name = "event_timestamp", nullable = false)
    private Instant eventTimestamp;

    private String actor;

    @Column(name = "correlation_id")
    private String correlationId;

    @Column(name = "run_id")
    private String runId;

    @Column(name = "node_id")
    private String nodeId;

    @Column(name = "sequence_hint")
    private Long sequenceHint;

    /** Event payload as a JSON object. */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "source_batch_id")
    private String sourceBatchId;

    @Column(name = "loaded_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant loadedAt = Instant.now();
}
