package com.rcatrail.repository;

import com.rcatrail.model.AuditEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and write access to stored audit events.
 *
 * Rows come back in storage order; callers that need the timeline order run
 * them through the timeline merger.
 */
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, UUID> {

    List<AuditEventEntity> findByScenarioId(String scenarioId);

    // User journey: one actor's events in a time range
    List<AuditEventEntity> findByActorAndEventTimestampBetween(String actor, Instant from, Instant to);

    // Insights: every event in a time range
    List<AuditEventEntity> findByEventTimestampBetween(Instant from, Instant to);

    // Logs without a scenario id are attributed through the run they name
    Optional<AuditEventEntity> findFirstByRunId(String runId);

    // Sequencing of input changes continues from the node's last stored version
    Optional<AuditEventEntity> findFirstByScenarioIdAndEventTypeAndNodeIdAndEventTimestampBeforeOrderByEventTimestampDescSequenceHintDesc(
            String scenarioId, String eventType, String nodeId, Instant before);

    @Query("select e.recordKey from AuditEventEntity e where e.recordKey in :keys")
    List<String> findExistingRecordKeys(@Param("keys") Collection<String> keys);
}
