package com.rcatrail.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcatrail.model.AuditEventEntity;
import com.rcatrail.model.EtlWatermark;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.InputChangeRecord;
import com.rcatrail.model.SourceKind;
import com.rcatrail.repository.AuditEventRepository;
import com.rcatrail.repository.EtlWatermarkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps between domain {@link Event}s and the reporting schema.
 *
 * FLOW (persistBatch):
 *   normalized events → record keys → drop keys already stored
 *                                          ↓
 *                              saveAll(new rows) in one transaction
 *                                          ↓
 *                     advance the watermark of every source feed touched
 *
 * A batch that is loaded twice stores nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditEventStore {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
    private static final int KEY_LOOKUP_CHUNK = 1000;

    private final AuditEventRepository eventRepository;
    private final EtlWatermarkRepository watermarkRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Stores the events that are not stored yet and advances the watermarks.
     *
     * @return number of rows actually inserted
     */
    @Transactional
    public int persistBatch(String batchId, Collection<Event> events) {
        Map<String, Event> byKey = new LinkedHashMap<>();
        for (Event event : events) {
            byKey.putIfAbsent(event.getRecordKey(), event);
        }
        Set<String> existing = existingKeys(byKey.keySet());

        List<AuditEventEntity> rows = new ArrayList<>();
        Map<SourceKind, List<Event>> storedBySource = new EnumMap<>(SourceKind.class);
        byKey.forEach((key, event) -> {
            if (!existing.contains(key)) {
                rows.add(toEntity(key, event, batchId));
                storedBySource.computeIfAbsent(event.getSource(), k -> new ArrayList<>()).add(event);
            }
        });
        eventRepository.saveAll(rows);

        Instant now = clock.instant();
        storedBySource.forEach((source, stored) -> advanceWatermark(source, stored, batchId, now));

        log.info("Stored batch {}: {} new events, {} already present", batchId, rows.size(), existing.size());
        return rows.size();
    }

    @Transactional(readOnly = true)
    public List<Event> eventsForScenario(String scenarioId) {
        return toEvents(eventRepository.findByScenarioId(scenarioId));
    }

    @Transactional(readOnly = true)
    public List<Event> eventsForActor(String actor, Instant from, Instant to) {
        return toEvents(eventRepository.findByActorAndEventTimestampBetween(actor, from, to));
    }

    @Transactional(readOnly = true)
    public List<Event> eventsBetween(Instant from, Instant to) {
        return toEvents(eventRepository.findByEventTimestampBetween(from, to));
    }

    /**
     * Latest stored change of a node strictly before the given instant, so that a
     * batch re-loading its own rows is sequenced exactly as the first time.
     */
    @Transactional(readOnly = true)
    public Optional<InputChangeRecord> latestInputChangeBefore(String scenarioId, String nodeId, Instant before) {
        return eventRepository
                .findFirstByScenarioIdAndEventTypeAndNodeIdAndEventTimestampBeforeOrderByEventTimestampDescSequenceHintDesc(
                        scenarioId, EventType.INPUT_CHANGE.getWireName(), nodeId, before)
                .map(this::toEvent)
                .map(InputChangeRecord::fromEvent);
    }

    @Transactional(readOnly = true)
    public Optional<String> scenarioOfRun(String runId) {
        return eventRepository.findFirstByRunId(runId).map(AuditEventEntity::getScenarioId);
    }

    private Set<String> existingKeys(Collection<String> keys) {
        Set<String> found = new HashSet<>();
        List<String> chunk = new ArrayList<>(KEY_LOOKUP_CHUNK);
        for (String key : keys) {
            chunk.add(key);
            if (chunk.size() == KEY_LOOKUP_CHUNK) {
                found.addAll(eventRepository.findExistingRecordKeys(chunk));
                chunk = new ArrayList<>(KEY_LOOKUP_CHUNK);
            }
        }
        if (!chunk.isEmpty()) {
            found.addAll(eventRepository.findExistingRecordKeys(chunk));
        }
        return found;
    }

    private void advanceWatermark(SourceKind source, List<Event> stored, String batchId, Instant now) {
        String name = source.name().toLowerCase(Locale.ROOT);
        EtlWatermark watermark = watermarkRepository.findById(name)
                .orElseGet(() -> EtlWatermark.builder().sourceName(name).build());

        Instant newest = stored.stream().map(Event::getTimestamp).max(Instant::compareTo).orElse(null);
        if (newest != null && (watermark.getLastLoadedAt() == null || newest.isAfter(watermark.getLastLoadedAt()))) {
            watermark.setLastLoadedAt(newest);
        }
        watermark.setRowsLoaded(watermark.getRowsLoaded() + stored.size());
        watermark.setLastRunCompleted(now);
        watermark.setStatus(EtlWatermark.STATUS_SUCCESS);
        watermark.setLastBatchId(batchId);
        watermarkRepository.save(watermark);
        log.debug("Watermark {} now at {}", name, watermark.getLastLoadedAt());
    }

    private AuditEventEntity toEntity(String key, Event event, String batchId) {
        return AuditEventEntity.builder()
                .recordKey(key)
                .scenarioId(event.getScenarioId())
                .eventType(event.getEventType().getWireName())
                .eventTimestamp(event.getTimestamp())
                .actor(event.getActor())
                .correlationId(event.getCorrelationId())
                .runId(event.getRunId())
                .nodeId(event.getNodeId())
                .sequenceHint(event.getSequenceHint())
                .payload(writePayload(event))
                .sourceBatchId(batchId)
                .loadedAt(clock.instant())
                .build();
    }

    private List<Event> toEvents(List<AuditEventEntity> rows) {
        return rows.stream().map(this::toEvent).toList();
    }

    private Event toEvent(AuditEventEntity row) {
        return Event.builder()
                .scenarioId(row.getScenarioId())
                .timestamp(row.getEventTimestamp())
                .eventType(EventType.fromWireName(row.getEventType()))
                .actor(row.getActor())
                .correlationId(row.getCorrelationId())
                .runId(row.getRunId())
                .nodeId(row.getNodeId())
                .sequenceHint(row.getSequenceHint())
                .payload(readPayload(row))
                .build();
    }

    private String writePayload(Event event) {
        try {
            return objectMapper.writeValueAsString(event.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize payload of " + event.getIdentity().asKey(), e);
        }
    }

    private Map<String, Object> readPayload(AuditEventEntity row) {
        try {
            return objectMapper.readValue(row.getPayload(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payload on stored event " + row.getRecordKey(), e);
        }
    }
}
