package com.rcatrail.service;

import com.rcatrail.dto.InputChangeRow;
import com.rcatrail.dto.LogRecord;
import com.rcatrail.dto.RunRecord;
import com.rcatrail.dto.ScenarioRecord;
import com.rcatrail.dto.SourceRecord;
import com.rcatrail.dto.UserActionRecord;
import com.rcatrail.exception.MalformedRecordException;
import com.rcatrail.model.ErrorCategory;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.HashTransition;
import com.rcatrail.model.PayloadKeys;
import com.rcatrail.model.RunStatus;
import com.rcatrail.model.Severity;
import com.rcatrail.model.SourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns one source row into canonical {@link Event}s.
 *
 * Per source kind:
 *   SCENARIO      → one state_change per lifecycle field present
 *   INPUT_CHANGE  → one input_change
 *   RUN           → run_started, plus run_completed / run_failed once endedAt is set
 *   LOG           → one log_entry, categorized by {@link ErrorCategorizer}
 *   USER_ACTION   → one user_action
 *
 * Normalization is a pure function of the row: the same row always yields events
 * with the same identity key, so re-running a batch is idempotent.
 *
 * Rows without a scenario id or without a resolvable timestamp are rejected with
 * {@link MalformedRecordException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventNormalizer {

    static final int MAX_MESSAGE_LENGTH = 500;

    private final ErrorCategorizer errorCategorizer;

    /**
     * Normalize a row whose kind is given by the caller.
     *
     * @throws MalformedRecordException if the row is unusable or does not match the kind
     */
    public List<Event> normalize(SourceKind kind, SourceRecord record) {
        if (record == null) {
            throw new MalformedRecordException(kind, null, "Record is null");
        }
        if (record.sourceKind() != kind) {
            throw new MalformedRecordException(kind, record.recordRef(),
                    "Record of kind " + record.sourceKind() + " tagged as " + kind);
        }
        return switch (kind) {
            case SCENARIO -> normalizeScenario((ScenarioRecord) record);
            case INPUT_CHANGE -> List.of(normalizeInputChange((InputChangeRow) record));
            case RUN -> normalizeRun((RunRecord) record);
            case LOG -> List.of(normalizeLog((LogRecord) record));
            case USER_ACTION -> List.of(normalizeUserAction((UserActionRecord) record));
        };
    }

    public List<Event> normalize(SourceRecord record) {
        return normalize(record == null ? null : record.sourceKind(), record);
    }

    // --- Scenario lifecycle ---

    /**
     * Lifecycle fields in their required order; withdrawn and deleted are terminal
     * alternatives that may follow any of them.
     */
    private enum Transition {
        CREATED(true),
        SUBMITTED(true),
        LOCKED(true),
        WITHDRAWN(false),
        DELETED(false);

        private final boolean ordered;

        Transition(boolean ordered) {
            this.ordered = ordered;
        }

        String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        String fieldName() {
            return switch (this) {
                case CREATED -> "created_at";
                case SUBMITTED -> "submitted_at";
                case LOCKED -> "locked_at";
                case WITHDRAWN -> "withdraw_at";
                case DELETED -> "delete_at";
            };
        }
    }

    private List<Event> normalizeScenario(ScenarioRecord row) {
        String scenarioId = requireScenarioId(SourceKind.SCENARIO, row.getScenarioId(), row.recordRef());

        Map<Transition, Instant> times = new LinkedHashMap<>();
        putIfPresent(times, Transition.CREATED, row.getCreatedAt(), row);
        putIfPresent(times, Transition.SUBMITTED, row.getSubmittedAt(), row);
        putIfPresent(times, Transition.LOCKED, row.getLockedAt(), row);
        putIfPresent(times, Transition.WITHDRAWN, row.getWithdrawAt(), row);
        putIfPresent(times, Transition.DELETED, row.getDeleteAt(), row);

        if (times.isEmpty()) {
            throw new MalformedRecordException(SourceKind.SCENARIO, scenarioId,
                    "Scenario row has no lifecycle timestamp");
        }

        List<String> violations = lifecycleViolations(times);
        if (!violations.isEmpty()) {
            log.warn("Out-of-order lifecycle for scenario {}: {}", scenarioId, violations);
        }

        List<Event> events = new ArrayList<>(times.size());
        for (Map.Entry<Transition, Instant> entry : times.entrySet()) {
            Transition transition = entry.getKey();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.TRANSITION_TYPE, transition.wireName());
            payload.put(PayloadKeys.PREVIOUS_STATUS, previousStatus(transition, row.getStatus()));
            payload.put(PayloadKeys.NEW_STATUS, newStatus(transition));
            if (!violations.isEmpty()) {
                payload.put(PayloadKeys.LIFECYCLE_ANOMALY, true);
                payload.put(PayloadKeys.ANOMALY_DETAIL, String.join("; ", violations));
            }

            events.add(Event.builder()
                    .scenarioId(scenarioId)
                    .timestamp(entry.getValue())
                    .eventType(EventType.STATE_CHANGE)
                    .actor(actorFor(transition, row))
                    .correlationId(requestIdFor(transition, row))
                    .sequenceHint((long) transition.ordinal() + 1)
                    .payload(payload)
                    .build());
        }
        return events;
    }

    private void putIfPresent(Map<Transition, Instant> times, Transition transition, String raw, ScenarioRecord row) {
        Instant parsed = parseTimestamp(SourceKind.SCENARIO, raw, row.recordRef(), transition.fieldName());
        if (parsed != null) {
            times.put(transition, parsed);
        }
    }

    /**
     * Every pair among created/submitted/locked that runs backwards, and every
     * terminal transition that precedes creation. Equal timestamps are fine.
     */
    private List<String> lifecycleViolations(Map<Transition, Instant> times) {
        List<String> violations = new ArrayList<>();
        List<Transition> ordered = new ArrayList<>();
        for (Transition t : times.keySet()) {
            if (t.ordered) {
                ordered.add(t);
            }
        }
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                Transition earlier = ordered.get(i);
                Transition later = ordered.get(j);
                if (times.get(later).isBefore(times.get(earlier))) {
                    violations.add(later.fieldName() + " precedes " + earlier.fieldName());
                }
            }
        }
        Instant created = times.get(Transition.CREATED);
        if (created != null) {
            for (Transition terminal : List.of(Transition.WITHDRAWN, Transition.DELETED)) {
                Instant at = times.get(terminal);
                if (at != null && at.isBefore(created)) {
                    violations.add(terminal.fieldName() + " precedes " + Transition.CREATED.fieldName());
                }
            }
        }
        return violations;
    }

    private String previousStatus(Transition transition, String currentStatus) {
        return switch (transition) {
            case CREATED -> null;
            case SUBMITTED -> "draft";
            case LOCKED -> "submitted";
            case WITHDRAWN -> currentStatus == null || "withdrawn".equals(currentStatus) ? "submitted" : currentStatus;
            case DELETED -> currentStatus == null || "deleted".equals(currentStatus) ? "draft" : currentStatus;
        };
    }

    private String newStatus(Transition transition) {
        return switch (transition) {
            case CREATED -> "draft";
            case SUBMITTED -> "submitted";
            case LOCKED -> "locked";
            case WITHDRAWN -> "withdrawn";
            case DELETED -> "deleted";
        };
    }

    private String actorFor(Transition transition, ScenarioRecord row) {
        return switch (transition) {
            case CREATED -> row.getCreatedBy();
            case SUBMITTED -> row.getSubmittedBy();
            case LOCKED -> row.getLockedBy();
            case WITHDRAWN -> row.getWithdrawBy();
            case DELETED -> row.getDeleteBy();
        };
    }

    private String requestIdFor(Transition transition, ScenarioRecord row) {
        return switch (transition) {
            case CREATED -> row.getCreatedReqId();
            case SUBMITTED -> row.getSubmittedReqId();
            case LOCKED -> row.getLockedReqId();
            case WITHDRAWN -> row.getWithdrawReqId();
            case DELETED -> row.getDeleteReqId();
        };
    }

    // --- Input changes ---

    private Event normalizeInputChange(InputChangeRow row) {
        String ref = row.recordRef();
        String scenarioId = requireScenarioId(SourceKind.INPUT_CHANGE, row.getScenarioId(), ref);
        Instant changedAt = requireTimestamp(SourceKind.INPUT_CHANGE, row.getChangedAt(), ref, "changed_at");
        if (row.getNodeId() == null || row.getNodeId().isBlank()) {
            throw new MalformedRecordException(SourceKind.INPUT_CHANGE, ref, "Input change has no node id");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.PREVIOUS_HASH, row.getPreviousHash());
        payload.put(PayloadKeys.NEW_HASH, row.getInputHash());
        payload.put(PayloadKeys.CHANGE_KIND, HashTransition.classify(row.getPreviousHash(), row.getInputHash()).name());
        payload.put(PayloadKeys.CHANGE_SEQUENCE, row.getChangeSequence());

        return Event.builder()
                .scenarioId(scenarioId)
                .timestamp(changedAt)
                .eventType(EventType.INPUT_CHANGE)
                .actor(row.getChangedBy())
                .correlationId(row.getCorrelationId())
                .nodeId(row.getNodeId())
                .sequenceHint(row.getChangeSequence())
                .payload(payload)
                .build();
    }

    // --- Runs ---

    private List<Event> normalizeRun(RunRecord row) {
        String ref = row.recordRef();
        String scenarioId = requireScenarioId(SourceKind.RUN, row.getScenarioId(), ref);
        if (row.getRunId() == null || row.getRunId().isBlank()) {
            throw new MalformedRecordException(SourceKind.RUN, ref, "Run row has no run id");
        }
        Instant startedAt = requireTimestamp(SourceKind.RUN, row.getStartedAt(), ref, "started_at");
        Instant endedAt = parseTimestamp(SourceKind.RUN, row.getEndedAt(), ref, "ended_at");

        RunStatus status;
        try {
            status = RunStatus.parse(row.getStatus());
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(SourceKind.RUN, ref, "Unknown run status: " + row.getStatus(), e);
        }
        String correlationId = row.getCorrelationId() != null ? row.getCorrelationId() : row.getRunId();

        List<Event> events = new ArrayList<>(2);

        Map<String, Object> started = new LinkedHashMap<>();
        started.put(PayloadKeys.RUN_STATUS, status.wireName());
        events.add(Event.builder()
                .scenarioId(scenarioId)
                .timestamp(startedAt)
                .eventType(EventType.RUN_STARTED)
                .actor(row.getRunBy())
                .correlationId(correlationId)
                .runId(row.getRunId())
                .payload(started)
                .build());

        if (endedAt == null) {
            return events;
        }
        if (status == RunStatus.RUNNING) {
            log.debug("Run {} has ended_at but status running; no terminal event", row.getRunId());
            return events;
        }

        Map<String, Object> finished = new LinkedHashMap<>();
        finished.put(PayloadKeys.RUN_STATUS, status.wireName());
        finished.put(PayloadKeys.DURATION_SECONDS, Duration.between(startedAt, endedAt).getSeconds());
        finished.put(PayloadKeys.FAIL_REASON, row.getFailReason());
        finished.put(PayloadKeys.NODE_FAILURE_COUNT, row.getNodeFailureCount());
        if (endedAt.isBefore(startedAt)) {
            finished.put(PayloadKeys.LIFECYCLE_ANOMALY, true);
            finished.put(PayloadKeys.ANOMALY_DETAIL, "ended_at precedes started_at");
        }

        events.add(Event.builder()
                .scenarioId(scenarioId)
                .timestamp(endedAt)
                .eventType(status == RunStatus.SUCCESS ? EventType.RUN_COMPLETED : EventType.RUN_FAILED)
                .actor(row.getRunBy())
                .correlationId(correlationId)
                .runId(row.getRunId())
                .nodeId(status.isFailure() ? row.getNodeId() : null)
                .payload(finished)
                .build());
        return events;
    }

    // --- Logs ---

    private Event normalizeLog(LogRecord row) {
        String ref = row.recordRef();
        String scenarioId = requireScenarioId(SourceKind.LOG, row.getScenarioId(), ref);
        Instant timestamp = requireTimestamp(SourceKind.LOG, row.getTimestamp(), ref, "timestamp");

        Severity severity = Severity.parse(row.getSeverity());
        String message = row.getMessage() == null ? "" : row.getMessage();
        ErrorCategory category = errorCategorizer.categorize(message);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.SEVERITY, severity.name());
        payload.put(PayloadKeys.MESSAGE, truncate(message));
        payload.put(PayloadKeys.ERROR_CATEGORY, category.wireName());
        payload.put(PayloadKeys.HAS_STACK_TRACE, row.isStackTrace());
        payload.put(PayloadKeys.LOG_STREAM, row.getLogStream());

        return Event.builder()
                .scenarioId(scenarioId)
                .timestamp(timestamp)
                .eventType(EventType.LOG_ENTRY)
                .actor(row.getUserId())
                .correlationId(row.getCorrelationId())
                .runId(row.getRunId())
                .nodeId(row.getNodeId())
                .payload(payload)
                .build();
    }

    private String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }

    // --- User actions ---

    private Event normalizeUserAction(UserActionRecord row) {
        String ref = row.recordRef();
        String scenarioId = requireScenarioId(SourceKind.USER_ACTION, row.getScenarioId(), ref);
        Instant timestamp = requireTimestamp(SourceKind.USER_ACTION, row.getActionTimestamp(), ref, "action_timestamp");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.ACTION_TYPE, row.getActionType());
        payload.put(PayloadKeys.ACTION_CATEGORY, row.getActionCategory());
        payload.put(PayloadKeys.TARGET_ENTITY_TYPE, row.getTargetEntityType());
        payload.put(PayloadKeys.TARGET_ENTITY_ID, row.getTargetEntityId());
        payload.put(PayloadKeys.SUCCESS, row.getSuccess() == null || row.getSuccess());
        // sorted so the payload does not depend on the source map's iteration order
        Map<String, Object> details = row.getDetails() == null
                ? Collections.emptyMap()
                : new TreeMap<>(row.getDetails());
        details.forEach(payload::putIfAbsent);

        return Event.builder()
                .scenarioId(scenarioId)
                .timestamp(timestamp)
                .eventType(EventType.USER_ACTION)
                .actor(row.getUserId())
                .correlationId(row.getCorrelationId())
                .payload(payload)
                .build();
    }

    // --- Shared validation ---

    private String requireScenarioId(SourceKind kind, String scenarioId, String ref) {
        if (scenarioId == null || scenarioId.isBlank()) {
            throw new MalformedRecordException(kind, ref, "Missing scenario_id");
        }
        return scenarioId;
    }

    private Instant requireTimestamp(SourceKind kind, String raw, String ref, String field) {
        Instant parsed = parseTimestamp(kind, raw, ref, field);
        if (parsed == null) {
            throw new MalformedRecordException(kind, ref, "Missing " + field);
        }
        return parsed;
    }

    private Instant parseTimestamp(SourceKind kind, String raw, String ref, String field) {
        try {
            return TimestampParser.parse(raw);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(kind, ref, "Unparseable " + field + ": '" + raw + "'", e);
        }
    }
}
