package com.rcatrail.service;

import com.rcatrail.config.RcaTrailProperties;
import com.rcatrail.dto.AuditTrailResponse;
import com.rcatrail.exception.ScenarioNotFoundException;
import com.rcatrail.model.DailySuccessRate;
import com.rcatrail.model.ErrorSummary;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.InputChangeRecord;
import com.rcatrail.model.RankedCount;
import com.rcatrail.model.Run;
import com.rcatrail.model.RunComparison;
import com.rcatrail.model.Session;
import com.rcatrail.model.Timeline;
import com.rcatrail.model.UserVelocity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/**
 * Read side of the service: loads stored events and hands them to the engines.
 *
 * Every view is recomputed per request from the stored canonical events; nothing
 * derived is cached or written back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RcaQueryService {

    static final int DEFAULT_SESSION_DAYS = 7;

    private final AuditEventStore store;
    private final TimelineMerger merger;
    private final RunAssembler runAssembler;
    private final RunContextDiffer differ;
    private final SessionGrouper sessionGrouper;
    private final MetricsAggregator aggregator;
    private final RcaTrailProperties properties;
    private final Clock clock;

    /**
     * Merged timeline of a scenario, optionally restricted to an inclusive UTC
     * date range and a set of event types.
     *
     * @throws ScenarioNotFoundException if nothing was ever stored for the scenario
     */
    public AuditTrailResponse auditTrail(String scenarioId, LocalDate start, LocalDate end, Set<EventType> types) {
        Timeline timeline = merger.merge(scenarioId, scenarioEvents(scenarioId));
        List<Event> events = timeline.getEvents().stream()
                .filter(e -> start == null || !utcDay(e).isBefore(start))
                .filter(e -> end == null || !utcDay(e).isAfter(end))
                .filter(e -> types == null || types.isEmpty() || types.contains(e.getEventType()))
                .toList();
        return AuditTrailResponse.builder()
                .scenarioId(scenarioId)
                .eventCount(events.size())
                .events(events)
                .build();
    }

    public List<Run> runs(String scenarioId) {
        return runAssembler.assemble(scenarioId, scenarioEvents(scenarioId));
    }

    public RunComparison runContext(String scenarioId, String runId) {
        List<Event> events = scenarioEvents(scenarioId);
        return differ.diff(scenarioId, runAssembler.assemble(scenarioId, events), inputChanges(events), runId);
    }

    public RunComparison compareRuns(String scenarioId, String firstRunId, String secondRunId) {
        List<Event> events = scenarioEvents(scenarioId);
        return differ.compare(scenarioId, runAssembler.assemble(scenarioId, events), inputChanges(events),
                firstRunId, secondRunId);
    }

    public ErrorSummary errorSummary(String scenarioId) {
        return aggregator.errorSummary(scenarioId, scenarioEvents(scenarioId), properties.getMetrics().getTopN());
    }

    /**
     * Sessions of one user between two UTC dates (inclusive). Defaults to the last
     * seven days and the configured inactivity threshold.
     */
    public List<Session> sessions(String userId, LocalDate start, LocalDate end, Integer gapMinutes) {
        LocalDate to = end != null ? end : LocalDate.now(clock);
        LocalDate from = start != null ? start : to.minusDays(DEFAULT_SESSION_DAYS);
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("start " + from + " is after end " + to);
        }
        Duration threshold = gapMinutes != null
                ? Duration.ofMinutes(gapMinutes)
                : properties.getSession().getInactivityThreshold();

        List<Event> events = store.eventsForActor(userId,
                from.atStartOfDay(ZoneOffset.UTC).toInstant(),
                to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1));
        return sessionGrouper.groupByUser(events, threshold).getOrDefault(userId, List.of());
    }

    public UserVelocity velocity(String userId, Integer days) {
        int window = days != null ? days : properties.getMetrics().getVelocityWindowDays();
        Instant now = clock.instant();
        List<Event> events = store.eventsForActor(userId, now.minus(Duration.ofDays(window)), now);
        return aggregator.rollup(events).velocity(userId, window);
    }

    public List<RankedCount> topErrorCategories(Integer days, Integer limit) {
        return recentRollup(days).topErrorCategories(limitOrDefault(limit));
    }

    public List<RankedCount> topFailingNodes(Integer days, Integer limit) {
        return recentRollup(days).topFailingNodes(limitOrDefault(limit));
    }

    public List<DailySuccessRate> successRate(Integer days) {
        return recentRollup(days).dailySuccessRate();
    }

    private MetricsRollup recentRollup(Integer days) {
        int window = days != null ? days : properties.getMetrics().getVelocityWindowDays();
        if (window <= 0) {
            throw new IllegalArgumentException("days must be positive: " + window);
        }
        Instant now = clock.instant();
        List<Event> events = store.eventsBetween(now.minus(Duration.ofDays(window)), now);
        log.debug("Insights over {} days: {} events", window, events.size());
        return aggregator.rollup(events);
    }

    private int limitOrDefault(Integer limit) {
        return limit != null ? limit : properties.getMetrics().getTopN();
    }

    private List<Event> scenarioEvents(String scenarioId) {
        List<Event> events = store.eventsForScenario(scenarioId);
        if (events.isEmpty()) {
            throw new ScenarioNotFoundException(scenarioId);
        }
        return events;
    }

    private static List<InputChangeRecord> inputChanges(List<Event> events) {
        return events.stream()
                .filter(e -> e.getEventType() == EventType.INPUT_CHANGE)
                .map(InputChangeRecord::fromEvent)
                .toList();
    }

    private static LocalDate utcDay(Event event) {
        return LocalDate.ofInstant(event.getTimestamp(), ZoneOffset.UTC);
    }
}
