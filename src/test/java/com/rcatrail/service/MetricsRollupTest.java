package com.rcatrail.service;

import com.rcatrail.dto.LogRecord;
import com.rcatrail.dto.RunRecord;
import com.rcatrail.dto.UserActionRecord;
import com.rcatrail.model.DailySuccessRate;
import com.rcatrail.model.Event;
import com.rcatrail.model.RankedCount;
import com.rcatrail.model.UserVelocity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsRollup: the queries, and that combining shard rollups gives
 * the same result as a single pass.
 */
class MetricsRollupTest {

    private EventNormalizer normalizer;
    private List<Event> events;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(new ErrorCategorizer());
        events = new ArrayList<>();

        events.addAll(run("R1", "2026-02-10T10:00:00Z", "2026-02-10T10:05:00Z", "success", null));
        events.addAll(run("R2", "2026-02-10T11:00:00Z", "2026-02-10T11:02:00Z", "failed", "n-1"));
        events.addAll(run("R3", "2026-02-11T09:00:00Z", "2026-02-11T09:30:00Z", "timeout", "n-2"));
        events.addAll(run("R4", "2026-02-11T12:00:00Z", "2026-02-11T12:10:00Z", "success", null));
        events.addAll(run("R5", "2026-02-11T13:00:00Z", null, "running", null));

        events.addAll(log("2026-02-10T11:01:00Z", "ERROR", "Deadlock on table inputs", "n-1"));
        events.addAll(log("2026-02-10T11:01:30Z", "ERROR", "SQL connection refused", "n-1"));
        events.addAll(log("2026-02-11T09:29:00Z", "ERROR", "Node calculation timed out", "n-2"));
        events.addAll(log("2026-02-11T09:29:30Z", "WARN", "Invalid input, using default", "n-3"));
        events.addAll(log("2026-02-11T09:29:40Z", "INFO", "Validation passed", null));

        events.addAll(action("jane", "s-1", "2026-02-10T09:00:00Z", "edit_input"));
        events.addAll(action("jane", "s-1", "2026-02-10T09:10:00Z", "edit_input"));
        events.addAll(action("jane", "s-2", "2026-02-11T09:00:00Z", "submit"));
        events.addAll(action("jane", "s-2", "2026-02-11T09:05:00Z", "run"));
        events.addAll(action("bob", "s-1", "2026-02-11T09:05:00Z", "view"));
    }

    private List<Event> run(String id, String start, String end, String status, String node) {
        return normalizer.normalize(RunRecord.builder()
                .runId(id).scenarioId("s-1").startedAt(start).endedAt(end).status(status).nodeId(node)
                .build());
    }

    private List<Event> log(String at, String severity, String message, String node) {
        return normalizer.normalize(LogRecord.builder()
                .scenarioId("s-1").timestamp(at).severity(severity).message(message).nodeId(node)
                .build());
    }

    private List<Event> action(String user, String scenario, String at, String type) {
        return normalizer.normalize(UserActionRecord.builder()
                .userId(user).scenarioId(scenario).actionTimestamp(at).actionType(type)
                .build());
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        private MetricsRollup rollup;

        @BeforeEach
        void rollUp() {
            rollup = MetricsRollup.of(events);
        }

        @Test
        @DisplayName("top error categories count ERROR logs only, ties by name")
        void topErrorCategories() {
            assertEquals(List.of(new RankedCount("database", 2), new RankedCount("timeout", 1)),
                    rollup.topErrorCategories(10));
            assertEquals(1, rollup.topErrorCategories(1).size());
        }

        @Test
        @DisplayName("failing nodes count ERROR logs and failed runs")
        void topFailingNodes() {
            assertEquals(List.of(new RankedCount("n-1", 3), new RankedCount("n-2", 2)),
                    rollup.topFailingNodes(10));
        }

        @Test
        @DisplayName("daily success rate over finished runs")
        void dailySuccessRate() {
            List<DailySuccessRate> series = rollup.dailySuccessRate();

            assertEquals(2, series.size());
            assertEquals(LocalDate.parse("2026-02-10"), series.get(0).getDay());
            assertEquals(0.5, series.get(0).getRate());
            assertEquals(1, series.get(1).getSuccessfulRuns());
            assertEquals(2, series.get(1).getFinishedRuns());
            assertEquals(5, rollup.totalOutcomes().getStarted());
        }

        @Test
        @DisplayName("velocity of one user over the window")
        void velocity() {
            UserVelocity velocity = rollup.velocity("jane", 7);

            assertEquals(4, velocity.getTotalActions());
            assertEquals(0.57, velocity.getActionsPerDay());
            assertEquals(2, velocity.getScenariosTouched());
            assertEquals(2, velocity.getActiveDays());
            assertEquals("edit_input", velocity.getMostFrequentAction());
            assertEquals(Map.of("edit_input", 2L, "submit", 1L, "run", 1L), velocity.getActionTypeDistribution());
        }

        @Test
        @DisplayName("most frequent action ties go to the alphabetically first type")
        void velocity_tieBreak() {
            MetricsRollup tied = MetricsRollup.of(events.subList(events.size() - 3, events.size() - 1));

            assertEquals("run", tied.velocity("jane", 1).getMostFrequentAction());
        }

        @Test
        @DisplayName("unknown user has zero velocity")
        void velocity_unknownUser() {
            UserVelocity velocity = rollup.velocity("nobody", 30);

            assertEquals(0, velocity.getTotalActions());
            assertNull(velocity.getMostFrequentAction());
        }
    }

    @Nested
    @DisplayName("Combining partial rollups")
    class CombineTests {

        @Test
        @DisplayName("sharded rollups sum to the full-pass rollup")
        void shards_equalFullPass() {
            List<Event> firstDay = events.stream()
                    .filter(e -> e.getTimestamp().isBefore(Instant.parse("2026-02-11T00:00:00Z")))
                    .toList();
            List<Event> secondDay = events.stream()
                    .filter(e -> !firstDay.contains(e))
                    .toList();

            MetricsRollup full = MetricsRollup.of(events);

            assertEquals(full, MetricsRollup.of(firstDay).plus(MetricsRollup.of(secondDay)));
            assertEquals(full, MetricsRollup.of(secondDay).plus(MetricsRollup.of(firstDay)));
        }

        @Test
        @DisplayName("empty is the identity and plus is associative")
        void monoidLaws() {
            MetricsRollup a = MetricsRollup.of(events.subList(0, 6));
            MetricsRollup b = MetricsRollup.of(events.subList(6, 14));
            MetricsRollup c = MetricsRollup.of(events.subList(14, events.size()));

            assertEquals(a, a.plus(MetricsRollup.empty()));
            assertEquals(a, MetricsRollup.empty().plus(a));
            assertEquals(a.plus(b).plus(c), a.plus(b.plus(c)));
        }
    }
}
