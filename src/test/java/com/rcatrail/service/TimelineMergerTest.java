package com.rcatrail.service;

import com.rcatrail.dto.InputChangeRow;
import com.rcatrail.dto.ScenarioRecord;
import com.rcatrail.model.AnomalyKind;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.PayloadKeys;
import com.rcatrail.model.Timeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TimelineMerger: ordering, tie-breaks, determinism and the handling of
 * events that cannot be placed.
 */
class TimelineMergerTest {

    private static final String SCENARIO = "s-1";

    private TimelineMerger merger;

    @BeforeEach
    void setUp() {
        merger = new TimelineMerger();
    }

    private static Event event(EventType type, String at, String correlationId) {
        return Event.builder()
                .scenarioId(SCENARIO)
                .timestamp(at == null ? null : Instant.parse(at))
                .eventType(type)
                .correlationId(correlationId)
                .build();
    }

    private static Event log(String at, String correlationId, String message) {
        return event(EventType.LOG_ENTRY, at, correlationId).toBuilder()
                .payload(Map.of("severity", "ERROR", "message", message))
                .build();
    }

    private static Event inputChange(String at, String node, long sequence) {
        return Event.builder()
                .scenarioId(SCENARIO)
                .timestamp(Instant.parse(at))
                .eventType(EventType.INPUT_CHANGE)
                .nodeId(node)
                .sequenceHint(sequence)
                .correlationId(node + "-" + sequence)
                .build();
    }

    private List<Event> sample() {
        return List.of(
                event(EventType.STATE_CHANGE, "2026-02-11T10:00:00Z", "req-1"),
                inputChange("2026-02-11T10:15:00Z", "X", 1),
                event(EventType.RUN_STARTED, "2026-02-11T10:30:00Z", "R1"),
                event(EventType.LOG_ENTRY, "2026-02-11T10:30:00Z", "R1"),
                event(EventType.RUN_FAILED, "2026-02-11T10:32:00Z", "R1"),
                inputChange("2026-02-11T10:40:00Z", "X", 2),
                event(EventType.USER_ACTION, "2026-02-11T10:50:00Z", "req-7"),
                event(EventType.RUN_STARTED, "2026-02-11T10:50:00Z", "R2"),
                event(EventType.RUN_COMPLETED, "2026-02-11T10:55:00Z", "R2"));
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("events come out by timestamp")
        void ordersByTimestamp() {
            List<Event> shuffled = new ArrayList<>(sample());
            Collections.reverse(shuffled);

            Timeline timeline = merger.merge(SCENARIO, shuffled);

            List<Event> events = timeline.getEvents();
            assertEquals(sample().size(), events.size());
            for (int i = 1; i < events.size(); i++) {
                assertFalse(events.get(i).getTimestamp().isBefore(events.get(i - 1).getTimestamp()));
            }
        }

        @Test
        @DisplayName("equal timestamps: higher-priority type first whatever the input order")
        void equalTimestamps_typePriority() {
            Event action = event(EventType.USER_ACTION, "2026-02-11T10:50:00Z", "a");
            Event started = event(EventType.RUN_STARTED, "2026-02-11T10:50:00Z", "z");
            Event state = event(EventType.STATE_CHANGE, "2026-02-11T10:50:00Z", "m");

            for (List<Event> input : List.of(List.of(action, started, state), List.of(state, action, started))) {
                List<Event> events = merger.merge(SCENARIO, input).getEvents();
                assertEquals(List.of(state, started, action), events);
            }
        }

        @Test
        @DisplayName("equal timestamps within one source: sequence hint decides")
        void equalTimestamps_sequenceHint() {
            Event second = inputChange("2026-02-11T10:15:00Z", "X", 2);
            Event first = inputChange("2026-02-11T10:15:00Z", "Y", 1);

            assertEquals(List.of(first, second), merger.merge(SCENARIO, List.of(second, first)).getEvents());
        }

        @Test
        @DisplayName("event repeated across sources is emitted once")
        void mergeSorted_dropsRepeatedEvent() {
            Event fromFirst = event(EventType.LOG_ENTRY, "2026-02-11T10:31:00Z", "c");
            Event fromSecond = event(EventType.LOG_ENTRY, "2026-02-11T10:31:00Z", "c");

            Timeline timeline = merger.mergeSorted(SCENARIO, List.of(List.of(fromFirst), List.of(fromSecond)));

            assertEquals(List.of(fromFirst), timeline.getEvents());
            assertEquals(1, timeline.getDuplicatesDropped());
        }

        @Test
        @DisplayName("log burst under one correlation id keeps every line, in the same order for any input order")
        void logBurst_keptAndOrderedByContent() {
            Event deadlock = log("2026-02-11T10:31:00Z", "R1", "deadlock detected");
            Event invalid = log("2026-02-11T10:31:00Z", "R1", "invalid input");

            List<Event> ab = merger.merge(SCENARIO, List.of(deadlock, invalid)).getEvents();
            List<Event> ba = merger.merge(SCENARIO, List.of(invalid, deadlock)).getEvents();
            List<Event> split = merger.mergeSorted(SCENARIO, List.of(List.of(invalid), List.of(deadlock))).getEvents();

            assertEquals(2, ab.size());
            assertEquals(ab, ba);
            assertEquals(ab, split);
        }

        @Test
        @DisplayName("nodes saved under one request at the same instant are all kept")
        void multiNodeSave_keepsEveryNode() {
            EventNormalizer normalizer = new EventNormalizer(new ErrorCategorizer());
            List<Event> events = new ArrayList<>();
            for (String node : List.of("X", "Y")) {
                events.addAll(normalizer.normalize(InputChangeRow.builder()
                        .scenarioId(SCENARIO).nodeId(node).changedAt("2026-02-11T10:15:00Z")
                        .inputHash("h-" + node).correlationId("req-1")
                        .build()));
            }

            Timeline timeline = merger.merge(SCENARIO, events);

            assertEquals(List.of("X", "Y"), timeline.getEvents().stream().map(Event::getNodeId).toList());
            assertEquals(0, timeline.getDuplicatesDropped());
        }

        @Test
        @DisplayName("lifecycle fields sharing one instant stay separate transitions")
        void sameInstantLifecycle_keepsEveryTransition() {
            EventNormalizer normalizer = new EventNormalizer(new ErrorCategorizer());
            List<Event> events = normalizer.normalize(ScenarioRecord.builder()
                    .scenarioId(SCENARIO).createdAt("2026-02-11T10:00:00Z").submittedAt("2026-02-11T10:00:00Z")
                    .build());

            Timeline timeline = merger.merge(SCENARIO, events);

            assertEquals(List.of("created", "submitted"), timeline.getEvents().stream()
                    .map(e -> e.payloadString(PayloadKeys.TRANSITION_TYPE)).toList());
        }

        @Test
        @DisplayName("unsorted source is rejected")
        void unsortedSource_isRejected() {
            List<Event> unsorted = List.of(
                    event(EventType.LOG_ENTRY, "2026-02-11T10:31:00Z", "a"),
                    event(EventType.LOG_ENTRY, "2026-02-11T10:30:00Z", "b"));

            assertThrows(IllegalArgumentException.class, () -> merger.mergeSorted(SCENARIO, List.of(unsorted)));
        }

        @Test
        @DisplayName("event of another scenario is rejected")
        void foreignScenario_isRejected() {
            Event foreign = event(EventType.LOG_ENTRY, "2026-02-11T10:31:00Z", "a").toBuilder()
                    .scenarioId("s-2")
                    .build();

            assertThrows(IllegalArgumentException.class, () -> merger.merge(SCENARIO, List.of(foreign)));
        }
    }

    @Test
    @DisplayName("merging any permutation gives the identical sequence")
    void merge_isDeterministic() {
        List<Event> expected = merger.merge(SCENARIO, sample()).getEvents();
        Random random = new Random(42);

        for (int i = 0; i < 20; i++) {
            List<Event> shuffled = new ArrayList<>(sample());
            Collections.shuffle(shuffled, random);
            assertEquals(expected, merger.merge(SCENARIO, shuffled).getEvents());
        }
    }

    @Test
    @DisplayName("events without timestamp are excluded and reported")
    void missingTimestamp_isReported() {
        List<Event> input = new ArrayList<>(sample());
        input.add(event(EventType.LOG_ENTRY, null, "lost"));

        Timeline timeline = merger.merge(SCENARIO, input);

        assertEquals(sample().size(), timeline.getEvents().size());
        assertEquals(1, timeline.getAnomalies().size());
        assertEquals(AnomalyKind.AMBIGUOUS_TIMESTAMP, timeline.getAnomalies().get(0).getKind());
        assertEquals("lost", timeline.getAnomalies().get(0).getRecordRef());
    }

    @Test
    @DisplayName("no events gives an empty timeline")
    void noEvents_emptyTimeline() {
        Timeline timeline = merger.merge(SCENARIO, List.of());

        assertTrue(timeline.getEvents().isEmpty());
        assertTrue(timeline.getAnomalies().isEmpty());
    }

    @Test
    @DisplayName("extending a timeline equals merging everything at once")
    void extend_matchesFullMerge() {
        List<Event> all = sample();
        Timeline initial = merger.merge(SCENARIO, all.subList(0, 5));
        List<Event> appendedRuns = List.of(all.get(7), all.get(8));
        List<Event> appendedOthers = List.of(all.get(5), all.get(6));

        Timeline extended = merger.extend(initial, List.of(appendedOthers, appendedRuns));

        assertEquals(merger.merge(SCENARIO, all).getEvents(), extended.getEvents());
    }
}
