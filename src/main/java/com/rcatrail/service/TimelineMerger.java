package com.rcatrail.service;

import com.rcatrail.model.AnomalyKind;
import com.rcatrail.model.Event;
import com.rcatrail.model.NormalizationAnomaly;
import com.rcatrail.model.SourceKind;
import com.rcatrail.model.Timeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Merges one scenario's events from all sources into a single ordered timeline.
 *
 * HOW IT WORKS:
 *   1. Each source contributes a sequence already sorted by {@link TimelineOrdering}
 *   2. A priority queue holds one cursor per source, keyed on the cursor's head event
 *   3. Poll the smallest head, emit it, advance that cursor: O(n log k) for k sources
 *   4. Heads that compare equal are taken from the earlier source first, and a
 *      cursor never reorders its own source, so the merge is stable
 *
 * Events that are equal in every field (same record key) are emitted once; distinct
 * records sharing scenario, type, timestamp and correlation id are all kept. Events without a timestamp cannot be placed; they are left out and
 * reported as anomalies.
 *
 * Sources are appended to incrementally, so an existing timeline can be extended
 * by merging it as the first source with the new slices ({@link #extend}).
 */
@Component
@Slf4j
public class TimelineMerger {

    /**
     * Stable k-way merge of per-source sequences.
     *
     * @param scenarioId owner of every event
     * @param sources    sequences in ingestion order, each sorted by {@link TimelineOrdering#ORDER}
     * @throws IllegalArgumentException if an event belongs to another scenario or a
     *                                  source is not sorted
     */
    public Timeline mergeSorted(String scenarioId, List<List<Event>> sources) {
        List<NormalizationAnomaly> anomalies = new ArrayList<>();
        List<List<Event>> usable = new ArrayList<>(sources.size());
        int total = 0;

        for (List<Event> source : sources) {
            List<Event> kept = new ArrayList<>(source.size());
            Event previous = null;
            for (Event event : source) {
                if (!scenarioId.equals(event.getScenarioId())) {
                    throw new IllegalArgumentException("Event of scenario " + event.getScenarioId()
                            + " in timeline of " + scenarioId);
                }
                if (event.getTimestamp() == null) {
                    anomalies.add(new NormalizationAnomaly(event.getSource(), AnomalyKind.AMBIGUOUS_TIMESTAMP,
                            event.getCorrelationId() != null ? event.getCorrelationId() : scenarioId,
                            event.getEventType().getWireName() + " has no timestamp, left out of the timeline"));
                    continue;
                }
                if (previous != null && TimelineOrdering.ORDER.compare(previous, event) > 0) {
                    throw new IllegalArgumentException("Source for scenario " + scenarioId
                            + " is not sorted at " + event.getTimestamp());
                }
                kept.add(event);
                previous = event;
            }
            total += kept.size();
            usable.add(kept);
        }

        PriorityQueue<Cursor> heads = new PriorityQueue<>();
        for (int i = 0; i < usable.size(); i++) {
            if (!usable.get(i).isEmpty()) {
                heads.add(new Cursor(i, usable.get(i)));
            }
        }

        List<Event> merged = new ArrayList<>(total);
        Set<String> seen = new HashSet<>();
        int duplicates = 0;

        while (!heads.isEmpty()) {
            Cursor cursor = heads.poll();
            Event head = cursor.head();
            if (seen.add(head.getRecordKey())) {
                merged.add(head);
            } else {
                duplicates++;
            }
            if (cursor.advance()) {
                heads.add(cursor);
            }
        }

        if (!anomalies.isEmpty() || duplicates > 0) {
            log.warn("Timeline for scenario {}: {} events without timestamp, {} duplicates dropped",
                    scenarioId, anomalies.size(), duplicates);
        }
        log.debug("Merged timeline for scenario {}: {} events from {} sources",
                scenarioId, merged.size(), sources.size());
        return new Timeline(scenarioId, List.copyOf(merged), List.copyOf(anomalies), duplicates);
    }

    /**
     * Merges an unordered collection: events are split by source kind, each slice is
     * sorted, then merged. The result does not depend on the order of the input.
     */
    public Timeline merge(String scenarioId, Collection<Event> events) {
        Map<SourceKind, List<Event>> bySource = new EnumMap<>(SourceKind.class);
        List<Event> untimed = new ArrayList<>();
        for (Event event : events) {
            if (event.getTimestamp() == null) {
                untimed.add(event);
            } else {
                bySource.computeIfAbsent(event.getSource(), k -> new ArrayList<>()).add(event);
            }
        }
        List<List<Event>> sources = new ArrayList<>(bySource.size() + 1);
        for (List<Event> slice : bySource.values()) {
            slice.sort(TimelineOrdering.ORDER);
            sources.add(slice);
        }
        if (!untimed.isEmpty()) {
            sources.add(untimed);
        }
        return mergeSorted(scenarioId, sources);
    }

    /**
     * Extends an existing timeline with newly appended, per-source sorted slices.
     * Existing events win ties against new ones.
     */
    public Timeline extend(Timeline existing, List<List<Event>> appended) {
        List<List<Event>> sources = new ArrayList<>(appended.size() + 1);
        sources.add(existing.getEvents());
        sources.addAll(appended);
        Timeline extended = mergeSorted(existing.getScenarioId(), sources);

        List<NormalizationAnomaly> anomalies = new ArrayList<>(existing.getAnomalies());
        anomalies.addAll(extended.getAnomalies());
        return new Timeline(existing.getScenarioId(), extended.getEvents(), List.copyOf(anomalies),
                existing.getDuplicatesDropped() + extended.getDuplicatesDropped());
    }

    private static final class Cursor implements Comparable<Cursor> {

        private final int sourceIndex;
        private final List<Event> events;
        private int position;

        Cursor(int sourceIndex, List<Event> events) {
            this.sourceIndex = sourceIndex;
            this.events = events;
        }

        Event head() {
            return events.get(position);
        }

        boolean advance() {
            position++;
            return position < events.size();
        }

        @Override
        public int compareTo(Cursor other) {
            int c = TimelineOrdering.ORDER.compare(head(), other.head());
            return c != 0 ? c : Integer.compare(sourceIndex, other.sourceIndex);
        }
    }
}
