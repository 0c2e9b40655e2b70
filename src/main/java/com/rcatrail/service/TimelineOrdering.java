package com.rcatrail.service;

import com.rcatrail.model.Event;
import com.rcatrail.model.EventContent;

import java.util.Comparator;

/**
 * The total order of a scenario timeline.
 *
 *   1. timestamp ascending
 *   2. event type priority (state_change < input_change < run_started < log_entry
 *      < user_action < run_completed / run_failed)
 *   3. sequence hint ascending, between events of the same type; an event without
 *      a hint sorts after one that has it
 *   4. content fallback: correlation id, run id, node id, actor (absent first)
 *   5. canonical content ({@link EventContent#canonical}), so payloads decide last
 *
 * Sequence hints are per-source counters, so they are only compared between events
 * of the same type, which makes step 3 equivalent to "hint first" within a source
 * while keeping the comparison transitive. Only events equal in every field compare
 * equal, so the order never depends on the order of the input.
 */
public final class TimelineOrdering {

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    public static final Comparator<Event> ORDER = Comparator
            .comparing(Event::getTimestamp)
            .thenComparingInt(e -> e.getEventType().getPriority())
            .thenComparing(TimelineOrdering::compareSequenceHints)
            .thenComparing(Event::getCorrelationId, NULLS_FIRST)
            .thenComparing(Event::getRunId, NULLS_FIRST)
            .thenComparing(Event::getNodeId, NULLS_FIRST)
            .thenComparing(Event::getActor, NULLS_FIRST)
            .thenComparing(EventContent::canonical);

    private TimelineOrdering() {
    }

    private static int compareSequenceHints(Event a, Event b) {
        if (a.getEventType() != b.getEventType()) {
            return a.getEventType().compareTo(b.getEventType());
        }
        Long ha = a.getSequenceHint();
        Long hb = b.getSequenceHint();
        if (ha == null || hb == null) {
            return ha == null ? (hb == null ? 0 : 1) : -1;
        }
        return Long.compare(ha, hb);
    }
}
