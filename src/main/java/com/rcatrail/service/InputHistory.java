package com.rcatrail.service;

import com.rcatrail.model.InputChangeRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-node version history of a scenario's inputs, ordered by changedAt.
 *
 * Point-in-time questions ("which hash was in effect at T?") are answered by
 * binary search over the node's versions, so lookups stay O(log n) as history grows.
 *
 * Windows are left-exclusive and right-inclusive: (after, upTo]. A null lower bound
 * means "since the beginning".
 */
public class InputHistory {

    static final Comparator<InputChangeRecord> VERSION_ORDER = Comparator
            .comparing(InputChangeRecord::getChangedAt)
            .thenComparing(InputChangeRecord::getSequenceHint, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<InputChangeRecord> WINDOW_ORDER = VERSION_ORDER
            .thenComparing(InputChangeRecord::getNodeId);

    private final Map<String, List<InputChangeRecord>> versionsByNode = new TreeMap<>();

    public InputHistory(Collection<InputChangeRecord> changes) {
        for (InputChangeRecord change : changes) {
            if (change.getChangedAt() == null || change.getNodeId() == null) {
                throw new IllegalArgumentException("Input change needs a node id and a timestamp: " + change);
            }
            versionsByNode.computeIfAbsent(change.getNodeId(), k -> new ArrayList<>()).add(change);
        }
        versionsByNode.values().forEach(versions -> versions.sort(VERSION_ORDER));
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(versionsByNode.keySet());
    }

    /** Latest version of the node at or before the instant. */
    public Optional<InputChangeRecord> latestAtOrBefore(String nodeId, Instant instant) {
        List<InputChangeRecord> versions = versionsByNode.get(nodeId);
        if (versions == null) {
            return Optional.empty();
        }
        int count = countAtOrBefore(versions, instant);
        return count == 0 ? Optional.empty() : Optional.of(versions.get(count - 1));
    }

    /** Hash in effect for the node at the instant, or null if it had no value yet. */
    public String valueAt(String nodeId, Instant instant) {
        return latestAtOrBefore(nodeId, instant).map(InputChangeRecord::getNewHash).orElse(null);
    }

    /** Last change of the node inside (after, upTo]. */
    public Optional<InputChangeRecord> lastChangeIn(String nodeId, Instant after, Instant upTo) {
        return latestAtOrBefore(nodeId, upTo)
                .filter(change -> after == null || change.getChangedAt().isAfter(after));
    }

    /** Number of the node's changes inside (after, upTo]. */
    public int countIn(String nodeId, Instant after, Instant upTo) {
        List<InputChangeRecord> versions = versionsByNode.get(nodeId);
        if (versions == null) {
            return 0;
        }
        int upper = countAtOrBefore(versions, upTo);
        int lower = after == null ? 0 : countAtOrBefore(versions, after);
        return Math.max(0, upper - lower);
    }

    /** Every change of every node inside (after, upTo], in timeline order. */
    public List<InputChangeRecord> changesIn(Instant after, Instant upTo) {
        List<InputChangeRecord> window = new ArrayList<>();
        for (List<InputChangeRecord> versions : versionsByNode.values()) {
            int upper = countAtOrBefore(versions, upTo);
            int lower = after == null ? 0 : countAtOrBefore(versions, after);
            if (lower < upper) {
                window.addAll(versions.subList(lower, upper));
            }
        }
        window.sort(WINDOW_ORDER);
        return window;
    }

    /** Hash in effect per node at the instant, nodes without a value yet omitted. */
    public Map<String, String> snapshotAt(Instant instant) {
        Map<String, String> snapshot = new TreeMap<>();
        for (String nodeId : versionsByNode.keySet()) {
            latestAtOrBefore(nodeId, instant).ifPresent(v -> snapshot.put(nodeId, v.getNewHash()));
        }
        return snapshot;
    }

    /**
     * Number of leading versions with changedAt <= instant (upper bound search).
     */
    private static int countAtOrBefore(List<InputChangeRecord> versions, Instant instant) {
        int lo = 0;
        int hi = versions.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (versions.get(mid).getChangedAt().isAfter(instant)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
