package com.rcatrail.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A maximal burst of one user's actions with no inactivity gap reaching the threshold.
 * Computed on demand, never persisted.
 */
@Value
public class Session {
    String userId;
    Instant startedAt;
    Instant endedAt;
    List<Event> actions;

    public Session(String userId, List<Event> actions) {
        if (actions.isEmpty()) {
            throw new IllegalArgumentException("A session holds at least one action");
        }
        this.userId = userId;
        this.actions = List.copyOf(actions);
        this.startedAt = actions.get(0).getTimestamp();
        this.endedAt = actions.get(actions.size() - 1).getTimestamp();
    }

    public int getActionCount() {
        return actions.size();
    }

    public Duration getDuration() {
        return Duration.between(startedAt, endedAt);
    }

    public List<String> getScenarioIds() {
        TreeSet<String> ids = new TreeSet<>();
        for (Event action : actions) {
            if (action.getScenarioId() != null) {
                ids.add(action.getScenarioId());
            }
        }
        return new ArrayList<>(ids);
    }

    public Map<String, Long> getActionTypes() {
        Map<String, Long> counts = new TreeMap<>();
        for (Event action : actions) {
            String type = action.payloadString(PayloadKeys.ACTION_TYPE);
            counts.merge(type == null ? action.getEventType().getWireName() : type, 1L, Long::sum);
        }
        return counts;
    }
}
