package com.rcatrail.service;

import com.rcatrail.config.RcaTrailProperties;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions a user's chronological actions into sessions.
 *
 * A gap at or above the inactivity threshold closes the current session and opens
 * a new one; anything shorter keeps the session going. Calendar days play no role.
 * One linear pass, no sorting: input is expected in timeline order.
 *
 *   actions: 09:00  09:10  09:50  09:55      threshold: 30m
 *   gaps:        10m    40m    5m
 *   sessions: [09:00, 09:10] [09:50, 09:55]
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionGrouper {

    private final RcaTrailProperties properties;

    public List<Session> group(List<Event> actions) {
        return group(actions, properties.getSession().getInactivityThreshold());
    }

    /**
     * @param actions   one user's action events, in chronological order
     * @param threshold inactivity gap that starts a new session, must be positive
     * @throws IllegalArgumentException on a non-positive threshold or out-of-order input
     */
    public List<Session> group(List<Event> actions, Duration threshold) {
        if (threshold == null || threshold.isZero() || threshold.isNegative()) {
            throw new IllegalArgumentException("Inactivity threshold must be positive: " + threshold);
        }
        List<Session> sessions = new ArrayList<>();
        if (actions.isEmpty()) {
            return sessions;
        }

        String userId = actions.get(0).getActor();
        List<Event> current = new ArrayList<>();
        Event previous = null;

        for (Event action : actions) {
            if (action.getTimestamp() == null) {
                throw new IllegalArgumentException("Action without timestamp for user " + userId);
            }
            if (previous != null) {
                Duration gap = Duration.between(previous.getTimestamp(), action.getTimestamp());
                if (gap.isNegative()) {
                    throw new IllegalArgumentException("Actions for user " + userId
                            + " are not in chronological order at " + action.getTimestamp());
                }
                if (gap.compareTo(threshold) >= 0) {
                    sessions.add(new Session(userId, current));
                    current = new ArrayList<>();
                }
            }
            current.add(action);
            previous = action;
        }
        sessions.add(new Session(userId, current));

        log.debug("Grouped {} actions of user {} into {} sessions", actions.size(), userId, sessions.size());
        return sessions;
    }

    /**
     * Splits a mixed event set by actor and groups each user's actions.
     * Only user_action events with an actor take part; system events are ignored.
     */
    public Map<String, List<Session>> groupByUser(Collection<Event> events, Duration threshold) {
        Map<String, List<Event>> byUser = new TreeMap<>();
        for (Event event : events) {
            if (event.getEventType() == EventType.USER_ACTION && event.getActor() != null) {
                byUser.computeIfAbsent(event.getActor(), k -> new ArrayList<>()).add(event);
            }
        }
        Map<String, List<Session>> sessions = new TreeMap<>();
        for (Map.Entry<String, List<Event>> entry : byUser.entrySet()) {
            List<Event> actions = entry.getValue();
            actions.sort(TimelineOrdering.ORDER);
            sessions.put(entry.getKey(), group(actions, threshold));
        }
        return sessions;
    }
}
