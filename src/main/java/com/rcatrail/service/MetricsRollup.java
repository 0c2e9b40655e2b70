package com.rcatrail.service;

import com.rcatrail.model.DailySuccessRate;
import com.rcatrail.model.ErrorCategory;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.PayloadKeys;
import com.rcatrail.model.RankedCount;
import com.rcatrail.model.Severity;
import com.rcatrail.model.UserVelocity;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BinaryOperator;

/**
 * Partial aggregate over a slice of normalized events.
 *
 * Every field is a count or a set, and {@link #plus} adds counts and unions sets,
 * so rollups of time shards combine into exactly the rollup of a single full pass:
 *
 *   of(shard1).plus(of(shard2)) == of(shard1 + shard2)
 *
 * {@link #empty()} is the identity. Instances are immutable.
 *
 * What is counted:
 *   error categories  ERROR log entries by their error_category
 *   failing nodes     ERROR log entries and failed runs that name a node
 *   run outcomes      started runs per UTC day of start, outcomes per UTC day of the terminal event
 *   user activity     user_action events per actor: count, action types, scenarios, active days
 */
@Getter
@EqualsAndHashCode
public final class MetricsRollup {

    private static final MetricsRollup EMPTY = new MetricsRollup(
            Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, Long> errorCategories;
    private final Map<String, Long> failingNodes;
    private final Map<LocalDate, RunOutcomes> dailyOutcomes;
    private final Map<String, UserActivity> users;

    private MetricsRollup(Map<String, Long> errorCategories, Map<String, Long> failingNodes,
                          Map<LocalDate, RunOutcomes> dailyOutcomes, Map<String, UserActivity> users) {
        this.errorCategories = Collections.unmodifiableMap(new TreeMap<>(errorCategories));
        this.failingNodes = Collections.unmodifiableMap(new TreeMap<>(failingNodes));
        this.dailyOutcomes = Collections.unmodifiableMap(new TreeMap<>(dailyOutcomes));
        this.users = Collections.unmodifiableMap(new TreeMap<>(users));
    }

    public static MetricsRollup empty() {
        return EMPTY;
    }

    public static MetricsRollup of(Collection<Event> events) {
        Map<String, Long> categories = new TreeMap<>();
        Map<String, Long> nodes = new TreeMap<>();
        Map<LocalDate, RunOutcomes> outcomes = new TreeMap<>();
        Map<String, UserActivity> users = new TreeMap<>();

        for (Event event : events) {
            if (event.getTimestamp() == null) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(event.getTimestamp(), ZoneOffset.UTC);
            switch (event.getEventType()) {
                case LOG_ENTRY -> {
                    if (Severity.parse(event.payloadString(PayloadKeys.SEVERITY)) == Severity.ERROR) {
                        String category = event.payloadString(PayloadKeys.ERROR_CATEGORY);
                        categories.merge(category == null ? ErrorCategory.UNCATEGORIZED.wireName() : category,
                                1L, Long::sum);
                        if (event.getNodeId() != null) {
                            nodes.merge(event.getNodeId(), 1L, Long::sum);
                        }
                    }
                }
                case RUN_STARTED -> outcomes.merge(day, RunOutcomes.STARTED, RunOutcomes::plus);
                case RUN_COMPLETED -> outcomes.merge(day, RunOutcomes.SUCCEEDED, RunOutcomes::plus);
                case RUN_FAILED -> {
                    boolean timeout = "timeout".equals(event.payloadString(PayloadKeys.RUN_STATUS));
                    outcomes.merge(day, timeout ? RunOutcomes.TIMED_OUT : RunOutcomes.FAILED, RunOutcomes::plus);
                    if (event.getNodeId() != null) {
                        nodes.merge(event.getNodeId(), 1L, Long::sum);
                    }
                }
                case USER_ACTION -> {
                    if (event.getActor() != null) {
                        users.merge(event.getActor(), UserActivity.of(event, day), UserActivity::plus);
                    }
                }
                case STATE_CHANGE, INPUT_CHANGE -> {
                    // not part of any rollup
                }
            }
        }
        return new MetricsRollup(categories, nodes, outcomes, users);
    }

    public MetricsRollup plus(MetricsRollup other) {
        return new MetricsRollup(
                mergeMaps(errorCategories, other.errorCategories, Long::sum),
                mergeMaps(failingNodes, other.failingNodes, Long::sum),
                mergeMaps(dailyOutcomes, other.dailyOutcomes, RunOutcomes::plus),
                mergeMaps(users, other.users, UserActivity::plus));
    }

    // --- Queries ---

    public List<RankedCount> topErrorCategories(int limit) {
        return top(errorCategories, limit);
    }

    public List<RankedCount> topFailingNodes(int limit) {
        return top(failingNodes, limit);
    }

    public List<DailySuccessRate> dailySuccessRate() {
        List<DailySuccessRate> series = new ArrayList<>();
        dailyOutcomes.forEach((day, o) -> {
            if (o.finished() > 0) {
                series.add(new DailySuccessRate(day, o.getSucceeded(), o.finished()));
            }
        });
        return series;
    }

    public RunOutcomes totalOutcomes() {
        return dailyOutcomes.values().stream().reduce(RunOutcomes.NONE, RunOutcomes::plus);
    }

    /**
     * Velocity of one user over a window of the given length. Ties for the most
     * frequent action type go to the alphabetically first type.
     */
    public UserVelocity velocity(String userId, int windowDays) {
        UserActivity activity = users.getOrDefault(userId, UserActivity.NONE);
        String mostFrequent = activity.getActionTypes().entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);
        double perDay = BigDecimal.valueOf(activity.getActions())
                .divide(BigDecimal.valueOf(Math.max(windowDays, 1)), 2, RoundingMode.HALF_UP)
                .doubleValue();
        return UserVelocity.builder()
                .userId(userId)
                .windowDays(windowDays)
                .totalActions(activity.getActions())
                .actionsPerDay(perDay)
                .scenariosTouched(activity.getScenarios().size())
                .activeDays(activity.getActiveDays().size())
                .mostFrequentAction(mostFrequent)
                .actionTypeDistribution(activity.getActionTypes())
                .build();
    }

    private static List<RankedCount> top(Map<String, Long> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(Math.max(0, limit))
                .map(e -> new RankedCount(e.getKey(), e.getValue()))
                .toList();
    }

    private static <K, V> Map<K, V> mergeMaps(Map<K, V> a, Map<K, V> b, BinaryOperator<V> combine) {
        Map<K, V> merged = new TreeMap<>(a);
        b.forEach((k, v) -> merged.merge(k, v, combine));
        return merged;
    }

    // --- Parts ---

    @Getter
    @EqualsAndHashCode
    public static final class RunOutcomes {

        static final RunOutcomes NONE = new RunOutcomes(0, 0, 0, 0);
        static final RunOutcomes STARTED = new RunOutcomes(1, 0, 0, 0);
        static final RunOutcomes SUCCEEDED = new RunOutcomes(0, 1, 0, 0);
        static final RunOutcomes FAILED = new RunOutcomes(0, 0, 1, 0);
        static final RunOutcomes TIMED_OUT = new RunOutcomes(0, 0, 0, 1);

        private final long started;
        private final long succeeded;
        private final long failed;
        private final long timedOut;

        RunOutcomes(long started, long succeeded, long failed, long timedOut) {
            this.started = started;
            this.succeeded = succeeded;
            this.failed = failed;
            this.timedOut = timedOut;
        }

        RunOutcomes plus(RunOutcomes other) {
            return new RunOutcomes(started + other.started, succeeded + other.succeeded,
                    failed + other.failed, timedOut + other.timedOut);
        }

        public long finished() {
            return succeeded + failed + timedOut;
        }
    }

    @Getter
    @EqualsAndHashCode
    public static final class UserActivity {

        static final UserActivity NONE = new UserActivity(0, Map.of(), Set.of(), Set.of());

        private final long actions;
        private final Map<String, Long> actionTypes;
        private final Set<String> scenarios;
        private final Set<LocalDate> activeDays;

        UserActivity(long actions, Map<String, Long> actionTypes, Set<String> scenarios, Set<LocalDate> activeDays) {
            this.actions = actions;
            this.actionTypes = Collections.unmodifiableMap(new TreeMap<>(actionTypes));
            this.scenarios = Collections.unmodifiableSet(new TreeSet<>(scenarios));
            this.activeDays = Collections.unmodifiableSet(new TreeSet<>(activeDays));
        }

        static UserActivity of(Event action, LocalDate day) {
            String type = action.payloadString(PayloadKeys.ACTION_TYPE);
            return new UserActivity(1,
                    Map.of(type == null ? EventType.USER_ACTION.getWireName() : type, 1L),
                    action.getScenarioId() == null ? Set.of() : Set.of(action.getScenarioId()),
                    Set.of(day));
        }

        UserActivity plus(UserActivity other) {
            Map<String, Long> types = new TreeMap<>(actionTypes);
            other.actionTypes.forEach((k, v) -> types.merge(k, v, Long::sum));
            Set<String> mergedScenarios = new TreeSet<>(scenarios);
            mergedScenarios.addAll(other.scenarios);
            Set<LocalDate> days = new TreeSet<>(activeDays);
            days.addAll(other.activeDays);
            return new UserActivity(actions + other.actions, types, mergedScenarios, days);
        }
    }
}
