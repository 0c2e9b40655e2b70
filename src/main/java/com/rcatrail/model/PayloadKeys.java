package com.rcatrail.model;

/**
 * Payload keys shared by the normalizer and the consumers of normalized events.
 */
public final class PayloadKeys {

    // state_change
    public static final String TRANSITION_TYPE = "transition_type";
    public static final String PREVIOUS_STATUS = "previous_status";
    public static final String NEW_STATUS = "new_status";
    public static final String LIFECYCLE_ANOMALY = "lifecycle_anomaly";
    public static final String ANOMALY_DETAIL = "anomaly_detail";

    // input_change
    public static final String PREVIOUS_HASH = "previous_hash";
    public static final String NEW_HASH = "new_hash";
    public static final String CHANGE_KIND = "change_kind";
    public static final String CHANGE_SEQUENCE = "change_sequence";

    // run_started / run_completed / run_failed
    public static final String RUN_STATUS = "run_status";
    public static final String DURATION_SECONDS = "duration_seconds";
    public static final String FAIL_REASON = "fail_reason";
    public static final String NODE_FAILURE_COUNT = "node_failure_count";

    // user_action
    public static final String ACTION_TYPE = "action_type";
    public static final String ACTION_CATEGORY = "action_category";
    public static final String TARGET_ENTITY_TYPE = "target_entity_type";
    public static final String TARGET_ENTITY_ID = "target_entity_id";
    public static final String SUCCESS = "success";

    // log_entry
    public static final String SEVERITY = "severity";
    public static final String MESSAGE = "message";
    public static final String ERROR_CATEGORY = "error_category";
    public static final String HAS_STACK_TRACE = "has_stack_trace";
    public static final String LOG_STREAM = "log_stream";

    private PayloadKeys() {
    }
}
