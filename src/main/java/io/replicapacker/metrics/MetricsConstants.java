package io.replicapacker.metrics;

/**
 * Constants for metrics names and tags used by the replica packer.
 */
public class MetricsConstants {
    public final static String PLANS_METRIC_NAME = "packing_plans_total";
    public final static String PLAN_FAILURES_METRIC_NAME = "packing_plan_failures_total";
    public final static String OPTIMIZE_DURATION_METRIC_NAME = "packing_optimize_duration";
    public final static String PLAN_SERVER_COUNT_METRIC_NAME = "packing_plan_server_count";
    public final static String TRIALS_METRIC_NAME = "packing_trials_total";
    public final static String STRATEGY_TAG = "strategy";
    public final static String REASON_TAG = "reason";

    private MetricsConstants() {}
}
