package com.di.execmaps.schema;

/**
 * The per-execution collections persisted by this store.
 */
public enum MapKind {

    ACTIVITY_INFO("activity-info"),
    TIMER_INFO("timer-info"),
    CHILD_EXECUTION_INFO("child-execution-info"),
    REQUEST_CANCEL_INFO("request-cancel-info"),
    SIGNAL_INFO("signal-info"),
    SIGNALS_REQUESTED("signals-requested");

    private final String tag;

    MapKind(String tag) {
        this.tag = tag;
    }

    /** Stable lowercase name used in log lines and metric tags. */
    public String tag() {
        return tag;
    }
}
