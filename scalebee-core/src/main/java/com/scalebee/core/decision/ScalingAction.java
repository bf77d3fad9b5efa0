package com.scalebee.core.decision;

public enum ScalingAction {
    NONE,
    POLICY_UNAVAILABLE,
    DISABLED,
    BOUND_TO_MIN,
    BOUND_TO_MAX,
    SCALE_UP,
    SCALE_DOWN,
    AT_MAXIMUM,
    AT_MINIMUM;

    /** Whether this action results in a call to the runtime. */
    public boolean changesReplicas() {
        return this == BOUND_TO_MIN || this == BOUND_TO_MAX || this == SCALE_UP || this == SCALE_DOWN;
    }
}
