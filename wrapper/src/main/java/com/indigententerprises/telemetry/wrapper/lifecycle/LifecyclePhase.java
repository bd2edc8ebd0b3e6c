package com.indigententerprises.telemetry.wrapper.lifecycle;

public enum LifecyclePhase {
    INIT,
    DIGEST_CHECK,
    PIPELINE_UP,
    SUPERVISING,
    DRAINING,
    SHUTDOWN
}
