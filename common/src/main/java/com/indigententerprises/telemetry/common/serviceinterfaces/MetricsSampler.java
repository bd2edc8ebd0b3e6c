package com.indigententerprises.telemetry.common.serviceinterfaces;

import com.indigententerprises.telemetry.common.domain.SystemMetrics;

/**
 * Best effort: an implementation reports zero for any value it cannot read and never throws.
 */
public interface MetricsSampler {

    SystemMetrics sample();

    /**
     * Starts the window over which the next CPU reading is taken.
     */
    default void prime() {}
}
