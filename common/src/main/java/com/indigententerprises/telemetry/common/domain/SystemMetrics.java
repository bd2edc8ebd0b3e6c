package com.indigententerprises.telemetry.common.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SystemMetrics(
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("mem_percent") double memPercent,
        @JsonProperty("inbound_traffic") long inboundTraffic,
        @JsonProperty("outbound_traffic") long outboundTraffic
) {
    public static final SystemMetrics ZERO = new SystemMetrics(0.0, 0.0, 0L, 0L);
}
