package com.indigententerprises.telemetry.common.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.UUID;

/**
 * Terminal outcome of the supervised child process. {@code signal} is null when the
 * child exited on its own, and is then left out of the JSON.
 */
@JsonPropertyOrder({"checksum", "uuid", "timestamp", "exit_status", "signal", "system_metrics"})
public record ExitEvent(
        @JsonProperty("checksum") String checksum,
        @JsonProperty("uuid") UUID uuid,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("exit_status") int exitStatus,
        @JsonProperty("signal") @JsonInclude(JsonInclude.Include.NON_EMPTY) String signal,
        @JsonProperty("system_metrics") SystemMetrics systemMetrics
) implements Relayable {

    public static ExitEvent unbranded(
            final Instant timestamp,
            final int exitStatus,
            final String signal,
            final SystemMetrics systemMetrics) {
        return new ExitEvent(null, null, timestamp, exitStatus, signal, systemMetrics);
    }

    @JsonIgnore
    @Override
    public RecordKind kind() {
        return RecordKind.EVENT;
    }

    @Override
    public ExitEvent brand(final UUID uuid, final String checksum) {
        return new ExitEvent(checksum, uuid, timestamp, exitStatus, signal, systemMetrics);
    }
}
