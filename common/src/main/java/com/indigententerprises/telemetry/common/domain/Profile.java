package com.indigententerprises.telemetry.common.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * One instrumentation record received on the data channel. The payload is passed
 * through to the broker untouched.
 */
@JsonPropertyOrder({"checksum", "uuid", "profile"})
public record Profile(
        @JsonProperty("checksum") @JsonInclude(JsonInclude.Include.NON_EMPTY) String checksum,
        @JsonProperty("uuid") @JsonInclude(JsonInclude.Include.NON_NULL) UUID uuid,
        @JsonProperty("profile") JsonNode profile
) implements Relayable {

    public static Profile of(final JsonNode payload) {
        return new Profile(null, null, payload);
    }

    @JsonIgnore
    @Override
    public RecordKind kind() {
        return RecordKind.PROFILE;
    }

    @Override
    public Profile brand(final UUID uuid, final String checksum) {
        return new Profile(checksum, uuid, profile);
    }
}
