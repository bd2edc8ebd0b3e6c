package com.indigententerprises.telemetry.common.domain;

import java.util.UUID;

/**
 * Anything the outbound relay can ship to the broker. The relay only knows a
 * record by its kind (which selects the destination topic) and by its ability
 * to be branded.
 */
public interface Relayable {

    RecordKind kind();

    /**
     * @return a copy of this record carrying the given identifier and executable checksum;
     *         no other field differs from this record
     */
    Relayable brand(UUID uuid, String checksum);
}
