package com.indigententerprises.telemetry.common.domain;

public enum RecordKind {
    EVENT,
    PROFILE
}
