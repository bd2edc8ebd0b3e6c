package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.domain.RecordKind;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public final class TopicRegistry {
    private final Map<RecordKind, String> topicsByKind;

    public TopicRegistry(final Map<RecordKind, String> topicsByKind) {
        final EnumMap<RecordKind, String> map = new EnumMap<>(RecordKind.class);

        for (final Map.Entry<RecordKind, String> entry : topicsByKind.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException("no topic name for " + entry.getKey());
            }
            map.put(entry.getKey(), entry.getValue());
        }

        this.topicsByKind = map;
    }

    public String require(final RecordKind kind) throws IllegalArgumentException {
        final String topic = topicsByKind.get(kind);

        if (topic == null) {
            throw new IllegalArgumentException("no topic configured for record kind " + kind);
        } else {
            return topic;
        }
    }

    public Collection<String> topics() {
        return topicsByKind.values();
    }
}
