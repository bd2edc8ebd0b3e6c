package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.domain.Relayable;
import com.indigententerprises.telemetry.common.infrastructure.RelayQueue;
import com.indigententerprises.telemetry.common.serviceinterfaces.DeliveryException;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * The single consumer of the relay queue. Each record is branded, serialized and sent
 * synchronously, so the broker sees records in queue order with one delivery in flight.
 * The first failed serialization or delivery stops the loop; nothing is retried.
 */
public final class OutboundRelay implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OutboundRelay.class);

    private final ObjectMapper objectMapper;
    private final TopicRegistry topicRegistry;
    private final Supplier<Producer<String, String>> connector;
    private final String checksum;
    private final Supplier<UUID> identifiers;

    private Producer<String, String> producer;
    private RelayQueue queue;
    private Future<Long> loop;

    public OutboundRelay(
            final ObjectMapper objectMapper,
            final TopicRegistry topicRegistry,
            final Supplier<Producer<String, String>> connector,
            final String checksum) {
        this(objectMapper, topicRegistry, connector, checksum, UUID::randomUUID);
    }

    public OutboundRelay(
            final ObjectMapper objectMapper,
            final TopicRegistry topicRegistry,
            final Supplier<Producer<String, String>> connector,
            final String checksum,
            final Supplier<UUID> identifiers) {
        this.objectMapper = objectMapper;
        this.topicRegistry = topicRegistry;
        this.connector = connector;
        this.checksum = checksum;
        this.identifiers = identifiers;
    }

    /**
     * Connects to the broker and starts draining the queue.
     *
     * @throws org.apache.kafka.common.KafkaException when the producer cannot be created or
     *         the topics' metadata cannot be fetched
     */
    public void start(final RelayQueue queue, final ExecutorService executor) {
        if (producer != null) {
            throw new IllegalStateException("relay already started");
        } else {
            final Producer<String, String> connected = connector.get();

            try {
                for (final String topic : topicRegistry.topics()) {
                    connected.partitionsFor(topic);
                }
            } catch (RuntimeException e) {
                connected.close();
                throw e;
            }

            log.info("kafka producer connected");
            this.producer = connected;
            this.queue = queue;
            this.loop = executor.submit(() -> drain(queue));
        }
    }

    private long drain(final RelayQueue queue) throws Exception {
        // mutable data
        long delivered = 0L;
        Relayable item;

        while ((item = queue.take()) != null) {
            deliver(item.brand(identifiers.get(), checksum));
            delivered++;
        }

        return delivered;
    }

    private void deliver(final Relayable branded) throws Exception {
        final String topic = topicRegistry.require(branded.kind());
        final String json = objectMapper.writeValueAsString(branded);

        if (log.isDebugEnabled()) {
            log.debug("producer got {} bytes: {}", json.getBytes(StandardCharsets.UTF_8).length, json);
        }

        final Future<RecordMetadata> sendFuture = producer.send(new ProducerRecord<>(topic, json));

        try {
            sendFuture.get();
        } catch (ExecutionException e) {
            throw new DeliveryException("delivery to " + topic + " failed", e.getCause());
        }
    }

    /**
     * Blocks until the loop has ended.
     *
     * @return the number of records delivered
     * @throws ExecutionException carrying the error that stopped the loop
     */
    public long awaitDrained() throws InterruptedException, ExecutionException {
        if (loop == null) {
            throw new IllegalStateException("relay was never started");
        } else {
            return loop.get();
        }
    }

    @Override
    public void close() {
        if (loop != null) {
            try {
                final long delivered = awaitDrained();
                log.info("kafka producer delivered {} records", delivered);
            } catch (ExecutionException e) {
                log.error("relay stopped early; {} queued records were not delivered", queue.pending(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("interrupted while waiting for the relay to drain");
            }
        }

        if (producer != null) {
            log.info("closing kafka producer");
            producer.close();
        }
    }
}
