package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.domain.ExitEvent;
import com.indigententerprises.telemetry.common.domain.Profile;
import com.indigententerprises.telemetry.common.domain.RecordKind;
import com.indigententerprises.telemetry.common.domain.Relayable;
import com.indigententerprises.telemetry.common.domain.SystemMetrics;
import com.indigententerprises.telemetry.common.infrastructure.RelayQueue;
import com.indigententerprises.telemetry.common.serviceinterfaces.DeliveryException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.StringSerializer;

import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@ExtendWith(MockitoExtension.class)
@Timeout(30)
public class OutboundRelayTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TopicRegistry TOPICS = new TopicRegistry(Map.of(
            RecordKind.EVENT, "events",
            RecordKind.PROFILE, "profiles"
    ));
    private static final String CHECKSUM = "4634270f707b6a54daae7530460842e20e37ed265ceee9a43e8924aa";

    static {
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Mock
    private Producer<String, String> producer;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static Profile profile(final String json) throws JsonProcessingException {
        return Profile.of(OBJECT_MAPPER.readTree(json));
    }

    @Test
    public void testRecordsReachTheBrokerInQueueOrder() throws Exception {
        final MockProducer<String, String> mockProducer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        final OutboundRelay systemUnderTest = new OutboundRelay(OBJECT_MAPPER, TOPICS, () -> mockProducer, CHECKSUM);
        final RelayQueue queue = new RelayQueue();

        systemUnderTest.start(queue, executor);
        queue.put(profile("{\"a\":1}"));
        queue.put(ExitEvent.unbranded(Instant.now(), 0, null, SystemMetrics.ZERO));
        queue.put(profile("{\"b\":2}"));
        queue.close();

        Assertions.assertEquals(3L, systemUnderTest.awaitDrained());
        systemUnderTest.close();

        final List<ProducerRecord<String, String>> history = mockProducer.history();
        Assertions.assertEquals(3, history.size());
        Assertions.assertEquals("profiles", history.get(0).topic());
        Assertions.assertEquals("events", history.get(1).topic());
        Assertions.assertEquals("profiles", history.get(2).topic());

        final JsonNode first = OBJECT_MAPPER.readTree(history.get(0).value());
        final JsonNode second = OBJECT_MAPPER.readTree(history.get(1).value());
        final JsonNode third = OBJECT_MAPPER.readTree(history.get(2).value());
        Assertions.assertEquals(1, first.get("profile").get("a").asInt());
        Assertions.assertEquals(0, second.get("exit_status").asInt());
        Assertions.assertEquals(2, third.get("profile").get("b").asInt());

        final Set<String> identifiers = new HashSet<>();

        for (final JsonNode delivered : List.of(first, second, third)) {
            Assertions.assertEquals(CHECKSUM, delivered.get("checksum").asText());
            identifiers.add(delivered.get("uuid").asText());
        }

        Assertions.assertEquals(3, identifiers.size());
        Assertions.assertTrue(mockProducer.closed());
    }

    @Test
    public void testEachRecordGetsTheNextIdentifier() throws Exception {
        final MockProducer<String, String> mockProducer =
                new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        final UUID fixed = UUID.fromString("00000000-0000-4000-8000-000000000001");
        final OutboundRelay systemUnderTest =
                new OutboundRelay(OBJECT_MAPPER, TOPICS, () -> mockProducer, CHECKSUM, () -> fixed);
        final RelayQueue queue = new RelayQueue();

        systemUnderTest.start(queue, executor);
        queue.put(profile("[1,2,3]"));
        queue.close();
        systemUnderTest.close();

        final JsonNode delivered = OBJECT_MAPPER.readTree(mockProducer.history().get(0).value());
        Assertions.assertEquals(fixed.toString(), delivered.get("uuid").asText());
        Assertions.assertEquals("[1,2,3]", delivered.get("profile").toString());
    }

    @Test
    public void testFailedDeliveryStopsTheRelay() throws Exception {
        final RecordMetadata metadata = new RecordMetadata(new TopicPartition("profiles", 0), 0L, 0, 0L, 4, 8);
        when(producer.send(any()))
                .thenReturn(CompletableFuture.completedFuture(metadata))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("broker unavailable")));

        final OutboundRelay systemUnderTest = new OutboundRelay(OBJECT_MAPPER, TOPICS, () -> producer, CHECKSUM);
        final RelayQueue queue = new RelayQueue();

        systemUnderTest.start(queue, executor);
        queue.put(profile("{\"n\":1}"));
        queue.put(profile("{\"n\":2}"));
        queue.put(profile("{\"n\":3}"));
        queue.close();

        final ExecutionException thrown = Assertions.assertThrows(ExecutionException.class, systemUnderTest::awaitDrained);
        Assertions.assertInstanceOf(DeliveryException.class, thrown.getCause());
        Assertions.assertInstanceOf(TimeoutException.class, thrown.getCause().getCause());
        Assertions.assertEquals(1, queue.pending());

        systemUnderTest.close();
        verify(producer, times(2)).send(any());
        verify(producer).close();
    }

    @Test
    public void testUnserializableRecordStopsTheRelay() throws Exception {
        final OutboundRelay systemUnderTest = new OutboundRelay(OBJECT_MAPPER, TOPICS, () -> producer, CHECKSUM);
        final RelayQueue queue = new RelayQueue();

        systemUnderTest.start(queue, executor);
        queue.put(new Unserializable());
        queue.put(profile("{\"n\":1}"));
        queue.close();

        final ExecutionException thrown = Assertions.assertThrows(ExecutionException.class, systemUnderTest::awaitDrained);
        Assertions.assertInstanceOf(JsonProcessingException.class, thrown.getCause());

        systemUnderTest.close();
        verify(producer, never()).send(any());
    }

    @Test
    public void testProducerIsClosedWhenTopicMetadataIsUnavailable() {
        when(producer.partitionsFor("events")).thenThrow(new TimeoutException("no metadata"));

        final Map<RecordKind, String> eventsOnly = Map.of(RecordKind.EVENT, "events");
        final OutboundRelay systemUnderTest =
                new OutboundRelay(OBJECT_MAPPER, new TopicRegistry(eventsOnly), () -> producer, CHECKSUM);

        Assertions.assertThrows(TimeoutException.class, () -> systemUnderTest.start(new RelayQueue(), executor));
        verify(producer).close();
    }

    public static final class Unserializable implements Relayable {

        @Override
        public RecordKind kind() {
            return RecordKind.PROFILE;
        }

        @Override
        public Relayable brand(final UUID uuid, final String checksum) {
            return this;
        }

        public String getBroken() {
            throw new IllegalStateException("cannot be read");
        }
    }
}
