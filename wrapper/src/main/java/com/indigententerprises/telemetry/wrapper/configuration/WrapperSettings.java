package com.indigententerprises.telemetry.wrapper.configuration;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.StringSerializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Everything the wrapper is configured with, resolved once at startup. Every setting in
 * {@link #REQUIRED} must be present; the certificate material is base64 encoded PEM.
 */
public final class WrapperSettings {

    private static final Logger log = LoggerFactory.getLogger(WrapperSettings.class);

    public static final String PREFIX = "wrapper.";

    public static final String BASE_URL = PREFIX + "base.url";
    public static final String BROKERS = PREFIX + "brokers";
    public static final String PROFILE_TOPIC = PREFIX + "prof.topic";
    public static final String EVENT_TOPIC = PREFIX + "event.topic";
    public static final String CA = PREFIX + "ca";
    public static final String CERT = PREFIX + "cert";
    public static final String PRIVATE_KEY = PREFIX + "private.key";

    public static final String CLIENT_ID = PREFIX + "client.id";
    public static final String REQUEST_TIMEOUT_MS = PREFIX + "request.timeout.ms";
    public static final String DELIVERY_TIMEOUT_MS = PREFIX + "delivery.timeout.ms";
    public static final String MAX_BLOCK_MS = PREFIX + "max.block.ms";
    public static final String SOCKET_DIR = PREFIX + "socket.dir";

    public static final List<String> REQUIRED =
            List.of(BASE_URL, BROKERS, PROFILE_TOPIC, EVENT_TOPIC, CA, CERT, PRIVATE_KEY);

    private final String baseUrl;
    private final String brokers;
    private final String profileTopic;
    private final String eventTopic;
    private final String caPem;
    private final String certPem;
    private final String privateKeyPem;
    private final String clientId;
    private final long requestTimeoutMs;
    private final long deliveryTimeoutMs;
    private final long maxBlockMs;
    private final Path socketDirectory;

    private WrapperSettings(final Function<String, String> lookup) {
        this.baseUrl = lookup.apply(BASE_URL);
        this.brokers = lookup.apply(BROKERS);
        this.profileTopic = lookup.apply(PROFILE_TOPIC);
        this.eventTopic = lookup.apply(EVENT_TOPIC);
        this.caPem = decode(CA, lookup.apply(CA));
        this.certPem = decode(CERT, lookup.apply(CERT));
        this.privateKeyPem = decode(PRIVATE_KEY, lookup.apply(PRIVATE_KEY));
        this.clientId = orDefault(lookup.apply(CLIENT_ID), "telemetry-wrapper");
        this.requestTimeoutMs = parseLong(REQUEST_TIMEOUT_MS, orDefault(lookup.apply(REQUEST_TIMEOUT_MS), "30000"));
        this.deliveryTimeoutMs = parseLong(DELIVERY_TIMEOUT_MS, orDefault(lookup.apply(DELIVERY_TIMEOUT_MS), "120000"));
        this.maxBlockMs = parseLong(MAX_BLOCK_MS, orDefault(lookup.apply(MAX_BLOCK_MS), "60000"));
        this.socketDirectory = Path.of(orDefault(lookup.apply(SOCKET_DIR), "."));
    }

    /**
     * @param lookup setting name to value, null when absent
     * @throws IllegalStateException naming the absent settings when any required one is missing
     * @throws IllegalArgumentException when a setting is present but unusable
     */
    public static WrapperSettings load(final Function<String, String> lookup) {
        final List<String> missing = new ArrayList<>();

        for (final String key : REQUIRED) {
            final String value = lookup.apply(key);

            if (value == null || value.isBlank()) {
                log.error("empty setting {} (environment variable {})", key, environmentName(key));
                missing.add(key);
            }
        }

        if (!missing.isEmpty()) {
            throw new IllegalStateException("incomplete configuration: missing " + missing);
        } else {
            return new WrapperSettings(lookup);
        }
    }

    public static String environmentName(final String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    public String getBaseUrl() { return baseUrl; }
    public String getProfileTopic() { return profileTopic; }
    public String getEventTopic() { return eventTopic; }
    public String getClientId() { return clientId; }
    public Path getSocketDirectory() { return socketDirectory; }

    public Properties producerProperties() {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, brokers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, String.valueOf(deliveryTimeoutMs));
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(maxBlockMs));

        props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");
        props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, "PEM");
        props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, caPem);
        props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, "PEM");
        props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, certPem);
        props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, privateKeyPem);
        // brokers are addressed by whatever name the deployment uses; only the chain is checked
        props.put(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, "");
        return props;
    }

    private static String decode(final String key, final String base64) {
        try {
            return new String(Base64.getDecoder().decode(base64.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " is not valid base64", e);
        }
    }

    private static long parseLong(final String key, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    private static String orDefault(final String value, final String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
