package com.indigententerprises.telemetry.wrapper.configuration;

import com.indigententerprises.telemetry.common.domain.RecordKind;
import com.indigententerprises.telemetry.common.infrastructure.JvmSignalSource;
import com.indigententerprises.telemetry.common.serviceimplementations.ChecksumService;
import com.indigententerprises.telemetry.common.serviceimplementations.ExecutableResolver;
import com.indigententerprises.telemetry.common.serviceimplementations.HttpIntegrityAuthority;
import com.indigententerprises.telemetry.common.serviceimplementations.KillCommandSignalForwarder;
import com.indigententerprises.telemetry.common.serviceimplementations.OperatingSystemMetricsSampler;
import com.indigententerprises.telemetry.common.serviceimplementations.ProcessSupervisor;
import com.indigententerprises.telemetry.common.serviceimplementations.TopicRegistry;
import com.indigententerprises.telemetry.common.serviceinterfaces.IntegrityAuthority;
import com.indigententerprises.telemetry.wrapper.lifecycle.CommandLine;
import com.indigententerprises.telemetry.wrapper.lifecycle.RelayLifecycle;

import org.springframework.beans.BeansException;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import org.apache.kafka.clients.producer.KafkaProducer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppWiring implements ApplicationContextAware {

    private static final Logger log = LoggerFactory.getLogger(AppWiring.class);

    private ApplicationContext applicationContext;

    @Override
    public void setApplicationContext(final ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Bean
    public WrapperSettings wrapperSettings(final Environment environment) {
        return WrapperSettings.load(environment::getProperty);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    // listeners, relay loop; the supervisor runs on the caller
    @Bean(destroyMethod="shutdownNow")
    public ExecutorService pipelineExecutor() {
        return Executors.newFixedThreadPool(3);
    }

    @Bean
    public TopicRegistry topicRegistry(final WrapperSettings settings) {
        return new TopicRegistry(Map.of(
                RecordKind.EVENT, settings.getEventTopic(),
                RecordKind.PROFILE, settings.getProfileTopic()
        ));
    }

    @Bean
    public IntegrityAuthority integrityAuthority(final WrapperSettings settings) {
        final HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        return new HttpIntegrityAuthority(httpClient, settings.getBaseUrl());
    }

    @Bean
    public ProcessSupervisor processSupervisor() {
        return new ProcessSupervisor(
                new OperatingSystemMetricsSampler(),
                new KillCommandSignalForwarder()
        );
    }

    @Bean
    public RelayLifecycle relayLifecycle(
            final WrapperSettings settings,
            final ObjectMapper objectMapper,
            final TopicRegistry topicRegistry,
            final IntegrityAuthority integrityAuthority,
            final ProcessSupervisor processSupervisor,
            final ExecutorService pipelineExecutor
    ) {
        return new RelayLifecycle(
                objectMapper,
                new ChecksumService(),
                integrityAuthority,
                ExecutableResolver.fromEnvironment(),
                topicRegistry,
                () -> new KafkaProducer<>(settings.producerProperties()),
                processSupervisor,
                new JvmSignalSource(),
                System.out,
                settings.getSocketDirectory(),
                pipelineExecutor
        );
    }

    @Bean
    public ApplicationRunner runner(final RelayLifecycle relayLifecycle) {
        return args -> {
            try {
                relayLifecycle.run(CommandLine.parse(args.getSourceArgs()));
            } catch (Exception e) {
                log.error("fatal error during {}", relayLifecycle.getPhase(), e);

                SpringApplication.exit(applicationContext, () -> 1);
                System.exit(1);
            }
        };
    }
}
