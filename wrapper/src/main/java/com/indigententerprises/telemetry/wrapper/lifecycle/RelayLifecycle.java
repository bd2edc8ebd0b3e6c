package com.indigententerprises.telemetry.wrapper.lifecycle;

import com.indigententerprises.telemetry.common.domain.ChildCommand;
import com.indigententerprises.telemetry.common.domain.ExitEvent;
import com.indigententerprises.telemetry.common.infrastructure.DataChannelListener;
import com.indigententerprises.telemetry.common.infrastructure.LogChannelListener;
import com.indigententerprises.telemetry.common.infrastructure.RelayQueue;
import com.indigententerprises.telemetry.common.serviceimplementations.ChecksumService;
import com.indigententerprises.telemetry.common.serviceimplementations.ExecutableResolver;
import com.indigententerprises.telemetry.common.serviceimplementations.OutboundRelay;
import com.indigententerprises.telemetry.common.serviceimplementations.ProcessSupervisor;
import com.indigententerprises.telemetry.common.serviceimplementations.TopicRegistry;
import com.indigententerprises.telemetry.common.serviceinterfaces.IntegrityAuthority;
import com.indigententerprises.telemetry.common.serviceinterfaces.IntegrityCheckException;
import com.indigententerprises.telemetry.common.serviceinterfaces.SignalSource;

import org.apache.kafka.clients.producer.Producer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * One supervised run, start to finish: digest check, pipeline start, supervision, then
 * drain and shutdown in reverse start order. Host interrupts are held from supervision until
 * shutdown completes; they go to the child and never stop the pipeline.
 *
 * <p>Shutdown waits for the child to close both IPC connections. A child that exits while
 * one of its connections is still open (or that never connects) leaves the run waiting
 * at shutdown; instrumented programs must close their connections on their way out.
 */
public final class RelayLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RelayLifecycle.class);

    public static final String DATA_SOCKET_VARIABLE = "WRAPPER_DATA_SOCKET";
    public static final String LOG_SOCKET_VARIABLE = "WRAPPER_LOG_SOCKET";

    private final ObjectMapper objectMapper;
    private final ChecksumService checksumService;
    private final IntegrityAuthority integrityAuthority;
    private final ExecutableResolver executableResolver;
    private final TopicRegistry topicRegistry;
    private final Supplier<Producer<String, String>> connector;
    private final ProcessSupervisor supervisor;
    private final SignalSource signalSource;
    private final OutputStream logSink;
    private final Path socketDirectory;
    private final ExecutorService executor;

    private volatile LifecyclePhase phase;

    public RelayLifecycle(
            final ObjectMapper objectMapper,
            final ChecksumService checksumService,
            final IntegrityAuthority integrityAuthority,
            final ExecutableResolver executableResolver,
            final TopicRegistry topicRegistry,
            final Supplier<Producer<String, String>> connector,
            final ProcessSupervisor supervisor,
            final SignalSource signalSource,
            final OutputStream logSink,
            final Path socketDirectory,
            final ExecutorService executor) {
        this.objectMapper = objectMapper;
        this.checksumService = checksumService;
        this.integrityAuthority = integrityAuthority;
        this.executableResolver = executableResolver;
        this.topicRegistry = topicRegistry;
        this.connector = connector;
        this.supervisor = supervisor;
        this.signalSource = signalSource;
        this.logSink = logSink;
        this.socketDirectory = socketDirectory;
        this.executor = executor;
        this.phase = LifecyclePhase.INIT;
    }

    public LifecyclePhase getPhase() {
        return phase;
    }

    /**
     * @param argv the child command and its arguments
     * @return the event queued for the child's exit
     * @throws IOException when the executable cannot be read or started, or a socket cannot be bound
     * @throws IntegrityCheckException when the release service answers unexpectedly
     */
    public ExitEvent run(final List<String> argv)
            throws IOException, IntegrityCheckException, InterruptedException {
        final Path executable = executableResolver.resolve(argv.get(0));

        enter(LifecyclePhase.DIGEST_CHECK);
        final String checksum = checksumService.compute(executable);

        if (!integrityAuthority.isRecognized(checksum)) {
            log.warn("invalid checksum: {}", checksum);
        }

        enter(LifecyclePhase.PIPELINE_UP);
        final long pid = ProcessHandle.current().pid();
        final RelayQueue queue = new RelayQueue();
        final OutboundRelay relay = new OutboundRelay(objectMapper, topicRegistry, connector, checksum);
        final DataChannelListener data =
                new DataChannelListener(socketDirectory.resolve("data-" + pid), objectMapper, queue);
        final LogChannelListener logs =
                new LogChannelListener(socketDirectory.resolve("log-" + pid), logSink);

        relay.start(queue, executor);

        try {
            data.start(executor);
        } catch (IOException | RuntimeException e) {
            abort(queue, relay);
            throw e;
        }

        try {
            logs.start(executor);
        } catch (IOException | RuntimeException e) {
            data.abort();
            abort(queue, relay);
            throw e;
        }

        enter(LifecyclePhase.SUPERVISING);
        final List<String> childArgv = new ArrayList<>(argv);
        childArgv.set(0, executable.toString());
        final ChildCommand command = new ChildCommand(
                childArgv,
                Map.of(
                        DATA_SOCKET_VARIABLE, data.getSocketPath().toAbsolutePath().toString(),
                        LOG_SOCKET_VARIABLE, logs.getSocketPath().toAbsolutePath().toString()
                )
        );

        try (SignalSource.Subscription ignored =
                     signalSource.subscribe(ProcessSupervisor.INTERRUPT, supervisor::signal)) {
            final ExitEvent event;

            try {
                event = supervisor.supervise(queue, command);
            } catch (IOException e) {
                logs.abort();
                data.abort();
                abort(queue, relay);
                throw e;
            }

            enter(LifecyclePhase.DRAINING);
            // the data session may still be reading lines the child wrote before exiting;
            // its error, if any, is logged by close()
            data.awaitSession();
            queue.close();

            enter(LifecyclePhase.SHUTDOWN);
            logs.close();
            data.close();
            relay.close();
            return event;
        }
    }

    private void abort(final RelayQueue queue, final OutboundRelay relay) {
        log.error("aborting pipeline startup");
        queue.close();
        relay.close();
    }

    private void enter(final LifecyclePhase next) {
        log.info("lifecycle: {} -> {}", phase, next);
        this.phase = next;
    }
}
