package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.domain.ChildCommand;
import com.indigententerprises.telemetry.common.domain.ExitEvent;
import com.indigententerprises.telemetry.common.domain.SystemMetrics;
import com.indigententerprises.telemetry.common.domain.TerminationSignal;
import com.indigententerprises.telemetry.common.infrastructure.RelayQueue;
import com.indigententerprises.telemetry.common.serviceinterfaces.MetricsSampler;
import com.indigententerprises.telemetry.common.serviceinterfaces.SignalForwarder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs the child to completion. Signals handed to {@link #signal(String)} while the child
 * is alive are passed on to it; any other time they are logged and dropped. When the child
 * exits an {@link ExitEvent} is queued for the relay.
 */
public final class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    public static final String INTERRUPT = "INT";

    // exit_status of a child that was ended by a signal
    public static final int SIGNALLED = -1;

    // never a signal name
    private static final String CHILD_EXITED = "";

    private final MetricsSampler metricsSampler;
    private final SignalForwarder signalForwarder;
    private final BlockingQueue<String> wakeups;

    private volatile boolean supervising;

    public ProcessSupervisor(
            final MetricsSampler metricsSampler,
            final SignalForwarder signalForwarder) {
        this.metricsSampler = metricsSampler;
        this.signalForwarder = signalForwarder;
        this.wakeups = new LinkedBlockingQueue<>();
        this.supervising = false;
    }

    /**
     * Hands a host signal to the running child. Safe to call from any thread.
     */
    public void signal(final String signalName) {
        if (supervising) {
            wakeups.add(signalName);
        } else {
            log.info("ignoring signal {}: no child is running", signalName);
        }
    }

    boolean isSupervising() {
        return supervising;
    }

    /**
     * Blocks until the child has exited and its event has been queued.
     *
     * @throws IOException when the child cannot be started
     */
    public ExitEvent supervise(final RelayQueue queue, final ChildCommand command)
            throws IOException, InterruptedException {
        final ProcessBuilder builder = new ProcessBuilder(command.argv())
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        builder.environment().putAll(command.environment());

        log.info("starting child {}", command.argv());
        wakeups.clear();
        final Process child = builder.start();
        child.getOutputStream().close();
        metricsSampler.prime();

        supervising = true;
        child.onExit().thenRun(() -> wakeups.add(CHILD_EXITED));

        try {
            // mutable data
            String wakeup;

            while (!CHILD_EXITED.equals(wakeup = wakeups.take())) {
                relay(child, wakeup);
            }
        } finally {
            supervising = false;
        }

        // mutable data
        String late;

        while ((late = wakeups.poll()) != null) {
            log.info("ignoring signal {}: child has exited", late);
        }

        final int exitValue = child.waitFor();
        log.info("child exited with status {}", exitValue);

        final ExitEvent event = event(exitValue, metricsSampler.sample());
        queue.put(event);
        return event;
    }

    private void relay(final Process child, final String signalName) {
        log.info("relaying signal: {}", signalName);

        try {
            signalForwarder.forward(child.toHandle(), signalName);
        } catch (IOException e) {
            log.warn("could not relay signal {} to child {}", signalName, child.pid(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while relaying signal {} to child {}", signalName, child.pid());
        }
    }

    static ExitEvent event(final int exitValue, final SystemMetrics metrics) {
        final String signal = TerminationSignal.fromExitValue(exitValue)
                .map(TerminationSignal::getDescription)
                .orElse(null);
        final int exitStatus = signal == null ? exitValue : SIGNALLED;
        return ExitEvent.unbranded(Instant.now(), exitStatus, signal, metrics);
    }
}
