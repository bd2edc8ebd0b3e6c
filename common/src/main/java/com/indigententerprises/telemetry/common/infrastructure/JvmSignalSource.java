package com.indigententerprises.telemetry.common.infrastructure;

import com.indigententerprises.telemetry.common.serviceinterfaces.SignalSource;

import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.function.Consumer;

/**
 * Host signals through {@code sun.misc.Signal}. While subscribed, the JVM's own handler
 * (which would start shutdown on INT) is replaced; closing the subscription puts it back.
 */
public final class JvmSignalSource implements SignalSource {

    @Override
    public Subscription subscribe(final String signalName, final Consumer<String> handler) {
        final Signal signal = new Signal(signalName);
        final SignalHandler previous = Signal.handle(signal, received -> handler.accept(received.getName()));
        return () -> Signal.handle(signal, previous);
    }
}
