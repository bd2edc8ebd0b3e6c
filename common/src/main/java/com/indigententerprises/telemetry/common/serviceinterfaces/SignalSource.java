package com.indigententerprises.telemetry.common.serviceinterfaces;

import java.util.function.Consumer;

public interface SignalSource {

    /**
     * Routes the named host signal (e.g. "INT") to the handler instead of the default
     * action until the returned subscription is closed.
     */
    Subscription subscribe(final String signalName, final Consumer<String> handler);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
