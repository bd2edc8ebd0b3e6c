package com.indigententerprises.telemetry.common.serviceinterfaces;

import java.io.IOException;

public interface SignalForwarder {

    void forward(final ProcessHandle target, final String signalName) throws IOException, InterruptedException;
}
