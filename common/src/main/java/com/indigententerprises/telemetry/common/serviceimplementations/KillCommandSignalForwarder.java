package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.serviceinterfaces.SignalForwarder;

import java.io.IOException;

/**
 * {@link Process} can only send TERM and KILL, so any other signal goes through kill(1).
 */
public final class KillCommandSignalForwarder implements SignalForwarder {

    @Override
    public void forward(final ProcessHandle target, final String signalName) throws IOException, InterruptedException {
        final Process kill = new ProcessBuilder("kill", "-" + signalName, Long.toString(target.pid()))
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        final int status = kill.waitFor();

        if (status != 0) {
            throw new IOException("kill -" + signalName + " " + target.pid() + " exited with status " + status);
        }
    }
}
