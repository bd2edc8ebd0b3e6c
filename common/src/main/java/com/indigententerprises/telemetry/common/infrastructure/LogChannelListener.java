package com.indigententerprises.telemetry.common.infrastructure;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Copies every byte the child writes on the log channel into the log sink, verbatim.
 */
public final class LogChannelListener extends SingleSessionListener {

    private final OutputStream sink;

    public LogChannelListener(final Path socketPath, final OutputStream sink) {
        super("log", socketPath);
        this.sink = sink;
    }

    @Override
    protected void serve(final SocketChannel client) throws Exception {
        final InputStream in = Channels.newInputStream(client);
        final byte[] buffer = new byte[8192];

        // mutable data
        int count;

        while ((count = in.read(buffer)) != -1) {
            sink.write(buffer, 0, count);
            sink.flush();
        }
    }
}
