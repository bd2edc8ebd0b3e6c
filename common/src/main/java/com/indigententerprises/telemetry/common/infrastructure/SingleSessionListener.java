package com.indigententerprises.telemetry.common.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * A local socket that serves exactly one client for the lifetime of the process.
 * The listening socket is closed as soon as that client is accepted, so any later
 * connection attempt is refused rather than queued.
 *
 * <p>{@link #close()} waits for the session to end, which only happens when the client
 * closes its side of the connection. A client that keeps the connection open keeps
 * {@code close()} waiting.
 */
public abstract class SingleSessionListener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleSessionListener.class);

    private final String name;
    private final Path socketPath;

    private ServerSocketChannel server;
    private Future<?> session;

    protected SingleSessionListener(final String name, final Path socketPath) {
        this.name = name;
        this.socketPath = socketPath;
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public void start(final ExecutorService executor) throws IOException {
        if (server != null) {
            throw new IllegalStateException(name + " listener already started");
        } else {
            final ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);

            try {
                channel.bind(UnixDomainSocketAddress.of(socketPath));
            } catch (IOException e) {
                channel.close();
                throw e;
            }

            this.server = channel;
            log.info("{} socket opened at {}", name, socketPath);
            this.session = executor.submit(() -> {
                acceptAndServe();
                return null;
            });
        }
    }

    private void acceptAndServe() throws Exception {
        try (SocketChannel client = server.accept()) {
            server.close();
            log.info("{} connection accepted", name);
            serve(client);
        }
        log.info("{} socket EOF", name);
    }

    /**
     * Runs the session on the accepted connection until the client closes it.
     */
    protected abstract void serve(final SocketChannel client) throws Exception;

    /**
     * Blocks until the session has finished.
     *
     * @return the error that ended the session, or null when the client closed cleanly
     */
    public Throwable awaitSession() throws InterruptedException {
        if (session == null) {
            throw new IllegalStateException(name + " listener was never started");
        } else {
            try {
                session.get();
                return null;
            } catch (ExecutionException e) {
                return e.getCause();
            }
        }
    }

    /**
     * Tears the socket down without waiting for a client.
     */
    public void abort() {
        if (session != null) {
            session.cancel(true);
        }
        release();
    }

    @Override
    public void close() {
        try {
            final Throwable error = awaitSession();

            if (error != null) {
                log.error("{} session ended with an error", name, error);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for the {} session", name);
        }

        log.info("closing {} socket", name);
        release();
    }

    private void release() {
        try {
            if (server != null) {
                server.close();
            }
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("could not release {} socket {}", name, socketPath, e);
        }
    }
}
