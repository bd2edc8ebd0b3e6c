package com.indigententerprises.telemetry.common.infrastructure;

import com.indigententerprises.telemetry.common.domain.Profile;
import com.indigententerprises.telemetry.common.serviceinterfaces.MalformedRecordException;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Timeout(30)
public class DataChannelListenerTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @TempDir
    Path directory;

    private ExecutorService executor;
    private RelayQueue queue;
    private Path socketPath;
    private DataChannelListener systemUnderTest;

    @BeforeEach
    public void setUp() throws IOException {
        executor = Executors.newCachedThreadPool();
        queue = new RelayQueue();
        socketPath = directory.resolve("data-1");
        systemUnderTest = new DataChannelListener(socketPath, OBJECT_MAPPER, queue);
        systemUnderTest.start(executor);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private void send(final String text) throws IOException {
        try (SocketChannel client = SocketChannel.open(UnixDomainSocketAddress.of(socketPath))) {
            client.write(ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8)));
        }
    }

    private Profile next() throws InterruptedException {
        return (Profile) queue.take();
    }

    @Test
    public void testEachLineBecomesOneProfileInOrder() throws Exception {
        send("{\"a\":1}\n[1,2]\n\"text\"\n42\r\n");

        Assertions.assertNull(systemUnderTest.awaitSession());
        systemUnderTest.close();
        queue.close();

        Assertions.assertEquals(OBJECT_MAPPER.readTree("{\"a\":1}"), next().profile());
        Assertions.assertEquals(OBJECT_MAPPER.readTree("[1,2]"), next().profile());
        Assertions.assertEquals(OBJECT_MAPPER.readTree("\"text\""), next().profile());
        Assertions.assertEquals(OBJECT_MAPPER.readTree("42"), next().profile());
        Assertions.assertNull(queue.take());
        Assertions.assertFalse(Files.exists(socketPath));
    }

    @Test
    public void testProfilesAreUnbranded() throws Exception {
        send("{\"a\":1}\n");
        systemUnderTest.close();

        final Profile profile = next();
        Assertions.assertNull(profile.uuid());
        Assertions.assertNull(profile.checksum());
    }

    @Test
    public void testMalformedLineStopsIntakeAndKeepsEarlierProfiles() throws Exception {
        send("{\"a\":1}\nnot json\n{\"b\":2}\n");

        final Throwable error = systemUnderTest.awaitSession();
        Assertions.assertInstanceOf(MalformedRecordException.class, error);
        Assertions.assertTrue(error.getMessage().contains("line 2"));

        systemUnderTest.close();
        queue.close();
        Assertions.assertEquals(OBJECT_MAPPER.readTree("{\"a\":1}"), next().profile());
        Assertions.assertNull(queue.take());
    }

    @Test
    public void testBlankLineIsMalformed() throws Exception {
        send("{\"a\":1}\n\n{\"b\":2}\n");

        Assertions.assertInstanceOf(MalformedRecordException.class, systemUnderTest.awaitSession());
        Assertions.assertEquals(1, queue.pending());
        systemUnderTest.close();
    }

    @Test
    public void testTwoValuesOnOneLineAreMalformed() throws Exception {
        send("{\"a\":1} {\"b\":2}\n");

        Assertions.assertInstanceOf(MalformedRecordException.class, systemUnderTest.awaitSession());
        Assertions.assertEquals(0, queue.pending());
        systemUnderTest.close();
    }

    @Test
    public void testLastLineWithoutNewlineIsStillRead() throws Exception {
        send("{\"a\":1}\n{\"b\":2}");

        Assertions.assertNull(systemUnderTest.awaitSession());
        Assertions.assertEquals(2, queue.pending());
        systemUnderTest.close();
    }

    @Test
    public void testSecondConnectionIsRefused() throws Exception {
        try (SocketChannel first = SocketChannel.open(UnixDomainSocketAddress.of(socketPath))) {
            first.write(ByteBuffer.wrap("{}\n".getBytes(StandardCharsets.UTF_8)));

            // the first profile arriving means the first client has been accepted
            Assertions.assertNotNull(next());
            Assertions.assertThrows(
                    IOException.class,
                    () -> SocketChannel.open(UnixDomainSocketAddress.of(socketPath)).close());
        }

        Assertions.assertNull(systemUnderTest.awaitSession());
        systemUnderTest.close();
    }

    @Test
    public void testBindingAnOccupiedNameFails() {
        final DataChannelListener second = new DataChannelListener(socketPath, OBJECT_MAPPER, queue);

        Assertions.assertThrows(IOException.class, () -> second.start(executor));
        systemUnderTest.abort();
    }

    @Test
    public void testAbortReleasesTheSocketWithoutAClient() throws Exception {
        Assertions.assertTrue(Files.exists(socketPath));

        systemUnderTest.abort();

        Assertions.assertFalse(Files.exists(socketPath));
    }
}
