package com.indigententerprises.telemetry.common.infrastructure;

import com.indigententerprises.telemetry.common.domain.Profile;
import com.indigententerprises.telemetry.common.serviceinterfaces.MalformedRecordException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Reads newline delimited JSON from the instrumented child and queues one
 * {@link Profile} per line. The first line that is not exactly one JSON value ends the
 * session; profiles queued before it are kept.
 */
public final class DataChannelListener extends SingleSessionListener {

    private static final Logger log = LoggerFactory.getLogger(DataChannelListener.class);

    private final ObjectReader reader;
    private final RelayQueue queue;

    public DataChannelListener(
            final Path socketPath,
            final ObjectMapper objectMapper,
            final RelayQueue queue) {
        super("data", socketPath);
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.queue = queue;
    }

    @Override
    protected void serve(final SocketChannel client) throws Exception {
        final BufferedReader lines = new BufferedReader(
                new InputStreamReader(Channels.newInputStream(client), StandardCharsets.UTF_8));

        // mutable data
        String line;
        long lineNumber = 0;

        while ((line = lines.readLine()) != null) {
            lineNumber++;
            queue.put(Profile.of(decode(line, lineNumber)));
        }

        log.debug("data channel delivered {} profiles", lineNumber);
    }

    private JsonNode decode(final String line, final long lineNumber) throws MalformedRecordException {
        final JsonNode payload;

        try {
            payload = reader.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("line " + lineNumber + " is not valid JSON", e);
        }

        // readTree yields a missing node for blank input
        if (payload == null || payload.isMissingNode()) {
            throw new MalformedRecordException("line " + lineNumber + " holds no JSON value");
        } else {
            return payload;
        }
    }
}
