package com.indigententerprises.telemetry.common.infrastructure;

import com.indigententerprises.telemetry.common.domain.RecordKind;
import com.indigententerprises.telemetry.common.domain.Relayable;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered hand-off between the producers (supervisor, data channel) and the single
 * outbound relay. Closing appends an end marker, so the reader sees the end of the
 * stream only after everything put before the close.
 */
public final class RelayQueue {

    private static final Relayable END_OF_STREAM = new Relayable() {
        @Override
        public RecordKind kind() {
            throw new UnsupportedOperationException("end of stream");
        }

        @Override
        public Relayable brand(final UUID uuid, final String checksum) {
            throw new UnsupportedOperationException("end of stream");
        }
    };

    private final BlockingQueue<Relayable> items;
    private final AtomicBoolean closed;

    // reader side only
    private boolean drained;

    public RelayQueue() {
        this.items = new LinkedBlockingQueue<>();
        this.closed = new AtomicBoolean(false);
        this.drained = false;
    }

    public void put(final Relayable item) throws InterruptedException {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        } else if (closed.get()) {
            throw new IllegalStateException("relay queue is closed");
        } else {
            items.put(item);
        }
    }

    /**
     * Marks the end of input. Items already queued stay queued. Closing twice has no effect.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            items.add(END_OF_STREAM);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Blocks for the next item.
     *
     * @return the next item, or null once the queue has been closed and drained
     */
    public Relayable take() throws InterruptedException {
        if (drained) {
            return null;
        } else {
            final Relayable item = items.take();

            if (item == END_OF_STREAM) {
                drained = true;
                return null;
            } else {
                return item;
            }
        }
    }

    /**
     * @return the number of items put but not yet taken
     */
    public int pending() {
        int result = 0;

        for (final Relayable item : items) {
            if (item != END_OF_STREAM) {
                result++;
            }
        }

        return result;
    }
}
