package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.exception.TransportException;
import com.nectarstudio.realtime.registry.ChannelRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bounded FIFO of frames for one channel, drained by at most one task at a time.
 * <p>
 * When full, the oldest frame is dropped and the channel is flagged for resync. While
 * flagged only refresh updates are accepted; the next one clears the flag, since a full
 * snapshot makes everything lost before it irrelevant. A new outbox starts paused and
 * sends nothing until {@link #open} is called.
 */
@Slf4j
public class ChannelOutbox {

    public interface DropListener {
        void onDropped(ChannelRef channel, OutboundMessage message);
    }

    private final ChannelRef channel;
    private final DuplexChannel connection;
    private final int capacity;
    private final Executor executor;
    private final DropListener dropListener;

    private final Deque<OutboundMessage> queue = new ArrayDeque<>();
    private boolean open;
    private boolean closed;
    private boolean draining;
    private boolean resyncRequired;

    public ChannelOutbox(ChannelRef channel, DuplexChannel connection, int capacity, Executor executor,
                         DropListener dropListener) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Outbox capacity must be positive: " + capacity);
        }
        this.channel = channel;
        this.connection = connection;
        this.capacity = capacity;
        this.executor = executor;
        this.dropListener = dropListener;
    }

    /**
     * Queues a frame.
     *
     * @return false when the frame was rejected because the outbox is closed or awaiting a resync
     */
    public boolean offer(OutboundMessage message) {
        OutboundMessage dropped;
        synchronized (this) {
            if (closed) {
                return false;
            }
            if (resyncRequired && !message.refresh()) {
                dropped = message;
            } else {
                dropped = null;
                if (message.refresh()) {
                    resyncRequired = false;
                }
                if (queue.size() >= capacity) {
                    OutboundMessage oldest = queue.pollFirst();
                    resyncRequired = !message.refresh();
                    notifyDropped(oldest);
                }
                queue.addLast(message);
            }
        }
        if (dropped != null) {
            notifyDropped(dropped);
            return false;
        }
        drainIfIdle();
        return true;
    }

    /**
     * Puts a frame ahead of everything queued, bypassing the bound. Used for the subscription
     * confirmation, which must precede any update queued while the channel was pending.
     */
    public void offerFirst(OutboundMessage message) {
        synchronized (this) {
            if (closed) {
                return;
            }
            queue.addFirst(message);
        }
        drainIfIdle();
    }

    public void open() {
        synchronized (this) {
            open = true;
        }
        drainIfIdle();
    }

    /**
     * Discards queued frames and stops sending. Frames being written complete.
     */
    public synchronized void close() {
        closed = true;
        queue.clear();
    }

    /**
     * Discards queued frames without closing.
     */
    public synchronized void clear() {
        queue.clear();
        resyncRequired = false;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isResyncRequired() {
        return resyncRequired;
    }

    public ChannelRef channel() {
        return channel;
    }

    private void drainIfIdle() {
        synchronized (this) {
            if (!open || closed || draining || queue.isEmpty()) {
                return;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected drain of {}: {}", channel, e.getMessage());
            synchronized (this) {
                draining = false;
            }
        }
    }

    private void drain() {
        while (true) {
            OutboundMessage next;
            synchronized (this) {
                next = closed ? null : queue.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                connection.send(next.frame());
            } catch (TransportException e) {
                log.info("🔌 Delivery to {} failed, dropping connection: {}", channel, e.getMessage());
                close();
                connection.close();
                return;
            }
        }
    }

    private void notifyDropped(OutboundMessage message) {
        if (dropListener != null) {
            dropListener.onDropped(channel, message);
        }
    }
}
