package com.nectarstudio.realtime.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handler bookkeeping shared by channel implementations.
 */
@Slf4j
public abstract class AbstractDuplexChannel implements DuplexChannel {

    private final String id;
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Consumer<String> messageHandler;

    protected AbstractDuplexChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void onMessage(Consumer<String> handler) {
        this.messageHandler = handler;
    }

    @Override
    public void onClose(Runnable callback) {
        closeCallbacks.add(callback);
        if (closed.get()) {
            callback.run();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Hands an inbound frame to the registered handler.
     */
    public void dispatchMessage(String message) {
        Consumer<String> handler = messageHandler;
        if (handler == null) {
            log.warn("No handler on connection {}, dropping inbound frame", id);
            return;
        }
        handler.accept(message);
    }

    /**
     * Marks the connection closed and runs the close callbacks, once.
     */
    public void dispatchClose() {
        if (closed.compareAndSet(false, true)) {
            for (Runnable callback : closeCallbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("Close callback failed on connection {}: {}", id, e.getMessage(), e);
                }
            }
        }
    }
}
