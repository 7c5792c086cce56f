package com.lumina.agent.core;

import com.lumina.agent.exception.TaskCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by everything one task does.
 * Callbacks may run more than once and must be idempotent.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            callbacks.forEach(this::runQuietly);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new TaskCancelledException();
        }
    }

    /**
     * Registers a callback fired on cancellation, immediately if already cancelled.
     * Returns a handle that deregisters it.
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
