package com.schema.migration.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-controlled cancellation signal accepted by every store operation and by
 * pool acquisition. Cancellation is cooperative: it is observed before a new
 * statement or acquisition begins, never in the middle of one.
 *
 * <p>Usage:</p>
 * <pre>
 * CancellationToken token = CancellationToken.create();
 * executor.submit(() -&gt; runner.run(token, migrations));
 * ...
 * token.cancel();
 * </pre>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a new token that can be cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns a shared token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Cancels the token and runs the registered listeners. Idempotent.
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Throws {@link OperationCancelledException} if the token has been cancelled.
     *
     * @param operation description of the operation about to start
     */
    public void throwIfCancelled(String operation) {
        if (cancelled) {
            throw new OperationCancelledException(operation + ": cancelled");
        }
    }

    /**
     * Registers a listener invoked once when the token is cancelled.
     * If the token is already cancelled the listener runs immediately on the calling thread.
     *
     * @return a registration that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> { };
        }
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
