package io.github.flameyossnowy.geofilter.api.session;

import io.github.flameyossnowy.geofilter.api.exceptions.FilterCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by executors between pages of rows.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new FilterCancelledException("Cancelled during " + operation);
        }
    }
}
