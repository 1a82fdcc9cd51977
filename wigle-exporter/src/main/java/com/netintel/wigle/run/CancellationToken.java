package com.netintel.wigle.run;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Checked before each page request and each batch identifier.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
