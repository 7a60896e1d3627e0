package com.finopti.remediation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one remediation run. Once raised it stays raised.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call raised the token, false if it was already raised
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
