package com.racklite.core;

import java.util.concurrent.atomic.AtomicReference;

/**
 * External cancellation signal for a running scan.

 * Cancellation is cooperative: host tasks and port checks consult the signal
 * before starting new work; dials already issued are allowed to finish.
 * The reason ends up in the error message of the FAILED scan.
 */
public class ScanCancellation
{

    // null until cancelled; set once together with the cancelled state
    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Signals cancellation. Only the first call records a reason.
     *
     * @param reason Human readable cause (null or blank records none)
     * @return true if this call cancelled the scan, false if it was already cancelled
     */
    public boolean cancel(String reason)
    {
        return this.reason.compareAndSet(null, reason != null ? reason : "");
    }

    public boolean isCancelled()
    {
        return reason.get() != null;
    }

    public String reason()
    {
        return reason.get();
    }
}
