package com.racklite.models;

/**
 * Scan status enum for tracking a discovery scan through its lifecycle

 * State Machine:
 * PENDING → RUNNING → COMPLETED
 *                   → FAILED
 * PENDING → FAILED (configuration error before any host work)

 * Transitions only move forward; COMPLETED and FAILED are terminal.
 */
public enum ScanStatus
{

    PENDING,        // Created, not yet started

    RUNNING,        // Hosts being probed

    COMPLETED,      // All host tasks finished

    FAILED;         // Configuration error or cancellation

    /**
     * Lower-case form used in JSON and database columns.
     *
     * @return status value
     */
    public String value()
    {
        return name().toLowerCase();
    }

    /**
     * Checks whether this status is terminal.
     *
     * @return true for COMPLETED and FAILED
     */
    public boolean isTerminal()
    {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks whether a transition to the given status moves forward.
     * Staying in the same non-terminal status is allowed (progress updates);
     * nothing leaves a terminal status.
     *
     * @param next requested status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ScanStatus next)
    {
        if (next == null || isTerminal())
        {
            return false;
        }

        return next.ordinal() >= ordinal();
    }

    /**
     * Parses a stored status value.
     *
     * @param value stored value (case-insensitive)
     * @return matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ScanStatus fromValue(String value)
    {
        if (value == null)
        {
            throw new IllegalArgumentException("Scan status cannot be null");
        }

        return valueOf(value.trim().toUpperCase());
    }
}
