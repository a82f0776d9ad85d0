package com.racklite.core;

/**
 * Failure raised by the discovery engine and its storage services.

 * The kind lets callers react without parsing messages:
 * - NOT_FOUND: referenced scan, rule, network or discovered device does not exist
 * - ALREADY_PROMOTED: discovered device was promoted before
 * - INVALID_REQUEST: caller input failed validation
 * - INVALID_REFERENCE: datacenter or network referenced by a promotion does not exist
 * - CONFIGURATION: scan could not start (missing network, bad subnet)
 * - CANCELLED: scan stopped by an external cancellation signal
 * - STORAGE: persistence layer failure
 */
public class DiscoveryException extends RuntimeException
{

    public enum Kind
    {
        NOT_FOUND,

        ALREADY_PROMOTED,

        INVALID_REQUEST,

        INVALID_REFERENCE,

        CONFIGURATION,

        CANCELLED,

        STORAGE
    }

    private final Kind kind;

    public DiscoveryException(Kind kind, String message)
    {
        super(message);

        this.kind = kind;
    }

    public DiscoveryException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);

        this.kind = kind;
    }

    public Kind kind()
    {
        return kind;
    }

    public static DiscoveryException notFound(String message)
    {
        return new DiscoveryException(Kind.NOT_FOUND, message);
    }

    public static DiscoveryException invalidRequest(String message)
    {
        return new DiscoveryException(Kind.INVALID_REQUEST, message);
    }

    /**
     * Checks whether a failure is a DiscoveryException of the given kind.
     *
     * @param cause failure to inspect (may be null)
     * @param kind expected kind
     * @return true if it matches
     */
    public static boolean isKind(Throwable cause, Kind kind)
    {
        return cause instanceof DiscoveryException && ((DiscoveryException) cause).kind == kind;
    }
}
