package com.racklite.models;

/**
 * Liveness status of a discovered device as observed by the last probe.

 * - ONLINE: at least one probed TCP port accepted a connection
 * - OFFLINE: no probed port accepted a connection
 * - UNKNOWN: never probed or probe abandoned
 */
public enum DeviceStatus
{

    ONLINE,

    OFFLINE,

    UNKNOWN;

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
     * Parses a stored status value, falling back to UNKNOWN.
     *
     * @param value stored value (case-insensitive, may be null)
     * @return matching status
     */
    public static DeviceStatus fromValue(String value)
    {
        if (value == null)
        {
            return UNKNOWN;
        }

        for (var status : values())
        {
            if (status.name().equalsIgnoreCase(value))
            {
                return status;
            }
        }

        return UNKNOWN;
    }
}
