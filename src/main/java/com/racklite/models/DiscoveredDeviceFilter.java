package com.racklite.models;

import io.vertx.core.json.JsonObject;

/**
 * Filter criteria for listing discovered devices. Unset fields match everything.
 */
public class DiscoveredDeviceFilter
{

    public String networkId;

    public DeviceStatus status;

    public Boolean promoted;        // null = all, true = promoted only, false = not promoted

    public int minConfidence;

    /**
     * Checks a record against this filter.
     *
     * @param device candidate record
     * @return true if every set criterion matches
     */
    public boolean matches(DiscoveredDevice device)
    {
        if (networkId != null && !networkId.isEmpty() && !networkId.equals(device.networkId))
        {
            return false;
        }

        if (status != null && status != device.status)
        {
            return false;
        }

        if (promoted != null && promoted != device.isPromoted())
        {
            return false;
        }

        return device.confidence >= minConfidence;
    }

    public static DiscoveredDeviceFilter fromJson(JsonObject json)
    {
        var filter = new DiscoveredDeviceFilter();

        if (json == null)
        {
            return filter;
        }

        filter.networkId = json.getString("network_id");

        var status = json.getString("status");

        filter.status = status != null && !status.isEmpty() ? DeviceStatus.fromValue(status) : null;

        filter.promoted = json.getBoolean("promoted");

        filter.minConfidence = json.getInteger("min_confidence", 0);

        return filter;
    }
}
