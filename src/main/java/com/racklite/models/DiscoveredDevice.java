package com.racklite.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

/**
 * Provisional, evidence-based record of an observed host.

 * The same class serves two roles:
 * 1. Draft: produced by a host probe, not yet persisted (no firstSeen, no promotion data)
 * 2. Stored record: one row per IP, merged on every observation

 * Lifecycle:
 * - Created on first observation of an IP (firstSeen set once)
 * - Merged on every later observation (lastSeen, status, ports overwritten)
 * - Promoted exactly once (promotedToDeviceId / promotedAt then never change)
 * - Purged by the retention sweep only if never promoted
 */
public class DiscoveredDevice
{

    public String id;

    public String ip;

    public String macAddress;

    public String hostname;

    public String networkId;

    public DeviceStatus status = DeviceStatus.UNKNOWN;

    public int confidence;                              // 0-100

    public String osGuess;

    public String osFamily;

    public List<Integer> openPorts = new ArrayList<>(); // discovery order, not meaningful

    public List<ServiceInfo> services = new ArrayList<>();

    public Instant firstSeen;

    public Instant lastSeen;

    public String lastScanId;

    public String promotedToDeviceId;

    public Instant promotedAt;

    public String rawScanData;

    public Instant createdAt;

    public Instant updatedAt;

    /**
     * Checks whether this record was already promoted to an inventory device.
     *
     * @return true if promotedToDeviceId is set
     */
    public boolean isPromoted()
    {
        return promotedToDeviceId != null && !promotedToDeviceId.isEmpty();
    }

    /**
     * Checks whether a reverse DNS name was resolved.
     *
     * @return true if hostname is non-blank
     */
    public boolean hasHostname()
    {
        return hostname != null && !hostname.isBlank();
    }

    /**
     * Creates an independent copy. Null lists become empty lists and ServiceInfo entries are copied.
     *
     * @return copy of this record
     */
    public DiscoveredDevice copy()
    {
        var copy = new DiscoveredDevice();

        copy.id = id;

        copy.ip = ip;

        copy.macAddress = macAddress;

        copy.hostname = hostname;

        copy.networkId = networkId;

        copy.status = status;

        copy.confidence = confidence;

        copy.osGuess = osGuess;

        copy.osFamily = osFamily;

        copy.openPorts = openPorts != null ? new ArrayList<>(openPorts) : new ArrayList<>();

        copy.services = new ArrayList<>();

        if (services != null)
        {
            for (var service : services)
            {
                copy.services.add(service.copy());
            }
        }

        copy.firstSeen = firstSeen;

        copy.lastSeen = lastSeen;

        copy.lastScanId = lastScanId;

        copy.promotedToDeviceId = promotedToDeviceId;

        copy.promotedAt = promotedAt;

        copy.rawScanData = rawScanData;

        copy.createdAt = createdAt;

        copy.updatedAt = updatedAt;

        return copy;
    }

    public JsonObject toJson()
    {
        var serviceArray = new JsonArray();

        if (services != null)
        {
            for (var service : services)
            {
                serviceArray.add(service.toJson());
            }
        }

        return new JsonObject()
            .put("id", id)
            .put("ip", ip)
            .put("mac_address", macAddress)
            .put("hostname", hostname)
            .put("network_id", networkId)
            .put("status", status.value())
            .put("confidence", confidence)
            .put("os_guess", osGuess)
            .put("os_family", osFamily)
            .put("open_ports", ModelJson.integers(openPorts))
            .put("services", serviceArray)
            .put("first_seen", ModelJson.instant(firstSeen))
            .put("last_seen", ModelJson.instant(lastSeen))
            .put("last_scan_id", lastScanId)
            .put("promoted_to_device_id", promotedToDeviceId)
            .put("promoted_at", ModelJson.instant(promotedAt))
            .put("raw_scan_data", rawScanData)
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static DiscoveredDevice fromJson(JsonObject json)
    {
        var device = new DiscoveredDevice();

        device.id = json.getString("id");

        device.ip = json.getString("ip");

        device.macAddress = json.getString("mac_address");

        device.hostname = json.getString("hostname");

        device.networkId = json.getString("network_id");

        device.status = DeviceStatus.fromValue(json.getString("status"));

        device.confidence = json.getInteger("confidence", 0);

        device.osGuess = json.getString("os_guess");

        device.osFamily = json.getString("os_family");

        device.openPorts = ModelJson.integers(json, "open_ports");

        var serviceArray = json.getJsonArray("services", new JsonArray());

        for (var i = 0; i < serviceArray.size(); i++)
        {
            device.services.add(ServiceInfo.fromJson(serviceArray.getJsonObject(i)));
        }

        device.firstSeen = ModelJson.instant(json, "first_seen");

        device.lastSeen = ModelJson.instant(json, "last_seen");

        device.lastScanId = json.getString("last_scan_id");

        device.promotedToDeviceId = json.getString("promoted_to_device_id");

        device.promotedAt = ModelJson.instant(json, "promoted_at");

        device.rawScanData = json.getString("raw_scan_data");

        device.createdAt = ModelJson.instant(json, "created_at");

        device.updatedAt = ModelJson.instant(json, "updated_at");

        return device;
    }
}
