package com.racklite.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

/**
 * Per-network scan configuration. One rule per network.

 * The baseline engine reads:
 * - enabled, scanIntervalHours (scheduler)
 * - scanType (depth label only)
 * - timeoutSeconds (per-port dial and DNS deadline)
 * - maxConcurrentScans (host fan-out limit)
 * - excludeIps (literal IPs or CIDRs skipped during enumeration)

 * The remaining flags (ports, service/OS detection, custom ports, excluded
 * hostnames) are stored for premium scanners and ignored here.
 */
public class DiscoveryRule
{

    public static final String SCAN_TYPE_QUICK = "quick";

    public static final String SCAN_TYPE_FULL = "full";

    public static final String SCAN_TYPE_DEEP = "deep";

    public static final int DEFAULT_TIMEOUT_SECONDS = 2;

    public static final int DEFAULT_MAX_CONCURRENT_SCANS = 5;

    public static final int DEFAULT_SCAN_INTERVAL_HOURS = 24;

    public String id;

    public String networkId;

    public boolean enabled = true;

    public int scanIntervalHours = DEFAULT_SCAN_INTERVAL_HOURS;

    public String scanType = SCAN_TYPE_FULL;

    public int maxConcurrentScans = DEFAULT_MAX_CONCURRENT_SCANS;

    public int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    public boolean scanPorts = true;

    public String portScanType = "common";      // common, full, custom

    public List<Integer> customPorts = new ArrayList<>();

    public boolean serviceDetection;

    public boolean osDetection;

    public List<String> excludeIps = new ArrayList<>();

    public List<String> excludeHosts = new ArrayList<>();

    public Instant createdAt;

    public Instant updatedAt;

    /**
     * Host fan-out limit, falling back to the default when unset.
     *
     * @return positive concurrency limit
     */
    public int effectiveMaxConcurrentScans()
    {
        return maxConcurrentScans > 0 ? maxConcurrentScans : DEFAULT_MAX_CONCURRENT_SCANS;
    }

    /**
     * Per-host timeout, falling back to the default when unset.
     *
     * @return positive timeout in seconds
     */
    public int effectiveTimeoutSeconds()
    {
        return timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("network_id", networkId)
            .put("enabled", enabled)
            .put("scan_interval_hours", scanIntervalHours)
            .put("scan_type", scanType)
            .put("max_concurrent_scans", maxConcurrentScans)
            .put("timeout_seconds", timeoutSeconds)
            .put("scan_ports", scanPorts)
            .put("port_scan_type", portScanType)
            .put("custom_ports", ModelJson.integers(customPorts))
            .put("service_detection", serviceDetection)
            .put("os_detection", osDetection)
            .put("exclude_ips", ModelJson.strings(excludeIps))
            .put("exclude_hosts", ModelJson.strings(excludeHosts))
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static DiscoveryRule fromJson(JsonObject json)
    {
        var rule = new DiscoveryRule();

        rule.id = json.getString("id");

        rule.networkId = json.getString("network_id");

        rule.enabled = json.getBoolean("enabled", true);

        rule.scanIntervalHours = json.getInteger("scan_interval_hours", DEFAULT_SCAN_INTERVAL_HOURS);

        rule.scanType = json.getString("scan_type", SCAN_TYPE_FULL);

        rule.maxConcurrentScans = json.getInteger("max_concurrent_scans", DEFAULT_MAX_CONCURRENT_SCANS);

        rule.timeoutSeconds = json.getInteger("timeout_seconds", DEFAULT_TIMEOUT_SECONDS);

        rule.scanPorts = json.getBoolean("scan_ports", true);

        rule.portScanType = json.getString("port_scan_type", "common");

        rule.customPorts = ModelJson.integers(json, "custom_ports");

        rule.serviceDetection = json.getBoolean("service_detection", false);

        rule.osDetection = json.getBoolean("os_detection", false);

        rule.excludeIps = ModelJson.strings(json, "exclude_ips");

        rule.excludeHosts = ModelJson.strings(json, "exclude_hosts");

        rule.createdAt = ModelJson.instant(json, "created_at");

        rule.updatedAt = ModelJson.instant(json, "updated_at");

        return rule;
    }
}
