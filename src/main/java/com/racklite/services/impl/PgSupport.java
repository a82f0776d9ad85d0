package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.models.Address;

import com.racklite.models.Datacenter;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.Network;

import com.racklite.models.ScanStatus;

import com.racklite.models.ServiceInfo;

import io.vertx.core.json.JsonArray;

import io.vertx.pgclient.PgException;

import io.vertx.sqlclient.Row;

import java.time.Instant;

import java.time.OffsetDateTime;

import java.time.ZoneOffset;

import java.util.ArrayList;

import java.util.Arrays;

import java.util.List;

/**
 * Row mapping, parameter conversion and error translation shared by the PostgreSQL services.
 */
final class PgSupport
{

    static final String UNIQUE_VIOLATION = "23505";

    static final String FOREIGN_KEY_VIOLATION = "23503";

    private PgSupport()
    {
    }

    // ===== errors =====

    static boolean hasSqlState(Throwable cause, String sqlState)
    {
        return cause instanceof PgException && sqlState.equals(((PgException) cause).getSqlState());
    }

    /**
     * Translate a database failure into a DiscoveryException.
     *
     * @param operation Operation name for the message
     * @param cause Original failure
     * @return DiscoveryException (unchanged if it already is one)
     */
    static DiscoveryException translate(String operation, Throwable cause)
    {
        if (cause instanceof DiscoveryException)
        {
            return (DiscoveryException) cause;
        }

        if (hasSqlState(cause, FOREIGN_KEY_VIOLATION))
        {
            return new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE,
                operation + ": referenced record does not exist", cause);
        }

        if (hasSqlState(cause, UNIQUE_VIOLATION))
        {
            return new DiscoveryException(DiscoveryException.Kind.INVALID_REQUEST,
                operation + ": record already exists", cause);
        }

        return new DiscoveryException(DiscoveryException.Kind.STORAGE, operation + ": " + cause.getMessage(), cause);
    }

    // ===== parameters =====

    static OffsetDateTime timestamp(Instant instant)
    {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static Integer[] integerArray(List<Integer> values)
    {
        return values != null ? values.toArray(new Integer[0]) : new Integer[0];
    }

    static String[] stringArray(List<String> values)
    {
        return values != null ? values.toArray(new String[0]) : new String[0];
    }

    static JsonArray servicesJson(List<ServiceInfo> services)
    {
        var array = new JsonArray();

        if (services != null)
        {
            for (var service : services)
            {
                array.add(service.toJson());
            }
        }

        return array;
    }

    // ===== rows =====

    static Instant instant(Row row, String column)
    {
        var value = row.getOffsetDateTime(column);

        return value != null ? value.toInstant() : null;
    }

    static List<Integer> integers(Row row, String column)
    {
        var values = row.getArrayOfIntegers(column);

        return values != null ? new ArrayList<>(Arrays.asList(values)) : new ArrayList<>();
    }

    static List<String> strings(Row row, String column)
    {
        var values = row.getArrayOfStrings(column);

        return values != null ? new ArrayList<>(Arrays.asList(values)) : new ArrayList<>();
    }

    static Network toNetwork(Row row)
    {
        var network = new Network(row.getString("id"), row.getString("name"),
            row.getString("subnet"), row.getString("datacenter_id"));

        network.description = row.getString("description");

        network.createdAt = instant(row, "created_at");

        network.updatedAt = instant(row, "updated_at");

        return network;
    }

    static Datacenter toDatacenter(Row row)
    {
        var datacenter = new Datacenter(row.getString("id"), row.getString("name"));

        datacenter.location = row.getString("location");

        datacenter.description = row.getString("description");

        datacenter.createdAt = instant(row, "created_at");

        datacenter.updatedAt = instant(row, "updated_at");

        return datacenter;
    }

    static Address toAddress(Row row)
    {
        var address = new Address();

        address.ip = row.getString("ip");

        var port = row.getInteger("port");

        address.port = port != null ? port : 0;

        address.type = row.getString("type");

        address.label = row.getString("label");

        address.networkId = row.getString("network_id");

        address.switchPort = row.getString("switch_port");

        return address;
    }

    static DiscoveredDevice toDiscovered(Row row)
    {
        var device = new DiscoveredDevice();

        device.id = row.getString("id");

        device.ip = row.getString("ip");

        device.macAddress = row.getString("mac_address");

        device.hostname = row.getString("hostname");

        device.networkId = row.getString("network_id");

        device.status = DeviceStatus.fromValue(row.getString("status"));

        device.confidence = row.getInteger("confidence");

        device.osGuess = row.getString("os_guess");

        device.osFamily = row.getString("os_family");

        device.openPorts = integers(row, "open_ports");

        var services = row.getJsonArray("services");

        if (services != null)
        {
            for (var i = 0; i < services.size(); i++)
            {
                device.services.add(ServiceInfo.fromJson(services.getJsonObject(i)));
            }
        }

        device.firstSeen = instant(row, "first_seen");

        device.lastSeen = instant(row, "last_seen");

        device.lastScanId = row.getString("last_scan_id");

        device.promotedToDeviceId = row.getString("promoted_to_device_id");

        device.promotedAt = instant(row, "promoted_at");

        device.rawScanData = row.getString("raw_scan_data");

        device.createdAt = instant(row, "created_at");

        device.updatedAt = instant(row, "updated_at");

        return device;
    }

    static DiscoveryScan toScan(Row row)
    {
        var scan = new DiscoveryScan();

        scan.id = row.getString("id");

        scan.networkId = row.getString("network_id");

        scan.status = ScanStatus.fromValue(row.getString("status"));

        scan.scanType = row.getString("scan_type");

        scan.scanDepth = row.getInteger("scan_depth");

        scan.totalHosts = row.getInteger("total_hosts");

        scan.scannedHosts = row.getInteger("scanned_hosts");

        scan.foundHosts = row.getInteger("found_hosts");

        scan.startedAt = instant(row, "started_at");

        scan.completedAt = instant(row, "completed_at");

        scan.durationSeconds = row.getInteger("duration_seconds");

        scan.errorMessage = row.getString("error_message");

        scan.createdAt = instant(row, "created_at");

        scan.updatedAt = instant(row, "updated_at");

        return scan;
    }

    static DiscoveryRule toRule(Row row)
    {
        var rule = new DiscoveryRule();

        rule.id = row.getString("id");

        rule.networkId = row.getString("network_id");

        rule.enabled = row.getBoolean("enabled");

        rule.scanIntervalHours = row.getInteger("scan_interval_hours");

        rule.scanType = row.getString("scan_type");

        rule.maxConcurrentScans = row.getInteger("max_concurrent_scans");

        rule.timeoutSeconds = row.getInteger("timeout_seconds");

        rule.scanPorts = row.getBoolean("scan_ports");

        rule.portScanType = row.getString("port_scan_type");

        rule.customPorts = integers(row, "custom_ports");

        rule.serviceDetection = row.getBoolean("service_detection");

        rule.osDetection = row.getBoolean("os_detection");

        rule.excludeIps = strings(row, "exclude_ips");

        rule.excludeHosts = strings(row, "exclude_hosts");

        rule.createdAt = instant(row, "created_at");

        rule.updatedAt = instant(row, "updated_at");

        return rule;
    }
}
