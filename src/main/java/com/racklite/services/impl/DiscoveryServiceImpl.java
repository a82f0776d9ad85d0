package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.core.DiscoveryReconciler;

import com.racklite.core.PromotionWorkflow;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveredDeviceFilter;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.PromoteDeviceRequest;

import com.racklite.models.ScanStatus;

import com.racklite.services.DiscoveryService;

import com.racklite.utils.DiscoveryValidationUtil;

import io.vertx.core.Future;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Row;

import io.vertx.sqlclient.RowSet;

import io.vertx.sqlclient.SqlConnection;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * DiscoveryServiceImpl - PostgreSQL implementation of DiscoveryService

 * Provides:
 * - Reconciling upsert by IP (SELECT ... FOR UPDATE inside a transaction, one retry
 *   when two first observations of the same IP race on the unique index)
 * - Transactional promotion: device, addresses, tags, domains and the promotion mark
 *   commit together or not at all
 * - Scan and rule CRUD with forward-only scan status
 */
public class DiscoveryServiceImpl implements DiscoveryService
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryServiceImpl.class);

    private static final String DISCOVERED_COLUMNS = """
            id, ip, mac_address, hostname, network_id, status, confidence, os_guess, os_family,
            open_ports, services, first_seen, last_seen, last_scan_id, promoted_to_device_id,
            promoted_at, raw_scan_data, created_at, updated_at
            """;

    private static final String SCAN_COLUMNS = """
            id, network_id, status, scan_type, scan_depth, total_hosts, scanned_hosts, found_hosts,
            started_at, completed_at, duration_seconds, error_message, created_at, updated_at
            """;

    private static final String RULE_COLUMNS = """
            id, network_id, enabled, scan_interval_hours, scan_type, max_concurrent_scans, timeout_seconds,
            scan_ports, port_scan_type, custom_ports, service_detection, os_detection, exclude_ips,
            exclude_hosts, created_at, updated_at
            """;

    private final Pool pgPool;

    /**
     * Constructor for DiscoveryServiceImpl
     *
     * @param pgPool PostgreSQL connection pool
     */
    public DiscoveryServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    // ===== DISCOVERED DEVICES =====

    @Override
    public Future<List<DiscoveredDevice>> discoveredList(DiscoveredDeviceFilter filter)
    {
        var effectiveFilter = filter != null ? filter : new DiscoveredDeviceFilter();

        var sql = new StringBuilder("SELECT ").append(DISCOVERED_COLUMNS).append(" FROM discovered_devices WHERE confidence >= $1");

        var params = Tuple.of(effectiveFilter.minConfidence);

        if (effectiveFilter.networkId != null && !effectiveFilter.networkId.isEmpty())
        {
            params.addString(effectiveFilter.networkId);

            sql.append(" AND network_id = $").append(params.size());
        }

        if (effectiveFilter.status != null)
        {
            params.addString(effectiveFilter.status.value());

            sql.append(" AND status = $").append(params.size());
        }

        if (effectiveFilter.promoted != null)
        {
            sql.append(effectiveFilter.promoted ? " AND promoted_to_device_id IS NOT NULL" : " AND promoted_to_device_id IS NULL");
        }

        sql.append(" ORDER BY last_seen DESC");

        return pgPool.preparedQuery(sql.toString())
            .execute(params)
            .map(rows ->
            {
                var devices = new ArrayList<DiscoveredDevice>();

                for (var row : rows)
                {
                    devices.add(PgSupport.toDiscovered(row));
                }

                return (List<DiscoveredDevice>) devices;
            })
            .recover(cause -> Future.failedFuture(PgSupport.translate("list discovered devices", cause)));
    }

    @Override
    public Future<DiscoveredDevice> discoveredGetById(String id)
    {
        return findDiscovered(pgPool.preparedQuery("SELECT " + DISCOVERED_COLUMNS + " FROM discovered_devices WHERE id = $1")
            .execute(Tuple.of(id)), "discovered device not found: " + id);
    }

    @Override
    public Future<DiscoveredDevice> discoveredGetByIp(String ip)
    {
        return findDiscovered(pgPool.preparedQuery("SELECT " + DISCOVERED_COLUMNS + " FROM discovered_devices WHERE ip = $1")
            .execute(Tuple.of(ip)), "discovered device not found for ip: " + ip);
    }

    @Override
    public Future<DiscoveredDevice> discoveredUpsert(DiscoveredDevice draft)
    {
        if (draft == null || draft.ip == null || draft.ip.isBlank())
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("discovered device ip is required"));
        }

        return upsertOnce(draft)
            .recover(cause ->
            {
                // A concurrent first observation inserted the row; the retry sees it and merges
                if (PgSupport.hasSqlState(cause, PgSupport.UNIQUE_VIOLATION))
                {
                    logger.debug("Concurrent insert for {}, retrying as update", draft.ip);

                    return upsertOnce(draft);
                }

                return Future.failedFuture(cause);
            })
            .recover(cause -> Future.failedFuture(PgSupport.translate("upsert discovered device " + draft.ip, cause)));
    }

    private Future<DiscoveredDevice> upsertOnce(DiscoveredDevice draft)
    {
        return pgPool.withTransaction(connection -> connection
            .preparedQuery("SELECT " + DISCOVERED_COLUMNS + " FROM discovered_devices WHERE ip = $1 FOR UPDATE")
            .execute(Tuple.of(draft.ip))
            .compose(rows ->
            {
                var existing = rows.size() > 0 ? PgSupport.toDiscovered(rows.iterator().next()) : null;

                var merged = DiscoveryReconciler.merge(existing, draft, Instant.now());

                var sql = existing == null ? """
                        INSERT INTO discovered_devices (id, ip, mac_address, hostname, network_id, status, confidence,
                            os_guess, os_family, open_ports, services, first_seen, last_seen, last_scan_id,
                            promoted_to_device_id, promoted_at, raw_scan_data, created_at, updated_at)
                        VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $13, $14, $15, $16, $17, $18, $19)
                        """ : """
                        UPDATE discovered_devices
                        SET ip = $2, mac_address = $3, hostname = $4, network_id = $5, status = $6, confidence = $7,
                            os_guess = $8, os_family = $9, open_ports = $10, services = $11, first_seen = $12,
                            last_seen = $13, last_scan_id = $14, promoted_to_device_id = $15, promoted_at = $16,
                            raw_scan_data = $17, created_at = $18, updated_at = $19
                        WHERE id = $1
                        """;

                return connection.preparedQuery(sql)
                    .execute(discoveredTuple(merged))
                    .map(result -> merged);
            }));
    }

    @Override
    public Future<Void> discoveredDelete(String id)
    {
        return pgPool.preparedQuery("DELETE FROM discovered_devices WHERE id = $1")
            .execute(Tuple.of(id))
            .recover(cause -> Future.failedFuture(PgSupport.translate("delete discovered device", cause)))
            .compose(result -> result.rowCount() == 0
                ? Future.failedFuture(DiscoveryException.notFound("discovered device not found: " + id))
                : Future.succeededFuture());
    }

    @Override
    public Future<Device> discoveredPromote(String id, PromoteDeviceRequest request)
    {
        var validationError = DiscoveryValidationUtil.validatePromoteRequest(request);

        if (validationError != null)
        {
            return Future.failedFuture(DiscoveryException.invalidRequest(validationError));
        }

        return pgPool.<Device>withTransaction(connection -> connection
            .preparedQuery("SELECT " + DISCOVERED_COLUMNS + " FROM discovered_devices WHERE id = $1 FOR UPDATE")
            .execute(Tuple.of(id))
            .compose(rows ->
            {
                if (rows.size() == 0)
                {
                    return Future.failedFuture(DiscoveryException.notFound("discovered device not found: " + id));
                }

                var discovered = PgSupport.toDiscovered(rows.iterator().next());

                if (discovered.isPromoted())
                {
                    return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.ALREADY_PROMOTED,
                        "discovered device " + id + " already promoted to device " + discovered.promotedToDeviceId));
                }

                return connection.query("SELECT id, name, location, description, created_at, updated_at FROM datacenters")
                    .execute()
                    .compose(datacenterRows ->
                    {
                        var datacenters = new ArrayList<Datacenter>();

                        for (var row : datacenterRows)
                        {
                            datacenters.add(PgSupport.toDatacenter(row));
                        }

                        var datacenterId = PromotionWorkflow.resolveDatacenterId(request, datacenters);

                        if (datacenterId != null && datacenters.stream().noneMatch(datacenter -> datacenter.id.equals(datacenterId)))
                        {
                            return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE,
                                "datacenter not found: " + datacenterId));
                        }

                        var now = Instant.now();

                        var device = PromotionWorkflow.buildDevice(discovered, request, datacenterId, now);

                        return insertDevice(connection, device)
                            .compose(v -> connection
                                .preparedQuery("UPDATE discovered_devices SET promoted_to_device_id = $2, promoted_at = $3, updated_at = $3 WHERE id = $1")
                                .execute(Tuple.of(id, device.id, PgSupport.timestamp(now))))
                            .map(result -> device);
                    });
            }))
            .onSuccess(device -> logger.debug("Discovered device {} promoted to {}", id, device.id))
            .recover(cause -> Future.failedFuture(PgSupport.translate("promote discovered device " + id, cause)));
    }

    private Future<Void> insertDevice(SqlConnection connection, Device device)
    {
        var deviceSql = """
                INSERT INTO devices (id, name, description, make_model, os, datacenter_id, username, location, created_at, updated_at)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $9)
                """;

        var deviceTuple = Tuple.of(device.id, device.name, device.description, device.makeModel, device.os,
            device.datacenterId, device.username, device.location, PgSupport.timestamp(device.createdAt));

        return connection.preparedQuery(deviceSql)
            .execute(deviceTuple)
            .compose(result ->
            {
                var addressTuples = new ArrayList<Tuple>();

                for (var address : device.addresses)
                {
                    addressTuples.add(Tuple.of(device.id, address.ip, address.port, address.type, address.label,
                        address.networkId, address.switchPort));
                }

                return executeBatch(connection, """
                        INSERT INTO addresses (device_id, ip, port, type, label, network_id, switch_port)
                        VALUES ($1, $2, $3, $4, $5, $6, $7)
                        """, addressTuples);
            })
            .compose(v ->
            {
                var tagTuples = new ArrayList<Tuple>();

                for (var tag : device.tags)
                {
                    tagTuples.add(Tuple.of(device.id, tag));
                }

                return executeBatch(connection, "INSERT INTO tags (device_id, tag) VALUES ($1, $2) ON CONFLICT DO NOTHING", tagTuples);
            })
            .compose(v ->
            {
                var domainTuples = new ArrayList<Tuple>();

                for (var domain : device.domains)
                {
                    domainTuples.add(Tuple.of(device.id, domain));
                }

                return executeBatch(connection, "INSERT INTO domains (device_id, domain) VALUES ($1, $2) ON CONFLICT DO NOTHING", domainTuples);
            });
    }

    private static Future<Void> executeBatch(SqlConnection connection, String sql, List<Tuple> batch)
    {
        if (batch.isEmpty())
        {
            return Future.succeededFuture();
        }

        return connection.preparedQuery(sql).executeBatch(batch).mapEmpty();
    }

    @Override
    public Future<Integer> discoveredCleanup(int olderThanDays)
    {
        var cutoff = Instant.now().minus(Duration.ofDays(olderThanDays));

        return pgPool.preparedQuery("DELETE FROM discovered_devices WHERE last_seen < $1 AND promoted_to_device_id IS NULL")
            .execute(Tuple.of(PgSupport.timestamp(cutoff)))
            .map(result -> result.rowCount())
            .recover(cause -> Future.failedFuture(PgSupport.translate("cleanup discovered devices", cause)));
    }

    // ===== SCANS =====

    @Override
    public Future<List<DiscoveryScan>> scanList(String networkId)
    {
        var sql = networkId == null
            ? "SELECT " + SCAN_COLUMNS + " FROM discovery_scans ORDER BY created_at DESC"
            : "SELECT " + SCAN_COLUMNS + " FROM discovery_scans WHERE network_id = $1 ORDER BY created_at DESC";

        var params = networkId == null ? Tuple.tuple() : Tuple.of(networkId);

        return pgPool.preparedQuery(sql)
            .execute(params)
            .map(rows ->
            {
                var scans = new ArrayList<DiscoveryScan>();

                for (var row : rows)
                {
                    scans.add(PgSupport.toScan(row));
                }

                return (List<DiscoveryScan>) scans;
            })
            .recover(cause -> Future.failedFuture(PgSupport.translate("list scans", cause)));
    }

    @Override
    public Future<DiscoveryScan> scanGetById(String scanId)
    {
        return pgPool.preparedQuery("SELECT " + SCAN_COLUMNS + " FROM discovery_scans WHERE id = $1")
            .execute(Tuple.of(scanId))
            .recover(cause -> Future.failedFuture(PgSupport.translate("get scan", cause)))
            .compose(rows -> rows.size() == 0
                ? Future.failedFuture(DiscoveryException.notFound("discovery scan not found: " + scanId))
                : Future.succeededFuture(PgSupport.toScan(rows.iterator().next())));
    }

    @Override
    public Future<DiscoveryScan> scanCreate(DiscoveryScan scan)
    {
        if (scan.networkId == null || scan.networkId.isBlank())
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("scan network_id is required"));
        }

        var stored = scan.copy();

        stored.id = stored.id != null && !stored.id.isBlank() ? stored.id : UUID.randomUUID().toString();

        var now = Instant.now();

        stored.createdAt = stored.createdAt != null ? stored.createdAt : now;

        stored.updatedAt = now;

        var sql = """
                INSERT INTO discovery_scans (id, network_id, status, scan_type, scan_depth, total_hosts, scanned_hosts,
                    found_hosts, progress_percent, started_at, completed_at, duration_seconds, error_message, created_at, updated_at)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $13, $14, $15)
                """;

        return pgPool.preparedQuery(sql)
            .execute(scanTuple(stored))
            .map(result -> stored)
            .recover(cause -> Future.failedFuture(PgSupport.translate("create scan", cause)));
    }

    @Override
    public Future<DiscoveryScan> scanUpdate(DiscoveryScan scan)
    {
        if (scan.status == null)
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("scan status is required"));
        }

        return pgPool.<DiscoveryScan>withTransaction(connection -> connection
            .preparedQuery("SELECT status, created_at FROM discovery_scans WHERE id = $1 FOR UPDATE")
            .execute(Tuple.of(scan.id))
            .compose(rows ->
            {
                if (rows.size() == 0)
                {
                    return Future.failedFuture(DiscoveryException.notFound("discovery scan not found: " + scan.id));
                }

                var row = rows.iterator().next();

                var current = ScanStatus.fromValue(row.getString("status"));

                if (!current.canTransitionTo(scan.status))
                {
                    return Future.failedFuture(DiscoveryException.invalidRequest("scan " + scan.id + " cannot move from "
                        + current.value() + " to " + scan.status.value()));
                }

                var stored = scan.copy();

                stored.createdAt = PgSupport.instant(row, "created_at");

                stored.updatedAt = Instant.now();

                var sql = """
                        UPDATE discovery_scans
                        SET network_id = $2, status = $3, scan_type = $4, scan_depth = $5, total_hosts = $6,
                            scanned_hosts = $7, found_hosts = $8, progress_percent = $9, started_at = $10,
                            completed_at = $11, duration_seconds = $12, error_message = $13, created_at = $14,
                            updated_at = $15
                        WHERE id = $1
                        """;

                return connection.preparedQuery(sql)
                    .execute(scanTuple(stored))
                    .map(result -> stored);
            }))
            .recover(cause -> Future.failedFuture(PgSupport.translate("update scan", cause)));
    }

    @Override
    public Future<Void> scanDelete(String scanId)
    {
        return pgPool.preparedQuery("DELETE FROM discovery_scans WHERE id = $1")
            .execute(Tuple.of(scanId))
            .recover(cause -> Future.failedFuture(PgSupport.translate("delete scan", cause)))
            .compose(result -> result.rowCount() == 0
                ? Future.failedFuture(DiscoveryException.notFound("discovery scan not found: " + scanId))
                : Future.succeededFuture());
    }

    // ===== RULES =====

    @Override
    public Future<List<DiscoveryRule>> ruleList(String networkId)
    {
        var sql = networkId == null
            ? "SELECT " + RULE_COLUMNS + " FROM discovery_rules ORDER BY created_at"
            : "SELECT " + RULE_COLUMNS + " FROM discovery_rules WHERE network_id = $1";

        var params = networkId == null ? Tuple.tuple() : Tuple.of(networkId);

        return pgPool.preparedQuery(sql)
            .execute(params)
            .map(rows ->
            {
                var rules = new ArrayList<DiscoveryRule>();

                for (var row : rows)
                {
                    rules.add(PgSupport.toRule(row));
                }

                return (List<DiscoveryRule>) rules;
            })
            .recover(cause -> Future.failedFuture(PgSupport.translate("list rules", cause)));
    }

    @Override
    public Future<DiscoveryRule> ruleGetById(String ruleId)
    {
        return findRule("SELECT " + RULE_COLUMNS + " FROM discovery_rules WHERE id = $1", ruleId,
            "discovery rule not found: " + ruleId);
    }

    @Override
    public Future<DiscoveryRule> ruleGetByNetwork(String networkId)
    {
        return findRule("SELECT " + RULE_COLUMNS + " FROM discovery_rules WHERE network_id = $1", networkId,
            "discovery rule not found for network: " + networkId);
    }

    @Override
    public Future<DiscoveryRule> ruleCreate(DiscoveryRule rule)
    {
        var validationError = DiscoveryValidationUtil.validateRule(rule);

        if (validationError != null)
        {
            return Future.failedFuture(DiscoveryException.invalidRequest(validationError));
        }

        var stored = InMemoryDatabase.copy(rule);

        stored.id = stored.id != null && !stored.id.isBlank() ? stored.id : UUID.randomUUID().toString();

        var now = Instant.now();

        stored.createdAt = now;

        stored.updatedAt = now;

        var sql = """
                INSERT INTO discovery_rules (id, network_id, enabled, scan_interval_hours, scan_type, max_concurrent_scans,
                    timeout_seconds, scan_ports, port_scan_type, custom_ports, service_detection, os_detection,
                    exclude_ips, exclude_hosts, created_at, updated_at)
                VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $13, $14, $15, $16)
                """;

        return pgPool.preparedQuery(sql)
            .execute(ruleTuple(stored))
            .map(result -> stored)
            .onSuccess(created -> logger.info("Discovery rule created for network {}", created.networkId))
            .recover(cause -> Future.failedFuture(PgSupport.hasSqlState(cause, PgSupport.UNIQUE_VIOLATION)
                ? DiscoveryException.invalidRequest("discovery rule already exists for network: " + rule.networkId)
                : PgSupport.translate("create rule", cause)));
    }

    @Override
    public Future<DiscoveryRule> ruleUpdate(DiscoveryRule rule)
    {
        var validationError = DiscoveryValidationUtil.validateRule(rule);

        if (validationError != null)
        {
            return Future.failedFuture(DiscoveryException.invalidRequest(validationError));
        }

        var stored = InMemoryDatabase.copy(rule);

        stored.updatedAt = Instant.now();

        var sql = """
                UPDATE discovery_rules
                SET network_id = $2, enabled = $3, scan_interval_hours = $4, scan_type = $5, max_concurrent_scans = $6,
                    timeout_seconds = $7, scan_ports = $8, port_scan_type = $9, custom_ports = $10,
                    service_detection = $11, os_detection = $12, exclude_ips = $13, exclude_hosts = $14,
                    created_at = COALESCE(created_at, $15), updated_at = $16
                WHERE id = $1
                RETURNING created_at
                """;

        return pgPool.preparedQuery(sql)
            .execute(ruleTuple(stored))
            .recover(cause -> Future.failedFuture(PgSupport.hasSqlState(cause, PgSupport.UNIQUE_VIOLATION)
                ? DiscoveryException.invalidRequest("discovery rule already exists for network: " + rule.networkId)
                : PgSupport.translate("update rule", cause)))
            .compose(rows ->
            {
                if (rows.size() == 0)
                {
                    return Future.failedFuture(DiscoveryException.notFound("discovery rule not found: " + rule.id));
                }

                stored.createdAt = PgSupport.instant(rows.iterator().next(), "created_at");

                return Future.succeededFuture(stored);
            });
    }

    @Override
    public Future<Void> ruleDelete(String ruleId)
    {
        return pgPool.preparedQuery("DELETE FROM discovery_rules WHERE id = $1")
            .execute(Tuple.of(ruleId))
            .recover(cause -> Future.failedFuture(PgSupport.translate("delete rule", cause)))
            .compose(result -> result.rowCount() == 0
                ? Future.failedFuture(DiscoveryException.notFound("discovery rule not found: " + ruleId))
                : Future.succeededFuture());
    }

    // ===== helpers =====

    private Future<DiscoveredDevice> findDiscovered(Future<RowSet<Row>> query, String notFoundMessage)
    {
        return query
            .recover(cause -> Future.failedFuture(PgSupport.translate("get discovered device", cause)))
            .compose(rows -> rows.size() == 0
                ? Future.failedFuture(DiscoveryException.notFound(notFoundMessage))
                : Future.succeededFuture(PgSupport.toDiscovered(rows.iterator().next())));
    }

    private Future<DiscoveryRule> findRule(String sql, String key, String notFoundMessage)
    {
        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(key))
            .recover(cause -> Future.failedFuture(PgSupport.translate("get rule", cause)))
            .compose(rows -> rows.size() == 0
                ? Future.failedFuture(DiscoveryException.notFound(notFoundMessage))
                : Future.succeededFuture(PgSupport.toRule(rows.iterator().next())));
    }

    private static Tuple discoveredTuple(DiscoveredDevice device)
    {
        return Tuple.tuple()
            .addString(device.id)
            .addString(device.ip)
            .addString(device.macAddress)
            .addString(device.hostname)
            .addString(device.networkId)
            .addString(device.status.value())
            .addInteger(device.confidence)
            .addString(device.osGuess)
            .addString(device.osFamily)
            .addArrayOfInteger(PgSupport.integerArray(device.openPorts))
            .addValue(PgSupport.servicesJson(device.services))
            .addOffsetDateTime(PgSupport.timestamp(device.firstSeen))
            .addOffsetDateTime(PgSupport.timestamp(device.lastSeen))
            .addString(device.lastScanId)
            .addString(device.promotedToDeviceId)
            .addOffsetDateTime(PgSupport.timestamp(device.promotedAt))
            .addString(device.rawScanData)
            .addOffsetDateTime(PgSupport.timestamp(device.createdAt))
            .addOffsetDateTime(PgSupport.timestamp(device.updatedAt));
    }

    private static Tuple scanTuple(DiscoveryScan scan)
    {
        return Tuple.tuple()
            .addString(scan.id)
            .addString(scan.networkId)
            .addString(scan.status.value())
            .addString(scan.scanType)
            .addInteger(scan.scanDepth)
            .addInteger(scan.totalHosts)
            .addInteger(scan.scannedHosts)
            .addInteger(scan.foundHosts)
            .addDouble(scan.progressPercent())
            .addOffsetDateTime(PgSupport.timestamp(scan.startedAt))
            .addOffsetDateTime(PgSupport.timestamp(scan.completedAt))
            .addInteger(scan.durationSeconds)
            .addString(scan.errorMessage)
            .addOffsetDateTime(PgSupport.timestamp(scan.createdAt))
            .addOffsetDateTime(PgSupport.timestamp(scan.updatedAt));
    }

    private static Tuple ruleTuple(DiscoveryRule rule)
    {
        return Tuple.tuple()
            .addString(rule.id)
            .addString(rule.networkId)
            .addBoolean(rule.enabled)
            .addInteger(rule.scanIntervalHours)
            .addString(rule.scanType)
            .addInteger(rule.maxConcurrentScans)
            .addInteger(rule.timeoutSeconds)
            .addBoolean(rule.scanPorts)
            .addString(rule.portScanType)
            .addArrayOfInteger(PgSupport.integerArray(rule.customPorts))
            .addBoolean(rule.serviceDetection)
            .addBoolean(rule.osDetection)
            .addArrayOfString(PgSupport.stringArray(rule.excludeIps))
            .addArrayOfString(PgSupport.stringArray(rule.excludeHosts))
            .addOffsetDateTime(PgSupport.timestamp(rule.createdAt))
            .addOffsetDateTime(PgSupport.timestamp(rule.updatedAt));
    }
}
