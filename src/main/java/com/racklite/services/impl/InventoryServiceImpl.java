package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.Network;

import com.racklite.services.InventoryService;

import com.racklite.utils.SubnetUtil;

import io.vertx.core.Future;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Row;

import io.vertx.sqlclient.SqlClient;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

import java.util.ArrayList;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.UUID;

/**
 * InventoryServiceImpl - PostgreSQL implementation of InventoryService

 * Devices are read together with their addresses, tags and domains.
 */
public class InventoryServiceImpl implements InventoryService
{

    private static final Logger logger = LoggerFactory.getLogger(InventoryServiceImpl.class);

    private static final String DEVICE_COLUMNS =
        "id, name, description, make_model, os, datacenter_id, username, location, created_at, updated_at";

    private final Pool pgPool;

    /**
     * Constructor for InventoryServiceImpl
     *
     * @param pgPool PostgreSQL connection pool
     */
    public InventoryServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<Network> networkGetById(String networkId)
    {
        var sql = """
                SELECT id, name, subnet, datacenter_id, description, created_at, updated_at
                FROM networks
                WHERE id = $1
                """;

        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(networkId))
            .recover(cause -> Future.failedFuture(PgSupport.translate("get network", cause)))
            .compose(rows ->
            {
                if (rows.size() == 0)
                {
                    return Future.failedFuture(DiscoveryException.notFound("network not found: " + networkId));
                }

                return Future.succeededFuture(PgSupport.toNetwork(rows.iterator().next()));
            });
    }

    @Override
    public Future<Network> networkCreate(Network network)
    {
        if (network.name == null || network.name.isBlank())
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("network name is required"));
        }

        if (!SubnetUtil.isValidCidr(network.subnet))
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("invalid subnet: " + network.subnet));
        }

        var id = network.id != null && !network.id.isBlank() ? network.id : UUID.randomUUID().toString();

        var now = PgSupport.timestamp(Instant.now());

        var sql = """
                INSERT INTO networks (id, name, subnet, datacenter_id, description, created_at, updated_at)
                VALUES ($1, $2, $3, $4, $5, $6, $6)
                RETURNING id, name, subnet, datacenter_id, description, created_at, updated_at
                """;

        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(id, network.name, network.subnet, network.datacenterId, network.description, now))
            .map(rows -> PgSupport.toNetwork(rows.iterator().next()))
            .onSuccess(created -> logger.info("Network created: {} ({})", created.name, created.subnet))
            .recover(cause -> Future.failedFuture(PgSupport.translate("create network", cause)));
    }

    @Override
    public Future<List<Datacenter>> datacenterList()
    {
        var sql = """
                SELECT id, name, location, description, created_at, updated_at
                FROM datacenters
                ORDER BY name
                """;

        return pgPool.query(sql)
            .execute()
            .map(rows ->
            {
                var datacenters = new ArrayList<Datacenter>();

                for (var row : rows)
                {
                    datacenters.add(PgSupport.toDatacenter(row));
                }

                return (List<Datacenter>) datacenters;
            })
            .recover(cause -> Future.failedFuture(PgSupport.translate("list datacenters", cause)));
    }

    @Override
    public Future<Datacenter> datacenterCreate(Datacenter datacenter)
    {
        if (datacenter.name == null || datacenter.name.isBlank())
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("datacenter name is required"));
        }

        var id = datacenter.id != null && !datacenter.id.isBlank() ? datacenter.id : UUID.randomUUID().toString();

        var now = PgSupport.timestamp(Instant.now());

        var sql = """
                INSERT INTO datacenters (id, name, location, description, created_at, updated_at)
                VALUES ($1, $2, $3, $4, $5, $5)
                RETURNING id, name, location, description, created_at, updated_at
                """;

        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(id, datacenter.name, datacenter.location, datacenter.description, now))
            .map(rows -> PgSupport.toDatacenter(rows.iterator().next()))
            .onSuccess(created -> logger.info("Datacenter created: {}", created.name))
            .recover(cause -> Future.failedFuture(PgSupport.translate("create datacenter", cause)));
    }

    @Override
    public Future<Device> deviceGetById(String deviceId)
    {
        var sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE id = $1";

        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(deviceId))
            .recover(cause -> Future.failedFuture(PgSupport.translate("get device", cause)))
            .compose(rows ->
            {
                if (rows.size() == 0)
                {
                    return Future.failedFuture(DiscoveryException.notFound("device not found: " + deviceId));
                }

                var device = toDevice(rows.iterator().next());

                return loadDeviceDetails(pgPool, List.of(device)).map(v -> device);
            });
    }

    @Override
    public Future<List<Device>> deviceList()
    {
        var sql = "SELECT " + DEVICE_COLUMNS + " FROM devices ORDER BY name";

        return pgPool.query(sql)
            .execute()
            .recover(cause -> Future.failedFuture(PgSupport.translate("list devices", cause)))
            .compose(rows ->
            {
                var devices = new ArrayList<Device>();

                for (var row : rows)
                {
                    devices.add(toDevice(row));
                }

                return loadDeviceDetails(pgPool, devices).map(v -> (List<Device>) devices);
            });
    }

    /**
     * Fill addresses, tags and domains for the given devices with one query per table.
     */
    private static Future<Void> loadDeviceDetails(SqlClient client, List<Device> devices)
    {
        if (devices.isEmpty())
        {
            return Future.succeededFuture();
        }

        var byId = new LinkedHashMap<String, Device>();

        for (var device : devices)
        {
            byId.put(device.id, device);
        }

        var ids = Tuple.of(byId.keySet().toArray(new String[0]));

        var addresses = client.preparedQuery("""
                SELECT device_id, ip, port, type, label, network_id, switch_port
                FROM addresses
                WHERE device_id = ANY($1)
                ORDER BY id
                """)
            .execute(ids)
            .onSuccess(rows ->
            {
                for (var row : rows)
                {
                    byId.get(row.getString("device_id")).addresses.add(PgSupport.toAddress(row));
                }
            });

        var tags = client.preparedQuery("SELECT device_id, tag FROM tags WHERE device_id = ANY($1) ORDER BY tag")
            .execute(ids)
            .onSuccess(rows ->
            {
                for (var row : rows)
                {
                    byId.get(row.getString("device_id")).tags.add(row.getString("tag"));
                }
            });

        var domains = client.preparedQuery("SELECT device_id, domain FROM domains WHERE device_id = ANY($1) ORDER BY domain")
            .execute(ids)
            .onSuccess(rows ->
            {
                for (var row : rows)
                {
                    byId.get(row.getString("device_id")).domains.add(row.getString("domain"));
                }
            });

        return Future.all(addresses, tags, domains)
            .<Void>mapEmpty()
            .recover(cause -> Future.failedFuture(PgSupport.translate("load device details", cause)));
    }

    private static Device toDevice(Row row)
    {
        var device = new Device();

        device.id = row.getString("id");

        device.name = row.getString("name");

        device.description = row.getString("description");

        device.makeModel = row.getString("make_model");

        device.os = row.getString("os");

        device.datacenterId = row.getString("datacenter_id");

        device.username = row.getString("username");

        device.location = row.getString("location");

        device.createdAt = PgSupport.instant(row, "created_at");

        device.updatedAt = PgSupport.instant(row, "updated_at");

        return device;
    }
}
