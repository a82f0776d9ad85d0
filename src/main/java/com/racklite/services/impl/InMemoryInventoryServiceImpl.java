package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.Network;

import com.racklite.services.InventoryService;

import com.racklite.utils.SubnetUtil;

import io.vertx.core.Future;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * InMemoryInventoryServiceImpl - InventoryService over an InMemoryDatabase
 */
public class InMemoryInventoryServiceImpl implements InventoryService
{

    private final InMemoryDatabase database;

    public InMemoryInventoryServiceImpl(InMemoryDatabase database)
    {
        this.database = database;
    }

    @Override
    public Future<Network> networkGetById(String networkId)
    {
        return database.atomically(() ->
        {
            var network = database.networks.get(networkId);

            if (network == null)
            {
                throw DiscoveryException.notFound("network not found: " + networkId);
            }

            return InMemoryDatabase.copy(network);
        });
    }

    @Override
    public Future<Network> networkCreate(Network network)
    {
        return database.atomically(() ->
        {
            if (network.name == null || network.name.isBlank())
            {
                throw DiscoveryException.invalidRequest("network name is required");
            }

            if (!SubnetUtil.isValidCidr(network.subnet))
            {
                throw DiscoveryException.invalidRequest("invalid subnet: " + network.subnet);
            }

            if (network.datacenterId != null && !database.datacenters.containsKey(network.datacenterId))
            {
                throw new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE,
                    "datacenter not found: " + network.datacenterId);
            }

            var stored = InMemoryDatabase.copy(network);

            if (stored.id == null || stored.id.isBlank())
            {
                stored.id = UUID.randomUUID().toString();
            }

            if (database.networks.containsKey(stored.id))
            {
                throw DiscoveryException.invalidRequest("network already exists: " + stored.id);
            }

            var now = Instant.now();

            stored.createdAt = now;

            stored.updatedAt = now;

            database.networks.put(stored.id, stored);

            return InMemoryDatabase.copy(stored);
        });
    }

    @Override
    public Future<List<Datacenter>> datacenterList()
    {
        return database.atomically(() ->
        {
            var result = new ArrayList<Datacenter>();

            for (var datacenter : database.datacenters.values())
            {
                result.add(InMemoryDatabase.copy(datacenter));
            }

            return result;
        });
    }

    @Override
    public Future<Datacenter> datacenterCreate(Datacenter datacenter)
    {
        return database.atomically(() ->
        {
            if (datacenter.name == null || datacenter.name.isBlank())
            {
                throw DiscoveryException.invalidRequest("datacenter name is required");
            }

            var stored = InMemoryDatabase.copy(datacenter);

            if (stored.id == null || stored.id.isBlank())
            {
                stored.id = UUID.randomUUID().toString();
            }

            if (database.datacenters.containsKey(stored.id))
            {
                throw DiscoveryException.invalidRequest("datacenter already exists: " + stored.id);
            }

            var now = Instant.now();

            stored.createdAt = now;

            stored.updatedAt = now;

            database.datacenters.put(stored.id, stored);

            return InMemoryDatabase.copy(stored);
        });
    }

    @Override
    public Future<Device> deviceGetById(String deviceId)
    {
        return database.atomically(() ->
        {
            var device = database.devices.get(deviceId);

            if (device == null)
            {
                throw DiscoveryException.notFound("device not found: " + deviceId);
            }

            return InMemoryDatabase.copy(device);
        });
    }

    @Override
    public Future<List<Device>> deviceList()
    {
        return database.atomically(() ->
        {
            var result = new ArrayList<Device>();

            for (var device : database.devices.values())
            {
                result.add(InMemoryDatabase.copy(device));
            }

            return result;
        });
    }
}
