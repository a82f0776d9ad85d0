package com.racklite.services;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.Network;

import io.vertx.core.Future;

import java.util.List;

/**
 * InventoryService - Read and seed access to the managed inventory

 * The discovery engine only needs:
 * - Network lookup (subnet for a scan)
 * - Datacenter listing (promotion auto-assignment)
 * - Device lookup (promotion results)

 * Full CRUD for these resources lives outside the discovery engine; the create
 * methods exist so deployments and tests can seed networks and datacenters.
 * Lookups fail with DiscoveryException(NOT_FOUND) when the ID does not exist.
 */
public interface InventoryService
{

    /**
     * Get a network by ID
     *
     * @param networkId Network ID
     * @return Future containing the network
     */
    Future<Network> networkGetById(String networkId);

    /**
     * Create a network; a missing ID is generated
     *
     * @param network Network to create
     * @return Future containing the stored network
     */
    Future<Network> networkCreate(Network network);

    Future<List<Datacenter>> datacenterList();

    Future<Datacenter> datacenterCreate(Datacenter datacenter);

    /**
     * Get an inventory device with its addresses, tags and domains
     *
     * @param deviceId Device ID
     * @return Future containing the device
     */
    Future<Device> deviceGetById(String deviceId);

    Future<List<Device>> deviceList();

}
