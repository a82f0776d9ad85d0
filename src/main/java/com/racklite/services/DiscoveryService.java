package com.racklite.services;

import com.racklite.models.Device;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveredDeviceFilter;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.PromoteDeviceRequest;

import io.vertx.core.Future;

import java.util.List;

/**
 * DiscoveryService - Persistence for discovered devices, scans and rules

 * This interface provides:
 * - Discovered device queries, reconciling upsert, delete and retention cleanup
 * - Atomic promotion of a discovered device into the inventory
 * - Scan record CRUD with forward-only status updates
 * - Discovery rule CRUD (one rule per network)

 * Failures are reported as DiscoveryException; missing IDs use kind NOT_FOUND.
 */
public interface DiscoveryService
{

    // ===== DISCOVERED DEVICES =====

    /**
     * List discovered devices ordered by last seen, newest first
     *
     * @param filter Filter criteria (null lists everything)
     * @return Future containing matching devices
     */
    Future<List<DiscoveredDevice>> discoveredList(DiscoveredDeviceFilter filter);

    Future<DiscoveredDevice> discoveredGetById(String id);

    Future<DiscoveredDevice> discoveredGetByIp(String ip);

    /**
     * Insert or merge a probe result, keyed by IP, as one atomic unit.
     * Existing records keep first seen, promotion fields and the higher confidence.
     *
     * @param draft Probe result
     * @return Future containing the stored record
     */
    Future<DiscoveredDevice> discoveredUpsert(DiscoveredDevice draft);

    Future<Void> discoveredDelete(String id);

    /**
     * Create an inventory device from a discovered device and mark it promoted, in one transaction.
     * Fails with NOT_FOUND, ALREADY_PROMOTED or INVALID_REFERENCE; nothing is persisted on failure.
     *
     * @param id Discovered device ID
     * @param request Operator supplied device data
     * @return Future containing the created device
     */
    Future<Device> discoveredPromote(String id, PromoteDeviceRequest request);

    /**
     * Delete never-promoted records not seen for the given number of days
     *
     * @param olderThanDays Retention threshold in days
     * @return Future containing the number of deleted records
     */
    Future<Integer> discoveredCleanup(int olderThanDays);

    // ===== SCANS =====

    /**
     * List scans, newest first
     *
     * @param networkId Network to filter by (null lists all)
     * @return Future containing scans
     */
    Future<List<DiscoveryScan>> scanList(String networkId);

    Future<DiscoveryScan> scanGetById(String scanId);

    Future<DiscoveryScan> scanCreate(DiscoveryScan scan);

    /**
     * Replace the stored scan state. Refuses backward status moves and edits of terminal scans.
     *
     * @param scan New scan state
     * @return Future containing the stored scan
     */
    Future<DiscoveryScan> scanUpdate(DiscoveryScan scan);

    Future<Void> scanDelete(String scanId);

    // ===== RULES =====

    Future<List<DiscoveryRule>> ruleList(String networkId);

    Future<DiscoveryRule> ruleGetById(String ruleId);

    /**
     * Get the rule configured for a network
     *
     * @param networkId Network ID
     * @return Future containing the rule, failing with NOT_FOUND if the network has none
     */
    Future<DiscoveryRule> ruleGetByNetwork(String networkId);

    Future<DiscoveryRule> ruleCreate(DiscoveryRule rule);

    Future<DiscoveryRule> ruleUpdate(DiscoveryRule rule);

    Future<Void> ruleDelete(String ruleId);

}
