package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.core.DiscoveryReconciler;

import com.racklite.core.PromotionWorkflow;

import com.racklite.models.Device;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveredDeviceFilter;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.PromoteDeviceRequest;

import com.racklite.services.DiscoveryService;

import com.racklite.utils.DiscoveryValidationUtil;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Comparator;

import java.util.List;

import java.util.UUID;

/**
 * InMemoryDiscoveryServiceImpl - DiscoveryService over an InMemoryDatabase

 * Applies the same merge and promotion rules as the PostgreSQL implementation;
 * each call is one critical section on the shared database lock.
 */
public class InMemoryDiscoveryServiceImpl implements DiscoveryService
{

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDiscoveryServiceImpl.class);

    private final InMemoryDatabase database;

    public InMemoryDiscoveryServiceImpl(InMemoryDatabase database)
    {
        this.database = database;
    }

    // ===== DISCOVERED DEVICES =====

    @Override
    public Future<List<DiscoveredDevice>> discoveredList(DiscoveredDeviceFilter filter)
    {
        var effectiveFilter = filter != null ? filter : new DiscoveredDeviceFilter();

        return database.atomically(() ->
        {
            var result = new ArrayList<DiscoveredDevice>();

            for (var device : database.discovered.values())
            {
                if (effectiveFilter.matches(device))
                {
                    result.add(device.copy());
                }
            }

            result.sort(Comparator.comparing((DiscoveredDevice device) -> device.lastSeen,
                Comparator.nullsLast(Comparator.reverseOrder())));

            return result;
        });
    }

    @Override
    public Future<DiscoveredDevice> discoveredGetById(String id)
    {
        return database.atomically(() -> requireDiscovered(id).copy());
    }

    @Override
    public Future<DiscoveredDevice> discoveredGetByIp(String ip)
    {
        return database.atomically(() ->
        {
            var id = database.discoveredIdByIp.get(ip);

            if (id == null)
            {
                throw DiscoveryException.notFound("discovered device not found for ip: " + ip);
            }

            return database.discovered.get(id).copy();
        });
    }

    @Override
    public Future<DiscoveredDevice> discoveredUpsert(DiscoveredDevice draft)
    {
        return database.atomically(() ->
        {
            if (draft == null || draft.ip == null || draft.ip.isBlank())
            {
                throw DiscoveryException.invalidRequest("discovered device ip is required");
            }

            var existingId = database.discoveredIdByIp.get(draft.ip);

            var existing = existingId != null ? database.discovered.get(existingId) : null;

            var merged = DiscoveryReconciler.merge(existing, draft, Instant.now());

            database.discovered.put(merged.id, merged);

            database.discoveredIdByIp.put(merged.ip, merged.id);

            return merged.copy();
        });
    }

    @Override
    public Future<Void> discoveredDelete(String id)
    {
        return database.atomically(() ->
        {
            var removed = requireDiscovered(id);

            database.discovered.remove(id);

            database.discoveredIdByIp.remove(removed.ip);

            return null;
        });
    }

    @Override
    public Future<Device> discoveredPromote(String id, PromoteDeviceRequest request)
    {
        return database.atomically(() ->
        {
            var validationError = DiscoveryValidationUtil.validatePromoteRequest(request);

            if (validationError != null)
            {
                throw DiscoveryException.invalidRequest(validationError);
            }

            var discovered = requireDiscovered(id);

            if (discovered.isPromoted())
            {
                throw new DiscoveryException(DiscoveryException.Kind.ALREADY_PROMOTED,
                    "discovered device " + id + " already promoted to device " + discovered.promotedToDeviceId);
            }

            var datacenterId = PromotionWorkflow.resolveDatacenterId(request, new ArrayList<>(database.datacenters.values()));

            var now = Instant.now();

            var device = PromotionWorkflow.buildDevice(discovered, request, datacenterId, now);

            // Every check happens before the first write
            if (datacenterId != null && !database.datacenters.containsKey(datacenterId))
            {
                throw new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE, "datacenter not found: " + datacenterId);
            }

            for (var address : device.addresses)
            {
                if (address.networkId != null && !database.networks.containsKey(address.networkId))
                {
                    throw new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE, "network not found: " + address.networkId);
                }
            }

            if (database.devices.containsKey(device.id))
            {
                throw DiscoveryException.invalidRequest("device already exists: " + device.id);
            }

            database.devices.put(device.id, InMemoryDatabase.copy(device));

            discovered.promotedToDeviceId = device.id;

            discovered.promotedAt = now;

            discovered.updatedAt = now;

            logger.debug("Discovered device {} promoted to {}", id, device.id);

            return InMemoryDatabase.copy(device);
        });
    }

    @Override
    public Future<Integer> discoveredCleanup(int olderThanDays)
    {
        return database.atomically(() ->
        {
            var cutoff = Instant.now().minus(Duration.ofDays(olderThanDays));

            var removed = 0;

            var iterator = database.discovered.values().iterator();

            while (iterator.hasNext())
            {
                var device = iterator.next();

                if (!device.isPromoted() && device.lastSeen != null && device.lastSeen.isBefore(cutoff))
                {
                    iterator.remove();

                    database.discoveredIdByIp.remove(device.ip);

                    removed++;
                }
            }

            return removed;
        });
    }

    // ===== SCANS =====

    @Override
    public Future<List<DiscoveryScan>> scanList(String networkId)
    {
        return database.atomically(() ->
        {
            var result = new ArrayList<DiscoveryScan>();

            for (var scan : database.scans.values())
            {
                if (networkId == null || networkId.equals(scan.networkId))
                {
                    result.add(scan.copy());
                }
            }

            result.sort(Comparator.comparing((DiscoveryScan scan) -> scan.createdAt,
                Comparator.nullsLast(Comparator.reverseOrder())));

            return result;
        });
    }

    @Override
    public Future<DiscoveryScan> scanGetById(String scanId)
    {
        return database.atomically(() -> requireScan(scanId).copy());
    }

    @Override
    public Future<DiscoveryScan> scanCreate(DiscoveryScan scan)
    {
        return database.atomically(() ->
        {
            if (scan.networkId == null || scan.networkId.isBlank())
            {
                throw DiscoveryException.invalidRequest("scan network_id is required");
            }

            var stored = scan.copy();

            if (stored.id == null || stored.id.isBlank())
            {
                stored.id = UUID.randomUUID().toString();
            }

            if (database.scans.containsKey(stored.id))
            {
                throw DiscoveryException.invalidRequest("scan already exists: " + stored.id);
            }

            var now = Instant.now();

            stored.createdAt = stored.createdAt != null ? stored.createdAt : now;

            stored.updatedAt = now;

            database.scans.put(stored.id, stored);

            return stored.copy();
        });
    }

    @Override
    public Future<DiscoveryScan> scanUpdate(DiscoveryScan scan)
    {
        return database.atomically(() ->
        {
            var existing = requireScan(scan.id);

            if (scan.status == null)
            {
                throw DiscoveryException.invalidRequest("scan status is required");
            }

            if (!existing.status.canTransitionTo(scan.status))
            {
                throw DiscoveryException.invalidRequest("scan " + scan.id + " cannot move from "
                    + existing.status.value() + " to " + scan.status.value());
            }

            var stored = scan.copy();

            stored.createdAt = existing.createdAt;

            stored.updatedAt = Instant.now();

            database.scans.put(stored.id, stored);

            return stored.copy();
        });
    }

    @Override
    public Future<Void> scanDelete(String scanId)
    {
        return database.atomically(() ->
        {
            requireScan(scanId);

            database.scans.remove(scanId);

            return null;
        });
    }

    // ===== RULES =====

    @Override
    public Future<List<DiscoveryRule>> ruleList(String networkId)
    {
        return database.atomically(() ->
        {
            var result = new ArrayList<DiscoveryRule>();

            for (var rule : database.rules.values())
            {
                if (networkId == null || networkId.equals(rule.networkId))
                {
                    result.add(InMemoryDatabase.copy(rule));
                }
            }

            return result;
        });
    }

    @Override
    public Future<DiscoveryRule> ruleGetById(String ruleId)
    {
        return database.atomically(() -> InMemoryDatabase.copy(requireRule(ruleId)));
    }

    @Override
    public Future<DiscoveryRule> ruleGetByNetwork(String networkId)
    {
        return database.atomically(() ->
        {
            var rule = findRuleByNetwork(networkId);

            if (rule == null)
            {
                throw DiscoveryException.notFound("discovery rule not found for network: " + networkId);
            }

            return InMemoryDatabase.copy(rule);
        });
    }

    @Override
    public Future<DiscoveryRule> ruleCreate(DiscoveryRule rule)
    {
        return database.atomically(() ->
        {
            validateRule(rule);

            if (findRuleByNetwork(rule.networkId) != null)
            {
                throw DiscoveryException.invalidRequest("discovery rule already exists for network: " + rule.networkId);
            }

            var stored = InMemoryDatabase.copy(rule);

            if (stored.id == null || stored.id.isBlank())
            {
                stored.id = UUID.randomUUID().toString();
            }

            var now = Instant.now();

            stored.createdAt = now;

            stored.updatedAt = now;

            database.rules.put(stored.id, stored);

            return InMemoryDatabase.copy(stored);
        });
    }

    @Override
    public Future<DiscoveryRule> ruleUpdate(DiscoveryRule rule)
    {
        return database.atomically(() ->
        {
            var existing = requireRule(rule.id);

            validateRule(rule);

            var sameNetwork = findRuleByNetwork(rule.networkId);

            if (sameNetwork != null && !sameNetwork.id.equals(rule.id))
            {
                throw DiscoveryException.invalidRequest("discovery rule already exists for network: " + rule.networkId);
            }

            var stored = InMemoryDatabase.copy(rule);

            stored.createdAt = existing.createdAt;

            stored.updatedAt = Instant.now();

            database.rules.put(stored.id, stored);

            return InMemoryDatabase.copy(stored);
        });
    }

    @Override
    public Future<Void> ruleDelete(String ruleId)
    {
        return database.atomically(() ->
        {
            requireRule(ruleId);

            database.rules.remove(ruleId);

            return null;
        });
    }

    // ===== helpers (caller holds the database lock) =====

    private DiscoveredDevice requireDiscovered(String id)
    {
        var device = id != null ? database.discovered.get(id) : null;

        if (device == null)
        {
            throw DiscoveryException.notFound("discovered device not found: " + id);
        }

        return device;
    }

    private DiscoveryScan requireScan(String scanId)
    {
        var scan = scanId != null ? database.scans.get(scanId) : null;

        if (scan == null)
        {
            throw DiscoveryException.notFound("discovery scan not found: " + scanId);
        }

        return scan;
    }

    private DiscoveryRule requireRule(String ruleId)
    {
        var rule = ruleId != null ? database.rules.get(ruleId) : null;

        if (rule == null)
        {
            throw DiscoveryException.notFound("discovery rule not found: " + ruleId);
        }

        return rule;
    }

    private DiscoveryRule findRuleByNetwork(String networkId)
    {
        for (var rule : database.rules.values())
        {
            if (rule.networkId != null && rule.networkId.equals(networkId))
            {
                return rule;
            }
        }

        return null;
    }

    private void validateRule(DiscoveryRule rule)
    {
        var validationError = DiscoveryValidationUtil.validateRule(rule);

        if (validationError != null)
        {
            throw DiscoveryException.invalidRequest(validationError);
        }

        if (!database.networks.containsKey(rule.networkId))
        {
            throw new DiscoveryException(DiscoveryException.Kind.INVALID_REFERENCE, "network not found: " + rule.networkId);
        }
    }
}
