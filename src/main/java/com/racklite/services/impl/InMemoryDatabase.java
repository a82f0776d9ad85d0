package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.models.Datacenter;

import com.racklite.models.Device;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.Network;

import io.vertx.core.Future;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.HashMap;

import java.util.LinkedHashMap;

import java.util.Map;

import java.util.concurrent.Callable;

import java.util.concurrent.locks.ReentrantLock;

/**
 * InMemoryDatabase - Process-local store shared by the in-memory service implementations

 * Every operation runs as one critical section under a single lock, which gives
 * the same all-or-nothing visibility the PostgreSQL services get from transactions.
 * Operations must validate before they mutate so a failure leaves no partial state.

 * Stored objects are never handed out directly; services copy on the way in and out.
 */
public class InMemoryDatabase
{

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final ReentrantLock lock = new ReentrantLock();

    final Map<String, Datacenter> datacenters = new LinkedHashMap<>();

    final Map<String, Network> networks = new LinkedHashMap<>();

    final Map<String, Device> devices = new LinkedHashMap<>();

    final Map<String, DiscoveredDevice> discovered = new LinkedHashMap<>();

    final Map<String, String> discoveredIdByIp = new HashMap<>();

    final Map<String, DiscoveryScan> scans = new LinkedHashMap<>();

    final Map<String, DiscoveryRule> rules = new LinkedHashMap<>();

    /**
     * Runs an operation atomically.
     *
     * @param operation Work to run under the lock; may throw DiscoveryException
     * @param <T> Result type
     * @return Future completed with the operation's result or failure
     */
    <T> Future<T> atomically(Callable<T> operation)
    {
        lock.lock();

        try
        {
            return Future.succeededFuture(operation.call());
        }
        catch (DiscoveryException exception)
        {
            return Future.failedFuture(exception);
        }
        catch (Exception exception)
        {
            logger.error("Error in in-memory operation: {}", exception.getMessage());

            return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.STORAGE,
                exception.getMessage(), exception));
        }
        finally
        {
            lock.unlock();
        }
    }

    // ===== copies =====

    static Network copy(Network network)
    {
        return Network.fromJson(network.toJson());
    }

    static Datacenter copy(Datacenter datacenter)
    {
        return Datacenter.fromJson(datacenter.toJson());
    }

    static Device copy(Device device)
    {
        return Device.fromJson(device.toJson());
    }

    static DiscoveryRule copy(DiscoveryRule rule)
    {
        return DiscoveryRule.fromJson(rule.toJson());
    }
}
