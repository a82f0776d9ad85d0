package com.racklite.core;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.Network;

import com.racklite.models.ScanStatus;

import com.racklite.services.impl.InMemoryDatabase;

import com.racklite.services.impl.InMemoryDiscoveryServiceImpl;

import com.racklite.services.impl.InMemoryInventoryServiceImpl;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

import java.time.Instant;

import java.util.List;

import java.util.Map;

import java.util.concurrent.CopyOnWriteArrayList;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class DiscoveryScannerTest
{

    private InMemoryDatabase database;

    private InMemoryInventoryServiceImpl inventoryService;

    private InMemoryDiscoveryServiceImpl discoveryService;

    private final List<DiscoveryScan> callbacks = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp()
    {
        database = new InMemoryDatabase();

        inventoryService = new InMemoryInventoryServiceImpl(database);

        discoveryService = new InMemoryDiscoveryServiceImpl(database);

        callbacks.clear();

        inventoryService.networkCreate(new Network("net-30", "Point to point", "10.0.0.0/30", null));

        inventoryService.networkCreate(new Network("net-24", "Lab", "192.168.5.0/24", null));

        inventoryService.networkCreate(new Network("net-wide", "Campus", "10.0.0.0/15", null));

        inventoryService.networkCreate(new Network("net-everything", "Default route", "0.0.0.0/0", null));
    }

    /**
     * Answers from a fixed table of open ports; unknown addresses are offline.
     */
    private static HostProber tableProber(Map<String, List<Integer>> openPorts)
    {
        return (ip, timeout, cancellation) ->
        {
            var draft = new DiscoveredDevice();

            draft.ip = ip;

            draft.openPorts = openPorts.getOrDefault(ip, List.of());

            draft.status = draft.openPorts.isEmpty() ? DeviceStatus.OFFLINE : DeviceStatus.ONLINE;

            draft.lastSeen = Instant.now();

            return Future.succeededFuture(draft);
        };
    }

    private DiscoveryScanner scanner(Vertx vertx, HostProber prober)
    {
        return new DiscoveryScanner(vertx, inventoryService, discoveryService, prober);
    }

    @Test
    void smallSubnetFindsTheListeningHost(Vertx vertx, VertxTestContext testContext)
    {
        var prober = tableProber(Map.of("10.0.0.2", List.of(22)));

        scanner(vertx, prober).scanNetwork("scan-1", "net-30", new DiscoveryRule(), null, callbacks::add)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(ScanStatus.COMPLETED, scan.status);

                assertEquals(2, scan.totalHosts);

                assertEquals(2, scan.scannedHosts);

                assertEquals(1, scan.foundHosts);

                var found = discoveryService.discoveredGetByIp("10.0.0.2").result();

                assertEquals(60, found.confidence);

                assertEquals(DeviceStatus.ONLINE, found.status);

                assertEquals("net-30", found.networkId);

                assertEquals("scan-1", found.lastScanId);

                assertTrue(discoveryService.discoveredGetByIp("10.0.0.1").failed());

                // enumeration, last host, terminal
                assertEquals(3, callbacks.size());

                assertEquals(ScanStatus.RUNNING, callbacks.get(0).status);

                assertEquals(ScanStatus.COMPLETED, callbacks.get(2).status);

                testContext.completeNow();
            })));
    }

    @Test
    void progressCallbacksAreThrottled(Vertx vertx, VertxTestContext testContext)
    {
        scanner(vertx, tableProber(Map.of())).scanNetwork(null, "net-24", new DiscoveryRule(), null, callbacks::add)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(254, scan.scannedHosts);

                assertEquals(0, scan.foundHosts);

                // enumeration + every 50 hosts (5) + last host + terminal
                assertEquals(8, callbacks.size());

                for (var i = 1; i < callbacks.size(); i++)
                {
                    assertTrue(callbacks.get(i).scannedHosts >= callbacks.get(i - 1).scannedHosts);
                }

                assertTrue(discoveryService.discoveredList(null).result().isEmpty());

                testContext.completeNow();
            })));
    }

    @Test
    void hostFanOutRespectsRuleConcurrency(Vertx vertx, VertxTestContext testContext)
    {
        var inFlight = new AtomicInteger();

        var peak = new AtomicInteger();

        HostProber slowProber = (ip, timeout, cancellation) ->
        {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);

            return Future.<DiscoveredDevice>future(promise -> vertx.setTimer(2, id ->
            {
                inFlight.decrementAndGet();

                var draft = new DiscoveredDevice();

                draft.ip = ip;

                draft.status = DeviceStatus.OFFLINE;

                promise.complete(draft);
            }));
        };

        var rule = new DiscoveryRule();

        rule.maxConcurrentScans = 4;

        scanner(vertx, slowProber).scanNetwork(null, "net-24", rule, null, null)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(254, scan.scannedHosts);

                assertTrue(peak.get() <= 4, "peak " + peak.get());

                testContext.completeNow();
            })));
    }

    @Test
    void missingNetworkFailsWithOneCallback(Vertx vertx, VertxTestContext testContext)
    {
        scanner(vertx, tableProber(Map.of())).scanNetwork("scan-x", "net-missing", null, null, callbacks::add)
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.CONFIGURATION));

                assertTrue(cause.getMessage().startsWith("getting network:"));

                assertEquals(1, callbacks.size());

                assertEquals(ScanStatus.FAILED, callbacks.get(0).status);

                assertEquals("scan-x", callbacks.get(0).id);

                testContext.completeNow();
            })));
    }

    @Test
    void uncountableSubnetIsAConfigurationError(Vertx vertx, VertxTestContext testContext)
    {
        scanner(vertx, tableProber(Map.of())).scanNetwork(null, "net-everything", null, null, callbacks::add)
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.CONFIGURATION));

                assertTrue(cause.getMessage().startsWith("generating IP list:"));

                assertEquals(1, callbacks.size());

                assertTrue(callbacks.get(0).errorMessage.startsWith("generating IP list:"));

                testContext.completeNow();
            })));
    }

    @Test
    void wideSubnetIsPulledOnlyAsHostsFinish(Vertx vertx, VertxTestContext testContext)
    {
        var probed = new AtomicInteger();

        var table = tableProber(Map.of());

        HostProber stopsAfterHundred = (ip, timeout, token) ->
        {
            if (probed.incrementAndGet() == 100)
            {
                token.cancel("enough hosts");
            }

            return table.probeHost(ip, timeout, token);
        };

        var rule = new DiscoveryRule();

        rule.maxConcurrentScans = 4;

        scanner(vertx, stopsAfterHundred).scanNetwork(null, "net-wide", rule, null, callbacks::add)
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.CANCELLED));

                // 10.0.0.0/15 without network and broadcast
                assertEquals(131070, callbacks.get(0).totalHosts);

                var last = callbacks.get(callbacks.size() - 1);

                assertEquals(ScanStatus.FAILED, last.status);

                assertEquals("scan cancelled: enough hosts", last.errorMessage);

                assertTrue(probed.get() >= 100 && probed.get() < 100 + rule.maxConcurrentScans, "probed " + probed.get());

                assertEquals(probed.get(), last.scannedHosts);

                testContext.completeNow();
            })));
    }

    @Test
    void excludedAddressesAreNeverDialed(Vertx vertx, VertxTestContext testContext)
    {
        var probed = new CopyOnWriteArrayList<String>();

        var table = tableProber(Map.of("10.0.0.2", List.of(80)));

        HostProber recording = (ip, timeout, cancellation) ->
        {
            probed.add(ip);

            return table.probeHost(ip, timeout, cancellation);
        };

        var rule = new DiscoveryRule();

        rule.excludeIps = List.of("10.0.0.1");

        scanner(vertx, recording).scanNetwork(null, "net-30", rule, null, null)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(1, scan.totalHosts);

                assertEquals(List.of("10.0.0.2"), probed);

                testContext.completeNow();
            })));
    }

    @Test
    void cancellationSkipsUnstartedHosts(Vertx vertx, VertxTestContext testContext)
    {
        var cancellation = new ScanCancellation();

        var table = tableProber(Map.of());

        HostProber cancelling = (ip, timeout, token) ->
        {
            token.cancel("operator request");

            return table.probeHost(ip, timeout, token);
        };

        var rule = new DiscoveryRule();

        rule.maxConcurrentScans = 1;

        scanner(vertx, cancelling).scanNetwork(null, "net-24", rule, cancellation, callbacks::add)
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.CANCELLED));

                assertTrue(cancellation.isCancelled());

                var last = callbacks.get(callbacks.size() - 1);

                assertEquals(ScanStatus.FAILED, last.status);

                assertEquals(DiscoveryScanner.CANCELLED_MESSAGE + ": operator request", last.errorMessage);

                assertEquals(1, last.scannedHosts);

                assertEquals(254, last.totalHosts);

                testContext.completeNow();
            })));
    }

    @Test
    void storageFailureDoesNotStopTheScan(Vertx vertx, VertxTestContext testContext)
    {
        var failingStore = new InMemoryDiscoveryServiceImpl(database)
        {
            @Override
            public Future<DiscoveredDevice> discoveredUpsert(DiscoveredDevice draft)
            {
                if ("10.0.0.1".equals(draft.ip))
                {
                    return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.STORAGE, "disk full"));
                }

                return super.discoveredUpsert(draft);
            }
        };

        var prober = tableProber(Map.of("10.0.0.1", List.of(22), "10.0.0.2", List.of(22, 80, 443)));

        new DiscoveryScanner(vertx, inventoryService, failingStore, prober)
            .scanNetwork(null, "net-30", null, null, null)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(2, scan.scannedHosts);

                assertEquals(2, scan.foundHosts);

                assertTrue(discoveryService.discoveredGetByIp("10.0.0.1").failed());

                assertEquals(70, discoveryService.discoveredGetByIp("10.0.0.2").result().confidence);

                testContext.completeNow();
            })));
    }

    @Test
    void offlineHostRefreshesExistingRecordOnly(Vertx vertx, VertxTestContext testContext)
    {
        var earlier = new DiscoveredDevice();

        earlier.ip = "10.0.0.1";

        earlier.status = DeviceStatus.ONLINE;

        earlier.confidence = 90;

        earlier.hostname = "router";

        discoveryService.discoveredUpsert(earlier);

        scanner(vertx, tableProber(Map.of())).scanNetwork(null, "net-30", null, null, null)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                var refreshed = discoveryService.discoveredGetByIp("10.0.0.1").result();

                assertEquals(DeviceStatus.OFFLINE, refreshed.status);

                assertEquals(90, refreshed.confidence);

                assertEquals("router", refreshed.hostname);

                assertTrue(discoveryService.discoveredGetByIp("10.0.0.2").failed());

                assertNull(refreshed.promotedToDeviceId);

                testContext.completeNow();
            })));
    }

    @Test
    void hostCheckFailureCountsAsOfflineHost(Vertx vertx, VertxTestContext testContext)
    {
        HostProber broken = (ip, timeout, cancellation) -> Future.failedFuture(new IllegalStateException("socket exploded"));

        scanner(vertx, broken).scanNetwork(null, "net-30", null, null, null)
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(2, scan.scannedHosts);

                assertEquals(0, scan.foundHosts);

                assertTrue(scan.durationSeconds >= 0);

                assertTrue(Duration.between(scan.startedAt, scan.completedAt).toMillis() >= 0);

                testContext.completeNow();
            })));
    }
}
