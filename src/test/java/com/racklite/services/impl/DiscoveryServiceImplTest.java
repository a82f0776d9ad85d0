package com.racklite.services.impl;

import com.racklite.core.DiscoveryException;

import com.racklite.models.Datacenter;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.Network;

import com.racklite.models.PromoteDeviceRequest;

import com.racklite.models.ScanStatus;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the PostgreSQL store against a live database.

 * Enabled only when RACKLITE_TEST_PG_HOST is set; RACKLITE_TEST_PG_PORT, _DATABASE, _USER and
 * _PASSWORD default to 5432 and racklite. Every test starts from empty tables.
 */
@ExtendWith(VertxExtension.class)
@EnabledIfEnvironmentVariable(named = "RACKLITE_TEST_PG_HOST", matches = ".+")
class DiscoveryServiceImplTest
{

    private Pool pgPool;

    private InventoryServiceImpl inventoryService;

    private DiscoveryServiceImpl discoveryService;

    private static String env(String name, String defaultValue)
    {
        var value = System.getenv(name);

        return value != null && !value.isBlank() ? value : defaultValue;
    }

    @BeforeEach
    void connect(Vertx vertx, VertxTestContext testContext)
    {
        var connectOptions = new PgConnectOptions()
            .setHost(env("RACKLITE_TEST_PG_HOST", "localhost"))
            .setPort(Integer.parseInt(env("RACKLITE_TEST_PG_PORT", "5432")))
            .setDatabase(env("RACKLITE_TEST_PG_DATABASE", "racklite"))
            .setUser(env("RACKLITE_TEST_PG_USER", "racklite"))
            .setPassword(env("RACKLITE_TEST_PG_PASSWORD", "racklite"));

        pgPool = PgBuilder.pool()
            .with(new PoolOptions().setMaxSize(5))
            .connectingTo(connectOptions)
            .using(vertx)
            .build();

        inventoryService = new InventoryServiceImpl(pgPool);

        discoveryService = new DiscoveryServiceImpl(pgPool);

        vertx.fileSystem().readFile("db/schema.sql")
            .compose(schema -> pgPool.query(schema.toString()).execute())
            .compose(v -> pgPool.query("TRUNCATE tags, domains, addresses, devices, discovered_devices, discovery_scans, "
                + "discovery_rules, networks, datacenters CASCADE").execute())
            .compose(v -> inventoryService.datacenterCreate(new Datacenter("dc-1", "Primary")))
            .compose(v -> inventoryService.networkCreate(new Network("net-1", "Lab", "10.0.0.0/24", "dc-1")))
            .onComplete(testContext.succeedingThenComplete());
    }

    @AfterEach
    void close(VertxTestContext testContext)
    {
        pgPool.close().onComplete(testContext.succeedingThenComplete());
    }

    private static DiscoveredDevice draft(String ip, int confidence)
    {
        var draft = new DiscoveredDevice();

        draft.ip = ip;

        draft.networkId = "net-1";

        draft.status = DeviceStatus.ONLINE;

        draft.confidence = confidence;

        draft.openPorts = List.of(22, 80);

        draft.lastSeen = Instant.now();

        return draft;
    }

    @Test
    void upsertMergesObservationsOfOneIp(VertxTestContext testContext)
    {
        discoveryService.discoveredUpsert(draft("10.0.0.5", 80))
            .compose(first -> discoveryService.discoveredUpsert(draft("10.0.0.5", 60))
                .map(second ->
                {
                    testContext.verify(() ->
                    {
                        assertEquals(first.id, second.id);

                        assertEquals(80, second.confidence);
                    });

                    return first;
                }))
            .compose(first -> discoveryService.discoveredGetByIp("10.0.0.5")
                .map(stored ->
                {
                    testContext.verify(() ->
                    {
                        assertEquals(first.firstSeen.toEpochMilli(), stored.firstSeen.toEpochMilli());

                        assertEquals(List.of(22, 80), stored.openPorts);
                    });

                    return stored;
                }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    void concurrentFirstObservationsKeepOneRow(VertxTestContext testContext)
    {
        var upserts = new ArrayList<Future<DiscoveredDevice>>();

        for (var i = 0; i < 5; i++)
        {
            upserts.add(discoveryService.discoveredUpsert(draft("10.0.0.6", 50 + i)));
        }

        Future.all(upserts)
            .compose(done -> discoveryService.discoveredList(null))
            .onComplete(testContext.succeeding(devices -> testContext.verify(() ->
            {
                assertEquals(1, devices.size());

                assertEquals(54, devices.get(0).confidence);

                testContext.completeNow();
            })));
    }

    @Test
    void promotionCommitsDeviceAndMarkTogether(VertxTestContext testContext)
    {
        var request = new PromoteDeviceRequest("web-01");

        request.tags = List.of("web", "lab");

        discoveryService.discoveredUpsert(draft("10.0.0.7", 70))
            .compose(discovered -> discoveryService.discoveredPromote(discovered.id, request)
                .compose(device -> inventoryService.deviceGetById(device.id))
                .compose(device ->
                {
                    testContext.verify(() ->
                    {
                        assertEquals("dc-1", device.datacenterId);

                        assertEquals(1, device.addresses.size());

                        assertEquals("10.0.0.7", device.addresses.get(0).ip);

                        assertEquals(2, device.tags.size());
                    });

                    return discoveryService.discoveredGetById(discovered.id);
                })
                .compose(marked ->
                {
                    testContext.verify(() -> assertNotNull(marked.promotedAt));

                    return discoveryService.discoveredPromote(discovered.id, request);
                }))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.ALREADY_PROMOTED));

                testContext.completeNow();
            })));
    }

    @Test
    void failedPromotionLeavesNothingBehind(VertxTestContext testContext)
    {
        var request = new PromoteDeviceRequest("ghost");

        request.datacenterId = "dc-missing";

        discoveryService.discoveredUpsert(draft("10.0.0.8", 70))
            .compose(discovered -> discoveryService.discoveredPromote(discovered.id, request)
                .transform(result ->
                {
                    testContext.verify(() ->
                    {
                        assertTrue(result.failed());

                        assertTrue(DiscoveryException.isKind(result.cause(), DiscoveryException.Kind.INVALID_REFERENCE));
                    });

                    return discoveryService.discoveredGetById(discovered.id);
                }))
            .compose(unchanged -> inventoryService.deviceList()
                .map(devices ->
                {
                    testContext.verify(() ->
                    {
                        assertFalse(unchanged.isPromoted());

                        assertTrue(devices.isEmpty());
                    });

                    return devices;
                }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    void scanStatusOnlyMovesForward(VertxTestContext testContext)
    {
        var scan = new DiscoveryScan();

        scan.networkId = "net-1";

        discoveryService.scanCreate(scan)
            .compose(created ->
            {
                var done = created.copy();

                done.status = ScanStatus.COMPLETED;

                return discoveryService.scanUpdate(done);
            })
            .compose(done ->
            {
                var reopened = done.copy();

                reopened.status = ScanStatus.RUNNING;

                return discoveryService.scanUpdate(reopened);
            })
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.INVALID_REQUEST));

                testContext.completeNow();
            })));
    }

    @Test
    void ruleLookupsOfUnknownIdsAreNotFound(VertxTestContext testContext)
    {
        var rule = new DiscoveryRule();

        rule.networkId = "net-1";

        discoveryService.ruleCreate(rule)
            .compose(created -> discoveryService.ruleList("net-1")
                .map(rules ->
                {
                    testContext.verify(() -> assertEquals(created.id, rules.get(0).id));

                    return created;
                }))
            .compose(created -> discoveryService.ruleDelete(created.id))
            .compose(v -> discoveryService.ruleGetById("rule-missing"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertTrue(DiscoveryException.isKind(cause, DiscoveryException.Kind.NOT_FOUND));

                testContext.completeNow();
            })));
    }
}
