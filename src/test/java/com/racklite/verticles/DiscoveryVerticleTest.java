package com.racklite.verticles;

import com.racklite.core.DiscoveryScanner;

import com.racklite.core.HostProber;

import com.racklite.models.Datacenter;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.Network;

import com.racklite.models.ScanStatus;

import com.racklite.services.impl.InMemoryDatabase;

import com.racklite.services.impl.InMemoryDiscoveryServiceImpl;

import com.racklite.services.impl.InMemoryInventoryServiceImpl;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.eventbus.ReplyException;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

import java.time.Instant;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class DiscoveryVerticleTest
{

    private static final long PROBE_DELAY_MS = 300;

    private InMemoryInventoryServiceImpl inventoryService;

    private InMemoryDiscoveryServiceImpl discoveryService;

    private DiscoveryVerticle verticle;

    @BeforeEach
    void deploy(Vertx vertx, VertxTestContext testContext)
    {
        var database = new InMemoryDatabase();

        inventoryService = new InMemoryInventoryServiceImpl(database);

        discoveryService = new InMemoryDiscoveryServiceImpl(database);

        inventoryService.datacenterCreate(new Datacenter("dc-1", "Primary"));

        inventoryService.networkCreate(new Network("net-30", "Uplink", "10.0.0.0/30", "dc-1"));

        inventoryService.networkCreate(new Network("net-24", "Lab", "192.168.5.0/24", "dc-1"));

        // 10.0.0.2 listens on ssh; every probe takes PROBE_DELAY_MS
        HostProber prober = (ip, timeout, cancellation) -> Future.<DiscoveredDevice>future(promise ->
            vertx.setTimer(PROBE_DELAY_MS, id ->
            {
                var draft = new DiscoveredDevice();

                draft.ip = ip;

                draft.openPorts = "10.0.0.2".equals(ip) ? List.of(22) : List.of();

                draft.status = draft.openPorts.isEmpty() ? DeviceStatus.OFFLINE : DeviceStatus.ONLINE;

                draft.lastSeen = Instant.now();

                promise.complete(draft);
            }));

        var scanner = new DiscoveryScanner(vertx, inventoryService, discoveryService, prober);

        verticle = new DiscoveryVerticle(discoveryService, scanner);

        var config = new JsonObject()
            .put("scheduler", new JsonObject().put("enabled", false))
            .put("retention", new JsonObject().put("days", 30));

        vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config))
            .onComplete(testContext.succeedingThenComplete());
    }

    private Future<DiscoveryScan> awaitScan(Vertx vertx, String scanId, ScanStatus status)
    {
        var promise = Promise.<DiscoveryScan>promise();

        var deadline = System.currentTimeMillis() + 20_000;

        vertx.setPeriodic(25, timerId ->
        {
            var scan = discoveryService.scanGetById(scanId).result();

            if (scan != null && scan.status == status)
            {
                vertx.cancelTimer(timerId);

                promise.tryComplete(scan);
            }
            else if (System.currentTimeMillis() > deadline)
            {
                vertx.cancelTimer(timerId);

                promise.tryFail("scan " + scanId + " never reached " + status);
            }
        });

        return promise.future();
    }

    private static int failureCode(Throwable cause)
    {
        return cause instanceof ReplyException ? ((ReplyException) cause).failureCode() : -1;
    }

    @Test
    void scanRunsInBackgroundAndPersistsProgress(Vertx vertx, VertxTestContext testContext)
    {
        vertx.eventBus().<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject().put("network_id", "net-30"))
            .compose(reply ->
            {
                var pending = reply.body();

                testContext.verify(() ->
                {
                    assertEquals("pending", pending.getString("status"));

                    assertEquals("net-30", pending.getString("network_id"));

                    assertEquals("full", pending.getString("scan_type"));
                });

                return awaitScan(vertx, pending.getString("id"), ScanStatus.COMPLETED);
            })
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(2, scan.totalHosts);

                assertEquals(2, scan.scannedHosts);

                assertEquals(1, scan.foundHosts);

                assertEquals(100.0, scan.progressPercent());

                assertEquals(60, discoveryService.discoveredGetByIp("10.0.0.2").result().confidence);

                testContext.completeNow();
            })));
    }

    @Test
    void scanTypeOverrideAndStoredRuleAreUsed(Vertx vertx, VertxTestContext testContext)
    {
        var rule = new DiscoveryRule();

        rule.networkId = "net-30";

        rule.scanType = DiscoveryRule.SCAN_TYPE_QUICK;

        discoveryService.ruleCreate(rule);

        vertx.eventBus().<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START,
                new JsonObject().put("network_id", "net-30").put("scan_type", "deep"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() ->
            {
                assertEquals("deep", reply.body().getString("scan_type"));

                assertEquals(DiscoveryRule.SCAN_TYPE_QUICK, discoveryService.ruleGetByNetwork("net-30").result().scanType);

                testContext.completeNow();
            })));
    }

    @Test
    void onlyOneRunningScanPerNetwork(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        var request = new JsonObject().put("network_id", "net-30");

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, request)
            .compose(first -> eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, request))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(400, failureCode(cause));

                assertTrue(cause.getMessage().contains("already running"));

                testContext.completeNow();
            })));
    }

    @Test
    void startWithoutNetworkIsRejected(Vertx vertx, VertxTestContext testContext)
    {
        vertx.eventBus().request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject())
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(400, failureCode(cause));

                testContext.completeNow();
            })));
    }

    @Test
    void unknownNetworkEndsInFailedScan(Vertx vertx, VertxTestContext testContext)
    {
        vertx.eventBus().<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject().put("network_id", "net-gone"))
            .compose(reply -> awaitScan(vertx, reply.body().getString("id"), ScanStatus.FAILED))
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertTrue(scan.errorMessage.startsWith("getting network:"));

                testContext.completeNow();
            })));
    }

    @Test
    void runningScanCanBeCancelled(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject().put("network_id", "net-24"))
            .compose(reply ->
            {
                var scanId = reply.body().getString("id");

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_CANCEL, new JsonObject().put("scan_id", scanId))
                    .compose(cancelled ->
                    {
                        testContext.verify(() -> assertTrue(cancelled.body().getBoolean("cancelled")));

                        return awaitScan(vertx, scanId, ScanStatus.FAILED);
                    });
            })
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(DiscoveryScanner.CANCELLED_MESSAGE + ": cancelled by request", scan.errorMessage);

                assertTrue(scan.scannedHosts < scan.totalHosts);

                testContext.completeNow();
            })));
    }

    @Test
    void cancellingUnknownScanIsNotFound(Vertx vertx, VertxTestContext testContext)
    {
        vertx.eventBus().request(DiscoveryVerticle.ADDRESS_SCAN_CANCEL, new JsonObject().put("scan_id", "nope"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                testContext.completeNow();
            })));
    }

    @Test
    void promoteOverEventBus(Vertx vertx, VertxTestContext testContext)
    {
        var draft = new DiscoveredDevice();

        draft.ip = "10.0.0.2";

        draft.networkId = "net-30";

        draft.status = DeviceStatus.ONLINE;

        draft.osGuess = "Linux";

        var discovered = discoveryService.discoveredUpsert(draft).result();

        var body = new JsonObject()
            .put("id", discovered.id)
            .put("request", new JsonObject().put("name", "edge-01").put("tags", new JsonArray().add("edge")));

        var eventBus = vertx.eventBus();

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_PROMOTE, body)
            .compose(reply ->
            {
                testContext.verify(() ->
                {
                    assertEquals("edge-01", reply.body().getString("name"));

                    assertEquals("dc-1", reply.body().getString("datacenter_id"));

                    assertEquals("Linux", reply.body().getString("os"));
                });

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_PROMOTE, body);
            })
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(409, failureCode(cause));

                testContext.completeNow();
            })));
    }

    @Test
    void bulkPromoteReportsPerIdErrors(Vertx vertx, VertxTestContext testContext)
    {
        var draft = new DiscoveredDevice();

        draft.ip = "10.0.0.1";

        draft.status = DeviceStatus.ONLINE;

        var discovered = discoveryService.discoveredUpsert(draft).result();

        var body = new JsonObject()
            .put("ids", new JsonArray().add(discovered.id).add("missing"))
            .put("devices", new JsonArray().add(new JsonObject().put("name", "core-sw")));

        vertx.eventBus().<JsonObject>request(DiscoveryVerticle.ADDRESS_PROMOTE_BULK, body)
            .onComplete(testContext.succeeding(reply -> testContext.verify(() ->
            {
                assertEquals(1, reply.body().getInteger("promoted_count"));

                assertEquals(1, reply.body().getInteger("error_count"));

                assertTrue(reply.body().getJsonArray("errors").getString(0).startsWith("promote missing:"));

                testContext.completeNow();
            })));
    }

    @Test
    void retentionSweepRemovesStaleRecords(Vertx vertx, VertxTestContext testContext)
    {
        var stale = new DiscoveredDevice();

        stale.ip = "10.0.0.1";

        stale.status = DeviceStatus.OFFLINE;

        stale.lastSeen = Instant.now().minus(Duration.ofDays(90));

        discoveryService.discoveredUpsert(stale);

        verticle.runRetentionSweep()
            .onComplete(testContext.succeeding(removed -> testContext.verify(() ->
            {
                assertEquals(1, removed);

                assertTrue(discoveryService.discoveredList(null).result().isEmpty());

                testContext.completeNow();
            })));
    }

    @Test
    void scheduleDueDecision()
    {
        var now = Instant.parse("2026-05-01T12:00:00Z");

        var rule = new DiscoveryRule();

        rule.scanIntervalHours = 6;

        assertTrue(DiscoveryVerticle.isDue(rule, null, now));

        var recent = new DiscoveryScan();

        recent.status = ScanStatus.COMPLETED;

        recent.createdAt = now.minus(Duration.ofHours(2));

        assertFalse(DiscoveryVerticle.isDue(rule, recent, now));

        var old = new DiscoveryScan();

        old.status = ScanStatus.FAILED;

        old.createdAt = now.minus(Duration.ofHours(6));

        assertTrue(DiscoveryVerticle.isDue(rule, old, now));

        var stillRunning = old.copy();

        stillRunning.status = ScanStatus.RUNNING;

        assertFalse(DiscoveryVerticle.isDue(rule, stillRunning, now));

        rule.enabled = false;

        assertFalse(DiscoveryVerticle.isDue(rule, null, now));

        rule.enabled = true;

        rule.scanIntervalHours = 0;

        assertFalse(DiscoveryVerticle.isDue(rule, null, now));
    }

    @Test
    void ruleLifecycleOverEventBus(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        var fields = new JsonObject()
            .put("network_id", "net-30")
            .put("scan_interval_hours", 6)
            .put("exclude_ips", new JsonArray().add("10.0.0.1"));

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_CREATE, fields)
            .compose(created ->
            {
                var ruleId = created.body().getString("id");

                testContext.verify(() ->
                {
                    assertTrue(ruleId != null && !ruleId.isBlank());

                    assertEquals(6, created.body().getInteger("scan_interval_hours"));
                });

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_GET, new JsonObject().put("id", ruleId))
                    .compose(fetched ->
                    {
                        testContext.verify(() -> assertEquals("net-30", fetched.body().getString("network_id")));

                        return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_LIST, new JsonObject().put("network_id", "net-30"));
                    })
                    .compose(listed ->
                    {
                        testContext.verify(() -> assertEquals(1, listed.body().getInteger("count")));

                        var update = fields.copy().put("id", ruleId).put("enabled", false);

                        return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_UPDATE, update);
                    })
                    .compose(updated ->
                    {
                        testContext.verify(() ->
                        {
                            assertFalse(updated.body().getBoolean("enabled"));

                            assertFalse(discoveryService.ruleGetByNetwork("net-30").result().enabled);
                        });

                        return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_DELETE, new JsonObject().put("id", ruleId));
                    })
                    .compose(deleted ->
                    {
                        testContext.verify(() -> assertTrue(deleted.body().getBoolean("deleted")));

                        return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_GET, new JsonObject().put("id", ruleId));
                    });
            })
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                testContext.completeNow();
            })));
    }

    @Test
    void invalidRuleRequestsAreRejected(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        var checkpoint = testContext.checkpoint(4);

        eventBus.request(DiscoveryVerticle.ADDRESS_RULE_CREATE, new JsonObject().put("network_id", "net-gone"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(422, failureCode(cause));

                checkpoint.flag();
            })));

        eventBus.request(DiscoveryVerticle.ADDRESS_RULE_UPDATE, new JsonObject().put("network_id", "net-30"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(400, failureCode(cause));

                checkpoint.flag();
            })));

        eventBus.request(DiscoveryVerticle.ADDRESS_RULE_UPDATE, new JsonObject().put("id", "rule-gone").put("network_id", "net-30"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                checkpoint.flag();
            })));

        eventBus.request(DiscoveryVerticle.ADDRESS_RULE_DELETE, new JsonObject().put("id", "rule-gone"))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                checkpoint.flag();
            })));
    }

    @Test
    void ruleCreatedOverEventBusDrivesTheScheduler(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        var fields = new JsonObject()
            .put("network_id", "net-30")
            .put("scan_interval_hours", 1)
            .put("scan_type", DiscoveryRule.SCAN_TYPE_QUICK);

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_RULE_CREATE, fields)
            .compose(created ->
            {
                verticle.runScheduledScans();

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_LIST, new JsonObject().put("network_id", "net-30"));
            })
            .compose(listed ->
            {
                var scans = listed.body().getJsonArray("scans");

                testContext.verify(() ->
                {
                    assertEquals(1, listed.body().getInteger("count"));

                    assertEquals(DiscoveryRule.SCAN_TYPE_QUICK, scans.getJsonObject(0).getString("scan_type"));
                });

                return awaitScan(vertx, scans.getJsonObject(0).getString("id"), ScanStatus.COMPLETED);
            })
            .onComplete(testContext.succeeding(scan -> testContext.verify(() ->
            {
                assertEquals(2, scan.scannedHosts);

                testContext.completeNow();
            })));
    }

    @Test
    void finishedScanCanBeListedFetchedAndDeleted(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject().put("network_id", "net-30"))
            .compose(reply -> awaitScan(vertx, reply.body().getString("id"), ScanStatus.COMPLETED))
            .compose(done -> eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_LIST, new JsonObject())
                .compose(listed ->
                {
                    testContext.verify(() ->
                    {
                        assertEquals(1, listed.body().getInteger("count"));

                        assertEquals(done.id, listed.body().getJsonArray("scans").getJsonObject(0).getString("id"));
                    });

                    return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_GET, new JsonObject().put("scan_id", done.id));
                })
                .compose(fetched ->
                {
                    testContext.verify(() -> assertEquals("completed", fetched.body().getString("status")));

                    return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_DELETE, new JsonObject().put("scan_id", done.id));
                })
                .compose(deleted ->
                {
                    testContext.verify(() -> assertTrue(deleted.body().getBoolean("deleted")));

                    return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_GET, new JsonObject().put("scan_id", done.id));
                }))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                testContext.completeNow();
            })));
    }

    @Test
    void runningScanCannotBeDeleted(Vertx vertx, VertxTestContext testContext)
    {
        var eventBus = vertx.eventBus();

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_SCAN_START, new JsonObject().put("network_id", "net-24"))
            .compose(reply -> eventBus.request(DiscoveryVerticle.ADDRESS_SCAN_DELETE,
                new JsonObject().put("scan_id", reply.body().getString("id"))))
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(400, failureCode(cause));

                assertTrue(cause.getMessage().contains("still running"));

                testContext.completeNow();
            })));
    }

    @Test
    void discoveredDevicesCanBeListedFetchedAndDeleted(Vertx vertx, VertxTestContext testContext)
    {
        var weak = new DiscoveredDevice();

        weak.ip = "10.0.0.1";

        weak.networkId = "net-30";

        weak.status = DeviceStatus.ONLINE;

        weak.confidence = 50;

        var strong = new DiscoveredDevice();

        strong.ip = "10.0.0.2";

        strong.networkId = "net-30";

        strong.status = DeviceStatus.ONLINE;

        strong.confidence = 80;

        discoveryService.discoveredUpsert(weak);

        var strongId = discoveryService.discoveredUpsert(strong).result().id;

        var eventBus = vertx.eventBus();

        eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_DISCOVERED_LIST,
                new JsonObject().put("network_id", "net-30").put("min_confidence", 70))
            .compose(listed ->
            {
                testContext.verify(() ->
                {
                    assertEquals(1, listed.body().getInteger("count"));

                    assertEquals("10.0.0.2", listed.body().getJsonArray("discovered_devices").getJsonObject(0).getString("ip"));
                });

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_DISCOVERED_GET, new JsonObject().put("id", strongId));
            })
            .compose(fetched ->
            {
                testContext.verify(() -> assertEquals(80, fetched.body().getInteger("confidence")));

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_DISCOVERED_DELETE, new JsonObject().put("id", strongId));
            })
            .compose(deleted -> eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_DISCOVERED_LIST, new JsonObject()))
            .compose(remaining ->
            {
                testContext.verify(() -> assertEquals(1, remaining.body().getInteger("count")));

                return eventBus.<JsonObject>request(DiscoveryVerticle.ADDRESS_DISCOVERED_DELETE, new JsonObject().put("id", strongId));
            })
            .onComplete(testContext.failing(cause -> testContext.verify(() ->
            {
                assertEquals(404, failureCode(cause));

                testContext.completeNow();
            })));
    }
}
