package com.racklite.verticles;

import com.racklite.core.DiscoveryException;

import com.racklite.core.DiscoveryScanner;

import com.racklite.core.PromotionWorkflow;

import com.racklite.core.ScanCancellation;

import com.racklite.models.DiscoveredDeviceFilter;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.PromoteDeviceRequest;

import com.racklite.models.ScanStatus;

import com.racklite.services.DiscoveryService;

import com.racklite.utils.ExceptionUtil;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Future;

import io.vertx.core.Handler;

import io.vertx.core.Promise;

import io.vertx.core.eventbus.Message;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Map;

import java.util.UUID;

import java.util.concurrent.ConcurrentHashMap;

/**
 * DiscoveryVerticle - Event bus surface, scheduler and retention sweep for network discovery

 * Event bus addresses:
 * - discovery.scan.start   {network_id, scan_type?}  -> pending scan record; the sweep runs in the background
 * - discovery.scan.cancel  {scan_id}                 -> signals a running scan
 * - discovery.promote      {id, request}             -> created device
 * - discovery.promote.bulk {ids, devices}            -> promoted devices and per-ID errors
 * - discovery.discovered.list {network_id?, status?, promoted?, min_confidence?} -> {discovered_devices, count}
 * - discovery.discovered.get / .delete {id}
 * - discovery.scan.list {network_id?} -> {scans, count}, newest first
 * - discovery.scan.get / .delete {scan_id}; a running scan cannot be deleted
 * - discovery.rule.list {network_id?} -> {rules, count}
 * - discovery.rule.get / .delete {id}
 * - discovery.rule.create {rule fields}; discovery.rule.update {id, rule fields}

 * Failures carry the DiscoveryException kind as failure code (400, 404, 409, 422, 500).

 * Background work:
 * - Scheduler: enabled rules whose scan interval has elapsed are scanned; one running scan per network
 * - Retention: never-promoted discovered devices not seen for retention.days are deleted

 * Every progress snapshot of a running scan is persisted in order through scanUpdate.
 */
public class DiscoveryVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryVerticle.class);

    public static final String ADDRESS_SCAN_START = "discovery.scan.start";

    public static final String ADDRESS_SCAN_CANCEL = "discovery.scan.cancel";

    public static final String ADDRESS_PROMOTE = "discovery.promote";

    public static final String ADDRESS_PROMOTE_BULK = "discovery.promote.bulk";

    public static final String ADDRESS_DISCOVERED_LIST = "discovery.discovered.list";

    public static final String ADDRESS_DISCOVERED_GET = "discovery.discovered.get";

    public static final String ADDRESS_DISCOVERED_DELETE = "discovery.discovered.delete";

    public static final String ADDRESS_SCAN_LIST = "discovery.scan.list";

    public static final String ADDRESS_SCAN_GET = "discovery.scan.get";

    public static final String ADDRESS_SCAN_DELETE = "discovery.scan.delete";

    public static final String ADDRESS_RULE_LIST = "discovery.rule.list";

    public static final String ADDRESS_RULE_GET = "discovery.rule.get";

    public static final String ADDRESS_RULE_CREATE = "discovery.rule.create";

    public static final String ADDRESS_RULE_UPDATE = "discovery.rule.update";

    public static final String ADDRESS_RULE_DELETE = "discovery.rule.delete";

    private final DiscoveryService discoveryService;

    private final DiscoveryScanner scanner;

    private final PromotionWorkflow promotionWorkflow;

    // network id -> running scan
    private final Map<String, RunningScan> runningScans = new ConcurrentHashMap<>();

    private int defaultTimeoutSeconds;

    private int defaultMaxConcurrentHosts;

    private String defaultScanType;

    private int retentionDays;

    private long schedulerTimerId = -1;

    private long retentionTimerId = -1;

    /**
     * Creates the verticle around already initialized services.
     *
     * @param discoveryService Scan, rule and discovered device storage
     * @param scanner Network scanner
     */
    public DiscoveryVerticle(DiscoveryService discoveryService, DiscoveryScanner scanner)
    {
        this.discoveryService = discoveryService;

        this.scanner = scanner;

        this.promotionWorkflow = new PromotionWorkflow(discoveryService);
    }

    /**
     * Start the verticle: load configuration, register event bus consumers and start the timers.
     *
     * @param startPromise promise completed once the verticle is ready
     */
    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting DiscoveryVerticle");

            var discoveryConfig = config();

            // HOCON parses dotted keys as nested objects: timeout.seconds becomes timeout -> seconds
            defaultTimeoutSeconds = nested(discoveryConfig, "timeout").getInteger("seconds", DiscoveryRule.DEFAULT_TIMEOUT_SECONDS);

            defaultMaxConcurrentHosts = nested(nested(discoveryConfig, "max"), "concurrent")
                .getInteger("hosts", DiscoveryRule.DEFAULT_MAX_CONCURRENT_SCANS);

            defaultScanType = nested(nested(discoveryConfig, "default"), "scan")
                .getString("type", DiscoveryRule.SCAN_TYPE_FULL);

            var schedulerConfig = nested(discoveryConfig, "scheduler");

            var schedulerEnabled = schedulerConfig.getBoolean("enabled", true);

            var schedulerIntervalSeconds = nested(schedulerConfig, "interval").getInteger("seconds", 60);

            var retentionConfig = nested(discoveryConfig, "retention");

            retentionDays = retentionConfig.getInteger("days", 0);

            var retentionIntervalHours = nested(retentionConfig, "interval").getInteger("hours", 24);

            setupEventBusConsumers();

            if (schedulerEnabled && schedulerIntervalSeconds > 0)
            {
                schedulerTimerId = vertx.setPeriodic(schedulerIntervalSeconds * 1000L, id -> runScheduledScans());

                logger.info("Discovery scheduler enabled: every {}s", schedulerIntervalSeconds);
            }

            if (retentionDays > 0 && retentionIntervalHours > 0)
            {
                retentionTimerId = vertx.setPeriodic(Duration.ofHours(retentionIntervalHours).toMillis(), id -> runRetentionSweep());

                logger.info("Discovered device retention enabled: {} days", retentionDays);
            }

            startPromise.complete();
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    @Override
    public void stop()
    {
        if (schedulerTimerId >= 0)
        {
            vertx.cancelTimer(schedulerTimerId);
        }

        if (retentionTimerId >= 0)
        {
            vertx.cancelTimer(retentionTimerId);
        }

        for (var running : runningScans.values())
        {
            running.cancellation.cancel("discovery verticle stopped");
        }

        logger.info("DiscoveryVerticle stopped");
    }

    /**
     * Register discovery event bus consumers.
     */
    private void setupEventBusConsumers()
    {
        vertx.eventBus().<JsonObject>consumer(ADDRESS_SCAN_START, this::handleStartScan);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_SCAN_CANCEL, this::handleCancelScan);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_PROMOTE, this::handlePromote);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_PROMOTE_BULK, this::handleBulkPromote);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_DISCOVERED_LIST, this::handleDiscoveredList);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_DISCOVERED_GET, message ->
            discoveryService.discoveredGetById(field(message, "id"))
                .onSuccess(device -> message.reply(device.toJson()))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to get discovered device")));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_DISCOVERED_DELETE, message ->
        {
            var id = field(message, "id");

            discoveryService.discoveredDelete(id)
                .onSuccess(v -> message.reply(new JsonObject().put("id", id).put("deleted", true)))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to delete discovered device"));
        });

        vertx.eventBus().<JsonObject>consumer(ADDRESS_SCAN_LIST, message ->
            discoveryService.scanList(field(message, "network_id"))
                .onSuccess(scans ->
                {
                    var array = new JsonArray();

                    scans.forEach(scan -> array.add(scan.toJson()));

                    message.reply(new JsonObject().put("scans", array).put("count", array.size()));
                })
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to list scans")));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_SCAN_GET, message ->
            discoveryService.scanGetById(field(message, "scan_id"))
                .onSuccess(scan -> message.reply(scan.toJson()))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to get scan")));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_SCAN_DELETE, this::handleDeleteScan);

        vertx.eventBus().<JsonObject>consumer(ADDRESS_RULE_LIST, message ->
            discoveryService.ruleList(field(message, "network_id"))
                .onSuccess(rules ->
                {
                    var array = new JsonArray();

                    rules.forEach(rule -> array.add(rule.toJson()));

                    message.reply(new JsonObject().put("rules", array).put("count", array.size()));
                })
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to list discovery rules")));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_RULE_GET, message ->
            discoveryService.ruleGetById(field(message, "id"))
                .onSuccess(rule -> message.reply(rule.toJson()))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to get discovery rule")));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_RULE_CREATE, message -> saveRule(message, false));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_RULE_UPDATE, message -> saveRule(message, true));

        vertx.eventBus().<JsonObject>consumer(ADDRESS_RULE_DELETE, message ->
        {
            var id = field(message, "id");

            discoveryService.ruleDelete(id)
                .onSuccess(v -> message.reply(new JsonObject().put("id", id).put("deleted", true)))
                .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to delete discovery rule"));
        });
    }

    // ===== Handlers =====

    private void handleStartScan(Message<JsonObject> message)
    {
        var request = message.body() != null ? message.body() : new JsonObject();

        var networkId = request.getString("network_id");

        if (networkId == null || networkId.isBlank())
        {
            ExceptionUtil.handleEventBus(message, DiscoveryException.invalidRequest("network_id is required"), "Failed to start scan");

            return;
        }

        startScan(networkId, request.getString("scan_type"))
            .onSuccess(scan -> message.reply(scan.toJson()))
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to start scan"));
    }

    private void handleCancelScan(Message<JsonObject> message)
    {
        var scanId = message.body() != null ? message.body().getString("scan_id") : null;

        for (var running : runningScans.values())
        {
            if (running.scanId.equals(scanId))
            {
                running.cancellation.cancel("cancelled by request");

                logger.info("Cancellation requested for scan {}", scanId);

                message.reply(new JsonObject().put("scan_id", scanId).put("cancelled", true));

                return;
            }
        }

        ExceptionUtil.handleEventBus(message, DiscoveryException.notFound("no running scan: " + scanId), "Failed to cancel scan");
    }

    private void handlePromote(Message<JsonObject> message)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        var request = PromoteDeviceRequest.fromJson(body.getJsonObject("request", new JsonObject()));

        promotionWorkflow.promote(body.getString("id"), request)
            .onSuccess(device -> message.reply(device.toJson()))
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to promote device"));
    }

    private void handleBulkPromote(Message<JsonObject> message)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        var ids = new ArrayList<String>();

        for (var id : body.getJsonArray("ids", new JsonArray()))
        {
            ids.add(String.valueOf(id));
        }

        var requests = new ArrayList<PromoteDeviceRequest>();

        var devices = body.getJsonArray("devices", new JsonArray());

        for (var i = 0; i < devices.size(); i++)
        {
            var device = devices.getJsonObject(i);

            requests.add(device != null ? PromoteDeviceRequest.fromJson(device) : null);
        }

        promotionWorkflow.bulkPromote(ids, requests)
            .onSuccess(result -> message.reply(result.toJson()))
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to promote devices"));
    }

    private void handleDiscoveredList(Message<JsonObject> message)
    {
        DiscoveredDeviceFilter filter;

        try
        {
            filter = DiscoveredDeviceFilter.fromJson(message.body());
        }
        catch (IllegalArgumentException | ClassCastException exception)
        {
            ExceptionUtil.handleEventBus(message, DiscoveryException.invalidRequest("invalid filter: " + exception.getMessage()),
                "Failed to list discovered devices");

            return;
        }

        discoveryService.discoveredList(filter)
            .onSuccess(devices ->
            {
                var array = new JsonArray();

                devices.forEach(device -> array.add(device.toJson()));

                message.reply(new JsonObject().put("discovered_devices", array).put("count", array.size()));
            })
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to list discovered devices"));
    }

    private void handleDeleteScan(Message<JsonObject> message)
    {
        var scanId = field(message, "scan_id");

        for (var running : runningScans.values())
        {
            if (running.scanId.equals(scanId))
            {
                ExceptionUtil.handleEventBus(message, DiscoveryException.invalidRequest("scan " + scanId
                    + " is still running; cancel it first"), "Failed to delete scan");

                return;
            }
        }

        discoveryService.scanDelete(scanId)
            .onSuccess(v -> message.reply(new JsonObject().put("scan_id", scanId).put("deleted", true)))
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, "Failed to delete scan"));
    }

    /**
     * Create or update a rule from its JSON fields. Updates need the rule id.
     */
    private void saveRule(Message<JsonObject> message, boolean update)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        var action = update ? "Failed to update discovery rule" : "Failed to create discovery rule";

        DiscoveryRule rule;

        try
        {
            rule = DiscoveryRule.fromJson(body);
        }
        catch (ClassCastException exception)
        {
            ExceptionUtil.handleEventBus(message, DiscoveryException.invalidRequest("invalid rule: " + exception.getMessage()), action);

            return;
        }

        if (update && (rule.id == null || rule.id.isBlank()))
        {
            ExceptionUtil.handleEventBus(message, DiscoveryException.invalidRequest("rule id is required"), action);

            return;
        }

        var saved = update ? discoveryService.ruleUpdate(rule) : discoveryService.ruleCreate(rule);

        saved
            .onSuccess(stored -> message.reply(stored.toJson()))
            .onFailure(cause -> ExceptionUtil.handleEventBus(message, cause, action));
    }

    private static String field(Message<JsonObject> message, String key)
    {
        return message.body() != null ? message.body().getString(key) : null;
    }

    // ===== Scans =====

    /**
     * Create a pending scan for a network and run it in the background.
     *
     * @param networkId Network to scan
     * @param scanTypeOverride Scan type for this run only (null keeps the rule's)
     * @return Future containing the pending scan record
     */
    Future<DiscoveryScan> startScan(String networkId, String scanTypeOverride)
    {
        var running = new RunningScan(UUID.randomUUID().toString());

        if (runningScans.putIfAbsent(networkId, running) != null)
        {
            return Future.failedFuture(DiscoveryException.invalidRequest("a scan is already running for network " + networkId));
        }

        return discoveryService.ruleGetByNetwork(networkId)
            .recover(cause ->
            {
                if (DiscoveryException.isKind(cause, DiscoveryException.Kind.NOT_FOUND))
                {
                    return Future.succeededFuture(defaultRule(networkId));
                }

                return Future.failedFuture(cause);
            })
            .compose(storedRule ->
            {
                var rule = DiscoveryRule.fromJson(storedRule.toJson());

                if (scanTypeOverride != null && !scanTypeOverride.isBlank())
                {
                    rule.scanType = scanTypeOverride;
                }

                var scan = new DiscoveryScan();

                scan.id = running.scanId;

                scan.networkId = networkId;

                scan.status = ScanStatus.PENDING;

                scan.scanType = rule.scanType;

                scan.scanDepth = DiscoveryScan.BASELINE_SCAN_DEPTH;

                return discoveryService.scanCreate(scan)
                    .onSuccess(created -> runInBackground(created, rule, running));
            })
            .onFailure(cause -> runningScans.remove(networkId, running));
    }

    private void runInBackground(DiscoveryScan scan, DiscoveryRule rule, RunningScan running)
    {
        var writer = new ProgressWriter();

        logger.info("Scan {} started for network {} ({})", scan.id, scan.networkId, rule.scanType);

        scanner.scanNetwork(scan.id, scan.networkId, rule, running.cancellation, writer)
            .onSuccess(done -> logger.info("Scan {} completed: {}/{} hosts, {} found",
                done.id, done.scannedHosts, done.totalHosts, done.foundHosts))
            .onFailure(cause -> logger.warn("Scan {} failed: {}", scan.id, cause.getMessage()))
            .onComplete(result -> writer.drained()
                .onComplete(v -> runningScans.remove(scan.networkId, running)));
    }

    /**
     * Check the enabled rules and start the scans that are due.
     */
    void runScheduledScans()
    {
        discoveryService.ruleList(null)
            .onSuccess(rules ->
            {
                var now = Instant.now();

                for (var rule : rules)
                {
                    if (!rule.enabled || rule.scanIntervalHours <= 0 || runningScans.containsKey(rule.networkId))
                    {
                        continue;
                    }

                    discoveryService.scanList(rule.networkId)
                        .onSuccess(scans ->
                        {
                            var lastScan = scans.isEmpty() ? null : scans.get(0);

                            if (isDue(rule, lastScan, now))
                            {
                                startScan(rule.networkId, null)
                                    .onSuccess(scan -> logger.info("Scheduled scan {} started for network {}", scan.id, rule.networkId))
                                    .onFailure(cause -> logger.warn("Scheduled scan for network {} not started: {}",
                                        rule.networkId, cause.getMessage()));
                            }
                        })
                        .onFailure(cause -> logger.error("Failed to list scans for network {}: {}", rule.networkId, cause.getMessage()));
                }
            })
            .onFailure(cause -> logger.error("Failed to load discovery rules: {}", cause.getMessage()));
    }

    /**
     * Delete never-promoted discovered devices older than the retention window.
     *
     * @return Future containing the number of deleted records
     */
    Future<Integer> runRetentionSweep()
    {
        return discoveryService.discoveredCleanup(retentionDays)
            .onSuccess(count ->
            {
                if (count > 0)
                {
                    logger.info("Retention sweep removed {} discovered devices older than {} days", count, retentionDays);
                }
            })
            .onFailure(cause -> logger.error("Retention sweep failed: {}", cause.getMessage()));
    }

    /**
     * A rule is due when its network was never scanned or the last scan was
     * created at least scanIntervalHours ago.
     *
     * @param rule Enabled rule
     * @param lastScan Most recent scan for the rule's network (may be null)
     * @param now Current time
     * @return true if a scan should start
     */
    static boolean isDue(DiscoveryRule rule, DiscoveryScan lastScan, Instant now)
    {
        if (!rule.enabled || rule.scanIntervalHours <= 0)
        {
            return false;
        }

        if (lastScan == null || lastScan.createdAt == null)
        {
            return true;
        }

        if (lastScan.status == ScanStatus.PENDING || lastScan.status == ScanStatus.RUNNING)
        {
            return false;
        }

        return !lastScan.createdAt.plus(Duration.ofHours(rule.scanIntervalHours)).isAfter(now);
    }

    private DiscoveryRule defaultRule(String networkId)
    {
        var rule = new DiscoveryRule();

        rule.networkId = networkId;

        rule.scanType = defaultScanType;

        rule.timeoutSeconds = defaultTimeoutSeconds;

        rule.maxConcurrentScans = defaultMaxConcurrentHosts;

        return rule;
    }

    private static JsonObject nested(JsonObject config, String key)
    {
        var value = config.getValue(key);

        return value instanceof JsonObject ? (JsonObject) value : new JsonObject();
    }

    /**
     * Persists progress snapshots one after another so a late write never
     * overtakes a newer one.
     */
    private final class ProgressWriter implements Handler<DiscoveryScan>
    {

        private Future<Void> tail = Future.succeededFuture();

        @Override
        public synchronized void handle(DiscoveryScan snapshot)
        {
            tail = tail.compose(v -> discoveryService.scanUpdate(snapshot)
                .<Void>mapEmpty()
                .recover(cause ->
                {
                    logger.error("Failed to persist progress of scan {}: {}", snapshot.id, cause.getMessage());

                    return Future.succeededFuture();
                }));
        }

        synchronized Future<Void> drained()
        {
            return tail;
        }
    }

    private static final class RunningScan
    {

        private final String scanId;

        private final ScanCancellation cancellation = new ScanCancellation();

        private RunningScan(String scanId)
        {
            this.scanId = scanId;
        }
    }
}
