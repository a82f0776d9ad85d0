package com.racklite.core;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import com.racklite.models.DiscoveryRule;

import com.racklite.models.DiscoveryScan;

import com.racklite.services.DiscoveryService;

import com.racklite.services.InventoryService;

import com.racklite.utils.SubnetUtil;

import io.vertx.core.Future;

import io.vertx.core.Handler;

import io.vertx.core.Vertx;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Duration;

import java.time.Instant;

import java.util.Iterator;

import java.util.UUID;

import java.util.function.Supplier;

/**
 * DiscoveryScanner - Sweeps one network and reconciles what it finds

 * Workflow:
 * 1. Resolve the network and describe its subnet minus the rule's exclusions
 *    (configuration errors fail the scan here)
 * 2. Pull candidates lazily into the host limiter (rule.maxConcurrentScans) and probe them
 * 3. Score each result and upsert it; offline results only refresh existing records
 * 4. Report progress every progressInterval hosts and on the final host
 * 5. Mark the scan COMPLETED, or FAILED when cancelled

 * Per-host problems never fail the scan: probe failures become offline results and
 * persistence failures are logged and dropped. The scanner keeps no state between
 * scans; each call owns its own tracker and limiter.
 */
public class DiscoveryScanner
{

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryScanner.class);

    public static final String CANCELLED_MESSAGE = "scan cancelled";

    private final Vertx vertx;

    private final InventoryService inventoryService;

    private final DiscoveryService discoveryService;

    private final HostProber hostProber;

    private final int progressInterval;

    public DiscoveryScanner(Vertx vertx, InventoryService inventoryService, DiscoveryService discoveryService, HostProber hostProber)
    {
        this(vertx, inventoryService, discoveryService, hostProber, ScanProgressTracker.DEFAULT_NOTIFY_INTERVAL);
    }

    /**
     * Creates a scanner.
     *
     * @param vertx Vert.x instance (limiters)
     * @param inventoryService Network lookup
     * @param discoveryService Reconciliation target for probe results
     * @param hostProber Probe implementation
     * @param progressInterval Completed hosts between progress callbacks
     */
    public DiscoveryScanner(Vertx vertx, InventoryService inventoryService, DiscoveryService discoveryService,
                            HostProber hostProber, int progressInterval)
    {
        this.vertx = vertx;

        this.inventoryService = inventoryService;

        this.discoveryService = discoveryService;

        this.hostProber = hostProber;

        this.progressInterval = progressInterval;
    }

    /**
     * Scan a network.

     * The progress handler receives independent snapshots: once when the host list is
     * known, throttled during the sweep, and once with the terminal state. A configuration
     * failure produces exactly one callback with the FAILED scan.
     *
     * @param scanId ID for the scan record (null generates one)
     * @param networkId Network to sweep
     * @param rule Timeout, concurrency and exclusion policy (null uses defaults)
     * @param cancellation External cancellation signal (null means never cancelled)
     * @param progressHandler Snapshot consumer (may be null)
     * @return Future with the terminal COMPLETED snapshot; fails with CONFIGURATION or CANCELLED
     */
    public Future<DiscoveryScan> scanNetwork(String scanId, String networkId, DiscoveryRule rule,
                                             ScanCancellation cancellation, Handler<DiscoveryScan> progressHandler)
    {
        var effectiveRule = rule != null ? rule : new DiscoveryRule();

        var token = cancellation != null ? cancellation : new ScanCancellation();

        var now = Instant.now();

        var scan = new DiscoveryScan();

        scan.id = scanId != null && !scanId.isBlank() ? scanId : UUID.randomUUID().toString();

        scan.networkId = networkId;

        scan.scanType = effectiveRule.scanType;

        scan.scanDepth = DiscoveryScan.BASELINE_SCAN_DEPTH;

        scan.createdAt = now;

        var tracker = new ScanProgressTracker(scan, progressInterval);

        tracker.start(now);

        return resolveCandidates(networkId, effectiveRule)
            .transform(candidates ->
            {
                if (candidates.failed())
                {
                    var message = candidates.cause().getMessage();

                    logger.error("Scan {} for network {} failed to start: {}", scan.id, networkId, message);

                    notifyProgress(progressHandler, tracker.fail(message, Instant.now()));

                    return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.CONFIGURATION,
                        message, candidates.cause()));
                }

                return sweep(scan.id, networkId, effectiveRule, candidates.result(), token, tracker, progressHandler);
            });
    }

    /**
     * Network lookup and enumeration. Failures here are configuration errors.
     */
    private Future<SubnetUtil.HostRange> resolveCandidates(String networkId, DiscoveryRule rule)
    {
        if (networkId == null || networkId.isBlank())
        {
            return Future.failedFuture("getting network: network id is required");
        }

        return inventoryService.networkGetById(networkId)
            .recover(cause -> Future.failedFuture("getting network: " + cause.getMessage()))
            .compose(network ->
            {
                try
                {
                    return Future.<SubnetUtil.HostRange>succeededFuture(SubnetUtil.hostRange(network.subnet, rule.excludeIps));
                }
                catch (IllegalArgumentException exception)
                {
                    return Future.failedFuture("generating IP list: " + exception.getMessage());
                }
            });
    }

    private Future<DiscoveryScan> sweep(String scanId, String networkId, DiscoveryRule rule, SubnetUtil.HostRange candidates,
                                        ScanCancellation cancellation, ScanProgressTracker tracker,
                                        Handler<DiscoveryScan> progressHandler)
    {
        tracker.setTotalHosts(candidates.size());

        notifyProgress(progressHandler, tracker.snapshot());

        logger.info("Starting network discovery: scan={}, network={}, hosts={}, concurrency={}, timeout={}s",
            scanId, networkId, candidates.size(), rule.effectiveMaxConcurrentScans(), rule.effectiveTimeoutSeconds());

        var hostLimiter = new ConcurrencyLimiter(vertx, rule.effectiveMaxConcurrentScans());

        var timeout = Duration.ofSeconds(rule.effectiveTimeoutSeconds());

        var hosts = candidates.iterator();

        // Hosts are pulled only as permits free up and no more are pulled once cancelled
        var hostTasks = new Iterator<Supplier<Future<Void>>>()
        {
            @Override
            public boolean hasNext()
            {
                return !cancellation.isCancelled() && hosts.hasNext();
            }

            @Override
            public Supplier<Future<Void>> next()
            {
                var ip = hosts.next();

                return () -> scanHost(scanId, networkId, ip, timeout, cancellation, tracker, progressHandler);
            }
        };

        return hostLimiter.drain(hostTasks)
            .transform(done ->
            {
                if (cancellation.isCancelled())
                {
                    var message = cancelledMessage(cancellation);

                    var failed = tracker.fail(message, Instant.now());

                    logger.info("Network discovery cancelled: scan={}, scanned={}/{}, found={}, reason={}",
                        scanId, failed.scannedHosts, failed.totalHosts, failed.foundHosts, cancellation.reason());

                    notifyProgress(progressHandler, failed);

                    return Future.failedFuture(new DiscoveryException(DiscoveryException.Kind.CANCELLED, message));
                }

                var completed = tracker.complete(Instant.now());

                logger.info("Network discovery completed: scan={}, network={}, found={}, duration={}s",
                    scanId, networkId, completed.foundHosts, completed.durationSeconds);

                notifyProgress(progressHandler, completed);

                return Future.succeededFuture(completed);
            });
    }

    /**
     * Probe, score, reconcile and count one host. Always succeeds.
     */
    private Future<Void> scanHost(String scanId, String networkId, String ip, Duration timeout,
                                  ScanCancellation cancellation, ScanProgressTracker tracker,
                                  Handler<DiscoveryScan> progressHandler)
    {
        // Hosts not started before cancellation are skipped and not counted
        if (cancellation.isCancelled())
        {
            return Future.succeededFuture();
        }

        return hostProber.probeHost(ip, timeout, cancellation)
            .recover(cause ->
            {
                logger.debug("Host discovery failed for {}: {}", ip, cause.getMessage());

                return Future.succeededFuture(offlineDraft(ip));
            })
            .compose(draft ->
            {
                draft.networkId = networkId;

                draft.lastScanId = scanId;

                draft.confidence = ConfidenceScorer.score(draft);

                var online = draft.status == DeviceStatus.ONLINE;

                return reconcile(draft)
                    .map(v ->
                    {
                        notifyProgress(progressHandler, tracker.hostCompleted(online, Instant.now()));

                        return (Void) null;
                    });
            });
    }

    /**
     * Persist a scored draft. Online hosts are upserted; offline hosts only refresh a record
     * that already exists. Storage failures are logged and swallowed so the scan continues.
     */
    private Future<Void> reconcile(DiscoveredDevice draft)
    {
        Future<DiscoveredDevice> saved;

        if (draft.status == DeviceStatus.ONLINE)
        {
            saved = discoveryService.discoveredUpsert(draft);
        }
        else
        {
            saved = discoveryService.discoveredGetByIp(draft.ip)
                .compose(existing -> discoveryService.discoveredUpsert(draft))
                .recover(cause ->
                {
                    if (DiscoveryException.isKind(cause, DiscoveryException.Kind.NOT_FOUND))
                    {
                        return Future.succeededFuture();
                    }

                    return Future.failedFuture(cause);
                });
        }

        return saved
            .onSuccess(device ->
            {
                if (device != null)
                {
                    logger.debug("Device saved: ip={}, status={}, confidence={}", device.ip, device.status.value(), device.confidence);
                }
            })
            .<Void>mapEmpty()
            .recover(cause ->
            {
                logger.error("Failed to save discovered device {}: {}", draft.ip, cause.getMessage());

                return Future.succeededFuture();
            });
    }

    /**
     * Error message of a cancelled scan: CANCELLED_MESSAGE, followed by the reason when one was given.
     *
     * @param cancellation Triggered cancellation signal
     * @return Message stored on the FAILED scan
     */
    public static String cancelledMessage(ScanCancellation cancellation)
    {
        var reason = cancellation.reason();

        return reason != null && !reason.isBlank() ? CANCELLED_MESSAGE + ": " + reason : CANCELLED_MESSAGE;
    }

    private static DiscoveredDevice offlineDraft(String ip)
    {
        var draft = new DiscoveredDevice();

        draft.ip = ip;

        draft.status = DeviceStatus.OFFLINE;

        draft.lastSeen = Instant.now();

        return draft;
    }

    private static void notifyProgress(Handler<DiscoveryScan> progressHandler, DiscoveryScan snapshot)
    {
        if (progressHandler == null || snapshot == null)
        {
            return;
        }

        try
        {
            progressHandler.handle(snapshot);
        }
        catch (Exception exception)
        {
            logger.error("Progress handler failed for scan {}: {}", snapshot.id, exception.getMessage());
        }
    }
}
