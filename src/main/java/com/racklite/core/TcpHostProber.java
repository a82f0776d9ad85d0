package com.racklite.core;

import com.racklite.models.DeviceStatus;

import com.racklite.models.DiscoveredDevice;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.net.NetClient;

import io.vertx.core.net.NetClientOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.net.InetAddress;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collections;

import java.util.List;

import java.util.function.Function;

/**
 * TcpHostProber - Baseline host probe using reverse DNS and TCP connect checks

 * For every host:
 * - Reverse DNS lookup on a worker thread (executeBlocking), bounded by the probe timeout
 * - TCP connect-and-close against the common port list through a NetClient,
 *   at most maxConcurrentPorts dials in flight per host

 * A host is ONLINE when at least one port accepted a connection, otherwise OFFLINE.
 * Connection failures and lookup failures are logged at DEBUG and never fail the probe.
 */
public class TcpHostProber implements HostProber
{

    private static final Logger logger = LoggerFactory.getLogger(TcpHostProber.class);

    /**
     * HTTP, HTTPS, SSH, RDP, Telnet, FTP, SMTP, DNS, POP3, IMAP, IMAPS, POP3S.
     */
    public static final List<Integer> COMMON_PORTS = List.of(80, 443, 22, 3389, 23, 21, 25, 53, 110, 143, 993, 995);

    public static final int DEFAULT_MAX_CONCURRENT_PORTS = 10;

    private final Vertx vertx;

    private final List<Integer> ports;

    private final int maxConcurrentPorts;

    private final Function<String, String> hostnameResolver;

    /**
     * Creates a prober for the common ports using the system resolver.
     *
     * @param vertx Vert.x instance
     * @param maxConcurrentPorts Port dials allowed in flight per host
     */
    public TcpHostProber(Vertx vertx, int maxConcurrentPorts)
    {
        this(vertx, COMMON_PORTS, maxConcurrentPorts, TcpHostProber::reverseLookup);
    }

    /**
     * Creates a prober with an explicit port list and hostname resolver.
     *
     * @param vertx Vert.x instance
     * @param ports Ports to dial, in dial order
     * @param maxConcurrentPorts Port dials allowed in flight per host
     * @param hostnameResolver Blocking reverse lookup; may return null or the IP itself when unresolved
     */
    public TcpHostProber(Vertx vertx, List<Integer> ports, int maxConcurrentPorts, Function<String, String> hostnameResolver)
    {
        this.vertx = vertx;

        this.ports = List.copyOf(ports);

        this.maxConcurrentPorts = maxConcurrentPorts > 0 ? maxConcurrentPorts : DEFAULT_MAX_CONCURRENT_PORTS;

        this.hostnameResolver = hostnameResolver;
    }

    @Override
    public Future<DiscoveredDevice> probeHost(String ip, Duration timeout, ScanCancellation cancellation)
    {
        try
        {
            var timeoutMs = Math.max(1L, timeout.toMillis());

            var client = vertx.createNetClient(new NetClientOptions()
                .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, timeoutMs)));

            var portLimiter = new ConcurrencyLimiter(vertx, maxConcurrentPorts);

            var openPorts = Collections.synchronizedList(new ArrayList<Integer>());

            var checks = new ArrayList<Future<Boolean>>();

            for (var port : ports)
            {
                checks.add(portLimiter.submit(() ->
                {
                    // Cancelled hosts skip the remaining dials; dials already issued complete
                    if (cancellation.isCancelled())
                    {
                        return Future.succeededFuture(false);
                    }

                    return checkPort(client, ip, port)
                        .onSuccess(open ->
                        {
                            if (open)
                            {
                                openPorts.add(port);
                            }
                        });
                }));
            }

            var hostnameFuture = cancellation.isCancelled()
                ? Future.<String>succeededFuture(null)
                : resolveHostname(ip, timeoutMs);

            var all = new ArrayList<Future<?>>(checks);

            all.add(hostnameFuture);

            return Future.join(all)
                .onComplete(result -> client.close())
                .map(result ->
                {
                    var draft = new DiscoveredDevice();

                    draft.ip = ip;

                    draft.hostname = hostnameFuture.result();

                    synchronized (openPorts)
                    {
                        draft.openPorts = new ArrayList<>(openPorts);
                    }

                    draft.status = draft.openPorts.isEmpty() ? DeviceStatus.OFFLINE : DeviceStatus.ONLINE;

                    draft.lastSeen = Instant.now();

                    logger.debug("Probed {}: status={}, openPorts={}, hostname={}",
                        ip, draft.status.value(), draft.openPorts, draft.hostname);

                    return draft;
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in probeHost: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    /**
     * Connect-and-close on one port. Never fails: an unreachable port completes with false.
     */
    private Future<Boolean> checkPort(NetClient client, String ip, int port)
    {
        var promise = Promise.<Boolean>promise();

        client.connect(port, ip)
            .onSuccess(socket ->
            {
                logger.debug("Port {} open on {}", port, ip);

                socket.close();

                promise.complete(true);
            })
            .onFailure(cause ->
            {
                logger.debug("Port {} not reachable on {}: {}", port, ip, cause.getMessage());

                promise.complete(false);
            });

        return promise.future();
    }

    /**
     * Best-effort reverse lookup bounded by a timer. Completes with null when the
     * lookup fails, times out, or only echoes the address back.
     */
    private Future<String> resolveHostname(String ip, long timeoutMs)
    {
        var promise = Promise.<String>promise();

        var timerId = vertx.setTimer(timeoutMs, id ->
        {
            if (promise.tryComplete(null))
            {
                logger.debug("Reverse lookup timed out for {}", ip);
            }
        });

        vertx.executeBlocking(() -> hostnameResolver.apply(ip), false)
            .onComplete(result ->
            {
                vertx.cancelTimer(timerId);

                if (result.failed())
                {
                    logger.debug("Reverse lookup failed for {}: {}", ip, result.cause().getMessage());

                    promise.tryComplete(null);

                    return;
                }

                promise.tryComplete(normalizeHostname(ip, result.result()));
            });

        return promise.future();
    }

    private static String normalizeHostname(String ip, String hostname)
    {
        if (hostname == null)
        {
            return null;
        }

        var name = hostname.trim();

        if (name.endsWith("."))
        {
            name = name.substring(0, name.length() - 1);
        }

        if (name.isEmpty() || name.equals(ip))
        {
            return null;
        }

        return name;
    }

    /**
     * System resolver lookup. BLOCKING: only called from executeBlocking.
     */
    static String reverseLookup(String ip)
    {
        try
        {
            return InetAddress.getByName(ip).getCanonicalHostName();
        }
        catch (Exception exception)
        {
            logger.debug("Reverse lookup error for {}: {}", ip, exception.getMessage());

            return null;
        }
    }
}
