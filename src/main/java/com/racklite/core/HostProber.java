package com.racklite.core;

import com.racklite.models.DiscoveredDevice;

import io.vertx.core.Future;

import java.time.Duration;

/**
 * Determines liveness and evidence for a single address.

 * Implementations hold no per-scan state and never touch the store; the
 * returned draft is persisted (or not) by the caller. Probe failures are
 * evidence, not errors: the Future should only fail on programming errors.
 */
public interface HostProber
{

    /**
     * Probes one host.
     *
     * @param ip IPv4 address to probe
     * @param timeout Deadline for each individual dial and for the reverse lookup
     * @param cancellation Signal consulted before each new port check
     * @return Future with an unsaved draft (status, open ports, hostname, lastSeen)
     */
    Future<DiscoveredDevice> probeHost(String ip, Duration timeout, ScanCancellation cancellation);

}
