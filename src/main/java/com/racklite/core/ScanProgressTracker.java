package com.racklite.core;

import com.racklite.models.DiscoveryScan;

import com.racklite.models.ScanStatus;

import java.time.Duration;

import java.time.Instant;

import java.util.concurrent.locks.ReentrantLock;

/**
 * ScanProgressTracker - Owns the mutable scan record while a sweep runs

 * All counter updates, status changes and the "notify now?" decision happen
 * under one lock. Callers receive an independent snapshot taken under the
 * lock and invoke progress callbacks after the lock is released.
 */
public class ScanProgressTracker
{

    /**
     * Default number of completed hosts between progress notifications.
     */
    public static final int DEFAULT_NOTIFY_INTERVAL = 50;

    private final ReentrantLock lock = new ReentrantLock();

    private final DiscoveryScan scan;

    private final int notifyInterval;

    /**
     * Creates a tracker around a scan record it will own exclusively.
     *
     * @param scan Scan record (must not be shared with other code afterwards)
     * @param notifyInterval Completed hosts between notifications (values below 1 become 1)
     */
    public ScanProgressTracker(DiscoveryScan scan, int notifyInterval)
    {
        this.scan = scan;

        this.notifyInterval = Math.max(1, notifyInterval);
    }

    /**
     * Moves the scan to RUNNING.
     *
     * @param now Start time
     * @return Snapshot after the change
     */
    public DiscoveryScan start(Instant now)
    {
        lock.lock();

        try
        {
            scan.transitionTo(ScanStatus.RUNNING);

            scan.startedAt = now;

            scan.updatedAt = now;

            return scan.copy();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Records the candidate host count once the subnet has been enumerated.
     *
     * @param totalHosts Candidate host count after exclusions
     */
    public void setTotalHosts(int totalHosts)
    {
        lock.lock();

        try
        {
            scan.totalHosts = totalHosts;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Records one probed host.
     *
     * @param online Whether the host answered on any port
     * @param now Completion time
     * @return Snapshot to publish, or null when this completion is not a notification point
     */
    public DiscoveryScan hostCompleted(boolean online, Instant now)
    {
        lock.lock();

        try
        {
            if (scan.status.isTerminal())
            {
                return null;
            }

            scan.scannedHosts = Math.min(scan.scannedHosts + 1, scan.totalHosts);

            if (online)
            {
                scan.foundHosts++;
            }

            scan.updatedAt = now;

            var notify = scan.scannedHosts % notifyInterval == 0 || scan.scannedHosts == scan.totalHosts;

            return notify ? scan.copy() : null;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Marks the scan completed.
     *
     * @param now Completion time
     * @return Terminal snapshot
     */
    public DiscoveryScan complete(Instant now)
    {
        return finish(ScanStatus.COMPLETED, null, now);
    }

    /**
     * Marks the scan failed.
     *
     * @param errorMessage Failure description
     * @param now Completion time
     * @return Terminal snapshot
     */
    public DiscoveryScan fail(String errorMessage, Instant now)
    {
        return finish(ScanStatus.FAILED, errorMessage, now);
    }

    /**
     * Independent copy of the current state.
     *
     * @return snapshot
     */
    public DiscoveryScan snapshot()
    {
        lock.lock();

        try
        {
            return scan.copy();
        }
        finally
        {
            lock.unlock();
        }
    }

    private DiscoveryScan finish(ScanStatus status, String errorMessage, Instant now)
    {
        lock.lock();

        try
        {
            scan.transitionTo(status);

            scan.errorMessage = errorMessage;

            scan.completedAt = now;

            scan.updatedAt = now;

            var startedAt = scan.startedAt != null ? scan.startedAt : now;

            scan.durationSeconds = (int) Math.max(0, Duration.between(startedAt, now).getSeconds());

            return scan.copy();
        }
        finally
        {
            lock.unlock();
        }
    }
}
