package com.racklite.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * One execution of a subnet sweep.

 * Invariants:
 * - scannedHosts never exceeds totalHosts
 * - status only moves forward (see {@link ScanStatus#canTransitionTo})
 * - immutable once terminal

 * Progress snapshots handed to callbacks are independent copies made with
 * {@link #copy()}.
 */
public class DiscoveryScan
{

    /**
     * Depth reported by the baseline TCP engine regardless of scan type.
     */
    public static final int BASELINE_SCAN_DEPTH = 2;

    public String id;

    public String networkId;

    public ScanStatus status = ScanStatus.PENDING;

    public String scanType;

    public int scanDepth;

    public int totalHosts;

    public int scannedHosts;

    public int foundHosts;

    public Instant startedAt;

    public Instant completedAt;

    public int durationSeconds;

    public String errorMessage;

    public Instant createdAt;

    public Instant updatedAt;

    /**
     * Percentage of candidate hosts already probed.
     *
     * @return scanned / total * 100, or 0 when there are no hosts
     */
    public double progressPercent()
    {
        if (totalHosts <= 0)
        {
            return 0.0;
        }

        return (double) scannedHosts / totalHosts * 100.0;
    }

    /**
     * Moves the scan to the given status.
     *
     * @param next requested status
     * @throws IllegalStateException if the transition would move backward or leave a terminal status
     */
    public void transitionTo(ScanStatus next)
    {
        if (!status.canTransitionTo(next))
        {
            throw new IllegalStateException("Illegal scan status transition " + status + " -> " + next + " for scan " + id);
        }

        status = next;
    }

    /**
     * Creates an independent copy of this scan.
     *
     * @return snapshot sharing no mutable state with this instance
     */
    public DiscoveryScan copy()
    {
        var copy = new DiscoveryScan();

        copy.id = id;

        copy.networkId = networkId;

        copy.status = status;

        copy.scanType = scanType;

        copy.scanDepth = scanDepth;

        copy.totalHosts = totalHosts;

        copy.scannedHosts = scannedHosts;

        copy.foundHosts = foundHosts;

        copy.startedAt = startedAt;

        copy.completedAt = completedAt;

        copy.durationSeconds = durationSeconds;

        copy.errorMessage = errorMessage;

        copy.createdAt = createdAt;

        copy.updatedAt = updatedAt;

        return copy;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("network_id", networkId)
            .put("status", status.value())
            .put("scan_type", scanType)
            .put("scan_depth", scanDepth)
            .put("total_hosts", totalHosts)
            .put("scanned_hosts", scannedHosts)
            .put("found_hosts", foundHosts)
            .put("progress_percent", progressPercent())
            .put("started_at", ModelJson.instant(startedAt))
            .put("completed_at", ModelJson.instant(completedAt))
            .put("duration_seconds", durationSeconds)
            .put("error_message", errorMessage)
            .put("created_at", ModelJson.instant(createdAt))
            .put("updated_at", ModelJson.instant(updatedAt));
    }

    public static DiscoveryScan fromJson(JsonObject json)
    {
        var scan = new DiscoveryScan();

        scan.id = json.getString("id");

        scan.networkId = json.getString("network_id");

        scan.status = ScanStatus.fromValue(json.getString("status", ScanStatus.PENDING.value()));

        scan.scanType = json.getString("scan_type");

        scan.scanDepth = json.getInteger("scan_depth", 0);

        scan.totalHosts = json.getInteger("total_hosts", 0);

        scan.scannedHosts = json.getInteger("scanned_hosts", 0);

        scan.foundHosts = json.getInteger("found_hosts", 0);

        scan.startedAt = ModelJson.instant(json, "started_at");

        scan.completedAt = ModelJson.instant(json, "completed_at");

        scan.durationSeconds = json.getInteger("duration_seconds", 0);

        scan.errorMessage = json.getString("error_message");

        scan.createdAt = ModelJson.instant(json, "created_at");

        scan.updatedAt = ModelJson.instant(json, "updated_at");

        return scan;
    }
}
