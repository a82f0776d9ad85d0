package com.racklite.core;

import com.racklite.models.DiscoveredDevice;

import java.time.Instant;

import java.util.UUID;

/**
 * Merge rules applied when a probe result meets the stored record for the same IP.

 * Both store implementations run these inside their own atomic section, so the
 * rules hold regardless of which scan writes last:
 * - first observation: new record, firstSeen = now
 * - later observations: firstSeen, id and promotion fields preserved,
 *   confidence never decreases, blank mac/hostname never erase known values,
 *   everything else is taken from the newest probe
 */
public final class DiscoveryReconciler
{

    private DiscoveryReconciler()
    {
    }

    /**
     * Builds the record to store for a probe result.
     *
     * @param existing Stored record for the draft's IP, or null on first observation
     * @param draft Fresh probe result
     * @param now Observation time
     * @return New record state; neither argument is modified
     */
    public static DiscoveredDevice merge(DiscoveredDevice existing, DiscoveredDevice draft, Instant now)
    {
        if (existing == null)
        {
            return newRecord(draft, now);
        }

        var merged = existing.copy();

        merged.confidence = Math.max(existing.confidence, draft.confidence);

        if (!isBlank(draft.macAddress))
        {
            merged.macAddress = draft.macAddress;
        }

        if (!isBlank(draft.hostname))
        {
            merged.hostname = draft.hostname;
        }

        if (!isBlank(draft.networkId))
        {
            merged.networkId = draft.networkId;
        }

        merged.status = draft.status;

        // The stored record never shares lists or ServiceInfo entries with the draft
        var observed = draft.copy();

        merged.openPorts = observed.openPorts;

        merged.services = observed.services;

        merged.osGuess = draft.osGuess;

        merged.osFamily = draft.osFamily;

        merged.lastSeen = draft.lastSeen != null ? draft.lastSeen : now;

        merged.lastScanId = draft.lastScanId;

        if (draft.rawScanData != null)
        {
            merged.rawScanData = draft.rawScanData;
        }

        merged.updatedAt = now;

        return merged;
    }

    private static DiscoveredDevice newRecord(DiscoveredDevice draft, Instant now)
    {
        var record = draft.copy();

        if (isBlank(record.id))
        {
            record.id = UUID.randomUUID().toString();
        }

        record.firstSeen = now;

        if (record.lastSeen == null)
        {
            record.lastSeen = now;
        }

        // Promotion is recorded only by the promotion workflow
        record.promotedToDeviceId = null;

        record.promotedAt = null;

        record.createdAt = now;

        record.updatedAt = now;

        return record;
    }

    private static boolean isBlank(String value)
    {
        return value == null || value.isBlank();
    }
}
