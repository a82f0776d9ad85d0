package com.racklite.core;

import com.racklite.models.DiscoveredDevice;

/**
 * Maps observed evidence to a 0-100 confidence score.

 * Scoring:
 * - 30 base for any probed address
 * - +20 when reverse DNS resolved a hostname
 * - +30 when at least one port accepted a connection
 * - +10 more when more than two ports accepted

 * Pure and deterministic: no I/O, no shared state.
 */
public final class ConfidenceScorer
{

    public static final int BASE_SCORE = 30;

    public static final int HOSTNAME_BONUS = 20;

    public static final int OPEN_PORT_BONUS = 30;

    public static final int MULTI_PORT_BONUS = 10;

    private ConfidenceScorer()
    {
    }

    /**
     * Scores a probe draft.
     *
     * @param draft probed host evidence
     * @return confidence clamped to [0, 100]
     */
    public static int score(DiscoveredDevice draft)
    {
        var score = BASE_SCORE;

        if (draft.hasHostname())
        {
            score += HOSTNAME_BONUS;
        }

        var openPortCount = draft.openPorts != null ? draft.openPorts.size() : 0;

        if (openPortCount > 0)
        {
            score += OPEN_PORT_BONUS;

            if (openPortCount > 2)
            {
                score += MULTI_PORT_BONUS;
            }
        }

        return Math.max(0, Math.min(100, score));
    }
}
