package com.lbg.markets.surveillance.hsm.domain;

import java.util.Map;

/**
 * Summary of one reconciliation sweep over the datafiles recorded online.
 */
public record SweepReport(
        String namespace,
        int candidates,
        int unchanged,
        int flippedOffline,
        Map<Long, String> skipped
) {
    public SweepReport {
        skipped = skipped != null ? Map.copyOf(skipped) : Map.of();
    }

    public int skippedCount() {
        return skipped.size();
    }
}
