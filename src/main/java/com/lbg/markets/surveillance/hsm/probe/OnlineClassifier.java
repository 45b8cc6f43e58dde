package com.lbg.markets.surveillance.hsm.probe;

import com.lbg.markets.surveillance.hsm.domain.ProbeResult;

/**
 * Decides online/offline from what a stat reports.
 * A file larger than the inline-data threshold with no allocated blocks is a
 * placeholder whose content has been migrated to tape.
 */
public final class OnlineClassifier {

    private OnlineClassifier() {
        // Utility class
    }

    public static boolean classify(long sizeBytes, long allocatedBlocks, long minFileSizeThresholdBytes) {
        return !(sizeBytes > minFileSizeThresholdBytes && allocatedBlocks == 0);
    }

    public static boolean classify(ProbeResult result, long minFileSizeThresholdBytes) {
        return classify(result.sizeBytes(), result.allocatedBlocks(), minFileSizeThresholdBytes);
    }
}
