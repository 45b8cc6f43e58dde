package com.lbg.markets.surveillance.hsm.domain;

/**
 * Logical size and allocated block count reported by a stat of one path.
 */
public record ProbeResult(long sizeBytes, long allocatedBlocks) {
    public ProbeResult {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        if (allocatedBlocks < 0) {
            throw new IllegalArgumentException("allocatedBlocks cannot be negative");
        }
    }
}
