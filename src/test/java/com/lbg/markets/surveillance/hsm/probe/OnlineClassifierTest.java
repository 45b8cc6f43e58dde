package com.lbg.markets.surveillance.hsm.probe;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class OnlineClassifierTest {

    private static final long THRESHOLD = 350;

    @Test
    void residentFileWithBlocksIsOnline() {
        assertTrue(OnlineClassifier.classify(1_048_575, 100, THRESHOLD));
    }

    @Test
    void largeFileWithoutBlocksIsOffline() {
        assertFalse(OnlineClassifier.classify(10_000, 0, THRESHOLD));
    }

    @Test
    void smallInlineFileWithoutBlocksIsOnline() {
        assertTrue(OnlineClassifier.classify(20, 0, THRESHOLD));
        assertTrue(OnlineClassifier.classify(0, 0, THRESHOLD));
    }

    @Test
    void sizeEqualToThresholdIsOnline() {
        assertTrue(OnlineClassifier.classify(THRESHOLD, 0, THRESHOLD));
        assertFalse(OnlineClassifier.classify(THRESHOLD + 1, 0, THRESHOLD));
    }

    @Test
    void offlineIffLargerThanThresholdAndNoBlocks() {
        Random random = new Random(42);
        for (int i = 0; i < 10_000; i++) {
            long threshold = random.nextInt(1024);
            long size;
            if (i % 4 == 0) {
                size = threshold;
            } else if (i % 4 == 1) {
                size = threshold + 1;
            } else {
                size = random.nextInt(4096);
            }
            long blocks = random.nextBoolean() ? 0 : 1 + random.nextInt(64);

            boolean expected = !(size > threshold && blocks == 0);
            assertEquals(expected, OnlineClassifier.classify(size, blocks, threshold),
                    () -> "size=" + size + " blocks=" + blocks + " threshold=" + threshold);
        }
    }
}
