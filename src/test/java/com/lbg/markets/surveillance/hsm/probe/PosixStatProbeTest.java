package com.lbg.markets.surveillance.hsm.probe;

import com.lbg.markets.surveillance.hsm.TestFixtures;
import com.lbg.markets.surveillance.hsm.domain.ProbeResult;
import com.lbg.markets.surveillance.hsm.error.ProbeException;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PosixStatProbeTest {

    private Path dir;

    @BeforeEach
    void setup() throws IOException {
        dir = Files.createTempDirectory("test-probe-");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var stream = Files.list(dir)) {
            for (Path p : stream.toList()) {
                Files.deleteIfExists(p);
            }
        }
        Files.deleteIfExists(dir);
    }

    @Test
    void parsesGnuStatOutput() {
        List<String> lines = List.of(
                "  File: /data/run-0001.h5",
                "  Size: 1048576   \tBlocks: 8          IO Block: 4096   regular file",
                "Device: 803h/2051d\tInode: 1234567     Links: 1");

        Optional<ProbeResult> result = PosixStatProbe.parseStatOutput(lines);

        assertEquals(Optional.of(new ProbeResult(1_048_576, 8)), result);
    }

    @Test
    void firstMatchingLineWins() {
        List<String> lines = List.of(
                "Size: 10 Blocks: 0",
                "Size: 99 Blocks: 99");

        assertEquals(new ProbeResult(10, 0), PosixStatProbe.parseStatOutput(lines).orElseThrow());
    }

    @Test
    void noMatchWhenFieldsMissing() {
        List<String> lines = List.of(
                "stat: cannot statx '/nope': No such file or directory",
                "  Size: 12");

        assertTrue(PosixStatProbe.parseStatOutput(lines).isEmpty());
    }

    @Test
    void probesRealFile() throws Exception {
        Path file = TestFixtures.sparseFile(dir, "sparse.bin", 1_048_576);

        Outcome<ProbeResult> outcome = new PosixStatProbe().probe(file);

        ProbeResult result = outcome.getOrThrow();
        assertEquals(1_048_576, result.sizeBytes());
        assertTrue(OnlineClassifier.classify(result, 350), "Sparse file with a written block is online");
    }

    @Test
    void missingFileIsProbeFailure() {
        Outcome<ProbeResult> outcome = new PosixStatProbe().probe(dir.resolve("missing.bin"));

        assertTrue(outcome.isFailure());
        assertInstanceOf(ProbeException.class, outcome.error().orElseThrow());
    }

    @Test
    void unavailableStatCommandIsProbeFailure() throws IOException {
        Path file = Files.writeString(dir.resolve("small.txt"), "content");
        PosixStatProbe probe = new PosixStatProbe(null, "no-such-stat-binary-for-tests");

        Outcome<ProbeResult> outcome = probe.probe(file);

        assertFalse(probe.usesNativeStat());
        ProbeException error = assertInstanceOf(ProbeException.class, outcome.error().orElseThrow());
        assertEquals(file, error.path());
    }
}
