package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.TestFixtures;
import com.lbg.markets.surveillance.hsm.TestFixtures.FakeStatProbe;
import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.error.ProbeException;
import com.lbg.markets.surveillance.hsm.error.UnverifiedException;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PoolHsmBackendTest {

    private final FakeStatProbe probe = new FakeStatProbe();
    private PoolHsmBackend backend;
    private Path dir;

    @BeforeEach
    void setup() throws IOException {
        backend = new PoolHsmBackend(probe, 2, 350);
        dir = Files.createTempDirectory("test-pool-");
    }

    @AfterEach
    void cleanup() throws IOException {
        backend.close();
        try (var stream = Files.list(dir)) {
            for (Path p : stream.toList()) {
                Files.deleteIfExists(p);
            }
        }
        Files.deleteIfExists(dir);
    }

    @Test
    void fileWithBlocksIsOnline() throws Exception {
        Path path = dir.resolve("resident.h5");
        probe.put(path, 1_048_575, 100);

        assertTrue(online(object(path)).getOrThrow());
    }

    @Test
    void largeFileWithoutBlocksIsOffline() throws Exception {
        Path path = dir.resolve("on-tape.h5");
        probe.put(path, 10_000, 0);

        assertFalse(online(object(path)).getOrThrow());
    }

    @Test
    void smallFileWithoutBlocksIsOnline() throws Exception {
        Path path = dir.resolve("inline.txt");
        probe.put(path, 20, 0);

        assertTrue(online(object(path)).getOrThrow());
    }

    @Test
    void explicitThresholdOverridesDefault() throws Exception {
        Path path = dir.resolve("medium.txt");
        probe.put(path, 400, 0);

        CompletableFuture<Outcome<Boolean>> result = new CompletableFuture<>();
        backend.online(object(path), 500, result::complete);

        assertTrue(result.get(5, TimeUnit.SECONDS).getOrThrow());
    }

    @Test
    void unverifiedObjectIsRejectedBeforeDispatch() {
        StorageObject object = new StorageObject(TestFixtures.TAPE_BOX, TestFixtures.FS_CLASS,
                dir.resolve("x"), false);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(UnverifiedException.class, () -> backend.online(object, outcome -> calls.incrementAndGet()));
        assertEquals(0, calls.get());
    }

    @Test
    void probeFailureIsDeliveredToCallback() throws Exception {
        Outcome<Boolean> outcome = online(object(dir.resolve("unknown")));

        assertTrue(outcome.isFailure());
        assertInstanceOf(ProbeException.class, outcome.error().orElseThrow());
    }

    @Test
    void callbackRunsOnResultThreadExactlyOnce() throws Exception {
        Path path = dir.resolve("a.h5");
        probe.put(path, 10_000, 8);
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> thread = new CompletableFuture<>();

        backend.online(object(path), outcome -> {
            calls.incrementAndGet();
            thread.complete(Thread.currentThread().getName());
        });

        assertTrue(thread.get(5, TimeUnit.SECONDS).startsWith("hsm-result-"));
        assertEquals(1, calls.get());
    }

    @Test
    void failingCallbackDoesNotStopLaterDeliveries() throws Exception {
        Path path = dir.resolve("b.h5");
        probe.put(path, 10_000, 8);

        backend.online(object(path), outcome -> {
            throw new IllegalStateException("callback bug");
        });

        assertTrue(online(object(path)).getOrThrow());
    }

    @Test
    void retrieveReadsFirstByte() throws Exception {
        Path path = Files.writeString(dir.resolve("recall.dat"), "payload");
        CompletableFuture<Outcome<StorageObject>> result = new CompletableFuture<>();

        backend.retrieve(object(path), result::complete);

        assertEquals(path, result.get(5, TimeUnit.SECONDS).getOrThrow().location());
    }

    @Test
    void retrieveOfMissingFileWrapsIoError() throws Exception {
        CompletableFuture<Outcome<StorageObject>> result = new CompletableFuture<>();

        backend.retrieve(object(dir.resolve("gone.dat")), result::complete);

        assertInstanceOf(IOException.class, result.get(5, TimeUnit.SECONDS).error().orElseThrow());
    }

    @Test
    void retrieveBatchReportsEveryEntryInOrder() throws Exception {
        Path present = Files.writeString(dir.resolve("one.dat"), "1");
        StorageObject missing = object(dir.resolve("two.dat"));
        StorageObject unverified = new StorageObject(TestFixtures.TAPE_BOX, TestFixtures.FS_CLASS, present, false);
        CompletableFuture<List<Outcome<StorageObject>>> result = new CompletableFuture<>();

        backend.retrieveBatch(List.of(object(present), missing, unverified), result::complete);

        List<Outcome<StorageObject>> outcomes = result.get(5, TimeUnit.SECONDS);
        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertInstanceOf(IOException.class, outcomes.get(1).error().orElseThrow());
        assertInstanceOf(UnverifiedException.class, outcomes.get(2).error().orElseThrow());
    }

    private Outcome<Boolean> online(StorageObject object) throws Exception {
        CompletableFuture<Outcome<Boolean>> result = new CompletableFuture<>();
        backend.online(object, result::complete);
        return result.get(5, TimeUnit.SECONDS);
    }

    private static StorageObject object(Path path) {
        return TestFixtures.object(TestFixtures.TAPE_BOX, path);
    }
}
