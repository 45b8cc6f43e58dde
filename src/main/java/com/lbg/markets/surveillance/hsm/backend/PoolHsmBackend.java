package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.probe.OnlineClassifier;
import com.lbg.markets.surveillance.hsm.probe.StatProbe;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Filesystem HSM backend running stat checks and recall reads on a bounded worker pool.
 * <p>
 * Results are delivered on one dedicated thread, separate from the workers, so a
 * slow callback holds up other deliveries but never a probe. Exceptions from the work
 * are captured in the {@link Outcome}, so a failing probe never kills a worker.
 * <p>
 * One instance per container; each instance owns its threads, so do not construct
 * it per request. {@link #close()} stops both pools.
 */
@ApplicationScoped
public class PoolHsmBackend implements HsmChecker, HsmRetriever, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PoolHsmBackend.class);

    private final StatProbe probe;
    private final long defaultMinFileSize;
    private final ExecutorService workers;
    private final ExecutorService results;

    @Inject
    public PoolHsmBackend(
            StatProbe probe,
            @ConfigProperty(name = "hsm.pool.size", defaultValue = "0") int poolSize,
            @ConfigProperty(name = "hsm.min-file-size", defaultValue = "350") long defaultMinFileSize
    ) {
        this.probe = probe;
        this.defaultMinFileSize = defaultMinFileSize;
        int threads = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        this.workers = Executors.newFixedThreadPool(threads, namedThreads("hsm-worker-"));
        this.results = Executors.newSingleThreadExecutor(namedThreads("hsm-result-"));
        LOG.infof("HSM worker pool started with %d threads", threads);
    }

    @Override
    public void online(StorageObject object, Consumer<Outcome<Boolean>> callback) {
        online(object, defaultMinFileSize, callback);
    }

    @Override
    public void online(StorageObject object, long minFileSize, Consumer<Outcome<Boolean>> callback) {
        NullHsmBackend.requireVerified(object);
        dispatch(() -> OnlineClassifier.classify(probe.probe(object.location()).getOrThrow(), minFileSize))
                .thenAcceptAsync(outcome -> deliver(callback, outcome), results);
    }

    @Override
    public void retrieve(StorageObject object, Consumer<Outcome<StorageObject>> callback) {
        NullHsmBackend.requireVerified(object);
        dispatch(() -> readFirstByte(object))
                .thenAcceptAsync(outcome -> deliver(callback, outcome), results);
    }

    @Override
    public void retrieveBatch(List<StorageObject> objects, Consumer<List<Outcome<StorageObject>>> callback) {
        List<CompletableFuture<Outcome<StorageObject>>> pending = new ArrayList<>(objects.size());
        for (StorageObject object : objects) {
            pending.add(object.verified()
                    ? dispatch(() -> readFirstByte(object))
                    : CompletableFuture.completedFuture(Outcome.failure(NullHsmBackend.unverified(object))));
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenRunAsync(() -> {
                    List<Outcome<StorageObject>> outcomes = new ArrayList<>(pending.size());
                    for (CompletableFuture<Outcome<StorageObject>> future : pending) {
                        outcomes.add(future.join());
                    }
                    deliver(callback, outcomes);
                }, results);
    }

    /**
     * Run {@code work} on the pool. The returned future always completes normally.
     */
    private <T> CompletableFuture<Outcome<T>> dispatch(Callable<T> work) {
        return CompletableFuture.supplyAsync(() -> Outcome.attempt(work), workers)
                .handle((outcome, error) -> error == null ? outcome : Outcome.<T>failure(asException(error)));
    }

    private <T> void deliver(Consumer<T> callback, T outcome) {
        try {
            callback.accept(outcome);
        } catch (RuntimeException e) {
            LOG.errorf(e, "HSM result callback failed for outcome %s", outcome);
        }
    }

    private static StorageObject readFirstByte(StorageObject object) throws IOException {
        try (InputStream in = Files.newInputStream(object.location())) {
            in.read();
        }
        LOG.debugf("Read first byte of %s", object.location());
        return object;
    }

    private static Exception asException(Throwable error) {
        return error instanceof Exception e ? e : new RuntimeException(error);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    @Override
    public void close() {
        workers.shutdown();
        results.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            if (!results.awaitTermination(10, TimeUnit.SECONDS)) {
                results.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            results.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("HSM worker pool stopped");
    }
}
