package com.lbg.markets.surveillance.hsm.orchestration;

import com.lbg.markets.surveillance.hsm.domain.Datafile;
import com.lbg.markets.surveillance.hsm.domain.StatusRecord;
import com.lbg.markets.surveillance.hsm.domain.SweepReport;
import com.lbg.markets.surveillance.hsm.error.HsmException;
import com.lbg.markets.surveillance.hsm.error.NamespaceNotFoundException;
import com.lbg.markets.surveillance.hsm.error.UnverifiedException;
import com.lbg.markets.surveillance.hsm.lock.AdvisoryLock;
import com.lbg.markets.surveillance.hsm.lock.DatafileLocks;
import com.lbg.markets.surveillance.hsm.store.DatafileCatalog;
import com.lbg.markets.surveillance.hsm.store.StatusStore;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Re-checks every datafile recorded online and marks the ones that have gone to tape.
 * <p>
 * Only moves records from online to offline; records already offline are never
 * selected. A datafile that cannot be checked is logged and skipped without
 * stopping the sweep. The only fatal error is an unknown namespace.
 */
@ApplicationScoped
public class ReconciliationSweep {

    private static final Logger LOG = Logger.getLogger(ReconciliationSweep.class);

    private final StatusStore store;
    private final DatafileCatalog catalog;
    private final StatusService statusService;
    private final DatafileLocks locks;

    @Inject
    public ReconciliationSweep(StatusStore store, DatafileCatalog catalog,
                               StatusService statusService, DatafileLocks locks) {
        this.store = store;
        this.catalog = catalog;
        this.statusService = statusService;
        this.locks = locks;
    }

    public SweepReport runSweep(String namespace) {
        return runSweep(namespace, statusService.minFileSize());
    }

    /**
     * Sweep all online records in {@code namespace}.
     *
     * @throws NamespaceNotFoundException if the namespace is not registered
     */
    public SweepReport runSweep(String namespace, long minFileSize) {
        if (!store.namespaceExists(namespace)) {
            throw new NamespaceNotFoundException(namespace);
        }

        List<StatusRecord> candidates = store.findByValue(namespace, true);
        LOG.infof("Starting HSM status sweep of %d online datafiles in %s", candidates.size(), namespace);

        String ownerId = "sweep-" + UUID.randomUUID();
        Map<Long, String> skipped = new LinkedHashMap<>();
        Map<Long, CompletableFuture<Outcome<Boolean>>> pending = new LinkedHashMap<>();
        List<AdvisoryLock> held = new ArrayList<>();
        int unchanged = 0;
        int flipped = 0;

        try {
            for (StatusRecord candidate : candidates) {
                long id = candidate.datafileId();
                Datafile datafile = catalog.findDatafile(id).orElse(null);
                if (datafile == null) {
                    skip(skipped, id, "datafile not found in catalog");
                    continue;
                }

                AdvisoryLock lock = locks.lock(id, ownerId);
                if (!lock.isAcquired()) {
                    skip(skipped, id, "locked by another worker");
                    continue;
                }
                held.add(lock);

                try {
                    CompletableFuture<Outcome<Boolean>> result = new CompletableFuture<>();
                    statusService.checkOnline(datafile, minFileSize, result::complete);
                    pending.put(id, result);
                } catch (UnverifiedException e) {
                    skip(skipped, id, "not verified");
                } catch (HsmException e) {
                    skip(skipped, id, e.getMessage());
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unexpected failure checking datafile %d", id);
                    skipped.put(id, String.valueOf(e.getMessage()));
                }
            }

            for (Map.Entry<Long, CompletableFuture<Outcome<Boolean>>> entry : pending.entrySet()) {
                long id = entry.getKey();
                Outcome<Boolean> outcome = entry.getValue().join();
                if (outcome.isFailure()) {
                    skip(skipped, id, "check failed: " + outcome.error().map(Exception::getMessage).orElse(""));
                } else if (outcome.result().orElse(true)) {
                    unchanged++;
                } else {
                    try {
                        store.update(namespace, id, false);
                        flipped++;
                        LOG.infof("Datafile %d is now offline", id);
                    } catch (HsmException e) {
                        skip(skipped, id, "update failed: " + e.getMessage());
                    }
                }
            }
        } finally {
            held.forEach(AdvisoryLock::release);
        }

        SweepReport report = new SweepReport(namespace, candidates.size(), unchanged, flipped, skipped);
        LOG.infof("HSM status sweep of %s finished: %d candidates, %d unchanged, %d now offline, %d skipped",
                namespace, report.candidates(), report.unchanged(), report.flippedOffline(), report.skippedCount());
        return report;
    }

    private void skip(Map<Long, String> skipped, long datafileId, String reason) {
        LOG.warnf("Skipping datafile %d: %s", datafileId, reason);
        skipped.put(datafileId, reason);
    }
}
