package com.lbg.markets.surveillance.hsm.orchestration;

import com.lbg.markets.surveillance.hsm.backend.HsmBackendRegistry;
import com.lbg.markets.surveillance.hsm.backend.HsmRetriever;
import com.lbg.markets.surveillance.hsm.domain.CreateOutcome;
import com.lbg.markets.surveillance.hsm.domain.Datafile;
import com.lbg.markets.surveillance.hsm.domain.Dataset;
import com.lbg.markets.surveillance.hsm.domain.StatusNamespaces;
import com.lbg.markets.surveillance.hsm.domain.StatusRecord;
import com.lbg.markets.surveillance.hsm.domain.StorageObject;
import com.lbg.markets.surveillance.hsm.error.HsmException;
import com.lbg.markets.surveillance.hsm.error.MissingStorageObjectException;
import com.lbg.markets.surveillance.hsm.error.NamespaceNotFoundException;
import com.lbg.markets.surveillance.hsm.error.StatusNotFoundException;
import com.lbg.markets.surveillance.hsm.error.StorageClassNotSupportedException;
import com.lbg.markets.surveillance.hsm.error.UnverifiedException;
import com.lbg.markets.surveillance.hsm.lock.AdvisoryLock;
import com.lbg.markets.surveillance.hsm.lock.DatafileLocks;
import com.lbg.markets.surveillance.hsm.store.DatafileCatalog;
import com.lbg.markets.surveillance.hsm.store.StatusStore;
import com.lbg.markets.surveillance.hsm.util.Outcome;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Entry point for checking, recording and recalling the HSM status of datafiles.
 * Binds the HSM backends to the catalog and the status store.
 */
@ApplicationScoped
public class StatusService {

    private static final Logger LOG = Logger.getLogger(StatusService.class);

    private final DatafileCatalog catalog;
    private final StatusStore store;
    private final HsmBackendRegistry backends;
    private final DatafileLocks locks;
    private final Set<String> supportedStorageClasses;
    private final long minFileSize;
    private final String datafileNamespace;

    @Inject
    public StatusService(
            DatafileCatalog catalog,
            StatusStore store,
            HsmBackendRegistry backends,
            DatafileLocks locks,
            @ConfigProperty(name = "hsm.storage-classes", defaultValue = "local-filesystem,filesystem")
            List<String> supportedStorageClasses,
            @ConfigProperty(name = "hsm.min-file-size", defaultValue = "350") long minFileSize,
            @ConfigProperty(name = "hsm.namespace.datafile", defaultValue = StatusNamespaces.DATAFILE)
            String datafileNamespace
    ) {
        this.catalog = catalog;
        this.store = store;
        this.backends = backends;
        this.locks = locks;
        this.supportedStorageClasses = Set.copyOf(supportedStorageClasses);
        this.minFileSize = minFileSize;
        this.datafileNamespace = datafileNamespace;
    }

    /**
     * Check whether the preferred replica of a datafile is online, using the
     * configured minimum file size.
     *
     * @throws UnverifiedException if the datafile is not verified
     * @throws MissingStorageObjectException if it has no preferred replica
     * @throws StorageClassNotSupportedException if the replica's storage class is not supported
     */
    public void checkOnline(Datafile datafile, Consumer<Outcome<Boolean>> callback) {
        checkOnline(datafile, minFileSize, callback);
    }

    public void checkOnline(Datafile datafile, long minFileSize, Consumer<Outcome<Boolean>> callback) {
        StorageObject object = checkableObject(datafile);
        backends.checkerFor(object.storageBoxId()).online(object, minFileSize, callback);
    }

    /**
     * Blocking variant of {@link #checkOnline}, for callers already off the request path.
     */
    public Outcome<Boolean> awaitOnline(Datafile datafile, long minFileSize) {
        CompletableFuture<Outcome<Boolean>> result = new CompletableFuture<>();
        checkOnline(datafile, minFileSize, result::complete);
        return result.join();
    }

    /**
     * Record the online status of a newly verified datafile, unless it already has one.
     * Safe to call repeatedly and from several workers at once.
     */
    public CreateOutcome createStatus(Datafile datafile, String namespace) {
        return createStatus(datafile, namespace, minFileSize);
    }

    public CreateOutcome createStatus(Datafile datafile, String namespace, long minFileSize) {
        if (!datafile.verified()) {
            LOG.warnf("Cannot determine online status for datafile %d, it is not verified", datafile.id());
            return CreateOutcome.UNVERIFIED;
        }
        if (!store.namespaceExists(namespace)) {
            throw new NamespaceNotFoundException(namespace);
        }
        if (store.exists(namespace, datafile.id())) {
            LOG.debugf("Status already exists for datafile %d", datafile.id());
            return CreateOutcome.EXISTS;
        }

        String ownerId = "datafile-" + datafile.id() + "-" + UUID.randomUUID();
        try (AdvisoryLock lock = locks.lock(datafile.id(), ownerId)) {
            if (!lock.isAcquired()) {
                return CreateOutcome.LOCKED;
            }
            // another worker may have finished between the first check and the lock
            if (store.exists(namespace, datafile.id())) {
                LOG.debugf("Status already exists for datafile %d", datafile.id());
                return CreateOutcome.EXISTS;
            }

            Outcome<Boolean> online;
            try {
                online = awaitOnline(datafile, minFileSize);
            } catch (HsmException e) {
                LOG.warnf("Cannot check online status of datafile %d: %s", datafile.id(), e.getMessage());
                return CreateOutcome.FAILED;
            }

            if (online.isFailure()) {
                LOG.errorf(online.error().orElseThrow(),
                        "Online check failed for datafile %d", datafile.id());
                return CreateOutcome.FAILED;
            }

            boolean value = online.result().orElseThrow();
            if (!store.create(StatusRecord.of(namespace, datafile.id(), value))) {
                return CreateOutcome.EXISTS;
            }
            LOG.infof("Recorded datafile %d as %s", datafile.id(), value ? "online" : "offline");
            return CreateOutcome.CREATED;
        }
    }

    /**
     * Create status records for every verified datafile in the catalog that has none.
     *
     * @return number of records created
     */
    public int backfill(String namespace) {
        int created = 0;
        for (Datafile datafile : catalog.allDatafiles()) {
            if (datafile.verified() && createStatus(datafile, namespace) == CreateOutcome.CREATED) {
                created++;
            }
        }
        LOG.infof("Backfilled %d status records in %s", created, namespace);
        return created;
    }

    /**
     * The recorded status of a datafile. Unlike {@link #checkOnline} this does not touch the filesystem.
     *
     * @throws StatusNotFoundException if no status has been recorded
     */
    public boolean isDatafileOnline(long datafileId) {
        return store.find(datafileNamespace, datafileId)
                .map(StatusRecord::online)
                .orElseThrow(() -> new StatusNotFoundException(datafileNamespace, datafileId));
    }

    /**
     * A dataset is online when every datafile in it is recorded online.
     */
    public boolean isDatasetOnline(long datasetId) {
        return catalog.datafilesInDataset(datasetId).stream()
                .allMatch(datafile -> isDatafileOnline(datafile.id()));
    }

    /**
     * An experiment is online when every one of its datasets is online.
     */
    public boolean isExperimentOnline(long experimentId) {
        return catalog.datasetsInExperiment(experimentId).stream()
                .map(Dataset::id)
                .allMatch(this::isDatasetOnline);
    }

    /**
     * Ask the HSM backing the datafile's preferred replica to recall it.
     */
    public void retrieve(Datafile datafile, Consumer<Outcome<StorageObject>> callback) {
        StorageObject object = checkableObject(datafile);
        backends.retrieverFor(object.storageBoxId()).retrieve(object, callback);
    }

    /**
     * Recall several datafiles. The callback receives one outcome per datafile, in
     * input order; datafiles that cannot be recalled appear as failures.
     */
    public void retrieveBatch(List<Datafile> datafiles, Consumer<List<Outcome<StorageObject>>> callback) {
        List<CompletableFuture<Outcome<StorageObject>>> slots = new ArrayList<>(datafiles.size());
        Map<HsmRetriever, List<Integer>> groups = new IdentityHashMap<>();
        Map<HsmRetriever, List<StorageObject>> groupObjects = new IdentityHashMap<>();

        for (int i = 0; i < datafiles.size(); i++) {
            try {
                StorageObject object = checkableObject(datafiles.get(i));
                HsmRetriever retriever = backends.retrieverFor(object.storageBoxId());
                groups.computeIfAbsent(retriever, r -> new ArrayList<>()).add(i);
                groupObjects.computeIfAbsent(retriever, r -> new ArrayList<>()).add(object);
                slots.add(new CompletableFuture<>());
            } catch (HsmException e) {
                slots.add(CompletableFuture.completedFuture(Outcome.failure(e)));
            }
        }

        groups.forEach((retriever, indexes) ->
                retriever.retrieveBatch(groupObjects.get(retriever), outcomes -> {
                    for (int j = 0; j < indexes.size(); j++) {
                        slots.get(indexes.get(j)).complete(outcomes.get(j));
                    }
                }));

        CompletableFuture.allOf(slots.toArray(new CompletableFuture[0]))
                .thenRun(() -> callback.accept(slots.stream().map(CompletableFuture::join).toList()));
    }

    /**
     * The preferred replica of a datafile, provided it can be probed on a filesystem.
     */
    StorageObject checkableObject(Datafile datafile) {
        if (!datafile.verified()) {
            throw UnverifiedException.datafile(datafile.id());
        }
        StorageObject object = datafile.preferred()
                .orElseThrow(() -> new MissingStorageObjectException(datafile.id()));
        if (!supportedStorageClasses.contains(object.storageClass())) {
            throw new StorageClassNotSupportedException(object.storageClass(), supportedStorageClasses);
        }
        return object;
    }

    public long minFileSize() {
        return minFileSize;
    }
}
