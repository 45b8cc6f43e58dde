package com.lbg.markets.surveillance.hsm.store;

import com.lbg.markets.surveillance.hsm.domain.StatusNamespaces;
import com.lbg.markets.surveillance.hsm.domain.StatusRecord;
import com.lbg.markets.surveillance.hsm.error.NamespaceNotFoundException;
import com.lbg.markets.surveillance.hsm.error.StatusNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory status store for development/testing.
 * Not persistent - state is lost on restart.
 */
@ApplicationScoped
public class InMemoryStatusStore implements StatusStore {

    private static final Logger LOG = Logger.getLogger(InMemoryStatusStore.class);

    private final Set<String> namespaces = ConcurrentHashMap.newKeySet();
    private final Map<String, StatusRecord> records = new ConcurrentHashMap<>();

    public InMemoryStatusStore() {
        namespaces.add(StatusNamespaces.DATAFILE);
        namespaces.add(StatusNamespaces.DATASET);
    }

    @Override
    public boolean namespaceExists(String namespace) {
        return namespaces.contains(namespace);
    }

    @Override
    public Optional<StatusRecord> find(String namespace, long datafileId) {
        return Optional.ofNullable(records.get(buildKey(namespace, datafileId)));
    }

    @Override
    public boolean create(StatusRecord record) {
        requireNamespace(record.namespace());
        boolean created = records.putIfAbsent(buildKey(record.namespace(), record.datafileId()), record) == null;
        if (created) {
            LOG.debugf("Created status %s for datafile %d", record.value(), record.datafileId());
        }
        return created;
    }

    @Override
    public void update(String namespace, long datafileId, boolean online) {
        StatusRecord updated = records.computeIfPresent(buildKey(namespace, datafileId),
                (key, existing) -> existing.withValue(online));
        if (updated == null) {
            throw new StatusNotFoundException(namespace, datafileId);
        }
        LOG.debugf("Updated datafile %d status to %s", datafileId, updated.value());
    }

    @Override
    public List<StatusRecord> findByValue(String namespace, boolean online) {
        return records.values().stream()
                .filter(record -> record.namespace().equals(namespace))
                .filter(record -> record.online() == online)
                .toList();
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }

    private void requireNamespace(String namespace) {
        if (!namespaceExists(namespace)) {
            throw new NamespaceNotFoundException(namespace);
        }
    }

    private String buildKey(String namespace, long datafileId) {
        return namespace + "|" + datafileId;
    }
}
