package com.lbg.markets.surveillance.hsm.store;

import com.lbg.markets.surveillance.hsm.domain.StatusRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for online status records, one per (namespace, datafile).
 */
public interface StatusStore {

    /**
     * Whether the schema namespace is registered.
     */
    boolean namespaceExists(String namespace);

    Optional<StatusRecord> find(String namespace, long datafileId);

    /**
     * Create the record unless one already exists for its namespace and datafile.
     *
     * @return true if the record was created
     */
    boolean create(StatusRecord record);

    /**
     * Update the value of an existing record.
     */
    void update(String namespace, long datafileId, boolean online);

    /**
     * All records in the namespace with the given value.
     */
    List<StatusRecord> findByValue(String namespace, boolean online);

    default boolean exists(String namespace, long datafileId) {
        return find(namespace, datafileId).isPresent();
    }
}
