package com.lbg.markets.surveillance.hsm.store;

import com.lbg.markets.surveillance.hsm.domain.Datafile;
import com.lbg.markets.surveillance.hsm.domain.Dataset;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory catalog for development/testing.
 */
@ApplicationScoped
public class InMemoryDatafileCatalog implements DatafileCatalog {

    private final Map<Long, Datafile> datafiles = new ConcurrentHashMap<>();
    private final Map<Long, Dataset> datasets = new ConcurrentHashMap<>();

    public void save(Datafile datafile) {
        datafiles.put(datafile.id(), datafile);
    }

    public void save(Dataset dataset) {
        datasets.put(dataset.id(), dataset);
    }

    public void clear() {
        datafiles.clear();
        datasets.clear();
    }

    @Override
    public Optional<Datafile> findDatafile(long datafileId) {
        return Optional.ofNullable(datafiles.get(datafileId));
    }

    @Override
    public List<Datafile> datafilesInDataset(long datasetId) {
        return datafiles.values().stream()
                .filter(datafile -> datafile.datasetId() == datasetId)
                .sorted(Comparator.comparingLong(Datafile::id))
                .toList();
    }

    @Override
    public List<Dataset> datasetsInExperiment(long experimentId) {
        return datasets.values().stream()
                .filter(dataset -> dataset.experimentIds().contains(experimentId))
                .sorted(Comparator.comparingLong(Dataset::id))
                .toList();
    }

    @Override
    public List<Datafile> allDatafiles() {
        return datafiles.values().stream()
                .sorted(Comparator.comparingLong(Datafile::id))
                .toList();
    }
}
