package com.lbg.markets.surveillance.hsm.store;

import com.lbg.markets.surveillance.hsm.domain.Datafile;
import com.lbg.markets.surveillance.hsm.domain.Dataset;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the record-keeping system owning datafiles, datasets and experiments.
 */
public interface DatafileCatalog {

    Optional<Datafile> findDatafile(long datafileId);

    List<Datafile> datafilesInDataset(long datasetId);

    List<Dataset> datasetsInExperiment(long experimentId);

    List<Datafile> allDatafiles();
}
