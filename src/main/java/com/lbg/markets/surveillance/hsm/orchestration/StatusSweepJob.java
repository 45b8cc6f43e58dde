package com.lbg.markets.surveillance.hsm.orchestration;

import com.lbg.markets.surveillance.hsm.domain.StatusNamespaces;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Runs the reconciliation sweep over the datafile namespace on a fixed cadence.
 */
@ApplicationScoped
public class StatusSweepJob {

    @Inject
    ReconciliationSweep sweep;

    @ConfigProperty(name = "hsm.namespace.datafile", defaultValue = StatusNamespaces.DATAFILE)
    String namespace;

    @Scheduled(identity = "hsm-status-sweep",
            every = "${hsm.sweep.interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweepDatafiles() {
        sweep.runSweep(namespace);
    }
}
