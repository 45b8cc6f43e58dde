package com.lbg.markets.surveillance.hsm.orchestration;

import com.lbg.markets.surveillance.hsm.domain.CreateOutcome;
import com.lbg.markets.surveillance.hsm.domain.DatafileVerified;
import com.lbg.markets.surveillance.hsm.domain.StatusNamespaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Records initial online status when the catalog reports a newly verified datafile.
 */
@ApplicationScoped
public class DatafileVerifiedObserver {

    private static final Logger LOG = Logger.getLogger(DatafileVerifiedObserver.class);

    @Inject
    StatusService statusService;

    @ConfigProperty(name = "hsm.namespace.datafile", defaultValue = StatusNamespaces.DATAFILE)
    String namespace;

    void onVerified(@ObservesAsync DatafileVerified event) {
        CreateOutcome outcome = statusService.createStatus(event.datafile(), namespace);
        LOG.debugf("Status creation for datafile %d: %s", event.datafile().id(), outcome);
    }
}
