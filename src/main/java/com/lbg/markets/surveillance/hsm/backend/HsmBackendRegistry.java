package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.HsmConfig;
import com.lbg.markets.surveillance.hsm.domain.HsmInterface;
import com.lbg.markets.surveillance.hsm.error.MultipleHsmConfigException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves the checker and retriever for a storage box.
 * No config means the box has no HSM; more than one config is an error.
 */
@ApplicationScoped
public class HsmBackendRegistry {

    private final HsmConfigRegistry configs;
    private final NullHsmBackend none;
    private final Map<HsmInterface, HsmChecker> checkers = new EnumMap<>(HsmInterface.class);
    private final Map<HsmInterface, HsmRetriever> retrievers = new EnumMap<>(HsmInterface.class);

    @Inject
    public HsmBackendRegistry(HsmConfigRegistry configs, NullHsmBackend none, PoolHsmBackend filesystem) {
        this.configs = configs;
        this.none = none;
        register(HsmInterface.NONE, none, none);
        register(HsmInterface.FILESYSTEM, filesystem, filesystem);
    }

    private void register(HsmInterface type, HsmChecker checker, HsmRetriever retriever) {
        checkers.put(type, checker);
        retrievers.put(type, retriever);
    }

    public HsmChecker checkerFor(String storageBoxId) {
        return resolve(storageBoxId, HsmConfig::checker, checkers, none);
    }

    public HsmRetriever retrieverFor(String storageBoxId) {
        return resolve(storageBoxId, HsmConfig::retriever, retrievers, none);
    }

    private <T> T resolve(String storageBoxId, Function<HsmConfig, HsmInterface> select,
                          Map<HsmInterface, T> backends, T fallback) {
        List<HsmConfig> matches = configs.findByStorageBox(storageBoxId);
        if (matches.isEmpty()) {
            return fallback;
        }
        if (matches.size() > 1) {
            throw new MultipleHsmConfigException(storageBoxId, matches.size());
        }
        return backends.get(select.apply(matches.get(0)));
    }
}
