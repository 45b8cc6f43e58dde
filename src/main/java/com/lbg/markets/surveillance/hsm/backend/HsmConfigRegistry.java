package com.lbg.markets.surveillance.hsm.backend;

import com.lbg.markets.surveillance.hsm.domain.HsmConfig;

import java.util.List;

/**
 * Source of per-storage-box HSM configuration.
 * Returns every config registered for the box, so that duplicates can be reported.
 */
public interface HsmConfigRegistry {

    List<HsmConfig> findByStorageBox(String storageBoxId);
}
