package com.lbg.markets.surveillance.hsm.domain;

/**
 * HSM configuration for a single storage box.
 */
public record HsmConfig(
        String storageBoxId,
        HsmInterface checker,
        HsmInterface retriever
) {
    public HsmConfig {
        if (storageBoxId == null || storageBoxId.isBlank()) {
            throw new IllegalArgumentException("storageBoxId cannot be blank");
        }
        checker = checker != null ? checker : HsmInterface.NONE;
        retriever = retriever != null ? retriever : HsmInterface.NONE;
    }
}
