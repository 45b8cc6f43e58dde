package com.lbg.markets.surveillance.hsm.domain;

/**
 * The HSM backends a storage box can be configured with.
 */
public enum HsmInterface {
    /** No HSM behind the storage box; everything is online. */
    NONE,
    /** Filesystem-based detection from size and allocated blocks. */
    FILESYSTEM
}
