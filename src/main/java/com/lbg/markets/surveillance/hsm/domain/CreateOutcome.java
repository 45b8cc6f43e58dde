package com.lbg.markets.surveillance.hsm.domain;

/**
 * What a single status-creation attempt did.
 */
public enum CreateOutcome {
    CREATED,
    EXISTS,
    LOCKED,
    UNVERIFIED,
    FAILED
}
