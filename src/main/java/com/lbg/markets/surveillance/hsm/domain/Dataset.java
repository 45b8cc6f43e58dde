package com.lbg.markets.surveillance.hsm.domain;

import java.util.Set;

public record Dataset(long id, String description, Set<Long> experimentIds) {
    public Dataset {
        experimentIds = experimentIds != null ? Set.copyOf(experimentIds) : Set.of();
    }
}
