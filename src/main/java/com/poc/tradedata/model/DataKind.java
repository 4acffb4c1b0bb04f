package com.poc.tradedata.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Provenance of a yearly indicator value.
 */
@Getter
@RequiredArgsConstructor
public enum DataKind {
    ACTUAL("ACT"),
    ESTIMATE("EST"),
    FORECAST("FOR"),
    UNKNOWN("?"),
    MISSING("–");

    private final String token;

    public boolean carriesValue() {
        return this == ACTUAL || this == ESTIMATE;
    }
}
