package com.specsim.domain.sim.model;

public enum SkipReason {
    MISSING_NAME,
    UNPARSEABLE_BIT_RANGE,
    MISSING_IDENTIFIER
}
