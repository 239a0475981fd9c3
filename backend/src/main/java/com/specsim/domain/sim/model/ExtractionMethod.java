package com.specsim.domain.sim.model;

public enum ExtractionMethod {
    PRIMARY,
    SECONDARY
}
