package com.specsim.domain.sim.model;

public enum GapReason {
    NO_CANDIDATE,
    BELOW_THRESHOLD,
    TIMEOUT,
    NO_SECTION
}
