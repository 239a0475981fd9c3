package com.specsim.domain.sim.model;

/**
 * A region that produced no usable field data.
 */
public record CoverageGap(int page, int regionIndex, GapReason reason, String detail) {}
