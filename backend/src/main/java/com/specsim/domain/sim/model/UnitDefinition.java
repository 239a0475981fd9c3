package com.specsim.domain.sim.model;

/**
 * Canonical unit with its conversion to the SI base: {@code si = value * factor + offset}.
 */
public record UnitDefinition(String symbol, String baseSi, double factor, double offset, String description) {}
