package com.specsim.domain.sim.model;

public record EnumValue(String code, String label) {}
