package com.specsim.domain.sim.model;

/**
 * Fields normalized from an appendix or other non-message section. They belong to no message
 * and are reported rather than placed in the model.
 */
public record UnattributedFields(Section section, int fieldCount) {}
