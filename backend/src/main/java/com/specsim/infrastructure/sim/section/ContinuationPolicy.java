package com.specsim.infrastructure.sim.section;

/**
 * Treatment of a "continued" heading whose label equals the open section's label.
 */
public enum ContinuationPolicy {
    /** Extend the open section. */
    FOLD,
    /** Start a new section with the same label. */
    NEW_SECTION
}
