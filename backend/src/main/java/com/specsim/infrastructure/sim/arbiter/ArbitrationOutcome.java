package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.PageRegion;

/**
 * Either a selected table or a coverage gap for one region.
 */
public record ArbitrationOutcome(PageRegion region, SelectedTable selection, CoverageGap gap) {

    public static ArbitrationOutcome selected(PageRegion region, SelectedTable selection) {
        return new ArbitrationOutcome(region, selection, null);
    }

    public static ArbitrationOutcome gap(PageRegion region, CoverageGap gap) {
        return new ArbitrationOutcome(region, null, gap);
    }

    public boolean isSelected() {
        return selection != null;
    }
}
