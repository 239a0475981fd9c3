package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.ExtractionMethod;

/**
 * How to choose between two candidates whose scores are equal.
 */
public enum TieBreakPolicy {
    /** More non-empty cells wins; PRIMARY if still equal. */
    DENSITY,
    /** PRIMARY always wins. */
    PRIMARY;

    /**
     * @return positive when the first candidate wins, negative when the second does
     */
    int compare(ExtractionMethod firstMethod, CandidateScore first, ExtractionMethod secondMethod, CandidateScore second) {
        if (this == DENSITY && first.density() != second.density()) {
            return Integer.compare(first.density(), second.density());
        }
        if (firstMethod == secondMethod) {
            return 0;
        }
        return firstMethod == ExtractionMethod.PRIMARY ? 1 : -1;
    }
}
