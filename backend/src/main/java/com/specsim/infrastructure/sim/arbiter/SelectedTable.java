package com.specsim.infrastructure.sim.arbiter;

import com.specsim.domain.sim.model.TableCandidate;

/**
 * The winning candidate for a region together with its score.
 *
 * @param candidate  the selected grid
 * @param score      its score
 * @param rivalScore score of the losing candidate, null when it was scored alone
 */
public record SelectedTable(TableCandidate candidate, CandidateScore score, CandidateScore rivalScore) {

    public int page() {
        return candidate.region().page();
    }
}
