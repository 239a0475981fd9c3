package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.UnattributedFields;

import java.util.List;

/**
 * The assembled model plus what the builder could not place.
 *
 * @param model         the semantic model
 * @param emptySections message sections that yielded no fields
 * @param unattributed  appendix/other sections whose fields are not part of any message
 */
public record BuildOutcome(SemanticModel model, List<Section> emptySections, List<UnattributedFields> unattributed) {

    public BuildOutcome {
        emptySections = List.copyOf(emptySections);
        unattributed = List.copyOf(unattributed);
    }

    public int unattributedFieldCount() {
        return unattributed.stream().mapToInt(UnattributedFields::fieldCount).sum();
    }
}
