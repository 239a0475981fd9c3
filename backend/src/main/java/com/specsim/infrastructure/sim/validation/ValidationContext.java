package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.SkippedRow;
import com.specsim.domain.sim.model.UnattributedFields;

import java.util.List;

/**
 * Read-only input shared by all checkers.
 *
 * @param model         the model under validation
 * @param priorModel    previous edition for diffing, nullable
 * @param coverageGaps  regions that produced no table
 * @param skippedRows   rows the normalizer could not use
 * @param emptySections message sections that produced no fields
 * @param unattributed  appendix/other sections whose fields are in no message
 */
public record ValidationContext(
        SemanticModel model,
        SemanticModel priorModel,
        List<CoverageGap> coverageGaps,
        List<SkippedRow> skippedRows,
        List<Section> emptySections,
        List<UnattributedFields> unattributed
) {
    public ValidationContext {
        coverageGaps = coverageGaps == null ? List.of() : List.copyOf(coverageGaps);
        skippedRows = skippedRows == null ? List.of() : List.copyOf(skippedRows);
        emptySections = emptySections == null ? List.of() : List.copyOf(emptySections);
        unattributed = unattributed == null ? List.of() : List.copyOf(unattributed);
    }

    /**
     * Context for validating a standalone model (no pipeline artefacts).
     */
    public static ValidationContext of(SemanticModel model, SemanticModel priorModel) {
        return new ValidationContext(model, priorModel, List.of(), List.of(), List.of(), List.of());
    }
}
