package com.specsim.domain.sim.service;

import com.specsim.domain.sim.model.IngestionRequest;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.SemanticModel;

/**
 * Domain entry point: turns one ingested document into a semantic model plus its validation report.
 */
public interface SimBuildService {

    /**
     * Build and validate the model for a document.
     *
     * @param request document metadata, page texts and the two extractors
     * @return the model, report, coverage gaps and skipped rows
     */
    PipelineResult build(IngestionRequest request);

    /**
     * Build and validate, additionally diffing against a prior edition.
     *
     * @param request    document metadata, page texts and the two extractors
     * @param priorModel model of the previous edition, nullable
     * @return the model, report (including version diffs), coverage gaps and skipped rows
     */
    PipelineResult build(IngestionRequest request, SemanticModel priorModel);
}
