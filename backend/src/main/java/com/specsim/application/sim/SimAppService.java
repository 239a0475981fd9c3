package com.specsim.application.sim;

import com.specsim.application.sim.exception.DocumentTooLargeException;
import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.ExtractionMethod;
import com.specsim.domain.sim.model.IngestionRequest;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.PageText;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.TransportUnit;
import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import com.specsim.infrastructure.sim.extraction.PrecomputedTableExtractor;
import com.specsim.infrastructure.sim.pipeline.SimPipeline;
import com.specsim.infrastructure.sim.serialization.SimDocument;
import com.specsim.infrastructure.sim.serialization.SimDocumentMapper;
import com.specsim.infrastructure.sim.serialization.SimFormat;
import com.specsim.infrastructure.sim.serialization.SimSerializer;
import com.specsim.infrastructure.sim.validation.ValidationContext;
import com.specsim.infrastructure.sim.validation.ValidationEngine;
import com.specsim.interfaces.api.dto.BuildSimRequest;
import com.specsim.interfaces.api.dto.BuildSimRequest.DocumentRequest;
import com.specsim.interfaces.api.dto.BuildSimRequest.PageRequest;
import com.specsim.interfaces.api.dto.BuildSimRequest.RegionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimAppService {

    private final SimPipeline simPipeline;
    private final ValidationEngine validationEngine;
    private final SimSerializer simSerializer;
    private final SimDocumentMapper documentMapper;

    @Value("${sim.api.max-pages:2000}")
    private int maxPages = 2000;

    /**
     * Full run over pre-extracted grids (arbitrate → classify → normalize → build → validate).
     */
    public PipelineResult build(BuildSimRequest request) {
        IngestionRequest ingestion = toIngestion(request);
        SemanticModel prior = request.priorModel() == null ? null : documentMapper.toModel(request.priorModel());
        return simPipeline.build(ingestion, prior);
    }

    /**
     * Build, then serialize only the model.
     */
    public String export(BuildSimRequest request, SimFormat format) {
        PipelineResult result = build(request);
        if (result.report().hasErrors()) {
            log.warn("[SimAppService] exporting {} with {} validation errors",
                    result.model().document().standard(), result.report().errors().size());
        }
        return simSerializer.write(result.model(), format);
    }

    /**
     * Re-validate a model that was built (or edited) elsewhere.
     */
    public ValidationReport validate(SimDocument model, SimDocument priorModel) {
        SemanticModel current = documentMapper.toModel(model);
        SemanticModel prior = priorModel == null ? null : documentMapper.toModel(priorModel);
        return validationEngine.validate(ValidationContext.of(current, prior));
    }

    /**
     * Parse a serialized SIM and validate it.
     */
    public ValidationReport validate(String content, SimFormat format) {
        return validationEngine.validate(simSerializer.read(content, format));
    }

    public SimDocument toDocument(SemanticModel model) {
        return documentMapper.toDocument(model);
    }

    // ===== Request mapping =====

    private IngestionRequest toIngestion(BuildSimRequest request) {
        if (request == null || request.document() == null || request.pages() == null) {
            throw new InvalidPipelineInputException("Document metadata and pages are required");
        }
        if (request.pages().size() > maxPages) {
            throw new DocumentTooLargeException(
                    String.format("At most %d pages can be ingested per request, got %d", maxPages, request.pages().size()));
        }

        PrecomputedTableExtractor.Builder primary = PrecomputedTableExtractor.builder(ExtractionMethod.PRIMARY);
        PrecomputedTableExtractor.Builder secondary = PrecomputedTableExtractor.builder(ExtractionMethod.SECONDARY);
        List<PageText> pages = new ArrayList<>(request.pages().size());
        int lastPage = 0;
        for (PageRequest page : request.pages()) {
            if (page == null) {
                throw new InvalidPipelineInputException("Page list must not contain null pages");
            }
            List<PageRegion> regions = new ArrayList<>();
            if (page.regions() != null) {
                for (RegionRequest region : page.regions()) {
                    if (region == null) {
                        throw new InvalidPipelineInputException("Page " + page.page() + " has a null region");
                    }
                    regions.add(toRegion(page.page(), region));
                    primary.grid(page.page(), region.index(), requireRows(page.page(), region.primary()));
                    secondary.grid(page.page(), region.index(), requireRows(page.page(), region.secondary()));
                }
            }
            pages.add(new PageText(page.page(), page.heading(), page.text(), regions));
            lastPage = Math.max(lastPage, page.page());
        }

        DocumentRequest meta = request.document();
        Document document = new Document(
                meta.standard(),
                meta.edition(),
                meta.pageCount() == null ? lastPage : meta.pageCount(),
                toTransportUnit(meta.transportUnit()),
                meta.containerBits());
        log.debug("[SimAppService] ingest {} {}: {} pages", document.standard(), document.edition(), pages.size());
        return new IngestionRequest(document, pages, primary.build(), secondary.build());
    }

    private static PageRegion toRegion(int page, RegionRequest region) {
        return new PageRegion(page, region.index(),
                orDefault(region.x0(), 0), orDefault(region.y0(), 0),
                orDefault(region.x1(), 1), orDefault(region.y1(), 1));
    }

    private static List<List<String>> requireRows(int page, List<List<String>> rows) {
        if (rows != null && rows.stream().anyMatch(row -> row == null)) {
            throw new InvalidPipelineInputException("Grid on page " + page + " contains a null row");
        }
        return rows;
    }

    private static TransportUnit toTransportUnit(String value) {
        try {
            return TransportUnit.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidPipelineInputException("Unknown transport unit: " + value, e);
        }
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
