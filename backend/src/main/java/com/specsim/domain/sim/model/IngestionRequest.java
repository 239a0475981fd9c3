package com.specsim.domain.sim.model;

import com.specsim.domain.sim.service.TableExtractor;

import java.util.List;

/**
 * Everything the pipeline needs for one document: metadata, page texts and the two extractors.
 */
public record IngestionRequest(
        Document document,
        List<PageText> pages,
        TableExtractor primaryExtractor,
        TableExtractor secondaryExtractor
) {}
