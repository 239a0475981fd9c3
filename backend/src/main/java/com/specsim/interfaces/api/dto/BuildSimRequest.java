package com.specsim.interfaces.api.dto;

import com.specsim.infrastructure.sim.serialization.SimDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * One document to ingest. Each region carries the grids both extraction methods produced for it.
 */
public record BuildSimRequest(
        @NotNull(message = "Document metadata is required")
        @Valid
        DocumentRequest document,

        @NotNull(message = "Pages are required")
        @Valid
        List<PageRequest> pages,

        SimDocument priorModel
) {

    public record DocumentRequest(
            @NotBlank(message = "Standard is required")
            String standard,

            String edition,

            @PositiveOrZero(message = "Page count must not be negative")
            Integer pageCount,

            @Pattern(regexp = "(?i)bit|byte", message = "Transport unit must be 'bit' or 'byte'")
            String transportUnit,

            @Positive(message = "Container size must be positive")
            Integer containerBits
    ) {}

    public record PageRequest(
            @Positive(message = "Page numbers start at 1")
            int page,

            String heading,

            String text,

            @Valid
            List<RegionRequest> regions
    ) {}

    public record RegionRequest(
            @PositiveOrZero(message = "Region index must not be negative")
            int index,

            Double x0,
            Double y0,
            Double x1,
            Double y1,

            List<List<String>> primary,

            List<List<String>> secondary
    ) {}
}
