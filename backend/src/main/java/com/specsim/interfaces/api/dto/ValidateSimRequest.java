package com.specsim.interfaces.api.dto;

import com.specsim.infrastructure.sim.serialization.SimDocument;
import jakarta.validation.constraints.NotNull;

public record ValidateSimRequest(
        @NotNull(message = "Model is required")
        SimDocument model,

        SimDocument priorModel
) {}
