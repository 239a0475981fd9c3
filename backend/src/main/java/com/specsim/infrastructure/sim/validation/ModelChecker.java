package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.ValidationIssue;

import java.util.List;

/**
 * One independent validation pass. Implementations read the model only and never throw for
 * data problems.
 */
public interface ModelChecker {

    String name();

    List<ValidationIssue> check(ValidationContext context);
}
