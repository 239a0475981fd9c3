package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs every {@link ModelChecker} concurrently over the read-only model and merges their
 * issues in checker order. The report also carries the model's coverage and mean confidence.
 */
@Slf4j
@Component
public class ValidationEngine {

    private final List<ModelChecker> checkers;

    public ValidationEngine(List<ModelChecker> checkers) {
        this.checkers = List.copyOf(checkers);
    }

    public ValidationReport validate(SemanticModel model) {
        return validate(ValidationContext.of(model, null));
    }

    public ValidationReport validate(ValidationContext context) {
        if (context == null || context.model() == null) {
            throw new InvalidPipelineInputException("Model to validate must not be null");
        }
        if (context.model().document() == null) {
            throw new InvalidPipelineInputException("Model has no document metadata");
        }

        List<CompletableFuture<List<ValidationIssue>>> futures = checkers.stream()
                .map(checker -> CompletableFuture.supplyAsync(() -> checker.check(context)))
                .toList();

        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                issues.addAll(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Checker " + checkers.get(i).name() + " failed", cause);
            }
        }

        ValidationReport report = ValidationReport.of(issues,
                ModelMetrics.coverage(context.model()), ModelMetrics.meanConfidence(context.model()));
        log.info("Validation completed: {} issues ({} errors, {} warnings), coverage={}, confidence={}",
                issues.size(), report.errors().size(), report.warnings().size(),
                String.format(Locale.ROOT, "%.2f", report.coverage()),
                String.format(Locale.ROOT, "%.2f", report.confidence()));
        return report;
    }

    public List<String> checkerNames() {
        return checkers.stream().map(ModelChecker::name).toList();
    }
}
