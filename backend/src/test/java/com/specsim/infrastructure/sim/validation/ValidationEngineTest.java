package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.domain.sim.model.ValidationRule;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.specsim.infrastructure.sim.validation.ValidationFixtures.DOCUMENT;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.field;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.message;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.model;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.segment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationEngineTest {

    @Mock
    private ModelChecker first;

    @Mock
    private ModelChecker second;

    private static final ValidationIssue WARNING = ValidationIssue.warning(
            ValidationRule.LOW_CONFIDENCE, "messages[0]", "low", null);
    private static final ValidationIssue ERROR = ValidationIssue.error(
            ValidationRule.BIT_RANGE_OVERLAP, "messages[0]", "overlap", null);

    @Nested
    @DisplayName("merging")
    class Merging {

        @Test
        @DisplayName("issues are merged in checker order")
        void checker_order() {
            when(first.check(any())).thenReturn(List.of(WARNING));
            when(second.check(any())).thenReturn(List.of(ERROR));

            ValidationReport report = new ValidationEngine(List.of(first, second)).validate(model());

            assertThat(report.issues()).containsExactly(WARNING, ERROR);
            assertThat(report.passed()).isFalse();
        }

        @Test
        @DisplayName("a report without errors passes")
        void passes_without_errors() {
            when(first.check(any())).thenReturn(List.of(WARNING));
            when(second.check(any())).thenReturn(List.of());

            ValidationReport report = new ValidationEngine(List.of(first, second)).validate(model());

            assertThat(report.passed()).isTrue();
            assertThat(report.warnings()).containsExactly(WARNING);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a null model is rejected")
        void null_model() {
            ValidationEngine engine = new ValidationEngine(List.of());
            assertThatThrownBy(() -> engine.validate((SemanticModel) null))
                    .isInstanceOf(InvalidPipelineInputException.class);
        }

        @Test
        @DisplayName("a model without document metadata is rejected")
        void missing_document() {
            ValidationEngine engine = new ValidationEngine(List.of());
            SemanticModel model = new SemanticModel(null, List.of(), List.of(), List.of(), List.of());
            assertThatThrownBy(() -> engine.validate(model))
                    .isInstanceOf(InvalidPipelineInputException.class);
        }

        @Test
        @DisplayName("a checker crash propagates unchanged")
        void checker_crash() {
            when(first.check(any())).thenThrow(new IllegalStateException("boom"));

            ValidationEngine engine = new ValidationEngine(List.of(first));

            assertThatThrownBy(() -> engine.validate(model()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");
        }
    }

    @Test
    @DisplayName("the real checkers agree on a clean model")
    void real_checkers_clean_model() {
        ValidationEngine engine = new ValidationEngine(List.of(
                new StructuralChecker(), new DictionaryTreeChecker(), new UnitConsistencyChecker(),
                new ConfidenceChecker(), new CoverageChecker(), new VersionDiffChecker()));

        ValidationReport report = engine.validate(
                model(message("J3.2", segment(16, field("Altitude", 0, 9), field("Quality", 10, 15)))));

        assertThat(report.issues()).isEmpty();
        assertThat(report.coverage()).isEqualTo(1.0);
        assertThat(report.confidence()).isEqualTo(1.0);
        assertThat(engine.checkerNames()).hasSize(6);
    }

    @Test
    @DisplayName("validation does not modify the model")
    void model_untouched() {
        SemanticModel model = model(message("J3.2", segment(8, field("A", 0, 7))));
        SemanticModel copy = new SemanticModel(DOCUMENT, model.messages(), model.dictionary(),
                model.enums(), model.units());

        new ValidationEngine(List.of(new StructuralChecker(), new CoverageChecker())).validate(model);

        assertThat(model).isEqualTo(copy);
    }
}
