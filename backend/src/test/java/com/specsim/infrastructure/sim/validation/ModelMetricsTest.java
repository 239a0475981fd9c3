package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.SemanticModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.specsim.infrastructure.sim.validation.ValidationFixtures.DOCUMENT;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.field;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.message;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.model;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.segment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelMetricsTest {

    @Test
    @DisplayName("coverage counts covered positions against declared segment lengths")
    void coverage_ratio() {
        SemanticModel model = model(
                message("J3.2", segment(16, field("Altitude", 0, 7))),
                message("J3.5", segment(16, field("Speed", 0, 15))));

        assertThat(ModelMetrics.coverage(model)).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("overlapping and out-of-bounds bits are not double counted")
    void coverage_overlap_and_overflow() {
        SemanticModel model = model(message("J3.2", segment(10,
                field("Track Number", 0, 7), field("Quality", 5, 9), field("Spare", 8, 30))));

        assertThat(ModelMetrics.coverage(model)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("confidence is the mean over every field")
    void mean_confidence() {
        SemanticModel model = model(message("J3.2", segment(16,
                field("Altitude", 0, 7),
                field("Course", 8, 15).toBuilder().confidence(0.5).build())));

        assertThat(ModelMetrics.meanConfidence(model)).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("an empty model scores zero on both")
    void empty_model() {
        SemanticModel empty = SemanticModel.empty(DOCUMENT);

        assertThat(ModelMetrics.coverage(empty)).isZero();
        assertThat(ModelMetrics.meanConfidence(empty)).isZero();
    }
}
