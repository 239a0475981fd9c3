package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.List;

import static com.specsim.infrastructure.sim.validation.ValidationFixtures.field;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.message;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.model;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.segment;
import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceCheckerTest {

    private ConfidenceChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ConfidenceChecker();
    }

    private void setField(String name, double value) throws Exception {
        Field field = ConfidenceChecker.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(checker, value);
    }

    private List<ValidationIssue> check(double confidence) {
        return checker.check(ValidationContext.of(model(message("J3.2", segment(16,
                field("Altitude", 0, 15).toBuilder().confidence(confidence).build()))), null));
    }

    @Test
    @DisplayName("confidence below the threshold is a warning")
    void low_confidence() {
        assertThat(check(0.64)).singleElement().satisfies(i -> {
            assertThat(i.rule()).isEqualTo(ValidationRule.LOW_CONFIDENCE);
            assertThat(i.message()).contains("0.64");
        });
    }

    @Test
    @DisplayName("confidence at the threshold passes")
    void at_threshold() {
        assertThat(check(0.7)).isEmpty();
    }

    @Test
    @DisplayName("threshold is configurable")
    void configurable() throws Exception {
        setField("minConfidence", 0.95);
        assertThat(check(0.9)).hasSize(1);
    }
}
