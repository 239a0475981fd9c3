package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationIssue.Severity;
import com.specsim.domain.sim.model.ValidationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.specsim.infrastructure.sim.validation.ValidationFixtures.field;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.message;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.model;
import static com.specsim.infrastructure.sim.validation.ValidationFixtures.segment;
import static org.assertj.core.api.Assertions.assertThat;

class VersionDiffCheckerTest {

    private VersionDiffChecker checker;

    @BeforeEach
    void setUp() {
        checker = new VersionDiffChecker();
    }

    @Test
    @DisplayName("no prior model, no diff")
    void no_prior() {
        assertThat(checker.check(ValidationContext.of(model(), null))).isEmpty();
    }

    @Test
    @DisplayName("added and removed messages and fields are informational")
    void diff() {
        var prior = model(
                message("J3.2", segment(32, field("Altitude", 0, 15), field("Quality", 16, 19))),
                message("J3.3", segment(16, field("Course", 0, 15))));
        var current = model(
                message("J3.2", segment(32, field("Altitude", 0, 15), field("Speed", 16, 25))),
                message("J3.5", segment(16, field("Course", 0, 15))));

        List<ValidationIssue> issues = checker.check(ValidationContext.of(current, prior));

        assertThat(issues).allMatch(i -> i.severity() == Severity.INFO && i.rule() == ValidationRule.VERSION_DIFF);
        assertThat(issues).extracting(ValidationIssue::message).containsExactly(
                "Field 'Speed' added to J3.2 since edition E",
                "Field 'Quality' removed from J3.2 since edition E",
                "Message J3.5 added since edition E",
                "Message J3.3 removed since edition E");
    }
}
