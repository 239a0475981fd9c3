package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.EnumValue;
import com.specsim.domain.sim.model.FieldEncoding;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.UnitDefinition;
import com.specsim.domain.sim.model.ValidationIssue;
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

class UnitConsistencyCheckerTest {

    private static final UnitDefinition FOOT = new UnitDefinition("foot", "metre", 0.3048, 0, "Length in feet");
    private static final UnitDefinition METRE = new UnitDefinition("metre", "metre", 1, 0, "Length in metres");

    private UnitConsistencyChecker checker;

    @BeforeEach
    void setUp() {
        checker = new UnitConsistencyChecker();
    }

    private static FieldRecord withUnit(String name, int start, int end, String unit) {
        return field(name, start, end).toBuilder().unit(unit).unitResolved(true).build();
    }

    private List<ValidationIssue> check(List<EnumDefinition> enums, FieldRecord... fields) {
        return checker.check(ValidationContext.of(model(
                List.of(message("J3.2", segment(64, fields))), List.of(), enums, List.of(FOOT, METRE)), null));
    }

    @Test
    @DisplayName("known units pass")
    void known_units() {
        assertThat(check(List.of(), withUnit("Altitude", 0, 15, "foot"))).isEmpty();
    }

    @Test
    @DisplayName("a unit missing from the model's unit table is flagged")
    void unresolved_unit() {
        FieldRecord field = field("Range", 0, 9).toBuilder().unit("furlongs").unitResolved(false).build();
        assertThat(check(List.of(), field)).singleElement().satisfies(i -> {
            assertThat(i.rule()).isEqualTo(ValidationRule.UNIT_UNRESOLVED);
            assertThat(i.message()).contains("furlongs");
        });
    }

    @Test
    @DisplayName("same field name with two units in one message is inconsistent")
    void inconsistent_units() {
        assertThat(check(List.of(),
                withUnit("Altitude", 0, 15, "foot"),
                withUnit("altitude", 16, 31, "metre")))
                .singleElement()
                .satisfies(i -> assertThat(i.rule()).isEqualTo(ValidationRule.UNIT_INCONSISTENT));
    }

    @Test
    @DisplayName("enum fields need a non-empty definition")
    void enum_references() {
        FieldRecord good = field("Identity", 0, 2).toBuilder()
                .encoding(FieldEncoding.ENUM).enumKey("J3.2.Identity").build();
        FieldRecord missing = field("Mode", 3, 5).toBuilder()
                .encoding(FieldEncoding.ENUM).enumKey("J3.2.Mode").build();
        FieldRecord unkeyed = field("Status", 6, 7).toBuilder().encoding(FieldEncoding.ENUM).build();
        EnumDefinition identity = new EnumDefinition("J3.2.Identity",
                List.of(new EnumValue("0", "Pending"), new EnumValue("1", "Unknown")));

        List<ValidationIssue> issues = check(List.of(identity), good, missing, unkeyed);

        assertThat(issues).extracting(ValidationIssue::rule)
                .containsExactly(ValidationRule.ENUM_INCOMPLETE, ValidationRule.ENUM_INCOMPLETE);
        assertThat(issues).extracting(ValidationIssue::targetPath).containsExactly(
                "messages[0].segments[0].fields[1]", "messages[0].segments[0].fields[2]");
    }
}
