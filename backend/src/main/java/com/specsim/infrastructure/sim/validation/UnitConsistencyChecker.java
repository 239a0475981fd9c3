package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.EnumDefinition;
import com.specsim.domain.sim.model.FieldEncoding;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Field references into the unit and enum tables, and unit agreement between same-named
 * fields of one message.
 */
@Component
@Order(3)
public class UnitConsistencyChecker implements ModelChecker {

    @Override
    public String name() {
        return "unit-consistency";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        SemanticModel model = context.model();
        List<ValidationIssue> issues = new ArrayList<>();
        List<Message> messages = model.messages();

        for (int m = 0; m < messages.size(); m++) {
            Message message = messages.get(m);
            Map<String, String> unitByName = new HashMap<>();

            for (int s = 0; s < message.segments().size(); s++) {
                Segment segment = message.segments().get(s);
                for (int f = 0; f < segment.fields().size(); f++) {
                    FieldRecord field = segment.fields().get(f);
                    String path = TargetPaths.field(m, s, f);

                    if (field.hasUnit() && model.findUnit(field.unit()).isEmpty()) {
                        issues.add(ValidationIssue.warning(ValidationRule.UNIT_UNRESOLVED, path,
                                String.format("Unit '%s' of field '%s' is not a known unit", field.unit(), field.name()),
                                "Map the unit token to a canonical unit or correct the source"));
                    }

                    if (field.encoding() == FieldEncoding.ENUM) {
                        checkEnum(model, field, path, issues);
                    }

                    if (field.hasUnit()) {
                        String key = field.name().toLowerCase(Locale.ROOT);
                        String previous = unitByName.putIfAbsent(key, field.unit());
                        if (previous != null && !previous.equals(field.unit())) {
                            issues.add(ValidationIssue.warning(ValidationRule.UNIT_INCONSISTENT, path,
                                    String.format("Field '%s' uses unit '%s' but an earlier '%s' in %s uses '%s'",
                                            field.name(), field.unit(), field.name(), message.label(), previous),
                                    "Use one unit for the field throughout the message"));
                        }
                    }
                }
            }
        }
        return issues;
    }

    private static void checkEnum(SemanticModel model, FieldRecord field, String path, List<ValidationIssue> issues) {
        if (field.enumKey() == null) {
            issues.add(ValidationIssue.warning(ValidationRule.ENUM_INCOMPLETE, path,
                    String.format("Enum field '%s' references no enum definition", field.name()),
                    "List the coded values in the field description"));
            return;
        }
        Optional<EnumDefinition> definition = model.findEnum(field.enumKey());
        if (definition.isEmpty() || definition.get().isEmpty()) {
            issues.add(ValidationIssue.warning(ValidationRule.ENUM_INCOMPLETE, path,
                    String.format("Enum '%s' of field '%s' is missing or has no values",
                            field.enumKey(), field.name()),
                    "Add the enum definition with at least one value"));
        }
    }
}
