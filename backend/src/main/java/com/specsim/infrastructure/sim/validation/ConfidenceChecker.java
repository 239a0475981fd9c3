package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@Order(4)
public class ConfidenceChecker implements ModelChecker {

    @Value("${sim.validation.min-confidence:0.7}")
    private double minConfidence = 0.7;

    @Override
    public String name() {
        return "confidence";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<Message> messages = context.model().messages();
        for (int m = 0; m < messages.size(); m++) {
            List<Segment> segments = messages.get(m).segments();
            for (int s = 0; s < segments.size(); s++) {
                List<FieldRecord> fields = segments.get(s).fields();
                for (int f = 0; f < fields.size(); f++) {
                    FieldRecord field = fields.get(f);
                    if (field.confidence() < minConfidence) {
                        issues.add(ValidationIssue.warning(ValidationRule.LOW_CONFIDENCE,
                                TargetPaths.field(m, s, f),
                                String.format(Locale.ROOT, "Field '%s' extracted with confidence %.2f (< %.2f)",
                                        field.name(), field.confidence(), minConfidence),
                                "Review the source row on page " + field.sourcePage()));
                    }
                }
            }
        }
        return issues;
    }
}
