package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.CoverageGap;
import com.specsim.domain.sim.model.Section;
import com.specsim.domain.sim.model.SkippedRow;
import com.specsim.domain.sim.model.UnattributedFields;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns pipeline coverage artefacts into warnings: gaps, skipped rows, empty message sections and
 * fields that landed outside any message.
 */
@Component
@Order(5)
public class CoverageChecker implements ModelChecker {

    @Override
    public String name() {
        return "coverage";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();

        List<CoverageGap> gaps = context.coverageGaps();
        for (int i = 0; i < gaps.size(); i++) {
            CoverageGap gap = gaps.get(i);
            issues.add(ValidationIssue.warning(ValidationRule.COVERAGE_GAP, TargetPaths.coverage(i),
                    String.format("No fields extracted for page %d region %d: %s (%s)",
                            gap.page(), gap.regionIndex(), gap.reason(), gap.detail()),
                    "Review the page manually or re-run extraction"));
        }

        List<SkippedRow> skipped = context.skippedRows();
        for (int i = 0; i < skipped.size(); i++) {
            SkippedRow row = skipped.get(i);
            issues.add(ValidationIssue.warning(ValidationRule.ROW_SKIPPED, TargetPaths.skippedRow(i),
                    String.format("Page %d row %d skipped: %s (%s)",
                            row.page(), row.rowIndex(), row.reason(), row.detail()),
                    "Correct the row in the source table"));
        }

        for (Section section : context.emptySections()) {
            issues.add(ValidationIssue.warning(ValidationRule.SECTION_EMPTY, TargetPaths.section(section.label()),
                    String.format("Message section %s (pages %d-%d) produced no fields",
                            section.label(), section.startPage(), section.endPage()),
                    "Check the section's tables"));
        }

        for (UnattributedFields stray : context.unattributed()) {
            Section section = stray.section();
            issues.add(ValidationIssue.warning(ValidationRule.FIELDS_UNATTRIBUTED, TargetPaths.section(section.label()),
                    String.format("%d field(s) in %s section %s (pages %d-%d) belong to no message",
                            stray.fieldCount(), section.kind().name().toLowerCase(Locale.ROOT), section.label(),
                            section.startPage(), section.endPage()),
                    "Check whether the section heading was misclassified"));
        }

        if (context.model().isEmpty()) {
            issues.add(ValidationIssue.warning(ValidationRule.EMPTY_MODEL, TargetPaths.messages(),
                    "The model contains no fields and no dictionary entries", null));
        }
        return issues;
    }
}
