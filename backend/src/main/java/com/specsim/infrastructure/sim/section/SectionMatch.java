package com.specsim.infrastructure.sim.section;

import com.specsim.domain.sim.model.SectionKind;

/**
 * Result of matching one heading against a rule.
 *
 * @param rule         name of the rule that matched
 * @param kind         section kind, null for a continuation whose label could not be recovered
 * @param label        section label, null under the same condition
 * @param title        heading text after the label
 * @param continuation whether the heading marks a continuation ("continued", "(cont.)")
 */
public record SectionMatch(String rule, SectionKind kind, String label, String title, boolean continuation) {

    public static SectionMatch of(String rule, SectionKind kind, String label, String title) {
        return new SectionMatch(rule, kind, label, title == null ? "" : title.strip(), false);
    }

    public SectionMatch asContinuation() {
        return new SectionMatch(rule, kind, label, title, true);
    }

    public boolean hasLabel() {
        return label != null;
    }
}
