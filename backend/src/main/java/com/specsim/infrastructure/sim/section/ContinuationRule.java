package com.specsim.infrastructure.sim.section;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizes repeated headings of a section split across pages ("J3.2 Air Track (continued)").
 * The label is recovered by running the labeling rules on the heading with the marker removed.
 */
public class ContinuationRule implements SectionRule {

    private static final Pattern CONTINUED = Pattern.compile(
            "\\(\\s*cont(?:inued|'d|\\.|d)?\\s*\\)|\\bcontinued\\b|\\bcont'd\\b",
            Pattern.CASE_INSENSITIVE
    );

    private final List<SectionRule> labelingRules;

    public ContinuationRule(List<SectionRule> labelingRules) {
        this.labelingRules = List.copyOf(labelingRules);
    }

    @Override
    public String name() {
        return "continuation";
    }

    @Override
    public Optional<SectionMatch> match(String heading) {
        if (!CONTINUED.matcher(heading).find()) {
            return Optional.empty();
        }
        String stripped = CONTINUED.matcher(heading).replaceAll(" ")
                .replaceAll("[\\s,;:-]+$", "")
                .strip();
        for (SectionRule rule : labelingRules) {
            Optional<SectionMatch> match = rule.match(stripped);
            if (match.isPresent()) {
                return Optional.of(match.get().asContinuation());
            }
        }
        return Optional.of(new SectionMatch(name(), null, null, stripped, true));
    }
}
