package com.specsim.infrastructure.sim.section;

import com.specsim.domain.sim.model.SectionKind;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex rule: group 1 feeds the label function, the optional named group {@code title} the title.
 */
public class PatternSectionRule implements SectionRule {

    private final String name;
    private final Pattern pattern;
    private final SectionKind kind;
    private final Function<String, String> labelOf;

    public PatternSectionRule(String name, Pattern pattern, SectionKind kind, Function<String, String> labelOf) {
        this.name = name;
        this.pattern = pattern;
        this.kind = kind;
        this.labelOf = labelOf;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<SectionMatch> match(String heading) {
        Matcher m = pattern.matcher(heading);
        if (!m.find()) {
            return Optional.empty();
        }
        String title = pattern.pattern().contains("?<title>") ? m.group("title") : "";
        return Optional.of(SectionMatch.of(name, kind, labelOf.apply(m.group(1)), title));
    }
}
