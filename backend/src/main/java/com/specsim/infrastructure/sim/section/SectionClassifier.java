package com.specsim.infrastructure.sim.section;

import com.specsim.domain.sim.model.PageText;
import com.specsim.domain.sim.model.Section;
import com.specsim.infrastructure.sim.CancellationToken;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import com.specsim.infrastructure.sim.normalize.TextCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Partitions the document's pages into ordered, disjoint sections.
 * <p>
 * A section opens at a page whose heading matches a rule and runs until the page before the
 * next opening heading (or the last page). Pages before the first match stay unassigned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionClassifier {

    private final SectionRuleRegistry registry;
    private final TextCleaner textCleaner;

    @Value("${sim.classifier.continuation-policy:FOLD}")
    private String continuationPolicy = ContinuationPolicy.FOLD.name();

    public List<Section> classify(List<PageText> pages, CancellationToken token) {
        if (pages == null) {
            throw new InvalidPipelineInputException("Page list must not be null");
        }
        ContinuationPolicy policy = continuationPolicy();

        List<PageText> ordered = pages.stream()
                .sorted(Comparator.comparingInt(PageText::page))
                .toList();

        List<Section> sections = new ArrayList<>();
        Section open = null;
        int previousPage = Integer.MIN_VALUE;
        int unassigned = 0;

        for (PageText page : ordered) {
            token.throwIfCancelled();
            if (page.page() == previousPage) {
                log.warn("[Classifier] duplicate page {} ignored", page.page());
                continue;
            }
            previousPage = page.page();

            Optional<SectionMatch> found = firstMatch(textCleaner.cell(page.headingLine()));
            if (found.isEmpty()) {
                if (open != null) {
                    open = open.withEndPage(page.page());
                } else {
                    unassigned++;
                }
                continue;
            }

            SectionMatch match = found.get();
            if (match.continuation()) {
                if (open != null && (!match.hasLabel()
                        || (match.label().equals(open.label()) && policy == ContinuationPolicy.FOLD))) {
                    open = open.withEndPage(page.page());
                    continue;
                }
                if (!match.hasLabel()) {
                    // continued heading with nothing to continue and no recoverable label
                    unassigned++;
                    continue;
                }
            } else if (open != null && match.label().equals(open.label()) && match.kind() == open.kind()) {
                open = open.withEndPage(page.page());
                continue;
            }

            if (open != null) {
                sections.add(open);
            }
            open = new Section(match.kind(), match.label(), match.title(), page.page(), page.page());
        }
        if (open != null) {
            sections.add(open);
        }

        log.info("[Classifier] {} pages → {} sections ({} unassigned pages)",
                ordered.size(), sections.size(), unassigned);
        return List.copyOf(sections);
    }

    public Optional<SectionMatch> firstMatch(String heading) {
        if (heading == null || heading.isBlank()) {
            return Optional.empty();
        }
        for (SectionRule rule : registry.rules()) {
            Optional<SectionMatch> match = rule.match(heading);
            if (match.isPresent()) {
                log.debug("[Classifier] '{}' matched rule {}", heading, rule.name());
                return match;
            }
        }
        return Optional.empty();
    }

    public ContinuationPolicy continuationPolicy() {
        return ContinuationPolicy.valueOf(continuationPolicy.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * The section containing {@code page}, if any.
     */
    public static Optional<Section> sectionFor(List<Section> sections, int page) {
        return sections.stream().filter(s -> s.contains(page)).findFirst();
    }
}
