package com.specsim.domain.sim.model;

import java.util.List;

/**
 * Text of one page as supplied by the rendering collaborator.
 *
 * @param page    1-based page number
 * @param heading heading line(s) of the page, nullable
 * @param text    full page text, nullable
 * @param regions table regions on the page; empty means the whole page
 */
public record PageText(int page, String heading, String text, List<PageRegion> regions) {

    public PageText {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public PageText(int page, String heading) {
        this(page, heading, null, List.of());
    }

    public List<PageRegion> effectiveRegions() {
        return regions.isEmpty() ? List.of(PageRegion.wholePage(page)) : regions;
    }

    /**
     * The line used for section classification: the heading, or the first non-blank text line.
     */
    public String headingLine() {
        if (heading != null && !heading.isBlank()) {
            return heading.strip();
        }
        if (text == null) {
            return "";
        }
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse("");
    }
}
