package com.specsim.domain.sim.model;

/**
 * A labeled, inclusive span of pages.
 *
 * @param kind      what the section describes
 * @param label     identifier, e.g. "J3.2", "CONNECT", "DFI-281"
 * @param title     heading text after the label, may be empty
 * @param startPage first page (inclusive)
 * @param endPage   last page (inclusive)
 */
public record Section(SectionKind kind, String label, String title, int startPage, int endPage) {

    public boolean contains(int page) {
        return page >= startPage && page <= endPage;
    }

    public boolean overlaps(Section other) {
        return startPage <= other.endPage && other.startPage <= endPage;
    }

    public Section withEndPage(int page) {
        return new Section(kind, label, title, startPage, page);
    }
}
