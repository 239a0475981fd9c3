package com.specsim.domain.sim.model;

/**
 * A bounded area on one page handed to the extractors.
 *
 * @param page  1-based page number
 * @param index region index within the page
 * @param x0    left
 * @param y0    top
 * @param x1    right
 * @param y1    bottom
 */
public record PageRegion(int page, int index, double x0, double y0, double x1, double y1) {

    public static PageRegion wholePage(int page) {
        return new PageRegion(page, 0, 0, 0, 1, 1);
    }

    public String describe() {
        return "page " + page + " region " + index;
    }
}
