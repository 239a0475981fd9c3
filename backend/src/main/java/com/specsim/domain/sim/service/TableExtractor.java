package com.specsim.domain.sim.service;

import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.TableCandidate;

import java.util.Optional;

/**
 * One independent table extraction method. Implementations must be safe to call from several threads.
 */
@FunctionalInterface
public interface TableExtractor {

    /**
     * Extract the table candidate for a region.
     *
     * @param region the page region to read
     * @return the candidate grid, or empty if this method found no table
     */
    Optional<TableCandidate> extract(PageRegion region);
}
