package com.specsim.infrastructure.sim.extraction;

import com.specsim.domain.sim.model.ExtractionMethod;
import com.specsim.domain.sim.model.PageRegion;
import com.specsim.domain.sim.model.TableCandidate;
import com.specsim.domain.sim.service.TableExtractor;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extractor over grids that an upstream collaborator has already produced, keyed by page and region index.
 */
public class PrecomputedTableExtractor implements TableExtractor {

    private final ExtractionMethod method;
    private final Map<RegionKey, List<List<String>>> grids;

    private record RegionKey(int page, int index) {}

    private PrecomputedTableExtractor(ExtractionMethod method, Map<RegionKey, List<List<String>>> grids) {
        this.method = method;
        this.grids = Collections.unmodifiableMap(new HashMap<>(grids));
    }

    @Override
    public Optional<TableCandidate> extract(PageRegion region) {
        List<List<String>> rows = grids.get(new RegionKey(region.page(), region.index()));
        if (rows == null || rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TableCandidate(method, region, rows));
    }

    public ExtractionMethod method() {
        return method;
    }

    public int size() {
        return grids.size();
    }

    public static Builder builder(ExtractionMethod method) {
        return new Builder(method);
    }

    public static final class Builder {
        private final ExtractionMethod method;
        private final Map<RegionKey, List<List<String>>> grids = new HashMap<>();

        private Builder(ExtractionMethod method) {
            this.method = method;
        }

        public Builder grid(int page, int regionIndex, List<List<String>> rows) {
            if (rows != null) {
                grids.put(new RegionKey(page, regionIndex), rows);
            }
            return this;
        }

        public PrecomputedTableExtractor build() {
            return new PrecomputedTableExtractor(method, grids);
        }
    }
}
