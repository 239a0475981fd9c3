package com.specsim.infrastructure.sim.model;

import com.specsim.domain.sim.model.Document;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.TransportUnit;
import com.specsim.infrastructure.sim.normalize.SegmentMarkers;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Groups a message's fields into segments.
 * <p>
 * A new segment starts whenever a field carries a marker different from the open segment's.
 * A field without a marker stays in the open segment. Field order is preserved.
 */
@Component
public class SegmentAssembler {

    public List<Segment> assemble(List<FieldRecord> fields, Document document) {
        List<Segment> segments = new ArrayList<>();
        List<FieldRecord> current = new ArrayList<>();
        String currentMarker = null;

        for (FieldRecord field : fields) {
            String marker = field.segmentMarker();
            if (!current.isEmpty() && marker != null && !Objects.equals(marker, currentMarker)) {
                segments.add(close(current, currentMarker, segments.size(), document));
                current = new ArrayList<>();
            }
            if (current.isEmpty() || marker != null) {
                currentMarker = marker;
            }
            current.add(field);
        }
        if (!current.isEmpty()) {
            segments.add(close(current, currentMarker, segments.size(), document));
        }
        return segments;
    }

    private static Segment close(List<FieldRecord> fields, String marker, int index, Document document) {
        return new Segment(SegmentMarkers.typeOf(marker), index, bitLength(fields, document), fields);
    }

    /**
     * Highest end + 1, rounded up to the declared container size for bit-addressed documents.
     */
    static int bitLength(List<FieldRecord> fields, Document document) {
        int observed = fields.stream().mapToInt(f -> f.range().end()).max().orElse(-1) + 1;
        if (document.transportUnit() == TransportUnit.BIT && document.hasContainerSize() && observed > 0) {
            int container = document.containerBits();
            return ((observed + container - 1) / container) * container;
        }
        return observed;
    }
}
