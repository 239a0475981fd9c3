package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.SemanticModel;
import com.specsim.domain.sim.model.Segment;

import java.util.BitSet;

/**
 * Whole-model aggregates reported alongside the issue list.
 */
final class ModelMetrics {

    private ModelMetrics() {
    }

    /**
     * Share of declared segment positions covered by at least one field, in [0, 1].
     * Positions past a segment's declared length do not count. A model without segments has 0.
     */
    static double coverage(SemanticModel model) {
        long declared = 0;
        long covered = 0;
        for (Message message : model.messages()) {
            for (Segment segment : message.segments()) {
                if (segment.bitLength() <= 0) {
                    continue;
                }
                BitSet used = new BitSet(segment.bitLength());
                for (FieldRecord field : segment.fields()) {
                    BitRange range = field.range();
                    if (range.start() < segment.bitLength()) {
                        used.set(range.start(), Math.min(range.end(), segment.bitLength() - 1) + 1);
                    }
                }
                declared += segment.bitLength();
                covered += used.cardinality();
            }
        }
        return declared == 0 ? 0.0 : (double) covered / declared;
    }

    /**
     * Mean field confidence; 0 when the model has no fields.
     */
    static double meanConfidence(SemanticModel model) {
        return model.messages().stream()
                .flatMap(message -> message.segments().stream())
                .flatMap(segment -> segment.fields().stream())
                .mapToDouble(FieldRecord::confidence)
                .average()
                .orElse(0.0);
    }
}
