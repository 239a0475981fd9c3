package com.specsim.infrastructure.sim.validation;

import com.specsim.domain.sim.model.BitRange;
import com.specsim.domain.sim.model.FieldRecord;
import com.specsim.domain.sim.model.Message;
import com.specsim.domain.sim.model.Segment;
import com.specsim.domain.sim.model.ValidationIssue;
import com.specsim.domain.sim.model.ValidationRule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bit-range layout of every segment: overlaps and out-of-bounds ranges are errors,
 * unused bits a warning.
 */
@Component
@Order(1)
public class StructuralChecker implements ModelChecker {

    @Override
    public String name() {
        return "structural";
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<Message> messages = context.model().messages();

        for (int m = 0; m < messages.size(); m++) {
            List<Segment> segments = messages.get(m).segments();
            for (int s = 0; s < segments.size(); s++) {
                checkSegment(messages.get(m), segments.get(s), m, s, issues);
            }
        }
        return issues;
    }

    private void checkSegment(Message message, Segment segment, int m, int s, List<ValidationIssue> issues) {
        List<FieldRecord> fields = segment.fields();

        // Every overlapping pair, reported on the later field
        for (int j = 1; j < fields.size(); j++) {
            FieldRecord later = fields.get(j);
            for (int i = 0; i < j; i++) {
                FieldRecord earlier = fields.get(i);
                if (earlier.range().overlaps(later.range())) {
                    issues.add(ValidationIssue.error(ValidationRule.BIT_RANGE_OVERLAP,
                            TargetPaths.field(m, s, j),
                            String.format("Fields '%s' (%s) and '%s' (%s) overlap in %s segment %d",
                                    earlier.name(), earlier.range(), later.name(), later.range(),
                                    message.label(), segment.index()),
                            "Check the bit positions of '" + earlier.name() + "' and '" + later.name() + "'"));
                }
            }
        }

        for (int f = 0; f < fields.size(); f++) {
            FieldRecord field = fields.get(f);
            if (!field.range().fitsWithin(segment.bitLength())) {
                issues.add(ValidationIssue.error(ValidationRule.BIT_RANGE_OUT_OF_BOUNDS,
                        TargetPaths.field(m, s, f),
                        String.format("Field '%s' (%s) exceeds segment length %d",
                                field.name(), field.range(), segment.bitLength()),
                        "Correct the range or the declared container size"));
            }
        }

        List<BitRange> unused = unusedRanges(fields, segment.bitLength());
        if (!unused.isEmpty()) {
            issues.add(ValidationIssue.warning(ValidationRule.BIT_RANGE_UNUSED,
                    TargetPaths.segment(m, s),
                    String.format("%s segment %d leaves positions %s unused",
                            message.label(), segment.index(), unused),
                    "Confirm the positions are spare or add the missing fields"));
        }
    }

    /**
     * Gaps in [0, bitLength) not covered by any field.
     */
    static List<BitRange> unusedRanges(List<FieldRecord> fields, int bitLength) {
        List<BitRange> ranges = fields.stream()
                .map(FieldRecord::range)
                .sorted(Comparator.comparingInt(BitRange::start))
                .toList();

        List<BitRange> gaps = new ArrayList<>();
        int next = 0;
        for (BitRange range : ranges) {
            if (next >= bitLength) {
                break;
            }
            if (range.start() > next) {
                gaps.add(new BitRange(next, Math.min(range.start(), bitLength) - 1));
            }
            next = Math.max(next, range.end() + 1);
        }
        if (next < bitLength) {
            gaps.add(new BitRange(next, bitLength - 1));
        }
        return gaps;
    }
}
