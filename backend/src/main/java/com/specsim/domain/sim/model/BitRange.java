package com.specsim.domain.sim.model;

/**
 * Inclusive, 0-based range of bits (or bytes, depending on the document's transport unit).
 */
public record BitRange(int start, int end) {

    public BitRange {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Bit range must be non-negative: " + start + "-" + end);
        }
        if (start > end) {
            throw new IllegalArgumentException("Bit range start exceeds end: " + start + "-" + end);
        }
    }

    public static BitRange single(int bit) {
        return new BitRange(bit, bit);
    }

    public int length() {
        return end - start + 1;
    }

    public boolean overlaps(BitRange other) {
        return start <= other.end && other.start <= end;
    }

    public boolean fitsWithin(int bitLength) {
        return end < bitLength;
    }

    @Override
    public String toString() {
        return start == end ? Integer.toString(start) : start + "-" + end;
    }
}
