package com.specsim.infrastructure.sim.arbiter;

/**
 * Explainable quality score of one table candidate.
 *
 * @param headerRatio      header cells matching the vocabulary / header cells
 * @param consistencyRatio rows with the modal column count / rows
 * @param bitParseRatio    data rows whose position cell parses / data rows
 * @param density          non-empty cells, used only to break ties
 * @param total            weighted sum in [0, 1]
 */
public record CandidateScore(
        double headerRatio,
        double consistencyRatio,
        double bitParseRatio,
        int density,
        double total
) {
    public static CandidateScore zero(int density) {
        return new CandidateScore(0, 0, 0, density, 0);
    }

    @Override
    public String toString() {
        return String.format("%.2f (header=%.2f, consistency=%.2f, bitParse=%.2f, density=%d)",
                total, headerRatio, consistencyRatio, bitParseRatio, density);
    }
}
