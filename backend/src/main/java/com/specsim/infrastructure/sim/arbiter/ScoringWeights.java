package com.specsim.infrastructure.sim.arbiter;

/**
 * Weights of the three candidate-quality features. The total score is normalized by their sum,
 * so only the proportions matter.
 */
public record ScoringWeights(double header, double consistency, double bitParse) {

    public static final double DEFAULT_HEADER = 0.4;
    public static final double DEFAULT_CONSISTENCY = 0.2;
    public static final double DEFAULT_BIT_PARSE = 0.4;

    public ScoringWeights {
        if (header < 0 || consistency < 0 || bitParse < 0) {
            throw new IllegalArgumentException("Scoring weights must be non-negative");
        }
        if (header + consistency + bitParse <= 0) {
            throw new IllegalArgumentException("At least one scoring weight must be positive");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(DEFAULT_HEADER, DEFAULT_CONSISTENCY, DEFAULT_BIT_PARSE);
    }

    public double sum() {
        return header + consistency + bitParse;
    }
}
