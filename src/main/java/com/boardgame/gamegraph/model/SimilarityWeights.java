package com.boardgame.gamegraph.model;

/**
 * Weights of the three similarity facets. They must be non-negative and sum to 1.0.
 */
public record SimilarityWeights(double mechanics, double categories, double numeric) {

    public static final SimilarityWeights DEFAULT = new SimilarityWeights(0.5, 0.3, 0.2);

    private static final double SUM_TOLERANCE = 1e-9;

    public SimilarityWeights {
        if (mechanics < 0 || categories < 0 || numeric < 0) {
            throw new IllegalArgumentException(String.format(
                    "Similarity weights must be non-negative: mechanics=%s, categories=%s, numeric=%s",
                    mechanics, categories, numeric));
        }
        double sum = mechanics + categories + numeric;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Similarity weights must sum to 1.0 but sum to " + sum);
        }
    }

    public double total() {
        return mechanics + categories + numeric;
    }
}
