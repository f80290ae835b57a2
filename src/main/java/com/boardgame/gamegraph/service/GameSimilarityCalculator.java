package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.model.Game;
import com.boardgame.gamegraph.model.NumericFeature;
import com.boardgame.gamegraph.model.SimilarityWeights;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Similarity between two games in [0, 1].
 *
 * <p>Combines a Jaccard score over mechanics, a Jaccard score over categories and a cosine
 * score over the numeric features, weighted by {@link SimilarityWeights}. Every input,
 * including games with no tags or no numbers, maps to a defined score; nothing here throws.
 */
@Component
@RequiredArgsConstructor
public class GameSimilarityCalculator {

    private final SimilarityWeights weights;

    public double score(Game a, Game b) {
        double mechanics = jaccard(a.getMechanics(), b.getMechanics());
        double categories = jaccard(a.getCategories(), b.getCategories());
        double numeric = numericCosine(a, b);

        double combined = (weights.mechanics() * mechanics
                + weights.categories() * categories
                + weights.numeric() * numeric) / weights.total();

        return clamp(combined);
    }

    /**
     * |A ∩ B| / |A ∪ B|; two empty sets agree completely and score 1.0.
     */
    static double jaccard(Set<String> a, Set<String> b) {
        Set<String> left = a != null ? a : Set.of();
        Set<String> right = b != null ? b : Set.of();

        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }

        int intersection = 0;
        for (String tag : left) {
            if (right.contains(tag)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    /**
     * Cosine over the features both games have. A feature missing on either side is left
     * out of both vectors. No shared feature scores 0.0, unless neither game has any
     * numeric feature at all, which counts as agreement like two empty tag sets.
     */
    static double numericCosine(Game a, Game b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        int dimensions = 0;

        for (NumericFeature feature : NumericFeature.values()) {
            Double x = feature.valueOf(a);
            Double y = feature.valueOf(b);
            if (x == null || y == null) {
                continue;
            }
            dot += x * y;
            normA += x * x;
            normB += y * y;
            dimensions++;
        }

        if (dimensions == 0) {
            return !NumericFeature.hasAny(a) && !NumericFeature.hasAny(b) ? 1.0 : 0.0;
        }
        if (normA == 0 && normB == 0) {
            return 1.0;
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        // sqrt(n * n) == n exactly, so a vector compared with itself yields exactly 1.0
        return clamp(dot / Math.sqrt(normA * normB));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
