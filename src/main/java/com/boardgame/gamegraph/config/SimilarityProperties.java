package com.boardgame.gamegraph.config;

import com.boardgame.gamegraph.model.SimilarityWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "gamegraph.similarity")
public class SimilarityProperties {
    private double mechanicsWeight = SimilarityWeights.DEFAULT.mechanics();
    private double categoriesWeight = SimilarityWeights.DEFAULT.categories();
    private double numericWeight = SimilarityWeights.DEFAULT.numeric();
    private double edgeThreshold = 0.35;

    /**
     * Validated weights; startup fails when they are negative or do not sum to 1.0.
     */
    @Bean
    public SimilarityWeights similarityWeights() {
        return toWeights();
    }

    public SimilarityWeights toWeights() {
        return new SimilarityWeights(mechanicsWeight, categoriesWeight, numericWeight);
    }
}
