package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.model.Game;
import com.boardgame.gamegraph.model.GameGraph;
import com.boardgame.gamegraph.model.SimilarityEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every unordered pair of games and keeps the pairs at or above the threshold.
 * All games become nodes, connected or not.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SimilarityGraphBuilder {

    private final GameSimilarityCalculator calculator;

    public GameGraph build(List<Game> games, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Edge threshold must be within [0, 1]: " + threshold);
        }

        log.info("Computing similarities for {} games with threshold {}", games.size(), threshold);

        Map<String, SimilarityEdge> edges = new LinkedHashMap<>();
        for (int i = 0; i < games.size(); i++) {
            Game a = games.get(i);
            for (int j = i + 1; j < games.size(); j++) {
                Game b = games.get(j);
                if (a.getId().equals(b.getId())) {
                    continue;
                }
                double score = calculator.score(a, b);
                if (score >= threshold) {
                    edges.putIfAbsent(SimilarityEdge.key(a.getId(), b.getId()),
                            SimilarityEdge.between(a.getId(), b.getId(), score));
                }
            }
        }

        log.info("Created {} similarity edges", edges.size());
        return new GameGraph(List.copyOf(games), new ArrayList<>(edges.values()));
    }
}
