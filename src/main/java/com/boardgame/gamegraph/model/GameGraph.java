package com.boardgame.gamegraph.model;

import java.util.List;

/**
 * Every fetched game as a node plus the edges that met the threshold.
 */
public record GameGraph(List<Game> nodes, List<SimilarityEdge> edges) {

    public static GameGraph empty() {
        return new GameGraph(List.of(), List.of());
    }
}
