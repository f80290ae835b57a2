package com.boardgame.gamegraph.dto;

import com.boardgame.gamegraph.model.SkippedGame;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationSummary {

    private String username;

    private double threshold;

    /**
     * Distinct games in the user's collection
     */
    private int collectionSize;

    /**
     * Games exported as nodes
     */
    private int nodeCount;

    private int edgeCount;

    /**
     * Collection games left out of the graph, with the reason
     */
    @Builder.Default
    private List<SkippedGame> skippedGames = new ArrayList<>();

    private Path nodesFile;
    private Path edgesFile;
}
