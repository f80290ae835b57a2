package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.dto.GenerationSummary;
import com.boardgame.gamegraph.exception.CollectionUnavailableException;
import com.boardgame.gamegraph.exception.GraphGenerationException;
import com.boardgame.gamegraph.exception.GraphGenerationException.Stage;
import com.boardgame.gamegraph.model.CollectionEntry;
import com.boardgame.gamegraph.model.DetailFetchResult;
import com.boardgame.gamegraph.model.Game;
import com.boardgame.gamegraph.model.GameGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the whole pipeline for one user: collection, details, similarity graph, export.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphGenerationService {

    private final CollectionService collectionService;
    private final GameDetailService detailService;
    private final SimilarityGraphBuilder graphBuilder;
    private final GraphExportService exportService;

    public GenerationSummary generate(String username, double threshold, Path outputDirectory)
            throws GraphGenerationException {

        List<CollectionEntry> collection;
        try {
            collection = collectionService.fetchCollection(username);
        } catch (CollectionUnavailableException e) {
            throw new GraphGenerationException(Stage.COLLECTION, e.getMessage(), e);
        }

        List<String> ids = collection.stream().map(CollectionEntry::id).collect(Collectors.toList());
        DetailFetchResult details = detailService.fetchDetails(ids);

        List<Game> games = new ArrayList<>();
        for (CollectionEntry entry : collection) {
            Game game = details.games().get(entry.id());
            if (game == null) {
                continue;
            }
            if ((game.getName() == null || game.getName().isBlank()) && !entry.name().isBlank()) {
                log.debug("Using collection name '{}' for game {}", entry.name(), entry.id());
                game = game.toBuilder().name(entry.name()).build();
            }
            games.add(game);
        }

        GameGraph graph = graphBuilder.build(games, threshold);

        GraphExportService.ExportResult written;
        try {
            written = exportService.export(graph, outputDirectory);
        } catch (IOException e) {
            throw new GraphGenerationException(Stage.EXPORT,
                    "Could not write graph to " + outputDirectory + ": " + e.getMessage(), e);
        }

        return GenerationSummary.builder()
                .username(username)
                .threshold(threshold)
                .collectionSize(collection.size())
                .nodeCount(graph.nodes().size())
                .edgeCount(graph.edges().size())
                .skippedGames(new ArrayList<>(details.skipped()))
                .nodesFile(written.nodesFile())
                .edgesFile(written.edgesFile())
                .build();
    }
}
