package com.boardgame.gamegraph.runner;

import com.boardgame.gamegraph.config.OutputProperties;
import com.boardgame.gamegraph.config.SimilarityProperties;
import com.boardgame.gamegraph.dto.GenerationSummary;
import com.boardgame.gamegraph.exception.GraphGenerationException;
import com.boardgame.gamegraph.model.SkippedGame;
import com.boardgame.gamegraph.service.GraphGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point:
 * {@code --username=<bgg user> [--edge-threshold=0.35] [--out-dir=data]}.
 * Exit code 0 on success, 1 when the pipeline fails, 2 on bad arguments.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gamegraph.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GenerateDataRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final GraphGenerationService generationService;
    private final SimilarityProperties similarityProperties;
    private final OutputProperties outputProperties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        String username = option(args, "username", null);
        if (username == null || username.isBlank()) {
            log.error("Missing required option --username=<BGG username>");
            exitCode = EXIT_USAGE;
            return;
        }

        double threshold;
        try {
            threshold = Double.parseDouble(option(args, "edge-threshold",
                    String.valueOf(similarityProperties.getEdgeThreshold())));
        } catch (NumberFormatException e) {
            log.error("--edge-threshold must be a number: {}", e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            log.error("--edge-threshold must be within [0, 1], got {}", threshold);
            exitCode = EXIT_USAGE;
            return;
        }

        Path outDir = Path.of(option(args, "out-dir", outputProperties.getDirectory()));

        log.info("=== Generating similarity graph for '{}' (threshold {}, output {}) ===",
                username, threshold, outDir.toAbsolutePath());

        try {
            GenerationSummary summary = generationService.generate(username, threshold, outDir);
            report(summary);
            exitCode = EXIT_OK;
        } catch (GraphGenerationException e) {
            log.error("Stage {} failed: {}", e.getStage(), e.getMessage(), e);
            if (e.getStage() == GraphGenerationException.Stage.COLLECTION) {
                log.error("Ensure the username is correct and the collection is public.");
            }
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void report(GenerationSummary summary) {
        for (SkippedGame skipped : summary.getSkippedGames()) {
            log.warn("Skipped game {}: {}", skipped.id(), skipped.reason());
        }
        log.info("=== Done: {} of {} games exported, {} skipped, {} edges with threshold {} ===",
                summary.getNodeCount(), summary.getCollectionSize(), summary.getSkippedGames().size(),
                summary.getEdgeCount(), summary.getThreshold());
    }

    private String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}
