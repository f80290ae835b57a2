package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.client.BggXmlApiClient;
import com.boardgame.gamegraph.config.BggProperties;
import com.boardgame.gamegraph.exception.BggApiException;
import com.boardgame.gamegraph.exception.MalformedGameException;
import com.boardgame.gamegraph.model.DetailFetchResult;
import com.boardgame.gamegraph.model.Game;
import com.boardgame.gamegraph.model.SkippedGame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches game details in batches. Failures never abort the run: a bad item or a
 * batch that exhausted its retries is dropped and recorded as skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GameDetailService {

    static final String ENDPOINT = "thing";

    private final BggXmlApiClient apiClient;
    private final GameXmlParser parser;
    private final BggProperties properties;

    public DetailFetchResult fetchDetails(List<String> ids) {
        Map<String, Game> games = new LinkedHashMap<>();
        List<SkippedGame> skipped = new ArrayList<>();

        if (ids.isEmpty()) {
            return new DetailFetchResult(games, skipped);
        }

        int batchSize = Math.max(1, properties.getBatchSize());
        int batchCount = (ids.size() + batchSize - 1) / batchSize;
        log.info("Fetching details for {} games in {} batches", ids.size(), batchCount);

        for (int start = 0; start < ids.size(); start += batchSize) {
            List<String> batch = ids.subList(start, Math.min(start + batchSize, ids.size()));
            log.info("Processing batch {}/{} ({} games)", start / batchSize + 1, batchCount, batch.size());
            fetchBatch(batch, games, skipped);
        }

        log.info("Fetched details for {} of {} games, {} skipped", games.size(), ids.size(), skipped.size());
        return new DetailFetchResult(games, skipped);
    }

    private void fetchBatch(List<String> batch, Map<String, Game> games, List<SkippedGame> skipped) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("id", String.join(",", batch));
        params.put("stats", "1");

        Element root;
        try {
            root = apiClient.request(ENDPOINT, params);
            if (!"items".equals(root.tagName())) {
                throw new BggApiException(BggApiException.Failure.MALFORMED_RESPONSE, ENDPOINT,
                        "unexpected <" + root.tagName() + "> response, expected <items>");
            }
        } catch (BggApiException e) {
            log.warn("Dropping batch of {} games: {}", batch.size(), e.getMessage());
            for (String id : batch) {
                skip(skipped, id, "batch failed: " + e.getFailure());
            }
            return;
        }

        Map<String, Game> parsed = new HashMap<>();
        Map<String, String> failures = new HashMap<>();
        for (Element item : root.children()) {
            if (!"item".equals(item.tagName())) {
                continue;
            }
            try {
                Game game = parser.parse(item);
                parsed.putIfAbsent(game.getId(), game);
            } catch (MalformedGameException e) {
                if (e.getGameId() != null) {
                    failures.putIfAbsent(e.getGameId(), "malformed: " + e.getMessage());
                } else {
                    log.warn("Ignoring unidentifiable item in thing response: {}", e.getMessage());
                }
            }
        }

        for (String id : batch) {
            Game game = parsed.get(id);
            if (game != null) {
                games.put(id, game);
            } else {
                skip(skipped, id, failures.getOrDefault(id, "missing from response"));
            }
        }
    }

    private void skip(List<SkippedGame> skipped, String id, String reason) {
        log.warn("Skipping game {}: {}", id, reason);
        skipped.add(new SkippedGame(id, reason));
    }
}
