package com.boardgame.gamegraph.model;

import java.util.List;
import java.util.Map;

/**
 * Games fetched by id, in request order, plus the ids that had to be dropped.
 */
public record DetailFetchResult(Map<String, Game> games, List<SkippedGame> skipped) {
}
