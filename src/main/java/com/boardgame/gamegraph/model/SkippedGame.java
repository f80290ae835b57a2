package com.boardgame.gamegraph.model;

/**
 * A requested game id that did not make it into the graph, and why.
 */
public record SkippedGame(String id, String reason) {
}
