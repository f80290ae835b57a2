package com.boardgame.gamegraph.model;

/**
 * One owned game as listed by the collection endpoint.
 */
public record CollectionEntry(String id, String name) {
}
