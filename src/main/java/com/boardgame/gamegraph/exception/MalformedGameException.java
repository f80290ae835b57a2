package com.boardgame.gamegraph.exception;

import lombok.Getter;

/**
 * A single thing record that cannot be turned into a game. Only that game is dropped.
 */
@Getter
public class MalformedGameException extends Exception {

    private final String gameId;

    public MalformedGameException(String gameId, String message) {
        super(message);
        this.gameId = gameId;
    }
}
