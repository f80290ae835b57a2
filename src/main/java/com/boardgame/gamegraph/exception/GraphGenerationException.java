package com.boardgame.gamegraph.exception;

import lombok.Getter;

/**
 * Fatal pipeline failure, tagged with the stage that produced it.
 */
@Getter
public class GraphGenerationException extends Exception {

    public enum Stage {
        COLLECTION,
        EXPORT
    }

    private final Stage stage;

    public GraphGenerationException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
