package com.boardgame.gamegraph.exception;

import lombok.Getter;

/**
 * The user's collection could not be retrieved: unknown user, private collection,
 * or a transport failure while listing it. No partial collection is usable.
 */
@Getter
public class CollectionUnavailableException extends Exception {

    private final String username;

    public CollectionUnavailableException(String username, String message) {
        super("Collection for '" + username + "' unavailable: " + message);
        this.username = username;
    }

    public CollectionUnavailableException(String username, String message, Throwable cause) {
        super("Collection for '" + username + "' unavailable: " + message, cause);
        this.username = username;
    }
}
