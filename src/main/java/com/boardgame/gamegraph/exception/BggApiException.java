package com.boardgame.gamegraph.exception;

import lombok.Getter;

import java.io.IOException;

/**
 * A BGG XML API call that failed for good, after any retries it was entitled to.
 */
@Getter
public class BggApiException extends IOException {

    public enum Failure {
        TIMEOUT,
        CONNECTION_FAILED,
        MALFORMED_RESPONSE,
        RATE_LIMIT_EXCEEDED,
        /** 4xx status other than 429; retrying will not help */
        REJECTED
    }

    private final Failure failure;
    private final String endpoint;

    public BggApiException(Failure failure, String endpoint, String message) {
        super(message);
        this.failure = failure;
        this.endpoint = endpoint;
    }

    public BggApiException(Failure failure, String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.endpoint = endpoint;
    }

    @Override
    public String getMessage() {
        return failure + " on '" + endpoint + "': " + super.getMessage();
    }
}
