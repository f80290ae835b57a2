package com.boardgame.gamegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection, rate-limit and retry settings for the BoardGameGeek XML API2.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gamegraph.bgg")
public class BggProperties {
    private String baseUrl = "https://boardgamegeek.com/xmlapi2";

    /**
     * Registered application token, sent as a bearer token when set
     */
    private String apiToken;

    private String userAgent = "GameGraph/1.0";

    /**
     * Minimum gap between two dispatched requests, retries included
     */
    private long requestDelayMillis = 1500;

    private int maxAttempts = 3;

    /**
     * Base of the exponential backoff: retryDelayMillis * 2^(attempt - 1)
     */
    private long retryDelayMillis = 1500;

    private int connectTimeoutSeconds = 30;
    private int readTimeoutSeconds = 60;

    /**
     * Ids per thing request
     */
    private int batchSize = 20;
}
