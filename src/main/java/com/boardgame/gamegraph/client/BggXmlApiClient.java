package com.boardgame.gamegraph.client;

import com.boardgame.gamegraph.config.BggProperties;
import com.boardgame.gamegraph.exception.BggApiException;
import com.boardgame.gamegraph.exception.BggApiException.Failure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Map;

/**
 * Read-only client for the BoardGameGeek XML API2.
 *
 * <p>Every attempt first waits on the shared {@link BggRateLimiter}. A request moves through
 * pending, retry(n) and then either success or exhaustion:
 * <ul>
 *   <li>202 (BGG is still preparing the data) and 429 are retried; once attempts run out the
 *       call fails with {@link Failure#RATE_LIMIT_EXCEEDED}</li>
 *   <li>network errors and 5xx are retried; once attempts run out the call fails with
 *       {@link Failure#TIMEOUT} or {@link Failure#CONNECTION_FAILED}</li>
 *   <li>any other 4xx fails at once with {@link Failure#REJECTED}</li>
 *   <li>a 200 body without an XML root element fails at once with {@link Failure#MALFORMED_RESPONSE}</li>
 * </ul>
 * Retries back off exponentially: {@code retryDelayMillis * 2^(attempt - 1)}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BggXmlApiClient {

    private static final int STATUS_PROCESSING = 202;
    private static final int STATUS_TOO_MANY_REQUESTS = 429;

    private final BggProperties properties;
    private final OkHttpClient httpClient;
    private final BggRateLimiter rateLimiter;

    /**
     * Call an API endpoint and return the root element of the XML response.
     *
     * @param endpoint Path below the base URL, e.g. "collection" or "thing"
     * @param params Query parameters, in the order they should appear
     * @return The document's root element
     * @throws BggApiException when the call failed for good
     */
    public Element request(String endpoint, Map<String, String> params) throws BggApiException {
        HttpUrl url = buildUrl(endpoint, params);
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        BggApiException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            waitForSlot(endpoint);
            log.debug("BGG request (attempt {}/{}): {}", attempt, maxAttempts, url);

            try (Response response = httpClient.newCall(buildRequest(url)).execute()) {
                int code = response.code();

                if (code == STATUS_PROCESSING || code == STATUS_TOO_MANY_REQUESTS) {
                    log.info("BGG returned {} for '{}' (attempt {}/{}), request queued or throttled",
                            code, endpoint, attempt, maxAttempts);
                    lastFailure = new BggApiException(Failure.RATE_LIMIT_EXCEEDED, endpoint,
                            "still status " + code + " after " + attempt + " attempts");
                } else if (response.isSuccessful()) {
                    Element root = parse(endpoint, readBody(response));
                    log.debug("BGG request succeeded on attempt {}: {}", attempt, endpoint);
                    return root;
                } else if (code >= 500) {
                    log.warn("BGG returned server error {} for '{}' (attempt {}/{})",
                            code, endpoint, attempt, maxAttempts);
                    lastFailure = new BggApiException(Failure.CONNECTION_FAILED, endpoint,
                            "server error " + code + " after " + attempt + " attempts");
                } else {
                    throw new BggApiException(Failure.REJECTED, endpoint, "status " + code + " " + response.message());
                }

            } catch (BggApiException e) {
                throw e;
            } catch (SocketTimeoutException e) {
                log.warn("BGG request to '{}' timed out (attempt {}/{}): {}",
                        endpoint, attempt, maxAttempts, e.getMessage());
                lastFailure = new BggApiException(Failure.TIMEOUT, endpoint,
                        "timed out after " + attempt + " attempts", e);
            } catch (IOException e) {
                log.warn("BGG request to '{}' failed (attempt {}/{}): {}",
                        endpoint, attempt, maxAttempts, e.getMessage());
                lastFailure = new BggApiException(Failure.CONNECTION_FAILED, endpoint,
                        "connection failed after " + attempt + " attempts", e);
            }

            if (attempt < maxAttempts) {
                backoff(endpoint, attempt);
            }
        }

        log.error("All {} attempts exhausted for '{}': {}", maxAttempts, endpoint, lastFailure.getFailure());
        throw lastFailure;
    }

    HttpUrl buildUrl(String endpoint, Map<String, String> params) {
        HttpUrl base = HttpUrl.parse(properties.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid BGG base URL: " + properties.getBaseUrl());
        }

        HttpUrl.Builder builder = base.newBuilder().addPathSegments(endpoint);
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    private Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "application/xml")
                .get();

        String token = properties.getApiToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    private String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private Element parse(String endpoint, String body) throws BggApiException {
        if (body.isBlank()) {
            throw new BggApiException(Failure.MALFORMED_RESPONSE, endpoint, "empty response body");
        }

        Document document = Jsoup.parse(body, "", Parser.xmlParser());
        Element root = document.children().first();
        if (root == null) {
            throw new BggApiException(Failure.MALFORMED_RESPONSE, endpoint, "response has no XML root element");
        }
        return root;
    }

    private void waitForSlot(String endpoint) throws BggApiException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedIOException e) {
            throw new BggApiException(Failure.CONNECTION_FAILED, endpoint, "interrupted before dispatch", e);
        }
    }

    private void backoff(String endpoint, int attempt) throws BggApiException {
        long delay = properties.getRetryDelayMillis() * (1L << (attempt - 1));
        if (delay <= 0) {
            return;
        }

        log.info("Retrying '{}' in {}ms", endpoint, delay);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BggApiException(Failure.CONNECTION_FAILED, endpoint, "interrupted during retry backoff", e);
        }
    }
}
