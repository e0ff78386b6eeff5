package com.hoopstats.infrastructure.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hoopstats.application.throttle.SourceRateLimiter;
import com.hoopstats.domain.error.PermanentSourceException;
import com.hoopstats.domain.error.RateLimitedException;
import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.SourceParseException;
import com.hoopstats.domain.error.TransientSourceException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP access for source adapters.
 *
 * <p>Every request first waits for a slot from the {@link SourceRateLimiter}, then its failures are
 * classified into the {@link SourceException} taxonomy:</p>
 * <ul>
 *   <li>I/O errors, timeouts, 408 and 5xx: transient</li>
 *   <li>429: rate limited, with the {@code Retry-After} seconds when sent</li>
 *   <li>other 4xx: permanent</li>
 *   <li>unexpected content type or malformed JSON: parse error</li>
 * </ul>
 */
public class SourceHttpClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SourceHttpClient.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;
    private final SourceRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SourceHttpClient(SourceRateLimiter rateLimiter, ObjectMapper objectMapper, Duration timeout) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        Timeout requestTimeout = Timeout.ofMilliseconds(timeout.toMillis());
        this.httpClient = HttpClients.custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                    .setConnectTimeout(requestTimeout)
                    .setSocketTimeout(requestTimeout)
                    .build())
                .build())
            .build();
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * Waits for a request slot of the source.
     */
    public void awaitPermit(String sourceId) throws SourceException {
        try {
            rateLimiter.awaitPermit(sourceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSourceException(sourceId, "Interrupted while waiting for a request slot", e);
        }
    }

    /**
     * Makes a GET request and returns the body as text (HTML pages, CSV files).
     */
    public String getText(String sourceId, String url, Map<String, String> headers) throws SourceException {
        return execute(sourceId, url, headers).body;
    }

    /**
     * Makes a GET request and returns the response as JsonNode.
     */
    public JsonNode getJson(String sourceId, String url, Map<String, String> headers) throws SourceException {
        Response response = execute(sourceId, url, headers);
        // If content-type is null or empty, we'll still try to parse as JSON
        if (response.contentType != null && !response.contentType.isEmpty()
            && !response.contentType.toLowerCase().startsWith("application/json")) {
            logger.error("Expected JSON but received content-type: {}. URL: {}", response.contentType, url);
            logResponseBodyPreview(response.body);
            throw new SourceParseException(sourceId, "Expected JSON response but received: " + response.contentType);
        }
        try {
            return objectMapper.readTree(response.body);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON. URL: {}", url);
            logResponseBodyPreview(response.body);
            throw new SourceParseException(sourceId, "Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Appends URL-encoded query parameters to a base URL.
     */
    public static String withParams(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringBuilder urlBuilder = new StringBuilder(baseUrl).append("?");
        params.forEach((key, value) -> urlBuilder
            .append(URLEncoder.encode(key, StandardCharsets.UTF_8))
            .append("=")
            .append(URLEncoder.encode(value, StandardCharsets.UTF_8))
            .append("&"));
        // Remove trailing &
        urlBuilder.setLength(urlBuilder.length() - 1);
        return urlBuilder.toString();
    }

    /**
     * Maps a non-2xx status onto the error taxonomy.
     */
    public static SourceException classify(String sourceId, int statusCode, String retryAfter, String url) {
        String message = "HTTP " + statusCode + " from " + url;
        if (statusCode == 429) {
            return new RateLimitedException(sourceId, message, parseRetryAfter(retryAfter));
        }
        if (statusCode == 408 || statusCode >= 500) {
            return new TransientSourceException(sourceId, message);
        }
        return new PermanentSourceException(sourceId, message);
    }

    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the stats sites
            return null;
        }
    }

    private Response execute(String sourceId, String url, Map<String, String> headers) throws SourceException {
        awaitPermit(sourceId);

        HttpGet request = new HttpGet(url);
        if (headers != null) {
            headers.forEach(request::addHeader);
        }

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            String contentType = entity != null ? entity.getContentType() : null;
            String body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";

            if (statusCode >= 200 && statusCode < 300) {
                return new Response(body, contentType);
            }
            Header retryAfter = response.getFirstHeader("Retry-After");
            logger.warn("{}: HTTP {} for {}", sourceId, statusCode, url);
            throw classify(sourceId, statusCode, retryAfter != null ? retryAfter.getValue() : null, url);

        } catch (IOException e) {
            throw new TransientSourceException(sourceId, "Request to " + url + " failed: " + e.getMessage(), e);
        } catch (ParseException e) {
            throw new SourceParseException(sourceId, "Failed to read response from " + url, e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private record Response(String body, String contentType) {
    }
}
