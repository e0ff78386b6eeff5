package com.hoopstats.infrastructure.scraper;

import com.hoopstats.domain.error.PermanentSourceException;
import com.hoopstats.domain.error.RateLimitedException;
import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.TransientSourceException;
import com.hoopstats.domain.model.ErrorCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SourceHttpClient status classification and URL building.
 */
class SourceHttpClientTest {

    private static final String URL = "https://example.org/stats";

    @Test
    void testTooManyRequestsIsRateLimited() {
        SourceException error = SourceHttpClient.classify("nba-stats", 429, "42", URL);

        RateLimitedException limited = assertInstanceOf(RateLimitedException.class, error);
        assertEquals(Duration.ofSeconds(42), limited.getRetryAfter().orElseThrow());
        assertEquals(ErrorCategory.RATE_LIMITED, limited.getCategory());
        assertTrue(limited.isRetryable());
    }

    @Test
    void testTooManyRequestsWithoutHeader() {
        RateLimitedException limited = assertInstanceOf(RateLimitedException.class,
            SourceHttpClient.classify("nba-stats", 429, null, URL));

        assertTrue(limited.getRetryAfter().isEmpty());
    }

    @Test
    void testServerErrorsAndTimeoutsAreTransient() {
        assertInstanceOf(TransientSourceException.class, SourceHttpClient.classify("s", 408, null, URL));
        assertInstanceOf(TransientSourceException.class, SourceHttpClient.classify("s", 500, null, URL));
        assertInstanceOf(TransientSourceException.class, SourceHttpClient.classify("s", 503, null, URL));
    }

    @Test
    void testClientErrorsArePermanent() {
        SourceException notFound = SourceHttpClient.classify("s", 404, null, URL);

        assertInstanceOf(PermanentSourceException.class, notFound);
        assertFalse(notFound.isRetryable());
        assertTrue(notFound.getMessage().contains("404"));
        assertInstanceOf(PermanentSourceException.class, SourceHttpClient.classify("s", 403, null, URL));
    }

    @Test
    void testParseRetryAfter() {
        assertEquals(Duration.ofSeconds(120), SourceHttpClient.parseRetryAfter(" 120 "));
        assertEquals(Duration.ZERO, SourceHttpClient.parseRetryAfter("0"));
        assertNull(SourceHttpClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(SourceHttpClient.parseRetryAfter("-5"));
        assertNull(SourceHttpClient.parseRetryAfter(""));
        assertNull(SourceHttpClient.parseRetryAfter(null));
    }

    @Test
    void testWithParamsEncodesValues() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("Season", "2023-24");
        params.put("SeasonType", "Regular Season");

        assertEquals(URL + "?Season=2023-24&SeasonType=Regular+Season", SourceHttpClient.withParams(URL, params));
        assertEquals(URL, SourceHttpClient.withParams(URL, Map.of()));
    }
}
