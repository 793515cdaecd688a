package com.metabolite.classification.http;

import com.metabolite.classification.core.model.LookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Issues one request at a time to a single source, pacing calls through a
 * {@link RateLimitPolicy}. Never throws: every failure becomes a
 * {@link com.metabolite.classification.core.model.LookupError#REQUEST_ERROR}.
 *
 * <p>No retries are attempted.</p>
 */
public class RateLimitedHttpClient {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedHttpClient.class);

    private final String sourceName;
    private final HttpTransport transport;
    private final RateLimitPolicy rateLimitPolicy;

    public RateLimitedHttpClient(String sourceName, HttpTransport transport, RateLimitPolicy rateLimitPolicy) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rateLimitPolicy = rateLimitPolicy != null ? rateLimitPolicy : RateLimitPolicy.none();
    }

    /**
     * Fetches the body at {@code uri}.
     *
     * @return the body on a 2xx reply, a request error otherwise
     */
    public LookupResult<String> get(URI uri, Duration timeout) {
        try {
            rateLimitPolicy.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LookupResult.requestError("Interrupted while waiting to call " + sourceName);
        }

        try {
            HttpReply reply = transport.get(uri, timeout);
            if (!reply.isSuccess()) {
                log.debug("http.status source={} uri={} status={}", sourceName, uri, reply.statusCode());
                return LookupResult.requestError("HTTP " + reply.statusCode() + " for url: " + uri);
            }
            return LookupResult.found(reply.body());
        } catch (HttpTimeoutException e) {
            log.debug("http.timeout source={} uri={} timeout={}", sourceName, uri, timeout);
            return LookupResult.requestError("Request timed out after " + timeout.toMillis() + " ms: " + uri);
        } catch (IOException e) {
            log.debug("http.io_error source={} uri={} error={}", sourceName, uri, e.toString());
            return LookupResult.requestError(describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LookupResult.requestError("Interrupted while calling " + uri);
        } catch (RuntimeException e) {
            log.warn("http.failed source={} uri={} error={}", sourceName, uri, e.toString());
            return LookupResult.requestError(describe(e));
        } finally {
            rateLimitPolicy.release();
        }
    }

    public String getSourceName() {
        return sourceName;
    }

    static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
