package com.metabolite.classification.hmdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metabolite.classification.core.model.LookupResult;
import com.metabolite.classification.http.RateLimitedHttpClient;
import com.metabolite.classification.http.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Resolves a metabolite name to an HMDB accession through the full-text search endpoint
 * ({@code /unearth/q?query=<name>&searcher=metabolites}).
 *
 * <p>The first match wins; there is no ranking or disambiguation.</p>
 */
public class HmdbResolver {
    private static final Logger log = LoggerFactory.getLogger(HmdbResolver.class);

    private final RateLimitedHttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public HmdbResolver(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout) {
        this(httpClient, baseUrl, timeout, new ObjectMapper());
    }

    public HmdbResolver(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout,
                        ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = Urls.normalizeBaseUrl(baseUrl);
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    /**
     * Looks up the accession of the first search hit for {@code metaboliteName}.
     */
    public LookupResult<String> resolve(String metaboliteName) {
        URI uri = searchUri(metaboliteName);
        return httpClient.get(uri, timeout).flatMap(this::parseSearchResponse);
    }

    URI searchUri(String metaboliteName) {
        return URI.create(baseUrl + "/unearth/q?query=" + Urls.encodeQueryParam(metaboliteName)
                + "&searcher=metabolites");
    }

    LookupResult<String> parseSearchResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("hmdb.search.malformed error={}", e.getOriginalMessage());
            return LookupResult.parseError("Malformed HMDB search response: " + e.getOriginalMessage());
        }

        JsonNode metabolites = root != null ? root.get("metabolites") : null;
        if (metabolites == null || !metabolites.isArray()) {
            return LookupResult.parseError("HMDB search response has no metabolites list");
        }
        if (metabolites.isEmpty()) {
            return LookupResult.notFound("No HMDB metabolite matches");
        }

        JsonNode hmdbId = metabolites.get(0).get("hmdb_id");
        if (hmdbId == null || !hmdbId.isValueNode() || hmdbId.asText().isBlank()) {
            return LookupResult.parseError("First HMDB match has no hmdb_id");
        }
        return LookupResult.found(hmdbId.asText());
    }
}
