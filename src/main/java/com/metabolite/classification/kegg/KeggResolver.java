package com.metabolite.classification.kegg;

import com.metabolite.classification.core.model.LookupResult;
import com.metabolite.classification.http.RateLimitedHttpClient;
import com.metabolite.classification.http.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Resolves a metabolite name to a KEGG compound id through {@code /find/compound/<name>}.
 *
 * <p>The response has one candidate per line, {@code cpd:C00031\tD-Glucose; Grape sugar}.
 * Only the first non-empty line is considered.</p>
 */
public class KeggResolver {
    private static final Logger log = LoggerFactory.getLogger(KeggResolver.class);

    private final RateLimitedHttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public KeggResolver(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = Urls.normalizeBaseUrl(baseUrl);
        this.timeout = timeout;
    }

    public LookupResult<String> resolve(String metaboliteName) {
        URI uri = URI.create(baseUrl + "/find/compound/" + Urls.encodePathSegment(metaboliteName));
        return httpClient.get(uri, timeout).flatMap(KeggResolver::parseFindResponse);
    }

    static LookupResult<String> parseFindResponse(String body) {
        if (body.isEmpty()) {
            return LookupResult.notFound("Empty KEGG find response");
        }
        for (String line : body.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String[] columns = line.split("\\s+", 2);
            if (columns.length < 2) {
                log.debug("kegg.find.malformed line='{}'", line);
                return LookupResult.parseError("Malformed KEGG find line: " + line);
            }
            String[] reference = columns[0].split(":", -1);
            if (reference.length < 2) {
                return LookupResult.parseError("KEGG entry without database prefix: " + columns[0]);
            }
            if (reference[1].isEmpty()) {
                return LookupResult.notFound("Empty KEGG compound id");
            }
            return LookupResult.found(reference[1]);
        }
        return LookupResult.notFound("No KEGG compound matches");
    }
}
