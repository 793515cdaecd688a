package com.metabolite.classification.kegg;

import com.metabolite.classification.core.model.LookupResult;
import com.metabolite.classification.core.model.MetaboliteType;
import com.metabolite.classification.http.RateLimitedHttpClient;
import com.metabolite.classification.http.Urls;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fetches the flat-file record and the pathway links of a KEGG compound.
 *
 * <p>The type is a substring heuristic: a record mentioning "Secondary metabolites"
 * anywhere is secondary, everything else primary. The description is the second line
 * of the record.</p>
 */
public class KeggFetcher {

    static final String SECONDARY_MARKER = "Secondary metabolites";
    private static final String PATHWAY_PREFIX = "path:";

    private final RateLimitedHttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public KeggFetcher(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = Urls.normalizeBaseUrl(baseUrl);
        this.timeout = timeout;
    }

    /**
     * Issues both requests; each is reported on its own.
     */
    public KeggCompoundInfo fetch(String keggId) {
        return new KeggCompoundInfo(keggId, fetchDetail(keggId), fetchPathways(keggId));
    }

    public LookupResult<KeggDetail> fetchDetail(String keggId) {
        URI uri = URI.create(baseUrl + "/get/cpd:" + Urls.encodePathSegment(keggId));
        return httpClient.get(uri, timeout).map(KeggFetcher::parseDetail);
    }

    public LookupResult<Set<String>> fetchPathways(String keggId) {
        URI uri = URI.create(baseUrl + "/link/pathway/cpd:" + Urls.encodePathSegment(keggId));
        return httpClient.get(uri, timeout).flatMap(KeggFetcher::parsePathways);
    }

    static KeggDetail parseDetail(String body) {
        MetaboliteType type = body.contains(SECONDARY_MARKER) ? MetaboliteType.SECONDARY : MetaboliteType.PRIMARY;
        String[] lines = body.split("\n", -1);
        String description = lines.length > 1 ? lines[1] : "";
        return new KeggDetail(type, description);
    }

    static LookupResult<Set<String>> parsePathways(String body) {
        Set<String> pathways = new LinkedHashSet<>();
        for (String line : body.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String[] columns = line.split("\t", -1);
            if (columns.length < 2) {
                return LookupResult.parseError("Malformed KEGG pathway link line: " + line);
            }
            String pathway = columns[1];
            if (pathway.startsWith(PATHWAY_PREFIX)) {
                pathway = pathway.substring(PATHWAY_PREFIX.length());
            }
            pathways.add(pathway);
        }
        return LookupResult.found(pathways);
    }
}
