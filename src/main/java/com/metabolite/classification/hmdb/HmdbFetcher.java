package com.metabolite.classification.hmdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.metabolite.classification.core.model.HmdbRecord;
import com.metabolite.classification.core.model.LookupResult;
import com.metabolite.classification.http.RateLimitedHttpClient;
import com.metabolite.classification.http.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches {@code /metabolites/<id>.xml} and extracts the taxonomy and pathway names.
 *
 * <p>Expected shape (root element {@code metabolite}):</p>
 * <pre>
 * &lt;metabolite&gt;
 *   &lt;classification&gt;
 *     &lt;super_class&gt;Lipids and lipid-like molecules&lt;/super_class&gt;
 *     &lt;class&gt;Fatty Acyls&lt;/class&gt;
 *     &lt;sub_class&gt;Fatty acids and conjugates&lt;/sub_class&gt;
 *   &lt;/classification&gt;
 *   &lt;pathways&gt;
 *     &lt;pathway&gt;&lt;name&gt;Fatty Acid Biosynthesis&lt;/name&gt;&lt;/pathway&gt;
 *   &lt;/pathways&gt;
 * &lt;/metabolite&gt;
 * </pre>
 *
 * A single {@code pathway} element is read as an object and several as an array;
 * both are handled the same way.
 */
public class HmdbFetcher {
    private static final Logger log = LoggerFactory.getLogger(HmdbFetcher.class);

    private final RateLimitedHttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final XmlMapper xmlMapper;

    public HmdbFetcher(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout) {
        this(httpClient, baseUrl, timeout, new XmlMapper());
    }

    public HmdbFetcher(RateLimitedHttpClient httpClient, String baseUrl, Duration timeout, XmlMapper xmlMapper) {
        this.httpClient = httpClient;
        this.baseUrl = Urls.normalizeBaseUrl(baseUrl);
        this.timeout = timeout;
        this.xmlMapper = xmlMapper;
    }

    public LookupResult<HmdbClassification> fetch(String hmdbId) {
        URI uri = URI.create(baseUrl + "/metabolites/" + Urls.encodePathSegment(hmdbId) + ".xml");
        return httpClient.get(uri, timeout).flatMap(this::parseDocument);
    }

    LookupResult<HmdbClassification> parseDocument(String body) {
        JsonNode metabolite;
        try {
            metabolite = xmlMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("hmdb.detail.malformed error={}", e.getOriginalMessage());
            return LookupResult.parseError("Malformed HMDB document: " + e.getOriginalMessage());
        }
        if (metabolite == null || metabolite.isMissingNode()) {
            return LookupResult.parseError("Empty HMDB document");
        }

        JsonNode classification = metabolite.path("classification");
        List<String> pathways = new ArrayList<>();
        for (JsonNode pathway : asList(metabolite.path("pathways").get("pathway"))) {
            if (!pathway.isObject()) {
                continue;
            }
            JsonNode name = pathway.get("name");
            pathways.add(name != null && name.isValueNode() ? name.asText() : "");
        }

        return LookupResult.found(new HmdbClassification(
                textOrUnknown(classification, "super_class"),
                textOrUnknown(classification, "class"),
                textOrUnknown(classification, "sub_class"),
                pathways));
    }

    /**
     * Treats a missing node as empty, an array as its elements and anything else as a
     * one-element list.
     */
    static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> entries = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return entries;
        }
        if (node.isArray()) {
            node.forEach(entries::add);
        } else {
            entries.add(node);
        }
        return entries;
    }

    private static String textOrUnknown(JsonNode parent, String field) {
        if (!parent.isObject()) {
            return HmdbRecord.UNKNOWN;
        }
        JsonNode value = parent.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isEmpty()) {
            return HmdbRecord.UNKNOWN;
        }
        return value.asText();
    }
}
