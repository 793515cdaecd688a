package com.metabolite.classification.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoints, deadlines and politeness delays of a pipeline.
 *
 * @param hmdbBaseUrl        HMDB site root, {@code https://hmdb.ca}
 * @param keggBaseUrl        KEGG REST root, {@code http://rest.kegg.jp}
 * @param searchTimeout      deadline of a name search call
 * @param detailTimeout      deadline of a detail or pathway call
 * @param hmdbDelay          pause between consecutive HMDB requests
 * @param keggDelay          pause between consecutive KEGG requests
 * @param keggPartialResults keep data from the KEGG request that succeeded when the other fails
 */
public record PipelineConfig(
        String hmdbBaseUrl,
        String keggBaseUrl,
        Duration searchTimeout,
        Duration detailTimeout,
        Duration hmdbDelay,
        Duration keggDelay,
        boolean keggPartialResults
) {
    public static final String DEFAULT_HMDB_BASE_URL = "https://hmdb.ca";
    public static final String DEFAULT_KEGG_BASE_URL = "http://rest.kegg.jp";
    public static final Duration DEFAULT_SEARCH_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_DETAIL_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_HMDB_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_KEGG_DELAY = Duration.ofMillis(500);

    public PipelineConfig {
        if (hmdbBaseUrl == null || hmdbBaseUrl.isBlank()) {
            throw new IllegalArgumentException("hmdbBaseUrl must not be blank");
        }
        if (keggBaseUrl == null || keggBaseUrl.isBlank()) {
            throw new IllegalArgumentException("keggBaseUrl must not be blank");
        }
        requirePositive(searchTimeout, "searchTimeout");
        requirePositive(detailTimeout, "detailTimeout");
        requireNonNegative(hmdbDelay, "hmdbDelay");
        requireNonNegative(keggDelay, "keggDelay");
    }

    /**
     * Default configuration: public endpoints, 10s/15s deadlines, 1s/0.5s delays,
     * atomic KEGG fetches.
     */
    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .hmdbBaseUrl(hmdbBaseUrl)
                .keggBaseUrl(keggBaseUrl)
                .searchTimeout(searchTimeout)
                .detailTimeout(detailTimeout)
                .hmdbDelay(hmdbDelay)
                .keggDelay(keggDelay)
                .keggPartialResults(keggPartialResults);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    public static class Builder {
        private String hmdbBaseUrl = DEFAULT_HMDB_BASE_URL;
        private String keggBaseUrl = DEFAULT_KEGG_BASE_URL;
        private Duration searchTimeout = DEFAULT_SEARCH_TIMEOUT;
        private Duration detailTimeout = DEFAULT_DETAIL_TIMEOUT;
        private Duration hmdbDelay = DEFAULT_HMDB_DELAY;
        private Duration keggDelay = DEFAULT_KEGG_DELAY;
        private boolean keggPartialResults;

        public Builder hmdbBaseUrl(String hmdbBaseUrl) {
            this.hmdbBaseUrl = hmdbBaseUrl;
            return this;
        }

        public Builder keggBaseUrl(String keggBaseUrl) {
            this.keggBaseUrl = keggBaseUrl;
            return this;
        }

        public Builder searchTimeout(Duration searchTimeout) {
            this.searchTimeout = searchTimeout;
            return this;
        }

        public Builder detailTimeout(Duration detailTimeout) {
            this.detailTimeout = detailTimeout;
            return this;
        }

        public Builder hmdbDelay(Duration hmdbDelay) {
            this.hmdbDelay = hmdbDelay;
            return this;
        }

        public Builder keggDelay(Duration keggDelay) {
            this.keggDelay = keggDelay;
            return this;
        }

        public Builder keggPartialResults(boolean keggPartialResults) {
            this.keggPartialResults = keggPartialResults;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(hmdbBaseUrl, keggBaseUrl, searchTimeout, detailTimeout,
                    hmdbDelay, keggDelay, keggPartialResults);
        }
    }
}
