package com.metabolite.classification.pipeline;

import com.metabolite.classification.core.model.DataSource;
import com.metabolite.classification.core.model.HmdbRecord;
import com.metabolite.classification.core.model.KeggRecord;
import com.metabolite.classification.core.model.LookupResult;
import com.metabolite.classification.core.model.MergedRecord;
import com.metabolite.classification.core.model.ResultTable;
import com.metabolite.classification.hmdb.HmdbClassification;
import com.metabolite.classification.hmdb.HmdbFetcher;
import com.metabolite.classification.hmdb.HmdbResolver;
import com.metabolite.classification.http.FixedDelayRateLimitPolicy;
import com.metabolite.classification.http.HttpTransport;
import com.metabolite.classification.http.JdkHttpTransport;
import com.metabolite.classification.http.RateLimitPolicy;
import com.metabolite.classification.http.RateLimitedHttpClient;
import com.metabolite.classification.http.Sleeper;
import com.metabolite.classification.kegg.KeggCompoundInfo;
import com.metabolite.classification.kegg.KeggFetcher;
import com.metabolite.classification.kegg.KeggResolver;
import com.metabolite.classification.logging.LogContext;
import com.metabolite.classification.merge.RecordMerger;
import com.metabolite.classification.metrics.MetricsService;
import com.metabolite.classification.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives a list of metabolite names through resolution, retrieval, merge and classification.
 *
 * <p>Runs strictly sequentially: every HMDB lookup, then every KEGG lookup, then the
 * merge. Failures are recorded on the affected metabolite's status and never abort the
 * run, so the returned table always has one row per distinct input name.</p>
 *
 * <pre>
 * PipelineOrchestrator pipeline = PipelineOrchestrator.builder()
 *     .config(PipelineConfig.defaults())
 *     .build();
 *
 * ResultTable table = pipeline.run(List.of("Glucose", "Quercetin"), ProgressListener.NOOP);
 * </pre>
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final double HMDB_PROGRESS_OFFSET = 0.3;
    static final double KEGG_PROGRESS_OFFSET = 0.7;

    private final HmdbResolver hmdbResolver;
    private final HmdbFetcher hmdbFetcher;
    private final KeggResolver keggResolver;
    private final KeggFetcher keggFetcher;
    private final RecordMerger merger;
    private final MetricsService metricsService;
    private final boolean keggPartialResults;

    private PipelineOrchestrator(Builder builder) {
        PipelineConfig config = builder.config != null ? builder.config : PipelineConfig.defaults();
        HttpTransport transport = builder.transport != null ? builder.transport : new JdkHttpTransport();
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;

        RateLimitPolicy hmdbPolicy = builder.hmdbRateLimitPolicy != null
                ? builder.hmdbRateLimitPolicy
                : new FixedDelayRateLimitPolicy(config.hmdbDelay(), sleeper, System::nanoTime);
        RateLimitPolicy keggPolicy = builder.keggRateLimitPolicy != null
                ? builder.keggRateLimitPolicy
                : new FixedDelayRateLimitPolicy(config.keggDelay(), sleeper, System::nanoTime);

        RateLimitedHttpClient hmdbClient = new RateLimitedHttpClient(DataSource.HMDB.getLabel(), transport, hmdbPolicy);
        RateLimitedHttpClient keggClient = new RateLimitedHttpClient(DataSource.KEGG.getLabel(), transport, keggPolicy);

        this.hmdbResolver = new HmdbResolver(hmdbClient, config.hmdbBaseUrl(), config.searchTimeout());
        this.hmdbFetcher = new HmdbFetcher(hmdbClient, config.hmdbBaseUrl(), config.detailTimeout());
        this.keggResolver = new KeggResolver(keggClient, config.keggBaseUrl(), config.searchTimeout());
        this.keggFetcher = new KeggFetcher(keggClient, config.keggBaseUrl(), config.detailTimeout());
        this.merger = builder.merger != null ? builder.merger : new RecordMerger();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.keggPartialResults = config.keggPartialResults();
    }

    public ResultTable run(List<String> metaboliteNames) {
        return run(metaboliteNames, ProgressListener.NOOP);
    }

    /**
     * Runs the full pipeline.
     *
     * @param metaboliteNames names in input order, passed through unchanged; must not contain null
     * @param listener        optional progress listener
     * @return one row per distinct name, in first-occurrence order
     */
    public ResultTable run(List<String> metaboliteNames, ProgressListener listener) {
        Objects.requireNonNull(metaboliteNames, "metaboliteNames");
        for (String name : metaboliteNames) {
            Objects.requireNonNull(name, "metabolite names must not be null");
        }
        ProgressListener progress = listener != null ? listener : ProgressListener.NOOP;

        try (LogContext ctx = LogContext.forRun(LogContext.generateRunId())) {
            log.info("pipeline.started metabolites={}", metaboliteNames.size());
            metricsService.recordRunSize(metaboliteNames.size());

            Map<String, HmdbRecord> hmdbRecords = queryHmdb(metaboliteNames, progress);
            Map<String, KeggRecord> keggRecords = queryKegg(metaboliteNames, progress);

            ResultTable table = new ResultTable();
            for (String name : metaboliteNames) {
                MergedRecord record = merger.merge(name, hmdbRecords.get(name), keggRecords.get(name));
                table.put(record);
            }
            for (MergedRecord record : table.records()) {
                metricsService.incrementClassified(record.finalType());
            }

            report(progress, 1.0, "Query complete");
            log.info("pipeline.completed rows={}", table.size());
            return table;
        }
    }

    /**
     * Resolves and fetches every name against HMDB. Later duplicates overwrite earlier ones.
     */
    public Map<String, HmdbRecord> queryHmdb(List<String> metaboliteNames, ProgressListener progress) {
        Map<String, HmdbRecord> results = new HashMap<>();
        int total = metaboliteNames.size();
        for (int i = 0; i < total; i++) {
            String name = metaboliteNames.get(i);
            report(progress, (i + HMDB_PROGRESS_OFFSET) / total, "Querying HMDB: " + name);
            results.put(name, lookupHmdb(name));
        }
        return results;
    }

    /**
     * Resolves and fetches every name against KEGG. Later duplicates overwrite earlier ones.
     */
    public Map<String, KeggRecord> queryKegg(List<String> metaboliteNames, ProgressListener progress) {
        Map<String, KeggRecord> results = new HashMap<>();
        int total = metaboliteNames.size();
        for (int i = 0; i < total; i++) {
            String name = metaboliteNames.get(i);
            report(progress, (i + KEGG_PROGRESS_OFFSET) / total, "Querying KEGG: " + name);
            results.put(name, lookupKegg(name));
        }
        return results;
    }

    HmdbRecord lookupHmdb(String name) {
        try (LogContext ctx = LogContext.forLookup(name, DataSource.HMDB.getLabel())) {
            LookupResult<String> resolved = hmdbResolver.resolve(name);
            metricsService.recordResolution(DataSource.HMDB, resolved.error());
            if (!resolved.isFound()) {
                log.info("hmdb.not_found cause={} detail={}", resolved.error(), resolved.message());
                return HmdbRecord.idNotFound();
            }

            String hmdbId = resolved.value();
            long start = System.nanoTime();
            LookupResult<HmdbClassification> fetched = hmdbFetcher.fetch(hmdbId);
            metricsService.recordFetch(DataSource.HMDB, fetched.isFound(), Duration.ofNanos(System.nanoTime() - start));

            if (!fetched.isFound()) {
                log.warn("hmdb.fetch_failed hmdbId={} cause={} detail={}", hmdbId, fetched.error(), fetched.message());
                return HmdbRecord.error(fetched.message());
            }
            HmdbClassification c = fetched.value();
            log.info("hmdb.found hmdbId={} superClass='{}' pathways={}", hmdbId, c.superClass(), c.pathways().size());
            return HmdbRecord.found(hmdbId, c.superClass(), c.className(), c.subClass(), c.pathways());
        }
    }

    KeggRecord lookupKegg(String name) {
        try (LogContext ctx = LogContext.forLookup(name, DataSource.KEGG.getLabel())) {
            LookupResult<String> resolved = keggResolver.resolve(name);
            metricsService.recordResolution(DataSource.KEGG, resolved.error());
            if (!resolved.isFound()) {
                log.info("kegg.not_found cause={} detail={}", resolved.error(), resolved.message());
                return KeggRecord.idNotFound();
            }

            String keggId = resolved.value();
            long start = System.nanoTime();
            KeggCompoundInfo info = keggFetcher.fetch(keggId);
            metricsService.recordFetch(DataSource.KEGG, info.isComplete(), Duration.ofNanos(System.nanoTime() - start));

            KeggRecord record = info.toRecord(keggPartialResults);
            if (info.isComplete()) {
                log.info("kegg.found keggId={} type={} pathways={}", keggId, record.type(), record.pathways().size());
            } else {
                log.warn("kegg.fetch_failed keggId={} detailOk={} pathwaysOk={} detail={}",
                        keggId, info.detail().isFound(), info.pathways().isFound(), info.failureMessage());
            }
            return record;
        }
    }

    private static void report(ProgressListener progress, double fraction, String message) {
        try {
            progress.onProgress(fraction, message);
        } catch (RuntimeException e) {
            log.warn("pipeline.progress_listener_failed error={}", e.toString());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config;
        private HttpTransport transport;
        private Sleeper sleeper;
        private RateLimitPolicy hmdbRateLimitPolicy;
        private RateLimitPolicy keggRateLimitPolicy;
        private RecordMerger merger;
        private MetricsService metricsService;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Transport shared by both sources. Defaults to {@link JdkHttpTransport}.
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sleeper used by the default fixed-delay policies.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder hmdbRateLimitPolicy(RateLimitPolicy policy) {
            this.hmdbRateLimitPolicy = policy;
            return this;
        }

        public Builder keggRateLimitPolicy(RateLimitPolicy policy) {
            this.keggRateLimitPolicy = policy;
            return this;
        }

        public Builder merger(RecordMerger merger) {
            this.merger = merger;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public PipelineOrchestrator build() {
            return new PipelineOrchestrator(this);
        }
    }
}
