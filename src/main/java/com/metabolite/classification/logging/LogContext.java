package com.metabolite.classification.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLookup("glucose", "HMDB")) {
 *     log.info("hmdb.found hmdbId={}", hmdbId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String METABOLITE = "metabolite";
    public static final String SOURCE = "source";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context spanning one pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    /**
     * Creates a log context for one metabolite against one source.
     */
    public static LogContext forLookup(String metaboliteName, String source) {
        LogContext ctx = new LogContext();
        ctx.put(METABOLITE, metaboliteName);
        ctx.put(SOURCE, source);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
