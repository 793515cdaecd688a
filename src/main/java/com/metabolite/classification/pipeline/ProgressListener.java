package com.metabolite.classification.pipeline;

/**
 * Receives observational progress updates from a pipeline run.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Called to report progress.
     *
     * @param fraction overall progress in [0, 1]
     * @param message  what the pipeline is doing
     */
    void onProgress(double fraction, String message);

    /**
     * A no-op progress listener.
     */
    ProgressListener NOOP = (fraction, message) -> {};
}
