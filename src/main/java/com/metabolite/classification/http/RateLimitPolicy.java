package com.metabolite.classification.http;

/**
 * Decides when the next request to a source may be issued.
 * {@link RateLimitedHttpClient} calls {@link #acquire()} before every request and
 * {@link #release()} once the request has finished, successful or not.
 */
public interface RateLimitPolicy {

    /**
     * Blocks until the next request is allowed.
     */
    void acquire() throws InterruptedException;

    /**
     * Records that the in-flight request has finished.
     */
    void release();

    /**
     * A policy that never waits.
     */
    static RateLimitPolicy none() {
        return NoDelay.INSTANCE;
    }

    enum NoDelay implements RateLimitPolicy {
        INSTANCE;

        @Override
        public void acquire() {
        }

        @Override
        public void release() {
        }
    }
}
