package com.metabolite.classification.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Static politeness delay: at least {@code delay} elapses between the end of one
 * request and the start of the next. The first request is never delayed.
 *
 * <p>Not thread-safe; the pipeline issues requests from a single thread.</p>
 */
public class FixedDelayRateLimitPolicy implements RateLimitPolicy {
    private static final Logger log = LoggerFactory.getLogger(FixedDelayRateLimitPolicy.class);

    private final Duration delay;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private long lastReleaseNanos;
    private boolean released;

    public FixedDelayRateLimitPolicy(Duration delay) {
        this(delay, Sleeper.SYSTEM, System::nanoTime);
    }

    public FixedDelayRateLimitPolicy(Duration delay, Sleeper sleeper, LongSupplier nanoClock) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        this.delay = delay;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    @Override
    public void acquire() throws InterruptedException {
        if (!released || delay.isZero()) {
            return;
        }
        Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - lastReleaseNanos);
        Duration remaining = delay.minus(elapsed);
        if (!remaining.isNegative() && !remaining.isZero()) {
            log.trace("ratelimit.wait remaining={}", remaining);
            sleeper.sleep(remaining);
        }
    }

    @Override
    public void release() {
        lastReleaseNanos = nanoClock.getAsLong();
        released = true;
    }

    public Duration getDelay() {
        return delay;
    }
}
