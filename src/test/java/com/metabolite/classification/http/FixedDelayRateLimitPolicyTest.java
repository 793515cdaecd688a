package com.metabolite.classification.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class FixedDelayRateLimitPolicyTest {

    private final AtomicLong clock = new AtomicLong(0);
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = duration -> {
        sleeps.add(duration);
        clock.addAndGet(duration.toNanos());
    };

    @Test
    @DisplayName("First request is not delayed")
    void firstRequestNotDelayed() throws InterruptedException {
        FixedDelayRateLimitPolicy policy = new FixedDelayRateLimitPolicy(Duration.ofSeconds(1), recordingSleeper, clock::get);

        policy.acquire();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Waits the full delay when the next request follows immediately")
    void waitsFullDelay() throws InterruptedException {
        FixedDelayRateLimitPolicy policy = new FixedDelayRateLimitPolicy(Duration.ofSeconds(1), recordingSleeper, clock::get);

        policy.acquire();
        policy.release();
        policy.acquire();

        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    @DisplayName("Only waits the remainder when time already passed")
    void waitsRemainder() throws InterruptedException {
        FixedDelayRateLimitPolicy policy = new FixedDelayRateLimitPolicy(Duration.ofMillis(500), recordingSleeper, clock::get);

        policy.acquire();
        policy.release();
        clock.addAndGet(Duration.ofMillis(200).toNanos());
        policy.acquire();

        assertEquals(List.of(Duration.ofMillis(300)), sleeps);
    }

    @Test
    @DisplayName("Does not wait once the delay has elapsed")
    void noWaitAfterDelay() throws InterruptedException {
        FixedDelayRateLimitPolicy policy = new FixedDelayRateLimitPolicy(Duration.ofMillis(500), recordingSleeper, clock::get);

        policy.acquire();
        policy.release();
        clock.addAndGet(Duration.ofSeconds(2).toNanos());
        policy.acquire();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Rejects a negative delay")
    void rejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> new FixedDelayRateLimitPolicy(Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("No-delay policy never sleeps")
    void noDelayPolicy() throws InterruptedException {
        RateLimitPolicy policy = RateLimitPolicy.none();
        policy.acquire();
        policy.release();
        policy.acquire();
        assertTrue(sleeps.isEmpty());
    }
}
