package org.javai.gitpulse.clock;

import java.time.Duration;

/**
 * Suspends the calling thread. Injected wherever the library waits, so tests can record
 * delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        };
    }
}
