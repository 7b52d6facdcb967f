package org.javai.gitpulse.clock;

/**
 * A monotonic nanosecond time source.
 */
@FunctionalInterface
public interface Ticker {

    long nanos();

    static Ticker system() {
        return System::nanoTime;
    }
}
