package org.javai.gitpulse.ratelimit;

import org.javai.gitpulse.clock.Sleeper;
import org.javai.gitpulse.clock.Ticker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Grants at most {@code permits} requests in any time window of length {@code window}.
 *
 * <p>Callers reserve a slot under a lock, in arrival order, then wait for that slot outside
 * the lock. The reservation log keeps the last {@code permits} slots; the next slot is the
 * later of "now" and "oldest slot + window", so slot {@code k + permits} is always at least
 * {@code window} after slot {@code k}.
 *
 * <p>A caller interrupted while waiting forfeits its slot. The slot still counts against the
 * window.
 */
public final class RollingWindowRateBudget implements RateBudget {

    private final int permits;
    private final long windowNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> slots = new ArrayDeque<>();

    public RollingWindowRateBudget(int permits, Duration window) {
        this(permits, window, Ticker.system(), Sleeper.system());
    }

    public RollingWindowRateBudget(int permits, Duration window, Ticker ticker, Sleeper sleeper) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1, was: " + permits);
        }
        Objects.requireNonNull(window, "window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, was: " + window);
        }
        this.permits = permits;
        this.windowNanos = window.toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public long acquire() throws InterruptedException {
        long slot = reserve();
        long wait = slot - ticker.nanos();
        if (wait > 0) {
            sleeper.sleep(Duration.ofNanos(wait));
        }
        return slot;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            long now = ticker.nanos();
            if (slots.size() == permits && slots.peekFirst() + windowNanos > now) {
                return false;
            }
            record(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int permits() {
        return permits;
    }

    public Duration window() {
        return Duration.ofNanos(windowNanos);
    }

    private long reserve() {
        lock.lock();
        try {
            long now = ticker.nanos();
            long slot = slots.size() < permits ? now : Math.max(now, slots.peekFirst() + windowNanos);
            record(slot);
            return slot;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void record(long slot) {
        if (slots.size() == permits) {
            slots.pollFirst();
        }
        slots.addLast(slot);
    }
}
