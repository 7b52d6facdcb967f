package org.javai.gitpulse.ratelimit;

/**
 * Grants permission to send requests upstream. One instance is shared by every call in a
 * process, so the aggregate outbound rate is bounded no matter how many calls are in flight.
 */
public interface RateBudget {

    /**
     * Blocks until a permit is granted.
     *
     * @return the ticker reading, in nanoseconds, at which the permit became valid
     * @throws InterruptedException if interrupted while waiting; no request may be sent then
     */
    long acquire() throws InterruptedException;

    /**
     * Grants a permit only if one is available right now.
     *
     * @return true if a permit was granted
     */
    boolean tryAcquire();

    /**
     * A budget that grants every request immediately.
     */
    static RateBudget unlimited() {
        return new RateBudget() {
            @Override
            public long acquire() {
                return System.nanoTime();
            }

            @Override
            public boolean tryAcquire() {
                return true;
            }
        };
    }
}
