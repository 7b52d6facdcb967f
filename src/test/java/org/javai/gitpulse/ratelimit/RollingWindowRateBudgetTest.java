package org.javai.gitpulse.ratelimit;

import org.javai.gitpulse.clock.FakeTicker;
import org.javai.gitpulse.clock.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class RollingWindowRateBudgetTest {

    private static final long SECOND = Duration.ofSeconds(1).toNanos();

    @Test
    void acquire_withinBudget_grantsImmediately() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        RecordingSleeper sleeper = new RecordingSleeper(ticker);
        RollingWindowRateBudget budget = new RollingWindowRateBudget(3, Duration.ofSeconds(1), ticker, sleeper);

        budget.acquire();
        budget.acquire();
        budget.acquire();

        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void acquire_beyondBudget_waitsForOldestGrantToLeaveWindow() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        RecordingSleeper sleeper = new RecordingSleeper(ticker);
        RollingWindowRateBudget budget = new RollingWindowRateBudget(1, Duration.ofSeconds(1), ticker, sleeper);

        long first = budget.acquire();
        ticker.advance(Duration.ofMillis(300));
        long second = budget.acquire();

        assertThat(second - first).isEqualTo(SECOND);
        assertThat(sleeper.sleepMillis()).containsExactly(700L);
    }

    @Test
    void acquire_afterIdleWindow_grantsImmediately() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        RecordingSleeper sleeper = new RecordingSleeper(ticker);
        RollingWindowRateBudget budget = new RollingWindowRateBudget(1, Duration.ofSeconds(1), ticker, sleeper);

        budget.acquire();
        ticker.advance(Duration.ofSeconds(5));
        budget.acquire();

        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void acquire_sequentialBurst_neverExceedsPermitsPerWindow() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        RecordingSleeper sleeper = new RecordingSleeper(ticker);
        RollingWindowRateBudget budget = new RollingWindowRateBudget(2, Duration.ofSeconds(1), ticker, sleeper);

        List<Long> grants = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            grants.add(budget.acquire());
            ticker.advance(Duration.ofMillis(150));
        }

        assertAtMostPermitsPerWindow(grants, 2, SECOND);
    }

    @Test
    void acquire_concurrentCallers_neverExceedPermitsPerWindow() throws Exception {
        FakeTicker ticker = new FakeTicker();
        RollingWindowRateBudget budget = new RollingWindowRateBudget(3, Duration.ofSeconds(1), ticker, duration -> {});

        int threads = 8;
        int perThread = 5;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> mine = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        mine.add(budget.acquire());
                    }
                    return mine;
                }));
            }
            start.countDown();

            List<Long> grants = new ArrayList<>();
            for (Future<List<Long>> future : futures) {
                grants.addAll(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(grants).hasSize(threads * perThread);
            assertAtMostPermitsPerWindow(grants, 3, SECOND);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void tryAcquire_refusesWhenWindowIsFull() {
        FakeTicker ticker = new FakeTicker();
        RollingWindowRateBudget budget = new RollingWindowRateBudget(1, Duration.ofSeconds(1), ticker, duration -> {});

        assertThat(budget.tryAcquire()).isTrue();
        assertThat(budget.tryAcquire()).isFalse();

        ticker.advance(Duration.ofSeconds(1));
        assertThat(budget.tryAcquire()).isTrue();
    }

    @Test
    void acquire_interruptedWhileWaiting_propagates() throws InterruptedException {
        FakeTicker ticker = new FakeTicker();
        RollingWindowRateBudget budget = new RollingWindowRateBudget(1, Duration.ofSeconds(1), ticker, duration -> {
            throw new InterruptedException("stop");
        });

        budget.acquire();

        assertThatThrownBy(budget::acquire).isInstanceOf(InterruptedException.class);
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RollingWindowRateBudget(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RollingWindowRateBudget(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertAtMostPermitsPerWindow(List<Long> grants, int permits, long windowNanos) {
        List<Long> sorted = new ArrayList<>(grants);
        Collections.sort(sorted);
        for (int i = 0; i + permits < sorted.size(); i++) {
            assertThat(sorted.get(i + permits) - sorted.get(i))
                    .as("grants %d and %d", i, i + permits)
                    .isGreaterThanOrEqualTo(windowNanos);
        }
    }
}
