package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compares several repositories by fetching their metrics concurrently.
 *
 * <p>Each target runs as its own task on the supplied executor. Every failure of a task, whether
 * a failed call or a defect, is captured into that target's slot; the other targets are never
 * cancelled. The comparison returns only after every task finished, and ranks the successes.
 *
 * <p>Targets share the client's rate budget, so concurrency shortens waiting on upstream
 * latency but never raises the outbound request rate.
 */
public class RepositoryComparator {

    private static final Logger log = LoggerFactory.getLogger(RepositoryComparator.class);

    static final String OPERATION = "compare_repositories";
    public static final int MIN_TARGETS = 2;
    public static final int MAX_TARGETS = 5;

    private final RepositoryMetricsFetcher fetcher;
    private final ExecutorService executor;
    private final Clock clock;

    public RepositoryComparator(RepositoryMetricsFetcher fetcher, ExecutorService executor, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Compares the targets on the named metrics.
     *
     * @param targets 2 to 5 distinct repositories
     * @param metricNames Metric wire names, or null/empty for all metrics
     * @param sink Receives progress; called from pool threads as targets complete
     * @return The aggregate, with one result per target in input order
     * @throws ApiCallException with kind {@code VALIDATION}, before any call is made, when the
     *                          targets or metric names are invalid
     */
    public ComparisonResult compare(List<ComparisonTarget> targets, Collection<String> metricNames, ProgressSink sink) {
        validateTargets(targets);
        List<ComparisonMetric> metrics = ComparisonMetric.resolve(metricNames);
        ProgressSink progress = ProgressSink.guarded(Objects.requireNonNull(sink, "sink must not be null"));

        int total = targets.size();
        progress.info("Comparing " + total + " repositories in parallel");
        log.debug("Comparing {} on {}", targets, metrics);

        List<TargetTask> tasks = new ArrayList<>(total);
        List<CompletableFuture<TargetResult>> futures = new ArrayList<>(total);
        AtomicInteger done = new AtomicInteger();
        for (ComparisonTarget target : targets) {
            TargetTask task = new TargetTask(target);
            tasks.add(task);
            futures.add(submit(task, metrics, progress).handle((result, error) -> {
                TargetResult settled = error == null ? result : abandon(task, error, progress);
                progress.progress(done.incrementAndGet(), total);
                return settled;
            }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<TargetResult> results = tasks.stream().map(TargetTask::result).toList();
        ComparisonResult comparison = ComparisonResult.of(targets, clock.instant(), metrics, results);
        int failed = comparison.failures().size();
        if (failed > 0) {
            log.warn("Comparison finished with {} of {} repositories failed", failed, total);
        }
        progress.info("Comparison finished: " + (total - failed) + " of " + total + " repositories succeeded");
        return comparison;
    }

    private CompletableFuture<TargetResult> submit(TargetTask task, List<ComparisonMetric> metrics,
                                                   ProgressSink progress) {
        try {
            return CompletableFuture.supplyAsync(() -> run(task, metrics, progress), executor);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule {}", task.target().key(), e);
            progress.error("Failed to fetch " + task.target().key() + ": comparison pool is not accepting work");
            return CompletableFuture.completedFuture(task.fail(ApiFailure.unexpected(OPERATION,
                    "Could not schedule " + task.target().key() + ": " + e, e)));
        }
    }

    /**
     * Settles a task whose future ended exceptionally, e.g. with an {@link Error} that
     * {@link #run} does not catch.
     */
    private TargetResult abandon(TargetTask task, Throwable error, ProgressSink progress) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (task.state().isTerminal()) {
            log.warn("{} finished before its task failed", task.target().key(), cause);
            return task.result();
        }
        log.error("Task for {} ended abnormally", task.target().key(), cause);
        progress.error("Failed to fetch " + task.target().key() + ": " + cause);
        return task.fail(ApiFailure.unexpected(OPERATION,
                "Unexpected error fetching " + task.target().key() + ": " + cause, cause));
    }

    private TargetResult run(TargetTask task, List<ComparisonMetric> metrics, ProgressSink progress) {
        ComparisonTarget target = task.target();
        try {
            task.start();
            CallOutcome<RepositoryMetrics> outcome = fetcher.fetch(target, metrics, progress);
            if (outcome instanceof CallOutcome.Fail<RepositoryMetrics> fail) {
                progress.error("Failed to fetch " + target.key() + ": " + fail.failure().userMessage());
                return task.fail(fail.failure());
            }
            return task.succeed(outcome.getOrThrow());
        } catch (RuntimeException e) {
            log.error("Unexpected error comparing {}", target.key(), e);
            progress.error("Failed to fetch " + target.key() + ": " + e);
            return task.fail(ApiFailure.unexpected(OPERATION,
                    "Unexpected error fetching " + target.key() + ": " + e, e));
        }
    }

    static void validateTargets(List<ComparisonTarget> targets) {
        if (targets == null || targets.size() < MIN_TARGETS) {
            throw ApiCallException.validation(OPERATION,
                    "At least " + MIN_TARGETS + " repositories are required for a comparison");
        }
        if (targets.size() > MAX_TARGETS) {
            throw ApiCallException.validation(OPERATION,
                    "At most " + MAX_TARGETS + " repositories can be compared, got " + targets.size());
        }
        Set<String> seen = new HashSet<>();
        for (ComparisonTarget target : targets) {
            if (target == null) {
                throw ApiCallException.validation(OPERATION, "Repository entries must not be null");
            }
            if (!seen.add(target.identity())) {
                throw ApiCallException.validation(OPERATION, "Repository listed twice: " + target.key());
            }
        }
    }
}
