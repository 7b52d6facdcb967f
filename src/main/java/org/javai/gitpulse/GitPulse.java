package org.javai.gitpulse;

import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.clock.Sleeper;
import org.javai.gitpulse.clock.Ticker;
import org.javai.gitpulse.compare.RepositoryComparator;
import org.javai.gitpulse.compare.RepositoryMetricsFetcher;
import org.javai.gitpulse.config.GitPulseConfig;
import org.javai.gitpulse.http.HttpTransport;
import org.javai.gitpulse.http.JdkHttpTransport;
import org.javai.gitpulse.ops.Log4jOpReporter;
import org.javai.gitpulse.ops.MetricsOpReporter;
import org.javai.gitpulse.ops.OpReporter;
import org.javai.gitpulse.ratelimit.RateBudget;
import org.javai.gitpulse.ratelimit.RollingWindowRateBudget;
import org.javai.gitpulse.tools.BranchAnalysisTool;
import org.javai.gitpulse.tools.CommitStatisticsTool;
import org.javai.gitpulse.tools.CompareRepositoriesTool;
import org.javai.gitpulse.tools.ContributorsTool;
import org.javai.gitpulse.tools.DeveloperActivityTool;
import org.javai.gitpulse.tools.IssuesSummaryTool;
import org.javai.gitpulse.tools.ReleasesSummaryTool;
import org.javai.gitpulse.tools.RepositoryHealthTool;
import org.javai.gitpulse.tools.TagsAnalysisTool;
import org.javai.gitpulse.tools.VersionComparisonTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the library together for one process: a single transport, a single {@link RateBudget}
 * shared by every call, the reporters, the resilient client and the operations built on it.
 *
 * <pre>{@code
 * try (GitPulse gitPulse = GitPulse.create(GitPulseConfig.resolve())) {
 *     ToolResult health = gitPulse.repositoryHealth()
 *         .getRepositoryHealth("octocat", "hello-world", ProgressSink.noOp());
 * }
 * }</pre>
 *
 * <p>Closing shuts down the comparison thread pool; calls in flight are allowed to finish.
 */
public final class GitPulse implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GitPulse.class);

    private final GitPulseConfig config;
    private final RateBudget rateBudget;
    private final ResilientApiClient client;
    private final ExecutorService fanOutPool;
    private final RepositoryHealthTool repositoryHealth;
    private final IssuesSummaryTool issuesSummary;
    private final ContributorsTool contributors;
    private final CompareRepositoriesTool compareRepositories;
    private final CommitStatisticsTool commitStatistics;
    private final BranchAnalysisTool branchAnalysis;
    private final DeveloperActivityTool developerActivity;
    private final ReleasesSummaryTool releasesSummary;
    private final TagsAnalysisTool tagsAnalysis;
    private final VersionComparisonTool versionComparison;

    private GitPulse(Builder builder) {
        this.config = builder.config;
        HttpTransport transport = builder.transport != null
                ? builder.transport
                : new JdkHttpTransport(config.baseUrl(), config.token(), config.userAgent(), config.timeout());
        OpReporter reporter = builder.reporter != null
                ? builder.reporter
                : OpReporter.composite(new Log4jOpReporter(), new MetricsOpReporter(config.metricsNamespace()));

        this.rateBudget = new RollingWindowRateBudget(config.ratePermits(), config.rateWindow(),
                builder.ticker, builder.sleeper);
        this.client = ResilientApiClient.builder(transport)
                .rateBudget(rateBudget)
                .reporter(reporter)
                .sleeper(builder.sleeper)
                .ticker(builder.ticker)
                .maxAttempts(config.maxAttempts())
                .baseDelay(config.baseDelay())
                .maxDelay(config.maxDelay())
                .retriableStatuses(config.retriableStatuses())
                .quotaLowWaterMark(config.quotaLowWaterMark())
                .build();

        JsonPayloads json = new JsonPayloads();
        RepositoryMetricsFetcher fetcher = new RepositoryMetricsFetcher(client, json, builder.clock);
        this.fanOutPool = Executors.newFixedThreadPool(config.fanOutThreads(), new FanOutThreadFactory());
        RepositoryComparator comparator = new RepositoryComparator(fetcher, fanOutPool, builder.clock);

        boolean credentialPresent = config.hasToken();
        this.repositoryHealth = new RepositoryHealthTool(client, json, credentialPresent, fetcher);
        this.issuesSummary = new IssuesSummaryTool(client, json, credentialPresent);
        this.contributors = new ContributorsTool(client, json, credentialPresent);
        this.compareRepositories = new CompareRepositoriesTool(client, json, credentialPresent, comparator);
        this.commitStatistics = new CommitStatisticsTool(client, json, credentialPresent, builder.clock);
        this.branchAnalysis = new BranchAnalysisTool(client, json, credentialPresent, builder.clock);
        this.developerActivity = new DeveloperActivityTool(client, json, credentialPresent);
        this.releasesSummary = new ReleasesSummaryTool(client, json, credentialPresent);
        this.tagsAnalysis = new TagsAnalysisTool(client, json, credentialPresent);
        this.versionComparison = new VersionComparisonTool(client, json, credentialPresent);

        if (!credentialPresent) {
            log.warn("No GitHub token configured; operations will fail with {}", ErrorKind.AUTHENTICATION.code());
        }
        log.info("GitPulse ready: {}", config);
    }

    public static GitPulse create(GitPulseConfig config) {
        return builder(config).build();
    }

    public static Builder builder(GitPulseConfig config) {
        return new Builder(config);
    }

    public GitPulseConfig config() {
        return config;
    }

    public RateBudget rateBudget() {
        return rateBudget;
    }

    public ResilientApiClient client() {
        return client;
    }

    public RepositoryHealthTool repositoryHealth() {
        return repositoryHealth;
    }

    public IssuesSummaryTool issuesSummary() {
        return issuesSummary;
    }

    public ContributorsTool contributors() {
        return contributors;
    }

    public CompareRepositoriesTool compareRepositories() {
        return compareRepositories;
    }

    public CommitStatisticsTool commitStatistics() {
        return commitStatistics;
    }

    public BranchAnalysisTool branchAnalysis() {
        return branchAnalysis;
    }

    public DeveloperActivityTool developerActivity() {
        return developerActivity;
    }

    public ReleasesSummaryTool releasesSummary() {
        return releasesSummary;
    }

    public TagsAnalysisTool tagsAnalysis() {
        return tagsAnalysis;
    }

    public VersionComparisonTool versionComparison() {
        return versionComparison;
    }

    @Override
    public void close() {
        fanOutPool.shutdown();
        try {
            if (!fanOutPool.awaitTermination(config.timeout().toMillis() * config.maxAttempts(), TimeUnit.MILLISECONDS)) {
                log.warn("Comparison pool did not terminate in time; interrupting remaining tasks");
                fanOutPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fanOutPool.shutdownNow();
        }
    }

    public static final class Builder {

        private final GitPulseConfig config;
        private HttpTransport transport;
        private OpReporter reporter;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.system();
        private Ticker ticker = Ticker.system();

        private Builder(GitPulseConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        /**
         * Replaces the HTTP transport built from the configuration.
         */
        public Builder transport(HttpTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
            return this;
        }

        /**
         * Replaces the default Log4j and metrics reporters.
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
            return this;
        }

        public GitPulse build() {
            return new GitPulse(this);
        }
    }

    private static final class FanOutThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "gitpulse-fanout-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
