package org.javai.gitpulse.compare;

import com.fasterxml.jackson.databind.JsonNode;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.GitHubDates;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.http.ApiRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the metrics of one repository through up to three sequential calls:
 * repository metadata, the open pull request count and the latest commit.
 *
 * <p>Only the metadata call is essential. When the pull request count or the latest commit
 * cannot be fetched, the metrics fall back to 0 pull requests and an unknown commit age, and a
 * warning goes to the sink. Calls that feed none of the requested metrics are skipped.
 */
public class RepositoryMetricsFetcher {

    private static final Logger log = LoggerFactory.getLogger(RepositoryMetricsFetcher.class);

    private static final Set<ComparisonMetric> NEED_PULL_REQUESTS =
            EnumSet.of(ComparisonMetric.OPEN_ISSUES, ComparisonMetric.OPEN_PRS);

    private final ResilientApiClient client;
    private final JsonPayloads json;
    private final Clock clock;

    public RepositoryMetricsFetcher(ResilientApiClient client, JsonPayloads json, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.json = Objects.requireNonNull(json, "json must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Fetches every metric.
     */
    public CallOutcome<RepositoryMetrics> fetch(ComparisonTarget target, ProgressSink sink) {
        return fetch(target, EnumSet.allOf(ComparisonMetric.class), sink);
    }

    public CallOutcome<RepositoryMetrics> fetch(ComparisonTarget target, Collection<ComparisonMetric> metrics,
                                                ProgressSink sink) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        ProgressSink progress = ProgressSink.guarded(Objects.requireNonNull(sink, "sink must not be null"));

        ApiRequest metadataRequest = ApiRequest.get(target.apiPath());
        return client.execute(metadataRequest, progress)
                .flatMap(response -> json.readObject(metadataRequest, response))
                .map(metadata -> assemble(target, metadata, metrics, progress));
    }

    private RepositoryMetrics assemble(ComparisonTarget target, JsonNode metadata,
                                       Collection<ComparisonMetric> metrics, ProgressSink progress) {
        long openPullRequests = metrics.stream().anyMatch(NEED_PULL_REQUESTS::contains)
                ? countOpenPullRequests(target, progress)
                : 0;
        Instant lastCommitDate = metrics.contains(ComparisonMetric.LAST_COMMIT_AGE)
                ? latestCommitDate(target, progress)
                : null;

        long openIssuesAndPulls = metadata.path("open_issues_count").asLong(0);
        return new RepositoryMetrics(
                target.owner(),
                target.repo(),
                Math.max(0, openIssuesAndPulls - openPullRequests),
                openPullRequests,
                metadata.path("stargazers_count").asLong(0),
                metadata.path("forks_count").asLong(0),
                metadata.path("watchers_count").asLong(0),
                lastCommitDate,
                lastCommitDate == null ? null : GitHubDates.daysSince(lastCommitDate, clock),
                textOrNull(metadata.get("language")),
                metadata.path("archived").asBoolean(false),
                metadata.path("disabled").asBoolean(false),
                GitHubDates.parse(textOrNull(metadata.get("pushed_at"))));
    }

    long countOpenPullRequests(ComparisonTarget target, ProgressSink progress) {
        ApiRequest request = ApiRequest.get("/search/issues", Map.of(
                "q", "repo:" + target.key() + " type:pr state:open",
                "per_page", "1"));
        CallOutcome<JsonNode> outcome = client.execute(request, progress)
                .flatMap(response -> json.readObject(request, response));
        if (outcome instanceof CallOutcome.Fail<JsonNode> fail) {
            degraded(target, "open pull requests", fail.failure(), progress);
            return 0;
        }
        return Math.max(0, outcome.getOrThrow().path("total_count").asLong(0));
    }

    Instant latestCommitDate(ComparisonTarget target, ProgressSink progress) {
        ApiRequest request = ApiRequest.get(target.apiPath() + "/commits", Map.of("per_page", "1"));
        CallOutcome<JsonNode> outcome = client.execute(request, progress)
                .flatMap(response -> json.readArray(request, response));
        if (outcome instanceof CallOutcome.Fail<JsonNode> fail) {
            degraded(target, "latest commit", fail.failure(), progress);
            return null;
        }
        JsonNode commits = outcome.getOrThrow();
        if (commits.isEmpty()) {
            return null;
        }
        return GitHubDates.parse(textOrNull(commits.get(0).path("commit").path("author").get("date")));
    }

    private static void degraded(ComparisonTarget target, String what, ApiFailure failure, ProgressSink progress) {
        log.warn("Could not fetch {} for {}: {} ({})", what, target.key(), failure.message(), failure.code());
        progress.info("Could not fetch " + what + " for " + target.key() + ", continuing without it");
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
