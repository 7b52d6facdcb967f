package org.javai.gitpulse.compare;

import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.RecordingProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.http.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.javai.gitpulse.http.GitHubFixtures.*;
import static org.javai.gitpulse.http.ScriptedTransport.*;

class RepositoryMetricsFetcherTest {

    private static final ComparisonTarget TARGET = new ComparisonTarget("octocat", "hello-world");
    private static final String REPO = "/repos/octocat/hello-world";
    private static final String COMMITS = REPO + "/commits";
    private static final String SEARCH = "/search/issues";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-11T12:00:00Z"), ZoneOffset.UTC);

    private ScriptedTransport transport;
    private RecordingProgressSink sink;
    private RepositoryMetricsFetcher fetcher;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sink = new RecordingProgressSink();
        ResilientApiClient client = ResilientApiClient.builder(transport).sleeper(duration -> {}).build();
        fetcher = new RepositoryMetricsFetcher(client, new JsonPayloads(), CLOCK);
    }

    @Test
    void fetch_combinesMetadataPullRequestsAndLatestCommit() {
        transport.on(REPO, json(repository(15, 100, 20)))
                .on(SEARCH, json(searchCount(5)))
                .on(COMMITS, json(commitsLatest("2024-03-08T12:00:00Z")));

        RepositoryMetrics metrics = fetcher.fetch(TARGET, sink).getOrThrow();

        assertThat(metrics.openIssues()).isEqualTo(10);
        assertThat(metrics.openPullRequests()).isEqualTo(5);
        assertThat(metrics.stars()).isEqualTo(100);
        assertThat(metrics.forks()).isEqualTo(20);
        assertThat(metrics.watchers()).isEqualTo(100);
        assertThat(metrics.lastCommitDate()).isEqualTo(Instant.parse("2024-03-08T12:00:00Z"));
        assertThat(metrics.lastCommitAgeDays()).isEqualTo(3L);
        assertThat(metrics.language()).isEqualTo("Java");
        assertThat(metrics.pushedAt()).isEqualTo(Instant.parse("2024-03-10T08:00:00Z"));
    }

    @Test
    void fetch_searchesOpenPullRequestsOfTheRepository() {
        transport.on(REPO, json(repository(1, 1, 1)))
                .on(SEARCH, json(searchCount(0)))
                .on(COMMITS, json("[]"));

        fetcher.fetch(TARGET, sink);

        assertThat(transport.requests())
                .filteredOn(request -> request.path().equals(SEARCH))
                .singleElement()
                .satisfies(request -> {
                    assertThat(request.query()).containsEntry("q", "repo:octocat/hello-world type:pr state:open");
                    assertThat(request.query()).containsEntry("per_page", "1");
                });
    }

    @Test
    void fetch_pullRequestCountUnavailable_degradesToZero() {
        transport.on(REPO, json(repository(15, 1, 1)))
                .on(SEARCH, status(500))
                .on(COMMITS, json(commitsLatest("2024-03-10T12:00:00Z")));

        CallOutcome<RepositoryMetrics> outcome = fetcher.fetch(TARGET, sink);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getOrThrow().openPullRequests()).isZero();
        assertThat(outcome.getOrThrow().openIssues()).isEqualTo(15);
        assertThat(sink.infos).anyMatch(message -> message.contains("open pull requests"));
    }

    @Test
    void fetch_latestCommitUnavailable_leavesAgeUnknown() {
        transport.on(REPO, json(repository(3, 1, 1)))
                .on(SEARCH, json(searchCount(1)))
                .on(COMMITS, status(409));

        RepositoryMetrics metrics = fetcher.fetch(TARGET, sink).getOrThrow();

        assertThat(metrics.lastCommitDate()).isNull();
        assertThat(metrics.lastCommitAgeDays()).isNull();
        assertThat(metrics.value(ComparisonMetric.LAST_COMMIT_AGE)).isEmpty();
    }

    @Test
    void fetch_emptyRepository_hasNoCommitAge() {
        transport.on(REPO, json(repository(0, 0, 0)))
                .on(SEARCH, json(searchCount(0)))
                .on(COMMITS, json("[]"));

        assertThat(fetcher.fetch(TARGET, sink).getOrThrow().lastCommitAgeDays()).isNull();
    }

    @Test
    void fetch_moreOpenPullRequestsThanIssueCount_neverGoesNegative() {
        transport.on(REPO, json(repository(2, 0, 0)))
                .on(SEARCH, json(searchCount(7)))
                .on(COMMITS, json("[]"));

        assertThat(fetcher.fetch(TARGET, sink).getOrThrow().openIssues()).isZero();
    }

    @Test
    void fetch_metadataNotFound_failsTarget() {
        transport.on(REPO, status(404));

        CallOutcome<RepositoryMetrics> outcome = fetcher.fetch(TARGET, sink);

        assertThat(outcome.failureOrNull().kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(transport.requestsTo(SEARCH)).isZero();
        assertThat(transport.requestsTo(COMMITS)).isZero();
    }

    @Test
    void fetch_onlyPopularityMetrics_skipsPullRequestAndCommitCalls() {
        transport.on(REPO, json(repository(4, 9, 2)));

        RepositoryMetrics metrics = fetcher.fetch(TARGET, List.of(ComparisonMetric.STARS, ComparisonMetric.FORKS), sink)
                .getOrThrow();

        assertThat(metrics.stars()).isEqualTo(9);
        assertThat(transport.requests()).hasSize(1);
    }
}
