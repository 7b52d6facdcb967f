package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.RecordingProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.compare.RepositoryComparator;
import org.javai.gitpulse.compare.RepositoryMetricsFetcher;
import org.javai.gitpulse.http.ScriptedTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.javai.gitpulse.http.GitHubFixtures.*;
import static org.javai.gitpulse.http.ScriptedTransport.*;

class CompareRepositoriesToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-11T12:00:00Z"), ZoneOffset.UTC);

    private ScriptedTransport transport;
    private RecordingProgressSink sink;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sink = new RecordingProgressSink();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void compareRepositories_reportsTableRankingsAndFailures() {
        transport.on("/repos/a/one", json(repository(5, 100, 10)))
                .on("/repos/b/two", json(repository(5, 300, 2)))
                .on("/repos/c/gone", status(404));

        ToolResult result = tool(true).compareRepositories(
                List.of(ComparisonTarget.parse("a/one"), ComparisonTarget.parse("b/two"), ComparisonTarget.parse("c/gone")),
                List.of("stars", "forks"), sink);

        JsonNode structured = result.structured();
        assertThat(structured.path("repositories")).hasSize(3);
        assertThat(structured.path("comparison_date").asText()).isEqualTo("2024-03-11T12:00:00Z");
        assertThat(structured.path("metrics").path("stars").path("a/one").asLong()).isEqualTo(100);
        assertThat(structured.path("metrics").path("stars").path("b/two").asLong()).isEqualTo(300);
        assertThat(structured.path("metrics").path("stars").has("c/gone")).isFalse();
        assertThat(structured.path("metrics").has("open_issues")).isFalse();
        assertThat(structured.path("summary").path("most_popular").asText()).isEqualTo("b/two");
        assertThat(structured.path("summary").path("most_forked").asText()).isEqualTo("a/one");
        assertThat(structured.path("summary").has("most_active")).isFalse();
        assertThat(structured.path("failures")).singleElement().satisfies(failure -> {
            assertThat(failure.path("repository").asText()).isEqualTo("c/gone");
            assertThat(failure.path("code").asText()).isEqualTo("not_found");
        });

        assertThat(result.meta())
                .containsEntry("operation", "compare_repositories")
                .containsEntry("repositories", List.of("a/one", "b/two", "c/gone"))
                .containsEntry("metrics_compared", List.of("stars", "forks"));
        assertThat(result.text())
                .contains("Stars:")
                .contains("  - b/two: 300")
                .contains("Not available:")
                .contains("  Most popular: b/two");
        assertThat(transport.requestsTo("/search/issues")).isZero();
    }

    @Test
    void compareRepositories_unknownCommitAge_rendersNoData() {
        transport.on("/repos/a/one", json(repository(0, 1, 1)))
                .on("/repos/a/one/commits", json("[]"))
                .on("/repos/b/two", json(repository(0, 1, 1)))
                .on("/repos/b/two/commits", json(commitsLatest("2024-03-09T12:00:00Z")));

        ToolResult result = tool(true).compareRepositories(
                List.of(ComparisonTarget.parse("a/one"), ComparisonTarget.parse("b/two")),
                List.of("last_commit_age"), sink);

        assertThat(result.structured().path("metrics").path("last_commit_age").path("a/one").isNull()).isTrue();
        assertThat(result.text()).contains("  - a/one: no data").contains("  - b/two: 2 days");
        assertThat(result.structured().path("summary").path("most_active").asText()).isEqualTo("b/two");
    }

    @Test
    void compareRepositories_tooFewTargets_isValidationError() {
        assertThatThrownBy(() -> tool(true).compareRepositories(
                List.of(ComparisonTarget.parse("a/one")), null, sink))
                .isInstanceOfSatisfying(ToolException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION);
                    assertThat(e.rpcCode()).isEqualTo(-32602);
                });
        assertThat(transport.requests()).isEmpty();
        assertThat(sink.errors).hasSize(1);
    }

    @Test
    void compareRepositories_withoutToken_failsBeforeAnyCall() {
        assertThatThrownBy(() -> tool(false).compareRepositories(
                List.of(ComparisonTarget.parse("a/one"), ComparisonTarget.parse("b/two")), null, sink))
                .isInstanceOfSatisfying(ToolException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.AUTHENTICATION));
        assertThat(transport.requests()).isEmpty();
    }

    private CompareRepositoriesTool tool(boolean credentialPresent) {
        ResilientApiClient client = ResilientApiClient.builder(transport).sleeper(duration -> {}).build();
        JsonPayloads json = new JsonPayloads();
        RepositoryComparator comparator = new RepositoryComparator(
                new RepositoryMetricsFetcher(client, json, CLOCK), executor, CLOCK);
        return new CompareRepositoriesTool(client, json, credentialPresent, comparator);
    }
}
