package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.RecordingProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.http.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;
import static org.javai.gitpulse.http.GitHubFixtures.*;
import static org.javai.gitpulse.http.ScriptedTransport.*;

class BranchAnalysisToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-11T12:00:00Z"), ZoneOffset.UTC);
    private static final String BRANCHES = "/repos/octocat/hello-world/branches";

    private ScriptedTransport transport;
    private RecordingProgressSink sink;
    private BranchAnalysisTool tool;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sink = new RecordingProgressSink();
        ResilientApiClient client = ResilientApiClient.builder(transport).sleeper(duration -> {}).build();
        tool = new BranchAnalysisTool(client, new JsonPayloads(), true, CLOCK);
    }

    @Test
    void getBranchAnalysis_splitsByLastCommitAge() {
        transport.on(BRANCHES, json(array(
                        branchListed("feature/login", "bbbbbbbbbb", false),
                        branchListed("main", "aaaaaaaaaa", true),
                        branchListed("old", "cccccccccc", false),
                        branchListed("mystery", "dddddddddd", false))))
                .on(BRANCHES + "/feature/login", json(branchDetails("feature/login", "bbbbbbbbbb", "2024-03-01T12:00:00Z", false)))
                .on(BRANCHES + "/main", json(branchDetails("main", "aaaaaaaaaa", "2024-03-10T12:00:00Z", true)))
                .on(BRANCHES + "/old", json(branchDetails("old", "cccccccccc", "2023-01-01T00:00:00Z", false)))
                .on(BRANCHES + "/mystery", status(404));

        ToolResult result = tool.getBranchAnalysis("octocat", "hello-world", 90, sink);

        JsonNode analysis = result.structured();
        assertThat(analysis.path("total_branches").asInt()).isEqualTo(4);
        assertThat(analysis.path("active_branches_count").asInt()).isEqualTo(2);
        assertThat(analysis.path("inactive_branches_count").asInt()).isEqualTo(1);
        assertThat(analysis.path("protected_branches_count").asInt()).isEqualTo(1);
        assertThat(analysis.path("active_branches")).extracting(branch -> branch.path("name").asText())
                .containsExactly("main", "feature/login");
        JsonNode main = analysis.path("active_branches").get(0);
        assertThat(main.path("last_commit_days_ago").asLong()).isEqualTo(1);
        assertThat(main.path("sha").asText()).isEqualTo("aaaaaaa");
        assertThat(main.path("protected").asBoolean()).isTrue();
        assertThat(analysis.path("inactive_branches").get(0).path("name").asText()).isEqualTo("old");
        assertThat(analysis.path("protected_branches")).extracting(JsonNode::asText).containsExactly("main");
        assertThat(result.meta()).containsEntry("days_threshold", 90);
        assertThat(result.text()).contains("main [protected] (last commit 1 days ago)");
    }

    @Test
    void getBranchAnalysis_looksUpDetailsForTheFirstTwentyBranchesOnly() {
        String[] listed = new String[25];
        for (int i = 0; i < listed.length; i++) {
            listed[i] = branchListed("b" + i, "sha" + i, false);
            if (i < BranchAnalysisTool.DETAILED_BRANCHES) {
                transport.on(BRANCHES + "/b" + i, json(branchDetails("b" + i, "sha" + i, "2024-03-09T12:00:00Z", false)));
            }
        }
        transport.on(BRANCHES, json(array(listed)));

        ToolResult result = tool.getBranchAnalysis("octocat", "hello-world", 30, sink);

        assertThat(transport.requests()).hasSize(1 + BranchAnalysisTool.DETAILED_BRANCHES);
        assertThat(result.structured().path("total_branches").asInt()).isEqualTo(25);
        assertThat(result.structured().path("active_branches_count").asInt()).isEqualTo(20);
        assertThat(result.structured().path("active_branches")).hasSize(BranchAnalysisTool.LISTED_ACTIVE);
    }

    @Test
    void getBranchAnalysis_branchListFailure_failsTheOperation() {
        transport.on(BRANCHES, status(404));

        assertThatThrownBy(() -> tool.getBranchAnalysis("octocat", "hello-world", 90, sink))
                .isInstanceOfSatisfying(ToolException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 366})
    void getBranchAnalysis_thresholdOutOfRange_isValidationError(int days) {
        assertThatThrownBy(() -> tool.getBranchAnalysis("octocat", "hello-world", days, sink))
                .isInstanceOfSatisfying(ToolException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION));
        assertThat(transport.requests()).isEmpty();
    }
}
