package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.GitHubDates;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.http.ApiRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits the branches of a repository into active and inactive by the age of their last
 * commit, and finds the protected ones.
 *
 * <p>The branch list does not carry commit dates, so the first {@value #DETAILED_BRANCHES}
 * branches are looked up one by one. A branch whose details cannot be read keeps what the list
 * says about it; a branch without a known commit date is counted but classified neither way.
 */
public class BranchAnalysisTool extends GitHubTool {

    private static final Logger log = LoggerFactory.getLogger(BranchAnalysisTool.class);

    public static final String OPERATION = "get_branch_analysis";
    public static final int DEFAULT_DAYS_THRESHOLD = 90;
    public static final int MAX_DAYS_THRESHOLD = 365;

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 10;
    static final int DETAILED_BRANCHES = 20;
    static final int LISTED_ACTIVE = 10;
    static final int LISTED_INACTIVE = 5;

    private final Clock clock;

    public BranchAnalysisTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent, Clock clock) {
        super(client, json, credentialPresent);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param daysThreshold a branch is active when its last commit is at most this many days
     *                      old, 1 to 365
     */
    public ToolResult getBranchAnalysis(String owner, String repo, int daysThreshold, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            if (daysThreshold < 1 || daysThreshold > MAX_DAYS_THRESHOLD) {
                throw ApiCallException.validation(OPERATION,
                        "days_threshold must be between 1 and " + MAX_DAYS_THRESHOLD + ", got " + daysThreshold);
            }
            progress.info("Fetching branches of " + target.key());
            progress.progress(0, 100);

            List<JsonNode> listed = fetchPages(ApiRequest.get(target.apiPath() + "/branches"),
                    PAGE_SIZE, MAX_PAGES, progress);
            progress.progress(50, 100);

            List<Branch> branches = new ArrayList<>(listed.size());
            for (int i = 0; i < listed.size(); i++) {
                JsonNode branch = listed.get(i);
                JsonNode details = i < DETAILED_BRANCHES ? details(target, branch, progress) : null;
                branches.add(Branch.of(branch, details));
            }
            progress.progress(85, 100);

            ObjectNode structured = classify(branches, daysThreshold);
            progress.progress(100, 100);

            Map<String, Object> meta = meta(target);
            meta.put("days_threshold", daysThreshold);
            return new ToolResult(render(target, structured, daysThreshold), structured, meta);
        });
    }

    private JsonNode details(ComparisonTarget target, JsonNode branch, ProgressSink progress) {
        String name = branch.path("name").asText("");
        if (name.isEmpty()) {
            return null;
        }
        CallOutcome<JsonNode> outcome = tryFetchObject(
                ApiRequest.get(target.apiPath() + "/branches/" + refSegment(name)), progress);
        if (!outcome.isSuccess()) {
            log.debug("No details for branch {} of {}: {}", name, target.key(), outcome.failureOrNull().message());
            return null;
        }
        return outcome.getOrThrow();
    }

    private ObjectNode classify(List<Branch> branches, int daysThreshold) {
        List<ObjectNode> active = new ArrayList<>();
        List<ObjectNode> inactive = new ArrayList<>();
        List<String> protectedNames = new ArrayList<>();
        for (Branch branch : branches) {
            if (branch.isProtected) {
                protectedNames.add(branch.name);
            }
            if (branch.lastCommit == null) {
                continue;
            }
            long daysAgo = GitHubDates.daysSince(branch.lastCommit, clock);
            ObjectNode entry = newObject();
            entry.put("name", branch.name);
            entry.put("protected", branch.isProtected);
            entry.put("last_commit_days_ago", daysAgo);
            entry.put("sha", branch.sha.length() > 7 ? branch.sha.substring(0, 7) : branch.sha);
            (daysAgo <= daysThreshold ? active : inactive).add(entry);
        }
        Comparator<ObjectNode> byAge = Comparator.comparingLong(entry -> entry.path("last_commit_days_ago").asLong());
        active.sort(byAge);
        inactive.sort(byAge.reversed());

        ObjectNode node = newObject();
        node.put("total_branches", branches.size());
        node.put("active_branches_count", active.size());
        node.put("inactive_branches_count", inactive.size());
        node.put("protected_branches_count", protectedNames.size());
        ArrayNode activeNode = node.putArray("active_branches");
        active.stream().limit(LISTED_ACTIVE).forEach(activeNode::add);
        ArrayNode inactiveNode = node.putArray("inactive_branches");
        inactive.stream().limit(LISTED_INACTIVE).forEach(inactiveNode::add);
        ArrayNode protectedNode = node.putArray("protected_branches");
        protectedNames.forEach(protectedNode::add);
        return node;
    }

    private static String render(ComparisonTarget target, ObjectNode analysis, int daysThreshold) {
        List<String> lines = new ArrayList<>();
        lines.add("Branch analysis for " + target.key());
        lines.add("");
        lines.add("Total branches: " + analysis.path("total_branches").asLong());
        lines.add("Active (<= " + daysThreshold + " days): " + analysis.path("active_branches_count").asLong());
        lines.add("Inactive (> " + daysThreshold + " days): " + analysis.path("inactive_branches_count").asLong());
        lines.add("Protected: " + analysis.path("protected_branches_count").asLong());
        JsonNode active = analysis.path("active_branches");
        if (!active.isEmpty()) {
            lines.add("");
            lines.add("Active branches:");
            for (JsonNode branch : active) {
                lines.add("  - " + branch.path("name").asText() + (branch.path("protected").asBoolean() ? " [protected]" : "")
                        + " (last commit " + branch.path("last_commit_days_ago").asLong() + " days ago)");
            }
        }
        JsonNode inactive = analysis.path("inactive_branches");
        if (!inactive.isEmpty()) {
            lines.add("");
            lines.add("Inactive branches:");
            for (JsonNode branch : inactive) {
                lines.add("  - " + branch.path("name").asText()
                        + " (last commit " + branch.path("last_commit_days_ago").asLong() + " days ago)");
            }
        }
        return String.join("\n", lines);
    }

    private static final class Branch {

        private final String name;
        private final String sha;
        private final boolean isProtected;
        private final Instant lastCommit;

        private Branch(String name, String sha, boolean isProtected, Instant lastCommit) {
            this.name = name;
            this.sha = sha;
            this.isProtected = isProtected;
            this.lastCommit = lastCommit;
        }

        static Branch of(JsonNode listed, JsonNode details) {
            JsonNode source = details != null ? details : listed;
            JsonNode commit = source.path("commit");
            return new Branch(
                    listed.path("name").asText(""),
                    commit.path("sha").asText(listed.path("commit").path("sha").asText("")),
                    listed.path("protected").asBoolean(false) || source.path("protected").asBoolean(false),
                    GitHubDates.parse(commit.path("commit").path("author").path("date").asText(null)));
        }
    }
}
