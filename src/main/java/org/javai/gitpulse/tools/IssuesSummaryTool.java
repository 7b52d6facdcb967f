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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Summarizes the issues of a repository: open and closed counts, counts per label and
 * per priority label, and the most recently updated issues.
 *
 * <p>Issues are read page by page, {@value #PAGE_SIZE} at a time and at most
 * {@value #MAX_PAGES} pages; pull requests, which the issues endpoint also lists, are dropped.
 * Open and closed totals come from the search API and fall back to counting the fetched
 * issues when search is unavailable.
 */
public class IssuesSummaryTool extends GitHubTool {

    private static final Logger log = LoggerFactory.getLogger(IssuesSummaryTool.class);

    public static final String OPERATION = "get_repository_issues_summary";

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 10;
    static final int RECENT_ISSUES = 10;

    private static final Set<String> STATES = Set.of("open", "closed", "all");
    private static final List<String> PRIORITIES = List.of("critical", "high", "medium", "low");

    public IssuesSummaryTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param state {@code open}, {@code closed} or {@code all}; null means {@code open}
     * @param labels only count issues carrying all of these labels; null or empty for no filter
     */
    public ToolResult getIssuesSummary(String owner, String repo, String state, List<String> labels,
                                       ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            String issueState = state == null ? "open" : state.trim().toLowerCase(Locale.ROOT);
            if (!STATES.contains(issueState)) {
                throw ApiCallException.validation(OPERATION,
                        "state must be one of 'open', 'closed' or 'all', got '" + state + "'");
            }
            progress.info("Fetching issues of " + target.key());
            progress.progress(0, 100);

            List<JsonNode> issues = fetchIssues(target, issueState, labels, progress);
            progress.progress(60, 100);

            long[] totals = countByState(target, issues, progress);
            progress.progress(80, 100);

            ObjectNode structured = summarize(target, issues, totals[0], totals[1]);
            progress.progress(100, 100);

            Map<String, Object> meta = meta(target);
            meta.put("state", issueState);
            return new ToolResult(render(structured), structured, meta);
        });
    }

    private List<JsonNode> fetchIssues(ComparisonTarget target, String state, List<String> labels,
                                       ProgressSink progress) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("state", state);
        query.put("per_page", String.valueOf(PAGE_SIZE));
        query.put("sort", "updated");
        query.put("direction", "desc");
        if (labels != null && !labels.isEmpty()) {
            query.put("labels", String.join(",", labels));
        }

        List<JsonNode> issues = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            ApiRequest request = ApiRequest.get(target.apiPath() + "/issues", query)
                    .withParam("page", String.valueOf(page));
            JsonNode batch = fetchArray(request, progress);
            for (JsonNode issue : batch) {
                if (!issue.has("pull_request")) {
                    issues.add(issue);
                }
            }
            if (batch.size() < PAGE_SIZE) {
                break;
            }
            progress.progress(page * 5, 100);
        }
        return issues;
    }

    /**
     * Returns {open, closed}.
     */
    private long[] countByState(ComparisonTarget target, List<JsonNode> issues, ProgressSink progress) {
        CallOutcome<Long> open = searchCount(target, "open", progress);
        CallOutcome<Long> closed = open.flatMap(count -> searchCount(target, "closed", progress));
        if (open.isSuccess() && closed.isSuccess()) {
            return new long[]{open.getOrThrow(), closed.getOrThrow()};
        }

        log.warn("Issue search unavailable for {}, counting fetched issues instead: {}",
                target.key(), closed.failureOrNull().message());
        progress.info("Issue search unavailable for " + target.key() + ", counting fetched issues instead");
        long openCount = issues.stream().filter(issue -> "open".equals(issue.path("state").asText())).count();
        long closedCount = issues.stream().filter(issue -> "closed".equals(issue.path("state").asText())).count();
        return new long[]{openCount, closedCount};
    }

    private CallOutcome<Long> searchCount(ComparisonTarget target, String state, ProgressSink progress) {
        ApiRequest request = ApiRequest.get("/search/issues", Map.of(
                "q", "repo:" + target.key() + " type:issue state:" + state,
                "per_page", "1"));
        return tryFetchObject(request, progress).map(result -> result.path("total_count").asLong(0));
    }

    private ObjectNode summarize(ComparisonTarget target, List<JsonNode> issues, long open, long closed) {
        Map<String, Long> byLabel = new LinkedHashMap<>();
        Map<String, Long> byPriority = new LinkedHashMap<>();
        for (JsonNode issue : issues) {
            List<String> names = labelNames(issue);
            for (String name : names) {
                byLabel.merge(name, 1L, Long::sum);
            }
            for (String priority : PRIORITIES) {
                if (names.stream().anyMatch(name -> name.equalsIgnoreCase("priority: " + priority))) {
                    byPriority.merge(priority, 1L, Long::sum);
                    break;
                }
            }
        }

        ObjectNode node = newObject();
        node.put("owner", target.owner());
        node.put("repo", target.repo());
        node.put("total_issues", open + closed);
        node.put("open_issues", open);
        node.put("closed_issues", closed);
        ObjectNode labels = node.putObject("issues_by_label");
        byLabel.forEach(labels::put);
        ObjectNode priorities = node.putObject("issues_by_priority");
        byPriority.forEach(priorities::put);

        ArrayNode recent = node.putArray("recent_issues");
        for (JsonNode issue : issues.subList(0, Math.min(RECENT_ISSUES, issues.size()))) {
            ObjectNode entry = recent.addObject();
            entry.put("number", issue.path("number").asLong(0));
            entry.put("title", issue.path("title").asText(""));
            entry.put("state", issue.path("state").asText("open"));
            ArrayNode names = entry.putArray("labels");
            labelNames(issue).forEach(names::add);
            putInstant(entry, "created_at", GitHubDates.parse(issue.path("created_at").asText(null)));
            putInstant(entry, "updated_at", GitHubDates.parse(issue.path("updated_at").asText(null)));
            entry.put("comments_count", issue.path("comments").asLong(0));
            entry.put("assignees_count", issue.path("assignees").size());
        }
        return node;
    }

    private static List<String> labelNames(JsonNode issue) {
        List<String> names = new ArrayList<>();
        for (JsonNode label : issue.path("labels")) {
            String name = label.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    static String render(ObjectNode summary) {
        List<String> lines = new ArrayList<>();
        lines.add("Issues summary: " + summary.path("owner").asText() + "/" + summary.path("repo").asText());
        lines.add("");
        lines.add("Total issues: " + summary.path("total_issues").asLong());
        lines.add("Open: " + summary.path("open_issues").asLong());
        lines.add("Closed: " + summary.path("closed_issues").asLong());

        JsonNode byLabel = summary.path("issues_by_label");
        if (!byLabel.isEmpty()) {
            lines.add("");
            lines.add("Issues by label:");
            byLabel.fields().forEachRemaining(entry ->
                    lines.add("  - " + entry.getKey() + ": " + entry.getValue().asLong()));
        }

        JsonNode recent = summary.path("recent_issues");
        if (!recent.isEmpty()) {
            lines.add("");
            lines.add("Recent issues:");
            for (int i = 0; i < Math.min(5, recent.size()); i++) {
                JsonNode issue = recent.get(i);
                String title = issue.path("title").asText();
                lines.add("  [" + issue.path("state").asText() + "] #" + issue.path("number").asLong()
                        + ": " + (title.length() > 50 ? title.substring(0, 50) : title));
            }
        }
        return String.join("\n", lines);
    }
}
