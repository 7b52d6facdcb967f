package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.compare.RepositoryMetrics;
import org.javai.gitpulse.compare.RepositoryMetricsFetcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Health metrics of a single repository: open issues and pull requests, popularity and
 * how recently it was committed to.
 */
public class RepositoryHealthTool extends GitHubTool {

    public static final String OPERATION = "get_repository_health";

    static final int INACTIVE_AFTER_DAYS = 30;

    private final RepositoryMetricsFetcher fetcher;

    public RepositoryHealthTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent,
                                RepositoryMetricsFetcher fetcher) {
        super(client, json, credentialPresent);
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    public ToolResult getRepositoryHealth(String owner, String repo, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            progress.info("Fetching health metrics for " + target.key());
            progress.progress(0, 100);

            RepositoryMetrics metrics = fetcher.fetch(target, progress).getOrThrow();

            progress.progress(100, 100);
            progress.info("Health metrics for " + target.key() + " ready");
            return new ToolResult(render(metrics), structured(metrics), meta(target));
        });
    }

    private ObjectNode structured(RepositoryMetrics metrics) {
        ObjectNode node = newObject();
        node.put("owner", metrics.owner());
        node.put("repo", metrics.repo());
        node.put("open_issues_count", metrics.openIssues());
        node.put("open_prs_count", metrics.openPullRequests());
        node.put("stars_count", metrics.stars());
        node.put("forks_count", metrics.forks());
        node.put("watchers_count", metrics.watchers());
        putInstant(node, "last_commit_date", metrics.lastCommitDate());
        if (metrics.lastCommitAgeDays() == null) {
            node.putNull("last_commit_age_days");
        } else {
            node.put("last_commit_age_days", metrics.lastCommitAgeDays());
        }
        node.put("language", metrics.language());
        node.put("is_archived", metrics.archived());
        node.put("is_disabled", metrics.disabled());
        putInstant(node, "pushed_at", metrics.pushedAt());
        return node;
    }

    static String render(RepositoryMetrics metrics) {
        List<String> lines = new ArrayList<>();
        lines.add("Repository health: " + metrics.key());
        lines.add("");
        lines.add("Open issues: " + metrics.openIssues());
        lines.add("Open pull requests: " + metrics.openPullRequests());
        lines.add("Stars: " + metrics.stars());
        lines.add("Forks: " + metrics.forks());
        lines.add("Watchers: " + metrics.watchers());
        if (metrics.lastCommitAgeDays() != null) {
            lines.add("Last commit: " + describeAge(metrics.lastCommitAgeDays()));
        }
        if (metrics.language() != null) {
            lines.add("Language: " + metrics.language());
        }
        if (metrics.archived()) {
            lines.add("Repository is archived");
        }
        if (metrics.disabled()) {
            lines.add("Repository is disabled");
        }
        return String.join("\n", lines);
    }

    static String describeAge(long days) {
        if (days == 0) {
            return "today";
        }
        if (days == 1) {
            return "yesterday";
        }
        return days + " days ago" + (days >= INACTIVE_AFTER_DAYS ? " (inactive)" : "");
    }
}
