package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.http.ApiRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares two release versions of a repository. Missing versions default to the latest and
 * the previous release. When both are known, the commit comparison between them is read as
 * well; if that lookup fails the result still names the versions, without the change counts.
 */
public class VersionComparisonTool extends GitHubTool {

    private static final Logger log = LoggerFactory.getLogger(VersionComparisonTool.class);

    public static final String OPERATION = "compare_release_versions";

    static final int RELEASES_CONSIDERED = 10;

    public VersionComparisonTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param version1 the newer version; null or blank for the latest release
     * @param version2 the older version; null or blank for the release before the latest
     */
    public ToolResult compareVersions(String owner, String repo, String version1, String version2, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            progress.info("Fetching releases of " + target.key());
            progress.progress(0, 100);

            JsonNode releases = fetchArray(ApiRequest.get(target.apiPath() + "/releases",
                    Map.of("per_page", String.valueOf(RELEASES_CONSIDERED))), progress);
            progress.progress(50, 100);

            String newer = isBlank(version1) ? tagAt(releases, 0) : version1.trim();
            String older = isBlank(version2) ? tagAt(releases, 1) : version2.trim();
            boolean comparable = newer != null && older != null;

            ObjectNode structured = newObject();
            structured.put("repository", target.key());
            structured.put("version1", newer);
            structured.put("version2", older);
            structured.put("comparison_available", comparable);
            structured.put("releases_found", releases.size());
            if (comparable) {
                structured.set("changes", changes(target, older, newer, progress));
            }

            progress.progress(100, 100);
            return new ToolResult(render(target, structured, releases), structured, meta(target));
        });
    }

    private JsonNode changes(ComparisonTarget target, String base, String head, ProgressSink progress) {
        CallOutcome<JsonNode> outcome = tryFetchObject(ApiRequest.get(
                target.apiPath() + "/compare/" + refSegment(base) + "..." + refSegment(head)), progress);
        if (!outcome.isSuccess()) {
            log.info("No commit comparison for {} {}...{}: {}", target.key(), base, head,
                    outcome.failureOrNull().message());
            progress.info("Commit comparison between " + base + " and " + head + " is unavailable");
            return NullNode.getInstance();
        }
        JsonNode comparison = outcome.getOrThrow();
        ObjectNode changes = newObject();
        changes.put("status", comparison.path("status").asText("unknown"));
        changes.put("ahead_by", comparison.path("ahead_by").asLong(0));
        changes.put("behind_by", comparison.path("behind_by").asLong(0));
        changes.put("total_commits", comparison.path("total_commits").asLong(0));
        changes.put("files_changed", comparison.path("files").size());
        return changes;
    }

    private static String tagAt(JsonNode releases, int index) {
        if (releases.size() <= index) {
            return null;
        }
        String tag = releases.get(index).path("tag_name").asText("");
        return tag.isEmpty() ? null : tag;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    private static String render(ComparisonTarget target, ObjectNode comparison, JsonNode releases) {
        List<String> lines = new ArrayList<>();
        lines.add("Version comparison for " + target.key());
        lines.add("");
        if (!comparison.path("comparison_available").asBoolean()) {
            lines.add("Not enough releases to compare");
            lines.add("  Releases found: " + releases.size());
            if (releases.size() > 0) {
                lines.add("  Latest release: " + releases.get(0).path("tag_name").asText("N/A"));
            }
            return String.join("\n", lines);
        }
        lines.add("Version 1: " + comparison.path("version1").asText());
        lines.add("Version 2: " + comparison.path("version2").asText());
        JsonNode changes = comparison.path("changes");
        if (changes.isObject()) {
            lines.add("");
            lines.add("Changes from version 2 to version 1:");
            lines.add("  Status: " + changes.path("status").asText());
            lines.add("  Commits: " + changes.path("total_commits").asLong()
                    + " (ahead by " + changes.path("ahead_by").asLong()
                    + ", behind by " + changes.path("behind_by").asLong() + ")");
            lines.add("  Files changed: " + changes.path("files_changed").asLong());
        }
        lines.add("");
        lines.add("Check the changelog and release notes for breaking changes between these versions.");
        return String.join("\n", lines);
    }
}
