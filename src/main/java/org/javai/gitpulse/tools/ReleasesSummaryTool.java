package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.http.ApiRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The latest releases of a repository, newest first.
 */
public class ReleasesSummaryTool extends GitHubTool {

    public static final String OPERATION = "get_releases_summary";
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    public ReleasesSummaryTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param limit how many releases to list, 1 to 50
     */
    public ToolResult getReleasesSummary(String owner, String repo, int limit, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            if (limit < 1 || limit > MAX_LIMIT) {
                throw ApiCallException.validation(OPERATION, "limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
            }
            progress.info("Fetching releases of " + target.key());
            progress.progress(0, 100);

            JsonNode releases = fetchArray(ApiRequest.get(target.apiPath() + "/releases",
                    Map.of("per_page", String.valueOf(limit))), progress);
            progress.progress(70, 100);

            ObjectNode structured = newObject();
            structured.put("repository", target.key());
            int shown = Math.min(limit, releases.size());
            structured.put("total_releases", shown);
            if (shown == 0) {
                structured.putNull("latest_release");
            } else {
                JsonNode latest = releases.get(0);
                structured.putObject("latest_release")
                        .put("tag_name", latest.path("tag_name").asText(null))
                        .put("published_at", latest.path("published_at").asText(null))
                        .put("prerelease", latest.path("prerelease").asBoolean(false));
            }
            ArrayNode list = structured.putArray("releases");
            for (int i = 0; i < shown; i++) {
                JsonNode release = releases.get(i);
                String tag = release.path("tag_name").asText(null);
                list.addObject()
                        .put("tag_name", tag)
                        .put("name", release.path("name").asText(tag))
                        .put("published_at", release.path("published_at").asText(null))
                        .put("prerelease", release.path("prerelease").asBoolean(false))
                        .put("draft", release.path("draft").asBoolean(false));
            }

            progress.progress(100, 100);
            return new ToolResult(render(target, structured), structured, meta(target));
        });
    }

    private static String render(ComparisonTarget target, ObjectNode summary) {
        List<String> lines = new ArrayList<>();
        lines.add("Releases of " + target.key());
        lines.add("");
        lines.add("Releases shown: " + summary.path("total_releases").asInt());
        JsonNode latest = summary.path("latest_release");
        if (!latest.isObject()) {
            lines.add("");
            lines.add("No releases found");
            return String.join("\n", lines);
        }
        lines.add("Latest release: " + latest.path("tag_name").asText("N/A"));
        lines.add("Published: " + latest.path("published_at").asText("N/A"));
        lines.add("Pre-release: " + (latest.path("prerelease").asBoolean() ? "yes" : "no"));
        lines.add("");
        lines.add("Recent releases:");
        int rank = 1;
        for (JsonNode release : summary.path("releases")) {
            String flags = (release.path("prerelease").asBoolean() ? " (pre-release)" : "")
                    + (release.path("draft").asBoolean() ? " (draft)" : "");
            lines.add("  " + rank++ + ". " + release.path("name").asText("N/A") + " ("
                    + release.path("tag_name").asText("N/A") + ")" + flags);
            lines.add("     " + release.path("published_at").asText("N/A"));
        }
        return String.join("\n", lines);
    }
}
