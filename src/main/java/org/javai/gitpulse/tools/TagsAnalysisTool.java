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
 * The latest tags of a repository with the commits they point at.
 */
public class TagsAnalysisTool extends GitHubTool {

    public static final String OPERATION = "analyze_repository_tags";
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public TagsAnalysisTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    public ToolResult analyzeTags(String owner, String repo, int limit, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            if (limit < 1 || limit > MAX_LIMIT) {
                throw ApiCallException.validation(OPERATION, "limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
            }
            progress.info("Fetching tags of " + target.key());
            progress.progress(0, 100);

            JsonNode tags = fetchArray(ApiRequest.get(target.apiPath() + "/tags",
                    Map.of("per_page", String.valueOf(limit))), progress);
            progress.progress(70, 100);

            int shown = Math.min(limit, tags.size());
            ObjectNode structured = newObject();
            structured.put("repository", target.key());
            structured.put("total_tags", shown);
            if (shown == 0) {
                structured.putNull("latest_tag");
            } else {
                structured.putObject("latest_tag")
                        .put("name", tags.get(0).path("name").asText(null))
                        .put("commit_sha", tags.get(0).path("commit").path("sha").asText(null));
            }
            ArrayNode list = structured.putArray("tags");
            for (int i = 0; i < shown; i++) {
                list.addObject()
                        .put("name", tags.get(i).path("name").asText(null))
                        .put("commit_sha", tags.get(i).path("commit").path("sha").asText(null));
            }

            progress.progress(100, 100);
            return new ToolResult(render(target, structured), structured, meta(target));
        });
    }

    private static String render(ComparisonTarget target, ObjectNode analysis) {
        List<String> lines = new ArrayList<>();
        lines.add("Tags of " + target.key());
        lines.add("");
        lines.add("Tags shown: " + analysis.path("total_tags").asInt());
        JsonNode latest = analysis.path("latest_tag");
        if (!latest.isObject()) {
            lines.add("");
            lines.add("No tags found");
            return String.join("\n", lines);
        }
        lines.add("Latest tag: " + latest.path("name").asText("N/A") + " (commit " + shortSha(latest) + ")");
        lines.add("");
        lines.add("Recent tags:");
        int rank = 1;
        for (JsonNode tag : analysis.path("tags")) {
            lines.add("  " + rank++ + ". " + tag.path("name").asText("N/A") + " (commit " + shortSha(tag) + ")");
        }
        return String.join("\n", lines);
    }

    private static String shortSha(JsonNode tag) {
        String sha = tag.path("commit_sha").asText("");
        if (sha.isEmpty()) {
            return "N/A";
        }
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
