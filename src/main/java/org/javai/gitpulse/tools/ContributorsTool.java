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
 * The top contributors of a repository by commit count.
 */
public class ContributorsTool extends GitHubTool {

    public static final String OPERATION = "get_repository_contributors";
    public static final int DEFAULT_TOP_N = 10;
    public static final int MAX_TOP_N = 100;

    public ContributorsTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param topN how many contributors to return, 1 to 100
     */
    public ToolResult getTopContributors(String owner, String repo, int topN, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            if (topN < 1 || topN > MAX_TOP_N) {
                throw ApiCallException.validation(OPERATION, "top_n must be between 1 and " + MAX_TOP_N + ", got " + topN);
            }
            progress.info("Fetching contributors of " + target.key());
            progress.progress(0, 100);

            ApiRequest request = ApiRequest.get(target.apiPath() + "/contributors",
                    Map.of("per_page", String.valueOf(topN), "anon", "false"));
            JsonNode contributors = fetchArray(request, progress);
            progress.progress(80, 100);

            ArrayNode top = json.arrayNode();
            for (int i = 0; i < Math.min(topN, contributors.size()); i++) {
                JsonNode contributor = contributors.get(i);
                ObjectNode entry = top.addObject();
                entry.put("login", contributor.path("login").asText("Unknown"));
                entry.put("contributions", contributor.path("contributions").asLong(0));
                entry.put("avatar_url", contributor.path("avatar_url").asText(""));
                entry.put("type", contributor.path("type").asText("User"));
                entry.put("site_admin", contributor.path("site_admin").asBoolean(false));
            }

            ObjectNode structured = newObject();
            structured.put("owner", target.owner());
            structured.put("repo", target.repo());
            structured.put("total_contributors", contributors.size());
            structured.set("top_contributors", top);

            progress.progress(100, 100);
            return new ToolResult(render(target, contributors.size(), top), structured, meta(target));
        });
    }

    private static String render(ComparisonTarget target, int total, ArrayNode top) {
        List<String> lines = new ArrayList<>();
        lines.add("Contributors of " + target.key());
        lines.add("");
        lines.add("Contributors returned: " + total);
        lines.add("");
        lines.add("Top contributors:");
        int rank = 1;
        for (JsonNode contributor : top) {
            lines.add(rank++ + ". " + contributor.path("login").asText()
                    + " - " + contributor.path("contributions").asLong() + " commits");
        }
        return String.join("\n", lines);
    }
}
