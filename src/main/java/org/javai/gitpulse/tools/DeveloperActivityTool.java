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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Commit counts per developer account over the latest commits of a repository. Commits whose
 * author has no linked account count toward the total but toward no developer.
 */
public class DeveloperActivityTool extends GitHubTool {

    public static final String OPERATION = "get_developer_activity";
    public static final int DEFAULT_TOP_N = 10;
    public static final int MAX_TOP_N = 50;

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 10;

    public DeveloperActivityTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        super(client, json, credentialPresent);
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param topN how many developers to list, 1 to 50
     */
    public ToolResult getDeveloperActivity(String owner, String repo, int topN, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            if (topN < 1 || topN > MAX_TOP_N) {
                throw ApiCallException.validation(OPERATION, "top_n must be between 1 and " + MAX_TOP_N + ", got " + topN);
            }
            progress.info("Fetching commits of " + target.key());
            progress.progress(0, 100);

            List<JsonNode> commits = fetchPages(ApiRequest.get(target.apiPath() + "/commits"),
                    PAGE_SIZE, MAX_PAGES, progress);
            progress.progress(80, 100);

            Map<String, Developer> developers = new LinkedHashMap<>();
            for (JsonNode commit : commits) {
                JsonNode account = commit.path("author");
                if (!account.isObject()) {
                    continue;
                }
                String login = account.path("login").asText("Unknown");
                String name = commit.path("commit").path("author").path("name").asText(login);
                developers.computeIfAbsent(login, key -> new Developer(key, name)).commits++;
            }

            int total = commits.size();
            ObjectNode structured = newObject();
            structured.put("total_commits", total);
            structured.put("unique_developers", developers.size());
            ArrayNode top = structured.putArray("top_developers");
            developers.values().stream()
                    .sorted(Comparator.comparingLong((Developer developer) -> developer.commits).reversed())
                    .limit(topN)
                    .forEach(developer -> top.addObject()
                            .put("login", developer.login)
                            .put("name", developer.name)
                            .put("commits", developer.commits)
                            .put("percentage", share(developer.commits, total)));

            progress.progress(100, 100);
            return new ToolResult(render(target, structured, topN), structured, meta(target));
        });
    }

    static double share(long commits, int total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(commits * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String render(ComparisonTarget target, ObjectNode activity, int topN) {
        List<String> lines = new ArrayList<>();
        lines.add("Developer activity for " + target.key());
        lines.add("");
        lines.add("Commits analyzed: " + activity.path("total_commits").asLong());
        lines.add("Unique developers: " + activity.path("unique_developers").asLong());
        lines.add("");
        lines.add("Top " + topN + " developers:");
        int rank = 1;
        for (JsonNode developer : activity.path("top_developers")) {
            lines.add("  " + rank++ + ". " + developer.path("name").asText() + " (@" + developer.path("login").asText()
                    + "): " + developer.path("commits").asLong() + " commits ("
                    + developer.path("percentage").asDouble() + "%)");
        }
        return String.join("\n", lines);
    }

    private static final class Developer {

        private final String login;
        private final String name;
        private long commits;

        private Developer(String login, String name) {
            this.login = login;
            this.name = name;
        }
    }
}
