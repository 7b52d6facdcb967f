package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.GitHubDates;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.http.ApiRequest;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Commit activity of a repository over a period: totals, the most frequent authors and the
 * spread of commits over the days of the week (UTC).
 *
 * <p>Period bounds accept {@code now}, {@code N days ago}, a date ({@code 2024-03-01}, read as
 * the start of that day in UTC) or an ISO-8601 instant. At most {@value #MAX_PAGES} pages of
 * {@value #PAGE_SIZE} commits are read.
 */
public class CommitStatisticsTool extends GitHubTool {

    public static final String OPERATION = "get_commit_statistics";
    public static final String DEFAULT_SINCE = "30 days ago";
    public static final String DEFAULT_UNTIL = "now";

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 10;
    static final int TOP_AUTHORS = 10;

    private static final Pattern DAYS_AGO = Pattern.compile("(\\d{1,5})\\s+days?\\s+ago");

    private final Clock clock;

    public CommitStatisticsTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent, Clock clock) {
        super(client, json, credentialPresent);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param since start of the period; null means {@value #DEFAULT_SINCE}
     * @param until end of the period; null means {@value #DEFAULT_UNTIL}
     */
    public ToolResult getCommitStatistics(String owner, String repo, String since, String until, ProgressSink sink) {
        return invoke(sink, progress -> {
            ComparisonTarget target = repository(owner, repo);
            String sinceText = since == null ? DEFAULT_SINCE : since.trim();
            String untilText = until == null ? DEFAULT_UNTIL : until.trim();
            Instant now = clock.instant();
            Instant from = periodBound("since", sinceText, now);
            Instant to = periodBound("until", untilText, now);
            if (from.isAfter(to)) {
                throw ApiCallException.validation(OPERATION,
                        "since (" + from + ") must not be after until (" + to + ")");
            }
            progress.info("Fetching commits of " + target.key() + " from " + from + " to " + to);
            progress.progress(0, 100);

            ApiRequest request = ApiRequest.get(target.apiPath() + "/commits",
                    Map.of("since", from.toString(), "until", to.toString()));
            List<JsonNode> commits = fetchPages(request, PAGE_SIZE, MAX_PAGES, progress);
            progress.progress(70, 100);

            ObjectNode structured = summarize(commits, sinceText, untilText);
            progress.progress(100, 100);
            return new ToolResult(render(target, structured), structured, meta(target));
        });
    }

    /**
     * Resolves one bound of the period against {@code now}.
     *
     * @throws ApiCallException with kind {@code VALIDATION} when the text is in none of the
     *                          accepted forms
     */
    static Instant periodBound(String field, String text, Instant now) {
        String value = text.toLowerCase(Locale.ROOT);
        if (value.equals("now")) {
            return now;
        }
        Matcher daysAgo = DAYS_AGO.matcher(value);
        if (daysAgo.matches()) {
            return now.minus(Duration.ofDays(Long.parseLong(daysAgo.group(1))));
        }
        Instant instant = GitHubDates.parse(text);
        if (instant != null) {
            return instant;
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw ApiCallException.validation(OPERATION, field
                    + " must be 'now', 'N days ago', a YYYY-MM-DD date or an ISO-8601 instant, got '" + text + "'");
        }
    }

    private ObjectNode summarize(List<JsonNode> commits, String since, String until) {
        Map<String, Long> authors = new LinkedHashMap<>();
        Map<DayOfWeek, Long> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            byDay.put(day, 0L);
        }
        for (JsonNode commit : commits) {
            JsonNode author = commit.path("commit").path("author");
            authors.merge(author.path("name").asText("Unknown"), 1L, Long::sum);
            Instant date = GitHubDates.parse(author.path("date").asText(null));
            if (date != null) {
                byDay.merge(date.atZone(ZoneOffset.UTC).getDayOfWeek(), 1L, Long::sum);
            }
        }

        ObjectNode node = newObject();
        node.put("total_commits", commits.size());
        ObjectNode period = node.putObject("period");
        period.put("since", since);
        period.put("until", until);
        node.put("unique_authors", authors.size());
        ArrayNode top = node.putArray("top_authors");
        authors.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_AUTHORS)
                .forEach(entry -> top.addObject()
                        .put("name", entry.getKey())
                        .put("commits", entry.getValue()));
        ObjectNode activity = node.putObject("activity_by_day");
        byDay.forEach((day, count) -> activity.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), count));
        return node;
    }

    private static String render(ComparisonTarget target, ObjectNode stats) {
        long total = stats.path("total_commits").asLong();
        List<String> lines = new ArrayList<>();
        lines.add("Commit statistics for " + target.key());
        lines.add("");
        lines.add("Total commits: " + total);
        lines.add("Period: " + stats.path("period").path("since").asText() + " - "
                + stats.path("period").path("until").asText());
        lines.add("Unique authors: " + stats.path("unique_authors").asLong());
        lines.add("");
        lines.add("Top authors:");
        int rank = 1;
        for (JsonNode author : stats.path("top_authors")) {
            long commits = author.path("commits").asLong();
            lines.add("  " + rank++ + ". " + author.path("name").asText() + ": " + commits
                    + " commits (" + percent(commits, total) + ")");
        }
        lines.add("");
        lines.add("Activity by day of week:");
        stats.path("activity_by_day").fields().forEachRemaining(day -> lines.add("  - " + day.getKey() + ": "
                + day.getValue().asLong() + " commits (" + percent(day.getValue().asLong(), total) + ")"));
        return String.join("\n", lines);
    }

    static String percent(long part, long total) {
        return String.format(Locale.ROOT, "%.1f%%", total == 0 ? 0.0 : part * 100.0 / total);
    }
}
