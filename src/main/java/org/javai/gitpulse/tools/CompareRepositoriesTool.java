package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonMetric;
import org.javai.gitpulse.compare.ComparisonResult;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.compare.RepositoryComparator;
import org.javai.gitpulse.compare.TargetResult;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compares 2 to 5 repositories side by side. Repositories that could not be fetched are listed
 * with their error; the metric table and the rankings cover the others.
 */
public class CompareRepositoriesTool extends GitHubTool {

    public static final String OPERATION = "compare_repositories";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final RepositoryComparator comparator;

    public CompareRepositoriesTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent,
                                   RepositoryComparator comparator) {
        super(client, json, credentialPresent);
        this.comparator = Objects.requireNonNull(comparator, "comparator must not be null");
    }

    @Override
    public String operation() {
        return OPERATION;
    }

    /**
     * @param targets the repositories to compare
     * @param metricNames metric names such as {@code stars}; null or empty compares every metric
     */
    public ToolResult compareRepositories(List<ComparisonTarget> targets, List<String> metricNames, ProgressSink sink) {
        return invoke(sink, progress -> {
            progress.progress(0, 100);
            ComparisonResult result = comparator.compare(targets, metricNames, progress);
            progress.progress(100, 100);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("repositories", result.targets().stream().map(ComparisonTarget::key).toList());
            meta.put("operation", OPERATION);
            meta.put("metrics_compared", result.metrics().stream().map(ComparisonMetric::wireName).toList());
            return new ToolResult(render(result), structured(result), meta);
        });
    }

    private ObjectNode structured(ComparisonResult result) {
        ObjectNode node = newObject();
        ArrayNode repositories = node.putArray("repositories");
        for (ComparisonTarget target : result.targets()) {
            repositories.addObject().put("owner", target.owner()).put("repo", target.repo());
        }
        putInstant(node, "comparison_date", result.comparedAt());

        ObjectNode metrics = node.putObject("metrics");
        result.table().forEach((metric, column) -> {
            ObjectNode values = metrics.putObject(metric.wireName());
            column.forEach(values::put);
        });

        ObjectNode summary = node.putObject("summary");
        result.rankings().asMap().forEach(summary::put);

        ArrayNode failures = node.putArray("failures");
        for (TargetResult.Failed failed : result.failures()) {
            ApiFailure failure = failed.failure();
            failures.addObject()
                    .put("repository", failed.target().key())
                    .put("code", failure.code())
                    .put("message", failure.userMessage());
        }
        return node;
    }

    static String render(ComparisonResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("Repository comparison");
        lines.add("");
        lines.add("Repositories: " + String.join(", ",
                result.targets().stream().map(ComparisonTarget::key).toList()));
        lines.add("Compared at: " + TIMESTAMP.format(result.comparedAt()));
        lines.add("");

        result.table().forEach((metric, column) -> {
            lines.add(title(metric) + ":");
            column.forEach((key, value) -> lines.add("  - " + key + ": " + format(metric, value)));
            lines.add("");
        });

        if (!result.failures().isEmpty()) {
            lines.add("Not available:");
            for (TargetResult.Failed failed : result.failures()) {
                lines.add("  - " + failed.target().key() + ": " + failed.failure().userMessage());
            }
            lines.add("");
        }

        if (!result.rankings().isEmpty()) {
            lines.add("Summary:");
            result.rankings().mostActive().ifPresent(target -> lines.add("  Most active: " + target.key()));
            result.rankings().mostPopular().ifPresent(target -> lines.add("  Most popular: " + target.key()));
            result.rankings().mostForked().ifPresent(target -> lines.add("  Most forked: " + target.key()));
        }
        return String.join("\n", lines).stripTrailing();
    }

    private static String title(ComparisonMetric metric) {
        return switch (metric) {
            case OPEN_ISSUES -> "Open issues";
            case OPEN_PRS -> "Open pull requests";
            case STARS -> "Stars";
            case FORKS -> "Forks";
            case WATCHERS -> "Watchers";
            case LAST_COMMIT_AGE -> "Last commit age (days)";
        };
    }

    private static String format(ComparisonMetric metric, Long value) {
        if (value == null) {
            return "no data";
        }
        return metric == ComparisonMetric.LAST_COMMIT_AGE ? value + " days" : String.valueOf(value);
    }
}
