package org.javai.gitpulse.compare;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * The aggregate of a comparison.
 *
 * @param targets The compared targets, in input order
 * @param comparedAt When the comparison ran
 * @param metrics The metrics that were compared
 * @param results One result per target, in input order, failures included
 * @param table Metric to (target key to value), built from successes only; a null value means
 *              the value is unknown for that target
 * @param rankings Leaders among the successes
 */
public record ComparisonResult(
        List<ComparisonTarget> targets,
        Instant comparedAt,
        List<ComparisonMetric> metrics,
        List<TargetResult> results,
        Map<ComparisonMetric, Map<String, Long>> table,
        Rankings rankings
) {

    public ComparisonResult {
        targets = List.copyOf(targets);
        Objects.requireNonNull(comparedAt, "comparedAt must not be null");
        metrics = List.copyOf(metrics);
        results = List.copyOf(results);
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(rankings, "rankings must not be null");
        if (results.size() != targets.size()) {
            throw new IllegalArgumentException("expected one result per target");
        }
    }

    /**
     * Builds the metric table and rankings from per-target results.
     */
    public static ComparisonResult of(List<ComparisonTarget> targets, Instant comparedAt,
                                      List<ComparisonMetric> metrics, List<TargetResult> results) {
        return new ComparisonResult(targets, comparedAt, metrics, results,
                tabulate(metrics, results), Rankings.rank(results, metrics));
    }

    public List<TargetResult.Succeeded> successes() {
        return results.stream()
                .filter(TargetResult.Succeeded.class::isInstance)
                .map(TargetResult.Succeeded.class::cast)
                .toList();
    }

    public List<TargetResult.Failed> failures() {
        return results.stream()
                .filter(TargetResult.Failed.class::isInstance)
                .map(TargetResult.Failed.class::cast)
                .toList();
    }

    private static Map<ComparisonMetric, Map<String, Long>> tabulate(List<ComparisonMetric> metrics,
                                                                     List<TargetResult> results) {
        Map<ComparisonMetric, Map<String, Long>> table = new LinkedHashMap<>();
        for (ComparisonMetric metric : metrics) {
            Map<String, Long> column = new LinkedHashMap<>();
            for (TargetResult result : results) {
                if (result instanceof TargetResult.Succeeded succeeded) {
                    OptionalLong value = succeeded.metrics().value(metric);
                    column.put(succeeded.target().key(), value.isPresent() ? value.getAsLong() : null);
                }
            }
            table.put(metric, Collections.unmodifiableMap(column));
        }
        return Collections.unmodifiableMap(table);
    }
}
