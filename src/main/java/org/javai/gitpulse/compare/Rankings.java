package org.javai.gitpulse.compare;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Leaders among the targets that succeeded. Ties go to the target listed first.
 */
public final class Rankings {

    private static final Rankings NONE = new Rankings(null, null, null);

    private final ComparisonTarget mostActive;
    private final ComparisonTarget mostPopular;
    private final ComparisonTarget mostForked;

    private Rankings(ComparisonTarget mostActive, ComparisonTarget mostPopular, ComparisonTarget mostForked) {
        this.mostActive = mostActive;
        this.mostPopular = mostPopular;
        this.mostForked = mostForked;
    }

    /**
     * Ranks the successful results, in input order. A ranking is only computed when its metric
     * was requested, and is absent when no success has a value for it.
     */
    public static Rankings rank(List<TargetResult> results, Collection<ComparisonMetric> metrics) {
        ComparisonTarget active = metrics.contains(ComparisonMetric.LAST_COMMIT_AGE)
                ? leader(results, ComparisonMetric.LAST_COMMIT_AGE, false) : null;
        ComparisonTarget popular = metrics.contains(ComparisonMetric.STARS)
                ? leader(results, ComparisonMetric.STARS, true) : null;
        ComparisonTarget forked = metrics.contains(ComparisonMetric.FORKS)
                ? leader(results, ComparisonMetric.FORKS, true) : null;
        if (active == null && popular == null && forked == null) {
            return NONE;
        }
        return new Rankings(active, popular, forked);
    }

    /**
     * The target with the smallest last commit age.
     */
    public Optional<ComparisonTarget> mostActive() {
        return Optional.ofNullable(mostActive);
    }

    /**
     * The target with the most stars.
     */
    public Optional<ComparisonTarget> mostPopular() {
        return Optional.ofNullable(mostPopular);
    }

    /**
     * The target with the most forks.
     */
    public Optional<ComparisonTarget> mostForked() {
        return Optional.ofNullable(mostForked);
    }

    public boolean isEmpty() {
        return mostActive == null && mostPopular == null && mostForked == null;
    }

    /**
     * Present rankings by name ({@code most_active}, {@code most_popular}, {@code most_forked})
     * to target key.
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        mostActive().ifPresent(target -> map.put("most_active", target.key()));
        mostPopular().ifPresent(target -> map.put("most_popular", target.key()));
        mostForked().ifPresent(target -> map.put("most_forked", target.key()));
        return map;
    }

    @Override
    public String toString() {
        return "Rankings" + asMap();
    }

    private static ComparisonTarget leader(List<TargetResult> results, ComparisonMetric metric, boolean highest) {
        ComparisonTarget leader = null;
        long best = 0;
        for (TargetResult result : results) {
            if (!(result instanceof TargetResult.Succeeded succeeded)) {
                continue;
            }
            OptionalLong value = succeeded.metrics().value(metric);
            if (value.isEmpty()) {
                continue;
            }
            long candidate = value.getAsLong();
            if (leader == null || (highest ? candidate > best : candidate < best)) {
                leader = succeeded.target();
                best = candidate;
            }
        }
        return leader;
    }
}
