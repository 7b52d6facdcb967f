package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiCallException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A metric that can be compared across repositories.
 */
public enum ComparisonMetric {

    OPEN_ISSUES("open_issues"),
    OPEN_PRS("open_prs"),
    STARS("stars"),
    FORKS("forks"),
    WATCHERS("watchers"),
    LAST_COMMIT_AGE("last_commit_age");

    private final String wireName;

    ComparisonMetric(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ComparisonMetric fromWireName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (ComparisonMetric metric : values()) {
            if (metric.wireName.equals(normalized)) {
                return metric;
            }
        }
        throw ApiCallException.validation("compare_repositories",
                "Unknown metric '" + name + "'; expected one of " + wireNames());
    }

    /**
     * Resolves requested metric names in request order, dropping repeats.
     * A null or empty request selects every metric.
     */
    public static List<ComparisonMetric> resolve(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of(values());
        }
        Set<ComparisonMetric> resolved = new LinkedHashSet<>();
        for (String name : names) {
            resolved.add(fromWireName(name));
        }
        return List.copyOf(new ArrayList<>(resolved));
    }

    static String wireNames() {
        return Arrays.stream(values()).map(ComparisonMetric::wireName).collect(Collectors.joining(", "));
    }
}
