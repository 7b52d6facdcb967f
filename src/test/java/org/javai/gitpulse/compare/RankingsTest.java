package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RankingsTest {

    private static final ComparisonTarget A = new ComparisonTarget("o", "a");
    private static final ComparisonTarget B = new ComparisonTarget("o", "b");
    private static final ComparisonTarget C = new ComparisonTarget("o", "c");

    @Test
    void rank_picksExtremesAmongSuccesses() {
        List<TargetResult> results = List.of(
                succeeded(A, 10, 1, 40L),
                succeeded(B, 99, 7, 3L),
                failed(C));

        Rankings rankings = Rankings.rank(results, EnumSet.allOf(ComparisonMetric.class));

        assertThat(rankings.mostPopular()).contains(B);
        assertThat(rankings.mostForked()).contains(B);
        assertThat(rankings.mostActive()).contains(B);
        assertThat(rankings.asMap()).containsExactly(
                entry("most_active", "o/b"), entry("most_popular", "o/b"), entry("most_forked", "o/b"));
    }

    @Test
    void rank_failedTargetWithHigherValuesIsIgnored() {
        List<TargetResult> results = List.of(failed(A), succeeded(B, 1, 1, 100L));

        Rankings rankings = Rankings.rank(results, EnumSet.allOf(ComparisonMetric.class));

        assertThat(rankings.mostPopular()).contains(B);
    }

    @Test
    void rank_allAgesUnknown_hasNoMostActive() {
        List<TargetResult> results = List.of(succeeded(A, 1, 1, null), succeeded(B, 2, 2, null));

        Rankings rankings = Rankings.rank(results, EnumSet.allOf(ComparisonMetric.class));

        assertThat(rankings.mostActive()).isEmpty();
        assertThat(rankings.mostPopular()).contains(B);
    }

    @Test
    void rank_noSuccesses_isEmpty() {
        Rankings rankings = Rankings.rank(List.of(failed(A), failed(B)), EnumSet.allOf(ComparisonMetric.class));

        assertThat(rankings.isEmpty()).isTrue();
        assertThat(rankings.asMap()).isEmpty();
        assertThat(rankings.mostActive()).isEmpty();
        assertThat(rankings).hasToString("Rankings{}");
    }

    @Test
    void rank_nothingRanked_sharesOneEmptyInstance() {
        Rankings noSuccesses = Rankings.rank(List.of(failed(A)), EnumSet.allOf(ComparisonMetric.class));
        Rankings noMetrics = Rankings.rank(List.of(succeeded(A, 5, 5, 1L)), EnumSet.noneOf(ComparisonMetric.class));

        assertThat(noSuccesses).isSameAs(noMetrics);
    }

    @Test
    void rank_metricsNotRequested_areNotRanked() {
        Rankings rankings = Rankings.rank(List.of(succeeded(A, 5, 5, 1L)), EnumSet.of(ComparisonMetric.WATCHERS));

        assertThat(rankings.isEmpty()).isTrue();
    }

    static TargetResult succeeded(ComparisonTarget target, long stars, long forks, Long ageDays) {
        return new TargetResult.Succeeded(target, new RepositoryMetrics(target.owner(), target.repo(),
                0, 0, stars, forks, stars, null, ageDays, null, false, false, null));
    }

    static TargetResult failed(ComparisonTarget target) {
        return new TargetResult.Failed(target,
                ApiFailure.terminalFailure(ErrorKind.NOT_FOUND, "HTTP 404", 404, "GET " + target.apiPath(), null));
    }
}
