package org.javai.gitpulse.compare;

import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ComparisonTargetTest {

    @Test
    void parse_ownerSlashRepo() {
        ComparisonTarget target = ComparisonTarget.parse("octocat/hello-world");

        assertThat(target.owner()).isEqualTo("octocat");
        assertThat(target.repo()).isEqualTo("hello-world");
        assertThat(target.key()).isEqualTo("octocat/hello-world");
        assertThat(target.apiPath()).isEqualTo("/repos/octocat/hello-world");
    }

    @ParameterizedTest
    @ValueSource(strings = {"octocat", "a/b/c", "/repo", "owner/", "own er/repo", "owner/..", "owner/re?po"})
    void parse_rejectsMalformedNames(String text) {
        assertThatThrownBy(() -> ComparisonTarget.parse(text))
                .isInstanceOfSatisfying(ApiCallException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION));
    }

    @Test
    void metrics_resolveInRequestOrderWithoutRepeats() {
        assertThat(ComparisonMetric.resolve(List.of("stars", "open_prs", "stars")))
                .containsExactly(ComparisonMetric.STARS, ComparisonMetric.OPEN_PRS);
    }

    @Test
    void metrics_absentRequestSelectsAll() {
        assertThat(ComparisonMetric.resolve(null)).containsExactly(ComparisonMetric.values());
        assertThat(ComparisonMetric.resolve(List.of())).hasSize(6);
    }

    @Test
    void metrics_unknownNameIsValidationError() {
        assertThatThrownBy(() -> ComparisonMetric.resolve(List.of("stars", "karma")))
                .isInstanceOf(ApiCallException.class)
                .hasMessageContaining("karma")
                .hasMessageContaining("last_commit_age");
    }
}
