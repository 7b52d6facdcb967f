package org.javai.gitpulse.retry;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static final ApiFailure TRANSIENT =
            ApiFailure.transientFailure(ErrorKind.TIMEOUT, "timed out", null, "op", null);

    @Test
    void exponentialBackoff_doublesDelayAndCapsAtMax() {
        RetryPolicy policy = RetryPolicy.exponentialBackoff("test", 10, Duration.ofSeconds(1), Duration.ofSeconds(5));

        assertThat(delayAfter(policy, 1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(delayAfter(policy, 2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(delayAfter(policy, 3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(delayAfter(policy, 4)).isEqualTo(Duration.ofSeconds(5));
        assertThat(delayAfter(policy, 9)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void decide_atMaxAttempts_givesUp() {
        RetryPolicy policy = RetryPolicy.fixed("test", 2, Duration.ofMillis(10));

        assertThat(policy.decide(context(2), TRANSIENT)).isInstanceOfSatisfying(RetryDecision.GiveUp.class,
                stop -> assertThat(stop.exhausted()).isTrue());
    }

    @Test
    void decide_terminalFailure_givesUpImmediately() {
        RetryPolicy policy = RetryPolicy.fixed("test", 5, Duration.ofMillis(10));

        RetryDecision decision = policy.decide(context(1), TRANSIENT.terminal());

        assertThat(decision).isInstanceOfSatisfying(RetryDecision.GiveUp.class, stop -> {
            assertThat(stop.reason()).isEqualTo(RetryDecision.StopReason.TERMINAL_FAILURE);
            assertThat(stop.detail()).contains("not retriable");
        });
    }

    @Test
    void noRetry_allowsSingleAttempt() {
        assertThat(RetryPolicy.noRetry().maxAttempts()).isEqualTo(1);
        assertThat(RetryPolicy.noRetry().decide(context(1), TRANSIENT)).isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void policies_rejectFewerThanOneAttempt() {
        assertThatThrownBy(() -> RetryPolicy.fixed("test", 0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Duration delayAfter(RetryPolicy policy, int attemptNumber) {
        RetryDecision decision = policy.decide(context(attemptNumber), TRANSIENT);
        assertThat(decision).isInstanceOf(RetryDecision.Retry.class);
        return ((RetryDecision.Retry) decision).delay();
    }

    private static RetryContext context(int attemptNumber) {
        return new RetryContext(attemptNumber, 0, Duration.ZERO);
    }
}
