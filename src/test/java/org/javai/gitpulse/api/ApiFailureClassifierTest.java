package org.javai.gitpulse.api;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.http.ApiRequest;
import org.javai.gitpulse.http.ApiResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ApiFailureClassifierTest {

    private static final ApiRequest REQUEST = ApiRequest.get("/repos/octocat/hello-world");

    private final ApiFailureClassifier classifier = new ApiFailureClassifier();

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 204})
    void classify_2xx_isSuccessWithStatus(int status) {
        CallOutcome<ApiResponse> outcome = classifier.classify(REQUEST, ApiResponse.of(status, "{}"));

        assertThat(outcome).isInstanceOf(CallOutcome.Success.class);
        assertThat(((CallOutcome.Success<ApiResponse>) outcome).status()).isEqualTo(status);
    }

    @ParameterizedTest
    @CsvSource({
            "429, RATE_LIMITED",
            "500, UPSTREAM_SERVER",
            "502, UPSTREAM_SERVER",
            "503, UPSTREAM_SERVER",
            "504, UPSTREAM_SERVER"
    })
    void classify_retriableStatus_isTransient(int status, ErrorKind expected) {
        ApiFailure failure = failureFor(ApiResponse.of(status, ""));

        assertThat(failure.kind()).isEqualTo(expected);
        assertThat(failure.retriable()).isTrue();
        assertThat(failure.status()).isEqualTo(status);
        assertThat(failure.operation()).isEqualTo("GET /repos/octocat/hello-world");
    }

    @ParameterizedTest
    @CsvSource({
            "401, AUTHENTICATION",
            "403, AUTHORIZATION",
            "404, NOT_FOUND"
    })
    void classify_clientErrors_areTerminal(int status, ErrorKind expected) {
        ApiFailure failure = failureFor(ApiResponse.of(status, ""));

        assertThat(failure.kind()).isEqualTo(expected);
        assertThat(failure.retriable()).isFalse();
    }

    @Test
    void classify_403WithExhaustedQuota_isRateLimited() {
        ApiResponse response = new ApiResponse(403, Map.of("x-ratelimit-remaining", List.of("0")), "");

        ApiFailure failure = failureFor(response);

        assertThat(failure.kind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(failure.retriable()).isFalse();
    }

    @Test
    void classify_unlistedStatus_isUnexpectedWithBodyExcerpt() {
        String body = "x".repeat(500);

        ApiFailure failure = failureFor(ApiResponse.of(418, body));

        assertThat(failure.kind()).isEqualTo(ErrorKind.UNEXPECTED);
        assertThat(failure.retriable()).isFalse();
        assertThat(failure.status()).isEqualTo(418);
        assertThat(failure.message()).contains("418").contains("x".repeat(200)).doesNotContain("x".repeat(201));
    }

    @Test
    void classify_customRetriableSet_isHonoured() {
        ApiFailureClassifier narrow = new ApiFailureClassifier(Set.of(503));

        assertThat(narrow.classify(REQUEST, ApiResponse.of(503, "")).failureOrNull().retriable()).isTrue();
        assertThat(narrow.classify(REQUEST, ApiResponse.of(500, "")).failureOrNull().retriable()).isFalse();
    }

    @Test
    void classify_timeout_isTransientTimeout() {
        ApiFailure failure = classifier.classify(REQUEST, new HttpTimeoutException("request timed out"));

        assertThat(failure.kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(failure.retriable()).isTrue();
        assertThat(failure.status()).isNull();
        assertThat(failure.message()).contains("request timed out");
        assertThat(failure.cause().type()).isEqualTo(HttpTimeoutException.class.getName());
    }

    @Test
    void classify_otherIoError_isTransientNetwork() {
        ApiFailure failure = classifier.classify(REQUEST, new ConnectException("Connection refused"));

        assertThat(failure.kind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(failure.retriable()).isTrue();
        assertThat(failure.message()).contains("Connection refused");
    }

    @Test
    void classify_genericIoError_isNetwork() {
        assertThat(classifier.classify(REQUEST, new IOException("reset")).kind()).isEqualTo(ErrorKind.NETWORK);
    }

    private ApiFailure failureFor(ApiResponse response) {
        CallOutcome<ApiResponse> outcome = classifier.classify(REQUEST, response);
        assertThat(outcome.isFail()).isTrue();
        return outcome.failureOrNull();
    }
}
