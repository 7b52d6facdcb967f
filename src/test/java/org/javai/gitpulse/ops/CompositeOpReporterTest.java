package org.javai.gitpulse.ops;

import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeOpReporterTest {

	private static final ApiFailure FAILURE = new ApiFailure(ErrorKind.UPSTREAM_SERVER, "HTTP 502 from GET /repos/o/r",
			true, 502, "GET /repos/o/r", 1, null, Instant.parse("2024-01-20T10:30:00Z"));

	@Test
	void everyReporterReceivesEveryEvent() {
		CapturingOpReporter first = new CapturingOpReporter();
		CapturingOpReporter second = new CapturingOpReporter();
		OpReporter composite = OpReporter.composite(first, second);

		composite.report(FAILURE);
		composite.reportRetryAttempt(FAILURE, 1, Duration.ofSeconds(1));
		composite.reportRetryExhausted(FAILURE, 3);
		composite.reportQuotaLow("GET /repos/o/r", 5);

		for (CapturingOpReporter reporter : List.of(first, second)) {
			assertThat(reporter.failures).containsExactly(FAILURE);
			assertThat(reporter.retries).containsExactly(new CapturingOpReporter.RetryAttempt(FAILURE, 1, Duration.ofSeconds(1)));
			assertThat(reporter.exhausted).containsExactly(new CapturingOpReporter.RetryExhausted(FAILURE, 3));
			assertThat(reporter.quotaLow).containsExactly(new CapturingOpReporter.QuotaLow("GET /repos/o/r", 5));
		}
	}

	@Test
	void failingReporter_doesNotStopTheOthers() {
		OpReporter broken = failure -> {
			throw new IllegalStateException("sink down");
		};
		CapturingOpReporter healthy = new CapturingOpReporter();

		CompositeOpReporter composite = CompositeOpReporter.of(List.of(broken, healthy));

		assertThatCode(() -> composite.report(FAILURE)).doesNotThrowAnyException();
		assertThat(healthy.failures).containsExactly(FAILURE);
		assertThat(composite.size()).isEqualTo(2);
	}
}
