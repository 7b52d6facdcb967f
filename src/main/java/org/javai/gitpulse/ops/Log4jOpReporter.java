package org.javai.gitpulse.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.Cause;
import org.javai.gitpulse.ErrorKind;

import java.time.Duration;

/**
 * Reports API access events through Log4j2.
 *
 * <p>Final failures are logged at a level derived from their {@link ErrorKind}:
 * <ul>
 *   <li>caller mistakes (validation, authentication, authorization, not found) → INFO</li>
 *   <li>upstream and transport trouble that outlived the retries → WARN</li>
 *   <li>{@code UNEXPECTED} → ERROR</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("API_FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker QUOTA_MARKER = MarkerManager.getMarker("QUOTA");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.gitpulse.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ApiFailure failure) {
		logger.atLevel(levelFor(failure.kind()))
			.withMarker(FAILURE_MARKER)
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of [{}] failed with {} (status {}); retrying in {} ms",
				attemptNumber,
				failure.operation(),
				failure.code(),
				failure.status(),
				delay.toMillis());
	}

	@Override
	public void reportRetryExhausted(ApiFailure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on [{}] after {} attempts. Code: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				failure.code(),
				failure.message());
	}

	@Override
	public void reportQuotaLow(String operation, int remaining) {
		logger.atWarn()
			.withMarker(QUOTA_MARKER)
			.log("GitHub API quota low after [{}]: {} requests remaining", operation, remaining);
	}

	private static String formatFailureMessage(ApiFailure failure) {
		return """
			Call [%s] failed: %s \
			| code=%s, status=%s, attempts=%d%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.code(),
				failure.status() == null ? "none" : failure.status(),
				failure.attempts(),
				formatCause(failure.cause())
			).trim();
	}

	private static String formatCause(Cause cause) {
		return cause != null ? ", cause=" + cause.type() : "";
	}

	static Level levelFor(ErrorKind kind) {
		return switch (kind) {
			case VALIDATION, AUTHENTICATION, AUTHORIZATION, NOT_FOUND -> Level.INFO;
			case RATE_LIMITED, UPSTREAM_SERVER, TIMEOUT, NETWORK -> Level.WARN;
			case UNEXPECTED -> Level.ERROR;
		};
	}
}
