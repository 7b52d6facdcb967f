package org.javai.gitpulse.ops;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Reports API access events as JSON lines via SLF4J, for metrics pipelines.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"gitpulse.GET /repos/o/r","code":"not_found",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.gitpulse.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper mapper = new ObjectMapper();

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prepended to tracking keys (may be null or blank)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	// Package-private for testing.
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(ApiFailure failure) {
		ObjectNode event = event("failure", failure.occurredAt(), failure.operation());
		event.put("code", failure.code());
		event.put("message", failure.message());
		event.put("retriable", failure.retriable());
		event.put("attempts", failure.attempts());
		if (failure.status() != null) {
			event.put("status", failure.status());
		}
		emit(event);
	}

	@Override
	public void reportRetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {
		ObjectNode event = event("retry_attempt", failure.occurredAt(), failure.operation());
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("code", failure.code());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(ApiFailure failure, int totalAttempts) {
		ObjectNode event = event("retry_exhausted", failure.occurredAt(), failure.operation());
		event.put("totalAttempts", totalAttempts);
		event.put("code", failure.code());
		emit(event);
	}

	@Override
	public void reportQuotaLow(String operation, int remaining) {
		ObjectNode event = event("quota_low", Instant.now(), operation);
		event.put("remaining", remaining);
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode event(String type, Instant timestamp, String operation) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", type);
		event.put("timestamp", ISO_FORMATTER.format(timestamp));
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("operation", operation);
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.debug("Could not serialize metrics event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
