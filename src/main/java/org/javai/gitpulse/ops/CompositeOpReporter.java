package org.javai.gitpulse.ops;

import org.javai.gitpulse.ApiFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to several reporters.
 *
 * <p>Every reporter receives every event. A reporter that throws is logged and skipped so
 * the remaining reporters still run.
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(ApiFailure failure) {
		forEach("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(ApiFailure failure, int attemptNumber, Duration delay) {
		forEach("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(ApiFailure failure, int totalAttempts) {
		forEach("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(failure, totalAttempts));
	}

	@Override
	public void reportQuotaLow(String operation, int remaining) {
		forEach("reportQuotaLow", reporter -> reporter.reportQuotaLow(operation, remaining));
	}

	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("OpReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}
}
