package org.javai.gitpulse.config;

import org.javai.gitpulse.api.ApiFailureClassifier;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Settings of a {@link org.javai.gitpulse.GitPulse} instance.
 *
 * <p>{@link #resolve()} reads each setting from a system property first, then from an
 * environment variable, and falls back to the default:
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>System property</th><th>Environment variable</th><th>Default</th></tr>
 *   <tr><td>gitpulse.baseUrl</td><td>GITPULSE_BASE_URL</td><td>https://api.github.com</td></tr>
 *   <tr><td>gitpulse.token</td><td>GITHUB_TOKEN</td><td>none</td></tr>
 *   <tr><td>gitpulse.userAgent</td><td>GITPULSE_USER_AGENT</td><td>GitPulse/1.0</td></tr>
 *   <tr><td>gitpulse.timeout</td><td>GITPULSE_TIMEOUT</td><td>20s</td></tr>
 *   <tr><td>gitpulse.rate.permits</td><td>GITPULSE_RATE_PERMITS</td><td>1</td></tr>
 *   <tr><td>gitpulse.rate.window</td><td>GITPULSE_RATE_WINDOW</td><td>1s</td></tr>
 *   <tr><td>gitpulse.retry.maxAttempts</td><td>GITPULSE_RETRY_MAX_ATTEMPTS</td><td>3</td></tr>
 *   <tr><td>gitpulse.retry.baseDelay</td><td>GITPULSE_RETRY_BASE_DELAY</td><td>1s</td></tr>
 *   <tr><td>gitpulse.retry.maxDelay</td><td>GITPULSE_RETRY_MAX_DELAY</td><td>60s</td></tr>
 *   <tr><td>gitpulse.retry.statuses</td><td>GITPULSE_RETRY_STATUSES</td><td>429,500,502,503,504</td></tr>
 *   <tr><td>gitpulse.quota.lowWaterMark</td><td>GITPULSE_QUOTA_LOW_WATER_MARK</td><td>100</td></tr>
 *   <tr><td>gitpulse.fanout.threads</td><td>GITPULSE_FANOUT_THREADS</td><td>5</td></tr>
 *   <tr><td>gitpulse.metrics.namespace</td><td>GITPULSE_METRICS_NAMESPACE</td><td>none</td></tr>
 * </table>
 *
 * <p>Durations are ISO-8601 ({@code PT20S}) or a number with an {@code ms}, {@code s} or
 * {@code m} suffix. Malformed values fail fast with {@link IllegalStateException}.
 */
public record GitPulseConfig(
        String baseUrl,
        String token,
        String userAgent,
        Duration timeout,
        int ratePermits,
        Duration rateWindow,
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Set<Integer> retriableStatuses,
        int quotaLowWaterMark,
        int fanOutThreads,
        String metricsNamespace
) {

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    public static final String DEFAULT_USER_AGENT = "GitPulse/1.0";

    public GitPulseConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(userAgent, "userAgent must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(rateWindow, "rateWindow must not be null");
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        retriableStatuses = Set.copyOf(retriableStatuses);
        token = token == null || token.isBlank() ? null : token;
        requirePositive("timeout", timeout);
        requirePositive("rateWindow", rateWindow);
        requireAtLeast("ratePermits", ratePermits, 1);
        requireAtLeast("maxAttempts", maxAttempts, 1);
        requireAtLeast("quotaLowWaterMark", quotaLowWaterMark, 0);
        requireAtLeast("fanOutThreads", fanOutThreads, 1);
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalStateException("retry delays must satisfy 0 <= baseDelay <= maxDelay");
        }
    }

    public static GitPulseConfig defaults() {
        return new GitPulseConfig(DEFAULT_BASE_URL, null, DEFAULT_USER_AGENT, Duration.ofSeconds(20),
                1, Duration.ofSeconds(1), 3, Duration.ofSeconds(1), Duration.ofSeconds(60),
                ApiFailureClassifier.DEFAULT_RETRIABLE_STATUSES, 100, 5, null);
    }

    /**
     * Resolves every setting from system properties, then the environment, then defaults.
     */
    public static GitPulseConfig resolve() {
        return resolve(System::getProperty, System::getenv);
    }

    /**
     * Resolves settings from {@code gitpulse.*} keys of the given properties, then defaults.
     */
    public static GitPulseConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return resolve(properties::getProperty, name -> null);
    }

    static GitPulseConfig resolve(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        Source source = new Source(systemProperties, environment);
        GitPulseConfig defaults = defaults();
        return new GitPulseConfig(
                source.string("gitpulse.baseUrl", "GITPULSE_BASE_URL", defaults.baseUrl()),
                source.string("gitpulse.token", "GITHUB_TOKEN", null),
                source.string("gitpulse.userAgent", "GITPULSE_USER_AGENT", defaults.userAgent()),
                source.duration("gitpulse.timeout", "GITPULSE_TIMEOUT", defaults.timeout()),
                source.integer("gitpulse.rate.permits", "GITPULSE_RATE_PERMITS", defaults.ratePermits()),
                source.duration("gitpulse.rate.window", "GITPULSE_RATE_WINDOW", defaults.rateWindow()),
                source.integer("gitpulse.retry.maxAttempts", "GITPULSE_RETRY_MAX_ATTEMPTS", defaults.maxAttempts()),
                source.duration("gitpulse.retry.baseDelay", "GITPULSE_RETRY_BASE_DELAY", defaults.baseDelay()),
                source.duration("gitpulse.retry.maxDelay", "GITPULSE_RETRY_MAX_DELAY", defaults.maxDelay()),
                source.statuses("gitpulse.retry.statuses", "GITPULSE_RETRY_STATUSES", defaults.retriableStatuses()),
                source.integer("gitpulse.quota.lowWaterMark", "GITPULSE_QUOTA_LOW_WATER_MARK", defaults.quotaLowWaterMark()),
                source.integer("gitpulse.fanout.threads", "GITPULSE_FANOUT_THREADS", defaults.fanOutThreads()),
                source.string("gitpulse.metrics.namespace", "GITPULSE_METRICS_NAMESPACE", null));
    }

    public boolean hasToken() {
        return token != null;
    }

    public GitPulseConfig withToken(String token) {
        return new GitPulseConfig(baseUrl, token, userAgent, timeout, ratePermits, rateWindow, maxAttempts,
                baseDelay, maxDelay, retriableStatuses, quotaLowWaterMark, fanOutThreads, metricsNamespace);
    }

    public GitPulseConfig withBaseUrl(String baseUrl) {
        return new GitPulseConfig(baseUrl, token, userAgent, timeout, ratePermits, rateWindow, maxAttempts,
                baseDelay, maxDelay, retriableStatuses, quotaLowWaterMark, fanOutThreads, metricsNamespace);
    }

    @Override
    public String toString() {
        return "GitPulseConfig[baseUrl=" + baseUrl + ", token=" + (token == null ? "none" : "****")
                + ", userAgent=" + userAgent + ", timeout=" + timeout
                + ", rate=" + ratePermits + "/" + rateWindow
                + ", maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", maxDelay=" + maxDelay
                + ", retriableStatuses=" + retriableStatuses + ", quotaLowWaterMark=" + quotaLowWaterMark
                + ", fanOutThreads=" + fanOutThreads + ", metricsNamespace=" + metricsNamespace + "]";
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalStateException(name + " must be positive, was: " + value);
        }
    }

    private static void requireAtLeast(String name, int value, int min) {
        if (value < min) {
            throw new IllegalStateException(name + " must be >= " + min + ", was: " + value);
        }
    }

    static Duration parseDuration(String text) {
        String value = text.trim();
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            if (value.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
            }
            if (value.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
            }
            if (value.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
            }
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("not a duration: '" + text + "'", e);
        }
    }

    private static final class Source {

        private final UnaryOperator<String> systemProperties;
        private final UnaryOperator<String> environment;

        private Source(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
            this.systemProperties = systemProperties;
            this.environment = environment;
        }

        String string(String sysProp, String envVar, String defaultValue) {
            String value = systemProperties.apply(sysProp);
            if (value == null || value.isBlank()) {
                value = environment.apply(envVar);
            }
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        int integer(String sysProp, String envVar, int defaultValue) {
            String value = string(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw malformed(sysProp, envVar, value, e);
            }
        }

        Duration duration(String sysProp, String envVar, Duration defaultValue) {
            String value = string(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return parseDuration(value);
            } catch (IllegalArgumentException e) {
                throw malformed(sysProp, envVar, value, e);
            }
        }

        Set<Integer> statuses(String sysProp, String envVar, Set<Integer> defaultValue) {
            String value = string(sysProp, envVar, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(status -> !status.isEmpty())
                        .map(Integer::valueOf)
                        .collect(Collectors.toUnmodifiableSet());
            } catch (NumberFormatException e) {
                throw malformed(sysProp, envVar, value, e);
            }
        }

        private static IllegalStateException malformed(String sysProp, String envVar, String value, Exception e) {
            return new IllegalStateException("Malformed configuration value '" + value
                    + "' for system property '" + sysProp + "' or environment variable '" + envVar + "'", e);
        }
    }
}
