package org.javai.gitpulse.http;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * A raw upstream response.
 *
 * @param status HTTP status code
 * @param headers Response headers; lookups are case-insensitive
 * @param body Response body as text (never null)
 */
public record ApiResponse(int status, Map<String, List<String>> headers, String body) {

    public ApiResponse {
        TreeMap<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null) {
                    normalized.put(name, List.copyOf(values));
                }
            });
        }
        headers = Collections.unmodifiableMap(normalized);
        body = Objects.requireNonNullElse(body, "");
    }

    public static ApiResponse of(int status, String body) {
        return new ApiResponse(status, Map.of(), body);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    /**
     * Parses a numeric header such as {@code X-RateLimit-Remaining}. Absent or malformed
     * values yield an empty result.
     */
    public OptionalInt intHeader(String name) {
        Optional<String> value = header(name);
        if (value.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.get().trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * The first {@code max} characters of the body, for error messages.
     */
    public String bodyExcerpt(int max) {
        return body.length() <= max ? body : body.substring(0, max);
    }
}
