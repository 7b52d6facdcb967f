package org.javai.gitpulse.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One read request against the upstream API.
 *
 * @param method The HTTP method; only {@code GET} is issued by this library
 * @param path The path below the API base URL, starting with {@code /}
 * @param query Query parameters in insertion order
 */
public record ApiRequest(String method, String path, Map<String, String> query) {

    public ApiRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, Map.of());
    }

    public static ApiRequest get(String path, Map<String, String> query) {
        return new ApiRequest("GET", path, query);
    }

    /**
     * Returns a copy with one more query parameter, replacing any earlier value for the name.
     */
    public ApiRequest withParam(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(query);
        copy.put(name, value);
        return new ApiRequest(method, path, copy);
    }

    /**
     * A short description used as the operation name in failures and logs,
     * e.g. {@code GET /repos/octocat/hello-world}.
     */
    public String describe() {
        return method + " " + path;
    }
}
