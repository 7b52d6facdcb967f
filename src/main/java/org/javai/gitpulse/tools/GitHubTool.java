package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiCallException;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.ProgressSink;
import org.javai.gitpulse.api.JsonPayloads;
import org.javai.gitpulse.api.ResilientApiClient;
import org.javai.gitpulse.compare.ComparisonTarget;
import org.javai.gitpulse.http.ApiRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base class for the read-only operations exposed to callers.
 *
 * <p>{@link #invoke} is the boundary: it checks the credential, runs the operation body and
 * turns any failure into a {@link ToolException}, telling the sink about it first. Inside the
 * body, failed calls are unwrapped with {@link #fetchObject} and {@link #fetchArray}, which
 * throw and are caught there.
 */
public abstract class GitHubTool {

    private static final Logger log = LoggerFactory.getLogger(GitHubTool.class);

    protected final ResilientApiClient client;
    protected final JsonPayloads json;
    private final boolean credentialPresent;

    protected GitHubTool(ResilientApiClient client, JsonPayloads json, boolean credentialPresent) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.json = Objects.requireNonNull(json, "json must not be null");
        this.credentialPresent = credentialPresent;
    }

    /**
     * The operation name, e.g. {@code get_repository_health}.
     */
    public abstract String operation();

    protected ToolResult invoke(ProgressSink sink, Function<ProgressSink, ToolResult> body) {
        ProgressSink progress = ProgressSink.guarded(Objects.requireNonNull(sink, "sink must not be null"));
        try {
            if (!credentialPresent) {
                throw new ApiCallException(ApiFailure.missingCredential(operation()));
            }
            return body.apply(progress);
        } catch (ApiCallException e) {
            throw failed(progress, e.failure());
        }
    }

    protected ComparisonTarget repository(String owner, String repo) {
        return new ComparisonTarget(owner, repo);
    }

    protected JsonNode fetchObject(ApiRequest request, ProgressSink progress) {
        return client.execute(request, progress)
                .flatMap(response -> json.readObject(request, response))
                .getOrThrow();
    }

    protected JsonNode fetchArray(ApiRequest request, ProgressSink progress) {
        return client.execute(request, progress)
                .flatMap(response -> json.readArray(request, response))
                .getOrThrow();
    }

    /**
     * Like {@link #fetchObject}, but hands back the outcome so the caller can degrade.
     */
    protected CallOutcome<JsonNode> tryFetchObject(ApiRequest request, ProgressSink progress) {
        return client.execute(request, progress).flatMap(response -> json.readObject(request, response));
    }

    /**
     * Reads a list endpoint page by page until a short page or {@code maxPages} pages.
     *
     * @param request the first page's request; {@code per_page} and {@code page} are set here
     */
    protected List<JsonNode> fetchPages(ApiRequest request, int pageSize, int maxPages, ProgressSink progress) {
        List<JsonNode> items = new ArrayList<>();
        ApiRequest sized = request.withParam("per_page", String.valueOf(pageSize));
        for (int page = 1; page <= maxPages; page++) {
            JsonNode batch = fetchArray(sized.withParam("page", String.valueOf(page)), progress);
            batch.forEach(items::add);
            if (batch.size() < pageSize) {
                break;
            }
        }
        return items;
    }

    /**
     * Encodes a ref name (branch, tag) for use as one path segment, keeping its slashes.
     */
    protected static String refSegment(String ref) {
        return URLEncoder.encode(ref, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%2F", "/");
    }

    protected Map<String, Object> meta(ComparisonTarget target) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("owner", target.owner());
        meta.put("repo", target.repo());
        meta.put("operation", operation());
        return meta;
    }

    protected ObjectNode newObject() {
        return json.objectNode();
    }

    protected static void putInstant(ObjectNode node, String field, Instant instant) {
        if (instant == null) {
            node.putNull(field);
        } else {
            node.put(field, instant.toString());
        }
    }

    private ToolException failed(ProgressSink progress, ApiFailure failure) {
        ToolException exception = new ToolException(operation(), failure);
        log.debug("{} failed after {} attempt(s): {}", operation(), failure.attempts(), failure.message());
        progress.error(exception.getMessage());
        return exception;
    }
}
