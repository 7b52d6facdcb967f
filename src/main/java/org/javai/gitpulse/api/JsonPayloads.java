package org.javai.gitpulse.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gitpulse.ApiFailure;
import org.javai.gitpulse.CallOutcome;
import org.javai.gitpulse.Cause;
import org.javai.gitpulse.ErrorKind;
import org.javai.gitpulse.http.ApiRequest;
import org.javai.gitpulse.http.ApiResponse;

import java.util.Objects;

/**
 * Reads upstream response bodies as Jackson trees and builds structured payloads.
 * A body that does not parse becomes an {@code UNEXPECTED} failure carrying the parser message.
 */
public final class JsonPayloads {

    private final ObjectMapper mapper;

    public JsonPayloads() {
        this(new ObjectMapper());
    }

    public JsonPayloads(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Parses a successful response body, keeping the response status.
     */
    public CallOutcome<JsonNode> read(ApiRequest request, ApiResponse response) {
        try {
            return CallOutcome.success(mapper.readTree(response.body()), response.status());
        } catch (JsonProcessingException e) {
            String operation = request.describe();
            return CallOutcome.fail(ApiFailure.terminalFailure(ErrorKind.UNEXPECTED,
                    "Malformed JSON from " + operation + ": " + e.getOriginalMessage(),
                    response.status(), operation, Cause.fromThrowable(e)));
        }
    }

    /**
     * Parses a response body that must be a JSON object.
     */
    public CallOutcome<JsonNode> readObject(ApiRequest request, ApiResponse response) {
        return read(request, response).flatMap(node -> node.isObject()
                ? CallOutcome.success(node, response.status())
                : CallOutcome.fail(shapeFailure(request, response, "object", node)));
    }

    /**
     * Parses a response body that must be a JSON array.
     */
    public CallOutcome<JsonNode> readArray(ApiRequest request, ApiResponse response) {
        return read(request, response).flatMap(node -> node.isArray()
                ? CallOutcome.success(node, response.status())
                : CallOutcome.fail(shapeFailure(request, response, "array", node)));
    }

    public ObjectNode objectNode() {
        return mapper.createObjectNode();
    }

    public ArrayNode arrayNode() {
        return mapper.createArrayNode();
    }

    private static ApiFailure shapeFailure(ApiRequest request, ApiResponse response, String expected, JsonNode actual) {
        String operation = request.describe();
        return ApiFailure.terminalFailure(ErrorKind.UNEXPECTED,
                "Expected a JSON " + expected + " from " + operation + " but got " + actual.getNodeType(),
                response.status(), operation, null);
    }
}
