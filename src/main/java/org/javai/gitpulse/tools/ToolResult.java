package org.javai.gitpulse.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * What an operation hands back to its caller: a human-readable rendering, the same data as a
 * structured JSON payload, and metadata identifying the operation and its subject.
 *
 * @param text Human-readable summary
 * @param structured Machine-readable payload with snake_case field names
 * @param meta Operation name and subject identity
 */
public record ToolResult(String text, JsonNode structured, Map<String, Object> meta) {

    public ToolResult {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(structured, "structured must not be null");
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public String operation() {
        return String.valueOf(meta.get("operation"));
    }
}
