package dev.receiptly.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Envelope returned by every tool: either {@code data} or {@code error}, never both.
 */
public record ToolResult<T>(T data, ToolError error) {

    public ToolResult {
        if (data != null && error != null) {
            throw new IllegalArgumentException("A tool result carries either data or an error");
        }
    }

    public static <T> ToolResult<T> success(T data) {
        return new ToolResult<>(data, null);
    }

    public static <T> ToolResult<T> failure(ToolError error) {
        return new ToolResult<>(null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
