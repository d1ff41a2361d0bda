package dev.receiptly.tools;

import java.util.Objects;

public record ToolError(ToolErrorCode code, String message, boolean retryable) {

    public ToolError {
        Objects.requireNonNull(code, "code");
    }

    public static ToolError of(ToolErrorCode code, String message) {
        return new ToolError(code, message, code.isRetryable());
    }
}
