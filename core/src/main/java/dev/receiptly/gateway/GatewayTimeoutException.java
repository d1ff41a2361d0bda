package dev.receiptly.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * Raised when an external dependency does not answer within its configured deadline.
 * Callers decide whether to retry; nothing below the tool surface retries on its own.
 */
public class GatewayTimeoutException extends RuntimeException {

    private final String gateway;
    private final Duration timeout;

    public GatewayTimeoutException(String gateway, Duration timeout, Throwable cause) {
        super("%s did not respond within %d ms".formatted(gateway, timeout.toMillis()), cause);
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.timeout = timeout;
    }

    public String getGateway() {
        return gateway;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
