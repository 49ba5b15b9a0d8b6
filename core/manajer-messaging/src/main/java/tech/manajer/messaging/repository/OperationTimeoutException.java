package tech.manajer.messaging.repository;

import java.time.Duration;

/**
 * Thrown when a persistence call does not complete within its bound.
 */
public class OperationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(operation + " did not complete within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
