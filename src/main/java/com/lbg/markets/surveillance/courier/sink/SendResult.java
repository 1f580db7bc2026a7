package com.lbg.markets.surveillance.courier.sink;

import java.time.Duration;

/**
 * Outcome of a single call to the remote endpoint. Remote failures are values,
 * not exceptions, so callers branch on {@link #status()}.
 */
public record SendResult(
        Status status,
        long messageId,
        Duration retryAfter,
        FailureKind failureKind,
        String detail
) {
    public enum Status {
        SUCCESS,
        RETRY_AFTER,
        FAILURE
    }

    public enum FailureKind {
        NETWORK,
        UNAUTHORIZED,
        REJECTED,
        SERVER,
        MALFORMED_RESPONSE
    }

    public static SendResult success(long messageId) {
        return new SendResult(Status.SUCCESS, messageId, Duration.ZERO, null, null);
    }

    public static SendResult retryAfter(Duration wait) {
        return new SendResult(Status.RETRY_AFTER, -1, wait, null, "rate limit exceeded");
    }

    public static SendResult failure(FailureKind kind, String detail) {
        return new SendResult(Status.FAILURE, -1, Duration.ZERO, kind, detail);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
