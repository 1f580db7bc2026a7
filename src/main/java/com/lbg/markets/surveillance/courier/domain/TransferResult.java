package com.lbg.markets.surveillance.courier.domain;

/**
 * Terminal outcome of one candidate within a scan cycle.
 */
public record TransferResult(
        String sourcePath,
        Status status,
        long sequenceId,
        int partsSent,
        long bytesDelivered,
        String reason
) {
    public enum Status {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    public static TransferResult delivered(String sourcePath, long sequenceId, int parts, long bytes) {
        return new TransferResult(sourcePath, Status.DELIVERED, sequenceId, parts, bytes, null);
    }

    public static TransferResult skipped(String sourcePath, String reason) {
        return new TransferResult(sourcePath, Status.SKIPPED, -1, 0, 0, reason);
    }

    public static TransferResult failed(String sourcePath, String error) {
        return new TransferResult(sourcePath, Status.FAILED, -1, 0, 0, error);
    }
}
