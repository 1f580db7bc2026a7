package com.lbg.markets.surveillance.courier.archive;

import java.io.IOException;

/**
 * Archival of one source file failed. The file is left for the next cycle.
 */
public class ArchiveException extends IOException {

    public enum Reason {
        DISK_FULL,
        PERMISSION_DENIED,
        ENCRYPTION_CONFIG,
        IO
    }

    private final Reason reason;

    public ArchiveException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
