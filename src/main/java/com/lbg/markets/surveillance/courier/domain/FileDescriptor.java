package com.lbg.markets.surveillance.courier.domain;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Describes a file found under a monitored folder, before any ledger lookup.
 */
public record FileDescriptor(
        String sourcePath,
        long sizeBytes,
        long mtimeEpochMs
) {
    public FileDescriptor {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("sourcePath cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }

    public Path path() {
        return Paths.get(sourcePath);
    }

    public String fileName() {
        Path name = path().getFileName();
        return name != null ? name.toString() : sourcePath;
    }
}
