package com.lbg.markets.surveillance.courier.transport;

import java.nio.file.Path;

/**
 * One document to deliver: a whole artifact or one part of it.
 *
 * @param sourcePath monitored path the unit belongs to, used to file error notices
 * @param file       bytes to upload
 * @param caption    ready-to-send caption
 * @param label      human-readable name for error notices
 */
public record DeliveryUnit(String sourcePath, Path file, String caption, String label) {
    public DeliveryUnit {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("sourcePath cannot be blank");
        }
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
    }
}
