package com.lbg.markets.surveillance.courier.archive;

import java.nio.file.Path;

/**
 * One part of a split artifact; {@code number} is 1-based.
 */
public record Chunk(Path path, int number, int total, long size) {
    public Chunk {
        if (number < 1 || number > total) {
            throw new IllegalArgumentException("part " + number + " out of range 1.." + total);
        }
    }
}
