package com.lbg.markets.surveillance.courier.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * What gets delivered for a source file. When {@code scratch} is false the
 * artifact is the source file itself and must never be deleted by the pipeline.
 */
public record Artifact(Path path, boolean scratch, boolean zipped, boolean encrypted) {

    public static Artifact passThrough(Path source, boolean zipped) {
        return new Artifact(source, false, zipped, false);
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public long size() throws IOException {
        return Files.size(path);
    }
}
