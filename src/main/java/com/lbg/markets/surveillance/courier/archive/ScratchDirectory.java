package com.lbg.markets.surveillance.courier.archive;

import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Per-candidate working directory for archives and chunks. Closing it removes
 * everything inside, whichever way the candidate finished.
 */
public final class ScratchDirectory implements Closeable {

    private static final Logger LOG = Logger.getLogger(ScratchDirectory.class);

    private final Path dir;

    private ScratchDirectory(Path dir) {
        this.dir = dir;
    }

    public static ScratchDirectory create(Path parent) throws IOException {
        if (parent == null) {
            return new ScratchDirectory(Files.createTempDirectory("courier-"));
        }
        Files.createDirectories(parent);
        return new ScratchDirectory(Files.createTempDirectory(parent, "courier-"));
    }

    public Path path() {
        return dir;
    }

    @Override
    public void close() {
        if (!Files.exists(dir)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.deleteIfExists(d);
                    return FileVisitResult.CONTINUE;
                }
            });
            LOG.debugf("Removed scratch directory %s", dir);
        } catch (IOException e) {
            LOG.warnf(e, "Could not fully remove scratch directory %s", dir);
        }
    }
}
