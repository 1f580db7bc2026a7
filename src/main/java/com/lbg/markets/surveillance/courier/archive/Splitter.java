package com.lbg.markets.surveillance.courier.archive;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts an artifact into consecutive parts of at most {@code maxChunkBytes},
 * named {@code <artifact>.001}, {@code <artifact>.002}, ... so that concatenating
 * them in name order rebuilds the artifact.
 */
@ApplicationScoped
public class Splitter {

    private static final Logger LOG = Logger.getLogger(Splitter.class);

    public static int partCount(long size, long maxChunkBytes) {
        if (maxChunkBytes <= 0) {
            throw new IllegalArgumentException("maxChunkBytes must be positive");
        }
        return Math.toIntExact((size + maxChunkBytes - 1) / maxChunkBytes);
    }

    public static String partName(String artifactName, int number) {
        return String.format("%s.%03d", artifactName, number);
    }

    public ChunkSet split(Path artifact, long maxChunkBytes, Path workDir) throws IOException {
        String artifactName = artifact.getFileName().toString();
        long size = Files.size(artifact);
        int total = partCount(size, maxChunkBytes);
        LOG.infof("Splitting file: %s (%d bytes) into %d parts", artifact, size, total);

        List<Chunk> chunks = new ArrayList<>(total);
        try (FileChannel in = FileChannel.open(artifact, StandardOpenOption.READ)) {
            for (int number = 1; number <= total; number++) {
                long offset = (number - 1) * maxChunkBytes;
                long length = Math.min(maxChunkBytes, size - offset);
                Path part = workDir.resolve(partName(artifactName, number));
                copyRange(in, offset, length, part);
                chunks.add(new Chunk(part, number, total, length));
            }
        } catch (IOException e) {
            new ChunkSet(artifactName, chunks).close();
            throw e;
        }
        return new ChunkSet(artifactName, chunks);
    }

    private static void copyRange(FileChannel in, long offset, long length, Path target) throws IOException {
        try (FileChannel out = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            long position = offset;
            long remaining = length;
            while (remaining > 0) {
                long copied = in.transferTo(position, remaining, out);
                if (copied <= 0) {
                    throw new IOException("Artifact truncated while splitting at offset " + position);
                }
                position += copied;
                remaining -= copied;
            }
        }
    }
}
