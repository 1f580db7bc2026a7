package com.lbg.markets.surveillance.courier.archive;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Ordered parts of one artifact. Closing deletes every part file.
 */
public final class ChunkSet implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ChunkSet.class);

    private final String artifactName;
    private final List<Chunk> chunks;

    ChunkSet(String artifactName, List<Chunk> chunks) {
        this.artifactName = artifactName;
        this.chunks = List.copyOf(chunks);
    }

    public String artifactName() {
        return artifactName;
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public int total() {
        return chunks.size();
    }

    @Override
    public void close() {
        for (Chunk chunk : chunks) {
            try {
                Files.deleteIfExists(chunk.path());
            } catch (IOException e) {
                LOG.warnf("Could not delete chunk %s: %s", chunk.path(), e.getMessage());
            }
        }
    }
}
