package com.lbg.markets.surveillance.courier.tracker;

import com.lbg.markets.surveillance.courier.domain.FileDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Path to byte size, rebuilt from the filesystem every cycle and used only to
 * order the work queue. Never consulted for anything else.
 */
@ApplicationScoped
public class SizeCache {

    private static final Logger LOG = Logger.getLogger(SizeCache.class);

    private final StateStore store;
    private Map<String, Long> sizes = new LinkedHashMap<>();

    @Inject
    public SizeCache(StateStore store) {
        this.store = store;
    }

    /**
     * Replace the cache with the sizes of the given candidates and, when
     * {@code persist} is set, write it out.
     */
    public synchronized void rebuild(List<FileDescriptor> candidates, boolean persist) {
        Map<String, Long> rebuilt = new LinkedHashMap<>();
        for (FileDescriptor candidate : candidates) {
            rebuilt.put(candidate.sourcePath(), candidate.sizeBytes());
        }
        sizes = rebuilt;
        if (persist) {
            store.saveSizeCache(rebuilt);
            LOG.debugf("File size cache built (%d entries)", rebuilt.size());
        }
    }

    /**
     * Candidates ordered smallest first. Equal sizes keep their enumeration order.
     */
    public synchronized List<FileDescriptor> smallestFirst(List<FileDescriptor> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparingLong(d -> sizes.getOrDefault(d.sourcePath(), d.sizeBytes())))
                .collect(Collectors.toList());
    }

    public synchronized Map<String, Long> entries() {
        return Map.copyOf(sizes);
    }

    public synchronized void clear() {
        sizes = new LinkedHashMap<>();
    }
}
