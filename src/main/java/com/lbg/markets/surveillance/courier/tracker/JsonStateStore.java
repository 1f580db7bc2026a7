package com.lbg.markets.surveillance.courier.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lbg.markets.surveillance.courier.config.CourierConfig;
import com.lbg.markets.surveillance.courier.domain.FileRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Keeps the ledger and the size cache as two JSON objects keyed by path.
 * Writes go to a sibling temp file which is then renamed over the target.
 */
@ApplicationScoped
public class JsonStateStore implements StateStore {

    private static final Logger LOG = Logger.getLogger(JsonStateStore.class);

    private static final TypeReference<LinkedHashMap<String, FileRecord>> HISTORY_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Long>> SIZES_TYPE = new TypeReference<>() {
    };

    private final Path historyPath;
    private final Path sizeCachePath;
    private final ObjectMapper mapper;

    @Inject
    public JsonStateStore(CourierConfig config, ObjectMapper mapper) {
        this(Paths.get(config.state().historyPath()), Paths.get(config.state().sizeCachePath()), mapper);
    }

    public JsonStateStore(Path historyPath, Path sizeCachePath, ObjectMapper mapper) {
        this.historyPath = historyPath;
        this.sizeCachePath = sizeCachePath;
        this.mapper = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Map<String, FileRecord> loadHistory() {
        Map<String, FileRecord> raw = read(historyPath, HISTORY_TYPE, LinkedHashMap::new);
        Map<String, FileRecord> history = new LinkedHashMap<>();
        raw.forEach((key, record) -> {
            if (record != null) {
                history.put(key, key.equals(record.path()) ? record : record.withPath(key));
            }
        });
        return history;
    }

    @Override
    public void saveHistory(Map<String, FileRecord> history) {
        write(historyPath, history);
    }

    @Override
    public Map<String, Long> loadSizeCache() {
        return read(sizeCachePath, SIZES_TYPE, LinkedHashMap::new);
    }

    @Override
    public void saveSizeCache(Map<String, Long> sizes) {
        write(sizeCachePath, sizes);
    }

    private <T extends Map<String, ?>> T read(Path file, TypeReference<T> type, Supplier<T> empty) {
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : empty.get();
        } catch (NoSuchFileException | FileNotFoundException e) {
            LOG.warnf("State file not found: %s. Starting with empty state.", file);
            return empty.get();
        } catch (JsonProcessingException e) {
            LOG.warnf("Could not decode JSON from %s (%s). Starting with empty state.", file, e.getOriginalMessage());
            return empty.get();
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state file " + file, e);
        }
    }

    private void write(Path target, Map<String, ?> data) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] json = mapper.writeValueAsBytes(data);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            LOG.debugf("Saved %d entries to %s", data.size(), target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StateStoreException("Failed to write state file " + target, e);
        }
    }
}
