package com.lbg.markets.surveillance.courier.admin;

import com.lbg.markets.surveillance.courier.config.CourierConfig;
import com.lbg.markets.surveillance.courier.domain.FileRecord;
import com.lbg.markets.surveillance.courier.orchestration.PipelineState;
import com.lbg.markets.surveillance.courier.tracker.StateStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Operations the dashboard performs against the pipeline's state.
 * Resets replace state wholesale; the scan worker picks the change up on its
 * next ledger reload.
 */
@ApplicationScoped
public class AdminService {

    private static final Logger LOG = Logger.getLogger(AdminService.class);

    private final PipelineState state;
    private final StateStore store;
    private final List<Path> logFiles;

    @Inject
    public AdminService(PipelineState state, StateStore store, CourierConfig config) {
        this(state, store, config.admin().logFiles().stream()
                .map(Paths::get)
                .collect(Collectors.toList()));
    }

    public AdminService(PipelineState state, StateStore store, List<Path> logFiles) {
        this.state = state;
        this.store = store;
        this.logFiles = List.copyOf(logFiles);
    }

    /**
     * Delivery history, most recent file_id first.
     */
    public List<FileRecord> history() {
        List<FileRecord> records = new ArrayList<>(state.ledger().snapshot().values());
        records.sort(Comparator.comparingLong(FileRecord::sequenceId).reversed());
        return records;
    }

    public Optional<FileRecord> findBySequenceId(long sequenceId) {
        return state.ledger().findBySequenceId(sequenceId);
    }

    /**
     * Truncate the delivery log files. Returns how many files were truncated.
     */
    public int clearDeliveryLogs() throws IOException {
        int cleared = 0;
        for (Path logFile : logFiles) {
            if (Files.exists(logFile)) {
                try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.WRITE)) {
                    channel.truncate(0);
                }
                LOG.infof("Cleared log file: %s", logFile);
                cleared++;
            }
        }
        return cleared;
    }

    /**
     * Empty the ledger and the size cache, both in memory and on disk.
     */
    public void clearAllState() {
        state.ledger().reset();
        state.sizes().clear();
        store.saveSizeCache(Map.of());
        LOG.info("Cleared persisted JSON state (history and size cache)");
    }
}
