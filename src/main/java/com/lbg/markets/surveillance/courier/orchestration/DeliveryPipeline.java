package com.lbg.markets.surveillance.courier.orchestration;

import com.lbg.markets.surveillance.courier.archive.ArchiveException;
import com.lbg.markets.surveillance.courier.archive.Archiver;
import com.lbg.markets.surveillance.courier.archive.Artifact;
import com.lbg.markets.surveillance.courier.archive.Chunk;
import com.lbg.markets.surveillance.courier.archive.ChunkSet;
import com.lbg.markets.surveillance.courier.archive.ReassemblyInstructions;
import com.lbg.markets.surveillance.courier.archive.ScratchDirectory;
import com.lbg.markets.surveillance.courier.archive.Splitter;
import com.lbg.markets.surveillance.courier.config.PipelineSettings;
import com.lbg.markets.surveillance.courier.domain.FileDescriptor;
import com.lbg.markets.surveillance.courier.domain.FileRecord;
import com.lbg.markets.surveillance.courier.domain.TransferResult;
import com.lbg.markets.surveillance.courier.notify.DeliveryEvent;
import com.lbg.markets.surveillance.courier.notify.EventNotifier;
import com.lbg.markets.surveillance.courier.source.SourceProvider;
import com.lbg.markets.surveillance.courier.tracker.Tracker;
import com.lbg.markets.surveillance.courier.transport.CaptionFormatter;
import com.lbg.markets.surveillance.courier.transport.DeliveryReceipt;
import com.lbg.markets.surveillance.courier.transport.DeliveryUnit;
import com.lbg.markets.surveillance.courier.transport.RateLimitedTransport;
import com.lbg.markets.surveillance.courier.util.ContentHasher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Drives candidates through the delivery flow:
 * filter → hash → dedupe → archive → send (whole or in parts) → commit → notify.
 *
 * <p>The ledger is only written after every part of a file has been delivered.
 * A failure anywhere leaves the ledger as it was, so the next cycle sends the
 * whole file again.
 */
@ApplicationScoped
public class DeliveryPipeline {

    private static final Logger LOG = Logger.getLogger(DeliveryPipeline.class);

    private final SourceProvider source;
    private final Archiver archiver;
    private final Splitter splitter;
    private final RateLimitedTransport transport;
    private final EventNotifier notifier;
    private final PipelineState state;
    private final PipelineSettings settings;
    private final Clock clock;

    @Inject
    public DeliveryPipeline(SourceProvider source, Archiver archiver, Splitter splitter,
                            RateLimitedTransport transport, EventNotifier notifier,
                            PipelineState state, PipelineSettings settings) {
        this(source, archiver, splitter, transport, notifier, state, settings, Clock.systemUTC());
    }

    public DeliveryPipeline(SourceProvider source, Archiver archiver, Splitter splitter,
                            RateLimitedTransport transport, EventNotifier notifier,
                            PipelineState state, PipelineSettings settings, Clock clock) {
        this.source = source;
        this.archiver = archiver;
        this.splitter = splitter;
        this.transport = transport;
        this.notifier = notifier;
        this.state = state;
        this.settings = settings;
        this.clock = clock;
    }

    public List<TransferResult> runCycle(List<Path> roots) throws InterruptedException {
        return runCycle(roots, () -> true);
    }

    /**
     * One pass over the monitored roots. {@code keepRunning} is checked between
     * candidates, never in the middle of one.
     *
     * @throws com.lbg.markets.surveillance.courier.tracker.StateStoreException if the ledger cannot be read
     */
    public List<TransferResult> runCycle(List<Path> roots, BooleanSupplier keepRunning) throws InterruptedException {
        Tracker ledger = state.ledger();
        ledger.reload();

        List<FileDescriptor> candidates = order(source.list(roots));
        LOG.infof("Scan cycle started: %d candidates under %d folders", candidates.size(), roots.size());

        List<TransferResult> results = new ArrayList<>();
        for (FileDescriptor candidate : candidates) {
            if (!keepRunning.getAsBoolean()) {
                LOG.info("Stop requested, ending cycle early");
                break;
            }
            try {
                results.add(process(candidate));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Unexpected error processing %s", candidate.sourcePath());
                notifier.publish(DeliveryEvent.failure(candidate.fileName(), null, candidate.sizeBytes(), 0));
                results.add(TransferResult.failed(candidate.sourcePath(), e.getMessage()));
            }
        }

        long delivered = results.stream().filter(r -> r.status() == TransferResult.Status.DELIVERED).count();
        long failed = results.stream().filter(r -> r.status() == TransferResult.Status.FAILED).count();
        LOG.infof("Scan cycle complete: %d delivered, %d failed, %d skipped",
                delivered, failed, results.size() - delivered - failed);
        return results;
    }

    private List<FileDescriptor> order(List<FileDescriptor> candidates) {
        if (settings.sizeCacheEnabled()) {
            state.sizes().rebuild(candidates, true);
            return state.sizes().smallestFirst(candidates);
        }
        return candidates.stream()
                .sorted(Comparator.comparingLong(FileDescriptor::sizeBytes))
                .collect(Collectors.toList());
    }

    /**
     * Take one candidate to a terminal state.
     */
    public TransferResult process(FileDescriptor descriptor) throws InterruptedException {
        long startedAt = clock.millis();
        String path = descriptor.sourcePath();
        String fileName = descriptor.fileName();
        Tracker ledger = state.ledger();

        if (!settings.extensions().allows(fileName)) {
            LOG.debugf("File ignored (extension not allowed): %s", path);
            return TransferResult.skipped(path, "Extension not allowed");
        }

        String hash;
        try {
            hash = ContentHasher.hash(descriptor.path());
        } catch (IOException e) {
            LOG.warnf("Cannot read %s this cycle: %s", path, e.getMessage());
            return TransferResult.skipped(path, "Unreadable: " + e.getMessage());
        }

        if (ledger.lookupByHash(hash)) {
            LOG.debugf("File with the same hash already delivered: %s", path);
            return TransferResult.skipped(path, "Already delivered");
        }
        if (!ledger.isStaleOrNew(path, hash)) {
            LOG.debugf("File already sent and not modified: %s", path);
            return TransferResult.skipped(path, "Unchanged");
        }

        LOG.infof("New file detected or file modified: %s", path);
        try (ScratchDirectory scratch = ScratchDirectory.create(settings.scratchRoot())) {
            Artifact artifact = archiver.archive(descriptor.path(), settings.archiveSpec(), scratch.path());
            long processedSize = artifact.size();
            long uploadStartedAt = clock.millis();

            int parts;
            if (processedSize > settings.maxChunkBytes()) {
                parts = deliverInParts(path, artifact, scratch.path());
            } else {
                parts = deliverWhole(path, fileName, artifact);
            }
            if (parts == 0) {
                return fail(descriptor, hash, startedAt, "Delivery failed");
            }

            long finishedAt = clock.millis();
            FileRecord record = new FileRecord(
                    path,
                    hash,
                    clock.instant(),
                    true,
                    artifact.encrypted(),
                    settings.archiveSpec().algorithm(),
                    ledger.nextSequenceId(),
                    descriptor.sizeBytes(),
                    processedSize,
                    finishedAt - startedAt,
                    uploadSpeed(descriptor.sizeBytes(), finishedAt - uploadStartedAt)
            );
            ledger.commit(record);
            transport.retractErrorNotice(path);
            notifier.publish(DeliveryEvent.success(fileName, record));

            LOG.infof("Delivered %s as file_id %d (%d part(s), %d bytes)",
                    path, record.sequenceId(), parts, processedSize);
            return TransferResult.delivered(path, record.sequenceId(), parts, processedSize);

        } catch (ArchiveException e) {
            LOG.errorf(e, "Archiving failed for %s (%s)", path, e.reason());
            return fail(descriptor, hash, startedAt, "Archive failed: " + e.reason());
        } catch (IOException e) {
            LOG.errorf(e, "Error processing file %s", path);
            return fail(descriptor, hash, startedAt, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error processing %s", path);
            return fail(descriptor, hash, startedAt, e.getMessage());
        }
    }

    private int deliverWhole(String path, String fileName, Artifact artifact) throws InterruptedException {
        LOG.infof("Sending file: %s", artifact.path());
        String caption = CaptionFormatter.documentCaption(fileName, artifact.encrypted(), 1, 1);
        DeliveryReceipt receipt = transport.deliverDocument(
                new DeliveryUnit(path, artifact.path(), caption, fileName));
        return receipt.delivered() ? 1 : 0;
    }

    private int deliverInParts(String path, Artifact artifact, Path workDir) throws IOException, InterruptedException {
        LOG.infof("File size exceeds %d bytes. Splitting and sending: %s", settings.maxChunkBytes(), artifact.path());
        try (ChunkSet chunks = splitter.split(artifact.path(), settings.maxChunkBytes(), workDir)) {
            for (Chunk chunk : chunks.chunks()) {
                String partName = chunk.path().getFileName().toString();
                LOG.infof("Sending part %d/%d: %s", chunk.number(), chunk.total(), partName);
                String caption = CaptionFormatter.documentCaption(
                        artifact.fileName(), artifact.encrypted(), chunk.number(), chunk.total());
                DeliveryReceipt receipt = transport.deliverDocument(
                        new DeliveryUnit(path, chunk.path(), caption, partName));
                if (!receipt.delivered()) {
                    LOG.errorf("Failed to send part %d of %s", chunk.number(), artifact.fileName());
                    return 0;
                }
            }

            String instructions = ReassemblyInstructions.render(
                    artifact.fileName(), chunks.total(), artifact.zipped(), artifact.encrypted());
            DeliveryReceipt note = transport.deliverText(CaptionFormatter.codeBlock(instructions));
            if (!note.delivered()) {
                LOG.errorf("All parts of %s delivered but reassembly instructions failed: %s",
                        artifact.fileName(), note.error());
            }
            return chunks.total();
        }
    }

    private TransferResult fail(FileDescriptor descriptor, String hash, long startedAt, String reason) {
        notifier.publish(DeliveryEvent.failure(descriptor.fileName(), hash, descriptor.sizeBytes(),
                clock.millis() - startedAt));
        return TransferResult.failed(descriptor.sourcePath(), reason);
    }

    private static double uploadSpeed(long bytes, long elapsedMs) {
        return elapsedMs > 0 ? bytes * 1000.0 / elapsedMs : 0;
    }
}
