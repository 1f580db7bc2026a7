package com.lbg.markets.surveillance.courier.orchestration;

import com.lbg.markets.surveillance.courier.config.CourierConfig;
import com.lbg.markets.surveillance.courier.config.PipelineSettings;
import com.lbg.markets.surveillance.courier.domain.TransferResult;
import com.lbg.markets.surveillance.courier.notify.EventNotifier;
import com.lbg.markets.surveillance.courier.tracker.StateStoreException;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Runs scan cycles on a single worker thread: cycle, wait the configured
 * interval, repeat. A cycle that cannot start (for example because the ledger
 * is unreadable) is logged and retried after the normal interval.
 *
 * <p>Stopping lets the in-flight candidate finish and cuts the wait short.
 * A stopped scheduler can be started again.
 */
@ApplicationScoped
public class ScanScheduler {

    private static final Logger LOG = Logger.getLogger(ScanScheduler.class);

    private final DeliveryPipeline pipeline;
    private final PipelineState state;
    private final EventNotifier notifier;
    private final PipelineSettings settings;
    private final boolean enabled;
    private final Duration shutdownGrace;

    private CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;
    private volatile boolean stopRequested;
    private ExecutorService worker;

    @Inject
    public ScanScheduler(DeliveryPipeline pipeline, PipelineState state, EventNotifier notifier,
                         PipelineSettings settings, CourierConfig config) {
        this(pipeline, state, notifier, settings, config.scan().enabled(), config.scan().shutdownGrace());
    }

    public ScanScheduler(DeliveryPipeline pipeline, PipelineState state, EventNotifier notifier,
                         PipelineSettings settings, boolean enabled, Duration shutdownGrace) {
        this.pipeline = pipeline;
        this.state = state;
        this.notifier = notifier;
        this.settings = settings;
        this.enabled = enabled;
        this.shutdownGrace = shutdownGrace;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Load persisted state, publish it, and start the loop. Does nothing when scanning is disabled.
     */
    public synchronized boolean start() {
        LOG.infof("Courier configured: %s, %d folders, chunk size %d bytes",
                settings.archiveSpec(), settings.roots().size(), settings.maxChunkBytes());
        if (!enabled) {
            LOG.info("Scanning disabled (courier.scan.enabled=false)");
            return false;
        }
        if (running) {
            return true;
        }
        try {
            state.ledger().reload();
            LOG.infof("History loaded, next file_id %d", state.ledger().nextSequenceId());
            notifier.publishHistory(state.ledger().snapshot());
        } catch (StateStoreException e) {
            LOG.errorf(e, "Could not load delivery history, the first cycle will retry");
        }
        CountDownLatch signal = new CountDownLatch(1);
        stopSignal = signal;
        stopRequested = false;
        running = true;
        worker = Executors.newSingleThreadExecutor(r -> new Thread(r, "courier-scan"));
        worker.submit(() -> loop(signal));
        LOG.info("Scan loop started");
        return true;
    }

    public void stop() {
        ExecutorService current;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            stopRequested = true;
            stopSignal.countDown();
            current = worker;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("Scan worker still busy after %s, interrupting", shutdownGrace);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Scan loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void loop(CountDownLatch signal) {
        while (signal.getCount() > 0) {
            try {
                runCycle(() -> signal.getCount() > 0);
                if (signal.await(settings.scanInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                LOG.info("Scan worker interrupted");
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * A single cycle over the configured roots. Errors that prevent the cycle
     * from running are logged and yield an empty result.
     */
    public List<TransferResult> runOnce() throws InterruptedException {
        return runCycle(() -> !stopRequested);
    }

    private List<TransferResult> runCycle(BooleanSupplier keepRunning) throws InterruptedException {
        try {
            return pipeline.runCycle(settings.roots(), keepRunning);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scan cycle aborted, retrying in %s", settings.scanInterval());
            return List.of();
        }
    }
}
