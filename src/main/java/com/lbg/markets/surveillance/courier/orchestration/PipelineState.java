package com.lbg.markets.surveillance.courier.orchestration;

import com.lbg.markets.surveillance.courier.tracker.LedgerTracker;
import com.lbg.markets.surveillance.courier.tracker.PendingErrors;
import com.lbg.markets.surveillance.courier.tracker.SizeCache;
import com.lbg.markets.surveillance.courier.tracker.StateStore;
import com.lbg.markets.surveillance.courier.tracker.Tracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Mutable state owned by the scan worker: ledger, size cache and pending
 * error notices. All of it is reached through here rather than held globally.
 */
@ApplicationScoped
public class PipelineState {

    private final Tracker ledger;
    private final SizeCache sizes;
    private final PendingErrors pendingErrors;

    @Inject
    public PipelineState(Tracker ledger, SizeCache sizes, PendingErrors pendingErrors) {
        this.ledger = ledger;
        this.sizes = sizes;
        this.pendingErrors = pendingErrors;
    }

    /**
     * Fresh state over the given store, for wiring outside the container.
     */
    public static PipelineState over(StateStore store) {
        return new PipelineState(new LedgerTracker(store), new SizeCache(store), new PendingErrors());
    }

    public Tracker ledger() {
        return ledger;
    }

    public SizeCache sizes() {
        return sizes;
    }

    public PendingErrors pendingErrors() {
        return pendingErrors;
    }
}
