package com.qf2.trader.rebalance;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Identity and abort flag of one running cycle.
 */
public class CycleContext {

    private final String cycleId;
    private final Instant startedAt;
    private final AtomicReference<String> abortReason = new AtomicReference<>();

    public CycleContext(String cycleId, Instant startedAt) {
        this.cycleId = cycleId;
        this.startedAt = startedAt;
    }

    public String cycleId() {
        return cycleId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void requestAbort(String reason) {
        abortReason.compareAndSet(null, reason == null ? "ABORT_REQUESTED" : reason);
    }

    public boolean isAbortRequested() {
        return abortReason.get() != null;
    }

    public String abortReason() {
        return abortReason.get();
    }
}
