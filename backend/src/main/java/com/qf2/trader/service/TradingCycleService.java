package com.qf2.trader.service;

import com.qf2.trader.common.Result;
import com.qf2.trader.exception.CycleInProgressException;
import com.qf2.trader.exception.EmptyUniverseException;
import com.qf2.trader.gateway.ExecutionGateway;
import com.qf2.trader.model.MarketSnapshot;
import com.qf2.trader.port.AuditRecord;
import com.qf2.trader.port.AuditSink;
import com.qf2.trader.port.AuditType;
import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.port.SentimentProvider;
import com.qf2.trader.rebalance.CircuitBreakerService;
import com.qf2.trader.rebalance.CycleContext;
import com.qf2.trader.rebalance.PortfolioLedger;
import com.qf2.trader.rebalance.RebalanceOrchestrator;
import com.qf2.trader.rebalance.RebalanceResult;
import com.qf2.trader.selection.AdaptiveSelectionEngine;
import com.qf2.trader.selection.SelectionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one full cycle: snapshot, selection, rebalance. At most one cycle runs at a time; the
 * portfolio ledger is only touched while the cycle lock is held.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCycleService {

    private final MarketSnapshotLoader snapshotLoader;
    private final SentimentProvider sentimentProvider;
    private final AdaptiveSelectionEngine selectionEngine;
    private final RebalanceOrchestrator orchestrator;
    private final PortfolioLedger ledger;
    private final ExecutionGateway executionGateway;
    private final CircuitBreakerService circuitBreaker;
    private final AuditSink auditSink;
    private final TradingMetrics metrics;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<CycleContext> running = new AtomicReference<>();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    public CycleReport runCycle(String trigger) {
        if (!cycleLock.tryLock()) {
            CycleContext current = running.get();
            throw new CycleInProgressException(current != null ? current.cycleId() : "unknown");
        }
        CycleContext context = new CycleContext(UUID.randomUUID().toString(), clock.instant());
        running.set(context);
        MDC.put("cycleId", context.cycleId());
        try {
            CycleReport report = execute(context, trigger);
            lastReport.set(report);
            metrics.recordCycle(report.status().name());
            audit(context, AuditType.CYCLE_FINISHED, Map.of("status", report.status(),
                    "message", report.message() == null ? "" : report.message()));
            log.info("Cycle {} finished: {} {}", context.cycleId(), report.status(),
                    report.message() == null ? "" : report.message());
            return report;
        } finally {
            running.set(null);
            MDC.remove("cycleId");
            cycleLock.unlock();
        }
    }

    /**
     * @return false when no cycle is running
     */
    public boolean requestAbort(String reason) {
        CycleContext context = running.get();
        if (context == null) {
            return false;
        }
        log.warn("Abort requested for cycle {}: {}", context.cycleId(), reason);
        context.requestAbort(reason);
        return true;
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public boolean isRunning() {
        return cycleLock.isLocked();
    }

    private CycleReport execute(CycleContext context, String trigger) {
        log.info("Cycle {} started ({})", context.cycleId(), trigger);
        audit(context, AuditType.CYCLE_STARTED, Map.of("trigger", trigger));
        circuitBreaker.beginCycle();
        SelectionOutcome selection = null;
        try {
            if (!ledger.isSynced()) {
                Result<ExecutionPort.AccountSnapshot> account = executionGateway.fetchAccount();
                if (!account.isOk()) {
                    return report(context, trigger, CycleStatus.FAILED,
                            "Account unavailable: " + account.errorKind() + " " + account.error(), null, null);
                }
                ledger.syncFrom(account.get(), clock.instant());
            }

            MarketSnapshot snapshot = snapshotLoader.load();
            Map<String, Double> sentiment = loadSentiment(snapshot);
            selection = selectionEngine.select(context.cycleId(), snapshot, sentiment);
            selection.fallbacks().forEach(fallback -> metrics.recordFallback(fallback.name()));
            if (selection.annealedEnergy() != null) {
                metrics.updateSelectionEnergy(selection.annealedEnergy());
            }
            if (context.isAbortRequested()) {
                return report(context, trigger, CycleStatus.ABORTED, context.abortReason(), selection, null);
            }

            RebalanceResult result = orchestrator.rebalance(context, selection.weights());
            CycleStatus status = result.circuitBreakerTripped() || circuitBreaker.isTripped()
                    ? CycleStatus.HALTED
                    : result.aborted() ? CycleStatus.ABORTED : CycleStatus.COMPLETED;
            return report(context, trigger, status, result.abortReason(), selection, result);
        } catch (EmptyUniverseException e) {
            log.warn("Cycle {} skipped: {}", context.cycleId(), e.getMessage());
            return report(context, trigger, CycleStatus.EMPTY_UNIVERSE, e.getMessage(), selection, null);
        } catch (RuntimeException e) {
            log.error("Cycle {} failed", context.cycleId(), e);
            return report(context, trigger, CycleStatus.FAILED, e.toString(), selection, null);
        }
    }

    private Map<String, Double> loadSentiment(MarketSnapshot snapshot) {
        try {
            return sentimentProvider.getScores(snapshot.assets());
        } catch (RuntimeException e) {
            log.warn("Sentiment feed unavailable, scoring with neutral sentiment: {}", e.getMessage());
            return Map.of();
        }
    }

    private CycleReport report(CycleContext context, String trigger, CycleStatus status, String message,
                               SelectionOutcome selection, RebalanceResult result) {
        return new CycleReport(context.cycleId(), trigger, context.startedAt(), clock.instant(), status, message,
                selection, result);
    }

    private void audit(CycleContext context, AuditType type, Map<String, Object> payload) {
        auditSink.append(AuditRecord.of(type, clock.instant(), context.cycleId(), new LinkedHashMap<>(payload)));
    }
}
