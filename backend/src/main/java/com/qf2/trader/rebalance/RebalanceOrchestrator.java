package com.qf2.trader.rebalance;

import com.qf2.trader.common.ErrorKind;
import com.qf2.trader.common.Result;
import com.qf2.trader.compliance.ComplianceDecision;
import com.qf2.trader.compliance.ComplianceStateStore;
import com.qf2.trader.compliance.ProposedTrade;
import com.qf2.trader.compliance.WashComplianceEngine;
import com.qf2.trader.exception.CircuitBreakerTrippedException;
import com.qf2.trader.exception.ComplianceBlockedException;
import com.qf2.trader.gateway.ExecutionGateway;
import com.qf2.trader.gateway.MarketDataGateway;
import com.qf2.trader.model.Side;
import com.qf2.trader.model.TradeRecord;
import com.qf2.trader.port.AuditRecord;
import com.qf2.trader.port.AuditSink;
import com.qf2.trader.port.AuditType;
import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.selection.TargetWeights;
import com.qf2.trader.service.TradingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns target weights into orders in seven stages: price discovery, valuation, deltas,
 * compliance, sells, cash resync, buys. Sells always complete and cash is re-read before any buy
 * is sized. An abort request is honoured only on the boundaries up to the compliance stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RebalanceOrchestrator {

    private static final double WEIGHT_EPSILON = 1e-12;

    private final RebalanceConfig config;
    private final WashComplianceEngine complianceEngine;
    private final MarketDataGateway marketData;
    private final ExecutionGateway execution;
    private final PortfolioLedger ledger;
    private final CircuitBreakerService circuitBreaker;
    private final AuditSink auditSink;
    private final TradingMetrics metrics;
    private final Clock clock;

    public RebalanceResult rebalance(CycleContext context, TargetWeights target) {
        Run run = new Run(context);
        try {
            discoverPrices(run, target);
            if (abortAt(run, CycleStage.PRICE_DISCOVERY)) {
                return run.result();
            }
            if (!value(run)) {
                return run.result();
            }
            if (abortAt(run, CycleStage.VALUATION)) {
                return run.result();
            }
            computeDeltas(run, target);
            if (abortAt(run, CycleStage.DELTA)) {
                return run.result();
            }
            filterCompliance(run);
            if (abortAt(run, CycleStage.COMPLIANCE)) {
                return run.result();
            }
            if (circuitBreaker.isTripped()) {
                run.tripped = true;
                auditBreaker(run, CycleStage.COMPLIANCE);
                run.abort(CycleStage.COMPLIANCE, "CIRCUIT_BREAKER_TRIPPED");
                stage(run, CycleStage.COMPLIANCE, StageOutcome.Status.FAILED, Map.of("abort", run.abortReason));
                return run.result();
            }
            executeSells(run);
            resyncCash(run);
            executeBuys(run);
            return run.result();
        } finally {
            ledger.complianceState().clearReservations();
        }
    }

    private void discoverPrices(Run run, TargetWeights target) {
        Set<String> assets = new TreeSet<>(ledger.heldAssets());
        target.weights().forEach((asset, weight) -> {
            if (weight > WEIGHT_EPSILON) {
                assets.add(asset);
            }
        });
        for (String asset : assets) {
            Result<Double> price = marketData.latestPrice(asset);
            if (price.isOk() && Double.isFinite(price.get()) && price.get() > 0) {
                run.prices.put(asset, price.get());
                continue;
            }
            String error = price.isOk() ? "non-positive price " + price.get() : price.errorKind() + ": " + price.error();
            log.warn("Price unavailable for {}, excluded from this cycle ({})", asset, error);
            run.excluded.add(asset);
            audit(run, AuditType.PRICE_UNAVAILABLE, Map.of("asset", asset, "error", error));
        }
        stage(run, CycleStage.PRICE_DISCOVERY,
                run.excluded.isEmpty() ? StageOutcome.Status.COMPLETED : StageOutcome.Status.PARTIAL,
                Map.of("priced", run.prices.size(), "excluded", List.copyOf(run.excluded)));
    }

    private boolean value(Run run) {
        double value = ledger.cash();
        for (String asset : ledger.heldAssets()) {
            double quantity = ledger.quantity(asset);
            Double price = run.prices.get(asset);
            if (price != null) {
                value += quantity * price;
            } else {
                double entry = ledger.holding(asset).getAvgEntryPrice();
                log.warn("Valuing unpriced {} {} at entry price {}", quantity, asset, entry);
                value += quantity * entry;
            }
        }
        run.portfolioValue = value;
        run.cashBefore = ledger.cash();
        metrics.updatePortfolioValue(value);
        if (value <= 0) {
            log.error("Portfolio value {} is not positive, aborting cycle", value);
            run.abort(CycleStage.VALUATION, "NON_POSITIVE_PORTFOLIO_VALUE");
            stage(run, CycleStage.VALUATION, StageOutcome.Status.FAILED, Map.of("portfolioValue", value));
            return false;
        }
        if (circuitBreaker.updateEquity(value)) {
            run.tripped = true;
            auditBreaker(run, CycleStage.VALUATION);
        }
        stage(run, CycleStage.VALUATION, StageOutcome.Status.COMPLETED,
                Map.of("portfolioValue", value, "cash", run.cashBefore));
        return true;
    }

    private void computeDeltas(Run run, TargetWeights target) {
        int dust = 0;
        for (Map.Entry<String, Double> entry : run.prices.entrySet()) {
            String asset = entry.getKey();
            double price = entry.getValue();
            double held = ledger.quantity(asset);
            double currentWeight = held * price / run.portfolioValue;
            double targetWeight = target.weight(asset);
            double delta = targetWeight - currentWeight;
            if (Math.abs(delta) + WEIGHT_EPSILON < config.threshold()) {
                continue;
            }
            Side side = delta > 0 ? Side.BUY : Side.SELL;
            double quantity = Math.abs(delta) * run.portfolioValue / price;
            if (side == Side.SELL) {
                quantity = Math.min(quantity, held);
            }
            quantity = config.roundDown(asset, quantity);
            if (quantity <= 0) {
                log.debug("Dropping {} {} intent below step size", side, asset);
                dust++;
                continue;
            }
            run.intents.add(new TradeIntent(asset, side, quantity, price, currentWeight, targetWeight));
        }
        stage(run, CycleStage.DELTA, StageOutcome.Status.COMPLETED,
                Map.of("intents", run.intents.size(), "dust", dust, "threshold", config.threshold()));
    }

    private void filterCompliance(Run run) {
        ComplianceStateStore store = ledger.complianceState();
        int blocked = 0;
        for (TradeIntent intent : run.intents) {
            ComplianceDecision decision = complianceEngine.evaluate(
                    new ProposedTrade(intent.asset(), intent.side(), intent.quantity(), intent.price()),
                    store, clock.instant());
            run.decisions.add(decision);
            audit(run, AuditType.COMPLIANCE_DECISION, decisionPayload(decision));
            if (decision.approved()) {
                store.reserve(intent.asset());
                run.approved.put(intent, decision);
            } else {
                blocked++;
                metrics.recordComplianceBlock(decision.reason().name());
                log.warn("Compliance blocked {} {} {}: {} ({})", intent.side(), intent.quantity(), intent.asset(),
                        decision.reason(), decision.message());
            }
        }
        stage(run, CycleStage.COMPLIANCE, StageOutcome.Status.COMPLETED,
                Map.of("approved", run.approved.size(), "blocked", blocked));
    }

    private void executeSells(Run run) {
        List<TradeIntent> sells = run.approved.keySet().stream()
                .filter(intent -> intent.side() == Side.SELL)
                .sorted(Comparator.comparingDouble(TradeIntent::notional).reversed()
                        .thenComparing(TradeIntent::asset))
                .toList();
        for (TradeIntent sell : sells) {
            ExecutedOrder order = submit(run, sell, run.approved.get(sell));
            if (order != null) {
                run.sells.add(order);
            }
        }
        stage(run, CycleStage.SELL_EXECUTION, executionStatus(run, run.sells, sells.size()),
                Map.of("submitted", run.sells.size(), "approved", sells.size()));
        boolean anyFilled = run.sells.stream().anyMatch(ExecutedOrder::filled);
        if (anyFilled && !config.settleDelay().isZero()) {
            try {
                Thread.sleep(config.settleDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                halt(run, "INTERRUPTED");
            }
        }
    }

    private void resyncCash(Run run) {
        Result<ExecutionPort.AccountSnapshot> account = execution.fetchAccount();
        StageOutcome.Status status;
        if (account.isOk()) {
            ledger.syncCash(account.get().cash());
            status = StageOutcome.Status.COMPLETED;
        } else {
            log.warn("Cash resync failed ({}: {}), using ledger cash {}", account.errorKind(), account.error(),
                    ledger.cash());
            status = StageOutcome.Status.PARTIAL;
        }
        run.cashAfterSells = ledger.cash();
        stage(run, CycleStage.CASH_RESYNC, status, Map.of("cash", run.cashAfterSells));
    }

    private void executeBuys(Run run) {
        List<TradeIntent> buys = run.approved.keySet().stream()
                .filter(intent -> intent.side() == Side.BUY)
                .sorted(Comparator.comparingDouble(TradeIntent::notional).reversed()
                        .thenComparing(TradeIntent::asset))
                .toList();
        if (buys.isEmpty()) {
            stage(run, CycleStage.BUY_EXECUTION, StageOutcome.Status.COMPLETED, Map.of("submitted", 0));
            return;
        }
        double available = Math.max(0.0, run.cashAfterSells) / (1.0 + complianceEngine.config().commissionRate());
        double requested = buys.stream().mapToDouble(TradeIntent::notional).sum();
        if (requested > available) {
            run.buyScale = requested > 0 ? available / requested : 0.0;
            log.warn("Buys request {} but {} available, scaling by {}", requested, available, run.buyScale);
        }
        int dropped = 0;
        for (TradeIntent buy : buys) {
            double quantity = run.buyScale < 1.0 ? config.roundDown(buy.asset(), buy.quantity() * run.buyScale) : buy.quantity();
            if (quantity <= 0) {
                log.warn("Scaled buy for {} rounds below step size, dropped", buy.asset());
                dropped++;
                continue;
            }
            ExecutedOrder order = submit(run, buy.withQuantity(quantity), run.approved.get(buy));
            if (order != null) {
                run.buys.add(order);
            }
        }
        stage(run, CycleStage.BUY_EXECUTION, executionStatus(run, run.buys, buys.size()),
                Map.of("submitted", run.buys.size(), "approved", buys.size(), "dropped", dropped,
                        "scale", run.buyScale, "requested", requested, "available", available));
    }

    /**
     * Submits one approved intent. Returns null without submitting once order flow is halted.
     */
    private ExecutedOrder submit(Run run, TradeIntent intent, ComplianceDecision decision) {
        if (run.halted) {
            return null;
        }
        try {
            circuitBreaker.ensureClosed();
        } catch (CircuitBreakerTrippedException e) {
            run.tripped = true;
            auditBreaker(run, run.currentStage(intent));
            halt(run, "CIRCUIT_BREAKER_TRIPPED");
            return null;
        }
        if (!decision.approved()) {
            throw new ComplianceBlockedException(decision);
        }
        String clientOrderId = run.context.cycleId() + "-" + (++run.orderSequence);
        ExecutionPort.OrderRequest request = new ExecutionPort.OrderRequest(clientOrderId, intent.asset(),
                intent.side(), intent.quantity(), config.orderType());
        audit(run, AuditType.TRADE_ATTEMPT, Map.of("clientOrderId", clientOrderId, "asset", intent.asset(),
                "side", intent.side(), "quantity", intent.quantity(), "price", intent.price()));

        Result<ExecutionPort.OrderResult> result = execution.submitOrder(request);
        ComplianceStateStore store = ledger.complianceState();
        store.release(intent.asset());

        ExecutedOrder order;
        if (!result.isOk()) {
            order = new ExecutedOrder(clientOrderId, null, intent.asset(), intent.side(), intent.quantity(), 0.0, 0.0,
                    null, result.errorKind(), result.error());
            log.warn("Order {} {} {} failed: {} {}", clientOrderId, intent.side(), intent.asset(),
                    result.errorKind(), result.error());
            metrics.recordOrder(intent.side().name(), "ERROR_" + result.errorKind());
            if (result.errorKind() == ErrorKind.INTERRUPTED) {
                halt(run, "INTERRUPTED");
            }
        } else {
            ExecutionPort.OrderResult fill = result.get();
            order = new ExecutedOrder(clientOrderId, fill.orderId(), intent.asset(), intent.side(), intent.quantity(),
                    fill.filledQuantity(), fill.fillPrice(), fill.status(), null, fill.message());
            metrics.recordOrder(intent.side().name(), fill.status().name());
            if (fill.hasFill()) {
                TradeRecord record = ledger.recordFill(fill.orderId(), intent.asset(), intent.side(),
                        fill.filledQuantity(), fill.fillPrice(), fill.commission(), clock.instant());
                complianceEngine.applyFill(store, record);
                if (order.partial()) {
                    log.warn("Partial fill for {}: {} of {} {}", clientOrderId, fill.filledQuantity(),
                            intent.quantity(), intent.asset());
                }
                if (intent.side() == Side.SELL && circuitBreaker.recordClosedTrade(record.realizedPnl())) {
                    run.tripped = true;
                    auditBreaker(run, CycleStage.SELL_EXECUTION);
                }
            } else {
                log.warn("Order {} {} {} rejected: {}", clientOrderId, intent.side(), intent.asset(), fill.message());
            }
        }
        audit(run, AuditType.TRADE_OUTCOME, orderPayload(order));
        return order;
    }

    private StageOutcome.Status executionStatus(Run run, List<ExecutedOrder> orders, int approved) {
        if (approved == 0) {
            return StageOutcome.Status.COMPLETED;
        }
        long clean = orders.stream().filter(order -> order.filled() && !order.partial()).count();
        if (clean == approved) {
            return StageOutcome.Status.COMPLETED;
        }
        if (run.halted && orders.isEmpty()) {
            return StageOutcome.Status.SKIPPED;
        }
        return orders.stream().anyMatch(ExecutedOrder::filled) ? StageOutcome.Status.PARTIAL : StageOutcome.Status.FAILED;
    }

    private boolean abortAt(Run run, CycleStage completed) {
        if (!completed.abortableAfter() || !run.context.isAbortRequested()) {
            return false;
        }
        log.warn("Cycle {} aborted after {}: {}", run.context.cycleId(), completed, run.context.abortReason());
        run.abort(completed, run.context.abortReason());
        audit(run, AuditType.STAGE, Map.of("stage", completed, "status", "ABORTED", "reason", run.abortReason));
        return true;
    }

    private void halt(Run run, String reason) {
        if (!run.halted) {
            log.error("Order submission halted for cycle {}: {}", run.context.cycleId(), reason);
            run.halted = true;
            run.haltReason = reason;
        }
    }

    private void auditBreaker(Run run, CycleStage stage) {
        Map<String, Object> payload = new LinkedHashMap<>(circuitBreaker.context());
        payload.put("stage", stage);
        audit(run, AuditType.CIRCUIT_BREAKER, payload);
    }

    private void stage(Run run, CycleStage stage, StageOutcome.Status status, Map<String, Object> detail) {
        run.stages.add(new StageOutcome(stage, status, detail));
        Map<String, Object> payload = new LinkedHashMap<>(detail);
        payload.put("stage", stage);
        payload.put("status", status);
        audit(run, AuditType.STAGE, payload);
        log.info("Stage {} {}: {}", stage, status, detail);
    }

    private Map<String, Object> decisionPayload(ComplianceDecision decision) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("asset", decision.asset());
        payload.put("side", decision.side());
        payload.put("quantity", decision.quantity());
        payload.put("price", decision.price());
        payload.put("verdict", decision.verdict());
        payload.put("reason", decision.reason());
        payload.put("rule", decision.evaluatedRule());
        payload.put("message", decision.message());
        payload.put("threshold", decision.threshold());
        payload.put("currentValue", decision.currentValue());
        return payload;
    }

    private Map<String, Object> orderPayload(ExecutedOrder order) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clientOrderId", order.clientOrderId());
        payload.put("orderId", order.orderId());
        payload.put("asset", order.asset());
        payload.put("side", order.side());
        payload.put("requestedQuantity", order.requestedQuantity());
        payload.put("filledQuantity", order.filledQuantity());
        payload.put("fillPrice", order.fillPrice());
        payload.put("status", order.status());
        payload.put("errorKind", order.errorKind());
        payload.put("partial", order.partial());
        payload.put("message", order.message());
        return payload;
    }

    private void audit(Run run, AuditType type, Map<String, Object> payload) {
        auditSink.append(AuditRecord.of(type, clock.instant(), run.context.cycleId(), payload));
    }

    private static final class Run {
        private final CycleContext context;
        private final Map<String, Double> prices = new TreeMap<>();
        private final List<String> excluded = new ArrayList<>();
        private final List<TradeIntent> intents = new ArrayList<>();
        private final List<ComplianceDecision> decisions = new ArrayList<>();
        private final Map<TradeIntent, ComplianceDecision> approved = new LinkedHashMap<>();
        private final List<ExecutedOrder> sells = new ArrayList<>();
        private final List<ExecutedOrder> buys = new ArrayList<>();
        private final List<StageOutcome> stages = new ArrayList<>();
        private double portfolioValue;
        private double cashBefore;
        private double cashAfterSells = Double.NaN;
        private double buyScale = 1.0;
        private CycleStage abortedAt;
        private String abortReason;
        private boolean tripped;
        private boolean halted;
        private String haltReason;
        private int orderSequence;

        Run(CycleContext context) {
            this.context = context;
        }

        void abort(CycleStage stage, String reason) {
            abortedAt = stage;
            abortReason = reason;
        }

        CycleStage currentStage(TradeIntent intent) {
            return intent.side() == Side.SELL ? CycleStage.SELL_EXECUTION : CycleStage.BUY_EXECUTION;
        }

        RebalanceResult result() {
            String reason = abortReason != null ? abortReason : haltReason;
            return new RebalanceResult(Collections.unmodifiableMap(new TreeMap<>(prices)), List.copyOf(excluded), portfolioValue, cashBefore,
                    cashAfterSells, List.copyOf(intents), List.copyOf(decisions), List.copyOf(sells), List.copyOf(buys),
                    buyScale, List.copyOf(stages), abortedAt, reason, tripped);
        }
    }
}
