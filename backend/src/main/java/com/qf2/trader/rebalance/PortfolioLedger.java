package com.qf2.trader.rebalance;

import com.qf2.trader.compliance.AssetComplianceState;
import com.qf2.trader.compliance.ComplianceStateStore;
import com.qf2.trader.model.Holding;
import com.qf2.trader.model.HoldingSnapshot;
import com.qf2.trader.model.Side;
import com.qf2.trader.model.TradeRecord;
import com.qf2.trader.port.ExecutionPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Holdings, cash and the append-only trade log: the only state that outlives a cycle. Written by
 * the rebalance orchestrator alone, after confirmed fills.
 */
@Slf4j
@Component
public class PortfolioLedger {

    private static final double QUANTITY_EPSILON = 1e-12;

    private final Map<String, Holding> holdings = new TreeMap<>();
    private final List<TradeRecord> trades = new ArrayList<>();
    private final ComplianceStateStore complianceState = new ComplianceStateStore();
    private double cash;
    private boolean synced;

    public synchronized double cash() {
        return cash;
    }

    public synchronized void syncCash(double exchangeCash) {
        if (Math.abs(exchangeCash - cash) > 1e-6) {
            log.info("Cash resynchronised from {} to {}", cash, exchangeCash);
        }
        cash = exchangeCash;
    }

    public synchronized double quantity(String asset) {
        Holding holding = holdings.get(asset);
        return holding == null ? 0.0 : holding.getQuantity();
    }

    public synchronized Holding holding(String asset) {
        Holding holding = holdings.get(asset);
        return holding == null ? null : holding.toBuilder().build();
    }

    public synchronized Map<String, HoldingSnapshot> holdings() {
        Map<String, HoldingSnapshot> snapshot = new TreeMap<>();
        holdings.forEach((asset, holding) -> snapshot.put(asset, holding.snapshot()));
        return Collections.unmodifiableMap(snapshot);
    }

    public synchronized List<String> heldAssets() {
        return holdings.values().stream()
                .filter(holding -> holding.getQuantity() > QUANTITY_EPSILON)
                .map(Holding::getAsset)
                .toList();
    }

    public synchronized List<TradeRecord> trades() {
        return List.copyOf(trades);
    }

    public ComplianceStateStore complianceState() {
        return complianceState;
    }

    public synchronized boolean isSynced() {
        return synced;
    }

    /**
     * Adopts cash and quantities reported by the exchange. Positions unknown to the ledger are taken
     * over without an entry basis; positions the exchange no longer reports are closed. The
     * compliance store's held quantity follows every change.
     */
    public synchronized void syncFrom(ExecutionPort.AccountSnapshot account, Instant now) {
        cash = account.cash();
        account.holdings().forEach((asset, quantity) -> {
            Holding holding = holdings.get(asset);
            if (holding == null) {
                if (quantity > QUANTITY_EPSILON) {
                    holdings.put(asset, Holding.builder().asset(asset).quantity(quantity).updatedAt(now).build());
                    complianceState.put(complianceState.get(asset).withHeldQuantity(quantity));
                    log.warn("Adopted position {} {} without entry basis", quantity, asset);
                }
            } else {
                reconcile(holding, quantity, now);
            }
        });
        holdings.values().stream()
                .filter(holding -> !account.holdings().containsKey(holding.getAsset()))
                .forEach(holding -> reconcile(holding, 0.0, now));
        synced = true;
    }

    private void reconcile(Holding holding, double quantity, Instant now) {
        if (Math.abs(holding.getQuantity() - quantity) <= QUANTITY_EPSILON) {
            return;
        }
        String asset = holding.getAsset();
        log.warn("Quantity for {} reconciled from {} to {}", asset, holding.getQuantity(), quantity);
        AssetComplianceState state = complianceState.get(asset);
        if (quantity <= QUANTITY_EPSILON) {
            holding.setQuantity(0.0);
            holding.setAvgEntryPrice(0.0);
            holding.setEntryTime(null);
            complianceState.put(state.withHeldQuantity(0.0).withAvgEntryPrice(0.0));
        } else {
            holding.setQuantity(quantity);
            complianceState.put(state.withHeldQuantity(quantity));
        }
        holding.setUpdatedAt(now);
    }

    /**
     * Applies a confirmed fill to the holding and cash and appends the trade record.
     */
    public synchronized TradeRecord recordFill(String orderId, String asset, Side side, double quantity,
                                               double price, double commission, Instant timestamp) {
        Holding holding = holdings.computeIfAbsent(asset, key -> Holding.builder().asset(key).build());
        double realized = 0.0;
        double filled = quantity;
        if (side == Side.BUY) {
            double previous = holding.getQuantity();
            double next = previous + quantity;
            double basis = holding.hasBasis() ? holding.costBasis() : 0.0;
            double avgEntry = holding.hasBasis() || previous <= QUANTITY_EPSILON
                    ? (basis + quantity * price) / next
                    : price;
            holding.setQuantity(next);
            holding.setAvgEntryPrice(avgEntry);
            if (previous <= QUANTITY_EPSILON) {
                holding.setEntryTime(timestamp);
            }
            cash -= quantity * price + commission;
        } else {
            double sold = Math.min(quantity, holding.getQuantity());
            if (sold < quantity - QUANTITY_EPSILON) {
                log.warn("Sell fill of {} {} exceeds held {}, recording {}", quantity, asset, holding.getQuantity(), sold);
            }
            filled = sold;
            realized = (holding.hasBasis() ? (price - holding.getAvgEntryPrice()) * sold : 0.0) - commission;
            double remaining = holding.getQuantity() - sold;
            holding.setRealizedPnl(holding.getRealizedPnl() + realized);
            if (remaining <= QUANTITY_EPSILON) {
                holding.setQuantity(0.0);
                holding.setAvgEntryPrice(0.0);
                holding.setEntryTime(null);
            } else {
                holding.setQuantity(remaining);
            }
            cash += sold * price - commission;
        }
        holding.setUpdatedAt(timestamp);
        TradeRecord record = TradeRecord.builder()
                .orderId(orderId)
                .asset(asset)
                .side(side)
                .quantity(filled)
                .price(price)
                .timestamp(timestamp)
                .commission(commission)
                .realizedPnl(realized)
                .holdingAfter(holding.snapshot())
                .build();
        trades.add(record);
        return record;
    }
}
