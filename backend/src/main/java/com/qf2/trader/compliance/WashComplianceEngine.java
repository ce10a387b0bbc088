package com.qf2.trader.compliance;

import com.qf2.trader.model.Side;
import com.qf2.trader.model.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Evaluates a proposed trade against the anti-wash-trading rules in a fixed order and reports the
 * first one that fails. Holds no state of its own: history lives in the {@link ComplianceStateStore}
 * handed in by the caller, which is written back through {@link #applyFill}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WashComplianceEngine {

    private final ComplianceConfig config;

    public ComplianceDecision evaluate(ProposedTrade trade, ComplianceStateStore store, Instant now) {
        AssetComplianceState state = store.get(trade.asset());
        LocalDate today = LocalDate.ofInstant(now, config.zone());

        if (trade.side() == Side.SELL && state.lastBuyTime() != null) {
            Duration held = Duration.between(state.lastBuyTime(), now);
            if (held.compareTo(config.minHold()) < 0) {
                return ComplianceDecision.block(trade, ComplianceReason.MIN_HOLD_TIME,
                        "Held " + held + ", minimum " + config.minHold(),
                        hours(config.minHold()), hours(held));
            }
        }

        if (trade.side() == Side.SELL && state.hasBasis()) {
            double grossReturn = (trade.price() - state.avgEntryPrice()) / state.avgEntryPrice();
            double netReturn = grossReturn - 2 * config.commissionRate();
            if (netReturn < config.minNetProfit()) {
                return ComplianceDecision.block(trade, ComplianceReason.MIN_NET_PROFIT,
                        String.format("Net return %.6f below minimum %.6f", netReturn, config.minNetProfit()),
                        config.minNetProfit(), netReturn);
            }
        }

        int assetTrades = store.tradesToday(trade.asset(), today);
        if (assetTrades >= config.maxDailyTradesPerAsset()) {
            return ComplianceDecision.block(trade, ComplianceReason.ASSET_DAILY_LIMIT,
                    assetTrades + " trades today for " + trade.asset(),
                    (double) config.maxDailyTradesPerAsset(), (double) assetTrades);
        }

        int totalTrades = store.totalTradesToday(today);
        if (totalTrades >= config.maxDailyTotalTrades()) {
            return ComplianceDecision.block(trade, ComplianceReason.GLOBAL_DAILY_LIMIT,
                    totalTrades + " trades today across all assets",
                    (double) config.maxDailyTotalTrades(), (double) totalTrades);
        }

        double notional = trade.notional();
        if (notional < config.minTradeValue()) {
            return ComplianceDecision.block(trade, ComplianceReason.MIN_TRADE_VALUE,
                    String.format("Trade value %.4f below minimum %.4f", notional, config.minTradeValue()),
                    config.minTradeValue(), notional);
        }

        if (trade.side() == Side.BUY && state.lastSellTime() != null) {
            Duration sinceSell = Duration.between(state.lastSellTime(), now);
            if (sinceSell.compareTo(config.cooldownAfterSell()) < 0) {
                return ComplianceDecision.block(trade, ComplianceReason.SELL_COOLDOWN,
                        "Sold " + sinceSell + " ago, cooldown " + config.cooldownAfterSell(),
                        hours(config.cooldownAfterSell()), hours(sinceSell));
            }
        }

        return ComplianceDecision.approve(trade);
    }

    /**
     * Folds a confirmed fill into the asset's state and the daily counters.
     */
    public void applyFill(ComplianceStateStore store, TradeRecord fill) {
        AssetComplianceState state = store.get(fill.asset());
        LocalDate day = LocalDate.ofInstant(fill.timestamp(), config.zone());
        int tradesToday = state.tradesOn(day) + 1;

        AssetComplianceState next;
        if (fill.side() == Side.BUY) {
            double quantity = state.heldQuantity() + fill.quantity();
            double basis = state.hasBasis() ? state.avgEntryPrice() * state.heldQuantity() : 0.0;
            double avgEntry = quantity > 0 ? (basis + fill.price() * fill.quantity()) / quantity : 0.0;
            if (!state.hasBasis() && state.heldQuantity() > 0) {
                avgEntry = fill.price();
            }
            next = state.withLastBuyTime(fill.timestamp())
                    .withHeldQuantity(quantity)
                    .withAvgEntryPrice(avgEntry);
        } else {
            double quantity = Math.max(0.0, state.heldQuantity() - fill.quantity());
            double pnl = state.hasBasis() ? (fill.price() - state.avgEntryPrice()) * fill.quantity() : 0.0;
            next = state.withLastSellTime(fill.timestamp())
                    .withHeldQuantity(quantity)
                    .withAvgEntryPrice(quantity > 0 ? state.avgEntryPrice() : 0.0)
                    .withRealizedNetPnl(state.realizedNetPnl() + pnl - fill.commission());
        }
        store.put(next.withTradeDay(day).withTradesToday(tradesToday));
        store.countTrade(day);
        log.debug("Compliance state for {} updated after {} fill: {}", fill.asset(), fill.side(), next);
    }

    public ComplianceConfig config() {
        return config;
    }

    private static double hours(Duration duration) {
        return duration.toMillis() / 3_600_000d;
    }
}
