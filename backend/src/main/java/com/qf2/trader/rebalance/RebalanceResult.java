package com.qf2.trader.rebalance;

import com.qf2.trader.compliance.ComplianceDecision;

import java.util.List;
import java.util.Map;

/**
 * @param buyScale factor applied to buy quantities; 1 when cash covered every buy
 * @param abortedAt stage after which the cycle stopped, null when it ran to the end
 */
public record RebalanceResult(
        Map<String, Double> prices,
        List<String> excludedAssets,
        double portfolioValue,
        double cashBefore,
        double cashAfterSells,
        List<TradeIntent> intents,
        List<ComplianceDecision> decisions,
        List<ExecutedOrder> sells,
        List<ExecutedOrder> buys,
        double buyScale,
        List<StageOutcome> stages,
        CycleStage abortedAt,
        String abortReason,
        boolean circuitBreakerTripped
) {
    public boolean aborted() {
        return abortedAt != null;
    }
}
