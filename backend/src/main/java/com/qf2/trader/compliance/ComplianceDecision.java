package com.qf2.trader.compliance;

import com.qf2.trader.model.Side;

/**
 * Outcome of one compliance evaluation.
 *
 * @param reason        first failing rule; null when approved
 * @param evaluatedRule rule that decided the outcome, {@code ALL_RULES} for an approval
 * @param threshold     configured limit of the failing rule
 * @param currentValue  observed value that failed it
 */
public record ComplianceDecision(
        String asset,
        Side side,
        double quantity,
        double price,
        Verdict verdict,
        ComplianceReason reason,
        String evaluatedRule,
        String message,
        Double threshold,
        Double currentValue
) {
    public static final String ALL_RULES = "ALL_RULES";

    public enum Verdict {
        APPROVE,
        BLOCK
    }

    static ComplianceDecision approve(ProposedTrade trade) {
        return new ComplianceDecision(trade.asset(), trade.side(), trade.quantity(), trade.price(),
                Verdict.APPROVE, null, ALL_RULES, "Approved", null, null);
    }

    static ComplianceDecision block(ProposedTrade trade, ComplianceReason reason, String message,
                                    Double threshold, Double currentValue) {
        return new ComplianceDecision(trade.asset(), trade.side(), trade.quantity(), trade.price(),
                Verdict.BLOCK, reason, reason.name(), message, threshold, currentValue);
    }

    public boolean approved() {
        return verdict == Verdict.APPROVE;
    }
}
