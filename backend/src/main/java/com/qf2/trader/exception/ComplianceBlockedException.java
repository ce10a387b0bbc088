package com.qf2.trader.exception;

import com.qf2.trader.compliance.ComplianceDecision;
import com.qf2.trader.compliance.ComplianceReason;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a caller insists on executing a trade the compliance engine blocked. The
 * orchestrator itself drops blocked intents instead of throwing.
 */
public class ComplianceBlockedException extends TradingException {

    private final ComplianceReason reason;

    public ComplianceBlockedException(ComplianceDecision decision) {
        super("Trade blocked by " + decision.reason() + ": " + decision.message(), contextOf(decision));
        this.reason = decision.reason();
    }

    public ComplianceReason getReason() {
        return reason;
    }

    private static Map<String, Object> contextOf(ComplianceDecision decision) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("asset", decision.asset());
        context.put("side", decision.side());
        context.put("quantity", decision.quantity());
        context.put("rule", decision.evaluatedRule());
        if (decision.threshold() != null) {
            context.put("threshold", decision.threshold());
        }
        if (decision.currentValue() != null) {
            context.put("currentValue", decision.currentValue());
        }
        return context;
    }
}
