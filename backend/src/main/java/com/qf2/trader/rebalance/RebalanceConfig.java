package com.qf2.trader.rebalance;

import com.qf2.trader.port.ExecutionPort;

import java.time.Duration;
import java.util.Map;

public record RebalanceConfig(
        double threshold,
        Duration minOrderInterval,
        Map<String, Double> stepSizes,
        double defaultStepSize,
        Duration settleDelay,
        ExecutionPort.OrderType orderType
) {
    public RebalanceConfig {
        stepSizes = stepSizes == null ? Map.of() : Map.copyOf(stepSizes);
        if (threshold < 0 || defaultStepSize <= 0) {
            throw new IllegalArgumentException("threshold must be >= 0 and defaultStepSize > 0");
        }
    }

    public double stepSize(String asset) {
        Double step = stepSizes.get(asset);
        return step != null && step > 0 ? step : defaultStepSize;
    }

    /**
     * Rounds down to a whole number of steps. The small tolerance keeps values like
     * {@code 0.3 / 0.1} from losing a step to floating-point error.
     */
    public double roundDown(String asset, double quantity) {
        if (quantity <= 0) {
            return 0.0;
        }
        double step = stepSize(asset);
        double steps = Math.floor(quantity / step + 1e-9);
        return steps * step;
    }
}
