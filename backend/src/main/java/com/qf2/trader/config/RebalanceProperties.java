package com.qf2.trader.config;

import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.rebalance.CircuitBreakerConfig;
import com.qf2.trader.rebalance.RebalanceConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "qf2.rebalance")
@Data
@Validated
public class RebalanceProperties {

    @PositiveOrZero
    @DecimalMax("1.0")
    private double threshold = 0.05;

    @PositiveOrZero
    private long minOrderIntervalMs = 300;

    private Map<String, Double> stepSizes = new LinkedHashMap<>();

    @Positive
    private double defaultStepSize = 0.000001;

    @Positive
    private long priceTimeoutMs = 5000;

    @Positive
    private long orderTimeoutMs = 10000;

    @PositiveOrZero
    private long settleDelayMs = 1000;

    @NotNull
    private ExecutionPort.OrderType orderType = ExecutionPort.OrderType.MARKET;

    @Valid
    private Retry retry = new Retry();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long baseDelayMs = 200;

        @PositiveOrZero
        private double jitterFactor = 0.2;
    }

    @Data
    public static class CircuitBreaker {
        @Positive
        private double maxDrawdownPct = 0.15;

        @Positive
        private double maxLossRate = 0.6;

        @Min(1)
        private int minClosedTrades = 5;

        private boolean latch = true;

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(maxDrawdownPct, maxLossRate, minClosedTrades, latch);
        }
    }

    public RebalanceConfig toConfig() {
        return new RebalanceConfig(threshold, Duration.ofMillis(minOrderIntervalMs), stepSizes, defaultStepSize,
                Duration.ofMillis(settleDelayMs), orderType);
    }
}
