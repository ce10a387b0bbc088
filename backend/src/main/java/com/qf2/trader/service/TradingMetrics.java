package com.qf2.trader.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final AtomicReference<Double> lastSelectionEnergy = new AtomicReference<>(0.0);
    private final AtomicReference<Double> portfolioValue = new AtomicReference<>(0.0);
    private final Counter circuitBreakerTrips;

    public TradingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.circuitBreakerTrips = Counter.builder("qf2_circuit_breaker_trips_total").register(meterRegistry);
        Gauge.builder("qf2_selection_energy_last", lastSelectionEnergy, value -> value.get()).register(meterRegistry);
        Gauge.builder("qf2_portfolio_value", portfolioValue, value -> value.get()).register(meterRegistry);
    }

    public void recordCycle(String outcome) {
        Counter.builder("qf2_cycles_total")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordComplianceBlock(String reason) {
        Counter.builder("qf2_compliance_blocks_total")
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrder(String side, String status) {
        Counter.builder("qf2_orders_total")
                .tag("side", side)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordFallback(String fallback) {
        Counter.builder("qf2_selection_fallbacks_total")
                .tag("fallback", fallback)
                .register(meterRegistry)
                .increment();
    }

    public void recordCircuitBreakerTrip() {
        circuitBreakerTrips.increment();
    }

    public void updateSelectionEnergy(double energy) {
        lastSelectionEnergy.set(energy);
    }

    public void updatePortfolioValue(double value) {
        portfolioValue.set(value);
    }
}
