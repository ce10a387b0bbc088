package com.qf2.trader.service;

import com.qf2.trader.config.SchedulerProperties;
import com.qf2.trader.exception.CycleInProgressException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "qf2.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RebalanceScheduler {

    private final TradingCycleService tradingCycleService;
    private final SchedulerProperties properties;

    @PostConstruct
    void announce() {
        log.info("Rebalance scheduler active: every {} ms after an initial {} ms",
                properties.getIntervalMs(), properties.getInitialDelayMs());
    }

    @Scheduled(fixedDelayString = "${qf2.scheduler.interval-ms:14400000}",
            initialDelayString = "${qf2.scheduler.initial-delay-ms:60000}")
    public void runScheduledCycle() {
        try {
            tradingCycleService.runCycle("SCHEDULED");
        } catch (CycleInProgressException e) {
            log.warn("Skipping scheduled cycle: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled cycle failed", e);
        }
    }
}
