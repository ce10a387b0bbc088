package com.qf2.trader.config;

import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.rebalance.RebalanceConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceConfigTest {

    private final ResilienceConfig resilienceConfig = new ResilienceConfig();

    private static RebalanceConfig withInterval(Duration interval) {
        return new RebalanceConfig(0.05, interval, Map.of(), 0.01, Duration.ZERO, ExecutionPort.OrderType.MARKET);
    }

    @Test
    void orderRateLimiterAllowsOneOrderPerInterval() {
        RebalanceProperties properties = new RebalanceProperties();
        properties.setOrderTimeoutMs(2_000);

        RateLimiter limiter = resilienceConfig.orderRateLimiter(withInterval(Duration.ofMillis(300)), properties);

        RateLimiterConfig config = limiter.getRateLimiterConfig();
        assertThat(limiter.getName()).isEqualTo("orders");
        assertThat(config.getLimitForPeriod()).isEqualTo(1);
        assertThat(config.getLimitRefreshPeriod()).isEqualTo(Duration.ofMillis(300));
        assertThat(config.getTimeoutDuration()).isEqualTo(Duration.ofMillis(2_300));
    }

    @Test
    void zeroIntervalLeavesOrdersUnpaced() {
        RateLimiter limiter = resilienceConfig.orderRateLimiter(withInterval(Duration.ZERO), new RebalanceProperties());

        for (int i = 0; i < 20; i++) {
            assertThat(limiter.acquirePermission()).isTrue();
        }
    }
}
