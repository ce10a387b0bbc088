package com.qf2.trader.config;

import com.qf2.trader.exception.ExchangeUnavailableException;
import com.qf2.trader.rebalance.RebalanceConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Slf4j
@Configuration
public class ResilienceConfig {

    /**
     * Price reads are idempotent, so timeouts are retried as well.
     */
    @Bean
    public Retry marketDataRetry(RebalanceProperties properties) {
        return retry("marketData", properties.getRetry(), ExchangeUnavailableException.class, TimeoutException.class);
    }

    @Bean
    public Retry executionRetry(RebalanceProperties properties) {
        return retry("execution", properties.getRetry(), ExchangeUnavailableException.class);
    }

    @Bean
    public TimeLimiter priceTimeLimiter(RebalanceProperties properties) {
        return timeLimiter("price", properties.getPriceTimeoutMs());
    }

    @Bean
    public TimeLimiter orderTimeLimiter(RebalanceProperties properties) {
        return timeLimiter("order", properties.getOrderTimeoutMs());
    }

    /**
     * One order per {@code min-order-interval-ms}. A zero interval leaves order flow unpaced.
     */
    @Bean
    public RateLimiter orderRateLimiter(RebalanceConfig rebalanceConfig, RebalanceProperties properties) {
        Duration interval = rebalanceConfig.minOrderInterval();
        if (interval.isZero() || interval.isNegative()) {
            return RateLimiter.of("orders", RateLimiterConfig.ofDefaults());
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(interval)
                .timeoutDuration(interval.plusMillis(properties.getOrderTimeoutMs()))
                .build();
        return RateLimiter.of("orders", config);
    }

    @SafeVarargs
    private static Retry retry(String name, RebalanceProperties.Retry settings,
                               Class<? extends Throwable>... retryOn) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(settings.getBaseDelayMs()),
                2.0,
                settings.getJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(retryOn)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}) after {}: {}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    private static TimeLimiter timeLimiter(String name, long timeoutMs) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of(name, config);
    }
}
