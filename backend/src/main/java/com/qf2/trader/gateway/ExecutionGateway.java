package com.qf2.trader.gateway;

import com.qf2.trader.common.Result;
import com.qf2.trader.port.ExecutionPort;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Bounded-retry boundary to the trade execution collaborator. Retries reuse the client order id,
 * so an exchange that de-duplicates by it never fills an order twice. Order submissions are paced by
 * the order rate limiter; account reads are not.
 */
@Component
public class ExecutionGateway extends ResilientGateway {

    private final ExecutionPort executionPort;
    private final RateLimiter orderRateLimiter;

    public ExecutionGateway(ExecutionPort executionPort,
                            @Qualifier("executionRetry") Retry retry,
                            @Qualifier("orderTimeLimiter") TimeLimiter timeLimiter,
                            @Qualifier("orderRateLimiter") RateLimiter orderRateLimiter,
                            @Qualifier("gatewayExecutor") Executor executor) {
        super(retry, timeLimiter, executor);
        this.executionPort = executionPort;
        this.orderRateLimiter = orderRateLimiter;
    }

    public Result<ExecutionPort.OrderResult> submitOrder(ExecutionPort.OrderRequest request) {
        return call("submitOrder " + request.side() + " " + request.asset(), orderRateLimiter,
                () -> executionPort.submitOrder(request));
    }

    public Result<ExecutionPort.AccountSnapshot> fetchAccount() {
        return call("fetchAccount", executionPort::fetchAccount);
    }
}
