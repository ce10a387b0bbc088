package com.qf2.trader.gateway;

import com.qf2.trader.common.ErrorKind;
import com.qf2.trader.common.Result;
import com.qf2.trader.exception.ExchangeUnavailableException;
import com.qf2.trader.exception.OrderRejectedException;
import com.qf2.trader.exception.PriceUnavailableException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls under a bounded retry and a per-attempt time limit, optionally paced by a
 * rate limiter, and turns every failure into a {@link Result} error.
 */
@Slf4j
abstract class ResilientGateway {

    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    protected ResilientGateway(Retry retry, TimeLimiter timeLimiter, Executor executor) {
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    protected <T> Result<T> call(String operation, Supplier<T> supplier) {
        return call(operation, null, supplier);
    }

    /**
     * Same as {@link #call(String, Supplier)}, but waits for a permit from {@code rateLimiter}
     * before the first attempt. Retries of the same call do not take another permit.
     */
    protected <T> Result<T> call(String operation, RateLimiter rateLimiter, Supplier<T> supplier) {
        Callable<T> decorated = Retry.decorateCallable(retry, () ->
                timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(supplier, executor)));
        if (rateLimiter != null) {
            decorated = RateLimiter.decorateCallable(rateLimiter, decorated);
        }
        try {
            return Result.ok(decorated.call());
        } catch (RequestNotPermitted e) {
            log.warn("{} not permitted by rate limiter {}", operation, rateLimiter.getName());
            return Result.err(ErrorKind.TRANSIENT, operation + " rate limited");
        } catch (ExchangeUnavailableException e) {
            log.warn("{} failed after retries: {}", operation, e.getMessage());
            return Result.err(ErrorKind.TRANSIENT, e.getMessage());
        } catch (TimeoutException e) {
            log.warn("{} timed out after {}", operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return Result.err(ErrorKind.TIMEOUT, operation + " timed out");
        } catch (OrderRejectedException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return Result.err(ErrorKind.REJECTED, e.getMessage());
        } catch (PriceUnavailableException e) {
            return Result.err(ErrorKind.UNAVAILABLE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.err(ErrorKind.INTERRUPTED, operation + " interrupted");
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return Result.err(ErrorKind.INTERRUPTED, operation + " interrupted");
            }
            log.warn("{} failed: {}", operation, e.toString());
            return Result.err(ErrorKind.UNAVAILABLE, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
