package com.qf2.trader.gateway;

import com.qf2.trader.common.Result;
import com.qf2.trader.model.Candle;
import com.qf2.trader.port.MarketDataProvider;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

@Component
public class MarketDataGateway extends ResilientGateway {

    private final MarketDataProvider marketDataProvider;

    public MarketDataGateway(MarketDataProvider marketDataProvider,
                             @Qualifier("marketDataRetry") Retry retry,
                             @Qualifier("priceTimeLimiter") TimeLimiter timeLimiter,
                             @Qualifier("gatewayExecutor") Executor executor) {
        super(retry, timeLimiter, executor);
        this.marketDataProvider = marketDataProvider;
    }

    public Result<Double> latestPrice(String asset) {
        return call("latestPrice " + asset, () -> marketDataProvider.getLatestPrice(asset));
    }

    public Result<List<Candle>> latestBars(String asset, int bars) {
        return call("latestBars " + asset, () -> marketDataProvider.getLatestBars(asset, bars));
    }
}
