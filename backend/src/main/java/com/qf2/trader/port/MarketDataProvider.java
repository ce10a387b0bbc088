package com.qf2.trader.port;

import com.qf2.trader.model.Candle;

import java.util.List;

/**
 * Source of OHLCV bars. Implementations throw
 * {@link com.qf2.trader.exception.ExchangeUnavailableException} for transient failures and
 * {@link com.qf2.trader.exception.PriceUnavailableException} when an asset has no price.
 */
public interface MarketDataProvider {

    /**
     * Latest {@code bars} bars for the asset, oldest first.
     */
    List<Candle> getLatestBars(String asset, int bars);

    double getLatestPrice(String asset);
}
