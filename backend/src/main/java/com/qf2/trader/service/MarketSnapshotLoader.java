package com.qf2.trader.service;

import com.qf2.trader.common.Result;
import com.qf2.trader.gateway.MarketDataGateway;
import com.qf2.trader.model.Candle;
import com.qf2.trader.model.MarketSnapshot;
import com.qf2.trader.selection.UniverseConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fetches the latest bars for every universe asset. Assets whose fetch fails are left out of the
 * snapshot for this cycle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketSnapshotLoader {

    private final UniverseConfig universeConfig;
    private final MarketDataGateway marketDataGateway;
    private final Clock clock;

    public MarketSnapshot load() {
        Map<String, List<Candle>> bars = new TreeMap<>();
        for (String asset : universeConfig.assets()) {
            Result<List<Candle>> result = marketDataGateway.latestBars(asset, universeConfig.lookbackBars());
            if (result.isOk()) {
                bars.put(asset, result.get());
            } else {
                log.warn("Dropping {} from this cycle: {} {}", asset, result.errorKind(), result.error());
            }
        }
        return new MarketSnapshot(clock.instant(), bars);
    }
}
