package com.qf2.trader.integration;

import com.qf2.trader.adapter.InMemoryMarketDataProvider;
import com.qf2.trader.adapter.InMemorySentimentProvider;
import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.rebalance.ExecutedOrder;
import com.qf2.trader.rebalance.PortfolioLedger;
import com.qf2.trader.service.CycleReport;
import com.qf2.trader.service.CycleStatus;
import com.qf2.trader.service.TradingCycleService;
import com.qf2.trader.util.TestCandleFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest(properties = {
        "qf2.universe.assets=BTCUSDT,ETHUSDT,BNBUSDT,SOLUSDT,XRPUSDT,DOGEUSDT",
        "qf2.selection.regime.min-assets=2",
        "qf2.selection.regime.max-assets=4",
        "qf2.selection.regime.default-assets=3"
})
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class TradingCycleIntegrationTest {

    private static final Map<String, Double> START_PRICES = Map.of(
            "BTCUSDT", 40_000.0,
            "ETHUSDT", 2_500.0,
            "BNBUSDT", 300.0,
            "SOLUSDT", 100.0,
            "XRPUSDT", 0.6,
            "DOGEUSDT", 0.1);

    @Autowired
    private TradingCycleService tradingCycleService;

    @Autowired
    private InMemoryMarketDataProvider marketDataProvider;

    @Autowired
    private InMemorySentimentProvider sentimentProvider;

    @Autowired
    private PortfolioLedger ledger;

    @Autowired
    private ExecutionPort exchange;

    @BeforeEach
    void seedMarket() {
        long seed = 1;
        for (Map.Entry<String, Double> entry : START_PRICES.entrySet()) {
            marketDataProvider.putBars(entry.getKey(),
                    TestCandleFactory.randomWalk(100, entry.getValue(), 0.01, seed++));
        }
        sentimentProvider.put("BTCUSDT", 0.5);
        sentimentProvider.put("SOLUSDT", -0.3);
    }

    @Test
    void fullCycleBuysIntoPaperAccount() {
        CycleReport report = tradingCycleService.runCycle("TEST");

        assertThat(report.status()).isEqualTo(CycleStatus.COMPLETED);
        assertThat(report.selection().selection().selectedAssets()).hasSizeBetween(1, 4);
        assertThat(report.selection().weights().sum()).isCloseTo(1.0, within(1e-6));
        assertThat(report.rebalance().sells()).isEmpty();
        assertThat(report.rebalance().buys()).isNotEmpty().allMatch(ExecutedOrder::filled);
        assertThat(report.selection().selection().selectedAssets()).containsAll(ledger.heldAssets());

        ExecutionPort.AccountSnapshot account = exchange.fetchAccount();
        assertThat(account.cash()).isGreaterThanOrEqualTo(0.0);
        assertThat(ledger.cash()).isCloseTo(account.cash(), within(1e-6));
        for (String asset : ledger.heldAssets()) {
            assertThat(ledger.quantity(asset)).isCloseTo(account.quantity(asset), within(1e-9));
        }
        assertThat(tradingCycleService.lastReport()).contains(report);
    }
}
