package com.qf2.trader.adapter;

import com.qf2.trader.model.Side;
import com.qf2.trader.port.ExecutionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PaperExchangeTest {

    private final InMemoryMarketDataProvider marketData = new InMemoryMarketDataProvider();
    private PaperExchange exchange;

    @BeforeEach
    void setUp() {
        marketData.setQuote("BTCUSDT", 40_000);
        exchange = new PaperExchange(marketData, 10_000, 0.001);
    }

    private static ExecutionPort.OrderRequest order(String id, Side side, double quantity) {
        return new ExecutionPort.OrderRequest(id, "BTCUSDT", side, quantity, ExecutionPort.OrderType.MARKET);
    }

    @Test
    void buyFillsAtQuoteAndChargesCommission() {
        ExecutionPort.OrderResult result = exchange.submitOrder(order("c-1", Side.BUY, 0.1));

        assertThat(result.status()).isEqualTo(ExecutionPort.OrderStatus.FILLED);
        assertThat(result.fillPrice()).isEqualTo(40_000.0);
        assertThat(result.commission()).isCloseTo(4.0, within(1e-9));
        ExecutionPort.AccountSnapshot account = exchange.fetchAccount();
        assertThat(account.cash()).isCloseTo(10_000 - 4_000 - 4, within(1e-9));
        assertThat(account.quantity("BTCUSDT")).isCloseTo(0.1, within(1e-12));
    }

    @Test
    void repeatedClientOrderIdDoesNotFillTwice() {
        ExecutionPort.OrderResult first = exchange.submitOrder(order("c-1", Side.BUY, 0.1));
        ExecutionPort.OrderResult second = exchange.submitOrder(order("c-1", Side.BUY, 0.1));

        assertThat(second).isEqualTo(first);
        assertThat(exchange.fetchAccount().quantity("BTCUSDT")).isCloseTo(0.1, within(1e-12));
    }

    @Test
    void buyBeyondCashIsRejected() {
        ExecutionPort.OrderResult result = exchange.submitOrder(order("c-1", Side.BUY, 0.25));

        assertThat(result.status()).isEqualTo(ExecutionPort.OrderStatus.REJECTED);
        assertThat(result.hasFill()).isFalse();
        assertThat(result.message()).contains("Insufficient cash");
        assertThat(exchange.fetchAccount().cash()).isEqualTo(10_000.0);
    }

    @Test
    void sellBeyondHoldingIsRejected() {
        exchange.deposit("BTCUSDT", 0.05);

        assertThat(exchange.submitOrder(order("c-1", Side.SELL, 0.06)).status())
                .isEqualTo(ExecutionPort.OrderStatus.REJECTED);
        assertThat(exchange.submitOrder(order("c-2", Side.SELL, 0.05)).status())
                .isEqualTo(ExecutionPort.OrderStatus.FILLED);
        assertThat(exchange.fetchAccount().holdings()).doesNotContainKey("BTCUSDT");
    }

    @Test
    void limitOrdersAreRejected() {
        ExecutionPort.OrderResult result = exchange.submitOrder(new ExecutionPort.OrderRequest("c-1", "BTCUSDT",
                Side.BUY, 0.01, ExecutionPort.OrderType.LIMIT));

        assertThat(result.status()).isEqualTo(ExecutionPort.OrderStatus.REJECTED);
    }
}
