package com.qf2.trader.adapter;

import com.qf2.trader.model.Side;
import com.qf2.trader.port.ExecutionPort;
import com.qf2.trader.port.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Dry-run exchange: fills market orders in full at the latest price and charges a flat commission
 * rate. Repeating a client order id returns the original result.
 */
@Slf4j
public class PaperExchange implements ExecutionPort {

    private static final double EPSILON = 1e-9;

    private final MarketDataProvider marketData;
    private final double commissionRate;
    private final Map<String, Double> holdings = new TreeMap<>();
    private final Map<String, OrderResult> ordersByClientId = new HashMap<>();
    private double cash;

    public PaperExchange(MarketDataProvider marketData, double startingCash, double commissionRate) {
        this.marketData = marketData;
        this.cash = startingCash;
        this.commissionRate = commissionRate;
    }

    @Override
    public synchronized OrderResult submitOrder(OrderRequest request) {
        OrderResult previous = ordersByClientId.get(request.clientOrderId());
        if (previous != null) {
            log.info("Duplicate paper order {}, returning original result", request.clientOrderId());
            return previous;
        }
        OrderResult result = fill(request);
        ordersByClientId.put(request.clientOrderId(), result);
        return result;
    }

    @Override
    public synchronized AccountSnapshot fetchAccount() {
        return new AccountSnapshot(cash, Map.copyOf(holdings));
    }

    public synchronized void deposit(String asset, double quantity) {
        holdings.merge(asset, quantity, Double::sum);
    }

    private OrderResult fill(OrderRequest request) {
        if (request.orderType() != OrderType.MARKET) {
            return rejected("Only market orders are supported");
        }
        if (request.quantity() <= 0) {
            return rejected("Quantity must be positive");
        }
        double price = marketData.getLatestPrice(request.asset());
        double notional = request.quantity() * price;
        double commission = notional * commissionRate;
        if (request.side() == Side.BUY) {
            if (notional + commission > cash + EPSILON) {
                return rejected(String.format("Insufficient cash: need %.4f, have %.4f", notional + commission, cash));
            }
            cash -= notional + commission;
            holdings.merge(request.asset(), request.quantity(), Double::sum);
        } else {
            double held = holdings.getOrDefault(request.asset(), 0.0);
            if (request.quantity() > held + EPSILON) {
                return rejected(String.format("Insufficient %s: need %.8f, hold %.8f", request.asset(),
                        request.quantity(), held));
            }
            double remaining = held - request.quantity();
            if (remaining <= EPSILON) {
                holdings.remove(request.asset());
            } else {
                holdings.put(request.asset(), remaining);
            }
            cash += notional - commission;
        }
        String orderId = "PAPER-" + UUID.randomUUID();
        log.info("Paper fill {} {} {} @ {} (commission {})", orderId, request.side(), request.quantity(), price, commission);
        return new OrderResult(orderId, OrderStatus.FILLED, request.quantity(), price, commission, "Filled");
    }

    private OrderResult rejected(String message) {
        log.warn("Paper order rejected: {}", message);
        return new OrderResult(null, OrderStatus.REJECTED, 0.0, 0.0, 0.0, message);
    }
}
