package com.qf2.trader.port;

import com.qf2.trader.model.Side;

import java.util.Map;

/**
 * Trade execution collaborator. Request signing and transport are the implementation's concern.
 */
public interface ExecutionPort {

    OrderResult submitOrder(OrderRequest request);

    AccountSnapshot fetchAccount();

    enum OrderType {
        MARKET,
        LIMIT
    }

    enum OrderStatus {
        FILLED,
        PARTIALLY_FILLED,
        REJECTED
    }

    record OrderRequest(String clientOrderId, String asset, Side side, double quantity, OrderType orderType) {}

    record OrderResult(String orderId, OrderStatus status, double filledQuantity, double fillPrice,
                       double commission, String message) {

        public boolean hasFill() {
            return status != OrderStatus.REJECTED && filledQuantity > 0;
        }
    }

    record AccountSnapshot(double cash, Map<String, Double> holdings) {

        public double quantity(String asset) {
            return holdings.getOrDefault(asset, 0.0);
        }
    }
}
