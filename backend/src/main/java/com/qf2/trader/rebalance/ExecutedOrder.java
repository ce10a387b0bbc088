package com.qf2.trader.rebalance;

import com.qf2.trader.common.ErrorKind;
import com.qf2.trader.model.Side;
import com.qf2.trader.port.ExecutionPort;

/**
 * One order attempt. {@code status} is null when the call itself failed; {@code errorKind} then
 * says why.
 */
public record ExecutedOrder(
        String clientOrderId,
        String orderId,
        String asset,
        Side side,
        double requestedQuantity,
        double filledQuantity,
        double fillPrice,
        ExecutionPort.OrderStatus status,
        ErrorKind errorKind,
        String message
) {
    public boolean filled() {
        return status != null && status != ExecutionPort.OrderStatus.REJECTED && filledQuantity > 0;
    }

    public boolean partial() {
        return filled() && filledQuantity < requestedQuantity;
    }
}
