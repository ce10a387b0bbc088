package com.qf2.trader.exception;

/**
 * Transient transport failure talking to an external collaborator. The only retryable kind.
 */
public class ExchangeUnavailableException extends TradingException {

    public ExchangeUnavailableException(String message) {
        super(message);
    }

    public ExchangeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
