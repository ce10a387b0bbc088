package com.qf2.trader.port;

/**
 * Append-only sink for structured decision records. No read-back.
 */
public interface AuditSink {

    void append(AuditRecord record);
}
