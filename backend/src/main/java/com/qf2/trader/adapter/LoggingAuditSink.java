package com.qf2.trader.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qf2.trader.port.AuditRecord;
import com.qf2.trader.port.AuditSink;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record as one JSON line to the {@code AUDIT} logger.
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;

    public LoggingAuditSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditRecord record) {
        try {
            AUDIT.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise audit record {} for cycle {}: {}", record.type(), record.cycleId(),
                    e.getMessage());
            AUDIT.info("{\"type\":\"{}\",\"cycleId\":\"{}\",\"serializationError\":true}", record.type(), record.cycleId());
        }
    }
}
