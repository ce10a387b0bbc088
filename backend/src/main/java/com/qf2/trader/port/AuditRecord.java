package com.qf2.trader.port;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AuditRecord(
        AuditType type,
        Instant timestamp,
        String cycleId,
        Map<String, Object> payload
) {
    public AuditRecord {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AuditRecord of(AuditType type, Instant timestamp, String cycleId, Map<String, Object> payload) {
        return new AuditRecord(type, timestamp, cycleId, payload);
    }
}
