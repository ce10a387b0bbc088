package com.qf2.trader.adapter;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.qf2.trader.port.AuditRecord;
import com.qf2.trader.port.AuditType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Logger auditLogger = (Logger) LoggerFactory.getLogger("AUDIT");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(appender);
    }

    @Test
    void recordIsWrittenAsOneJsonLine() throws Exception {
        LoggingAuditSink sink = new LoggingAuditSink(objectMapper);

        sink.append(AuditRecord.of(AuditType.COMPLIANCE_DECISION, Instant.parse("2024-03-10T12:00:00Z"), "cycle-7",
                Map.of("asset", "BTCUSDT", "verdict", "BLOCK")));

        assertThat(appender.list).hasSize(1);
        String line = appender.list.get(0).getFormattedMessage();
        assertThat(line).doesNotContain("\n");
        JsonNode json = objectMapper.readTree(line);
        assertThat(json.get("type").asText()).isEqualTo("COMPLIANCE_DECISION");
        assertThat(json.get("cycleId").asText()).isEqualTo("cycle-7");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-10T12:00:00Z");
        assertThat(json.get("payload").get("asset").asText()).isEqualTo("BTCUSDT");
    }

    @Test
    void unserialisablePayloadStillLeavesATrace() {
        LoggingAuditSink sink = new LoggingAuditSink(objectMapper);

        sink.append(AuditRecord.of(AuditType.STAGE, Instant.parse("2024-03-10T12:00:00Z"), "cycle-8",
                Map.of("bad", new Object())));

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getFormattedMessage())
                .contains("\"cycleId\":\"cycle-8\"")
                .contains("serializationError");
    }
}
