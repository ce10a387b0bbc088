package com.qf2.trader.controller;

import com.qf2.trader.exception.CycleInProgressException;
import com.qf2.trader.service.CycleReport;
import com.qf2.trader.service.CycleStatus;
import com.qf2.trader.service.TradingCycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TradingCycleControllerTest {

    private static final CycleReport REPORT = new CycleReport("cycle-42", "MANUAL",
            Instant.parse("2024-03-10T12:00:00Z"), Instant.parse("2024-03-10T12:00:05Z"),
            CycleStatus.COMPLETED, null, null, null);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradingCycleService tradingCycleService;

    @Test
    void runReturnsCycleReport() throws Exception {
        when(tradingCycleService.runCycle("MANUAL")).thenReturn(REPORT);

        mockMvc.perform(post("/api/cycle/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleId").value("cycle-42"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.startedAt").value("2024-03-10T12:00:00Z"));
    }

    @Test
    void runWhileCycleInProgressIsConflict() throws Exception {
        when(tradingCycleService.runCycle("MANUAL")).thenThrow(new CycleInProgressException("cycle-41"));

        mockMvc.perform(post("/api/cycle/run").header("X-Request-Id", "req-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.requestId").value("req-1"))
                .andExpect(jsonPath("$.message").value("Cycle cycle-41 is still running"))
                .andExpect(jsonPath("$.context.runningCycleId").value("cycle-41"));
    }

    @Test
    void lastWithoutCycleIsNotFound() throws Exception {
        when(tradingCycleService.lastReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/cycle/last"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.path").value("/api/cycle/last"))
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void lastReturnsMostRecentReport() throws Exception {
        when(tradingCycleService.lastReport()).thenReturn(Optional.of(REPORT));

        mockMvc.perform(get("/api/cycle/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trigger").value("MANUAL"));
    }

    @Test
    void abortForwardsReason() throws Exception {
        when(tradingCycleService.requestAbort("market halt")).thenReturn(true);

        mockMvc.perform(post("/api/cycle/abort")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"market halt\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.message").value("Abort requested: market halt"));
    }

    @Test
    void abortWithoutBodyUsesDefaultReason() throws Exception {
        when(tradingCycleService.requestAbort("MANUAL_ABORT")).thenReturn(false);

        mockMvc.perform(post("/api/cycle/abort"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.message").value("No cycle is running"));
        verify(tradingCycleService).requestAbort("MANUAL_ABORT");
    }

    @Test
    void overlongAbortReasonIsRejected() throws Exception {
        String reason = "x".repeat(201);

        mockMvc.perform(post("/api/cycle/abort")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"" + reason + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("reason"));
    }

    @Test
    void circuitBreakerStateAndReset() throws Exception {
        mockMvc.perform(get("/api/circuit-breaker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tripped").value(false));

        mockMvc.perform(post("/api/circuit-breaker/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tripped").value(false))
                .andExpect(jsonPath("$.closedTrades").value(0));
    }
}
