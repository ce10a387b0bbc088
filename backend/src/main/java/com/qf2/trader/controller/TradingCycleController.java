package com.qf2.trader.controller;

import com.qf2.trader.dto.AbortRequest;
import com.qf2.trader.dto.AbortResponse;
import com.qf2.trader.dto.CircuitBreakerResponse;
import com.qf2.trader.exception.NotFoundException;
import com.qf2.trader.rebalance.CircuitBreakerService;
import com.qf2.trader.rebalance.CircuitBreakerState;
import com.qf2.trader.service.CycleReport;
import com.qf2.trader.service.TradingCycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TradingCycleController {

    private final TradingCycleService tradingCycleService;
    private final CircuitBreakerService circuitBreakerService;

    @PostMapping("/cycle/run")
    public ResponseEntity<CycleReport> run() {
        log.info("Manual cycle requested");
        return ResponseEntity.ok(tradingCycleService.runCycle("MANUAL"));
    }

    @GetMapping("/cycle/last")
    public ResponseEntity<CycleReport> last() {
        return tradingCycleService.lastReport()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No cycle has completed yet"));
    }

    @PostMapping("/cycle/abort")
    public ResponseEntity<AbortResponse> abort(@Valid @RequestBody(required = false) AbortRequest request) {
        String reason = request == null || request.getReason() == null || request.getReason().isBlank()
                ? "MANUAL_ABORT"
                : request.getReason();
        boolean accepted = tradingCycleService.requestAbort(reason);
        return ResponseEntity.ok(AbortResponse.builder()
                .accepted(accepted)
                .message(accepted ? "Abort requested: " + reason : "No cycle is running")
                .build());
    }

    @GetMapping("/circuit-breaker")
    public ResponseEntity<CircuitBreakerResponse> circuitBreaker() {
        return ResponseEntity.ok(toResponse(circuitBreakerService.state()));
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<CircuitBreakerResponse> resetCircuitBreaker() {
        log.warn("Circuit breaker reset requested");
        circuitBreakerService.reset();
        return ResponseEntity.ok(toResponse(circuitBreakerService.state()));
    }

    private CircuitBreakerResponse toResponse(CircuitBreakerState state) {
        return CircuitBreakerResponse.builder()
                .tripped(state.tripped())
                .reason(state.reason())
                .trippedAt(state.trippedAt())
                .peakEquity(state.peakEquity())
                .drawdown(state.drawdown())
                .closedTrades(state.closedTrades())
                .lossRate(state.lossRate())
                .build();
    }
}
