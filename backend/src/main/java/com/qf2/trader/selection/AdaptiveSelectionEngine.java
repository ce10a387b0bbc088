package com.qf2.trader.selection;

import com.qf2.trader.exception.DegenerateSelectionException;
import com.qf2.trader.exception.EmptyUniverseException;
import com.qf2.trader.exception.InsufficientHistoryException;
import com.qf2.trader.model.MarketSnapshot;
import com.qf2.trader.port.AuditRecord;
import com.qf2.trader.port.AuditSink;
import com.qf2.trader.port.AuditType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Regime, alpha and correlation feed the Hamiltonian; the annealed selection is repaired to exactly
 * {@code n} assets and weighted by the CVaR allocator. Every local recovery is recorded as a
 * {@link SelectionOutcome.Fallback} and audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveSelectionEngine {

    private final UniverseConfig universeConfig;
    private final RegimeDetector regimeDetector;
    private final LambdaTuner lambdaTuner;
    private final AlphaScorer alphaScorer;
    private final CorrelationEstimator correlationEstimator;
    private final HamiltonianBuilder hamiltonianBuilder;
    private final SimulatedAnnealer annealer;
    private final SelectionRepair selectionRepair;
    private final WeightAllocator weightAllocator;
    private final AuditSink auditSink;
    private final Clock clock;

    private final AtomicReference<RegimeParameters> lastRegime = new AtomicReference<>();

    public SelectionOutcome select(String cycleId, MarketSnapshot snapshot, Map<String, Double> sentiment) {
        List<SelectionOutcome.Fallback> fallbacks = new ArrayList<>();
        MarketSnapshot eligible = snapshot.eligible(Math.max(universeConfig.minBars(), alphaScorer.requiredBars()));
        int eligibleCount = eligible.assets().size();
        if (eligibleCount < Math.max(universeConfig.minEligibleAssets(), 1)) {
            throw new EmptyUniverseException(eligibleCount, universeConfig.minEligibleAssets());
        }
        log.info("Selection universe: {} of {} assets eligible", eligibleCount, snapshot.assets().size());

        RegimeParameters regime = detectRegime(cycleId, eligible, fallbacks);
        lambdaTuner.record(regime.regime());
        regime = regime.withLambda(lambdaTuner.tune(regime.lambda()));
        audit(cycleId, AuditType.REGIME, regimePayload(regime));

        AlphaVector alpha = alphaScorer.score(eligible, sentiment);
        audit(cycleId, AuditType.ALPHA, Map.of("alpha", alpha.asMap()));

        CorrelationMatrix correlation = correlationEstimator.estimate(eligible);
        QuboProblem problem = hamiltonianBuilder.build(alpha, correlation, regime.targetSize(), regime.lambda());

        Selection selection;
        Double annealedEnergy = null;
        try {
            AnnealResult result = annealer.anneal(problem);
            annealedEnergy = result.energy();
            audit(cycleId, AuditType.ANNEALING, annealingPayload(problem, result));
            selection = selectionRepair.repair(problem, result.state(), Selection.Source.ANNEALER);
            if (Math.abs(selection.drift()) > annealer.config().sizeTolerance()) {
                log.warn("Annealed selection size {} outside tolerance {} of target {}",
                        result.selectedCount(), annealer.config().sizeTolerance(), problem.targetSize());
            }
        } catch (RuntimeException e) {
            log.warn("Annealing failed, selecting top {} by alpha: {}", problem.targetSize(), e.getMessage());
            fallbacks.add(SelectionOutcome.Fallback.TOP_ALPHA);
            audit(cycleId, AuditType.FALLBACK, Map.of("fallback", SelectionOutcome.Fallback.TOP_ALPHA,
                    "error", String.valueOf(e.getMessage())));
            selection = selectionRepair.topByAlpha(problem);
        }
        audit(cycleId, AuditType.SELECTION, selectionPayload(selection));

        TargetWeights weights;
        try {
            weights = weightAllocator.allocate(selection, eligible);
        } catch (DegenerateSelectionException e) {
            log.warn("Degenerate selection, falling back to equal weights: {}", e.getMessage());
            fallbacks.add(SelectionOutcome.Fallback.EQUAL_WEIGHT);
            audit(cycleId, AuditType.FALLBACK, Map.of("fallback", SelectionOutcome.Fallback.EQUAL_WEIGHT,
                    "error", e.getMessage(), "context", e.getContext()));
            weights = TargetWeights.equal(selection.universe(), selection.selectedAssets(),
                    TargetWeights.Method.EQUAL_WEIGHT_FALLBACK);
        }
        audit(cycleId, AuditType.WEIGHTS, Map.of("method", weights.method(), "weights", weights.weights()));

        return new SelectionOutcome(regime, alpha, problem.penalty(), annealedEnergy, selection, weights, fallbacks);
    }

    public RegimeParameters lastRegime() {
        return lastRegime.get();
    }

    private RegimeParameters detectRegime(String cycleId, MarketSnapshot eligible, List<SelectionOutcome.Fallback> fallbacks) {
        try {
            RegimeParameters detected = regimeDetector.detect(eligible, universeConfig.referenceAssets());
            lastRegime.set(detected);
            return detected;
        } catch (InsufficientHistoryException e) {
            RegimeParameters previous = lastRegime.get();
            SelectionOutcome.Fallback fallback = previous != null
                    ? SelectionOutcome.Fallback.REGIME_PREVIOUS
                    : SelectionOutcome.Fallback.REGIME_DEFAULTS;
            RegimeParameters reused = previous != null ? previous.asFallback() : regimeDetector.defaults();
            log.warn("{}; reusing {} regime parameters n={}, lambda={}", e.getMessage(),
                    previous != null ? "previous" : "default", reused.targetSize(), reused.lambda());
            fallbacks.add(fallback);
            audit(cycleId, AuditType.FALLBACK, Map.of("fallback", fallback, "error", e.getMessage(),
                    "context", e.getContext()));
            return reused;
        }
    }

    private Map<String, Object> regimePayload(RegimeParameters regime) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("regime", regime.regime());
        payload.put("volatility", Double.isFinite(regime.volatility()) ? regime.volatility() : null);
        payload.put("targetSize", regime.targetSize());
        payload.put("lambda", regime.lambda());
        payload.put("fallback", regime.fallback());
        return payload;
    }

    private Map<String, Object> annealingPayload(QuboProblem problem, AnnealResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("energy", result.energy());
        payload.put("penalty", problem.penalty());
        payload.put("targetSize", problem.targetSize());
        payload.put("selectedCount", result.selectedCount());
        payload.put("bestRead", result.bestRead());
        payload.put("reads", result.reads());
        payload.put("iterations", result.iterations());
        payload.put("seed", result.seed());
        return payload;
    }

    private Map<String, Object> selectionPayload(Selection selection) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", selection.source());
        payload.put("assets", selection.selectedAssets());
        payload.put("energy", selection.energy());
        payload.put("drift", selection.drift());
        payload.put("repaired", selection.repaired());
        return payload;
    }

    private void audit(String cycleId, AuditType type, Map<String, Object> payload) {
        auditSink.append(AuditRecord.of(type, clock.instant(), cycleId, payload));
    }
}
