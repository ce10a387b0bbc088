package com.qf2.trader.selection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brings a selection to exactly {@code n} members by greedy single-asset moves scored on the reward
 * and risk terms alone: the member whose removal improves the objective most goes first, the
 * candidate with the lowest marginal cost is added first. Ties go to the lowest index.
 */
@Slf4j
@Component
public class SelectionRepair {

    public Selection repair(QuboProblem problem, boolean[] state, Selection.Source source) {
        boolean[] mask = state.clone();
        int target = problem.targetSize();
        int before = QuboProblem.count(mask);
        while (QuboProblem.count(mask) > target) {
            mask[worstMember(problem, mask)] = false;
        }
        while (QuboProblem.count(mask) < target) {
            mask[bestCandidate(problem, mask)] = true;
        }
        boolean repaired = before != target;
        if (repaired) {
            log.info("Selection repaired from {} to {} assets", before, target);
        }
        return new Selection(problem.assets(), mask, target, problem.energy(mask), before - target, repaired, source);
    }

    /**
     * Top-{@code n} by alpha, used when annealing is unavailable.
     */
    public Selection topByAlpha(QuboProblem problem) {
        boolean[] mask = new boolean[problem.size()];
        for (int k = 0; k < problem.targetSize(); k++) {
            int best = -1;
            for (int i = 0; i < mask.length; i++) {
                if (!mask[i] && (best < 0 || problem.alpha(i) > problem.alpha(best))) {
                    best = i;
                }
            }
            mask[best] = true;
        }
        return new Selection(problem.assets(), mask, problem.targetSize(), problem.energy(mask), 0, false,
                Selection.Source.TOP_ALPHA_FALLBACK);
    }

    private int worstMember(QuboProblem problem, boolean[] mask) {
        int worst = -1;
        double worstContribution = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i]) {
                continue;
            }
            double contribution = marginal(problem, mask, i);
            if (contribution > worstContribution) {
                worstContribution = contribution;
                worst = i;
            }
        }
        return worst;
    }

    private int bestCandidate(QuboProblem problem, boolean[] mask) {
        int best = -1;
        double bestCost = Double.POSITIVE_INFINITY;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                continue;
            }
            double cost = marginal(problem, mask, i);
            if (cost < bestCost) {
                bestCost = cost;
                best = i;
            }
        }
        return best;
    }

    private double marginal(QuboProblem problem, boolean[] mask, int i) {
        double value = -problem.alpha(i);
        for (int j = 0; j < mask.length; j++) {
            if (j != i && mask[j]) {
                value += problem.lambda() * problem.correlation(i, j);
            }
        }
        return value;
    }
}
