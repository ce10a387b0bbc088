package com.qf2.trader.selection;

import java.util.ArrayList;
import java.util.List;

/**
 * Best state across all reads.
 *
 * @param bestRead index of the read that produced {@code state}; ties go to the lowest index
 * @param seed     base seed; read {@code r} used {@code seed + r}
 */
public record AnnealResult(
        List<String> assets,
        boolean[] state,
        double energy,
        int bestRead,
        int reads,
        long iterations,
        long seed
) {
    public AnnealResult {
        assets = List.copyOf(assets);
        state = state.clone();
    }

    @Override
    public boolean[] state() {
        return state.clone();
    }

    public int selectedCount() {
        return QuboProblem.count(state);
    }

    public List<String> selectedAssets() {
        List<String> selected = new ArrayList<>();
        for (int i = 0; i < state.length; i++) {
            if (state[i]) {
                selected.add(assets.get(i));
            }
        }
        return selected;
    }
}
