package com.qf2.trader.selection;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary selection over the universe after repair.
 *
 * @param drift selected count before repair minus the target size
 */
public record Selection(
        List<String> universe,
        boolean[] mask,
        int targetSize,
        double energy,
        int drift,
        boolean repaired,
        Source source
) {
    public enum Source {
        ANNEALER,
        TOP_ALPHA_FALLBACK
    }

    public Selection {
        universe = List.copyOf(universe);
        mask = mask.clone();
    }

    @Override
    public boolean[] mask() {
        return mask.clone();
    }

    public boolean isSelected(int index) {
        return mask[index];
    }

    public int count() {
        return QuboProblem.count(mask);
    }

    public List<String> selectedAssets() {
        List<String> selected = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                selected.add(universe.get(i));
            }
        }
        return selected;
    }
}
