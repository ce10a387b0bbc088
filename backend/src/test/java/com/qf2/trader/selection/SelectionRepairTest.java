package com.qf2.trader.selection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionRepairTest {

    private final SelectionRepair repair = new SelectionRepair();

    private QuboProblem problem(int n) {
        HamiltonianBuilder builder = new HamiltonianBuilder(new HamiltonianConfig(2.0, 1.0, null));
        return builder.build(SelectionFixtures.fiveAssetAlpha(), CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3),
                n, 1.0);
    }

    @Test
    void removesWeakestMembersWhenOverTarget() {
        Selection selection = repair.repair(problem(2), SelectionFixtures.mask(5, 0, 1, 2, 3), Selection.Source.ANNEALER);

        assertThat(selection.selectedAssets()).containsExactly("A0", "A1");
        assertThat(selection.drift()).isEqualTo(2);
        assertThat(selection.repaired()).isTrue();
    }

    @Test
    void addsCheapestCandidatesWhenUnderTarget() {
        Selection selection = repair.repair(problem(3), SelectionFixtures.mask(5, 1), Selection.Source.ANNEALER);

        assertThat(selection.selectedAssets()).containsExactly("A0", "A1", "A4");
        assertThat(selection.drift()).isEqualTo(-2);
    }

    @Test
    void leavesExactSelectionUntouched() {
        QuboProblem problem = problem(2);
        boolean[] state = SelectionFixtures.mask(5, 2, 3);

        Selection selection = repair.repair(problem, state, Selection.Source.ANNEALER);

        assertThat(selection.mask()).containsExactly(state);
        assertThat(selection.repaired()).isFalse();
        assertThat(selection.drift()).isZero();
        assertThat(selection.energy()).isEqualTo(problem.energy(state));
    }

    @Test
    void topByAlphaPicksHighestScores() {
        Selection selection = repair.topByAlpha(problem(3));

        assertThat(selection.selectedAssets()).containsExactly("A0", "A1", "A4");
        assertThat(selection.source()).isEqualTo(Selection.Source.TOP_ALPHA_FALLBACK);
    }
}
