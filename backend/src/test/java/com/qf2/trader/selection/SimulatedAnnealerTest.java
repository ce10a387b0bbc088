package com.qf2.trader.selection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimulatedAnnealerTest {

    private static final AnnealerConfig CONFIG = new AnnealerConfig(5.0, 0.01, 200, 0, 16, 2_000_000L, 7L, true, 1, 1);

    private final HamiltonianBuilder builder = new HamiltonianBuilder(new HamiltonianConfig(2.0, 1.0, null));
    private final SimulatedAnnealer annealer = new SimulatedAnnealer(CONFIG, Runnable::run, () -> 99L);

    @Test
    void findsBruteForceOptimumOfFiveAssetExample() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0, 5.0);

        AnnealResult result = annealer.anneal(problem);

        assertThat(result.selectedAssets()).containsExactly("A0", "A1");
        assertThat(result.energy()).isCloseTo(-1.1, within(1e-9));
        assertThat(result.reads()).isEqualTo(16);
        assertThat(result.seed()).isEqualTo(7L);
    }

    @ParameterizedTest
    @ValueSource(ints = {5, 10, 20, 40})
    void selectedCountStaysWithinToleranceOfTarget(int universeSize) {
        List<String> assets = SelectionFixtures.assets(universeSize);
        int n = Math.max(1, universeSize / 4);
        QuboProblem problem = builder.build(SelectionFixtures.randomAlpha(assets, universeSize + 1L),
                SelectionFixtures.randomCorrelation(assets, universeSize + 2L), n, 1.0);

        AnnealResult result = annealer.anneal(problem);
        Selection repaired = new SelectionRepair().repair(problem, result.state(), Selection.Source.ANNEALER);

        assertThat(Math.abs(result.selectedCount() - n)).isLessThanOrEqualTo(CONFIG.sizeTolerance());
        assertThat(repaired.count()).isEqualTo(n);
    }

    @Test
    void fixedSeedIsReproducibleAcrossExecutors() throws Exception {
        List<String> assets = SelectionFixtures.assets(20);
        QuboProblem problem = builder.build(SelectionFixtures.randomAlpha(assets, 5),
                SelectionFixtures.randomCorrelation(assets, 6), 6, 0.8);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            AnnealResult sequential = annealer.anneal(problem);
            AnnealResult parallel = new SimulatedAnnealer(CONFIG, pool, () -> 1L).anneal(problem);

            assertThat(parallel.state()).containsExactly(sequential.state());
            assertThat(parallel.energy()).isEqualTo(sequential.energy());
            assertThat(parallel.bestRead()).isEqualTo(sequential.bestRead());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unsetSeedComesFromSeedSource() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0);

        AnnealResult result = annealer.anneal(problem, CONFIG.withSeed(null));

        assertThat(result.seed()).isEqualTo(99L);
    }

    @Test
    void iterationBudgetBoundsTheWork() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0);
        AnnealerConfig capped = new AnnealerConfig(5.0, 0.01, 200, 0, 3, 25L, 1L, true, 1, 1);

        AnnealResult result = annealer.anneal(problem, capped);

        assertThat(result.iterations()).isEqualTo(75L);
        assertThat(result.selectedCount()).isEqualTo(2);
    }
}
