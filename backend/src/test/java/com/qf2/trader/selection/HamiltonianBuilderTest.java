package com.qf2.trader.selection;

import com.qf2.trader.exception.EmptyUniverseException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HamiltonianBuilderTest {

    private final HamiltonianBuilder builder = new HamiltonianBuilder(new HamiltonianConfig(2.0, 1.0, null));

    private static double directEnergy(AlphaVector alpha, CorrelationMatrix rho, int n, double lambda, double penalty,
                                       boolean[] x) {
        double h = 0.0;
        int count = 0;
        for (int i = 0; i < x.length; i++) {
            if (!x[i]) {
                continue;
            }
            count++;
            h -= alpha.score(i);
            for (int j = i + 1; j < x.length; j++) {
                if (x[j]) {
                    h += lambda * rho.get(i, j);
                }
            }
        }
        return h + penalty * (count - n) * (count - n);
    }

    @Test
    void expandedCoefficientsReproduceTheHamiltonianOnEveryState() {
        AlphaVector alpha = SelectionFixtures.fiveAssetAlpha();
        CorrelationMatrix rho = SelectionFixtures.randomCorrelation(SelectionFixtures.FIVE, 3);
        QuboProblem problem = builder.build(alpha, rho, 2, 0.7, 4.0);

        for (int bits = 0; bits < 32; bits++) {
            boolean[] x = new boolean[5];
            for (int i = 0; i < 5; i++) {
                x[i] = (bits & (1 << i)) != 0;
            }
            assertThat(problem.energy(x)).isCloseTo(directEnergy(alpha, rho, 2, 0.7, 4.0, x), within(1e-9));
        }
    }

    @Test
    void coefficientsFollowExpansion() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0, 5.0);

        assertThat(problem.diagonal(0)).isCloseTo(-0.8 + 5.0 * (1 - 4), within(1e-12));
        assertThat(problem.coupling(0, 1)).isCloseTo(0.3 + 10.0, within(1e-12));
        assertThat(problem.coupling(1, 0)).isEqualTo(problem.coupling(0, 1));
        assertThat(problem.coupling(2, 2)).isZero();
        assertThat(problem.offset()).isCloseTo(20.0, within(1e-12));
    }

    @Test
    void bruteForceMinimumOfFiveAssetExampleSelectsTopPair() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0, 5.0);

        boolean[] best = null;
        double bestEnergy = Double.POSITIVE_INFINITY;
        for (int bits = 0; bits < 32; bits++) {
            boolean[] x = new boolean[5];
            for (int i = 0; i < 5; i++) {
                x[i] = (bits & (1 << i)) != 0;
            }
            double energy = problem.energy(x);
            if (energy < bestEnergy) {
                bestEnergy = energy;
                best = x;
            }
        }

        assertThat(best).containsExactly(true, true, false, false, false);
        assertThat(bestEnergy).isCloseTo(-1.1, within(1e-9));
        assertThat(problem.objective(best)).isCloseTo(-1.1, within(1e-9));
    }

    @Test
    void localFieldsGiveFlipDeltas() {
        QuboProblem problem = builder.build(SelectionFixtures.fiveAssetAlpha(),
                SelectionFixtures.randomCorrelation(SelectionFixtures.FIVE, 11), 3, 1.2);
        boolean[] x = SelectionFixtures.mask(5, 0, 3);
        double[] fields = problem.localFields(x);

        for (int i = 0; i < 5; i++) {
            boolean[] flipped = x.clone();
            flipped[i] = !flipped[i];
            double expected = problem.energy(flipped) - problem.energy(x);
            assertThat((x[i] ? -1 : 1) * fields[i]).isCloseTo(expected, within(1e-9));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {5, 10, 20, 40})
    void defaultPenaltyMakesEveryOffSizeStateImprovableTowardTarget(int universeSize) {
        List<String> assets = SelectionFixtures.assets(universeSize);
        AlphaVector alpha = SelectionFixtures.randomAlpha(assets, universeSize);
        CorrelationMatrix rho = SelectionFixtures.randomCorrelation(assets, universeSize * 31L);
        int n = Math.max(1, universeSize / 3);
        double lambda = 1.5;
        QuboProblem problem = builder.build(alpha, rho, n, lambda);
        SplittableRandom random = new SplittableRandom(universeSize);

        for (int sample = 0; sample < 300; sample++) {
            boolean[] x = new boolean[universeSize];
            double density = random.nextDouble();
            for (int i = 0; i < universeSize; i++) {
                x[i] = random.nextDouble() < density;
            }
            int count = QuboProblem.count(x);
            if (count == n) {
                continue;
            }
            double energy = problem.energy(x);
            for (int i = 0; i < universeSize; i++) {
                if (count < n && !x[i] || count > n && x[i]) {
                    boolean[] moved = x.clone();
                    moved[i] = !moved[i];
                    assertThat(problem.energy(moved)).isLessThan(energy);
                }
            }
        }
    }

    @Test
    void penaltyOverrideIsUsedVerbatimAndFloorApplies() {
        HamiltonianBuilder overridden = new HamiltonianBuilder(new HamiltonianConfig(2.0, 1.0, 42.0));
        AlphaVector zeros = AlphaVector.of(SelectionFixtures.FIVE, 0, 0, 0, 0, 0);
        CorrelationMatrix identity = CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.0);

        assertThat(overridden.penaltyFor(zeros, identity, 2, 1.0)).isEqualTo(42.0);
        assertThat(builder.penaltyFor(zeros, identity, 2, 1.0)).isEqualTo(1.0);
        assertThat(builder.penaltyFor(SelectionFixtures.fiveAssetAlpha(),
                CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3), 2, 1.0))
                .isCloseTo(2.0 * (0.8 + 2 * 0.3), within(1e-12));
    }

    @Test
    void rejectsTargetLargerThanUniverseOrBelowOne() {
        AlphaVector alpha = SelectionFixtures.fiveAssetAlpha();
        CorrelationMatrix rho = CorrelationMatrix.uniform(SelectionFixtures.FIVE, 0.3);

        assertThatThrownBy(() -> builder.build(alpha, rho, 6, 1.0)).isInstanceOf(EmptyUniverseException.class);
        assertThatThrownBy(() -> builder.build(alpha, rho, 0, 1.0)).isInstanceOf(EmptyUniverseException.class);
    }

    @Test
    void rejectsMismatchedUniverses() {
        CorrelationMatrix other = CorrelationMatrix.uniform(List.of("X", "Y", "Z", "W", "V"), 0.1);

        assertThatThrownBy(() -> builder.build(SelectionFixtures.fiveAssetAlpha(), other, 2, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configRequiresMultiplierAboveOne() {
        assertThatThrownBy(() -> new HamiltonianConfig(1.0, 1.0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
