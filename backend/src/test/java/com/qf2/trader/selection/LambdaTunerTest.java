package com.qf2.trader.selection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LambdaTunerTest {

    private static final LambdaTuningConfig CONFIG = new LambdaTuningConfig(true, 10, 42, 0.3, 1.5, 1.5);

    @Test
    void leavesLambdaAloneUntilEnoughCycles() {
        LambdaTuner tuner = new LambdaTuner(CONFIG);
        for (int i = 0; i < 9; i++) {
            tuner.record(MarketRegime.HIGH_VOLATILITY);
        }

        assertThat(tuner.tune(0.5)).isEqualTo(0.5);
    }

    @Test
    void boostsAndCapsWhenHighVolatilityDominates() {
        LambdaTuner tuner = new LambdaTuner(CONFIG);
        for (int i = 0; i < 6; i++) {
            tuner.record(MarketRegime.NORMAL);
        }
        for (int i = 0; i < 4; i++) {
            tuner.record(MarketRegime.HIGH_VOLATILITY);
        }

        assertThat(tuner.tune(0.5)).isCloseTo(0.75, within(1e-12));
        assertThat(tuner.tune(1.2)).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void keepsLambdaWhenShareAtOrBelowThreshold() {
        LambdaTuner tuner = new LambdaTuner(CONFIG);
        for (int i = 0; i < 7; i++) {
            tuner.record(MarketRegime.LOW_VOLATILITY);
        }
        for (int i = 0; i < 3; i++) {
            tuner.record(MarketRegime.HIGH_VOLATILITY);
        }

        assertThat(tuner.tune(0.5)).isEqualTo(0.5);
    }

    @Test
    void historyIsBounded() {
        LambdaTuner tuner = new LambdaTuner(new LambdaTuningConfig(true, 2, 5, 0.3, 1.5, 1.5));
        for (int i = 0; i < 12; i++) {
            tuner.record(MarketRegime.NORMAL);
        }

        assertThat(tuner.historySize()).isEqualTo(5);
    }

    @Test
    void disabledTunerNeverChangesLambda() {
        LambdaTuner tuner = new LambdaTuner(LambdaTuningConfig.disabled());
        for (int i = 0; i < 20; i++) {
            tuner.record(MarketRegime.HIGH_VOLATILITY);
        }

        assertThat(tuner.tune(0.5)).isEqualTo(0.5);
    }
}
