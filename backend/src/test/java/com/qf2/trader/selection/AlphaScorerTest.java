package com.qf2.trader.selection;

import com.qf2.trader.exception.InsufficientHistoryException;
import com.qf2.trader.model.MarketSnapshot;
import com.qf2.trader.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AlphaScorerTest {

    private static AlphaConfig config(AlphaConfig.Normalization normalization) {
        return new AlphaConfig(2, 4, 3, 1.0, 0.5, 0.3, 0.2, normalization, 3.0);
    }

    private final AlphaScorer scorer = new AlphaScorer(config(AlphaConfig.Normalization.MIN_MAX));

    private MarketSnapshot flatUniverse() {
        return TestCandleFactory.snapshot(Map.of(
                "AAA", TestCandleFactory.flat(10, 100),
                "BBB", TestCandleFactory.flat(10, 50),
                "CCC", TestCandleFactory.flat(10, 20)));
    }

    @Test
    void subSignalsFollowWindowDefinitions() {
        double[] closes = {80, 100, 100, 100, 110};

        assertThat(scorer.momentum(closes)).isCloseTo(0.10 - 0.375, within(1e-12));
        assertThat(scorer.meanReversion(closes)).isCloseTo((310.0 / 3 - 110) / 110, within(1e-12));
    }

    @Test
    void minMaxNormalisesIntoUnitRange() {
        AlphaVector alpha = scorer.score(flatUniverse(), Map.of("AAA", 1.0, "BBB", -1.0, "CCC", 0.0));

        assertThat(alpha.assets()).containsExactly("AAA", "BBB", "CCC");
        assertThat(alpha.score("AAA")).isCloseTo(1.0, within(1e-12));
        assertThat(alpha.score("BBB")).isCloseTo(-1.0, within(1e-12));
        assertThat(alpha.score("CCC")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void zScoreDividesByClip() {
        AlphaScorer zScorer = new AlphaScorer(config(AlphaConfig.Normalization.Z_SCORE));

        AlphaVector alpha = zScorer.score(flatUniverse(), Map.of("AAA", 1.0, "BBB", -1.0, "CCC", 0.0));

        assertThat(alpha.score("AAA")).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(alpha.score("BBB")).isCloseTo(-1.0 / 3.0, within(1e-12));
        assertThat(alpha.maxAbs()).isLessThanOrEqualTo(1.0);
    }

    @Test
    void missingSentimentCountsAsNeutral() {
        Map<String, Double> partial = new HashMap<>();
        partial.put("AAA", 1.0);
        partial.put("BBB", -1.0);
        partial.put("CCC", Double.NaN);

        AlphaVector withGap = scorer.score(flatUniverse(), partial);
        AlphaVector explicit = scorer.score(flatUniverse(), Map.of("AAA", 1.0, "BBB", -1.0, "CCC", 0.0));
        AlphaVector none = scorer.score(flatUniverse(), null);

        assertThat(withGap.scores()).containsExactly(explicit.scores(), within(1e-12));
        assertThat(none.scores()).containsOnly(0.0);
    }

    @Test
    void sentimentIsClampedToUnitRange() {
        AlphaVector clamped = scorer.score(flatUniverse(), Map.of("AAA", 7.0, "BBB", -1.0, "CCC", 0.0));
        AlphaVector bounded = scorer.score(flatUniverse(), Map.of("AAA", 1.0, "BBB", -1.0, "CCC", 0.0));

        assertThat(clamped.scores()).containsExactly(bounded.scores(), within(1e-12));
    }

    @Test
    void identicalInputsGiveIdenticalScores() {
        MarketSnapshot snapshot = TestCandleFactory.snapshot(Map.of(
                "AAA", TestCandleFactory.randomWalk(30, 100, 0.02, 1),
                "BBB", TestCandleFactory.randomWalk(30, 100, 0.02, 2),
                "CCC", TestCandleFactory.randomWalk(30, 100, 0.02, 3)));
        Map<String, Double> sentiment = Map.of("AAA", 0.2, "CCC", -0.4);

        assertThat(scorer.score(snapshot, sentiment).scores())
                .containsExactly(scorer.score(snapshot, sentiment).scores());
    }

    @Test
    void rejectsSeriesShorterThanLongestWindow() {
        MarketSnapshot snapshot = TestCandleFactory.snapshot(Map.of("AAA", TestCandleFactory.flat(4, 100)));

        assertThat(scorer.requiredBars()).isEqualTo(5);
        assertThatThrownBy(() -> scorer.score(snapshot, Map.of()))
                .isInstanceOf(InsufficientHistoryException.class);
    }

    @Test
    void vectorLookupsFollowUniverseOrder() {
        AlphaVector alpha = AlphaVector.of(List.of("X", "Y"), 0.4, -0.9);

        assertThat(alpha.asMap()).containsExactly(Map.entry("X", 0.4), Map.entry("Y", -0.9));
        assertThat(alpha.maxAbs()).isEqualTo(0.9);
        assertThat(alpha.score("missing")).isZero();
    }
}
