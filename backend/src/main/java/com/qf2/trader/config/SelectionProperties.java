package com.qf2.trader.config;

import com.qf2.trader.selection.AlphaConfig;
import com.qf2.trader.selection.AllocatorConfig;
import com.qf2.trader.selection.AnnealerConfig;
import com.qf2.trader.selection.CorrelationConfig;
import com.qf2.trader.selection.HamiltonianConfig;
import com.qf2.trader.selection.LambdaTuningConfig;
import com.qf2.trader.selection.RegimeConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "qf2.selection")
@Data
@Validated
public class SelectionProperties {

    @Valid
    private Regime regime = new Regime();
    @Valid
    private Alpha alpha = new Alpha();
    @Valid
    private Correlation correlation = new Correlation();
    @Valid
    private Hamiltonian hamiltonian = new Hamiltonian();
    @Valid
    private Annealer annealer = new Annealer();
    @Valid
    private Allocator allocator = new Allocator();

    @Data
    public static class Regime {
        @Min(2)
        private int window = 48;

        @Min(2)
        private int minObservations = 24;

        @Positive
        private double annualizationFactor = 8760;

        @PositiveOrZero
        private double lowVolatility = 1.8;

        @Positive
        private double highVolatility = 4.7;

        @Min(1)
        private int minAssets = 5;

        @Min(1)
        private int maxAssets = 20;

        @PositiveOrZero
        private double minLambda = 0.25;

        @PositiveOrZero
        private double maxLambda = 1.5;

        @Min(1)
        private int defaultAssets = 10;

        @PositiveOrZero
        private double defaultLambda = 0.5;

        @Valid
        private Tuning tuning = new Tuning();

        public RegimeConfig toConfig() {
            return new RegimeConfig(window, minObservations, annualizationFactor, lowVolatility, highVolatility,
                    minAssets, maxAssets, minLambda, maxLambda, defaultAssets, defaultLambda);
        }
    }

    @Data
    public static class Tuning {
        private boolean enabled = true;

        @Min(1)
        private int minCycles = 10;

        @Min(1)
        private int historySize = 42;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double highVolatilityShare = 0.3;

        @Positive
        private double boost = 1.5;

        @Positive
        private double cap = 1.5;

        public LambdaTuningConfig toConfig() {
            return new LambdaTuningConfig(enabled, minCycles, historySize, highVolatilityShare, boost, cap);
        }
    }

    @Data
    public static class Alpha {
        @Min(1)
        private int shortWindow = 24;

        @Min(2)
        private int longWindow = 72;

        @Min(1)
        private int meanReversionWindow = 24;

        private double meanReversionScale = 1.0;

        private double momentumWeight = 0.5;

        private double sentimentWeight = 0.3;

        private double meanReversionWeight = 0.2;

        @NotNull
        private AlphaConfig.Normalization normalization = AlphaConfig.Normalization.MIN_MAX;

        @Positive
        private double zClip = 3.0;

        public AlphaConfig toConfig() {
            return new AlphaConfig(shortWindow, longWindow, meanReversionWindow, meanReversionScale,
                    momentumWeight, sentimentWeight, meanReversionWeight, normalization, zClip);
        }
    }

    @Data
    public static class Correlation {
        @Min(2)
        private int lookback = 48;

        public CorrelationConfig toConfig() {
            return new CorrelationConfig(lookback);
        }
    }

    @Data
    public static class Hamiltonian {
        @DecimalMin(value = "1.0", inclusive = false)
        private double penaltyMultiplier = 2.0;

        @PositiveOrZero
        private double minPenalty = 1.0;

        private Double penaltyOverride;

        public HamiltonianConfig toConfig() {
            return new HamiltonianConfig(penaltyMultiplier, minPenalty, penaltyOverride);
        }
    }

    @Data
    public static class Annealer {
        @Positive
        private double tStart = 5.0;

        @Positive
        private double tEnd = 0.01;

        @Min(1)
        private int steps = 200;

        @PositiveOrZero
        private int sweeps = 0;

        @Min(1)
        private int reads = 32;

        @Min(1)
        private long maxIterations = 2_000_000L;

        private Long seed;

        private boolean scaleToProblem = true;

        @PositiveOrZero
        private int parallelism = 0;

        @PositiveOrZero
        private int sizeTolerance = 1;

        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }

        public AnnealerConfig toConfig() {
            return new AnnealerConfig(tStart, tEnd, steps, sweeps, reads, maxIterations, seed, scaleToProblem,
                    effectiveParallelism(), sizeTolerance);
        }
    }

    @Data
    public static class Allocator {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double confidence = 0.95;

        @PositiveOrZero
        private double minWeight = 0.02;

        @DecimalMax("1.0")
        private double maxWeight = 0.40;

        @PositiveOrZero
        private double expectedReturnWeight = 1.0;

        @PositiveOrZero
        private double performancePenalty = 0.0;

        @Min(2)
        private int minObservations = 10;

        @Min(1)
        private int iterations = 400;

        @Positive
        private double stepSize = 0.05;

        @Positive
        private double periodsPerYear = 8760;

        public AllocatorConfig toConfig() {
            return new AllocatorConfig(confidence, minWeight, maxWeight, expectedReturnWeight, performancePenalty,
                    minObservations, iterations, stepSize, periodsPerYear);
        }
    }
}
