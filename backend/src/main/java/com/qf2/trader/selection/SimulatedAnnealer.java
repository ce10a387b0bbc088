package com.qf2.trader.selection;

import com.qf2.trader.exception.TradingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Classical simulated annealing over a {@link QuboProblem}. Each read is an independent run of the
 * {@link Phase} machine with its own random source; reads share no mutable state and the minimum
 * energy across reads is kept.
 */
@Slf4j
@Service
public class SimulatedAnnealer {

    enum Phase {
        INITIALIZE,
        COOL,
        ACCEPT_REJECT,
        TERMINATE,
        DONE
    }

    private static final double EPSILON = 1e-12;

    private final AnnealerConfig config;
    private final Executor executor;
    private final LongSupplier seedSource;

    @Autowired
    public SimulatedAnnealer(AnnealerConfig config, @Qualifier("annealerExecutor") Executor executor) {
        this(config, executor, () -> ThreadLocalRandom.current().nextLong());
    }

    public SimulatedAnnealer(AnnealerConfig config, Executor executor, LongSupplier seedSource) {
        this.config = config;
        this.executor = executor;
        this.seedSource = seedSource;
    }

    public AnnealerConfig config() {
        return config;
    }

    public AnnealResult anneal(QuboProblem problem) {
        return anneal(problem, config);
    }

    public AnnealResult anneal(QuboProblem problem, AnnealerConfig runConfig) {
        if (problem.size() == 0) {
            throw new TradingException("Cannot anneal an empty problem", Map.of("stage", "ANNEAL"));
        }
        long baseSeed = runConfig.seed() != null ? runConfig.seed() : seedSource.getAsLong();
        double scale = runConfig.scaleToProblem() ? problem.objectiveScale() : 1.0;
        List<CompletableFuture<ReadResult>> futures = new ArrayList<>(runConfig.reads());
        for (int read = 0; read < runConfig.reads(); read++) {
            int readIndex = read;
            futures.add(CompletableFuture.supplyAsync(
                    () -> new AnnealRun(problem, runConfig, scale, new SplittableRandom(baseSeed + readIndex), readIndex).run(),
                    executor));
        }
        List<ReadResult> results;
        try {
            results = futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            throw new TradingException("Annealing read failed",
                    Map.of("stage", "ANNEAL", "seed", baseSeed, "assets", problem.size()),
                    e.getCause() != null ? e.getCause() : e);
        }
        ReadResult best = results.get(0);
        long iterations = 0;
        for (ReadResult result : results) {
            iterations += result.iterations();
            if (result.energy() < best.energy() - EPSILON) {
                best = result;
            }
            log.debug("Read {} finished: energy={}, selected={}", result.read(), result.energy(),
                    QuboProblem.count(result.state()));
        }
        log.info("Annealing finished: best energy {} from read {} of {} ({} selected, seed {})",
                best.energy(), best.read(), results.size(), QuboProblem.count(best.state()), baseSeed);
        return new AnnealResult(problem.assets(), best.state(), best.energy(), best.read(), results.size(),
                iterations, baseSeed);
    }

    private record ReadResult(int read, boolean[] state, double energy, long iterations) {}

    /**
     * One read. Walks INITIALIZE -> (COOL -> ACCEPT_REJECT*)* -> TERMINATE; cooling stops at the
     * last scheduled temperature or when the iteration budget runs out.
     */
    private static final class AnnealRun {

        private final QuboProblem problem;
        private final AnnealerConfig config;
        private final double scale;
        private final SplittableRandom random;
        private final int read;
        private final int size;
        private final int proposalsPerStep;

        private boolean[] state;
        private double[] fields;
        private double energy;
        private boolean[] bestState;
        private double bestEnergy;
        private int step;
        private int proposalsLeft;
        private double temperature;
        private long iterations;

        AnnealRun(QuboProblem problem, AnnealerConfig config, double scale, SplittableRandom random, int read) {
            this.problem = problem;
            this.config = config;
            this.scale = scale;
            this.random = random;
            this.read = read;
            this.size = problem.size();
            this.proposalsPerStep = config.sweeps() > 0 ? config.sweeps() : size;
        }

        ReadResult run() {
            Phase phase = Phase.INITIALIZE;
            while (phase != Phase.DONE) {
                phase = switch (phase) {
                    case INITIALIZE -> initialize();
                    case COOL -> cool();
                    case ACCEPT_REJECT -> acceptReject();
                    case TERMINATE -> terminate();
                    case DONE -> Phase.DONE;
                };
            }
            return new ReadResult(read, bestState, bestEnergy, iterations);
        }

        private Phase initialize() {
            double density = problem.targetSize() / (double) size;
            state = new boolean[size];
            for (int i = 0; i < size; i++) {
                state[i] = random.nextDouble() < density;
            }
            fields = problem.localFields(state);
            energy = problem.energy(state);
            bestState = state.clone();
            bestEnergy = energy;
            step = 0;
            return Phase.COOL;
        }

        private Phase cool() {
            if (step >= config.steps() || iterations >= config.maxIterations()) {
                return Phase.TERMINATE;
            }
            temperature = temperatureAt(step) * scale;
            proposalsLeft = proposalsPerStep;
            step++;
            return Phase.ACCEPT_REJECT;
        }

        private Phase acceptReject() {
            if (proposalsLeft == 0 || iterations >= config.maxIterations()) {
                return Phase.COOL;
            }
            proposalsLeft--;
            iterations++;
            int i = random.nextInt(size);
            double delta = state[i] ? -fields[i] : fields[i];
            if (delta <= 0 || random.nextDouble() < Math.exp(-delta / temperature)) {
                flip(i, delta);
                if (energy < bestEnergy - EPSILON) {
                    bestEnergy = energy;
                    bestState = state.clone();
                }
            }
            return Phase.ACCEPT_REJECT;
        }

        private Phase terminate() {
            state = bestState;
            fields = problem.localFields(state);
            energy = bestEnergy;
            descend();
            bestState = state.clone();
            bestEnergy = problem.energy(bestState);
            return Phase.DONE;
        }

        private double temperatureAt(int k) {
            if (config.steps() == 1) {
                return config.tStart();
            }
            double fraction = k / (double) (config.steps() - 1);
            return config.tStart() * Math.pow(config.tEnd() / config.tStart(), fraction);
        }

        /**
         * Greedy polish: best improving single flip, otherwise best improving swap, until neither
         * improves.
         */
        private void descend() {
            while (true) {
                int bestFlip = -1;
                double bestDelta = -EPSILON;
                for (int i = 0; i < size; i++) {
                    double delta = state[i] ? -fields[i] : fields[i];
                    if (delta < bestDelta) {
                        bestDelta = delta;
                        bestFlip = i;
                    }
                }
                if (bestFlip >= 0) {
                    flip(bestFlip, bestDelta);
                    continue;
                }
                int swapIn = -1;
                int swapOut = -1;
                for (int in = 0; in < size; in++) {
                    if (state[in]) {
                        continue;
                    }
                    for (int out = 0; out < size; out++) {
                        if (!state[out]) {
                            continue;
                        }
                        double delta = fields[in] - fields[out] - problem.coupling(in, out);
                        if (delta < bestDelta) {
                            bestDelta = delta;
                            swapIn = in;
                            swapOut = out;
                        }
                    }
                }
                if (swapIn < 0) {
                    return;
                }
                flip(swapIn, fields[swapIn]);
                flip(swapOut, -fields[swapOut]);
            }
        }

        private void flip(int i, double delta) {
            boolean next = !state[i];
            double direction = next ? 1.0 : -1.0;
            for (int j = 0; j < size; j++) {
                if (j != i) {
                    fields[j] += direction * problem.coupling(i, j);
                }
            }
            state[i] = next;
            energy += delta;
        }
    }
}
