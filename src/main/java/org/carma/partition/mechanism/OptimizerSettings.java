package org.carma.partition.mechanism;

import java.util.*;

/**
 * Tuning knobs for {@link PartitionOptimizer}.
 *
 * <h2>Trial budget</h2>
 * With {@code trials = AUTO_TRIALS} the budget scales with the number of selected
 * entities: 150 up to 8, 300 up to 12, 500 beyond.
 *
 * <h2>Early stopping</h2>
 * A solve stops after {@code window} consecutive trials without improvement, where
 * {@code window = max(1, min(earlyStopCap, floor(trials * earlyStopFraction)))}.
 *
 * <h2>Overflow screening</h2>
 * When the request exceeds total capacity by at most {@code smallExcessThreshold},
 * every removal combination is screened (up to {@code maxScreenedCombinations}),
 * and the best {@code screeningTopK} are re-run with {@code screeningTrials} trials.
 *
 * <h2>Seed template</h2>
 * An optional starting partition evaluated as an extra first trial. Empty by
 * default; nothing about a particular dataset is built in.
 */
public class OptimizerSettings {

    /** Trial budget chosen from the candidate count. */
    public static final int AUTO_TRIALS = 0;

    public static final long DEFAULT_SEED = 42L;

    public static final OptimizerSettings DEFAULT = new Builder().build();

    /** Small budgets for interactive use and tests. */
    public static final OptimizerSettings FAST = new Builder()
        .trials(40)
        .screeningTopK(5)
        .screeningTrials(30)
        .maxScreenedCombinations(2_000)
        .build();

    /** Larger budgets and a longer patience window. */
    public static final OptimizerSettings THOROUGH = new Builder()
        .trials(1_000)
        .earlyStopCap(200)
        .screeningTopK(30)
        .screeningTrials(300)
        .build();

    private final long seed;
    private final int trials;
    private final double earlyStopFraction;
    private final int earlyStopCap;
    private final int maxRefinePasses;
    private final int smallExcessThreshold;
    private final int screeningTopK;
    private final int screeningTrials;
    private final long maxScreenedCombinations;
    private final StrategyPolicy strategyPolicy;
    private final List<List<String>> seedTemplate;

    private OptimizerSettings(Builder builder) {
        this.seed = builder.seed;
        this.trials = builder.trials;
        this.earlyStopFraction = builder.earlyStopFraction;
        this.earlyStopCap = builder.earlyStopCap;
        this.maxRefinePasses = builder.maxRefinePasses;
        this.smallExcessThreshold = builder.smallExcessThreshold;
        this.screeningTopK = builder.screeningTopK;
        this.screeningTrials = builder.screeningTrials;
        this.maxScreenedCombinations = builder.maxScreenedCombinations;
        this.strategyPolicy = builder.strategyPolicy;
        List<List<String>> template = new ArrayList<>();
        for (List<String> group : builder.seedTemplate) {
            template.add(List.copyOf(group));
        }
        this.seedTemplate = Collections.unmodifiableList(template);
    }

    // ========================================================================
    // Getters
    // ========================================================================

    public long getSeed() {
        return seed;
    }

    public int getTrials() {
        return trials;
    }

    public double getEarlyStopFraction() {
        return earlyStopFraction;
    }

    public int getEarlyStopCap() {
        return earlyStopCap;
    }

    public int getMaxRefinePasses() {
        return maxRefinePasses;
    }

    public int getSmallExcessThreshold() {
        return smallExcessThreshold;
    }

    public int getScreeningTopK() {
        return screeningTopK;
    }

    public int getScreeningTrials() {
        return screeningTrials;
    }

    public long getMaxScreenedCombinations() {
        return maxScreenedCombinations;
    }

    public StrategyPolicy getStrategyPolicy() {
        return strategyPolicy;
    }

    public List<List<String>> getSeedTemplate() {
        return seedTemplate;
    }

    public boolean hasSeedTemplate() {
        return !seedTemplate.isEmpty();
    }

    // ========================================================================
    // Derived budgets
    // ========================================================================

    /**
     * Number of trials for a solve over {@code candidateCount} entities.
     */
    public int trialBudget(int candidateCount) {
        if (trials != AUTO_TRIALS) {
            return trials;
        }
        if (candidateCount <= 8) {
            return 150;
        } else if (candidateCount <= 12) {
            return 300;
        }
        return 500;
    }

    /**
     * Consecutive non-improving trials tolerated before stopping.
     */
    public int earlyStopWindow(int trialBudget) {
        int window = (int) Math.floor(trialBudget * earlyStopFraction);
        return Math.max(1, Math.min(earlyStopCap, window));
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .seed(seed)
            .trials(trials)
            .earlyStopFraction(earlyStopFraction)
            .earlyStopCap(earlyStopCap)
            .maxRefinePasses(maxRefinePasses)
            .smallExcessThreshold(smallExcessThreshold)
            .screeningTopK(screeningTopK)
            .screeningTrials(screeningTrials)
            .maxScreenedCombinations(maxScreenedCombinations)
            .strategyPolicy(strategyPolicy);
        return builder.seedTemplate(seedTemplate);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private long seed = DEFAULT_SEED;
        private int trials = AUTO_TRIALS;
        private double earlyStopFraction = 0.25;
        private int earlyStopCap = 50;
        private int maxRefinePasses = 50;
        private int smallExcessThreshold = 4;
        private int screeningTopK = 20;
        private int screeningTrials = 200;
        private long maxScreenedCombinations = 20_000;
        private StrategyPolicy strategyPolicy = StrategyPolicy.DEFAULT;
        private List<List<String>> seedTemplate = List.of();

        public Builder() {}

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Fixed trial count, or {@link #AUTO_TRIALS} to scale with the input.
         */
        public Builder trials(int trials) {
            if (trials < 0) {
                throw new IllegalArgumentException("Trials must be >= 0");
            }
            this.trials = trials;
            return this;
        }

        public Builder earlyStopFraction(double fraction) {
            if (!(fraction > 0.0 && fraction <= 1.0)) {
                throw new IllegalArgumentException("Early stop fraction must be in (0, 1]");
            }
            this.earlyStopFraction = fraction;
            return this;
        }

        public Builder earlyStopCap(int cap) {
            if (cap < 1) {
                throw new IllegalArgumentException("Early stop cap must be >= 1");
            }
            this.earlyStopCap = cap;
            return this;
        }

        public Builder maxRefinePasses(int passes) {
            if (passes < 0) {
                throw new IllegalArgumentException("Refine passes must be >= 0");
            }
            this.maxRefinePasses = passes;
            return this;
        }

        /**
         * Largest excess that still gets exhaustive removal screening. Zero disables it.
         */
        public Builder smallExcessThreshold(int threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("Small excess threshold must be >= 0");
            }
            this.smallExcessThreshold = threshold;
            return this;
        }

        public Builder screeningTopK(int topK) {
            if (topK < 1) {
                throw new IllegalArgumentException("Screening top-K must be >= 1");
            }
            this.screeningTopK = topK;
            return this;
        }

        public Builder screeningTrials(int trials) {
            if (trials < 1) {
                throw new IllegalArgumentException("Screening trials must be >= 1");
            }
            this.screeningTrials = trials;
            return this;
        }

        public Builder maxScreenedCombinations(long max) {
            if (max < 1) {
                throw new IllegalArgumentException("Max screened combinations must be >= 1");
            }
            this.maxScreenedCombinations = max;
            return this;
        }

        public Builder strategyPolicy(StrategyPolicy policy) {
            this.strategyPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder seedTemplate(List<List<String>> template) {
            this.seedTemplate = template != null ? template : List.of();
            return this;
        }

        public OptimizerSettings build() {
            return new OptimizerSettings(this);
        }
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add("seed=" + seed);
        parts.add(trials == AUTO_TRIALS ? "trials=auto" : "trials=" + trials);
        parts.add("earlyStop=" + earlyStopFraction + "/" + earlyStopCap);
        parts.add("passes=" + maxRefinePasses);
        parts.add("screening=" + smallExcessThreshold + "/" + screeningTopK + "/" + screeningTrials);
        parts.add(strategyPolicy.toString());
        if (hasSeedTemplate()) {
            parts.add("template=" + seedTemplate);
        }
        return "OptimizerSettings[" + String.join(", ", parts) + "]";
    }
}
