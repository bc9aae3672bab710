package org.carma.partition.mechanism;

import java.util.*;

/**
 * Configurable policy deciding which construction strategy each trial uses.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>ROUND_ROBIN: weights expand into a fixed, interleaved schedule and trial
 *       {@code t} uses {@code schedule[t mod size]}. Weights {GREEDY_GAIN:2,
 *       CLUSTER_SEED:1} give GREEDY_GAIN, CLUSTER_SEED, GREEDY_GAIN, ...</li>
 *   <li>WEIGHTED_RANDOM: each trial samples a strategy with probability
 *       proportional to its weight, from the solve's seeded generator.</li>
 * </ul>
 *
 * | Preset | Mode | Mix |
 * |--------|------|-----|
 * | DEFAULT | round robin | all four, equal |
 * | CLUSTER_HEAVY | round robin | greedy gain, cluster seed, fill first |
 * | EXPLORATORY | weighted random | greedy 3, balanced 2, fill first 2, cluster 1 |
 */
public class StrategyPolicy {

    public enum Mode {
        ROUND_ROBIN,
        WEIGHTED_RANDOM
    }

    public static final StrategyPolicy DEFAULT = new Builder()
        .weight(ConstructionStrategy.FILL_FIRST, 1)
        .weight(ConstructionStrategy.BALANCED, 1)
        .weight(ConstructionStrategy.CLUSTER_SEED, 1)
        .weight(ConstructionStrategy.GREEDY_GAIN, 1)
        .build();

    public static final StrategyPolicy CLUSTER_HEAVY = new Builder()
        .weight(ConstructionStrategy.GREEDY_GAIN, 1)
        .weight(ConstructionStrategy.CLUSTER_SEED, 1)
        .weight(ConstructionStrategy.FILL_FIRST, 1)
        .build();

    public static final StrategyPolicy EXPLORATORY = new Builder()
        .mode(Mode.WEIGHTED_RANDOM)
        .weight(ConstructionStrategy.GREEDY_GAIN, 3)
        .weight(ConstructionStrategy.BALANCED, 2)
        .weight(ConstructionStrategy.FILL_FIRST, 2)
        .weight(ConstructionStrategy.CLUSTER_SEED, 1)
        .build();

    private final Mode mode;
    private final Map<ConstructionStrategy, Integer> weights;
    private final List<ConstructionStrategy> schedule;
    private final int totalWeight;

    private StrategyPolicy(Builder builder) {
        this.mode = builder.mode;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(builder.weights));
        this.totalWeight = weights.values().stream().mapToInt(Integer::intValue).sum();
        this.schedule = Collections.unmodifiableList(buildSchedule(weights));
    }

    private static List<ConstructionStrategy> buildSchedule(Map<ConstructionStrategy, Integer> weights) {
        int maxWeight = weights.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<ConstructionStrategy> schedule = new ArrayList<>();
        for (int round = 0; round < maxWeight; round++) {
            for (Map.Entry<ConstructionStrategy, Integer> entry : weights.entrySet()) {
                if (entry.getValue() > round) {
                    schedule.add(entry.getKey());
                }
            }
        }
        return schedule;
    }

    /**
     * Strategy for the given zero-based trial.
     */
    public ConstructionStrategy select(int trial, Random rng) {
        if (mode == Mode.ROUND_ROBIN) {
            return schedule.get(Math.floorMod(trial, schedule.size()));
        }
        int pick = rng.nextInt(totalWeight);
        for (Map.Entry<ConstructionStrategy, Integer> entry : weights.entrySet()) {
            pick -= entry.getValue();
            if (pick < 0) {
                return entry.getKey();
            }
        }
        throw new IllegalStateException("Weighted pick out of range");
    }

    public Mode getMode() {
        return mode;
    }

    public Map<ConstructionStrategy, Integer> getWeights() {
        return weights;
    }

    public List<ConstructionStrategy> getSchedule() {
        return schedule;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private Mode mode = Mode.ROUND_ROBIN;
        private final Map<ConstructionStrategy, Integer> weights = new LinkedHashMap<>();

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        /**
         * Set a strategy's weight. Zero removes it from the mix.
         */
        public Builder weight(ConstructionStrategy strategy, int weight) {
            if (weight < 0) {
                throw new IllegalArgumentException("Weight of " + strategy + " must be >= 0");
            }
            if (weight == 0) {
                weights.remove(strategy);
            } else {
                weights.put(strategy, weight);
            }
            return this;
        }

        public StrategyPolicy build() {
            if (weights.isEmpty()) {
                throw new IllegalArgumentException("At least one strategy needs a positive weight");
            }
            return new StrategyPolicy(this);
        }
    }

    @Override
    public String toString() {
        return "StrategyPolicy[" + mode + ", " + weights + "]";
    }
}
