package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Trims a candidate list that exceeds total capacity down to exactly
 * {@code capacities.total()} entities.
 *
 * <h2>Small excess: removal screening</h2>
 * When the excess is at most {@code smallExcessThreshold}, every combination of
 * {@code excess} entities to remove is enumerated in lexicographic input order.
 * Each remaining subset is quick-scored with one cluster-seed construction; the
 * top-K subsets (stable on ties) are then scored properly with a full trial run,
 * and the best of those wins (first on ties). Screening is skipped, with a warning,
 * when the number of combinations exceeds {@code maxScreenedCombinations}.
 *
 * <h2>Large excess: priority ranking</h2>
 * Each candidate is ranked by {@code degreeWithin + 0.5 * clusterBonus} over the
 * full pool, descending, ties by input order. The top {@code total} are kept, in
 * input order. Fully deterministic.
 */
public class OverflowSelector {

    private static final Logger log = LoggerFactory.getLogger(OverflowSelector.class);

    public enum Policy {
        /** Nothing to trim. */
        NONE,
        /** Exhaustive removal screening. */
        SCREENED,
        /** Degree and cluster ranking. */
        PRIORITY
    }

    private final RelationshipGraph graph;
    private final Capacities capacities;
    private final OptimizerSettings settings;
    private final AssignmentConstructor constructor;
    private final TrialRunner trialRunner;

    public OverflowSelector(RelationshipGraph graph, Capacities capacities, OptimizerSettings settings) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.capacities = Objects.requireNonNull(capacities, "capacities");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.constructor = new AssignmentConstructor(graph, capacities);
        this.trialRunner = new TrialRunner(graph, capacities, settings);
    }

    /**
     * Which candidates were kept and which were dropped.
     */
    public static class Selection {
        private final List<String> selected;
        private final List<String> dropped;
        private final Policy policy;

        public Selection(List<String> selected, List<String> dropped, Policy policy) {
            this.selected = List.copyOf(selected);
            this.dropped = List.copyOf(dropped);
            this.policy = policy;
        }

        public List<String> getSelected() { return selected; }
        public List<String> getDropped() { return dropped; }
        public Policy getPolicy() { return policy; }

        @Override
        public String toString() {
            return String.format("Selection[%s: kept=%d, dropped=%s]", policy, selected.size(), dropped);
        }
    }

    /**
     * Reduce the candidates to total capacity.
     *
     * @param candidates Distinct registry names in caller order
     * @param rng Seeded generator owned by the calling solve
     */
    public Selection select(List<String> candidates, Random rng) {
        int maxPeople = capacities.total();
        if (candidates.size() <= maxPeople) {
            return new Selection(candidates, List.of(), Policy.NONE);
        }

        int excess = candidates.size() - maxPeople;
        if (excess <= settings.getSmallExcessThreshold()) {
            long combinations = combinationCount(candidates.size(), excess, settings.getMaxScreenedCombinations());
            if (combinations <= settings.getMaxScreenedCombinations()) {
                return screenRemovals(candidates, excess, rng);
            }
            log.warn("overflow.screening.skipped candidates={} excess={} limit={}",
                candidates.size(), excess, settings.getMaxScreenedCombinations());
        }
        return selectByPriority(candidates);
    }

    // ========================================================================
    // Small excess
    // ========================================================================

    private Selection screenRemovals(List<String> candidates, int excess, Random rng) {
        int n = candidates.size();
        List<Screened> screened = new ArrayList<>();

        int[] removal = new int[excess];
        for (int i = 0; i < excess; i++) {
            removal[i] = i;
        }
        do {
            List<String> subset = without(candidates, removal);
            int quickScore = graph.score(constructor.clusterSeed(subset, rng));
            screened.add(new Screened(subset, quickScore));
        } while (nextCombination(removal, n));

        screened.sort(Comparator.comparingInt((Screened s) -> s.quickScore).reversed());
        int topK = Math.min(settings.getScreeningTopK(), screened.size());
        log.debug("overflow.screened combinations={} topK={} bestQuick={}",
            screened.size(), topK, screened.get(0).quickScore);

        List<String> bestSubset = null;
        int bestScore = -1;
        for (int k = 0; k < topK; k++) {
            Screened candidate = screened.get(k);
            TrialRunner.Outcome outcome = trialRunner.run(
                candidate.subset, settings.getScreeningTrials(), rng, List.of());
            if (outcome.getScore() > bestScore) {
                bestScore = outcome.getScore();
                bestSubset = candidate.subset;
            }
        }

        log.info("overflow.selected policy=SCREENED candidates={} kept={} score={}",
            n, bestSubset.size(), bestScore);
        return new Selection(bestSubset, droppedFrom(candidates, bestSubset), Policy.SCREENED);
    }

    private static final class Screened {
        private final List<String> subset;
        private final int quickScore;

        private Screened(List<String> subset, int quickScore) {
            this.subset = subset;
            this.quickScore = quickScore;
        }
    }

    private static List<String> without(List<String> candidates, int[] removal) {
        List<String> subset = new ArrayList<>(candidates.size() - removal.length);
        int r = 0;
        for (int i = 0; i < candidates.size(); i++) {
            if (r < removal.length && removal[r] == i) {
                r++;
            } else {
                subset.add(candidates.get(i));
            }
        }
        return subset;
    }

    /**
     * Advance to the next k-combination of {0..n-1} in lexicographic order.
     */
    static boolean nextCombination(int[] combination, int n) {
        int k = combination.length;
        int i = k - 1;
        while (i >= 0 && combination[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        combination[i]++;
        for (int j = i + 1; j < k; j++) {
            combination[j] = combination[j - 1] + 1;
        }
        return true;
    }

    /**
     * n choose k, saturating just above {@code limit}.
     */
    static long combinationCount(int n, int k, long limit) {
        long result = 1;
        for (int i = 1; i <= k; i++) {
            result = result * (n - k + i) / i;
            if (result > limit) {
                return limit + 1;
            }
        }
        return result;
    }

    // ========================================================================
    // Large excess
    // ========================================================================

    /**
     * Keep the highest-priority {@code total} candidates.
     */
    public Selection selectByPriority(List<String> candidates) {
        int maxPeople = capacities.total();
        List<String> ranked = new ArrayList<>(candidates);
        Map<String, Double> priority = new HashMap<>();
        for (String name : candidates) {
            priority.put(name, priority(name, candidates));
        }
        // List.sort is stable: equal priorities keep input order
        ranked.sort(Comparator.comparingDouble((String name) -> priority.get(name)).reversed());

        Set<String> kept = new HashSet<>(ranked.subList(0, Math.min(maxPeople, ranked.size())));
        List<String> selected = new ArrayList<>();
        for (String name : candidates) {
            if (kept.contains(name)) {
                selected.add(name);
            }
        }

        log.info("overflow.selected policy=PRIORITY candidates={} kept={}", candidates.size(), selected.size());
        return new Selection(selected, droppedFrom(candidates, selected), Policy.PRIORITY);
    }

    /**
     * Degree into the pool plus half the local cluster bonus.
     */
    public double priority(String name, List<String> pool) {
        return graph.degreeWithin(name, pool) + 0.5 * graph.clusterBonus(name, pool);
    }

    private static List<String> droppedFrom(List<String> candidates, List<String> selected) {
        Set<String> kept = new HashSet<>(selected);
        List<String> dropped = new ArrayList<>();
        for (String name : candidates) {
            if (!kept.contains(name)) {
                dropped.add(name);
            }
        }
        return dropped;
    }
}
