package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Budgeted multi-start search: construct, refine, keep the best.
 *
 * Each trial picks a strategy from the {@link StrategyPolicy}, builds an assignment
 * with {@link AssignmentConstructor} and improves it with {@link LocalSearchRefiner}.
 * Only a strictly better score replaces the incumbent. The run stops when the
 * budget is spent or after the early-stop window of consecutive trials without
 * improvement.
 */
public class TrialRunner {

    private static final Logger log = LoggerFactory.getLogger(TrialRunner.class);

    private final AssignmentConstructor constructor;
    private final LocalSearchRefiner refiner;
    private final OptimizerSettings settings;

    public TrialRunner(RelationshipGraph graph, Capacities capacities, OptimizerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.constructor = new AssignmentConstructor(graph, capacities);
        this.refiner = new LocalSearchRefiner(graph, settings.getMaxRefinePasses());
    }

    /**
     * Outcome of a run.
     */
    public static class Outcome {
        private final ScoredAssignment best;
        private final int trialsRun;
        private final boolean stoppedEarly;

        public Outcome(ScoredAssignment best, int trialsRun, boolean stoppedEarly) {
            this.best = best;
            this.trialsRun = trialsRun;
            this.stoppedEarly = stoppedEarly;
        }

        public ScoredAssignment getBest() { return best; }
        public int getScore() { return best.getScore(); }
        public int getTrialsRun() { return trialsRun; }
        public boolean isStoppedEarly() { return stoppedEarly; }
    }

    /**
     * Run up to {@code trials} trials over the given candidates.
     *
     * @param candidates Distinct registry names, no more than total capacity
     * @param trials Trial budget (at least one trial always runs)
     * @param rng Seeded generator owned by the calling solve
     * @param template Optional starting partition tried first; may be empty
     */
    public Outcome run(List<String> candidates, int trials, Random rng, List<List<String>> template) {
        int budget = Math.max(1, trials);
        int window = settings.earlyStopWindow(budget);
        StrategyPolicy policy = settings.getStrategyPolicy();

        ScoredAssignment best = null;
        int trialsRun = 0;
        int sinceImprovement = 0;
        boolean stoppedEarly = false;

        if (template != null && !template.isEmpty()) {
            best = refiner.refine(constructor.fromTemplate(template, candidates));
            trialsRun++;
            log.debug("trial.template score={}", best.getScore());
        }

        for (int trial = 0; trial < budget; trial++) {
            ConstructionStrategy strategy = policy.select(trial, rng);
            Assignment initial = constructor.construct(strategy, candidates, rng);
            ScoredAssignment refined = refiner.refine(initial);
            trialsRun++;

            if (best == null || refined.getScore() > best.getScore()) {
                if (best != null) {
                    log.debug("trial.improved trial={} strategy={} score={} previous={}",
                        trial, strategy, refined.getScore(), best.getScore());
                }
                best = refined;
                sinceImprovement = 0;
            } else {
                sinceImprovement++;
            }

            if (sinceImprovement >= window && trial + 1 < budget) {
                stoppedEarly = true;
                log.debug("trial.earlyStop trial={} window={} score={}", trial, window, best.getScore());
                break;
            }
        }

        return new Outcome(best, trialsRun, stoppedEarly);
    }
}
