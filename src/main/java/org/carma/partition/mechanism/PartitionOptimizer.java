package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Assigns entities to capacity-bounded groups, maximizing the number of
 * connections kept inside groups.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Resolve candidates against the graph registry (case-insensitive); names
 *       with no match are reported on the result and excluded.</li>
 *   <li>No valid candidates: return empty groups with score 0, no trials.</li>
 *   <li>More candidates than total capacity: trim with {@link OverflowSelector}.</li>
 *   <li>Run the trial budget with {@link TrialRunner} and return the best.</li>
 * </ol>
 *
 * A solve is single-threaded and a pure function of its inputs and seed: the same
 * graph, capacities, candidates, settings and seed always give the same result.
 * Malformed capacities fail at construction; a solve itself never fails for lack
 * of a solution.
 *
 * Usage:
 * <pre>
 * PartitionOptimizer optimizer = new PartitionOptimizer(
 *     RelationshipGraph.build(relationships), Capacities.of(3, 6, 6));
 * PartitionResult result = optimizer.solve(List.of("Han Wu", "Weiqing", "Qubing"), 7L);
 * </pre>
 */
public class PartitionOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PartitionOptimizer.class);

    private final RelationshipGraph graph;
    private final Capacities capacities;
    private final OptimizerSettings settings;
    private final CandidateResolver resolver;
    private final OverflowSelector overflowSelector;
    private final TrialRunner trialRunner;
    private final List<List<String>> seedTemplate;

    public PartitionOptimizer(RelationshipGraph graph, Capacities capacities) {
        this(graph, capacities, OptimizerSettings.DEFAULT);
    }

    public PartitionOptimizer(RelationshipGraph graph, Capacities capacities, OptimizerSettings settings) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.capacities = Objects.requireNonNull(capacities, "capacities");
        this.settings = settings != null ? settings : OptimizerSettings.DEFAULT;
        this.resolver = new CandidateResolver(graph);
        this.overflowSelector = new OverflowSelector(graph, capacities, this.settings);
        this.trialRunner = new TrialRunner(graph, capacities, this.settings);
        this.seedTemplate = resolveTemplate(this.settings.getSeedTemplate());
    }

    /**
     * One-shot solve from raw inputs.
     *
     * @throws DegenerateCapacitiesException if capacities are empty or not all positive
     */
    public static PartitionResult solve(List<Integer> capacities,
                                        Map<String, ? extends Collection<String>> relationships,
                                        List<String> candidates,
                                        long seed) {
        Capacities validated = Capacities.of(capacities);
        return new PartitionOptimizer(RelationshipGraph.build(relationships), validated)
            .solve(candidates, seed);
    }

    // ========================================================================
    // Solving
    // ========================================================================

    /**
     * Solve with the seed from the settings.
     */
    public PartitionResult solve(List<String> candidates) {
        return solve(candidates, settings.getSeed());
    }

    /**
     * Solve with an explicit seed.
     */
    public PartitionResult solve(List<String> candidates, long seed) {
        long startTime = System.currentTimeMillis();

        CandidateResolver.Resolution resolution = resolver.resolve(candidates);
        if (resolution.hasUnrecognized()) {
            log.warn("solve.unrecognized names={}", resolution.getUnrecognized());
        }
        if (resolution.isEmpty()) {
            log.info("solve.empty requested={} capacities={}",
                candidates != null ? candidates.size() : 0, capacities);
            return PartitionResult.empty(capacities)
                .setUnrecognized(resolution.getUnrecognized())
                .setComputationTimeMs(System.currentTimeMillis() - startTime);
        }

        Random rng = new Random(seed);
        List<String> selected = resolution.getResolved();
        List<String> dropped = List.of();

        if (selected.size() > capacities.total()) {
            log.info("solve.overflow candidates={} capacity={}", selected.size(), capacities.total());
            OverflowSelector.Selection selection = overflowSelector.select(selected, rng);
            selected = selection.getSelected();
            dropped = selection.getDropped();
        }

        int trials = settings.trialBudget(selected.size());
        TrialRunner.Outcome outcome = trialRunner.run(selected, trials, rng, seedTemplate);
        ScoredAssignment best = outcome.getBest();

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("solve.done entities={} score={} trials={} earlyStop={} timeMs={}",
            selected.size(), best.getScore(), outcome.getTrialsRun(), outcome.isStoppedEarly(), elapsed);

        return new PartitionResult(capacities, best.getAssignment().toLists(), best.getScore())
            .setUnrecognized(resolution.getUnrecognized())
            .setDropped(dropped)
            .setTrialsRun(outcome.getTrialsRun())
            .setStoppedEarly(outcome.isStoppedEarly())
            .setComputationTimeMs(elapsed);
    }

    /**
     * Template names in registry spelling. Names the registry does not know are
     * dropped with a warning; empty groups are kept so group indexes still line up.
     */
    private List<List<String>> resolveTemplate(List<List<String>> template) {
        if (template.isEmpty()) {
            return List.of();
        }
        List<List<String>> resolved = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (List<String> group : template) {
            List<String> names = new ArrayList<>();
            for (String name : group) {
                Optional<String> canonical = graph.canonicalName(name);
                if (canonical.isPresent()) {
                    names.add(canonical.get());
                } else {
                    unresolved.add(name);
                }
            }
            resolved.add(Collections.unmodifiableList(names));
        }
        if (!unresolved.isEmpty()) {
            log.warn("template.unrecognized names={}", unresolved);
        }
        return Collections.unmodifiableList(resolved);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public RelationshipGraph getGraph() {
        return graph;
    }

    public Capacities getCapacities() {
        return capacities;
    }

    public OptimizerSettings getSettings() {
        return settings;
    }

    /**
     * Seed template after resolution against the registry.
     */
    public List<List<String>> getSeedTemplate() {
        return seedTemplate;
    }
}
