package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Best-improvement hill climbing over swaps and moves.
 *
 * <h2>Neighborhood</h2>
 * - Swap: exchange x in group i with y in group j, for every i &lt; j.
 * - Move: relocate x from group i into group j != i when j has spare capacity.
 *
 * Each pass scans swaps first, then moves, and applies only the single best
 * strictly-improving candidate; a later candidate replaces an earlier one only if
 * it is strictly better. Passes repeat until nothing improves or the pass cap is
 * reached, so the returned score is never below the input score.
 *
 * Candidates are evaluated by score deltas computed from degrees into the affected
 * groups, which equals recomputing the full score.
 */
public class LocalSearchRefiner {

    private static final Logger log = LoggerFactory.getLogger(LocalSearchRefiner.class);

    private final RelationshipGraph graph;
    private final int maxPasses;

    public LocalSearchRefiner(RelationshipGraph graph, int maxPasses) {
        if (maxPasses < 0) {
            throw new IllegalArgumentException("Max passes must be >= 0");
        }
        this.graph = Objects.requireNonNull(graph, "graph");
        this.maxPasses = maxPasses;
    }

    /**
     * Improve a copy of the assignment. The argument is left untouched.
     */
    public ScoredAssignment refine(Assignment assignment) {
        Assignment current = assignment.copy();
        int score = graph.score(current);
        int passes = 0;

        while (passes < maxPasses) {
            Improvement best = findBestImprovement(current);
            if (best == null) {
                break;
            }
            best.applyTo(current);
            score += best.delta;
            passes++;
        }

        if (log.isTraceEnabled()) {
            log.trace("refine.done passes={} score={} start={}", passes, score, graph.score(assignment));
        }
        return new ScoredAssignment(current, score);
    }

    private Improvement findBestImprovement(Assignment assignment) {
        int groups = assignment.groupCount();
        List<List<String>> members = assignment.toLists();
        Improvement best = null;
        int bestDelta = 0;

        for (int i = 0; i < groups; i++) {
            for (int j = i + 1; j < groups; j++) {
                for (String x : members.get(i)) {
                    for (String y : members.get(j)) {
                        int delta = swapDelta(assignment, x, i, y, j);
                        if (delta > bestDelta) {
                            bestDelta = delta;
                            best = Improvement.swap(x, y, delta);
                        }
                    }
                }
            }
        }

        for (int i = 0; i < groups; i++) {
            for (int j = 0; j < groups; j++) {
                if (i == j || !assignment.hasSpace(j)) {
                    continue;
                }
                for (String x : members.get(i)) {
                    int delta = moveDelta(assignment, x, i, j);
                    if (delta > bestDelta) {
                        bestDelta = delta;
                        best = Improvement.move(x, j, delta);
                    }
                }
            }
        }
        return best;
    }

    /**
     * Score change if x (group i) and y (group j) trade places.
     */
    int swapDelta(Assignment assignment, String x, int i, String y, int j) {
        int link = graph.areConnected(x, y) ? 1 : 0;
        int lost = graph.degreeWithin(x, assignment.group(i)) + graph.degreeWithin(y, assignment.group(j));
        int gained = graph.degreeWithin(x, assignment.group(j)) - link
            + graph.degreeWithin(y, assignment.group(i)) - link;
        return gained - lost;
    }

    /**
     * Score change if x moves from group i to group j.
     */
    int moveDelta(Assignment assignment, String x, int i, int j) {
        return graph.degreeWithin(x, assignment.group(j)) - graph.degreeWithin(x, assignment.group(i));
    }

    private static final class Improvement {
        private final String entity;
        private final String partner;
        private final int targetGroup;
        private final int delta;

        private Improvement(String entity, String partner, int targetGroup, int delta) {
            this.entity = entity;
            this.partner = partner;
            this.targetGroup = targetGroup;
            this.delta = delta;
        }

        static Improvement swap(String x, String y, int delta) {
            return new Improvement(x, y, -1, delta);
        }

        static Improvement move(String x, int target, int delta) {
            return new Improvement(x, null, target, delta);
        }

        void applyTo(Assignment assignment) {
            if (partner != null) {
                assignment.swap(entity, partner);
            } else {
                assignment.move(entity, targetGroup);
            }
        }
    }
}
