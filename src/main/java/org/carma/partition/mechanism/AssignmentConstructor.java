package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import java.util.*;

/**
 * Builds initial assignments with one of the {@link ConstructionStrategy}s.
 *
 * Every strategy places candidates until either all are placed or every group is
 * full; nobody is skipped while capacity remains. Candidates are expected to be
 * distinct registry names. Randomized strategies draw only from the supplied
 * generator so a seeded solve is reproducible.
 *
 * @see LocalSearchRefiner
 */
public class AssignmentConstructor {

    private final RelationshipGraph graph;
    private final Capacities capacities;

    public AssignmentConstructor(RelationshipGraph graph, Capacities capacities) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.capacities = Objects.requireNonNull(capacities, "capacities");
    }

    /**
     * Build an assignment with the given strategy.
     */
    public Assignment construct(ConstructionStrategy strategy, List<String> candidates, Random rng) {
        switch (strategy) {
            case FILL_FIRST:
                return fillFirst(candidates, rng);
            case BALANCED:
                return balanced(candidates, rng);
            case CLUSTER_SEED:
                return clusterSeed(candidates, rng);
            case GREEDY_GAIN:
                return greedyGain(candidates, rng);
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
    }

    // ========================================================================
    // Strategies
    // ========================================================================

    public Assignment fillFirst(List<String> candidates, Random rng) {
        Assignment assignment = Assignment.empty(capacities);
        List<String> order = shuffled(candidates, rng);

        int current = 0;
        for (String name : order) {
            while (current < assignment.groupCount() && !assignment.hasSpace(current)) {
                current++;
            }
            if (current >= assignment.groupCount()) {
                break;
            }
            assignment.add(current, name);
        }
        return assignment;
    }

    public Assignment balanced(List<String> candidates, Random rng) {
        Assignment assignment = Assignment.empty(capacities);
        List<String> order = shuffled(candidates, rng);

        for (String name : order) {
            List<Integer> tied = new ArrayList<>();
            int fewest = Integer.MAX_VALUE;
            for (int g = 0; g < assignment.groupCount(); g++) {
                if (!assignment.hasSpace(g)) {
                    continue;
                }
                int size = assignment.size(g);
                if (size < fewest) {
                    fewest = size;
                    tied.clear();
                    tied.add(g);
                } else if (size == fewest) {
                    tied.add(g);
                }
            }
            if (tied.isEmpty()) {
                break;
            }
            int group = tied.size() == 1 ? tied.get(0) : tied.get(rng.nextInt(tied.size()));
            assignment.add(group, name);
        }
        return assignment;
    }

    public Assignment clusterSeed(List<String> candidates, Random rng) {
        // Seed: highest degree inside the pool, first in input order on ties
        String seed = null;
        int bestDegree = 0;
        for (String name : candidates) {
            int degree = graph.degreeWithin(name, candidates);
            if (degree > bestDegree) {
                bestDegree = degree;
                seed = name;
            }
        }
        if (seed == null) {
            return fillFirst(candidates, rng);
        }

        Assignment assignment = Assignment.empty(capacities);
        List<String> remaining = new ArrayList<>(candidates);
        assignment.add(0, seed);
        remaining.remove(seed);

        for (int g = 0; g < assignment.groupCount(); g++) {
            while (assignment.hasSpace(g) && !remaining.isEmpty()) {
                int bestIndex = 0;
                int bestLinks = -1;
                for (int i = 0; i < remaining.size(); i++) {
                    int links = graph.degreeWithin(remaining.get(i), assignment.group(g));
                    if (links > bestLinks) {
                        bestLinks = links;
                        bestIndex = i;
                    }
                }
                assignment.add(g, remaining.remove(bestIndex));
            }
        }
        return assignment;
    }

    public Assignment greedyGain(List<String> candidates, Random rng) {
        Assignment assignment = Assignment.empty(capacities);
        for (String name : shuffled(candidates, rng)) {
            if (!placeGreedily(assignment, name)) {
                break;
            }
        }
        return assignment;
    }

    /**
     * Start from a configured template: each template name that is a candidate goes
     * into its template group while room remains; everything else is placed
     * greedily in candidate order. Template groups beyond the group count are ignored.
     */
    public Assignment fromTemplate(List<List<String>> template, List<String> candidates) {
        Assignment assignment = Assignment.empty(capacities);
        Set<String> pool = new HashSet<>(candidates);

        int groups = Math.min(template.size(), assignment.groupCount());
        for (int g = 0; g < groups; g++) {
            for (String name : template.get(g)) {
                if (pool.contains(name) && !assignment.contains(name) && assignment.hasSpace(g)) {
                    assignment.add(g, name);
                }
            }
        }
        for (String name : candidates) {
            if (!assignment.contains(name) && !placeGreedily(assignment, name)) {
                break;
            }
        }
        return assignment;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Place one entity where it adds the most connections (lowest index on ties).
     * Without a positive gain, use the group with most spare room (lowest index on
     * ties). Returns false when every group is full.
     */
    private boolean placeGreedily(Assignment assignment, String name) {
        int bestGroup = -1;
        int bestGain = 0;
        for (int g = 0; g < assignment.groupCount(); g++) {
            if (!assignment.hasSpace(g)) {
                continue;
            }
            // Adding one member raises connectionsWithin by its degree into the group
            int gain = graph.degreeWithin(name, assignment.group(g));
            if (gain > bestGain) {
                bestGain = gain;
                bestGroup = g;
            }
        }

        if (bestGroup < 0) {
            int mostSpare = 0;
            for (int g = 0; g < assignment.groupCount(); g++) {
                int spare = assignment.spare(g);
                if (spare > mostSpare) {
                    mostSpare = spare;
                    bestGroup = g;
                }
            }
        }

        if (bestGroup < 0) {
            return false;
        }
        assignment.add(bestGroup, name);
        return true;
    }

    private static List<String> shuffled(List<String> candidates, Random rng) {
        List<String> order = new ArrayList<>(candidates);
        Collections.shuffle(order, rng);
        return order;
    }
}
