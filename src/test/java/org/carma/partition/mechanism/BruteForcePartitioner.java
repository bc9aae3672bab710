package org.carma.partition.mechanism;

import org.carma.partition.model.*;

import java.util.*;

/**
 * Exhaustive reference solver for small inputs: tries every group label for every
 * entity and keeps the best complete, capacity-respecting assignment.
 */
final class BruteForcePartitioner {

    private BruteForcePartitioner() {}

    static int bestScore(RelationshipGraph graph, Capacities capacities, List<String> entities) {
        if (entities.size() > capacities.total()) {
            throw new IllegalArgumentException("Reference solver needs entities <= total capacity");
        }
        return search(graph, Assignment.empty(capacities), entities, 0);
    }

    private static int search(RelationshipGraph graph, Assignment assignment, List<String> entities, int index) {
        if (index == entities.size()) {
            return graph.score(assignment);
        }
        int best = -1;
        String name = entities.get(index);
        for (int g = 0; g < assignment.groupCount(); g++) {
            if (!assignment.hasSpace(g)) {
                continue;
            }
            Assignment next = assignment.copy();
            next.add(g, name);
            best = Math.max(best, search(graph, next, entities, index + 1));
        }
        return best;
    }

    /**
     * Random symmetric graph over E0..E{n-1}.
     */
    static RelationshipGraph randomGraph(int n, double density, Random random) {
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            List<String> related = new ArrayList<>();
            for (int j = i + 1; j < n; j++) {
                if (random.nextDouble() < density) {
                    related.add("E" + j);
                }
            }
            relationships.put("E" + i, related);
        }
        return RelationshipGraph.build(relationships);
    }

    static List<String> names(int n) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            names.add("E" + i);
        }
        return names;
    }
}
