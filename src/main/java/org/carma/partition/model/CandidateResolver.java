package org.carma.partition.model;

import java.util.*;

/**
 * Matches caller-supplied names against the graph registry.
 *
 * Matching ignores case and surrounding whitespace, and every match is rewritten
 * to its canonical spelling. Repeated names (in any spelling) are kept once, at
 * their first position. Names with no registry match are collected separately so
 * the caller can report them; they never reach the optimizer.
 */
public class CandidateResolver {

    private final RelationshipGraph graph;

    public CandidateResolver(RelationshipGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Outcome of resolving a candidate list.
     */
    public static class Resolution {
        private final List<String> resolved;
        private final List<String> unrecognized;

        public Resolution(List<String> resolved, List<String> unrecognized) {
            this.resolved = List.copyOf(resolved);
            this.unrecognized = List.copyOf(unrecognized);
        }

        /** Canonical names, input order, no duplicates. */
        public List<String> getResolved() { return resolved; }

        /** Input tokens with no registry match, trimmed, input order. */
        public List<String> getUnrecognized() { return unrecognized; }

        public boolean isEmpty() { return resolved.isEmpty(); }

        public boolean hasUnrecognized() { return !unrecognized.isEmpty(); }

        @Override
        public String toString() {
            return String.format("Resolution[resolved=%s, unrecognized=%s]", resolved, unrecognized);
        }
    }

    public Resolution resolve(Collection<String> names) {
        Set<String> resolved = new LinkedHashSet<>();
        List<String> unrecognized = new ArrayList<>();
        if (names == null) {
            return new Resolution(List.of(), List.of());
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            Optional<String> canonical = graph.canonicalName(name);
            if (canonical.isPresent()) {
                resolved.add(canonical.get());
            } else {
                unrecognized.add(name.trim());
            }
        }
        return new Resolution(new ArrayList<>(resolved), unrecognized);
    }

    /**
     * Resolve a comma-separated list such as {@code "Han Wu, weiqing,Qubing"}.
     */
    public Resolution resolve(String commaSeparated) {
        return resolve(split(commaSeparated));
    }

    public static List<String> split(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : commaSeparated.split(",")) {
            if (!token.isBlank()) {
                tokens.add(token.trim());
            }
        }
        return tokens;
    }
}
