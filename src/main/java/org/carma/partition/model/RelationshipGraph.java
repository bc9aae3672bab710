package org.carma.partition.model;

import java.util.*;

/**
 * Undirected, loop-free connection graph over a registry of named entities.
 *
 * Built from a directed declaration table (entity → related entities) by
 * symmetrizing every declared edge. Duplicate declarations collapse into a single
 * edge and self declarations are dropped.
 *
 * <h2>Registry</h2>
 * Every name that appears as a key or as a value is registered, in declaration
 * order. Names are matched case-insensitively: the first spelling seen becomes the
 * canonical form, and later spellings that differ only by case refer to it.
 * A registered entity with no edges is valid; a name that never appears is unknown.
 *
 * The graph is immutable once built and safe to share between solves.
 */
public class RelationshipGraph {

    private final Map<String, Set<String>> adjacency;
    private final Map<String, String> canonicalByKey;
    private final int edgeCount;

    private RelationshipGraph(Map<String, Set<String>> adjacency,
                              Map<String, String> canonicalByKey,
                              int edgeCount) {
        this.adjacency = adjacency;
        this.canonicalByKey = canonicalByKey;
        this.edgeCount = edgeCount;
    }

    // ========================================================================
    // Construction
    // ========================================================================

    /**
     * Build a symmetric graph from directed declarations.
     *
     * @param relationships Entity → list of related entities (may be asymmetric)
     * @return Immutable undirected graph
     */
    public static RelationshipGraph build(Map<String, ? extends Collection<String>> relationships) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Map<String, String> canonical = new HashMap<>();
        int edges = 0;

        if (relationships != null) {
            for (Map.Entry<String, ? extends Collection<String>> entry : relationships.entrySet()) {
                String source = register(entry.getKey(), adjacency, canonical);
                if (source == null || entry.getValue() == null) {
                    continue;
                }
                for (String related : entry.getValue()) {
                    String target = register(related, adjacency, canonical);
                    if (target == null || target.equals(source)) {
                        continue;
                    }
                    if (adjacency.get(source).add(target)) {
                        adjacency.get(target).add(source);
                        edges++;
                    }
                }
            }
        }

        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : adjacency.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return new RelationshipGraph(Collections.unmodifiableMap(frozen), canonical, edges);
    }

    private static String register(String rawName, Map<String, Set<String>> adjacency,
                                   Map<String, String> canonical) {
        if (rawName == null || rawName.isBlank()) {
            return null;
        }
        String name = rawName.trim();
        String existing = canonical.putIfAbsent(key(name), name);
        if (existing != null) {
            return existing;
        }
        adjacency.put(name, new LinkedHashSet<>());
        return name;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    // ========================================================================
    // Registry
    // ========================================================================

    /**
     * All registered entities in declaration order.
     */
    public List<String> entities() {
        return new ArrayList<>(adjacency.keySet());
    }

    public int entityCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Exact (case-sensitive) registry membership.
     */
    public boolean contains(String name) {
        return name != null && adjacency.containsKey(name);
    }

    /**
     * Resolve a name to its canonical registry spelling, ignoring case and
     * surrounding whitespace.
     */
    public Optional<String> canonicalName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByKey.get(key(name)));
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Neighbors of an entity. Unknown entities have none.
     */
    public Set<String> neighbors(String name) {
        Set<String> neighbors = adjacency.get(name);
        return neighbors != null ? neighbors : Collections.emptySet();
    }

    public boolean areConnected(String a, String b) {
        return neighbors(a).contains(b);
    }

    /**
     * Count unordered pairs inside the group that are connected.
     */
    public int connectionsWithin(Collection<String> group) {
        List<String> members = new ArrayList<>(group);
        int connections = 0;
        for (int i = 0; i < members.size(); i++) {
            Set<String> neighbors = neighbors(members.get(i));
            if (neighbors.isEmpty()) {
                continue;
            }
            for (int j = i + 1; j < members.size(); j++) {
                if (neighbors.contains(members.get(j))) {
                    connections++;
                }
            }
        }
        return connections;
    }

    /**
     * Number of pool members adjacent to {@code name}. The entity itself never counts.
     */
    public int degreeWithin(String name, Collection<String> pool) {
        Set<String> neighbors = neighbors(name);
        if (neighbors.isEmpty()) {
            return 0;
        }
        int degree = 0;
        for (String other : pool) {
            if (!other.equals(name) && neighbors.contains(other)) {
                degree++;
            }
        }
        return degree;
    }

    /**
     * Local triangle density: among the neighbors of {@code name} that are in the
     * pool, the number of pairs that are themselves connected.
     */
    public int clusterBonus(String name, Collection<String> pool) {
        List<String> connected = new ArrayList<>();
        Set<String> neighbors = neighbors(name);
        for (String other : pool) {
            if (!other.equals(name) && neighbors.contains(other)) {
                connected.add(other);
            }
        }
        return connectionsWithin(connected);
    }

    /**
     * Total connections kept inside groups.
     */
    public int score(Assignment assignment) {
        int total = 0;
        for (int i = 0; i < assignment.groupCount(); i++) {
            total += connectionsWithin(assignment.group(i));
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("RelationshipGraph[%d entities, %d edges]", adjacency.size(), edgeCount);
    }
}
