package org.carma.partition.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipGraphTest {

    private static Map<String, List<String>> table(String... pairs) {
        Map<String, List<String>> table = new LinkedHashMap<>();
        for (String pair : pairs) {
            String[] parts = pair.split("-");
            table.computeIfAbsent(parts[0], k -> new ArrayList<>()).add(parts[1]);
        }
        return table;
    }

    // ============ Construction ============

    @Test
    @DisplayName("Directed declarations become undirected edges")
    void testSymmetrizes() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-B", "B-C"));

        assertTrue(graph.neighbors("B").contains("A"));
        assertTrue(graph.neighbors("C").contains("B"));
        assertTrue(graph.areConnected("A", "B"));
        assertTrue(graph.areConnected("B", "A"));
        assertFalse(graph.areConnected("A", "C"));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    @DisplayName("Self declarations are dropped")
    void testNoLoops() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-A", "A-B"));

        assertFalse(graph.neighbors("A").contains("A"));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    @DisplayName("Duplicate and reverse declarations collapse into one edge")
    void testDuplicatesCollapse() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-B", "A-B", "B-A"));

        assertEquals(1, graph.edgeCount());
        assertEquals(Set.of("B"), graph.neighbors("A"));
    }

    @Test
    @DisplayName("Registry holds keys and values in declaration order")
    void testRegistryOrder() {
        RelationshipGraph graph = RelationshipGraph.build(table("Imperial-Jingke", "Weiqing-Qubing", "Jingke-Jianli"));

        assertEquals(List.of("Imperial", "Jingke", "Weiqing", "Qubing", "Jianli"), graph.entities());
        assertEquals(5, graph.entityCount());
    }

    @Test
    @DisplayName("An entity with an empty list is registered without neighbors")
    void testIsolatedEntity() {
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        relationships.put("Solo", List.of());
        relationships.put("A", List.of("B"));
        RelationshipGraph graph = RelationshipGraph.build(relationships);

        assertTrue(graph.contains("Solo"));
        assertTrue(graph.neighbors("Solo").isEmpty());
    }

    @Test
    @DisplayName("Unknown names have no neighbors and no canonical form")
    void testUnknown() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-B"));

        assertFalse(graph.contains("Ghost"));
        assertTrue(graph.neighbors("Ghost").isEmpty());
        assertTrue(graph.canonicalName("Ghost").isEmpty());
        assertEquals(0, graph.degreeWithin("Ghost", List.of("A", "B")));
    }

    @Test
    @DisplayName("Empty or null relationship tables give an empty graph")
    void testEmpty() {
        assertEquals(0, RelationshipGraph.build(Map.of()).entityCount());
        assertEquals(0, RelationshipGraph.build(null).edgeCount());
    }

    @Test
    @DisplayName("Spellings differing by case refer to the first spelling seen")
    void testCaseInsensitiveRegistry() {
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        relationships.put("Han Wu", List.of("Weiqing"));
        relationships.put("weiqing", List.of("han wu", "Qubing"));
        RelationshipGraph graph = RelationshipGraph.build(relationships);

        assertEquals(List.of("Han Wu", "Weiqing", "Qubing"), graph.entities());
        assertEquals(2, graph.edgeCount());
        assertTrue(graph.areConnected("Weiqing", "Qubing"));
    }

    @ParameterizedTest
    @DisplayName("Canonical lookup ignores case and surrounding whitespace")
    @ValueSource(strings = {"han wu", "HAN WU", "Han Wu", "  han Wu  "})
    void testCanonicalName(String spelling) {
        RelationshipGraph graph = RelationshipGraph.build(Map.of("Han Wu", List.of("Weiqing")));

        assertEquals(Optional.of("Han Wu"), graph.canonicalName(spelling));
    }

    // ============ Queries ============

    @Test
    @DisplayName("connectionsWithin counts each connected pair once")
    void testConnectionsWithin() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-B", "B-C", "C-A", "C-D"));

        assertEquals(3, graph.connectionsWithin(List.of("A", "B", "C")));
        assertEquals(4, graph.connectionsWithin(List.of("A", "B", "C", "D")));
        assertEquals(0, graph.connectionsWithin(List.of("A", "D")));
        assertEquals(0, graph.connectionsWithin(List.of()));
    }

    @Test
    @DisplayName("degreeWithin excludes the entity itself")
    void testDegreeWithin() {
        RelationshipGraph graph = RelationshipGraph.build(table("A-B", "A-C", "A-D"));

        assertEquals(2, graph.degreeWithin("A", List.of("A", "B", "C")));
        assertEquals(1, graph.degreeWithin("B", List.of("A", "B", "C")));
        assertEquals(0, graph.degreeWithin("B", List.of("C", "D")));
    }

    @Test
    @DisplayName("clusterBonus counts connected pairs among in-pool neighbors")
    void testClusterBonus() {
        // Hub H with leaves A, B, C; A-B connected, C loose
        RelationshipGraph graph = RelationshipGraph.build(table("H-A", "H-B", "H-C", "A-B"));

        assertEquals(1, graph.clusterBonus("H", List.of("H", "A", "B", "C")));
        assertEquals(0, graph.clusterBonus("H", List.of("H", "A", "C")));
        assertEquals(1, graph.clusterBonus("A", List.of("H", "A", "B")));
        assertEquals(0, graph.clusterBonus("C", List.of("H", "A", "B", "C")));
    }

    @Test
    @DisplayName("Score equals brute-force edge counting over random graphs")
    void testScoreMatchesBruteForce() {
        Random random = new Random(11);
        for (int round = 0; round < 20; round++) {
            int n = 4 + random.nextInt(9);
            List<String> names = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                names.add("E" + i);
            }
            Map<String, List<String>> relationships = new LinkedHashMap<>();
            List<String[]> edges = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    if (random.nextDouble() < 0.35) {
                        // Declare in a random direction
                        String from = random.nextBoolean() ? names.get(i) : names.get(j);
                        String to = from.equals(names.get(i)) ? names.get(j) : names.get(i);
                        relationships.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
                        edges.add(new String[]{names.get(i), names.get(j)});
                    }
                }
                relationships.putIfAbsent(names.get(i), new ArrayList<>());
            }
            RelationshipGraph graph = RelationshipGraph.build(relationships);

            Capacities capacities = Capacities.of(4, 4, 4);
            Assignment assignment = Assignment.empty(capacities);
            List<String> shuffled = new ArrayList<>(names);
            Collections.shuffle(shuffled, random);
            for (String name : shuffled) {
                int group = random.nextInt(3);
                while (!assignment.hasSpace(group)) {
                    group = (group + 1) % 3;
                }
                assignment.add(group, name);
            }

            int expected = 0;
            for (String[] edge : edges) {
                if (assignment.groupOf(edge[0]) == assignment.groupOf(edge[1])) {
                    expected++;
                }
            }
            assertEquals(expected, graph.score(assignment), "round " + round);
            assertEquals(edges.size(), graph.edgeCount());
        }
    }
}
