package org.carma.partition.command;

import org.carma.partition.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentFormatterTest {

    private RelationshipGraph graph;
    private PartitionResult result;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        relationships.put("Imperial", List.of("Jingke"));
        relationships.put("Jingke", List.of("Jianli"));
        relationships.put("Yuhuan", List.of("Libai"));
        graph = RelationshipGraph.build(relationships);

        result = new PartitionResult(Capacities.of(3, 2, 2),
            List.of(List.of("Imperial", "Jingke", "Jianli"), List.of(), List.of("Yuhuan", "Libai")), 3);
    }

    @Test
    @DisplayName("Compact form lists one line per group and the total")
    void testCompact() {
        String text = new AssignmentFormatter(graph).formatCompact(result);

        assertEquals("Imperial, Jingke, Jianli\n(empty)\nYuhuan, Libai\nTotal connections = 3", text);
    }

    @Test
    @DisplayName("Detailed form shows sizes, capacities and per-group connections")
    void testDetailed() {
        result.setUnrecognized(List.of("Nobody")).setDropped(List.of("Dufu"));

        String text = new AssignmentFormatter(graph).formatDetailed(result);

        assertTrue(text.startsWith("Total connections: 3\n"));
        assertTrue(text.contains("Group 1 (3/3) - 2 connections:\n  Imperial, Jingke, Jianli\n"));
        assertTrue(text.contains("Group 2 (0/2) - 0 connections:\n  (empty)\n"));
        assertTrue(text.contains("Group 3 (2/2) - 1 connections:"));
        assertTrue(text.contains("Unrecognized: Nobody\n"));
        assertTrue(text.contains("Dropped (over capacity): Dufu\n"));
    }

    @Test
    @DisplayName("Without a graph the detailed form omits connection counts")
    void testDetailedWithoutGraph() {
        String text = new AssignmentFormatter(null).formatDetailed(result);

        assertTrue(text.contains("Group 1 (3/3):\n"));
        assertFalse(text.contains("connections:"));
    }

    @Test
    @DisplayName("Unrecognized line is empty when every name matched")
    void testUnrecognizedLine() {
        AssignmentFormatter formatter = new AssignmentFormatter(graph);

        assertEquals("", formatter.formatUnrecognized(List.of()));
        assertEquals("Unrecognized names: Ghost, Nobody", formatter.formatUnrecognized(List.of("Ghost", "Nobody")));
    }
}
