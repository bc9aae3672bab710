package org.carma.partition.mechanism;

import org.carma.partition.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class TrialRunnerTest {

    private static RelationshipGraph path() {
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        relationships.put("X", List.of("Y", "Z"));
        relationships.put("Y", List.of("X", "W"));
        relationships.put("Z", List.of("X"));
        relationships.put("W", List.of("Y"));
        return RelationshipGraph.build(relationships);
    }

    @Test
    @DisplayName("A run without improvement stops after the early-stop window")
    void testEarlyStop() {
        // No edges: every trial scores 0, so only the first one improves
        Map<String, List<String>> relationships = new LinkedHashMap<>();
        relationships.put("A", List.of());
        relationships.put("B", List.of());
        RelationshipGraph graph = RelationshipGraph.build(relationships);
        OptimizerSettings settings = new OptimizerSettings.Builder()
            .earlyStopFraction(0.1)
            .earlyStopCap(5)
            .build();

        TrialRunner.Outcome outcome = new TrialRunner(graph, Capacities.of(1, 1), settings)
            .run(List.of("A", "B"), 100, new Random(1), List.of());

        assertTrue(outcome.isStoppedEarly());
        assertEquals(6, outcome.getTrialsRun());
        assertEquals(0, outcome.getScore());
    }

    @Test
    @DisplayName("Spending the full budget is not an early stop")
    void testFullBudget() {
        // Window equals the budget, so the run can never stop early
        OptimizerSettings settings = new OptimizerSettings.Builder().earlyStopFraction(1.0).build();

        TrialRunner.Outcome outcome = new TrialRunner(path(), Capacities.of(2, 2, 2), settings)
            .run(List.of("X", "Y", "Z", "W"), 3, new Random(1), List.of());

        assertFalse(outcome.isStoppedEarly());
        assertEquals(3, outcome.getTrialsRun());
        assertEquals(2, outcome.getScore());
    }

    @Test
    @DisplayName("A template counts as an extra trial")
    void testTemplateTrial() {
        OptimizerSettings settings = new OptimizerSettings.Builder().earlyStopFraction(1.0).build();
        List<List<String>> template = List.of(List.of("X", "Z"), List.of("Y", "W"));

        TrialRunner.Outcome outcome = new TrialRunner(path(), Capacities.of(2, 2, 2), settings)
            .run(List.of("X", "Y", "Z", "W"), 2, new Random(1), template);

        assertEquals(3, outcome.getTrialsRun());
        assertEquals(2, outcome.getScore());
    }

    @Test
    @DisplayName("Zero or negative budgets still run one trial")
    void testMinimumOneTrial() {
        TrialRunner.Outcome outcome = new TrialRunner(path(), Capacities.of(2, 2, 2), OptimizerSettings.DEFAULT)
            .run(List.of("X", "Y"), 0, new Random(1), List.of());

        assertEquals(1, outcome.getTrialsRun());
        assertEquals(1, outcome.getScore());
    }
}
