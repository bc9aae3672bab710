package org.carma.partition.runner;

import org.carma.partition.config.ProblemConfigLoader;
import org.carma.partition.config.ProblemConfigLoader.ProblemConfig;
import org.carma.partition.model.PartitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PartitionRunnerTest {

    private ByteArrayOutputStream buffer;
    private PartitionRunner runner;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        runner = new PartitionRunner(new ProblemConfigLoader(), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("A bundled problem is solved and reported")
    void testRunResource() throws IOException {
        PartitionResult result = runner.runResource("problems/sample-4.yaml");

        assertEquals(2, result.getScore());
        String text = output();
        assertTrue(text.contains("Problem: sample-4"));
        assertTrue(text.contains("Candidate pool:"));
        assertTrue(text.contains("=== RESULT ==="));
        assertTrue(text.contains("Total connections: 2"));
        assertTrue(text.contains("Total connections = 2"));
    }

    @Test
    @DisplayName("Overflowing problems report dropped entities")
    void testOverflowReport() throws IOException {
        PartitionResult result = runner.runResource("problems/characters.yaml");

        assertEquals(15, result.getAssignedCount());
        assertEquals(4, result.getDropped().size());
        assertTrue(output().contains("Dropped (over capacity):"));
    }

    @Test
    @DisplayName("Quiet mode prints nothing")
    void testQuiet() throws IOException {
        PartitionResult result = runner.verbose(false).runResource("problems/sample-4.yaml");

        assertEquals(2, result.getScore());
        assertEquals("", output());
    }

    @Test
    @DisplayName("Problems are loaded from files and directories")
    void testRunFromFile(@TempDir Path dir) throws IOException {
        Path problem = dir.resolve("pairs.yaml");
        Files.writeString(problem, String.join("\n",
            "capacities: [2, 2]",
            "relationships:",
            "  A: [B]",
            "  C: [D]",
            "candidates: [A, C, B, D]"));

        PartitionResult result = runner.run(problem);

        assertEquals(2, result.getScore());
        assertEquals(1, runner.listProblems(dir).size());
        assertTrue(output().contains("Problem: pairs"));
    }

    @Test
    @DisplayName("Problems built in code may leave description and candidates unset")
    void testRunInlineProblem() {
        ProblemConfig problem = new ProblemConfig();
        problem.name = "inline";
        problem.capacities = List.of(2, 2);
        problem.relationships = Map.of("A", List.of("B"));

        PartitionResult empty = runner.run(problem);

        assertEquals(0, empty.getScore());
        assertEquals(0, empty.getAssignedCount());
        assertTrue(output().contains("Requested: 0 []"));
        assertFalse(output().contains("Description:"));

        problem.candidates = List.of("a", "b");
        assertEquals(1, runner.run(problem).getScore());
    }
}
