package org.carma.partition.runner;

import org.carma.partition.command.AssignmentFormatter;
import org.carma.partition.config.ProblemConfigLoader;
import org.carma.partition.config.ProblemConfigLoader.ProblemConfig;
import org.carma.partition.mechanism.*;
import org.carma.partition.model.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Solves problems loaded from configuration files and reports the results.
 *
 * Key features:
 * - Loads capacities, relationships, candidates and solver settings from YAML/JSON
 * - Reports the candidate pool with each entity's connections inside it
 * - Runs the optimizer and prints a per-group breakdown
 *
 * Usage:
 * <pre>
 * java org.carma.partition.runner.PartitionRunner problems/my-problem.yaml
 * java org.carma.partition.runner.PartitionRunner          # bundled samples
 * </pre>
 */
public class PartitionRunner {

    /** Problems bundled on the classpath. */
    public static final List<String> BUNDLED_PROBLEMS = List.of(
        "problems/sample-1.yaml",
        "problems/sample-2.yaml",
        "problems/sample-3.yaml",
        "problems/sample-4.yaml",
        "problems/characters.yaml"
    );

    private final ProblemConfigLoader loader;
    private final PrintStream out;

    private boolean verbose = true;

    public PartitionRunner() {
        this(new ProblemConfigLoader(), System.out);
    }

    public PartitionRunner(ProblemConfigLoader loader, PrintStream out) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.out = Objects.requireNonNull(out, "out");
    }

    public PartitionRunner verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    public PartitionResult run(Path problemFile) throws IOException {
        log("Loading problem from: " + problemFile);
        return run(loader.load(problemFile));
    }

    public PartitionResult runResource(String resource) throws IOException {
        log("Loading bundled problem: " + resource);
        return run(loader.loadResource(resource));
    }

    /**
     * Solve a loaded problem and print the report.
     */
    public PartitionResult run(ProblemConfig problem) {
        // 1. Build graph, capacities and settings
        Capacities capacities = loader.buildCapacities(problem);
        RelationshipGraph graph = loader.buildGraph(problem);
        OptimizerSettings settings = loader.buildSettings(problem);
        List<String> candidates = problem.candidates != null ? problem.candidates : List.of();

        log("Problem: " + problem.name);
        if (problem.description != null && !problem.description.isEmpty()) {
            log("Description: " + problem.description);
        }
        log("Capacities: " + capacities.asList() + " (total " + capacities.total() + ")");
        log("Graph: " + graph.entityCount() + " entities, " + graph.edgeCount() + " connections");
        log("Requested: " + candidates.size() + " " + candidates);
        if (candidates.size() > capacities.total()) {
            log("Requested more than total capacity (" + candidates.size() + " > "
                + capacities.total() + "); lowest-priority entities will be dropped");
        }
        log("Settings: " + settings);
        log("");

        // 2. Candidate pool
        CandidateResolver.Resolution resolution = new CandidateResolver(graph).resolve(candidates);
        log("Candidate pool:");
        for (String name : resolution.getResolved()) {
            List<String> linked = new ArrayList<>();
            for (String other : resolution.getResolved()) {
                if (graph.areConnected(name, other)) {
                    linked.add(other);
                }
            }
            log("  " + name + ": " + linked.size() + " connection(s) " + linked);
        }
        log("");

        // 3. Solve
        PartitionOptimizer optimizer = new PartitionOptimizer(graph, capacities, settings);
        PartitionResult result = optimizer.solve(candidates);

        // 4. Report
        AssignmentFormatter formatter = new AssignmentFormatter(graph);
        log("=== RESULT ===");
        log(formatter.formatDetailed(result));
        log("Trials: " + result.getTrialsRun() + (result.isStoppedEarly() ? " (stopped early)" : "")
            + ", time: " + result.getComputationTimeMs() + " ms");
        log("");
        log("=== COMPACT ===");
        log(formatter.formatCompact(result));
        log("");
        return result;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void log(String message) {
        if (verbose) {
            out.println(message);
        }
    }

    public List<Path> listProblems(Path directory) throws IOException {
        return loader.listProblems(directory);
    }

    public static void main(String[] args) throws IOException {
        PartitionRunner runner = new PartitionRunner();
        if (args.length == 0) {
            for (String resource : BUNDLED_PROBLEMS) {
                runner.runResource(resource);
            }
            return;
        }
        for (String arg : args) {
            Path path = Paths.get(arg);
            if (Files.isDirectory(path)) {
                for (Path problem : runner.listProblems(path)) {
                    runner.run(problem);
                }
            } else {
                runner.run(path);
            }
        }
    }
}
