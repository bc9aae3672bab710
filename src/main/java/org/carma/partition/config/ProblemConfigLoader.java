package org.carma.partition.config;

import org.carma.partition.model.*;
import org.carma.partition.mechanism.*;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Loads partitioning problems from YAML files.
 *
 * A problem consists of:
 * - Group capacities
 * - The directed relationship table
 * - The candidate names to place
 * - Solver settings (optional)
 *
 * JSON files load too, since the YAML parser accepts JSON. The keys
 * {@code house_capacities} and {@code people_to_select} are read as aliases of
 * {@code capacities} and {@code candidates}.
 *
 * <pre>
 * name: small-triangles
 * capacities: [3, 3, 3]
 * relationships:
 *   A: [B, C]
 *   B: [C]
 * candidates: [A, B, C]
 * solver:
 *   seed: 7
 *   trials: 0            # auto
 *   strategies:
 *     mode: ROUND_ROBIN
 *     weights: {GREEDY_GAIN: 2, CLUSTER_SEED: 1}
 *   seedTemplate: [[A, B, C]]
 * </pre>
 */
public class ProblemConfigLoader {

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a problem.
     */
    public static class ProblemConfig {
        public String name;
        public String description;
        public List<Integer> capacities;
        public Map<String, List<String>> relationships;
        public List<String> candidates;
        public SolverConfig solver;

        @Override
        public String toString() {
            return String.format("ProblemConfig[name=%s, capacities=%s, candidates=%d]",
                name, capacities, candidates != null ? candidates.size() : 0);
        }
    }

    /**
     * Solver settings for the problem. Unset fields keep the optimizer defaults.
     */
    public static class SolverConfig {
        public Long seed;
        public Integer trials;
        public Double earlyStopFraction;
        public Integer earlyStopCap;
        public Integer maxRefinePasses;
        public Integer smallExcessThreshold;
        public Integer screeningTopK;
        public Integer screeningTrials;
        public Long maxScreenedCombinations;
        public String strategyMode;
        public Map<String, Integer> strategyWeights;
        public List<List<String>> seedTemplate;
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public ProblemConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a problem from a YAML or JSON file.
     */
    public ProblemConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Problem file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            return parse(is, file.toString());
        }
    }

    /**
     * Load a problem bundled on the classpath, e.g. {@code "problems/sample-4.yaml"}.
     */
    public ProblemConfig loadResource(String resource) throws IOException {
        InputStream is = ProblemConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Problem resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        }
    }

    private ProblemConfig parse(InputStream is, String source) {
        Object raw;
        try {
            raw = yaml.load(new InputStreamReader(is, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new ProblemConfigException("Malformed problem file " + source + ": " + e.getMessage(), e);
        }
        if (!(raw instanceof Map)) {
            throw new ProblemConfigException("Problem file " + source + " must contain a mapping");
        }
        return parseProblemConfig(asStringMap(raw, "root"), source);
    }

    /**
     * Parse raw YAML into ProblemConfig.
     */
    ProblemConfig parseProblemConfig(Map<String, Object> raw, String source) {
        ProblemConfig config = new ProblemConfig();
        config.name = getString(raw, "name", defaultName(source));
        config.description = getString(raw, "description", "");

        Object capacities = raw.containsKey("capacities") ? raw.get("capacities") : raw.get("house_capacities");
        if (capacities == null) {
            throw new ProblemConfigException("Missing 'capacities' in " + source);
        }
        config.capacities = new ArrayList<>();
        for (Object value : asList(capacities, "capacities")) {
            if (!(value instanceof Number)) {
                throw new ProblemConfigException("Capacity '" + value + "' is not a number in " + source);
            }
            config.capacities.add(wholeNumber((Number) value, "capacities").intValue());
        }

        // Parse relationships, keeping declaration order
        config.relationships = new LinkedHashMap<>();
        Object relationships = raw.get("relationships");
        if (relationships != null) {
            for (Map.Entry<String, Object> entry : asStringMap(relationships, "relationships").entrySet()) {
                config.relationships.put(entry.getKey(), asNames(entry.getValue(), entry.getKey()));
            }
        }

        Object candidates = raw.containsKey("candidates") ? raw.get("candidates") : raw.get("people_to_select");
        config.candidates = candidates != null ? asNames(candidates, "candidates") : new ArrayList<>();

        Object solver = raw.get("solver");
        if (solver != null) {
            config.solver = parseSolverConfig(asStringMap(solver, "solver"));
        }
        return config;
    }

    private SolverConfig parseSolverConfig(Map<String, Object> raw) {
        SolverConfig solver = new SolverConfig();
        solver.seed = getLong(raw, "seed");
        solver.trials = getInteger(raw, "trials");
        solver.earlyStopFraction = getDouble(raw, "earlyStopFraction");
        solver.earlyStopCap = getInteger(raw, "earlyStopCap");
        solver.maxRefinePasses = getInteger(raw, "maxRefinePasses");
        solver.smallExcessThreshold = getInteger(raw, "smallExcessThreshold");
        solver.screeningTopK = getInteger(raw, "screeningTopK");
        solver.screeningTrials = getInteger(raw, "screeningTrials");
        solver.maxScreenedCombinations = getLong(raw, "maxScreenedCombinations");

        Object strategies = raw.get("strategies");
        if (strategies != null) {
            Map<String, Object> strategyMap = asStringMap(strategies, "strategies");
            solver.strategyMode = getString(strategyMap, "mode", null);
            Object weights = strategyMap.get("weights");
            if (weights != null) {
                solver.strategyWeights = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : asStringMap(weights, "weights").entrySet()) {
                    if (!(entry.getValue() instanceof Number)) {
                        throw new ProblemConfigException("Weight of " + entry.getKey() + " is not a number");
                    }
                    solver.strategyWeights.put(entry.getKey(),
                        wholeNumber((Number) entry.getValue(), "weights." + entry.getKey()).intValue());
                }
            }
        }

        Object template = raw.get("seedTemplate");
        if (template != null) {
            solver.seedTemplate = new ArrayList<>();
            for (Object group : asList(template, "seedTemplate")) {
                solver.seedTemplate.add(asNames(group, "seedTemplate"));
            }
        }
        return solver;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * @throws DegenerateCapacitiesException for empty or non-positive capacities
     */
    public Capacities buildCapacities(ProblemConfig config) {
        return Capacities.of(config.capacities);
    }

    public RelationshipGraph buildGraph(ProblemConfig config) {
        return RelationshipGraph.build(config.relationships);
    }

    /**
     * Build optimizer settings, starting from {@code base} for unset fields.
     */
    public OptimizerSettings buildSettings(ProblemConfig config, OptimizerSettings base) {
        OptimizerSettings.Builder builder = base.toBuilder();
        SolverConfig solver = config.solver;
        if (solver == null) {
            return builder.build();
        }

        if (solver.seed != null) builder.seed(solver.seed);
        if (solver.trials != null) builder.trials(solver.trials);
        if (solver.earlyStopFraction != null) builder.earlyStopFraction(solver.earlyStopFraction);
        if (solver.earlyStopCap != null) builder.earlyStopCap(solver.earlyStopCap);
        if (solver.maxRefinePasses != null) builder.maxRefinePasses(solver.maxRefinePasses);
        if (solver.smallExcessThreshold != null) builder.smallExcessThreshold(solver.smallExcessThreshold);
        if (solver.screeningTopK != null) builder.screeningTopK(solver.screeningTopK);
        if (solver.screeningTrials != null) builder.screeningTrials(solver.screeningTrials);
        if (solver.maxScreenedCombinations != null) builder.maxScreenedCombinations(solver.maxScreenedCombinations);
        if (solver.seedTemplate != null) builder.seedTemplate(solver.seedTemplate);

        if (solver.strategyMode != null || solver.strategyWeights != null) {
            builder.strategyPolicy(buildStrategyPolicy(solver));
        }
        return builder.build();
    }

    public OptimizerSettings buildSettings(ProblemConfig config) {
        return buildSettings(config, OptimizerSettings.DEFAULT);
    }

    private StrategyPolicy buildStrategyPolicy(SolverConfig solver) {
        StrategyPolicy.Builder builder = new StrategyPolicy.Builder();
        if (solver.strategyMode != null) {
            builder.mode(parseEnum(StrategyPolicy.Mode.class, solver.strategyMode, "strategy mode"));
        }
        if (solver.strategyWeights == null) {
            for (Map.Entry<ConstructionStrategy, Integer> entry : StrategyPolicy.DEFAULT.getWeights().entrySet()) {
                builder.weight(entry.getKey(), entry.getValue());
            }
        } else {
            for (Map.Entry<String, Integer> entry : solver.strategyWeights.entrySet()) {
                builder.weight(parseEnum(ConstructionStrategy.class, entry.getKey(), "strategy"), entry.getValue());
            }
        }
        return builder.build();
    }

    /**
     * Build a ready-to-use optimizer for the problem.
     */
    public PartitionOptimizer buildOptimizer(ProblemConfig config) {
        return new PartitionOptimizer(buildGraph(config), buildCapacities(config), buildSettings(config));
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List problem files (.yaml, .yml, .json) in a directory, sorted by name.
     */
    public List<Path> listProblems(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<Path> problems = new ArrayList<>();
        try (var stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> {
                      String file = p.getFileName().toString();
                      return file.endsWith(".yaml") || file.endsWith(".yml") || file.endsWith(".json");
                  })
                  .sorted()
                  .forEach(problems::add);
        }
        return problems;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static String defaultName(String source) {
        String file = source.replace('\\', '/');
        int slash = file.lastIndexOf('/');
        file = slash >= 0 ? file.substring(slash + 1) : file;
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProblemConfigException("Unknown " + what + ": " + value, e);
        }
    }

    private static Map<String, Object> asStringMap(Object value, String field) {
        if (!(value instanceof Map)) {
            throw new ProblemConfigException("'" + field + "' must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            map.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return map;
    }

    private static List<?> asList(Object value, String field) {
        if (!(value instanceof List)) {
            throw new ProblemConfigException("'" + field + "' must be a list");
        }
        return (List<?>) value;
    }

    private static List<String> asNames(Object value, String field) {
        List<String> names = new ArrayList<>();
        if (value == null) {
            return names;
        }
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    names.add(item.toString());
                }
            }
            return names;
        }
        if (value instanceof String) {
            names.add((String) value);
            return names;
        }
        throw new ProblemConfigException("'" + field + "' must be a name or a list of names");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static Integer getInteger(Map<String, Object> map, String key) {
        Number number = getNumber(map, key);
        return number != null ? wholeNumber(number, key).intValue() : null;
    }

    private static Long getLong(Map<String, Object> map, String key) {
        Number number = getNumber(map, key);
        return number != null ? wholeNumber(number, key).longValue() : null;
    }

    private static Double getDouble(Map<String, Object> map, String key) {
        Number number = getNumber(map, key);
        return number != null ? number.doubleValue() : null;
    }

    private static Number getNumber(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new ProblemConfigException("'" + key + "' must be a number, was '" + value + "'");
        }
        return (Number) value;
    }

    /**
     * Counts and seeds must be written as integers; 2.7 is not read as 2.
     */
    private static Number wholeNumber(Number number, String field) {
        if (!(number instanceof Integer || number instanceof Long)) {
            throw new ProblemConfigException("'" + field + "' must be a whole number, was '" + number + "'");
        }
        return number;
    }
}
