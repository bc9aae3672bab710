package org.carma.partition.model;

import java.util.*;

/**
 * Result of a partitioning solve.
 *
 * Contains:
 * - The best assignment found, one name list per group
 * - Its score (connections kept inside groups)
 * - Names that did not match the registry
 * - Names dropped because the request exceeded total capacity
 * - Search metadata (trials run, early stop, time)
 */
public class PartitionResult {

    private final Capacities capacities;
    private final List<List<String>> groups;
    private final int score;
    private List<String> unrecognized;
    private List<String> dropped;
    private int trialsRun;
    private boolean stoppedEarly;
    private long computationTimeMs;

    public PartitionResult(Capacities capacities, List<List<String>> groups, int score) {
        if (groups.size() != capacities.groupCount()) {
            throw new IllegalArgumentException(
                "Expected " + capacities.groupCount() + " groups, got " + groups.size());
        }
        this.capacities = capacities;
        List<List<String>> copy = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            copy.add(List.copyOf(group));
        }
        this.groups = Collections.unmodifiableList(copy);
        this.score = score;
        this.unrecognized = List.of();
        this.dropped = List.of();
    }

    /**
     * All groups empty, score 0.
     */
    public static PartitionResult empty(Capacities capacities) {
        List<List<String>> groups = new ArrayList<>();
        for (int i = 0; i < capacities.groupCount(); i++) {
            groups.add(List.of());
        }
        return new PartitionResult(capacities, groups, 0);
    }

    // ========================================================================
    // Builder-style setters
    // ========================================================================

    public PartitionResult setUnrecognized(List<String> unrecognized) {
        this.unrecognized = List.copyOf(unrecognized);
        return this;
    }

    public PartitionResult setDropped(List<String> dropped) {
        this.dropped = List.copyOf(dropped);
        return this;
    }

    public PartitionResult setTrialsRun(int trialsRun) {
        this.trialsRun = trialsRun;
        return this;
    }

    public PartitionResult setStoppedEarly(boolean stoppedEarly) {
        this.stoppedEarly = stoppedEarly;
        return this;
    }

    public PartitionResult setComputationTimeMs(long ms) {
        this.computationTimeMs = ms;
        return this;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Capacities getCapacities() {
        return capacities;
    }

    public List<List<String>> getGroups() {
        return groups;
    }

    public List<String> getGroup(int index) {
        return groups.get(index);
    }

    public int getScore() {
        return score;
    }

    public List<String> getUnrecognized() {
        return unrecognized;
    }

    public List<String> getDropped() {
        return dropped;
    }

    public int getTrialsRun() {
        return trialsRun;
    }

    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    public int getAssignedCount() {
        return groups.stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return getAssignedCount() == 0;
    }

    public boolean hasUnrecognized() {
        return !unrecognized.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PartitionResult[").append(capacities).append("]:\n");
        sb.append("  Score: ").append(score).append("\n");
        sb.append("  Assigned: ").append(getAssignedCount()).append("/").append(capacities.total()).append("\n");
        for (int i = 0; i < groups.size(); i++) {
            sb.append("  Group ").append(i + 1).append(": ").append(groups.get(i)).append("\n");
        }
        if (!unrecognized.isEmpty()) {
            sb.append("  Unrecognized: ").append(unrecognized).append("\n");
        }
        if (!dropped.isEmpty()) {
            sb.append("  Dropped: ").append(dropped).append("\n");
        }
        return sb.toString();
    }
}
