package org.carma.partition.command;

import org.carma.partition.model.*;

import java.util.*;

/**
 * Renders partition results as text blocks.
 *
 * Compact form, one line per group plus the total:
 * <pre>
 * Imperial, Jingke, Jianli
 * (empty)
 * Total connections = 2
 * </pre>
 */
public class AssignmentFormatter {

    public static final String EMPTY_MARKER = "(empty)";

    private final RelationshipGraph graph;

    /**
     * @param graph Used by the detailed form to count per-group connections; may be null
     */
    public AssignmentFormatter(RelationshipGraph graph) {
        this.graph = graph;
    }

    public String formatCompact(PartitionResult result) {
        List<String> lines = new ArrayList<>();
        for (List<String> group : result.getGroups()) {
            lines.add(group.isEmpty() ? EMPTY_MARKER : String.join(", ", group));
        }
        lines.add("Total connections = " + result.getScore());
        return String.join("\n", lines);
    }

    public String formatDetailed(PartitionResult result) {
        StringBuilder sb = new StringBuilder();
        Capacities capacities = result.getCapacities();
        sb.append("Total connections: ").append(result.getScore()).append("\n");
        for (int i = 0; i < result.getGroups().size(); i++) {
            List<String> group = result.getGroup(i);
            sb.append("Group ").append(i + 1)
              .append(" (").append(group.size()).append("/").append(capacities.get(i)).append(")");
            if (graph != null) {
                sb.append(" - ").append(graph.connectionsWithin(group)).append(" connections");
            }
            sb.append(":\n");
            sb.append("  ").append(group.isEmpty() ? EMPTY_MARKER : String.join(", ", group)).append("\n");
        }
        if (result.hasUnrecognized()) {
            sb.append("Unrecognized: ").append(String.join(", ", result.getUnrecognized())).append("\n");
        }
        if (!result.getDropped().isEmpty()) {
            sb.append("Dropped (over capacity): ").append(String.join(", ", result.getDropped())).append("\n");
        }
        return sb.toString();
    }

    /**
     * One line listing names that were not recognized, or an empty string.
     */
    public String formatUnrecognized(List<String> unrecognized) {
        if (unrecognized.isEmpty()) {
            return "";
        }
        return "Unrecognized names: " + String.join(", ", unrecognized);
    }
}
