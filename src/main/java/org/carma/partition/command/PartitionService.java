package org.carma.partition.command;

import org.carma.partition.mechanism.PartitionOptimizer;
import org.carma.partition.model.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Boundary between a command front end and the optimizer.
 *
 * Takes the raw name tokens of a request and always answers with a
 * {@link CommandOutcome}: a rendered partition, a "no matches" answer listing the
 * names that were not recognized, or a generic failure. Unexpected exceptions are
 * logged with their cause and never propagate to the enclosing service.
 */
public class PartitionService {

    private static final Logger log = LoggerFactory.getLogger(PartitionService.class);

    static final String FAILURE_MESSAGE = "Could not compute a partition. Please try again later.";

    private final PartitionOptimizer optimizer;
    private final AssignmentFormatter formatter;

    public PartitionService(PartitionOptimizer optimizer) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer");
        this.formatter = new AssignmentFormatter(optimizer.getGraph());
    }

    /**
     * Handle a comma-separated request such as {@code "Han Wu, weiqing, Qubing"}.
     */
    public CommandOutcome handle(String commaSeparated) {
        return handle(CandidateResolver.split(commaSeparated));
    }

    public CommandOutcome handle(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return CommandOutcome.noMatches(List.of(), "No names were given.");
        }

        try {
            PartitionResult result = optimizer.solve(tokens);

            if (result.isEmpty()) {
                String message = "None of the requested names are known.";
                if (result.hasUnrecognized()) {
                    message += "\n" + formatter.formatUnrecognized(result.getUnrecognized());
                }
                return CommandOutcome.noMatches(result.getUnrecognized(), message);
            }

            StringBuilder message = new StringBuilder(formatter.formatCompact(result));
            if (result.hasUnrecognized()) {
                message.append("\n").append(formatter.formatUnrecognized(result.getUnrecognized()));
            }
            return CommandOutcome.ok(result, message.toString());
        } catch (RuntimeException e) {
            log.error("partition.failed tokens={} error={}", tokens.size(), e.getMessage(), e);
            return CommandOutcome.internalFailure(FAILURE_MESSAGE);
        }
    }
}
