package org.carma.partition.command;

import org.carma.partition.model.PartitionResult;

import java.util.*;

/**
 * Explicit outcome of a partition command, ready to show to the requester.
 */
public class CommandOutcome {

    public enum Status {
        /** A partition was computed. */
        OK,
        /** None of the requested names matched the registry. */
        NO_MATCHES,
        /** Something unexpected failed; the cause was logged. */
        INTERNAL_FAILURE
    }

    private final Status status;
    private final String message;
    private final PartitionResult result;
    private final List<String> unrecognized;

    private CommandOutcome(Status status, String message, PartitionResult result, List<String> unrecognized) {
        this.status = status;
        this.message = message;
        this.result = result;
        this.unrecognized = List.copyOf(unrecognized);
    }

    public static CommandOutcome ok(PartitionResult result, String message) {
        return new CommandOutcome(Status.OK, message, result, result.getUnrecognized());
    }

    public static CommandOutcome noMatches(List<String> unrecognized, String message) {
        return new CommandOutcome(Status.NO_MATCHES, message, null, unrecognized);
    }

    public static CommandOutcome internalFailure(String message) {
        return new CommandOutcome(Status.INTERNAL_FAILURE, message, null, List.of());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The computed partition, present only for {@link Status#OK}.
     */
    public Optional<PartitionResult> getResult() {
        return Optional.ofNullable(result);
    }

    public List<String> getUnrecognized() {
        return unrecognized;
    }

    @Override
    public String toString() {
        return "CommandOutcome[" + status + "]";
    }
}
