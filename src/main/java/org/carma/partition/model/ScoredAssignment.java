package org.carma.partition.model;

/**
 * Snapshot of an assignment together with the score it had when taken.
 * The held assignment is a private copy and is never mutated.
 */
public final class ScoredAssignment {

    private final Assignment assignment;
    private final int score;

    public ScoredAssignment(Assignment assignment, int score) {
        this.assignment = assignment.copy();
        this.score = score;
    }

    /**
     * Fresh copy of the snapshot, free to mutate.
     */
    public Assignment getAssignment() {
        return assignment.copy();
    }

    public int getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("ScoredAssignment[score=%d, %s]", score, assignment.toLists());
    }
}
