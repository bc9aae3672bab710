package org.carma.partition.mechanism;

/**
 * Procedures that build an initial, capacity-respecting assignment.
 *
 * @see AssignmentConstructor
 */
public enum ConstructionStrategy {
    /**
     * Shuffle, then pack group 0 until full, then group 1, and so on.
     * Pure ordering randomness.
     */
    FILL_FIRST,

    /**
     * Shuffle, then place each entity into the least-filled group that still has
     * room. Ties are broken uniformly at random.
     */
    BALANCED,

    /**
     * Seed group 0 with the best-connected entity, then grow each group in turn with
     * the entity that has the most edges into it. Deterministic except for the
     * fill-first fallback when the pool has no edges at all.
     */
    CLUSTER_SEED,

    /**
     * Shuffle, then place each entity into the group where it adds the most
     * connections; with no positive gain anywhere, into the group with most room.
     */
    GREEDY_GAIN
}
