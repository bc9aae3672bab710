package org.carma.partition.model;

import java.util.*;

/**
 * Mutable partition of entities into capacity-bounded groups.
 *
 * Groups are insertion-ordered sets, and an index from entity to group keeps
 * membership, removal and relocation O(1). Every mutator enforces the invariants:
 * an entity is in at most one group and no group exceeds its capacity.
 *
 * Scores are never stored here; compute them with
 * {@link RelationshipGraph#score(Assignment)} after the last mutation.
 */
public class Assignment {

    private final Capacities capacities;
    private final List<LinkedHashSet<String>> groups;
    private final Map<String, Integer> groupOf;

    private Assignment(Capacities capacities) {
        this.capacities = capacities;
        this.groups = new ArrayList<>(capacities.groupCount());
        for (int i = 0; i < capacities.groupCount(); i++) {
            groups.add(new LinkedHashSet<>());
        }
        this.groupOf = new HashMap<>();
    }

    /**
     * An assignment with every group empty.
     */
    public static Assignment empty(Capacities capacities) {
        return new Assignment(Objects.requireNonNull(capacities, "capacities"));
    }

    /**
     * Deep copy; later mutations of either side are independent.
     */
    public Assignment copy() {
        Assignment copy = new Assignment(capacities);
        for (int i = 0; i < groups.size(); i++) {
            for (String name : groups.get(i)) {
                copy.groups.get(i).add(name);
                copy.groupOf.put(name, i);
            }
        }
        return copy;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Capacities getCapacities() {
        return capacities;
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Read-only view of one group, in insertion order.
     */
    public Set<String> group(int index) {
        return Collections.unmodifiableSet(groups.get(index));
    }

    public int size(int index) {
        return groups.get(index).size();
    }

    public int spare(int index) {
        return capacities.get(index) - groups.get(index).size();
    }

    public boolean hasSpace(int index) {
        return spare(index) > 0;
    }

    public int totalAssigned() {
        return groupOf.size();
    }

    public boolean isFull() {
        return totalAssigned() >= capacities.total();
    }

    public boolean contains(String name) {
        return groupOf.containsKey(name);
    }

    /**
     * Group index of an entity, or -1 when unassigned.
     */
    public int groupOf(String name) {
        Integer index = groupOf.get(name);
        return index != null ? index : -1;
    }

    // ========================================================================
    // Mutators
    // ========================================================================

    public void add(int index, String name) {
        if (groupOf.containsKey(name)) {
            throw new IllegalStateException(name + " is already in group " + groupOf.get(name));
        }
        if (!hasSpace(index)) {
            throw new IllegalStateException("Group " + index + " is full (" + capacities.get(index) + ")");
        }
        groups.get(index).add(name);
        groupOf.put(name, index);
    }

    /**
     * Relocate an assigned entity into another group with spare capacity.
     */
    public void move(String name, int target) {
        int source = requireGroup(name);
        if (source == target) {
            return;
        }
        if (!hasSpace(target)) {
            throw new IllegalStateException("Group " + target + " is full (" + capacities.get(target) + ")");
        }
        groups.get(source).remove(name);
        groups.get(target).add(name);
        groupOf.put(name, target);
    }

    /**
     * Exchange two entities that sit in different groups. Group sizes are unchanged.
     */
    public void swap(String a, String b) {
        int groupA = requireGroup(a);
        int groupB = requireGroup(b);
        if (groupA == groupB) {
            throw new IllegalStateException(a + " and " + b + " are both in group " + groupA);
        }
        groups.get(groupA).remove(a);
        groups.get(groupB).remove(b);
        groups.get(groupA).add(b);
        groups.get(groupB).add(a);
        groupOf.put(a, groupB);
        groupOf.put(b, groupA);
    }

    private int requireGroup(String name) {
        Integer index = groupOf.get(name);
        if (index == null) {
            throw new IllegalStateException(name + " is not assigned");
        }
        return index;
    }

    // ========================================================================
    // Conversion
    // ========================================================================

    /**
     * Groups as plain lists, one per capacity slot.
     */
    public List<List<String>> toLists() {
        List<List<String>> lists = new ArrayList<>(groups.size());
        for (Set<String> group : groups) {
            lists.add(new ArrayList<>(group));
        }
        return lists;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Assignment that = (Assignment) o;
        return capacities.equals(that.capacities) && toLists().equals(that.toLists());
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacities, toLists());
    }

    @Override
    public String toString() {
        return "Assignment" + toLists();
    }
}
