package org.carma.partition.model;

import java.util.*;

/**
 * Ordered, positive group capacities. One entry per group.
 */
public final class Capacities {

    private final int[] sizes;
    private final int total;

    private Capacities(int[] sizes) {
        this.sizes = sizes;
        this.total = Arrays.stream(sizes).sum();
    }

    /**
     * @throws DegenerateCapacitiesException if no capacity is given or any is not positive
     */
    public static Capacities of(int... sizes) {
        if (sizes == null || sizes.length == 0) {
            throw new DegenerateCapacitiesException("At least one group capacity is required");
        }
        for (int i = 0; i < sizes.length; i++) {
            if (sizes[i] <= 0) {
                throw new DegenerateCapacitiesException(
                    "Capacity of group " + i + " must be positive, was " + sizes[i]);
            }
        }
        return new Capacities(sizes.clone());
    }

    public static Capacities of(List<Integer> sizes) {
        if (sizes == null) {
            throw new DegenerateCapacitiesException("At least one group capacity is required");
        }
        int[] array = new int[sizes.size()];
        for (int i = 0; i < array.length; i++) {
            Integer size = sizes.get(i);
            if (size == null) {
                throw new DegenerateCapacitiesException("Capacity of group " + i + " is missing");
            }
            array[i] = size;
        }
        return of(array);
    }

    public int groupCount() {
        return sizes.length;
    }

    public int get(int group) {
        return sizes[group];
    }

    public int total() {
        return total;
    }

    public List<Integer> asList() {
        List<Integer> list = new ArrayList<>(sizes.length);
        for (int size : sizes) {
            list.add(size);
        }
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(sizes, ((Capacities) o).sizes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sizes);
    }

    @Override
    public String toString() {
        return "Capacities" + Arrays.toString(sizes);
    }
}
