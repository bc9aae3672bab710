package org.carma.partition.model;

/**
 * Raised when the group capacities cannot describe a partition: none supplied,
 * or a capacity that is zero or negative.
 */
public class DegenerateCapacitiesException extends IllegalArgumentException {

    public DegenerateCapacitiesException(String message) {
        super(message);
    }
}
