package org.carma.partition.config;

/**
 * A problem file is readable but its content is missing a field or has the
 * wrong shape.
 */
public class ProblemConfigException extends IllegalArgumentException {

    public ProblemConfigException(String message) {
        super(message);
    }

    public ProblemConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
