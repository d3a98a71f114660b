package org.javai.deltashare.boundary;

import org.javai.deltashare.ClassifiedOutcome;

/**
 * Classifies failure signals into the closed outcome taxonomy.
 * Implementations must be total and deterministic.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param signal The exception that occurred
     * @return the classification; never null
     */
    ClassifiedOutcome classify(String operation, Throwable signal);
}
