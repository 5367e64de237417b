/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.util.exception;

import org.tinycsp.search.SearchStatistics;

/**
 * Thrown when a solution listener fails.
 * The enumeration is aborted and the statistics gathered up to the failure
 * are attached, marked as not completed.
 */
public class SolutionCallbackException extends RuntimeException {

    private static final long serialVersionUID = -2950436197154786402L;

    private final transient SearchStatistics partialStatistics;

    public SolutionCallbackException(int solutionIndex, SearchStatistics partialStatistics, Throwable cause) {
        super("solution listener failed on solution " + solutionIndex, cause);
        this.partialStatistics = partialStatistics;
    }

    /**
     * @return the statistics of the aborted run, {@code isCompleted()} is always false
     */
    public SearchStatistics getPartialStatistics() {
        return partialStatistics;
    }
}
