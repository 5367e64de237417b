/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.util.exception;

/**
 * Exception that is raised when a domain becomes empty during propagation.
 * It is a normal search signal, always recovered by backtracking,
 * and never reaches the caller of a solve.
 */
public class InconsistencyException extends RuntimeException {

    private static final long serialVersionUID = 1546076465264566385L;

    public static final InconsistencyException INCONSISTENCY = new InconsistencyException();

    private InconsistencyException() {
        super("inconsistency", null, false, false);
    }

    @Override
    public String toString() {
        return "inconsistency";
    }
}
