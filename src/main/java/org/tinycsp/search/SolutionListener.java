/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

/**
 * Callback invoked once per solution, in discovery order.
 * It runs synchronously inside the search and must not modify the model
 * nor start another search on the same solver.
 */
@FunctionalInterface
public interface SolutionListener {

    /**
     * @param index    the position of the solution, starting at 0
     * @param solution the assignment
     * @throws Exception any failure aborts the enumeration
     */
    void onSolution(int index, Solution solution) throws Exception;
}
