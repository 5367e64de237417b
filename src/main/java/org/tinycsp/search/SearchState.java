/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

/**
 * States of a {@link DFSearch}.
 */
public enum SearchState {
    /** assigning variables and backtracking */
    EXPLORING,
    /** every variable is fixed, the solution listeners are running */
    SOLUTION_FOUND,
    /** the search tree is closed, or the search was stopped */
    EXHAUSTED
}
