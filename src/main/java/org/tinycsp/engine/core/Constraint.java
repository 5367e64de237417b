/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.search.Solution;

import java.util.List;

/**
 * Interface implemented by every constraint.
 * A constraint holds no search state of its own
 * except reversible bookkeeping restored with the domains.
 *
 * @see AbstractConstraint
 */
public interface Constraint {

    /**
     * Subscribes the constraint to the domain changes of its variables.
     * Called once by {@link Solver#post(Constraint)}.
     */
    void post();

    /**
     * Removes the values that are inconsistent with the fixed variables of the scope.
     *
     * @return {@link PropagationResult#CONTRADICTION} if a domain would become empty,
     *         {@link PropagationResult#REDUCED} if some value was removed,
     *         {@link PropagationResult#UNCHANGED} otherwise
     */
    PropagationResult propagate();

    /**
     * @return true if no subset of fixed variables of the scope violates the constraint
     */
    boolean isConsistent();

    /**
     * Evaluates the constraint on a complete assignment.
     *
     * @param solution a complete assignment of the solver variables
     * @return true if the assignment satisfies the constraint
     */
    boolean isSatisfiedBy(Solution solution);

    /**
     * @return the variables (or views) the constraint is stated on
     */
    List<IntVar> scope();
}
