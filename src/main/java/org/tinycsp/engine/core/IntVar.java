/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.util.exception.InconsistencyException;
import org.tinycsp.util.exception.ValueOutOfDomainException;

/**
 * Interface of an integer variable, or of an affine view {@code x + c} over one.
 * The domain is a finite set of integers that shrinks during search
 * and is restored on backtrack.
 */
public interface IntVar {

    /**
     * Returns the solver in which this variable was created.
     *
     * @return the solver in which this variable was created
     */
    Solver getSolver();

    /**
     * Returns the index of the underlying variable in its solver,
     * in declaration order starting at 0.
     *
     * @return the index of the underlying variable
     */
    int getId();

    /**
     * Returns the constant added to the underlying variable,
     * 0 for a plain variable.
     *
     * @return the additive offset of this expression
     */
    int offset();

    String getName();

    /**
     * Ask that {@link Constraint#propagate()} is called
     * each time the domain of this variable changes.
     *
     * @param c the constraint to notify
     */
    void propagateOnDomainChange(Constraint c);

    /**
     * Returns the minimum of the domain of the variable
     *
     * @return the minimum of the domain of the variable
     */
    int min();

    /**
     * Returns the maximum of the domain of the variable
     *
     * @return the maximum of the domain of the variable
     */
    int max();

    /**
     * Returns the size of the domain of the variable
     *
     * @return the size of the domain of the variable
     */
    int size();

    /**
     * Returns true if the domain of the variable has a single value.
     *
     * @return true if the domain of the variable is a singleton.
     */
    boolean isFixed();

    /**
     * Returns true if the domain contains the specified value.
     *
     * @param v the value whose membership is tested
     * @return true if the domain contains the specified value
     */
    boolean contains(int v);

    /**
     * Returns the smallest value of the domain strictly larger than v,
     * or {@link Integer#MAX_VALUE} if there is none.
     * As {@code Integer.MAX_VALUE} may itself be in the domain,
     * iterate while {@code v < max()} rather than testing the result.
     *
     * @param v a value, not necessarily in the domain
     * @return the successor of v in the domain
     */
    int after(int v);

    /**
     * Copies the values of the domain into an array, in ascending order.
     *
     * @param dest an array large enough {@code dest.length >= size()}
     * @return the size of the domain and {@code dest[0,...,size-1]} contains
     *         the values in the domain
     */
    int fillArray(int[] dest);

    /**
     * Removes the specified value.
     *
     * @param v the value to remove
     * @return true if the domain changed
     * @exception InconsistencyException
     *            is thrown if the domain would become empty
     */
    boolean remove(int v);

    /**
     * Assigns the specified value.
     *
     * @param v the value to assign.
     * @return true if the domain changed
     * @exception ValueOutOfDomainException
     *            is thrown if v is not in the domain
     */
    boolean fix(int v);
}
