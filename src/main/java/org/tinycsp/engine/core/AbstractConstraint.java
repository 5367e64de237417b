/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.util.exception.InconsistencyException;

import java.util.List;

/**
 * Abstract class the most of the constraints
 * should extend.
 * Subclasses implement {@link #filter()}, which may throw
 * {@link InconsistencyException} through the variables it modifies.
 */
public abstract class AbstractConstraint implements Constraint {

    private final Solver cp;
    private final List<IntVar> scope;

    public AbstractConstraint(Solver cp, IntVar... scope) {
        this.cp = cp;
        this.scope = List.of(scope);
    }

    public Solver getSolver() {
        return cp;
    }

    @Override
    public List<IntVar> scope() {
        return scope;
    }

    @Override
    public void post() {
        for (IntVar x : scope) {
            x.propagateOnDomainChange(this);
        }
    }

    @Override
    public final PropagationResult propagate() {
        try {
            return filter() ? PropagationResult.REDUCED : PropagationResult.UNCHANGED;
        } catch (InconsistencyException e) {
            return PropagationResult.CONTRADICTION;
        }
    }

    /**
     * Filtering of the constraint.
     *
     * @return true if a domain was reduced
     */
    protected abstract boolean filter();

    @Override
    public String toString() {
        return getClass().getSimpleName() + scope;
    }
}
