/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.search.Solution;

/**
 * Not Equal constraint between two variables
 */
public class NotEqual extends AbstractConstraint {
    private final IntVar x, y;

    /**
     * Creates a constraint such
     * that {@code x != y}
     *
     * @param x the left member
     * @param y the right memer
     * @see org.tinycsp.cp.CPFactory#neq(IntVar, IntVar)
     */
    public NotEqual(IntVar x, IntVar y) {
        super(x.getSolver(), x, y);
        this.x = x;
        this.y = y;
    }

    @Override
    protected boolean filter() {
        if (y.isFixed()) {
            return x.remove(y.min());
        } else if (x.isFixed()) {
            return y.remove(x.min());
        }
        return false;
    }

    @Override
    public boolean isConsistent() {
        return !(x.isFixed() && y.isFixed() && x.min() == y.min());
    }

    @Override
    public boolean isSatisfiedBy(Solution solution) {
        return solution.valueOf(x) != solution.valueOf(y);
    }
}
