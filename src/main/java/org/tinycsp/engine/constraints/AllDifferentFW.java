/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.tinycsp.engine.core.AbstractConstraint;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.search.Solution;
import org.tinycsp.state.StateInt;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Forward Checking filtering AllDifferent Constraint
 *
 * Whenever one variable is fixed, this value
 * is removed from the domain of other variables.
 * Members may be offset views ({@code x+c}), in which case
 * the shifted value is compared.
 */
public class AllDifferentFW extends AbstractConstraint {

    private final IntVar[] x;
    // unfixed members are unBounds[0..nUnBounds-1]
    final int[] unBounds;
    final StateInt nUnBounds;

    public AllDifferentFW(IntVar... x) {
        super(x[0].getSolver(), x);
        this.x = x;
        int n = x.length;
        nUnBounds = getSolver().getStateManager().makeStateInt(n);
        unBounds = IntStream.range(0, n).toArray();
    }

    @Override
    protected boolean filter() {
        boolean changed = false;
        int nU = nUnBounds.value();
        for (int i = nU - 1; i >= 0; i--) {
            int idx = unBounds[i];
            IntVar y = x[idx];
            if (y.isFixed()) {
                // swap the fixed member out before filtering
                unBounds[i] = unBounds[nU - 1];
                unBounds[nU - 1] = idx;
                nU--;
                nUnBounds.setValue(nU);
                for (int k = 0; k < nU; k++) {
                    changed |= x[unBounds[k]].remove(y.min());
                }
            }
        }
        return changed;
    }

    @Override
    public boolean isConsistent() {
        Set<Integer> seen = new HashSet<>();
        for (IntVar y : x) {
            if (y.isFixed() && !seen.add(y.min())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isSatisfiedBy(Solution solution) {
        Set<Integer> seen = new HashSet<>();
        for (IntVar y : x) {
            if (!seen.add(solution.valueOf(y))) {
                return false;
            }
        }
        return true;
    }
}
