/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;

/**
 * Forward-checking propagation driven by a worklist of variables.
 * <p>
 * A variable enters the worklist each time its domain changes.
 * Dequeuing a variable runs {@link Constraint#propagate()} on every constraint
 * incident to it; the reductions made there enqueue further variables.
 * The loop stops at a fixed point or at the first contradiction.
 */
public class PropagationEngine {

    private final ArrayDeque<IntVarImpl> queue = new ArrayDeque<>();
    private boolean[] scheduled = new boolean[16];
    private long nPropagations = 0;

    void schedule(IntVarImpl x) {
        int id = x.getId();
        if (id >= scheduled.length) {
            scheduled = Arrays.copyOf(scheduled, Math.max(id + 1, scheduled.length * 2));
        }
        if (!scheduled[id]) {
            scheduled[id] = true;
            queue.add(x);
        }
    }

    /**
     * @return true if some variable is waiting to be propagated
     */
    public boolean hasPending() {
        return !queue.isEmpty();
    }

    /**
     * Drops the pending variables.
     */
    public void clear() {
        while (!queue.isEmpty()) {
            scheduled[queue.poll().getId()] = false;
        }
    }

    /**
     * @return the number of calls to {@link Constraint#propagate()} since creation
     */
    public long numberOfPropagations() {
        return nPropagations;
    }

    /**
     * Propagates every constraint once, then runs the worklist to its fixed point.
     *
     * @param constraints all the constraints of the model
     * @return the combined outcome
     */
    public PropagationResult propagateAll(List<Constraint> constraints) {
        PropagationResult result = PropagationResult.UNCHANGED;
        for (Constraint c : constraints) {
            nPropagations++;
            result = result.and(c.propagate());
            if (result == PropagationResult.CONTRADICTION) {
                clear();
                return result;
            }
        }
        return result.and(fixPoint());
    }

    /**
     * Runs the worklist until no scheduled variable remains.
     *
     * @return {@link PropagationResult#CONTRADICTION} as soon as one constraint fails,
     *         {@link PropagationResult#REDUCED} if some constraint removed a value,
     *         {@link PropagationResult#UNCHANGED} otherwise
     */
    public PropagationResult fixPoint() {
        PropagationResult result = PropagationResult.UNCHANGED;
        while (!queue.isEmpty()) {
            IntVarImpl x = queue.poll();
            scheduled[x.getId()] = false;
            for (Constraint c : x.constraints()) {
                nPropagations++;
                result = result.and(c.propagate());
                if (result == PropagationResult.CONTRADICTION) {
                    clear();
                    return result;
                }
            }
        }
        return result;
    }
}
