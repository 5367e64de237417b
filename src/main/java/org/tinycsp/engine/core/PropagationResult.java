/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

/**
 * Outcome of a propagation step.
 */
public enum PropagationResult {
    /** no domain was modified */
    UNCHANGED,
    /** at least one value was removed from a domain */
    REDUCED,
    /** a domain would have become empty, the current branch must be abandoned */
    CONTRADICTION;

    /**
     * Combines two outcomes, a contradiction dominates a reduction which dominates no change.
     *
     * @param other the other outcome
     * @return the strongest of both outcomes
     */
    public PropagationResult and(PropagationResult other) {
        return this.ordinal() >= other.ordinal() ? this : other;
    }
}
