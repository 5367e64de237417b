/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

/**
 * A reversible operation recorded on the trail.
 */
@FunctionalInterface
public interface StateEntry {
    void restore();
}
