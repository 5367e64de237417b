/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

/**
 * Object that wraps an integer value
 * that can be saved and restored through
 * the {@link StateManager#saveState()} / {@link StateManager#restoreState()}
 * methods.
 */
public interface StateInt {

    /**
     * Set the value
     * @param v the value to set
     * @return the new value that was set
     */
    int setValue(int v);

    /**
     * Retrieves the current value
     * @return the current value
     */
    int value();

    /**
     * Increments the value
     * @return the new value
     */
    default int increment() {
        return setValue(value() + 1);
    }

    /**
     * Decrements the value
     * @return the new value
     */
    default int decrement() {
        return setValue(value() - 1);
    }
}
