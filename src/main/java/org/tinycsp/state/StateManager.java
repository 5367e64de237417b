/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

/**
 * The StateManager exposes
 * all the mechanisms and data-structures
 * needed to implement a depth-first-search
 * with reversible states.
 */
public interface StateManager {

    /**
     * Stores the current state
     * such that it can be recovered using restoreState()
     * Increase the level by 1
     */
    void saveState();

    /**
     * Restores state as it was at getLevel()-1
     * Decrease the level by 1
     */
    void restoreState();

    /**
     * Restores the state up the the given level.
     *
     * @param level the level, a non negative number between 0 and {@link #getLevel()}
     */
    void restoreStateUntil(int level);

    /**
     * Returns the current level.
     * It is increased at each {@link #saveState()}
     * and decreased at each {@link #restoreState()}.
     * It is initially equal to -1.
     * @return the level
     */
    int getLevel();

    /**
     * Records an entry that must be restored
     * when the current level is undone.
     *
     * @param entry the undo action
     */
    void pushState(StateEntry entry);

    /**
     * Creates a Stateful integer (restorable)
     *
     * @param initValue the initial value
     * @return a reference to the integer.
     */
    StateInt makeStateInt(int initValue);

    /**
     * Executes a body within a new level and restores it afterwards.
     *
     * @param body the code to execute
     */
    default void withNewState(Runnable body) {
        final int level = getLevel();
        saveState();
        try {
            body.run();
        } finally {
            restoreStateUntil(level);
        }
    }
}
