/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * StateManager that will lazily store
 * the state of state object
 * at each {@link #saveState()} call.
 * Only the one that effectively change are stored
 * and at most once between any two call to {@link #saveState()}.
 * This can be seen as an optimized version of a copy-based state manager.
 */
public class Trailer implements StateManager {

    private final Deque<StateEntry> trail;
    private final Deque<Integer> limits;

    /**
     * Magic is used to detect whether a state object
     * was already trailed at the current level.
     */
    private long magic = 0L;

    public Trailer() {
        trail = new ArrayDeque<>();
        limits = new ArrayDeque<>();
    }

    public long getMagic() {
        return magic;
    }

    @Override
    public void pushState(StateEntry entry) {
        trail.push(entry);
    }

    @Override
    public int getLevel() {
        return limits.size() - 1;
    }

    /**
     * Number of undo records currently on the trail.
     *
     * @return the trail size
     */
    public int trailSize() {
        return trail.size();
    }

    private void restore() {
        int n = trail.size() - limits.pop();
        for (int i = 0; i < n; i++) {
            trail.pop().restore();
        }
    }

    @Override
    public void saveState() {
        limits.push(trail.size());
        magic++;
    }

    @Override
    public void restoreState() {
        if (limits.isEmpty()) {
            throw new IllegalStateException("no saved state to restore");
        }
        restore();
        magic++;
    }

    @Override
    public void restoreStateUntil(int level) {
        while (getLevel() > level) {
            restoreState();
        }
    }

    @Override
    public StateInt makeStateInt(int initValue) {
        return new TrailInt(this, initValue);
    }
}
