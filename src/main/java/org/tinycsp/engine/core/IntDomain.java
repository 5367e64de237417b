/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.state.StateInt;
import org.tinycsp.state.StateManager;

import java.util.Arrays;
import java.util.Set;
import java.util.StringJoiner;

import static org.tinycsp.util.exception.InconsistencyException.INCONSISTENCY;

/**
 * Reversible finite domain over a sorted sequence of integers.
 * Values are addressed by their position in the initial domain,
 * either an interval or an explicit set of values.
 * Every removal is recorded on the trail of the state manager
 * so that restoring a level brings back exactly the removed values.
 */
public class IntDomain {

    /**
     * Largest number of values a domain may hold.
     */
    public static final int MAX_SIZE = 1 << 24;

    private final StateManager sm;
    private final int ofs;
    // sorted values of an explicit set, null for an interval
    private final int[] values;
    private final boolean[] present;
    private final StateInt size;
    // positions of the current bounds
    private final StateInt minPos;
    private final StateInt maxPos;

    public IntDomain(StateManager sm, int lo, int hi) {
        assert (lo <= hi && (long) hi - lo < MAX_SIZE);
        this.sm = sm;
        this.ofs = lo;
        this.values = null;
        this.present = new boolean[hi - lo + 1];
        Arrays.fill(present, true);
        this.size = sm.makeStateInt(present.length);
        this.minPos = sm.makeStateInt(0);
        this.maxPos = sm.makeStateInt(present.length - 1);
    }

    public IntDomain(StateManager sm, Set<Integer> values) {
        assert (!values.isEmpty() && values.size() <= MAX_SIZE);
        this.sm = sm;
        this.values = values.stream().mapToInt(Integer::intValue).sorted().toArray();
        this.ofs = this.values[0];
        this.present = new boolean[this.values.length];
        Arrays.fill(present, true);
        this.size = sm.makeStateInt(present.length);
        this.minPos = sm.makeStateInt(0);
        this.maxPos = sm.makeStateInt(present.length - 1);
    }

    private int valueAt(int pos) {
        return values == null ? ofs + pos : values[pos];
    }

    /**
     * @return the position of v in the initial domain, -1 if it was never there
     */
    private int positionOf(int v) {
        if (values != null) {
            int pos = Arrays.binarySearch(values, v);
            return pos < 0 ? -1 : pos;
        }
        long pos = (long) v - ofs;
        return pos < 0 || pos >= present.length ? -1 : (int) pos;
    }

    /**
     * @return the first position whose value is greater than v
     */
    private int firstPositionAbove(int v) {
        if (values != null) {
            int pos = Arrays.binarySearch(values, v);
            return pos < 0 ? -pos - 1 : pos + 1;
        }
        long pos = (long) v - ofs + 1;
        return (int) Math.max(0, Math.min(pos, present.length));
    }

    public int min() {
        return valueAt(minPos.value());
    }

    public int max() {
        return valueAt(maxPos.value());
    }

    public int size() {
        return size.value();
    }

    public boolean isSingleton() {
        return size.value() == 1;
    }

    public boolean contains(int v) {
        int pos = positionOf(v);
        return pos >= minPos.value() && pos <= maxPos.value() && present[pos];
    }

    /**
     * @param v a value
     * @return the smallest value of the domain greater than v,
     * {@code Integer.MAX_VALUE} if {@code v >= max()}
     */
    public int after(int v) {
        int hi = maxPos.value();
        for (int p = Math.max(firstPositionAbove(v), minPos.value()); p <= hi; p++) {
            if (present[p]) {
                return valueAt(p);
            }
        }
        return Integer.MAX_VALUE;
    }

    private int nextPosition(int pos) {
        int p = pos + 1;
        while (!present[p]) {
            p++;
        }
        return p;
    }

    private int previousPosition(int pos) {
        int p = pos - 1;
        while (!present[p]) {
            p--;
        }
        return p;
    }

    public int fillArray(int[] dest) {
        int s = 0;
        for (int p = minPos.value(); p <= maxPos.value(); p++) {
            if (present[p]) {
                dest[s++] = valueAt(p);
            }
        }
        return s;
    }

    private void erase(int pos) {
        present[pos] = false;
        sm.pushState(() -> present[pos] = true);
    }

    /**
     * Removes a value from the domain.
     *
     * @param v the value to remove
     * @return true if the value was present
     */
    public boolean remove(int v) {
        if (!contains(v)) {
            return false;
        }
        if (size.value() == 1) {
            throw INCONSISTENCY;
        }
        int pos = positionOf(v);
        erase(pos);
        size.decrement();
        if (pos == minPos.value()) {
            minPos.setValue(nextPosition(pos));
        }
        if (pos == maxPos.value()) {
            maxPos.setValue(previousPosition(pos));
        }
        return true;
    }

    /**
     * Removes every value but v, which must be in the domain.
     *
     * @param v the value to keep
     * @return true if at least one value was removed
     */
    public boolean removeAllBut(int v) {
        assert (contains(v));
        if (size.value() == 1) {
            return false;
        }
        int pos = positionOf(v);
        for (int p = minPos.value(); p <= maxPos.value(); p++) {
            if (p != pos && present[p]) {
                erase(p);
            }
        }
        size.setValue(1);
        minPos.setValue(pos);
        maxPos.setValue(pos);
        return true;
    }

    @Override
    public String toString() {
        StringJoiner b = new StringJoiner(",", "{", "}");
        for (int p = minPos.value(); p <= maxPos.value(); p++) {
            if (present[p]) {
                b.add(String.valueOf(valueAt(p)));
            }
        }
        return b.toString();
    }
}
