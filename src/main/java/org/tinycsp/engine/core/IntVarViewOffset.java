/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.util.exception.ValueOutOfDomainException;

/**
 * A view on a variable of type {@code x+o}.
 * It has no domain of its own: every query and every update
 * is translated to the underlying variable.
 * The shifted domain must fit in the int range, values outside of it
 * are never in the domain of the view.
 */
public class IntVarViewOffset implements IntVar {

    private final IntVar x;
    private final int o;

    /**
     * @param x      the viewed variable
     * @param offset the constant added to x
     * @throws IllegalArgumentException if {@code x+offset} leaves the int range
     */
    public IntVarViewOffset(IntVar x, int offset) {
        if ((long) x.min() + offset < Integer.MIN_VALUE || (long) x.max() + offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("the view " + x.getName() + (offset >= 0 ? "+" : "") + offset
                    + " leaves the int range");
        }
        this.x = x;
        this.o = offset;
    }

    @Override
    public Solver getSolver() {
        return x.getSolver();
    }

    @Override
    public int getId() {
        return x.getId();
    }

    @Override
    public int offset() {
        return x.offset() + o;
    }

    @Override
    public String getName() {
        return o >= 0 ? x.getName() + "+" + o : x.getName() + "-" + (-o);
    }

    @Override
    public void propagateOnDomainChange(Constraint c) {
        x.propagateOnDomainChange(c);
    }

    @Override
    public int min() {
        return x.min() + o;
    }

    @Override
    public int max() {
        return x.max() + o;
    }

    @Override
    public int size() {
        return x.size();
    }

    @Override
    public boolean isFixed() {
        return x.isFixed();
    }

    private boolean inRange(long w) {
        return w >= Integer.MIN_VALUE && w <= Integer.MAX_VALUE;
    }

    @Override
    public boolean contains(int v) {
        long w = (long) v - o;
        return inRange(w) && x.contains((int) w);
    }

    @Override
    public int after(int v) {
        if (v >= max()) {
            return Integer.MAX_VALUE;
        }
        long w = (long) v - o;
        return w < Integer.MIN_VALUE ? min() : x.after((int) w) + o;
    }

    @Override
    public int fillArray(int[] dest) {
        int s = x.fillArray(dest);
        for (int i = 0; i < s; i++) {
            dest[i] += o;
        }
        return s;
    }

    @Override
    public boolean remove(int v) {
        long w = (long) v - o;
        return inRange(w) && x.remove((int) w);
    }

    @Override
    public boolean fix(int v) {
        long w = (long) v - o;
        if (!inRange(w)) {
            throw new ValueOutOfDomainException(getName(), v);
        }
        return x.fix((int) w);
    }

    @Override
    public String toString() {
        return getName();
    }
}
