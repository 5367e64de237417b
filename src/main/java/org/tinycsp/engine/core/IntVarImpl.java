/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.util.exception.ValueOutOfDomainException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Implementation of a variable
 * with a reversible {@link IntDomain}.
 * Each domain change schedules the variable
 * in the propagation engine of its solver.
 */
public class IntVarImpl implements IntVar {

    private final Solver cp;
    private final int id;
    private final String name;
    private final IntDomain domain;
    private final List<Constraint> onDomain = new ArrayList<>();

    /**
     * Creates a variable with the elements {@code {min,...,max}}
     * as initial domain.
     *
     * @param cp   the solver in which the variable is created
     * @param id   the index of the variable in the solver
     * @param name the name of the variable
     * @param min  the minimum value of the domain
     * @param max  the maximum value of the domain with {@code max >= min}
     */
    IntVarImpl(Solver cp, int id, String name, int min, int max) {
        this.cp = cp;
        this.id = id;
        this.name = name;
        this.domain = new IntDomain(cp.getStateManager(), min, max);
    }

    /**
     * Creates a variable with a given set of values as initial domain.
     *
     * @param cp     the solver in which the variable is created
     * @param id     the index of the variable in the solver
     * @param name   the name of the variable
     * @param values the initial values in the domain, it must be nonempty
     */
    IntVarImpl(Solver cp, int id, String name, Set<Integer> values) {
        this.cp = cp;
        this.id = id;
        this.name = name;
        this.domain = new IntDomain(cp.getStateManager(), values);
    }

    @Override
    public Solver getSolver() {
        return cp;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int offset() {
        return 0;
    }

    @Override
    public String getName() {
        return name;
    }

    List<Constraint> constraints() {
        return Collections.unmodifiableList(onDomain);
    }

    @Override
    public void propagateOnDomainChange(Constraint c) {
        if (!onDomain.contains(c)) {
            onDomain.add(c);
        }
    }

    @Override
    public int min() {
        return domain.min();
    }

    @Override
    public int max() {
        return domain.max();
    }

    @Override
    public int size() {
        return domain.size();
    }

    @Override
    public boolean isFixed() {
        return domain.isSingleton();
    }

    @Override
    public boolean contains(int v) {
        return domain.contains(v);
    }

    @Override
    public int after(int v) {
        return domain.after(v);
    }

    @Override
    public int fillArray(int[] dest) {
        return domain.fillArray(dest);
    }

    @Override
    public boolean remove(int v) {
        boolean changed = domain.remove(v);
        if (changed) {
            cp.getPropagationEngine().schedule(this);
        }
        return changed;
    }

    @Override
    public boolean fix(int v) {
        if (!domain.contains(v)) {
            throw new ValueOutOfDomainException(name, v);
        }
        boolean changed = domain.removeAllBut(v);
        if (changed) {
            cp.getPropagationEngine().schedule(this);
        }
        return changed;
    }

    @Override
    public String toString() {
        return isFixed() ? String.valueOf(min()) : domain.toString();
    }
}
