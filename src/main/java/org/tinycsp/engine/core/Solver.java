/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.core;

import org.tinycsp.state.StateManager;
import org.tinycsp.state.Trailer;
import org.tinycsp.util.exception.InvalidDomainException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Owns the variables, the constraints and the reversible state of a model.
 * <p>
 * Variables and constraints are declared first. Once a search has started the
 * structure is read-only and only the domains change, through the trail.
 * The model can be solved again but not extended.
 * A solver is used by a single thread and one search at a time.
 */
public class Solver {

    private final StateManager sm;
    private final PropagationEngine engine;
    private final List<IntVar> variables = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private boolean searching = false;
    private boolean solved = false;

    public Solver() {
        this(new Trailer());
    }

    public Solver(StateManager sm) {
        this.sm = sm;
        this.engine = new PropagationEngine();
    }

    public StateManager getStateManager() {
        return sm;
    }

    public PropagationEngine getPropagationEngine() {
        return engine;
    }

    /**
     * Creates a variable with domain {@code {lo,...,hi}}.
     *
     * @param lo   the lower bound
     * @param hi   the upper bound
     * @param name the name of the variable, {@code x<id>} if null
     * @return the new variable
     * @throws InvalidDomainException if {@code lo > hi} or the interval has more than
     *                                {@link IntDomain#MAX_SIZE} values
     * @throws IllegalStateException if the model has already been solved
     */
    public IntVar makeIntVar(int lo, int hi, String name) {
        if (lo > hi) {
            throw new InvalidDomainException(lo, hi);
        }
        if ((long) hi - lo + 1 > IntDomain.MAX_SIZE) {
            throw new InvalidDomainException(lo, hi, "more than " + IntDomain.MAX_SIZE + " values");
        }
        checkModifiable();
        int id = variables.size();
        IntVar x = new IntVarImpl(this, id, name == null ? "x" + id : name, lo, hi);
        variables.add(x);
        return x;
    }

    /**
     * Creates a variable whose domain is an explicit set of values.
     *
     * @param values the values of the domain
     * @param name   the name of the variable, {@code x<id>} if null
     * @return the new variable
     * @throws InvalidDomainException if the set is empty or has more than {@link IntDomain#MAX_SIZE} values
     * @throws IllegalStateException if the model has already been solved
     */
    public IntVar makeIntVar(Set<Integer> values, String name) {
        if (values.isEmpty()) {
            throw new InvalidDomainException("invalid domain: empty set of values");
        }
        if (values.size() > IntDomain.MAX_SIZE) {
            throw new InvalidDomainException("invalid domain: more than " + IntDomain.MAX_SIZE + " values");
        }
        checkModifiable();
        int id = variables.size();
        IntVar x = new IntVarImpl(this, id, name == null ? "x" + id : name, values);
        variables.add(x);
        return x;
    }

    /**
     * @param id the index of a variable
     * @return the variable created at that index
     */
    public IntVar getVariable(int id) {
        return variables.get(id);
    }

    /**
     * @return the variables in declaration order
     */
    public List<IntVar> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public int numberOfVariables() {
        return variables.size();
    }

    /**
     * @return the posted constraints in posting order
     */
    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Returns the live domain of a variable, in ascending order.
     *
     * @param id the index of the variable
     * @return a fresh array with the values currently in the domain
     */
    public int[] currentDomain(int id) {
        IntVar x = variables.get(id);
        int[] values = new int[x.size()];
        x.fillArray(values);
        return values;
    }

    /**
     * Registers a constraint. No filtering happens here,
     * the domains are only reduced once a search starts.
     *
     * @param c the constraint to add to the model
     * @throws IllegalArgumentException if the constraint mentions a variable of another solver
     * @throws IllegalStateException if the model has already been solved
     */
    public void post(Constraint c) {
        checkModifiable();
        for (IntVar x : c.scope()) {
            if (x.getSolver() != this || x.getId() >= variables.size()) {
                throw new IllegalArgumentException("variable " + x.getName() + " does not belong to this solver");
            }
        }
        c.post();
        constraints.add(c);
    }

    /**
     * Propagates all the constraints up to the fixed point.
     *
     * @return the outcome of the propagation
     */
    public PropagationResult fixPoint() {
        return engine.propagateAll(constraints);
    }

    /**
     * Propagates the pending domain changes only.
     *
     * @return the outcome of the propagation
     */
    public PropagationResult propagate() {
        return engine.fixPoint();
    }

    /**
     * @return true if every constraint is consistent with the fixed variables
     */
    public boolean isConsistent() {
        for (Constraint c : constraints) {
            if (!c.isConsistent()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Marks the start of a search.
     *
     * @throws IllegalStateException if a search is already running on this solver
     */
    public void beginSearch() {
        if (searching) {
            throw new IllegalStateException("a search is already running on this solver");
        }
        searching = true;
        solved = true;
    }

    public void endSearch() {
        searching = false;
    }

    public boolean isSearching() {
        return searching;
    }

    /**
     * @return true once a search has been started on this solver
     */
    public boolean isSolved() {
        return solved;
    }

    private void checkModifiable() {
        if (solved) {
            throw new IllegalStateException("the model is read-only once a search has started");
        }
    }
}
