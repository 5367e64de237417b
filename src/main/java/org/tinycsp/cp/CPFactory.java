/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.cp;

import org.tinycsp.engine.constraints.AllDifferentFW;
import org.tinycsp.engine.constraints.NotEqual;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.IntVarViewOffset;
import org.tinycsp.engine.core.Solver;
import org.tinycsp.search.DFSearch;
import org.tinycsp.search.Searches;
import org.tinycsp.util.exception.InvalidDomainException;

import java.util.Set;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Factory to create {@link Solver}, {@link IntVar}, {@link Constraint}
 * and {@link DFSearch} objects.
 */
public final class CPFactory {

    private CPFactory() {
        throw new UnsupportedOperationException();
    }

    /**
     * Creates a solver backed by a trail.
     *
     * @return the solver
     */
    public static Solver makeSolver() {
        return new Solver();
    }

    /**
     * Creates a variable with a domain of specified arity.
     *
     * @param cp the solver in which the variable is created
     * @param sz a positive value that is the size of the domain
     * @return a variable with domain equal to the set {0,...,sz-1}
     */
    public static IntVar makeIntVar(Solver cp, int sz) {
        return makeIntVar(cp, 0, sz - 1);
    }

    /**
     * Creates a variable with a domain equal to the specified range.
     *
     * @param cp  the solver in which the variable is created
     * @param min the lower bound of the domain (included)
     * @param max the upper bound of the domain (included) {@code max >= min}
     * @return a variable with domain equal to the set {min,...,max}
     * @throws InvalidDomainException if {@code min > max}
     */
    public static IntVar makeIntVar(Solver cp, int min, int max) {
        return cp.makeIntVar(min, max, null);
    }

    public static IntVar makeIntVar(Solver cp, int min, int max, String name) {
        return cp.makeIntVar(min, max, name);
    }

    /**
     * Creates a variable with a given domain.
     *
     * @param cp     the solver in which the variable is created
     * @param values the initial values in the domain, it must be nonempty
     * @return a variable with domain equal to the set of values
     * @throws InvalidDomainException if the set is empty
     */
    public static IntVar makeIntVar(Solver cp, Set<Integer> values) {
        return cp.makeIntVar(values, null);
    }

    /**
     * Creates an array of variables with specified domain size.
     *
     * @param cp the solver in which the variables are created
     * @param n  the number of variables to create
     * @param sz a positive value that is the size of the domain
     * @return an array of n variables, each with domain equal to the set {0,...,sz-1}
     */
    public static IntVar[] makeIntVarArray(Solver cp, int n, int sz) {
        return makeIntVarArray(n, i -> makeIntVar(cp, sz));
    }

    /**
     * Creates an array of variables with specified lambda function
     *
     * @param n    the number of variables to create
     * @param body the function that given the index i in the array creates/map the corresponding {@link IntVar}
     * @return an array of n variables
     *         with variable at index <i>i</i> generated as {@code body.get(i)}
     */
    public static IntVar[] makeIntVarArray(int n, IntFunction<IntVar> body) {
        IntVar[] t = new IntVar[n];
        for (int i = 0; i < n; i++) {
            t[i] = body.apply(i);
        }
        return t;
    }

    /**
     * A variable that is a view of {@code x+v}.
     *
     * @param x a variable
     * @param v a value
     * @return a variable that is a view of {@code x+v}
     * @throws IllegalArgumentException if {@code x+v} leaves the int range
     */
    public static IntVar plus(IntVar x, int v) {
        return v == 0 ? x : new IntVarViewOffset(x, v);
    }

    /**
     * A variable that is a view of {@code x-v}.
     *
     * @param x a variable
     * @param v a value
     * @return a variable that is a view of {@code x-v}
     * @throws IllegalArgumentException if {@code x-v} leaves the int range
     */
    public static IntVar minus(IntVar x, int v) {
        if (v == Integer.MIN_VALUE) {
            throw new IllegalArgumentException("cannot negate " + v);
        }
        return v == 0 ? x : new IntVarViewOffset(x, -v);
    }

    /**
     * Returns a constraint imposing that the two different variables
     * must take different values.
     *
     * @param x the first variable
     * @param y the second variable
     * @return a constraint so that {@code x != y}
     */
    public static Constraint neq(IntVar x, IntVar y) {
        return new NotEqual(x, y);
    }

    /**
     * Returns an allDifferent constraint that enforces
     * forward-checking consistency.
     *
     * @param x an array of variables or offset views
     * @return a constraint so that {@code x[i] != x[j] for all i < j}
     */
    public static Constraint allDifferent(IntVar... x) {
        if (x.length == 0) {
            throw new IllegalArgumentException("allDifferent over an empty array");
        }
        return new AllDifferentFW(x);
    }

    /**
     * Creates a Depth First Search with custom variable selection.
     *
     * @param cp       the solver that will be used for the search
     * @param selector the next variable to branch on, null once all are fixed
     * @return the depth first search object ready to execute with
     *         {@link DFSearch#solve()} or {@link DFSearch#solve(java.util.function.Predicate)}
     */
    public static DFSearch makeDfs(Solver cp, Supplier<IntVar> selector) {
        return new DFSearch(cp, selector);
    }

    /**
     * Creates a Depth First Search branching on every variable of the solver
     * in declaration order.
     *
     * @param cp the solver that will be used for the search
     * @return the depth first search object
     */
    public static DFSearch makeDfs(Solver cp) {
        return new DFSearch(cp, Searches.firstUnassigned(cp.getVariables()));
    }
}
