/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.IntVar;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Factory for variable selection heuristics.
 * A selector returns the next variable to branch on,
 * or {@code null} once every variable is fixed.
 * Values are always tried in ascending order by {@link DFSearch}.
 */
public final class Searches {

    private Searches() {
    }

    /**
     * Minimum Selector.
     * <p>Example of usage.
     * <pre>
     * {@code
     * IntVar xs = selectMin(x,xi -> xi.size() > 1,xi -> xi.size());
     * }
     * </pre>
     *
     * @param x    the array on which the minimum value is searched
     * @param p    the predicate that filters the element eligible for selection
     * @param f    the evaluation function that returns a comparable when applied on an element of x
     * @param <T>  the type of the elements in x, for instance {@link IntVar}
     * @param <N>  the type on which the minimum is computed, for instance {@link Integer}
     * @return the minimum element in x that satisfies the predicate p
     *         or null if no element satisfies the predicate.
     */
    public static <T, N extends Comparable<N>> T selectMin(List<T> x, Predicate<T> p, Function<T, N> f) {
        T sel = null;
        for (T xi : x) {
            if (p.test(xi)) {
                sel = sel == null || f.apply(xi).compareTo(f.apply(sel)) < 0 ? xi : sel;
            }
        }
        return sel;
    }

    /**
     * First unfixed variable in the given order.
     *
     * @param x the variables to branch on
     * @return a selector over x
     */
    public static Supplier<IntVar> firstUnassigned(List<IntVar> x) {
        return () -> {
            for (IntVar xi : x) {
                if (!xi.isFixed()) {
                    return xi;
                }
            }
            return null;
        };
    }

    public static Supplier<IntVar> firstUnassigned(IntVar... x) {
        return firstUnassigned(List.of(x));
    }

    /**
     * First-fail: the unfixed variable with the smallest domain,
     * the first one in the given order on ties.
     *
     * @param x the variables to branch on
     * @return a selector over x
     */
    public static Supplier<IntVar> firstFail(List<IntVar> x) {
        return () -> selectMin(x, xi -> !xi.isFixed(), IntVar::size);
    }

    public static Supplier<IntVar> firstFail(IntVar... x) {
        return firstFail(List.of(x));
    }
}
