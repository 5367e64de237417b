/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.Solver;
import org.tinycsp.util.exception.SolutionCallbackException;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Enumerates every solution of a model and reports them to a {@link SolutionListener}.
 * <p>
 * The clock starts once, before the root propagation; the time given with each
 * solution is relative to that start and includes the time spent in the listener
 * for the previous solutions.
 */
public final class SolutionEnumerator {

    private SolutionEnumerator() {
    }

    /**
     * Enumerates all the solutions, branching on the variables in declaration order.
     *
     * @param cp       the model to solve
     * @param listener called once per solution
     * @return the statistics of the completed enumeration
     * @throws SolutionCallbackException if the listener fails, with the partial statistics
     */
    public static SearchStatistics enumerateAll(Solver cp, SolutionListener listener) {
        return enumerateAll(cp, Searches::firstUnassigned, listener, stats -> false);
    }

    /**
     * Enumerates the solutions until the limit becomes true.
     *
     * @param cp       the model to solve
     * @param listener called once per solution
     * @param limit    tested at each node, stops the enumeration when true
     * @return the statistics, {@link SearchStatistics#isCompleted()} is false if the limit stopped the search
     */
    public static SearchStatistics enumerateAll(Solver cp, SolutionListener listener, Predicate<SearchStatistics> limit) {
        return enumerateAll(cp, Searches::firstUnassigned, listener, limit);
    }

    /**
     * Enumerates the solutions with a given variable selection.
     *
     * @param cp        the model to solve
     * @param selection builds the variable selector from the variables of the model,
     *                  for instance {@code Searches::firstFail}
     * @param listener  called once per solution
     * @param limit     tested at each node, stops the enumeration when true
     * @return the statistics of the enumeration
     * @throws SolutionCallbackException if the listener fails, with the partial statistics
     */
    public static SearchStatistics enumerateAll(Solver cp,
                                                Function<List<IntVar>, Supplier<IntVar>> selection,
                                                SolutionListener listener,
                                                Predicate<SearchStatistics> limit) {
        List<IntVar> variables = cp.getVariables();
        DFSearch dfs = new DFSearch(cp, selection.apply(variables));
        dfs.onSolution(() -> {
            SearchStatistics stats = dfs.getStatistics();
            int index = stats.numberOfSolutions() - 1;
            Solution solution = Solution.of(index, variables, dfs.elapsedNanos());
            try {
                listener.onSolution(index, solution);
            } catch (Exception e) {
                throw new SolutionCallbackException(index, stats, e);
            }
        });
        return dfs.solve(limit);
    }
}
