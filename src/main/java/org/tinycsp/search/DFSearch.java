/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.search;

import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.PropagationResult;
import org.tinycsp.engine.core.Solver;
import org.tinycsp.state.StateManager;
import org.tinycsp.util.Stopwatch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Depth First Search Branch and Bound implementation
 * without the bound: every solution is enumerated.
 * <p>
 * The search keeps an explicit stack of decision frames.
 * Each frame remembers the variable it branches on, the last value tried
 * and the trail level at which it was opened.
 * Values are tried in ascending order; a value whose propagation fails
 * counts as a conflict and the next one is tried.
 * Going back to a frame restores the trail to its level, which undoes
 * exactly the reductions caused by the previous value.
 */
public class DFSearch {

    private final Solver cp;
    private final StateManager sm;
    private final Supplier<IntVar> variableSelector;

    private final List<Runnable> solutionListeners = new LinkedList<>();
    private final List<Runnable> failureListeners = new LinkedList<>();

    private final Stopwatch stopwatch = new Stopwatch();
    private SearchStatistics statistics = new SearchStatistics();
    private SearchState state = SearchState.EXHAUSTED;

    private static final class DecisionFrame {
        final IntVar x;
        final int level;
        int last = Integer.MIN_VALUE;
        boolean started = false;

        DecisionFrame(IntVar x, int level) {
            this.x = x;
            this.level = level;
        }

        // the domain is restored to the frame level, so last is still in it
        boolean hasNextValue() {
            return !started || last < x.max();
        }

        int nextValue() {
            return started ? x.after(last) : x.min();
        }
    }

    /**
     * Creates a Depth First Search object with a given variable selection
     * that defines the search tree.
     *
     * @param cp               the solver whose variables are assigned
     * @param variableSelector returns the next variable to branch on,
     *                         or null when all the relevant variables are fixed
     */
    public DFSearch(Solver cp, Supplier<IntVar> variableSelector) {
        this.cp = cp;
        this.sm = cp.getStateManager();
        this.variableSelector = variableSelector;
    }

    /**
     * Adds a listener that is called on each solution.
     * The variables are fixed while it runs.
     *
     * @param listener the closure to be called whenever a solution is found
     */
    public void onSolution(Runnable listener) {
        solutionListeners.add(listener);
    }

    /**
     * Adds a listener that is called whenever an assignment fails.
     *
     * @param listener the closure to be called whenever a failure occurs
     */
    public void onFailure(Runnable listener) {
        failureListeners.add(listener);
    }

    public SearchState getState() {
        return state;
    }

    /**
     * @return the statistics of the current, or last, run
     */
    public SearchStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return the time elapsed since the current run started
     */
    public long elapsedNanos() {
        return stopwatch.getElapsedTimeNanos();
    }

    /**
     * Start the solving process.
     *
     * @return an object with the statistics on the solving process
     */
    public SearchStatistics solve() {
        return solve(stats -> false);
    }

    /**
     * Start the solving process
     * with a given limit.
     *
     * @param limit a predicate called at each node
     *             that stops the search when it becomes true
     * @return an object with the statistics on the solving process
     */
    public SearchStatistics solve(Predicate<SearchStatistics> limit) {
        cp.beginSearch();
        statistics = new SearchStatistics();
        stopwatch.reset();
        stopwatch.start();
        int rootLevel = sm.getLevel();
        try {
            sm.saveState();
            state = SearchState.EXPLORING;
            explore(limit);
        } finally {
            sm.restoreStateUntil(rootLevel);
            cp.getPropagationEngine().clear();
            stopwatch.pause();
            statistics.setWallTimeNanos(stopwatch.getElapsedTimeNanos());
            state = SearchState.EXHAUSTED;
            cp.endSearch();
        }
        return statistics;
    }

    private void explore(Predicate<SearchStatistics> limit) {
        if (cp.fixPoint() == PropagationResult.CONTRADICTION) {
            statistics.incrConflicts();
            notifyFailure();
            statistics.setCompleted();
            return;
        }
        IntVar first = variableSelector.get();
        if (first == null) {
            notifySolution();
            statistics.setCompleted();
            return;
        }
        Deque<DecisionFrame> stack = new ArrayDeque<>();
        stack.push(new DecisionFrame(first, sm.getLevel()));
        while (!stack.isEmpty()) {
            if (limit.test(statistics)) {
                return;
            }
            DecisionFrame frame = stack.peek();
            sm.restoreStateUntil(frame.level);
            if (!frame.hasNextValue()) {
                stack.pop();
                continue;
            }
            int v = frame.nextValue();
            frame.started = true;
            frame.last = v;
            statistics.incrBranches();
            sm.saveState();
            frame.x.fix(v);
            if (cp.propagate() == PropagationResult.CONTRADICTION) {
                statistics.incrConflicts();
                notifyFailure();
                continue;
            }
            IntVar next = variableSelector.get();
            if (next == null) {
                notifySolution();
            } else {
                stack.push(new DecisionFrame(next, sm.getLevel()));
            }
        }
        statistics.setCompleted();
    }

    private void notifySolution() {
        assert (cp.isConsistent());
        state = SearchState.SOLUTION_FOUND;
        statistics.incrSolutions();
        solutionListeners.forEach(Runnable::run);
        state = SearchState.EXPLORING;
    }

    private void notifyFailure() {
        failureListeners.forEach(Runnable::run);
    }
}
