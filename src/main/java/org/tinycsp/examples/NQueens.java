/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.tinycsp.cp.CPFactory;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.Solver;
import org.tinycsp.search.SearchStatistics;
import org.tinycsp.search.Solution;
import org.tinycsp.search.SolutionEnumerator;
import org.tinycsp.util.exception.SolutionCallbackException;

import java.util.ArrayList;
import java.util.List;

import static org.tinycsp.cp.CPFactory.*;

/**
 * The N-Queens problem.
 * <a href="http://csplib.org/Problems/prob054/">CSPLib</a>.
 * <p>
 * One variable per column holds the row of its queen.
 * Usage: {@code NQueens [size] [--json]}, the size defaults to 8.
 */
public class NQueens {

    public static final int DEFAULT_SIZE = 8;

    /**
     * Posts the three allDifferent constraints on rows and diagonals.
     *
     * @param cp the solver
     * @param n  the size of the board
     * @return the queen variables, {@code q[i]} is the row of the queen in column i
     */
    public static IntVar[] build(Solver cp, int n) {
        IntVar[] q = makeIntVarArray(n, i -> makeIntVar(cp, 0, n - 1, "x_" + i));
        IntVar[] diag1 = makeIntVarArray(n, i -> plus(q[i], i));
        IntVar[] diag2 = makeIntVarArray(n, i -> minus(q[i], i));
        cp.post(allDifferent(q));
        cp.post(allDifferent(diag1));
        cp.post(allDifferent(diag2));
        return q;
    }

    /**
     * @return the board, row by row, {@code Q} for a queen and {@code _} otherwise
     */
    public static String render(Solution solution, IntVar[] q) {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < q.length; i++) {
            for (int j = 0; j < q.length; j++) {
                b.append(solution.valueOf(q[j]) == i ? "Q " : "_ ");
            }
            b.append('\n');
        }
        return b.toString();
    }

    public static void main(String[] args) {
        List<String> positional = new ArrayList<>();
        boolean json = false;
        for (String arg : args) {
            if (arg.equals("--json")) {
                json = true;
            } else {
                positional.add(arg);
            }
        }
        int n = DEFAULT_SIZE;
        if (!positional.isEmpty()) {
            try {
                n = Integer.parseInt(positional.get(0));
            } catch (NumberFormatException e) {
                System.err.println("Invalid board size: " + positional.get(0));
                System.exit(2);
                return;
            }
            if (n < 1) {
                System.err.println("Invalid board size: " + n);
                System.exit(2);
                return;
            }
        }

        Solver cp = CPFactory.makeSolver();
        IntVar[] q = build(cp, n);

        final boolean jsonOutput = json;
        SearchStatistics stats;
        try {
            stats = SolutionEnumerator.enumerateAll(cp, (index, solution) -> {
                if (jsonOutput) {
                    System.out.println(solution.toJson());
                } else {
                    System.out.println(StatisticsPrinter.header(solution));
                    System.out.println(render(solution, q));
                }
            });
        } catch (SolutionCallbackException e) {
            System.err.println("Enumeration aborted: " + e.getCause());
            StatisticsPrinter.print(System.err, e.getPartialStatistics(), json);
            System.exit(1);
            return;
        }
        StatisticsPrinter.print(System.out, stats, json);
    }
}
