/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.tinycsp.search.SearchStatistics;
import org.tinycsp.search.Solution;

import java.io.PrintStream;

/**
 * Text rendering shared by the example programs.
 */
final class StatisticsPrinter {

    private StatisticsPrinter() {
    }

    static String header(Solution solution) {
        return String.format("Solution %d, time = %s s", solution.index(), solution.elapsedSeconds());
    }

    static String format(SearchStatistics stats) {
        StringBuilder b = new StringBuilder();
        b.append("\nStatistics\n");
        b.append(String.format("  conflicts      : %d\n", stats.numberOfConflicts()));
        b.append(String.format("  branches       : %d\n", stats.numberOfBranches()));
        b.append(String.format("  wall time      : %s s\n", stats.wallTimeSeconds()));
        b.append(String.format("  solutions found: %d\n", stats.numberOfSolutions()));
        if (!stats.isCompleted()) {
            b.append("  (search not completed)\n");
        }
        return b.toString();
    }

    static void print(PrintStream out, SearchStatistics stats, boolean json) {
        if (json) {
            out.println(stats.toJson());
        } else {
            out.print(format(stats));
        }
    }
}
