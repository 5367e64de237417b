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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.tinycsp.cp.CPFactory.neq;

/**
 * Map coloring of the Australian mainland states:
 * adjacent states must receive different colors.
 * All the colorings are enumerated.
 * <p>
 * Usage: {@code MapColoring [--json]}
 */
public class MapColoring {

    public static final String[] COLORS = {"Red", "Green", "Blue"};

    public static final Map<String, List<String>> MAINLAND = mainland();

    private static Map<String, List<String>> mainland() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("WA", List.of("NT", "SA"));
        m.put("NT", List.of("WA", "SA", "Q"));
        m.put("SA", List.of("WA", "NT", "Q", "NSW", "V"));
        m.put("Q", List.of("NT", "SA", "NSW"));
        m.put("NSW", List.of("Q", "SA", "V"));
        m.put("V", List.of("SA", "NSW"));
        return m;
    }

    /**
     * A model with one color variable per state.
     */
    public record Model(Solver cp, Map<String, IntVar> stateColors) {}

    /**
     * Builds the model. Every neighbor relation yields a {@code !=} constraint,
     * relations listed in both directions are posted twice.
     *
     * @param neighbors the neighbors of each state
     * @param nColors   the number of available colors
     * @return the model
     */
    public static Model build(Map<String, List<String>> neighbors, int nColors) {
        Solver cp = CPFactory.makeSolver();
        Map<String, IntVar> stateColors = new LinkedHashMap<>();
        for (String state : neighbors.keySet()) {
            stateColors.put(state, CPFactory.makeIntVar(cp, 0, nColors - 1, state));
        }
        for (Map.Entry<String, List<String>> e : neighbors.entrySet()) {
            for (String neighbor : e.getValue()) {
                IntVar other = stateColors.get(neighbor);
                if (other == null) {
                    throw new IllegalArgumentException("unknown state " + neighbor);
                }
                cp.post(neq(stateColors.get(e.getKey()), other));
            }
        }
        return new Model(cp, stateColors);
    }

    /**
     * @return one {@code STATE: Color} line per state
     */
    public static String render(Solution solution, Map<String, IntVar> stateColors, String[] colors) {
        StringBuilder b = new StringBuilder();
        for (Map.Entry<String, IntVar> e : stateColors.entrySet()) {
            b.append(e.getKey()).append(": ").append(colors[solution.valueOf(e.getValue())]).append('\n');
        }
        return b.toString();
    }

    public static void main(String[] args) {
        boolean json = List.of(args).contains("--json");
        Model model = build(MAINLAND, COLORS.length);

        SearchStatistics stats;
        try {
            stats = SolutionEnumerator.enumerateAll(model.cp(), (index, solution) -> {
                if (json) {
                    System.out.println(solution.toJson());
                } else {
                    System.out.println(StatisticsPrinter.header(solution));
                    System.out.println(render(solution, model.stateColors(), COLORS));
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
