/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.junit.jupiter.api.Test;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.search.SearchStatistics;
import org.tinycsp.search.Solution;
import org.tinycsp.search.SolutionEnumerator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MapColoringTest {

    private static List<Solution> solve(MapColoring.Model model) {
        List<Solution> solutions = new ArrayList<>();
        SearchStatistics stats = SolutionEnumerator.enumerateAll(model.cp(), (index, solution) -> solutions.add(solution));
        assertTrue(stats.isCompleted());
        assertEquals(solutions.size(), stats.numberOfSolutions());
        return solutions;
    }

    private static void assertProperColorings(Map<String, List<String>> neighbors, MapColoring.Model model, List<Solution> solutions) {
        for (Solution s : solutions) {
            for (Map.Entry<String, List<String>> e : neighbors.entrySet()) {
                for (String n : e.getValue()) {
                    assertNotEquals(s.valueOf(e.getKey()), s.valueOf(n), e.getKey() + "/" + n + " in " + s);
                }
            }
        }
        assertEquals(solutions.size(), new HashSet<>(solutions).size());
    }

    @Test
    public void testMainland() {
        MapColoring.Model model = MapColoring.build(MapColoring.MAINLAND, MapColoring.COLORS.length);
        assertEquals(6, model.cp().numberOfVariables());
        assertEquals(18, model.cp().getConstraints().size());

        List<Solution> solutions = solve(model);
        // every state lies in a chain of triangles: 3 choices for SA, 2 for WA, the rest follows
        assertEquals(6, solutions.size());
        assertProperColorings(MapColoring.MAINLAND, model, solutions);

        Solution first = solutions.get(0);
        assertEquals(Map.of("WA", 0, "NT", 1, "SA", 2, "Q", 0, "NSW", 1, "V", 0), first.asMap());
    }

    @Test
    public void testWithTasmania() {
        Map<String, List<String>> australia = new LinkedHashMap<>(MapColoring.MAINLAND);
        australia.put("T", List.of());
        MapColoring.Model model = MapColoring.build(australia, MapColoring.COLORS.length);

        List<Solution> solutions = solve(model);
        assertEquals(18, solutions.size());
        assertProperColorings(australia, model, solutions);
    }

    @Test
    public void testTwoColorsIsUnsatisfiable() {
        MapColoring.Model model = MapColoring.build(MapColoring.MAINLAND, 2);
        List<Solution> solutions = new ArrayList<>();
        SearchStatistics stats = SolutionEnumerator.enumerateAll(model.cp(), (index, solution) -> solutions.add(solution));
        assertTrue(solutions.isEmpty());
        assertTrue(stats.isCompleted());
        assertTrue(stats.numberOfConflicts() > 0);
    }

    @Test
    public void testUnknownNeighbor() {
        Map<String, List<String>> bad = Map.of("A", List.of("B"));
        assertThrows(IllegalArgumentException.class, () -> MapColoring.build(bad, 3));
    }

    @Test
    public void testRender() {
        MapColoring.Model model = MapColoring.build(MapColoring.MAINLAND, MapColoring.COLORS.length);
        List<Solution> solutions = solve(model);
        String text = MapColoring.render(solutions.get(0), model.stateColors(), MapColoring.COLORS);
        assertEquals("WA: Red\nNT: Green\nSA: Blue\nQ: Red\nNSW: Green\nV: Red\n", text);
        for (IntVar x : model.stateColors().values()) {
            assertEquals(3, x.size());
        }
    }
}
