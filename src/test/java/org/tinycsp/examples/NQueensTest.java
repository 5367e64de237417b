/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.examples;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.tinycsp.cp.CPFactory;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.Solver;
import org.tinycsp.search.SearchStatistics;
import org.tinycsp.search.Solution;
import org.tinycsp.search.SolutionEnumerator;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NQueensTest {

    private static boolean isValid(int[] q) {
        for (int i = 0; i < q.length; i++) {
            for (int j = i + 1; j < q.length; j++) {
                if (q[i] == q[j] || q[i] + i == q[j] + j || q[i] - i == q[j] - j) {
                    return false;
                }
            }
        }
        return true;
    }

    @ParameterizedTest
    @CsvSource({"1,1", "2,0", "3,0", "4,2", "5,10", "6,4", "8,92"})
    public void testNumberOfSolutions(int n, int expected) {
        Solver cp = CPFactory.makeSolver();
        NQueens.build(cp, n);
        List<int[]> solutions = new ArrayList<>();
        SearchStatistics stats = SolutionEnumerator.enumerateAll(cp, (index, solution) -> solutions.add(solution.values()));
        assertEquals(expected, solutions.size());
        assertEquals(expected, stats.numberOfSolutions());
        assertTrue(stats.isCompleted());
        for (int[] q : solutions) {
            assertTrue(isValid(q));
        }
    }

    @Test
    public void testFourQueens() {
        Solver cp = CPFactory.makeSolver();
        IntVar[] q = NQueens.build(cp, 4);
        assertEquals(3, cp.getConstraints().size());
        List<Solution> solutions = new ArrayList<>();
        SolutionEnumerator.enumerateAll(cp, (index, solution) -> solutions.add(solution));
        assertEquals(2, solutions.size());
        assertArrayEquals(new int[]{1, 3, 0, 2}, solutions.get(0).values());
        assertArrayEquals(new int[]{2, 0, 3, 1}, solutions.get(1).values());
        assertEquals("x_0", q[0].getName());

        String board = NQueens.render(solutions.get(0), q);
        assertEquals("_ _ Q _ \nQ _ _ _ \n_ _ _ Q \n_ Q _ _ \n", board);
    }
}
