/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.engine.core;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.tinycsp.cp.CPFactory;
import org.tinycsp.engine.SolverTest;
import org.tinycsp.examples.NQueens;
import org.tinycsp.state.StateManager;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.cp.CPFactory.neq;

public class PropagationEngineTest extends SolverTest {

    private static int[][] snapshot(Solver cp) {
        int[][] domains = new int[cp.numberOfVariables()][];
        for (int i = 0; i < domains.length; i++) {
            domains[i] = cp.currentDomain(i);
        }
        return domains;
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testCascade(Solver cp) {
        IntVar[] x = CPFactory.makeIntVarArray(cp, 3, 2);
        cp.post(neq(x[0], x[1]));
        cp.post(neq(x[1], x[2]));
        assertEquals(PropagationResult.UNCHANGED, cp.fixPoint());

        x[0].fix(0);
        assertEquals(PropagationResult.REDUCED, cp.propagate());
        assertTrue(x[1].isFixed());
        assertEquals(1, x[1].min());
        assertTrue(x[2].isFixed());
        assertEquals(0, x[2].min());
        assertFalse(cp.getPropagationEngine().hasPending());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testContradiction(Solver cp) {
        IntVar[] x = CPFactory.makeIntVarArray(cp, 3, 2);
        cp.post(neq(x[0], x[1]));
        cp.post(neq(x[1], x[2]));
        cp.post(neq(x[0], x[2]));

        cp.getStateManager().saveState();
        x[0].fix(0);
        assertEquals(PropagationResult.CONTRADICTION, cp.propagate());
        assertFalse(cp.getPropagationEngine().hasPending());
        cp.getStateManager().restoreState();
        for (IntVar xi : x) {
            assertEquals(2, xi.size());
        }
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testPropagateIsIdempotent(Solver cp) {
        IntVar[] q = NQueens.build(cp, 6);
        q[0].fix(1);
        q[3].fix(0);
        assertEquals(PropagationResult.REDUCED, cp.propagate());
        int[][] before = snapshot(cp);
        for (Constraint c : cp.getConstraints()) {
            assertEquals(PropagationResult.UNCHANGED, c.propagate());
        }
        assertEquals(PropagationResult.UNCHANGED, cp.fixPoint());
        assertArrayEquals(before, snapshot(cp));
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testBacktrackRestoresDomains(Solver cp) {
        IntVar[] q = NQueens.build(cp, 8);
        StateManager sm = cp.getStateManager();
        Random rand = new Random(42);

        sm.saveState();
        int[][] root = snapshot(cp);
        for (int run = 0; run < 50; run++) {
            int depth = 0;
            int[][][] saved = new int[q.length + 1][][];
            while (depth < q.length) {
                saved[depth] = snapshot(cp);
                int level = sm.getLevel();
                sm.saveState();
                IntVar x = q[rand.nextInt(q.length)];
                int[] values = cp.currentDomain(x.getId());
                x.fix(values[rand.nextInt(values.length)]);
                depth++;
                if (cp.propagate() == PropagationResult.CONTRADICTION) {
                    sm.restoreStateUntil(level);
                    depth--;
                    assertArrayEquals(saved[depth], snapshot(cp));
                    break;
                }
            }
            while (depth > 0) {
                sm.restoreState();
                depth--;
                assertArrayEquals(saved[depth], snapshot(cp));
            }
            assertArrayEquals(root, snapshot(cp));
        }
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testPostForeignVariable(Solver cp) {
        Solver other = CPFactory.makeSolver();
        IntVar x = CPFactory.makeIntVar(cp, 0, 2);
        IntVar y = CPFactory.makeIntVar(other, 0, 2);
        assertThrows(IllegalArgumentException.class, () -> cp.post(neq(x, y)));
        assertTrue(cp.getConstraints().isEmpty());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testPropagationCounter(Solver cp) {
        IntVar[] x = CPFactory.makeIntVarArray(cp, 2, 2);
        cp.post(neq(x[0], x[1]));
        long before = cp.getPropagationEngine().numberOfPropagations();
        cp.fixPoint();
        assertEquals(before + 1, cp.getPropagationEngine().numberOfPropagations());
    }
}
