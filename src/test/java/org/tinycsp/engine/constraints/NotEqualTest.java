/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine.constraints;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.tinycsp.cp.CPFactory;
import org.tinycsp.engine.SolverTest;
import org.tinycsp.engine.core.Constraint;
import org.tinycsp.engine.core.IntVar;
import org.tinycsp.engine.core.PropagationResult;
import org.tinycsp.engine.core.Solver;

import static org.junit.jupiter.api.Assertions.*;
import static org.tinycsp.cp.CPFactory.neq;

public class NotEqualTest extends SolverTest {

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testNothingToDoWhileUnfixed(Solver cp) {
        IntVar x = CPFactory.makeIntVar(cp, 0, 3);
        IntVar y = CPFactory.makeIntVar(cp, 0, 3);
        Constraint c = neq(x, y);
        cp.post(c);
        assertEquals(PropagationResult.UNCHANGED, c.propagate());
        assertEquals(4, x.size());
        assertEquals(4, y.size());
        assertTrue(c.isConsistent());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testRemovesFixedValue(Solver cp) {
        IntVar x = CPFactory.makeIntVar(cp, 0, 3);
        IntVar y = CPFactory.makeIntVar(cp, 0, 3);
        Constraint c = neq(x, y);
        cp.post(c);

        y.fix(2);
        assertEquals(PropagationResult.REDUCED, c.propagate());
        assertFalse(x.contains(2));
        assertEquals(3, x.size());
        assertEquals(PropagationResult.UNCHANGED, c.propagate());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testBothSides(Solver cp) {
        IntVar x = CPFactory.makeIntVar(cp, 0, 3);
        IntVar y = CPFactory.makeIntVar(cp, 0, 3);
        cp.post(neq(x, y));
        x.fix(0);
        assertEquals(PropagationResult.REDUCED, cp.propagate());
        assertEquals(1, y.min());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testContradiction(Solver cp) {
        IntVar x = CPFactory.makeIntVar(cp, 1, 1);
        IntVar y = CPFactory.makeIntVar(cp, 1, 1);
        Constraint c = neq(x, y);
        cp.post(c);
        assertFalse(c.isConsistent());
        assertEquals(PropagationResult.CONTRADICTION, c.propagate());
        assertEquals(PropagationResult.CONTRADICTION, cp.fixPoint());
    }

    @ParameterizedTest
    @MethodSource("getSolver")
    public void testWithOffsetView(Solver cp) {
        IntVar x = CPFactory.makeIntVar(cp, 0, 3);
        IntVar y = CPFactory.makeIntVar(cp, 0, 3);
        cp.post(neq(CPFactory.plus(x, 1), y));
        y.fix(2);
        cp.propagate();
        assertFalse(x.contains(1));
        assertEquals(3, x.size());
    }
}
