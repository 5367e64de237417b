/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.engine;

import org.tinycsp.engine.core.Solver;
import org.tinycsp.state.Trailer;

import java.util.stream.Stream;

public abstract class SolverTest {

    public static Stream<Solver> getSolver() {
        return Stream.of(new Solver(new Trailer()));
    }
}
