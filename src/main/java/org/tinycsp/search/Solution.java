/*
 * MaxiCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.tinycsp.search;

import org.json.JSONArray;
import org.json.JSONObject;
import org.tinycsp.engine.core.IntVar;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a complete assignment.
 * Values are indexed by variable id, in declaration order.
 */
public final class Solution {

    private final int index;
    private final int[] values;
    private final String[] names;
    private final long elapsedNanos;

    Solution(int index, int[] values, String[] names, long elapsedNanos) {
        this.index = index;
        this.values = values;
        this.names = names;
        this.elapsedNanos = elapsedNanos;
    }

    /**
     * Takes a snapshot of fixed variables.
     *
     * @param index        the position of the solution in discovery order
     * @param variables    all the variables of the solver, in declaration order
     * @param elapsedNanos the time elapsed since the search started
     * @return the solution
     * @throws IllegalStateException if one variable is not fixed
     */
    public static Solution of(int index, List<IntVar> variables, long elapsedNanos) {
        int[] values = new int[variables.size()];
        String[] names = new String[variables.size()];
        for (IntVar x : variables) {
            if (!x.isFixed()) {
                throw new IllegalStateException("variable " + x.getName() + " is not fixed");
            }
            values[x.getId()] = x.min();
            names[x.getId()] = x.getName();
        }
        return new Solution(index, values, names, elapsedNanos);
    }

    /**
     * @return the position of this solution in discovery order, starting at 0
     */
    public int index() {
        return index;
    }

    public int size() {
        return values.length;
    }

    /**
     * @param id the index of a variable
     * @return the value assigned to that variable
     */
    public int value(int id) {
        return values[id];
    }

    /**
     * Evaluates a variable or an offset view.
     *
     * @param x a variable of the solved model, or a view over one
     * @return the value of the underlying variable plus the offset of x
     */
    public int valueOf(IntVar x) {
        return values[x.getId()] + x.offset();
    }

    /**
     * @param name the name of a variable
     * @return the value of the first variable with that name
     * @throws IllegalArgumentException if no variable has that name
     */
    public int valueOf(String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name)) {
                return values[i];
            }
        }
        throw new IllegalArgumentException("no variable named " + name);
    }

    /**
     * @return a copy of the values
     */
    public int[] values() {
        return values.clone();
    }

    /**
     * @return the assignment as an unmodifiable name to value map, in declaration order
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names[i], values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    /**
     * @return the time elapsed between the start of the search and this solution
     */
    public double elapsedSeconds() {
        return elapsedNanos / 1e9;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("index", index);
        json.put("time", elapsedSeconds());
        JSONObject assignment = new JSONObject();
        for (int i = 0; i < values.length; i++) {
            assignment.put(names[i], values[i]);
        }
        json.put("assignment", assignment);
        json.put("values", new JSONArray(values));
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Solution)) return false;
        return Arrays.equals(values, ((Solution) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Solution " + index + " " + asMap();
    }
}
