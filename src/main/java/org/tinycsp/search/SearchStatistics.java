/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.search;

import org.json.JSONObject;

/**
 * Statistics collected during the
 * execution of {@link DFSearch#solve()}.
 * Only the search updates them; callers get a read-only view.
 */
public class SearchStatistics {

    private long nConflicts = 0;
    private long nBranches = 0;
    private int nSolutions = 0;
    private boolean completed = false;
    private long wallTimeNanos = 0;

    @Override
    public String toString() {
        return String.format("\n\t#conflicts: %d\n\t#branches: %d\n\t#solutions: %d\n\tcompleted: %b\n\twall time: %.6f s\n",
                nConflicts, nBranches, nSolutions, completed, wallTimeSeconds());
    }

    /**
     * @return the fields of the statistics as a json object
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("conflicts", nConflicts);
        json.put("branches", nBranches);
        json.put("solutions", nSolutions);
        json.put("completed", completed);
        json.put("wallTime", wallTimeSeconds());
        return json;
    }

    void incrConflicts() {
        nConflicts++;
    }

    void incrBranches() {
        nBranches++;
    }

    void incrSolutions() {
        nSolutions++;
    }

    void setCompleted() {
        completed = true;
    }

    void setWallTimeNanos(long nanos) {
        wallTimeNanos = nanos;
    }

    /**
     * @return the number of assignments whose propagation failed
     */
    public long numberOfConflicts() {
        return nConflicts;
    }

    /**
     * @return the number of tentative assignments (decisions) taken
     */
    public long numberOfBranches() {
        return nBranches;
    }

    public int numberOfSolutions() {
        return nSolutions;
    }

    /**
     * @return true if the whole search tree was explored,
     *         false if the search was stopped or aborted by a failing listener
     */
    public boolean isCompleted() {
        return completed;
    }

    public long wallTimeMillis() {
        return wallTimeNanos / 1_000_000;
    }

    public double wallTimeSeconds() {
        return wallTimeNanos / 1e9;
    }
}
