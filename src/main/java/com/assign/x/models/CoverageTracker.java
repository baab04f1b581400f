package com.assign.x.models;

import java.util.Arrays;

public final class CoverageTracker {

    private final boolean[] coveredRows;
    private final boolean[] coveredCols;

    public CoverageTracker(int size) {
        this.coveredRows = new boolean[size];
        this.coveredCols = new boolean[size];
    }

    /**
     * Covers exactly the columns holding a selected zero and uncovers every row.
     */
    public void coverSelectedColumns(MatchingState matching) {
        for (int j = 0; j < coveredCols.length; j++) {
            coveredCols[j] = matching.hasSelectionInColumn(j);
        }
        Arrays.fill(coveredRows, false);
    }

    public void coverRow(int row) {
        coveredRows[row] = true;
    }

    public void coverColumn(int col) {
        coveredCols[col] = true;
    }

    public void uncoverColumn(int col) {
        coveredCols[col] = false;
    }

    public boolean isRowCovered(int row) {
        return coveredRows[row];
    }

    public boolean isColumnCovered(int col) {
        return coveredCols[col];
    }

    public int coveredColumnCount() {
        int count = 0;
        for (boolean covered : coveredCols) {
            if (covered) {
                count++;
            }
        }
        return count;
    }

    public boolean[] coveredRowsCopy() {
        return coveredRows.clone();
    }

    public boolean[] coveredColsCopy() {
        return coveredCols.clone();
    }
}
