package com.assign.x.models;

import java.util.Arrays;

import static com.assign.x.utils.basic.Constant.NONE;

/**
 * Selected zeros (the tentative assignment, kept in both directions) and the prepared zeros of the
 * current search phase. Indices are stored in fixed arrays with {@code -1} meaning "none".
 */
public final class MatchingState {

    private final int[] selectedInRow;
    private final int[] selectedInCol;
    private final int[] preparedInRow;
    private int selectedCount;

    public MatchingState(int size) {
        this.selectedInRow = new int[size];
        this.selectedInCol = new int[size];
        this.preparedInRow = new int[size];
        Arrays.fill(selectedInRow, NONE);
        Arrays.fill(selectedInCol, NONE);
        Arrays.fill(preparedInRow, NONE);
    }

    public void select(int row, int col) {
        if (selectedInRow[row] != NONE || selectedInCol[col] != NONE) {
            throw new IllegalStateException("Cannot select (" + row + ", " + col
                    + "): row or column already holds a selected zero");
        }
        selectedInRow[row] = col;
        selectedInCol[col] = row;
        selectedCount++;
    }

    public void deselect(int row, int col) {
        if (selectedInRow[row] != col || selectedInCol[col] != row) {
            throw new IllegalStateException("Cannot deselect (" + row + ", " + col
                    + "): not a selected zero");
        }
        selectedInRow[row] = NONE;
        selectedInCol[col] = NONE;
        selectedCount--;
    }

    public void prepare(int row, int col) {
        preparedInRow[row] = col;
    }

    public void clearPrepared() {
        Arrays.fill(preparedInRow, NONE);
    }

    public boolean hasSelectionInRow(int row) {
        return selectedInRow[row] != NONE;
    }

    public boolean hasSelectionInColumn(int col) {
        return selectedInCol[col] != NONE;
    }

    public int selectedColumnOf(int row) {
        return selectedInRow[row];
    }

    public int selectedRowOf(int col) {
        return selectedInCol[col];
    }

    public int preparedColumnOf(int row) {
        return preparedInRow[row];
    }

    public int getSelectedCount() {
        return selectedCount;
    }

    public int[] selectedInRowCopy() {
        return selectedInRow.clone();
    }

    public int[] preparedInRowCopy() {
        return preparedInRow.clone();
    }
}
