package com.assign.x.dto;

import com.assign.x.models.SolverState;

import java.util.List;

/**
 * Read-only copy of the solver's working data taken after a transition.
 *
 * @param state         transition that just completed
 * @param step          running transition number, starting at 0
 * @param matrix        working (reduced and adjusted) matrix values
 * @param coveredRows   row cover flags
 * @param coveredCols   column cover flags
 * @param selectedInRow row to selected column, -1 for none
 * @param preparedInRow row to prepared column, -1 for none
 * @param preparedPath  prepared cells of the current alternating path, empty outside path building
 * @param selectedPath  selected cells of the current alternating path, empty outside path building
 */
public record SolverSnapshot(SolverState state,
                             int step,
                             double[][] matrix,
                             boolean[] coveredRows,
                             boolean[] coveredCols,
                             int[] selectedInRow,
                             int[] preparedInRow,
                             List<Cell> preparedPath,
                             List<Cell> selectedPath) {

    public SolverSnapshot {
        preparedPath = List.copyOf(preparedPath);
        selectedPath = List.copyOf(selectedPath);
    }

    public int size() {
        return matrix.length;
    }

    public boolean isSelected(int row, int col) {
        return selectedInRow[row] == col;
    }

    public boolean isPrepared(int row, int col) {
        return preparedInRow[row] == col;
    }

    public boolean isOnPath(int row, int col) {
        Cell cell = new Cell(row, col);
        return preparedPath.contains(cell) || selectedPath.contains(cell);
    }
}
