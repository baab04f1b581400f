package com.assign.x.processors.matcher.hungarian;

import com.assign.x.dto.Cell;
import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.models.AlternatingPath;
import com.assign.x.models.MatchingState;
import com.assign.x.models.SolverState;

import static com.assign.x.utils.basic.Constant.NONE;

/**
 * Follows prepared and selected zeros from a prepared zero in a row without a selection, and flips the
 * resulting chain so the matching grows by one.
 */
public class AugmentingPathBuilder {

    /**
     * Walks column to selected zero, then row to prepared zero, until a column without a selected zero
     * is reached.
     *
     * @param row row of the starting prepared zero, must hold no selected zero
     * @param col column of the starting prepared zero
     */
    public AlternatingPath build(MatchingState matching, int size, int row, int col) {
        if (matching.hasSelectionInRow(row)) {
            throw new InternalInvariantException("Path start row " + row + " already holds a selected zero",
                    SolverState.BUILD_PATH);
        }
        AlternatingPath path = new AlternatingPath();
        path.addPrepared(row, col);

        int j = col;
        while (matching.hasSelectionInColumn(j)) {
            int i = matching.selectedRowOf(j);
            path.addSelected(i, j);

            int next = matching.preparedColumnOf(i);
            if (next == NONE) {
                throw new InternalInvariantException("Selected zero (" + i + ", " + j
                        + ") has no prepared zero on its row", SolverState.BUILD_PATH);
            }
            path.addPrepared(i, next);
            j = next;

            // each row appears once, a longer chain loops
            if (path.getPreparedCells().size() > size) {
                throw new InternalInvariantException("Alternating path does not terminate", SolverState.BUILD_PATH);
            }
        }
        return path;
    }

    /**
     * Deselects the selected cells of {@code path}, selects its prepared cells, and drops every
     * prepared mark.
     */
    public void flip(MatchingState matching, AlternatingPath path) {
        if (!path.isComplete()) {
            throw new InternalInvariantException("Cannot flip an incomplete alternating path",
                    SolverState.BUILD_PATH);
        }
        for (Cell cell : path.getSelectedCells()) {
            matching.deselect(cell.row(), cell.col());
        }
        for (Cell cell : path.getPreparedCells()) {
            matching.select(cell.row(), cell.col());
        }
        matching.clearPrepared();
    }
}
